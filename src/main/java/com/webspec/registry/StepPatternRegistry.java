package com.webspec.registry;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Ordered table mapping step-text patterns to handler identifiers.
 *
 * <p>Matching walks the entries in registration order and returns the first
 * entry whose pattern is found anywhere in the step text. Order therefore
 * decides which identifier wins when two patterns could both match, and an
 * exact duplicate registered later is unreachable; {@link #validate()} reports
 * such duplicates.
 *
 * <p>Patterns are compiled on registration. An invalid pattern fails the build of
 * the registry with a {@link PatternCompileException}.
 */
public class StepPatternRegistry {

    private static final Logger log = LoggerFactory.getLogger(StepPatternRegistry.class);

    private final List<PatternEntry> entries = new ArrayList<>();

    // ── Registration ──────────────────────────────────────────────────────────

    /**
     * Appends a pattern for the given identifier.
     *
     * @throws PatternCompileException if the pattern is not a valid regular expression
     */
    public StepPatternRegistry register(String pattern, String identifier) {
        return register(identifier, pattern, List.of());
    }

    /**
     * Appends a primary pattern plus aliases that all map to {@code identifier}.
     *
     * @throws PatternCompileException if any of the patterns is invalid
     */
    public StepPatternRegistry register(String identifier, String pattern, List<String> aliases) {
        PatternEntry entry = new PatternEntry(identifier, pattern, aliases);
        entries.add(entry);
        log.debug("StepPatternRegistry: registered /{}/ -> {} ({} alias(es))",
            pattern, identifier, aliases.size());
        return this;
    }

    // ── Lookup ────────────────────────────────────────────────────────────────

    /**
     * Returns the first match for the step text, or empty when no pattern matches.
     */
    public Optional<StepMatch> match(String text) {
        if (text == null) return Optional.empty();
        for (PatternEntry entry : entries) {
            Optional<StepMatch> m = entry.match(text);
            if (m.isPresent()) return m;
        }
        return Optional.empty();
    }

    /**
     * Reports every exact pattern string registered under more than one
     * identifier (as primary or alias). The earliest registration wins matching.
     */
    public CatalogValidation validate() {
        Map<String, String> firstOwner = new HashMap<>();
        List<DuplicatePatternWarning> warnings = new ArrayList<>();

        for (PatternEntry entry : entries) {
            for (String source : entry.getAllPatterns()) {
                String owner = firstOwner.putIfAbsent(source, entry.getIdentifier());
                if (owner != null && !owner.equals(entry.getIdentifier())) {
                    warnings.add(new DuplicatePatternWarning(source, owner, entry.getIdentifier()));
                }
            }
        }

        if (!warnings.isEmpty()) {
            warnings.forEach(w -> log.warn("StepPatternRegistry: {}", w.describe()));
        }
        return CatalogValidation.of(warnings);
    }

    public List<PatternEntry> entries() {
        return Collections.unmodifiableList(entries);
    }

    /** Distinct identifiers in first-registration order. */
    public Set<String> identifiers() {
        Set<String> ids = new LinkedHashSet<>();
        entries.forEach(e -> ids.add(e.getIdentifier()));
        return Collections.unmodifiableSet(ids);
    }

    public int size() {
        return entries.size();
    }
}
