package com.webspec.registry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * One registry row: a primary pattern plus optional aliases, all mapping to the
 * same identifier. Compiled on construction.
 */
public final class PatternEntry {

    private final String        identifier;
    private final Pattern       pattern;
    private final List<Pattern> aliases;

    PatternEntry(String identifier, String pattern, List<String> aliases) {
        this.identifier = Objects.requireNonNull(identifier, "identifier");
        this.pattern    = compile(pattern, identifier);
        List<Pattern> compiled = new ArrayList<>();
        for (String alias : aliases) {
            compiled.add(compile(alias, identifier));
        }
        this.aliases = Collections.unmodifiableList(compiled);
    }

    /**
     * Searches the text with the primary pattern, then each alias in order.
     * The search is unanchored: a pattern may match anywhere in the text.
     */
    Optional<StepMatch> match(String text) {
        Optional<StepMatch> primary = tryMatch(pattern, text);
        if (primary.isPresent()) return primary;
        for (Pattern alias : aliases) {
            Optional<StepMatch> m = tryMatch(alias, text);
            if (m.isPresent()) return m;
        }
        return Optional.empty();
    }

    private Optional<StepMatch> tryMatch(Pattern p, String text) {
        Matcher matcher = p.matcher(text);
        if (!matcher.find()) return Optional.empty();

        List<String> params = new ArrayList<>();
        for (int g = 1; g <= matcher.groupCount(); g++) {
            String value = matcher.group(g);
            if (value != null) params.add(value);
        }
        return Optional.of(new StepMatch(identifier, params, p.pattern()));
    }

    private static Pattern compile(String source, String identifier) {
        if (source == null) {
            throw new PatternCompileException(null, identifier, null);
        }
        try {
            return Pattern.compile(source);
        } catch (PatternSyntaxException e) {
            throw new PatternCompileException(source, identifier, e);
        }
    }

    // ── Getters ───────────────────────────────────────────────────────────────

    public String getIdentifier() { return identifier; }
    public String getPattern()    { return pattern.pattern(); }

    public List<String> getAliases() {
        return aliases.stream().map(Pattern::pattern).toList();
    }

    /** The primary pattern followed by every alias, in match order. */
    public List<String> getAllPatterns() {
        List<String> all = new ArrayList<>();
        all.add(getPattern());
        all.addAll(getAliases());
        return all;
    }

    @Override
    public String toString() {
        return String.format("PatternEntry{%s -> /%s/, aliases=%d}", identifier, getPattern(), aliases.size());
    }
}
