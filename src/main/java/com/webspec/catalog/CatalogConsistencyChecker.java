package com.webspec.catalog;

import com.webspec.registry.PatternEntry;
import com.webspec.registry.StepPatternRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Verifies that every pattern the registry can match is discoverable in the
 * catalog: for each registry pattern there must be a catalog step with the
 * same id whose pattern or one of whose aliases is that exact string.
 */
public final class CatalogConsistencyChecker {

    private static final Logger log = LoggerFactory.getLogger(CatalogConsistencyChecker.class);

    private CatalogConsistencyChecker() {}

    /** A registry pattern with no catalog counterpart. */
    public record Inconsistency(String identifier, String pattern, String reason) {}

    public static List<Inconsistency> check(StepPatternRegistry registry, StepCatalog catalog) {
        List<Inconsistency> problems = new ArrayList<>();

        for (PatternEntry entry : registry.entries()) {
            Optional<StepInfo> info = catalog.findById(entry.getIdentifier());
            for (String pattern : entry.getAllPatterns()) {
                if (info.isEmpty()) {
                    problems.add(new Inconsistency(entry.getIdentifier(), pattern,
                        "no catalog step with this id"));
                } else if (!info.get().getAllPatterns().contains(pattern)) {
                    problems.add(new Inconsistency(entry.getIdentifier(), pattern,
                        "pattern is neither the catalog pattern nor an alias"));
                }
            }
        }

        if (problems.isEmpty()) {
            log.debug("CatalogConsistencyChecker: {} registry entries consistent with catalog", registry.size());
        } else {
            problems.forEach(p -> log.warn("CatalogConsistencyChecker: {} /{}/ - {}",
                p.identifier(), p.pattern(), p.reason()));
        }
        return problems;
    }
}
