package com.webspec.registry;

/**
 * An exact pattern string registered more than once. Because matching is
 * first-wins, the later registration can never be reached.
 */
public record DuplicatePatternWarning(String pattern, String firstIdentifier, String shadowedIdentifier) {

    public String describe() {
        return String.format("Pattern /%s/ is registered for '%s' and again for '%s'; the second is unreachable",
            pattern, firstIdentifier, shadowedIdentifier);
    }
}
