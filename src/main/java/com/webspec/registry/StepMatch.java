package com.webspec.registry;

import java.util.List;

/**
 * A successful match of step text against a registered pattern.
 *
 * @param identifier     the handler identifier the pattern maps to
 * @param parameters     captured groups, left to right; groups that did not take
 *                       part in the match are omitted
 * @param matchedPattern the pattern source that matched (primary or alias)
 */
public record StepMatch(String identifier, List<String> parameters, String matchedPattern) {

    public StepMatch {
        parameters = List.copyOf(parameters);
    }

    /** Returns the parameter at {@code index}, or {@code fallback} if there are fewer. */
    public String parameter(int index, String fallback) {
        return index < parameters.size() ? parameters.get(index) : fallback;
    }
}
