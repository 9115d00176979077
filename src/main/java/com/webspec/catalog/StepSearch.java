package com.webspec.catalog;

import java.util.List;
import java.util.Locale;

/**
 * Free-text search over catalog steps.
 */
public final class StepSearch {

    private StepSearch() {}

    /**
     * Returns the steps whose id, description, category, any alias or any
     * example contains {@code query}, ignoring case. A blank query matches all.
     */
    public static List<StepInfo> search(List<StepInfo> steps, String query) {
        if (query == null || query.isBlank()) return List.copyOf(steps);
        String q = query.toLowerCase(Locale.ROOT);
        return steps.stream().filter(step -> matches(step, q)).toList();
    }

    public static List<StepInfo> filterByCategory(List<StepInfo> steps, String category) {
        return steps.stream()
            .filter(s -> s.getCategory() != null && s.getCategory().equalsIgnoreCase(category))
            .toList();
    }

    private static boolean matches(StepInfo step, String q) {
        return contains(step.getId(), q)
            || contains(step.getDescription(), q)
            || contains(step.getCategory(), q)
            || step.getAliases().stream().anyMatch(a -> contains(a, q))
            || step.getExamples().stream().anyMatch(e -> contains(e, q));
    }

    private static boolean contains(String field, String q) {
        return field != null && field.toLowerCase(Locale.ROOT).contains(q);
    }
}
