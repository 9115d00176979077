package com.webspec.catalog;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.TreeSet;

/**
 * In-memory collection of {@link StepInfo}s. Categories are kept sorted and
 * unique as steps are added.
 */
public class StepCatalog {

    private final List<StepInfo>  steps      = new ArrayList<>();
    private final TreeSet<String> categories = new TreeSet<>();

    public StepCatalog() {}

    public StepCatalog(List<StepInfo> steps) {
        steps.forEach(this::addStep);
    }

    public void addStep(StepInfo step) {
        if (step.getCategory() != null) categories.add(step.getCategory());
        steps.add(step);
    }

    public Optional<StepInfo> findById(String id) {
        return steps.stream().filter(s -> s.getId().equals(id)).findFirst();
    }

    /** Steps of a category; the category name is compared case-insensitively. */
    public List<StepInfo> findByCategory(String category) {
        String wanted = category.toLowerCase(Locale.ROOT);
        return steps.stream()
            .filter(s -> s.getCategory() != null && s.getCategory().toLowerCase(Locale.ROOT).equals(wanted))
            .toList();
    }

    public List<StepInfo> allSteps()    { return Collections.unmodifiableList(steps); }
    public List<String>   categories()  { return List.copyOf(categories); }
    public int            totalSteps()  { return steps.size(); }
}
