package com.webspec.executor;

import java.util.List;

/**
 * A parsed feature as produced by a Gherkin parser. {@code file} and
 * {@code description} may be null.
 */
public record FeatureDefinition(String name, String file, String description, List<ScenarioDefinition> scenarios) {

    public FeatureDefinition {
        scenarios = List.copyOf(scenarios);
    }

    public FeatureDefinition(String name, List<ScenarioDefinition> scenarios) {
        this(name, null, null, scenarios);
    }
}
