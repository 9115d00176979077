package com.webspec.executor;

import java.util.List;

/** A parsed scenario: name and ordered steps. */
public record ScenarioDefinition(String name, List<StepDefinition> steps) {

    public ScenarioDefinition {
        steps = List.copyOf(steps);
    }
}
