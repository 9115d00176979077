package com.webspec.comparison;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;
import java.util.Optional;

/**
 * Everything {@link ComparisonEngine#compare} found between two runs.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ComparisonResult(
        ComparisonStatus status,
        ComparisonSummary summary,
        MetricsDifference metricsDiff,
        List<ScenarioChange> scenarioChanges,
        List<StepPerformanceChange> stepPerformanceChanges,
        List<RegressionItem> regressions,
        List<ImprovementItem> improvements) {

    public ComparisonResult {
        scenarioChanges        = List.copyOf(scenarioChanges);
        stepPerformanceChanges = List.copyOf(stepPerformanceChanges);
        regressions            = List.copyOf(regressions);
        improvements           = List.copyOf(improvements);
    }

    public boolean hasRegressions() {
        return !regressions.isEmpty();
    }

    public Optional<ScenarioChange> scenarioChange(String scenarioName) {
        return scenarioChanges.stream().filter(c -> c.scenarioName().equals(scenarioName)).findFirst();
    }

    public List<RegressionItem> regressionsForScenario(String scenarioName) {
        return regressions.stream().filter(r -> scenarioName.equals(r.scenarioName())).toList();
    }
}
