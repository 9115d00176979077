package com.webspec.comparison;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * Signed deltas (current minus baseline) of the summary counters and the total
 * duration. The percentage is 0 when the baseline duration is 0.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record MetricsDifference(
        int passedScenariosDiff,
        int failedScenariosDiff,
        int skippedScenariosDiff,
        int passedStepsDiff,
        int failedStepsDiff,
        int skippedStepsDiff,
        long durationDiffMs,
        double durationChangePercent) {
}
