package com.webspec.comparison;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ComparisonSummary(
        Instant baselineTimestamp,
        Instant currentTimestamp,
        int scenarioChangesCount,
        int stepChangesCount,
        int regressionCount,
        int improvementCount) {
}
