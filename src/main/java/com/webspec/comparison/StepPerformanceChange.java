package com.webspec.comparison;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * Mean duration of all steps sharing the same text, baseline vs current.
 * {@code occurrenceCount} is the number of occurrences in the current run.
 */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record StepPerformanceChange(
        String stepText,
        double baselineAvgMs,
        double currentAvgMs,
        double changePercent,
        boolean regression,
        int occurrenceCount) {
}
