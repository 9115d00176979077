package com.webspec.alerts;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.Locale;

/** Snapshot of everything a {@link PerformanceMonitor} has recorded so far. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record PerformanceSummary(
        long totalDurationMs,
        int scenarioCount,
        int scenariosPassed,
        int scenariosFailed,
        int scenariosSkipped,
        int stepCount,
        double avgScenarioDurationMs,
        double avgStepDurationMs,
        long maxScenarioDurationMs,
        long maxStepDurationMs,
        double failureRatePercent,
        int alertsGenerated) {

    @Override
    public String toString() {
        return String.format(Locale.ROOT,
            "PerformanceSummary{scenarios=%d (passed=%d, failed=%d, skipped=%d), steps=%d, "
                + "avgScenario=%.1fms, avgStep=%.1fms, failureRate=%.1f%%, alerts=%d}",
            scenarioCount, scenariosPassed, scenariosFailed, scenariosSkipped, stepCount,
            avgScenarioDurationMs, avgStepDurationMs, failureRatePercent, alertsGenerated);
    }
}
