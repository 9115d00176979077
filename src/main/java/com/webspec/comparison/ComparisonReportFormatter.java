package com.webspec.comparison;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.webspec.model.StepStatus;
import com.webspec.util.JsonSupport;

import java.io.UncheckedIOException;
import java.util.Locale;

/**
 * Renders a {@link ComparisonResult} as a human-readable report, JSON or YAML.
 */
public final class ComparisonReportFormatter {

    private ComparisonReportFormatter() {}

    public static String format(ComparisonResult result, String format) {
        try {
            return switch (format == null ? "text" : format.toLowerCase(Locale.ROOT)) {
                case "json"        -> JsonSupport.json().writeValueAsString(result);
                case "yaml", "yml" -> JsonSupport.yaml().writeValueAsString(result);
                default            -> toText(result);
            };
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Could not serialize comparison result", e);
        }
    }

    public static String toText(ComparisonResult result) {
        StringBuilder out = new StringBuilder();
        out.append("=== Test Result Comparison Report ===\n\n");
        out.append("Status: ").append(result.status().wireName().toUpperCase(Locale.ROOT)).append("\n\n");

        ComparisonSummary s = result.summary();
        out.append("--- Summary ---\n");
        line(out, "Baseline: %s", s.baselineTimestamp());
        line(out, "Current:  %s", s.currentTimestamp());
        line(out, "Scenarios Changed: %d", s.scenarioChangesCount());
        line(out, "Step Performance Changes: %d", s.stepChangesCount());
        line(out, "Regressions Detected: %d", s.regressionCount());
        line(out, "Improvements Detected: %d", s.improvementCount());
        out.append('\n');

        MetricsDifference m = result.metricsDiff();
        out.append("--- Metrics Change ---\n");
        line(out, "Passed Scenarios:  %+d", m.passedScenariosDiff());
        line(out, "Failed Scenarios:  %+d", m.failedScenariosDiff());
        line(out, "Skipped Scenarios: %+d", m.skippedScenariosDiff());
        line(out, "Passed Steps:      %+d", m.passedStepsDiff());
        line(out, "Failed Steps:      %+d", m.failedStepsDiff());
        line(out, "Skipped Steps:     %+d", m.skippedStepsDiff());
        line(out, "Duration:          %+dms (%.1f%%)", m.durationDiffMs(), m.durationChangePercent());
        out.append('\n');

        if (!result.regressions().isEmpty()) {
            out.append("--- Regressions ---\n");
            int n = 1;
            for (RegressionItem r : result.regressions()) {
                line(out, "  %d. %s", n++, r.description());
                line(out, "     Severity: %s", r.severity().wireName());
                line(out, "     Impact: %.1f %s", r.impactValue(), r.impactUnit());
                if (r.scenarioName() != null) line(out, "     Scenario: %s", r.scenarioName());
                if (r.stepText() != null)     line(out, "     Step: %s", r.stepText());
                out.append('\n');
            }
        }

        if (!result.improvements().isEmpty()) {
            out.append("--- Improvements ---\n");
            int n = 1;
            for (ImprovementItem i : result.improvements()) {
                line(out, "  %d. %s", n++, i.description());
                line(out, "     Value: %.1f %s", i.improvementValue(), i.improvementUnit());
                if (i.scenarioName() != null) line(out, "     Scenario: %s", i.scenarioName());
                if (i.stepText() != null)     line(out, "     Step: %s", i.stepText());
                out.append('\n');
            }
        }

        if (!result.scenarioChanges().isEmpty()) {
            out.append("--- Scenario Changes ---\n");
            for (ScenarioChange c : result.scenarioChanges()) {
                line(out, "  %s: %s → %s", c.scenarioName(),
                    statusLabel(c.previousStatus(), "new"), statusLabel(c.currentStatus(), "removed"));
                line(out, "     Duration: %dms → %dms", c.previousDurationMs(), c.currentDurationMs());
                line(out, "     Change Type: %s", c.changeType().wireName());
                out.append('\n');
            }
        }

        if (!result.stepPerformanceChanges().isEmpty()) {
            out.append("--- Step Performance Changes ---\n");
            for (StepPerformanceChange c : result.stepPerformanceChanges()) {
                line(out, "  %s %s %.1f%% (%dx occurrence)",
                    c.regression() ? "↑" : "↓", c.stepText(), Math.abs(c.changePercent()), c.occurrenceCount());
                line(out, "     Baseline: %.1fms → Current: %.1fms", c.baselineAvgMs(), c.currentAvgMs());
                out.append('\n');
            }
        }
        return out.toString();
    }

    private static String statusLabel(StepStatus status, String missing) {
        return status != null ? status.wireName() : missing;
    }

    private static void line(StringBuilder out, String format, Object... args) {
        out.append(String.format(Locale.ROOT, format, args)).append('\n');
    }
}
