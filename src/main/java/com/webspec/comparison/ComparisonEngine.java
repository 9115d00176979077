package com.webspec.comparison;

import com.webspec.model.ExecutionResult;
import com.webspec.model.ExecutionSummary;
import com.webspec.model.ScenarioResult;
import com.webspec.model.StepResult;
import com.webspec.model.StepStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Compares a baseline run with a current run of the same feature.
 *
 * ## Rules
 *
 *   Scenarios are matched by name (a later scenario with a duplicate name
 *   replaces the earlier one on the same side).
 *   <ul>
 *     <li>passed → failed is a {@link Severity#CRITICAL} regression</li>
 *     <li>a duration increase above 10% of the baseline is a regression,
 *         {@link Severity#HIGH} above 50%, else {@link Severity#MEDIUM}</li>
 *     <li>any duration decrease is an improvement</li>
 *   </ul>
 *   Steps are grouped by exact text and compared by mean duration. Changes above
 *   5% are listed; above 10% they also become a regression or improvement.
 *   A zero baseline duration never produces a percentage-based finding.
 *
 * The overall status is REGRESSION when any regression exists, else IMPROVEMENT
 * when any improvement exists, else UNCHANGED. The engine is pure: it reads
 * both results and modifies neither.
 */
public class ComparisonEngine {

    private static final Logger log = LoggerFactory.getLogger(ComparisonEngine.class);

    static final double REGRESSION_THRESHOLD_PERCENT  = 10.0;
    static final double HIGH_SEVERITY_PERCENT         = 50.0;
    static final double STEP_CHANGE_THRESHOLD_PERCENT = 5.0;

    // ── Primary API ───────────────────────────────────────────────────────────

    public ComparisonResult compare(ExecutionResult baseline, ExecutionResult current) {
        List<ScenarioChange>  scenarioChanges = new ArrayList<>();
        List<RegressionItem>  regressions     = new ArrayList<>();
        List<ImprovementItem> improvements    = new ArrayList<>();

        MetricsDifference metrics = metricsDiff(baseline, current);

        Map<String, ScenarioResult> baselineByName = byName(baseline);
        Map<String, ScenarioResult> currentByName  = byName(current);

        for (Map.Entry<String, ScenarioResult> entry : baselineByName.entrySet()) {
            String         name   = entry.getKey();
            ScenarioResult before = entry.getValue();
            ScenarioResult after  = currentByName.get(name);

            if (after == null) {
                scenarioChanges.add(new ScenarioChange(name, before.getStatus(), null,
                    before.getDurationMs(), 0, ChangeType.REMOVED));
                continue;
            }

            scenarioChanges.add(compareScenario(name, before, after));
            findScenarioFindings(name, before, after, regressions, improvements);
        }

        for (Map.Entry<String, ScenarioResult> entry : currentByName.entrySet()) {
            if (!baselineByName.containsKey(entry.getKey())) {
                ScenarioResult after = entry.getValue();
                scenarioChanges.add(new ScenarioChange(entry.getKey(), null, after.getStatus(),
                    0, after.getDurationMs(), ChangeType.NEW));
            }
        }

        List<StepPerformanceChange> stepChanges = analyzeSteps(baseline, current, regressions, improvements);

        ComparisonStatus status = !regressions.isEmpty()  ? ComparisonStatus.REGRESSION
                                : !improvements.isEmpty() ? ComparisonStatus.IMPROVEMENT
                                : ComparisonStatus.UNCHANGED;

        ComparisonSummary summary = new ComparisonSummary(
            baseline.getTimestamp(), current.getTimestamp(),
            scenarioChanges.size(), stepChanges.size(), regressions.size(), improvements.size());

        log.info("ComparisonEngine: {} - {} scenario change(s), {} step change(s), {} regression(s), {} improvement(s)",
            status.wireName(), scenarioChanges.size(), stepChanges.size(), regressions.size(), improvements.size());

        return new ComparisonResult(status, summary, metrics, scenarioChanges, stepChanges, regressions, improvements);
    }

    // ── Metrics ───────────────────────────────────────────────────────────────

    private static MetricsDifference metricsDiff(ExecutionResult baseline, ExecutionResult current) {
        ExecutionSummary b = baseline.getSummary();
        ExecutionSummary c = current.getSummary();
        long durationDiff = current.getDurationMs() - baseline.getDurationMs();

        return new MetricsDifference(
            c.getPassedScenarios()  - b.getPassedScenarios(),
            c.getFailedScenarios()  - b.getFailedScenarios(),
            c.getSkippedScenarios() - b.getSkippedScenarios(),
            c.getPassedSteps()      - b.getPassedSteps(),
            c.getFailedSteps()      - b.getFailedSteps(),
            c.getSkippedSteps()     - b.getSkippedSteps(),
            durationDiff,
            percentOf(durationDiff, baseline.getDurationMs()));
    }

    // ── Scenarios ─────────────────────────────────────────────────────────────

    private static Map<String, ScenarioResult> byName(ExecutionResult result) {
        Map<String, ScenarioResult> map = new LinkedHashMap<>();
        for (ScenarioResult s : result.getScenarios()) {
            map.put(s.getName(), s);
        }
        return map;
    }

    private static ScenarioChange compareScenario(String name, ScenarioResult before, ScenarioResult after) {
        ChangeType type;
        if (before.getStatus() != after.getStatus())              type = ChangeType.STATUS_CHANGED;
        else if (after.getDurationMs() < before.getDurationMs()) type = ChangeType.DURATION_IMPROVED;
        else if (after.getDurationMs() > before.getDurationMs()) type = ChangeType.DURATION_REGRESSED;
        else                                                      type = ChangeType.UNCHANGED;

        return new ScenarioChange(name, before.getStatus(), after.getStatus(),
            before.getDurationMs(), after.getDurationMs(), type);
    }

    private static void findScenarioFindings(String name, ScenarioResult before, ScenarioResult after,
                                             List<RegressionItem> regressions,
                                             List<ImprovementItem> improvements) {
        if (before.getStatus() == StepStatus.PASSED && after.getStatus() == StepStatus.FAILED) {
            regressions.add(new RegressionItem(
                "Scenario '" + name + "' changed from passed to failed",
                Severity.CRITICAL, name, null, 1.0, "count"));
        }

        long baseMs = before.getDurationMs();
        long curMs  = after.getDurationMs();

        if (curMs < baseMs) {
            long saved = baseMs - curMs;
            improvements.add(new ImprovementItem(
                String.format(Locale.ROOT, "Scenario '%s' duration improved by %.1f%%", name, percentOf(saved, baseMs)),
                name, null, saved, "ms"));
        } else if (curMs > baseMs && baseMs > 0) {
            long   added   = curMs - baseMs;
            double percent = percentOf(added, baseMs);
            if (percent > REGRESSION_THRESHOLD_PERCENT) {
                regressions.add(new RegressionItem(
                    String.format(Locale.ROOT, "Scenario '%s' duration regressed by %.1f%%", name, percent),
                    Severity.forDurationIncrease(percent), name, null, added, "ms"));
            }
        }
    }

    // ── Steps ─────────────────────────────────────────────────────────────────

    private static List<StepPerformanceChange> analyzeSteps(ExecutionResult baseline, ExecutionResult current,
                                                            List<RegressionItem> regressions,
                                                            List<ImprovementItem> improvements) {
        Map<String, List<Long>> baselineTimes = stepTimes(baseline);
        Map<String, List<Long>> currentTimes  = stepTimes(current);
        List<StepPerformanceChange> changes   = new ArrayList<>();

        for (Map.Entry<String, List<Long>> entry : baselineTimes.entrySet()) {
            String     text  = entry.getKey();
            List<Long> after = currentTimes.get(text);
            if (after == null) continue;

            double baseAvg = mean(entry.getValue());
            double curAvg  = mean(after);
            if (baseAvg == 0) continue;

            double  percent      = (curAvg - baseAvg) / baseAvg * 100.0;
            boolean isRegression = curAvg > baseAvg;
            if (Math.abs(percent) <= STEP_CHANGE_THRESHOLD_PERCENT) continue;

            changes.add(new StepPerformanceChange(text, baseAvg, curAvg, percent, isRegression, after.size()));

            if (isRegression && percent > REGRESSION_THRESHOLD_PERCENT) {
                regressions.add(new RegressionItem(
                    String.format(Locale.ROOT, "Step '%s' duration regressed by %.1f%%", text, percent),
                    Severity.forDurationIncrease(percent), null, text, curAvg - baseAvg, "ms"));
            } else if (!isRegression && Math.abs(percent) > REGRESSION_THRESHOLD_PERCENT) {
                improvements.add(new ImprovementItem(
                    String.format(Locale.ROOT, "Step '%s' duration improved by %.1f%%", text, Math.abs(percent)),
                    null, text, baseAvg - curAvg, "ms"));
            }
        }
        return changes;
    }

    private static Map<String, List<Long>> stepTimes(ExecutionResult result) {
        Map<String, List<Long>> times = new LinkedHashMap<>();
        for (ScenarioResult scenario : result.getScenarios()) {
            for (StepResult step : scenario.getSteps()) {
                times.computeIfAbsent(step.getText(), k -> new ArrayList<>()).add(step.getDurationMs());
            }
        }
        return times;
    }

    private static double mean(List<Long> values) {
        return values.stream().mapToLong(Long::longValue).average().orElse(0);
    }

    private static double percentOf(long delta, long base) {
        return base > 0 ? (double) delta / base * 100.0 : 0.0;
    }
}
