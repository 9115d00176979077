package com.webspec.profiling;

import com.webspec.model.ExecutionResult;
import com.webspec.model.ScenarioResult;
import com.webspec.model.StepResult;
import com.webspec.model.StepStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Breaks a feature run down by scenario and by step text to show where the
 * time went.
 *
 * ## Output
 *   - Per scenario: each step's share of the scenario time and the slowest step.
 *   - Slowest steps: up to {@value #TOP_STEPS} step texts ordered by total time
 *     across all scenarios. Ties keep first-seen order.
 *   - Bottlenecks: the top step, the slowest scenario and suggestions for slow
 *     navigation, waits, clicks and single-step outliers.
 */
public final class ExecutionProfiler {

    private static final Logger log = LoggerFactory.getLogger(ExecutionProfiler.class);

    static final int  TOP_STEPS          = 10;
    static final long OUTLIER_GAP_MS     = 1000;

    private ExecutionProfiler() {}

    public static ProfilingReport analyze(ExecutionResult result) {
        List<ScenarioMetrics>   scenarios = new ArrayList<>();
        Map<String, StepTiming> byText    = new LinkedHashMap<>();

        for (ScenarioResult scenario : result.getScenarios()) {
            scenarios.add(analyzeScenario(scenario));
            for (StepResult step : scenario.getSteps()) {
                byText.merge(step.getText(), StepTiming.single(step.getText(), step.getDurationMs()),
                    (existing, added) -> existing.plus(added.totalMs()));
            }
        }

        List<StepTiming> slowest = byText.values().stream()
            .sorted(Comparator.comparingLong(StepTiming::totalMs).reversed())
            .limit(TOP_STEPS)
            .toList();

        BottleneckAnalysis bottlenecks = analyzeBottlenecks(slowest, scenarios);
        log.debug("ExecutionProfiler: {} scenario(s), top bottleneck '{}'",
            scenarios.size(), bottlenecks.topBottleneck());
        return new ProfilingReport(result.getDurationMs(), scenarios, slowest, bottlenecks);
    }

    // ── Private helpers ───────────────────────────────────────────────────────

    private static ScenarioMetrics analyzeScenario(ScenarioResult scenario) {
        long duration = scenario.getDurationMs();
        List<StepMetrics> steps = new ArrayList<>();
        StepTiming slowest = null;

        for (StepResult step : scenario.getSteps()) {
            double share = duration > 0 ? step.getDurationMs() * 100.0 / duration : 0.0;
            steps.add(new StepMetrics(step.getText(), step.getDurationMs(), share, step.getStatus()));
            if (step.getDurationMs() > 0 && (slowest == null || step.getDurationMs() > slowest.totalMs())) {
                slowest = StepTiming.single(step.getText(), step.getDurationMs());
            }
        }
        return new ScenarioMetrics(scenario.getName(), duration, steps.size(),
            scenario.getStatus() == StepStatus.PASSED, steps, slowest);
    }

    private static BottleneckAnalysis analyzeBottlenecks(List<StepTiming> slowest, List<ScenarioMetrics> scenarios) {
        List<String> suggestions = new ArrayList<>();
        String topBottleneck = null;
        String slowScenario  = null;

        if (!slowest.isEmpty()) {
            StepTiming top = slowest.get(0);
            topBottleneck = top.text();
            String lower = top.text().toLowerCase(Locale.ROOT);
            if (lower.contains("navigate") || lower.contains("wait")) {
                suggestions.add(String.format(
                    "The '%s' step takes %dms - consider reducing wait times or optimizing navigation",
                    top.text(), top.totalMs()));
            }
            if (lower.contains("click")) {
                suggestions.add("Click operations are slow - verify element selectors and page responsiveness");
            }
        }

        ScenarioMetrics longest = scenarios.stream()
            .max(Comparator.comparingLong(ScenarioMetrics::durationMs))
            .orElse(null);
        if (longest != null) {
            slowScenario = longest.name();
            suggestions.add(String.format("Scenario '%s' is the slowest at %dms",
                longest.name(), longest.durationMs()));
        }

        if (slowest.size() > 1) {
            long gap = slowest.get(0).totalMs() - slowest.get(1).totalMs();
            if (gap > OUTLIER_GAP_MS) {
                suggestions.add(String.format(
                    "Step '%s' is %dms slower than the next slowest step - investigate this outlier",
                    topBottleneck, gap));
            }
        }
        return new BottleneckAnalysis(topBottleneck, suggestions, slowScenario);
    }
}
