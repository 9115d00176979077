package com.webspec.alerts;

import com.webspec.model.ExecutionResult;
import com.webspec.model.ScenarioResult;
import com.webspec.model.StepResult;
import com.webspec.model.StepStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;

/**
 * Accumulates scenario and step timings for one session and evaluates alert
 * thresholds against them.
 *
 * ## Metrics
 *   - Scenario and step durations are means over everything recorded; zero when
 *     nothing has been recorded.
 *   - Failure rate is failed scenarios over recorded scenarios, in percent.
 *   - Total duration and the per-second rates use the time since construction.
 *   - Memory usage is the JVM heap currently in use, in megabytes.
 *
 * Recording and evaluation only read the results handed in. Methods are
 * synchronized so batch workers can share one monitor.
 */
public class PerformanceMonitor {

    private static final Logger log = LoggerFactory.getLogger(PerformanceMonitor.class);

    private final Clock clock;
    private final long  startNanos;

    private final List<Long>             scenarioDurations = new ArrayList<>();
    private final List<Long>             stepDurations     = new ArrayList<>();
    private final Map<String, Double>    customMetrics     = new HashMap<>();
    private final List<PerformanceAlert> alerts            = new ArrayList<>();

    private int    failedScenarios;
    private int    skippedScenarios;
    private String currentFeature;
    private String slowestScenario;
    private long   slowestScenarioMs = -1;
    private String slowestStep;
    private long   slowestStepMs     = -1;

    public PerformanceMonitor() {
        this(Clock.systemUTC());
    }

    public PerformanceMonitor(Clock clock) {
        this.clock      = clock;
        this.startNanos = System.nanoTime();
    }

    // ── Recording ─────────────────────────────────────────────────────────────

    /** Records the scenario's duration and outcome, and each of its steps. */
    public synchronized void recordScenario(ScenarioResult scenario) {
        scenarioDurations.add(scenario.getDurationMs());
        if (scenario.getStatus() == StepStatus.FAILED) {
            failedScenarios++;
        } else if (scenario.getStatus() == StepStatus.SKIPPED) {
            skippedScenarios++;
        }
        if (scenario.getDurationMs() > slowestScenarioMs) {
            slowestScenarioMs = scenario.getDurationMs();
            slowestScenario   = scenario.getName();
        }
        for (StepResult step : scenario.getSteps()) {
            recordStep(step);
        }
    }

    public synchronized void recordStep(StepResult step) {
        stepDurations.add(step.getDurationMs());
        if (step.getDurationMs() > slowestStepMs) {
            slowestStepMs = step.getDurationMs();
            slowestStep   = step.getText();
        }
    }

    /** Records every scenario of a feature run and remembers the feature name for alerts. */
    public synchronized void recordExecution(ExecutionResult result) {
        if (result.getFeature() != null) {
            currentFeature = result.getFeature().getName();
        }
        for (ScenarioResult scenario : result.getScenarios()) {
            recordScenario(scenario);
        }
        log.debug("PerformanceMonitor: recorded '{}' ({} scenario(s))",
            currentFeature, result.getScenarios().size());
    }

    public synchronized void setMetric(String key, double value) {
        customMetrics.put(key, value);
    }

    // ── Metric values ─────────────────────────────────────────────────────────

    public double getMetricValue(AlertMetric metric) {
        return getMetricValue(metric, null);
    }

    /** Current value of {@code metric}; {@code customKey} is only read for {@link AlertMetric#CUSTOM}. */
    public synchronized double getMetricValue(AlertMetric metric, String customKey) {
        return switch (metric) {
            case SCENARIO_DURATION_MS -> mean(scenarioDurations);
            case STEP_DURATION_MS     -> mean(stepDurations);
            case FAILURE_RATE_PERCENT -> failureRate();
            case TOTAL_DURATION_MS    -> elapsedMs();
            case SCENARIOS_PER_SECOND -> perSecond(scenarioDurations.size());
            case STEPS_PER_SECOND     -> perSecond(stepDurations.size());
            case MEMORY_USAGE_MB      -> usedHeapMb();
            case CUSTOM               -> customKey == null ? 0.0 : customMetrics.getOrDefault(customKey, 0.0);
        };
    }

    // ── Evaluation ────────────────────────────────────────────────────────────

    /**
     * Checks every threshold of {@code config} against the current metrics and
     * returns the alerts raised by this call. A disabled config raises nothing.
     * Raised alerts are also kept for {@link #getAlerts()}.
     */
    public synchronized List<PerformanceAlert> evaluateThresholds(AlertConfig config) {
        if (!config.isEnabled()) {
            log.debug("PerformanceMonitor: config '{}' is disabled", config.getName());
            return List.of();
        }
        List<PerformanceAlert> raised = new ArrayList<>();
        for (AlertThreshold threshold : config.getThresholds()) {
            if (threshold.getMetric() == null || threshold.getOperator() == null) {
                log.warn("PerformanceMonitor: threshold '{}' has no metric or operator", threshold.getName());
                continue;
            }
            double value = getMetricValue(threshold.getMetric(), threshold.getCustomKey());
            if (threshold.getOperator().test(value, threshold.getValue())) {
                PerformanceAlert alert = toAlert(threshold, value);
                raised.add(alert);
                log.info("PerformanceMonitor: {}", alert);
            }
        }
        alerts.addAll(raised);
        return raised;
    }

    public synchronized List<PerformanceAlert> getAlerts() {
        return Collections.unmodifiableList(new ArrayList<>(alerts));
    }

    public synchronized PerformanceSummary getSummary() {
        int scenarios = scenarioDurations.size();
        return new PerformanceSummary(
            elapsedMs(),
            scenarios,
            scenarios - failedScenarios - skippedScenarios,
            failedScenarios,
            skippedScenarios,
            stepDurations.size(),
            mean(scenarioDurations),
            mean(stepDurations),
            Math.max(0, slowestScenarioMs),
            Math.max(0, slowestStepMs),
            failureRate(),
            alerts.size());
    }

    // ── Private helpers ───────────────────────────────────────────────────────

    private PerformanceAlert toAlert(AlertThreshold threshold, double value) {
        AlertMetric metric = threshold.getMetric();
        String scenario = metric == AlertMetric.SCENARIO_DURATION_MS ? slowestScenario : null;
        String step     = metric == AlertMetric.STEP_DURATION_MS ? slowestStep : null;
        String message  = threshold.getMessage() != null
            ? threshold.getMessage()
            : threshold.metricLabel() + " " + threshold.getOperator().symbol() + " " + threshold.getValue();
        return new PerformanceAlert(clock.instant(), threshold.getSeverity(), threshold.getName(), message,
            threshold.metricLabel(), value, threshold.getValue(), currentFeature, scenario, step);
    }

    private double failureRate() {
        return scenarioDurations.isEmpty() ? 0.0 : failedScenarios * 100.0 / scenarioDurations.size();
    }

    private double perSecond(int count) {
        double seconds = elapsedMs() / 1000.0;
        return seconds > 0 ? count / seconds : 0.0;
    }

    private long elapsedMs() {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }

    private static double mean(List<Long> values) {
        if (values.isEmpty()) return 0.0;
        long total = 0;
        for (long v : values) total += v;
        return (double) total / values.size();
    }

    private static double usedHeapMb() {
        Runtime rt = Runtime.getRuntime();
        return (rt.totalMemory() - rt.freeMemory()) / (1024.0 * 1024.0);
    }
}
