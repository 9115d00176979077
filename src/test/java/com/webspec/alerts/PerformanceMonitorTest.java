package com.webspec.alerts;

import com.webspec.model.ScenarioResult;
import org.testng.annotations.Test;

import java.time.Clock;
import java.time.ZoneOffset;
import java.util.List;

import static com.webspec.support.ResultFixtures.T0;
import static com.webspec.support.ResultFixtures.failed;
import static com.webspec.support.ResultFixtures.feature;
import static com.webspec.support.ResultFixtures.passed;
import static com.webspec.support.ResultFixtures.step;
import static com.webspec.support.ResultFixtures.withSteps;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

public class PerformanceMonitorTest {

    private static PerformanceMonitor newMonitor() {
        return new PerformanceMonitor(Clock.fixed(T0, ZoneOffset.UTC));
    }

    /** 45 seconds spread over five 9 second steps. */
    private static ScenarioResult slowCheckout() {
        return withSteps("Checkout",
            step("I open \"/cart\"", 9_000), step("I click \"#checkout\"", 9_000),
            step("I type \"4111\" into \"#card\"", 9_000), step("I click \"#pay\"", 9_000),
            step("I wait 9 seconds", 9_000));
    }

    // ════════════════════════════════════════════════════════════════════════
    // Default ruleset
    // ════════════════════════════════════════════════════════════════════════

    @Test
    public void defaults_scenarioBetweenWarningAndCriticalRaisesOneWarning() {
        PerformanceMonitor monitor = newMonitor();
        monitor.recordScenario(slowCheckout());

        List<PerformanceAlert> alerts = monitor.evaluateThresholds(AlertConfig.defaults());

        assertThat(alerts).singleElement().satisfies(a -> {
            assertThat(a.thresholdName()).isEqualTo("slow_scenario");
            assertThat(a.severity()).isEqualTo(AlertSeverity.WARNING);
            assertThat(a.value()).isEqualTo(45_000.0);
            assertThat(a.thresholdValue()).isEqualTo(30_000.0);
            assertThat(a.scenario()).isEqualTo("Checkout");
            assertThat(a.timestamp()).isEqualTo(T0);
        });
        assertThat(alerts).noneMatch(a -> a.severity() == AlertSeverity.CRITICAL);
    }

    @Test
    public void defaults_fastRunRaisesNothing() {
        PerformanceMonitor monitor = newMonitor();
        monitor.recordExecution(feature("login", passed("Valid login", 1_200), passed("Logout", 300)));

        assertThat(monitor.evaluateThresholds(AlertConfig.defaults())).isEmpty();
    }

    @Test
    public void defaults_highFailureRateAndSlowStepCarryFeatureAndStep() {
        PerformanceMonitor monitor = newMonitor();
        monitor.recordExecution(feature("search", passed("Find", 10_000), failed("Filter", 12_000)));

        List<PerformanceAlert> alerts = monitor.evaluateThresholds(AlertConfig.defaults());

        assertThat(alerts).extracting(PerformanceAlert::thresholdName)
            .containsExactly("slow_step", "high_failure_rate");
        assertThat(alerts.get(0).step()).isEqualTo("I open the page for Filter");
        assertThat(alerts.get(1).value()).isEqualTo(50.0);
        assertThat(alerts).allSatisfy(a -> assertThat(a.feature()).isEqualTo("search"));
    }

    @Test
    public void disabledConfigRaisesNothing() {
        PerformanceMonitor monitor = newMonitor();
        monitor.recordScenario(slowCheckout());
        AlertConfig config = AlertConfig.defaults();
        config.setEnabled(false);

        assertThat(monitor.evaluateThresholds(config)).isEmpty();
        assertThat(monitor.getAlerts()).isEmpty();
    }

    // ════════════════════════════════════════════════════════════════════════
    // Metrics and operators
    // ════════════════════════════════════════════════════════════════════════

    @Test
    public void metrics_areZeroBeforeAnythingIsRecorded() {
        PerformanceMonitor monitor = newMonitor();

        assertThat(monitor.getMetricValue(AlertMetric.SCENARIO_DURATION_MS)).isZero();
        assertThat(monitor.getMetricValue(AlertMetric.STEP_DURATION_MS)).isZero();
        assertThat(monitor.getMetricValue(AlertMetric.FAILURE_RATE_PERCENT)).isZero();
        assertThat(monitor.getMetricValue(AlertMetric.CUSTOM, "unset")).isZero();
    }

    @Test
    public void customMetric_isComparedByKey() {
        PerformanceMonitor monitor = newMonitor();
        monitor.setMetric("queue_depth", 42);
        AlertConfig config = new AlertConfig("custom", List.of(
            AlertThreshold.custom("deep_queue", "queue_depth", AlertOperator.EQUAL_TO, 42,
                AlertSeverity.INFO, "Queue depth is exactly 42")));

        List<PerformanceAlert> alerts = monitor.evaluateThresholds(config);

        assertThat(alerts).singleElement().satisfies(a -> {
            assertThat(a.metric()).isEqualTo("custom:queue_depth");
            assertThat(a.severity()).isEqualTo(AlertSeverity.INFO);
        });
    }

    @Test
    public void operators_compareValueAgainstThreshold() {
        assertThat(AlertOperator.GREATER_THAN.test(10.5, 10)).isTrue();
        assertThat(AlertOperator.GREATER_THAN.test(10, 10)).isFalse();
        assertThat(AlertOperator.LESS_THAN.test(9, 10)).isTrue();
        assertThat(AlertOperator.EQUAL_TO.test(0.1 + 0.2, 0.3)).isTrue();
        assertThat(AlertOperator.NOT_EQUAL_TO.test(0.1 + 0.2, 0.3)).isFalse();
        assertThat(AlertOperator.NOT_EQUAL_TO.test(1, 2)).isTrue();
    }

    @Test
    public void operators_acceptSymbolsAndNames() {
        assertThat(AlertOperator.fromWireName(">")).isEqualTo(AlertOperator.GREATER_THAN);
        assertThat(AlertOperator.fromWireName("!=")).isEqualTo(AlertOperator.NOT_EQUAL_TO);
        assertThat(AlertOperator.fromWireName("LessThan")).isEqualTo(AlertOperator.LESS_THAN);
        assertThat(AlertMetric.fromWireName("StepDurationMs")).isEqualTo(AlertMetric.STEP_DURATION_MS);
    }

    // ════════════════════════════════════════════════════════════════════════
    // Summary
    // ════════════════════════════════════════════════════════════════════════

    @Test
    public void summary_countsOutcomesAndAlerts() {
        PerformanceMonitor monitor = newMonitor();
        monitor.recordExecution(feature("mixed", passed("a", 1_000), passed("b", 3_000), failed("c", 2_000)));
        monitor.evaluateThresholds(AlertConfig.defaults());

        PerformanceSummary summary = monitor.getSummary();

        assertThat(summary.scenarioCount()).isEqualTo(3);
        assertThat(summary.scenariosPassed()).isEqualTo(2);
        assertThat(summary.scenariosFailed()).isEqualTo(1);
        assertThat(summary.stepCount()).isEqualTo(3);
        assertThat(summary.avgScenarioDurationMs()).isEqualTo(2_000.0);
        assertThat(summary.maxScenarioDurationMs()).isEqualTo(3_000);
        assertThat(summary.failureRatePercent()).isCloseTo(33.33, within(0.01));
        assertThat(summary.alertsGenerated()).isEqualTo(1);
    }
}
