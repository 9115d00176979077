package com.webspec.profiling;

import com.webspec.model.ExecutionResult;
import com.webspec.model.StepResult;
import org.testng.annotations.Test;

import java.util.stream.IntStream;

import static com.webspec.support.ResultFixtures.feature;
import static com.webspec.support.ResultFixtures.step;
import static com.webspec.support.ResultFixtures.withSteps;
import static org.assertj.core.api.Assertions.assertThat;

public class ExecutionProfilerTest {

    private static final String OPEN  = "I navigate to \"https://shop.example.com\"";
    private static final String CLICK = "I click on \"#buy\"";
    private static final String CHECK = "I should see \"Thanks\"";

    private static ExecutionResult shop() {
        return feature("shop",
            withSteps("Buy one", step(OPEN, 3_000), step(CLICK, 500), step(CHECK, 500)),
            withSteps("Buy two", step(OPEN, 3_000), step(CLICK, 700), step(CLICK, 300), step(CHECK, 500)));
    }

    @Test
    public void analyze_scenarioSharesAndSlowestStep() {
        ProfilingReport report = ExecutionProfiler.analyze(shop());

        assertThat(report.totalDurationMs()).isEqualTo(8_500);
        ScenarioMetrics first = report.scenarios().get(0);
        assertThat(first.name()).isEqualTo("Buy one");
        assertThat(first.stepCount()).isEqualTo(3);
        assertThat(first.passed()).isTrue();
        assertThat(first.steps()).extracting(StepMetrics::percentage).containsExactly(75.0, 12.5, 12.5);
        assertThat(first.slowestStep().text()).isEqualTo(OPEN);
    }

    @Test
    public void analyze_aggregatesStepsByTextAcrossScenarios() {
        ProfilingReport report = ExecutionProfiler.analyze(shop());

        assertThat(report.slowestSteps()).extracting(StepTiming::text).containsExactly(OPEN, CLICK, CHECK);
        StepTiming click = report.slowestSteps().get(1);
        assertThat(click.totalMs()).isEqualTo(1_500);
        assertThat(click.calls()).isEqualTo(3);
        assertThat(click.averageMs()).isEqualTo(500);
    }

    @Test
    public void analyze_suggestsNavigationWorkAndFlagsOutlier() {
        BottleneckAnalysis analysis = ExecutionProfiler.analyze(shop()).bottleneckAnalysis();

        assertThat(analysis.topBottleneck()).isEqualTo(OPEN);
        assertThat(analysis.slowScenario()).isEqualTo("Buy two");
        assertThat(analysis.suggestions()).containsExactly(
            "The '" + OPEN + "' step takes 6000ms - consider reducing wait times or optimizing navigation",
            "Scenario 'Buy two' is the slowest at 4500ms",
            "Step '" + OPEN + "' is 4500ms slower than the next slowest step - investigate this outlier");
    }

    @Test
    public void analyze_keepsTenSlowestStepTexts() {
        ExecutionResult many = feature("many", withSteps("All",
            IntStream.rangeClosed(1, 12).mapToObj(i -> step("I wait " + i + " seconds", i * 100L))
                .toArray(StepResult[]::new)));

        ProfilingReport report = ExecutionProfiler.analyze(many);

        assertThat(report.slowestSteps()).hasSize(10);
        assertThat(report.slowestSteps().get(0).text()).isEqualTo("I wait 12 seconds");
    }

    @Test
    public void analyze_emptyRun() {
        ProfilingReport report = ExecutionProfiler.analyze(feature("empty"));

        assertThat(report.scenarios()).isEmpty();
        assertThat(report.slowestSteps()).isEmpty();
        assertThat(report.bottleneckAnalysis().topBottleneck()).isNull();
        assertThat(report.bottleneckAnalysis().suggestions()).isEmpty();
    }
}
