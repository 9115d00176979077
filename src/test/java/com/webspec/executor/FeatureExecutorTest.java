package com.webspec.executor;

import com.webspec.model.ErrorInfo;
import com.webspec.model.ExecutionResult;
import com.webspec.model.ScenarioResult;
import com.webspec.model.StepResult;
import com.webspec.model.StepStatus;
import com.webspec.registry.DefaultStepPatterns;
import com.webspec.registry.StepPatternRegistry;
import org.testng.annotations.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * FeatureExecutor against in-memory backends. No WebDriver.
 */
public class FeatureExecutorTest {

    private static final AutomationBackend ALWAYS_PASSES = inv -> StepOutcome.passed("ok " + inv.identifier());

    private final StepPatternRegistry patterns = DefaultStepPatterns.build();

    private static ScenarioDefinition scenario(String name, StepDefinition... steps) {
        return new ScenarioDefinition(name, List.of(steps));
    }

    @Test
    public void execute_allStepsPass() {
        FeatureExecutor executor = new FeatureExecutor(patterns, ALWAYS_PASSES);

        ExecutionResult result = executor.execute(new FeatureDefinition("Login", List.of(
            scenario("happy",
                StepDefinition.of("Given", "I navigate to \"https://example.com\""),
                StepDefinition.of("When", "I click on \"button.login\""),
                StepDefinition.of("Then", "I should see \"Welcome\"")))));

        assertThat(result.getStatus()).isEqualTo(StepStatus.PASSED);
        assertThat(result.getSummary().getPassedSteps()).isEqualTo(3);
        assertThat(result.getFeature().getName()).isEqualTo("Login");
        assertThat(result.getScenarios().get(0).getSteps().get(1).getOutput()).isEqualTo("ok click");
    }

    @Test
    public void execute_passesCapturedParametersToBackend() {
        List<StepInvocation> seen = new ArrayList<>();
        FeatureExecutor executor = new FeatureExecutor(patterns, inv -> {
            seen.add(inv);
            return StepOutcome.passed(null);
        });

        executor.executeScenario(scenario("typing",
            StepDefinition.of("When", "I type \"hello\" into \"#search\"")));

        assertThat(seen).hasSize(1);
        assertThat(seen.get(0).identifier()).isEqualTo("type_text");
        assertThat(seen.get(0).parameters()).containsExactly("hello", "#search");
        assertThat(seen.get(0).text()).isEqualTo("I type \"hello\" into \"#search\"");
    }

    @Test
    public void executeScenario_stopsAtFirstFailureAndSkipsTheRest() {
        FeatureExecutor executor = new FeatureExecutor(patterns, inv ->
            inv.identifier().equals("click") ? StepOutcome.failed("Element not found: #missing") : StepOutcome.passed(null));

        ScenarioResult result = executor.executeScenario(scenario("broken",
            StepDefinition.of("Given", "I go back"),
            StepDefinition.of("When", "I click on \"#missing\""),
            StepDefinition.of("Then", "I should see \"Done\""),
            StepDefinition.of("And", "I go forward")));

        assertThat(result.getStatus()).isEqualTo(StepStatus.FAILED);
        assertThat(result.getSteps()).extracting(StepResult::getStatus)
            .containsExactly(StepStatus.PASSED, StepStatus.FAILED, StepStatus.SKIPPED, StepStatus.SKIPPED);
        ErrorInfo error = result.getSteps().get(1).getError();
        assertThat(error.getCode()).isEqualTo(ErrorInfo.STEP_EXECUTION_FAILED);
        assertThat(error.getMessage()).isEqualTo("Element not found: #missing");
    }

    @Test
    public void executeScenario_unmatchedStepFailsWithoutCallingBackend() {
        List<StepInvocation> seen = new ArrayList<>();
        FeatureExecutor executor = new FeatureExecutor(patterns, inv -> {
            seen.add(inv);
            return StepOutcome.passed(null);
        });

        ScenarioResult result = executor.executeScenario(scenario("unknown",
            StepDefinition.of("Given", "I do a barrel roll"),
            StepDefinition.of("Then", "I go back")));

        assertThat(seen).isEmpty();
        StepResult first = result.getSteps().get(0);
        assertThat(first.getStatus()).isEqualTo(StepStatus.FAILED);
        assertThat(first.getError().getCode()).isEqualTo(ErrorInfo.UNMATCHED_STEP);
        assertThat(first.getError().getMessage()).isEqualTo("Unknown step: I do a barrel roll");
        assertThat(result.getSteps().get(1).getStatus()).isEqualTo(StepStatus.SKIPPED);
    }

    @Test
    public void executeScenario_backendExceptionBecomesFailedStep() {
        FeatureExecutor executor = new FeatureExecutor(patterns, inv -> {
            throw new StepExecutionException("driver crashed");
        });

        ScenarioResult result = executor.executeScenario(scenario("crash",
            StepDefinition.of("Given", "I go back")));

        assertThat(result.getStatus()).isEqualTo(StepStatus.FAILED);
        assertThat(result.getSteps().get(0).getError().getMessage()).isEqualTo("driver crashed");
    }

    @Test
    public void execute_failureInOneScenarioDoesNotStopTheNext() {
        FeatureExecutor executor = new FeatureExecutor(patterns, inv ->
            inv.identifier().equals("go_back") ? StepOutcome.failed("no history") : StepOutcome.passed(null));

        ExecutionResult result = executor.execute(new FeatureDefinition("History", List.of(
            scenario("back", StepDefinition.of("Given", "I go back")),
            scenario("forward", StepDefinition.of("Given", "I go forward")))));

        assertThat(result.getScenarios()).extracting(ScenarioResult::getStatus)
            .containsExactly(StepStatus.FAILED, StepStatus.PASSED);
        assertThat(result.getStatus()).isEqualTo(StepStatus.FAILED);
    }

    @Test
    public void eachScenarioGetsItsOwnValueStore() {
        List<ValueStore> stores = new ArrayList<>();
        FeatureExecutor executor = new FeatureExecutor(patterns, inv -> {
            stores.add(inv.values());
            inv.values().put("seen", inv.text());
            return StepOutcome.passed(null);
        });

        executor.execute(new FeatureDefinition("Stores", List.of(
            scenario("one", StepDefinition.of("Given", "I go back"), StepDefinition.of("Then", "I go forward")),
            scenario("two", StepDefinition.of("Given", "I go back")))));

        assertThat(stores).hasSize(3);
        assertThat(stores.get(0)).isSameAs(stores.get(1));
        assertThat(stores.get(2)).isNotSameAs(stores.get(0));
        assertThat(stores.get(2).get("seen")).contains("I go back");
    }
}
