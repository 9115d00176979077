package com.webspec.executor;

import com.webspec.executor.handlers.FailingHandler;
import com.webspec.executor.handlers.RememberValueHandler;
import com.webspec.model.ExecutionResult;
import com.webspec.model.StepResult;
import com.webspec.model.StepStatus;
import com.webspec.registry.DefaultStepPatterns;
import com.webspec.registry.StepIds;
import com.webspec.registry.StepPatternRegistry;
import org.testng.annotations.BeforeClass;
import org.testng.annotations.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Handler discovery and dispatch without a browser.
 */
public class StepHandlerRegistryTest {

    private StepHandlerRegistry handlers;

    @BeforeClass
    public void setUp() {
        handlers = new StepHandlerRegistry();
    }

    // ════════════════════════════════════════════════════════════════════════
    // Discovery
    // ════════════════════════════════════════════════════════════════════════

    @Test
    public void everyBuiltInStepHasAHandler() {
        StepPatternRegistry patterns = DefaultStepPatterns.build();

        for (String id : patterns.identifiers()) {
            assertThat(handlers.hasHandler(id)).as("handler for %s", id).isTrue();
        }
    }

    @Test
    public void handlersFromTheTestClasspathAreDiscovered() {
        assertThat(handlers.find(RememberValueHandler.ID))
            .containsInstanceOf(RememberValueHandler.class);
        assertThat(handlers.size()).isEqualTo(handlers.identifiers().size());
    }

    // ════════════════════════════════════════════════════════════════════════
    // Dispatch
    // ════════════════════════════════════════════════════════════════════════

    @Test
    public void dispatch_unknownIdentifierIsNotFound() {
        HandlerDispatchBackend backend = new HandlerDispatchBackend(handlers, null);

        StepOutcome outcome = backend.execute(new StepInvocation("teleport", List.of(), "I teleport", new ValueStore()));

        assertThat(outcome.getStatus()).isEqualTo(StepOutcome.Status.NOT_FOUND);
        assertThat(outcome.getMessage()).contains("teleport");
    }

    @Test
    public void dispatch_browserStepWithoutDriverFails() {
        HandlerDispatchBackend backend = new HandlerDispatchBackend(handlers, null);

        StepOutcome outcome = backend.execute(
            new StepInvocation(StepIds.CLICK, List.of("#go"), "I click on \"#go\"", new ValueStore()));

        assertThat(outcome.isPassed()).isFalse();
        assertThat(outcome.getMessage()).isEqualTo("No browser attached for step 'click'");
    }

    @Test
    public void dispatch_fixedWaitNeedsNoDriver() {
        HandlerDispatchBackend backend = new HandlerDispatchBackend(handlers, null);

        StepOutcome outcome = backend.execute(
            new StepInvocation(StepIds.WAIT_MILLISECONDS, List.of("5"), "I wait 5 ms", new ValueStore()));

        assertThat(outcome.isPassed()).isTrue();
    }

    @Test
    public void dispatch_handlerExceptionMessageIsKeptVerbatim() {
        HandlerDispatchBackend backend = new HandlerDispatchBackend(handlers, null);

        StepOutcome outcome = backend.execute(new StepInvocation(FailingHandler.ID,
            List.of("Checkout service unavailable"), "the step fails with \"Checkout service unavailable\"",
            new ValueStore()));

        assertThat(outcome.getStatus()).isEqualTo(StepOutcome.Status.FAILED);
        assertThat(outcome.getMessage()).isEqualTo("Checkout service unavailable");
        assertThat(outcome.getError()).isInstanceOf(StepExecutionException.class);
    }

    @Test
    public void dispatch_handlerExceptionWithoutMessageUsesItsType() {
        HandlerDispatchBackend backend = new HandlerDispatchBackend(handlers, null);

        StepOutcome outcome = backend.execute(
            new StepInvocation(FailingHandler.ID, List.of(), "the step fails", new ValueStore()));

        assertThat(outcome.getMessage()).isEqualTo("IllegalStateException");
    }

    @Test
    public void storedValuesFlowBetweenStepsOfAScenario() {
        StepPatternRegistry patterns = DefaultStepPatterns.build()
            .register(RememberValueHandler.PATTERN, RememberValueHandler.ID);
        FeatureExecutor executor = new FeatureExecutor(patterns, new HandlerDispatchBackend(handlers, null));

        ExecutionResult result = executor.execute(new FeatureDefinition("Data", List.of(
            new ScenarioDefinition("match", List.of(
                StepDefinition.of("Given", "I remember \"A-100\" as \"orderId\""),
                StepDefinition.of("Then", "the stored value \"orderId\" should be \"A-100\""))),
            new ScenarioDefinition("mismatch", List.of(
                StepDefinition.of("Given", "I remember \"A-101\" as \"orderId\""),
                StepDefinition.of("Then", "the stored value \"orderId\" should be \"A-100\""))),
            new ScenarioDefinition("isolated", List.of(
                StepDefinition.of("Then", "the stored value \"orderId\" should be \"A-100\""))))));

        assertThat(result.getScenarios().get(0).getStatus()).isEqualTo(StepStatus.PASSED);

        StepResult mismatch = result.getScenarios().get(1).getSteps().get(1);
        assertThat(mismatch.getStatus()).isEqualTo(StepStatus.FAILED);
        assertThat(mismatch.getError().getMessage()).contains("'A-100'").contains("'A-101'");

        StepResult isolated = result.getScenarios().get(2).getSteps().get(0);
        assertThat(isolated.getError().getMessage()).isEqualTo("No value stored under 'orderId'");
    }
}
