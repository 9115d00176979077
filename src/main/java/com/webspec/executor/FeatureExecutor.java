package com.webspec.executor;

import com.webspec.model.ErrorInfo;
import com.webspec.model.ExecutionResult;
import com.webspec.model.FeatureInfo;
import com.webspec.model.ScenarioResult;
import com.webspec.model.StepResult;
import com.webspec.registry.StepMatch;
import com.webspec.registry.StepPatternRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Runs a parsed feature scenario by scenario and builds its {@link ExecutionResult}.
 *
 * ## Execution model
 *
 *   1. Steps of a scenario run strictly in order, one at a time.
 *   2. Each step text is resolved through the {@link StepPatternRegistry}. Text
 *      that matches no pattern fails with {@code UNMATCHED_STEP}.
 *   3. A matched step is handed to the {@link AutomationBackend}. A failed outcome
 *      or an exception fails the step with {@code STEP_EXECUTION_FAILED}; the
 *      backend's message is kept verbatim.
 *   4. After the first failed step the remaining steps of that scenario are
 *      recorded as skipped. The next scenario starts normally.
 *
 * Every scenario gets its own {@link ValueStore}.
 */
public class FeatureExecutor {

    private static final Logger log = LoggerFactory.getLogger(FeatureExecutor.class);

    private final StepPatternRegistry patterns;
    private final AutomationBackend   backend;

    public FeatureExecutor(StepPatternRegistry patterns, AutomationBackend backend) {
        this.patterns = patterns;
        this.backend  = backend;
    }

    // ── Primary API ───────────────────────────────────────────────────────────

    public ExecutionResult execute(FeatureDefinition feature) {
        log.info("FeatureExecutor: running feature '{}' ({} scenario(s))",
            feature.name(), feature.scenarios().size());
        long start = System.nanoTime();

        ExecutionResult result = new ExecutionResult(
            new FeatureInfo(feature.name(), feature.file(), feature.description()));
        for (ScenarioDefinition scenario : feature.scenarios()) {
            result.addScenario(executeScenario(scenario));
        }
        result.setDurationMs(elapsedMs(start));

        log.info("FeatureExecutor: feature '{}' {} in {}ms - {}",
            feature.name(), result.getStatus().wireName(), result.getDurationMs(), result.getSummary());
        return result;
    }

    public ScenarioResult executeScenario(ScenarioDefinition scenario) {
        ValueStore     values   = new ValueStore();
        ScenarioResult result   = new ScenarioResult(scenario.name());
        boolean        failed   = false;
        long           start    = System.nanoTime();

        for (StepDefinition step : scenario.steps()) {
            if (failed) {
                result.addStep(StepResult.skipped(step.keyword(), step.text()));
                continue;
            }
            StepResult stepResult = executeStep(step, values);
            result.addStep(stepResult);
            failed = stepResult.isFailed();
        }
        result.setDurationMs(elapsedMs(start));

        log.info("FeatureExecutor: scenario '{}' {} ({} step(s), {}ms)",
            scenario.name(), result.getStatus().wireName(), scenario.steps().size(), result.getDurationMs());
        return result;
    }

    // ── Private helpers ───────────────────────────────────────────────────────

    private StepResult executeStep(StepDefinition step, ValueStore values) {
        long start = System.nanoTime();

        Optional<StepMatch> match = patterns.match(step.text());
        if (match.isEmpty()) {
            log.warn("FeatureExecutor: no pattern matches step '{}'", step.text());
            return StepResult.failed(step.keyword(), step.text(), elapsedMs(start),
                new ErrorInfo(ErrorInfo.UNMATCHED_STEP, "Unknown step: " + step.text()));
        }

        StepMatch m = match.get();
        StepOutcome outcome;
        try {
            outcome = backend.execute(new StepInvocation(m.identifier(), m.parameters(), step.text(), values));
        } catch (RuntimeException e) {
            log.error("FeatureExecutor: backend threw for '{}': {}", step.text(), e.getMessage(), e);
            outcome = StepOutcome.failed(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName(), e);
        }
        long duration = elapsedMs(start);

        if (outcome.isPassed()) {
            log.debug("FeatureExecutor: PASSED {} {} ({}ms)", step.keyword(), step.text(), duration);
            return StepResult.passed(step.keyword(), step.text(), duration).withOutput(outcome.getMessage());
        }
        log.warn("FeatureExecutor: FAILED {} {} - {}", step.keyword(), step.text(), outcome.getMessage());
        return StepResult.failed(step.keyword(), step.text(), duration,
            new ErrorInfo(ErrorInfo.STEP_EXECUTION_FAILED, outcome.getMessage()));
    }

    private static long elapsedMs(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }
}
