package com.webspec.support;

import com.webspec.model.ErrorInfo;
import com.webspec.model.ExecutionResult;
import com.webspec.model.FeatureInfo;
import com.webspec.model.ScenarioResult;
import com.webspec.model.StepResult;

import java.time.Instant;

/**
 * Builds synthetic execution results for unit tests. No browser, no executor.
 */
public final class ResultFixtures {

    public static final Instant T0 = Instant.parse("2024-01-01T00:00:00Z");

    private ResultFixtures() {}

    public static ExecutionResult feature(String name, ScenarioResult... scenarios) {
        ExecutionResult result = new ExecutionResult(new FeatureInfo(name, name + ".feature", null), T0);
        long total = 0;
        for (ScenarioResult s : scenarios) {
            result.addScenario(s);
            total += s.getDurationMs();
        }
        return result.setDurationMs(total);
    }

    /** A scenario whose single step passed in {@code durationMs}. */
    public static ScenarioResult passed(String name, long durationMs) {
        return new ScenarioResult(name)
            .addStep(StepResult.passed("Given", "I open the page for " + name, durationMs))
            .setDurationMs(durationMs);
    }

    /** A scenario whose single step failed in {@code durationMs}. */
    public static ScenarioResult failed(String name, long durationMs) {
        return new ScenarioResult(name)
            .addStep(StepResult.failed("Given", "I open the page for " + name, durationMs,
                new ErrorInfo(ErrorInfo.STEP_EXECUTION_FAILED, "boom")))
            .setDurationMs(durationMs);
    }

    /** A scenario with the given steps (all passed); its duration is the sum of theirs. */
    public static ScenarioResult withSteps(String name, StepResult... steps) {
        ScenarioResult scenario = new ScenarioResult(name);
        long total = 0;
        for (StepResult step : steps) {
            scenario.addStep(step);
            total += step.getDurationMs();
        }
        return scenario.setDurationMs(total);
    }

    public static StepResult step(String text, long durationMs) {
        return StepResult.passed("When", text, durationMs);
    }
}
