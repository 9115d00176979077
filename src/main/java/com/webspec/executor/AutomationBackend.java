package com.webspec.executor;

/**
 * Performs the browser side of a matched step.
 *
 * <p>Implementations report failures through {@link StepOutcome#failed}; an
 * exception escaping {@link #execute} is treated as a step failure as well.
 */
@FunctionalInterface
public interface AutomationBackend {
    StepOutcome execute(StepInvocation invocation);
}
