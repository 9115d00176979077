package com.webspec.executor;

/**
 * Executes one step identifier against the browser.
 *
 * <h3>Registration</h3>
 * Implementations must:
 * <ol>
 *   <li>Be annotated with {@link HandlesStep} (value = the step identifier)</li>
 *   <li>Have a no-arg constructor (package-private is fine)</li>
 *   <li>Live in the {@code com.webspec.executor.handlers} package, on the main or
 *       the test classpath, so {@link StepHandlerRegistry} discovers them</li>
 * </ol>
 *
 * <h3>Implementation rules</h3>
 * <ul>
 *   <li>Never throw: catch and return {@link StepOutcome#failed}</li>
 *   <li>Be stateless: one instance serves every scenario. Per-scenario data
 *       belongs in {@link StepContext#getValues()}</li>
 * </ul>
 */
public interface StepHandler {
    StepOutcome execute(StepContext context);
}
