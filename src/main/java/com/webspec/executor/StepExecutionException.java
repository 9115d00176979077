package com.webspec.executor;

/**
 * May be thrown by an {@link AutomationBackend} that cannot complete a step.
 * {@link FeatureExecutor} records it as a failed step; it never aborts a feature.
 */
public class StepExecutionException extends RuntimeException {

    public StepExecutionException(String message) {
        super(message);
    }

    public StepExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
