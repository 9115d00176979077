package com.webspec.executor;

/**
 * What a handler or backend reports after executing one step.
 *
 * <p>Immutable. Use the static factories.
 */
public final class StepOutcome {

    public enum Status { PASSED, FAILED, NOT_FOUND }

    private final Status    status;
    private final String    message;
    private final Throwable error;   // non-null only for some failures

    private StepOutcome(Status status, String message, Throwable error) {
        this.status  = status;
        this.message = message;
        this.error   = error;
    }

    // ── Static factories ──────────────────────────────────────────────────────

    public static StepOutcome passed(String output) {
        return new StepOutcome(Status.PASSED, output, null);
    }

    public static StepOutcome failed(String message, Throwable cause) {
        return new StepOutcome(Status.FAILED, message, cause);
    }

    public static StepOutcome failed(String message) {
        return failed(message, null);
    }

    public static StepOutcome notFound(String identifier) {
        return new StepOutcome(Status.NOT_FOUND,
            "No handler registered for step identifier: " + identifier, null);
    }

    // ── Getters ───────────────────────────────────────────────────────────────

    public Status    getStatus()  { return status; }
    public String    getMessage() { return message; }
    public Throwable getError()   { return error; }

    public boolean isPassed() { return status == Status.PASSED; }

    @Override
    public String toString() {
        return String.format("StepOutcome{status=%s, message='%s'}", status, message);
    }
}
