package com.webspec.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Outcome of one executed (or skipped) step.
 *
 * <p>Immutable. The executing caller decides the status; the {@code with*}
 * methods return modified copies.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class StepResult {

    private final String     text;
    private final String     keyword;
    private final StepStatus status;
    private final long       durationMs;
    private final String     output;
    private final ErrorInfo  error;

    @JsonCreator
    public StepResult(@JsonProperty("step") String text,
                      @JsonProperty("keyword") String keyword,
                      @JsonProperty("status") StepStatus status,
                      @JsonProperty("duration_ms") long durationMs,
                      @JsonProperty("output") String output,
                      @JsonProperty("error") ErrorInfo error) {
        this.text       = Objects.requireNonNull(text, "step text");
        this.keyword    = keyword != null ? keyword : "";
        this.status     = status != null ? status : StepStatus.PENDING;
        this.durationMs = Math.max(0, durationMs);
        this.output     = output;
        this.error      = error;
    }

    public StepResult(String text, String keyword) {
        this(text, keyword, StepStatus.PENDING, 0, null, null);
    }

    // ── Static factories ──────────────────────────────────────────────────────

    public static StepResult passed(String keyword, String text, long durationMs) {
        return new StepResult(text, keyword, StepStatus.PASSED, durationMs, null, null);
    }

    public static StepResult failed(String keyword, String text, long durationMs, ErrorInfo error) {
        return new StepResult(text, keyword, StepStatus.FAILED, durationMs, null, error);
    }

    public static StepResult skipped(String keyword, String text) {
        return new StepResult(text, keyword, StepStatus.SKIPPED, 0, null, null);
    }

    // ── Copies ────────────────────────────────────────────────────────────────

    public StepResult withStatus(StepStatus newStatus) {
        return new StepResult(text, keyword, newStatus, durationMs, output, error);
    }

    public StepResult withDuration(long newDurationMs) {
        return new StepResult(text, keyword, status, newDurationMs, output, error);
    }

    public StepResult withOutput(String newOutput) {
        return new StepResult(text, keyword, status, durationMs, newOutput, error);
    }

    public StepResult withError(ErrorInfo newError) {
        return new StepResult(text, keyword, status, durationMs, output, newError);
    }

    // ── Getters ───────────────────────────────────────────────────────────────

    @JsonProperty("step")
    public String     getText()       { return text; }
    public String     getKeyword()    { return keyword; }
    public StepStatus getStatus()     { return status; }
    @JsonProperty("duration_ms")
    public long       getDurationMs() { return durationMs; }
    public String     getOutput()     { return output; }
    public ErrorInfo  getError()      { return error; }

    @JsonIgnore public boolean isPassed()  { return status == StepStatus.PASSED; }
    @JsonIgnore public boolean isFailed()  { return status == StepStatus.FAILED; }
    @JsonIgnore public boolean isSkipped() { return status == StepStatus.SKIPPED; }

    @Override
    public String toString() {
        return String.format("StepResult{%s %s, status=%s, %dms}", keyword, text, status, durationMs);
    }
}
