package com.webspec.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Ordered step results for one scenario.
 *
 * <p>The status is never set directly. It is re-derived from the steps every
 * time a step is added:
 * <ul>
 *   <li>failed  - any step failed</li>
 *   <li>skipped - every step skipped (a scenario without steps counts as skipped)</li>
 *   <li>passed  - otherwise, when at least one step passed</li>
 *   <li>pending - otherwise</li>
 * </ul>
 *
 * <p>When the scenario has been added to an {@link ExecutionResult}, adding a
 * step also refreshes that result's summary.
 */
@JsonIgnoreProperties(value = {"status"}, allowGetters = true, ignoreUnknown = true)
public class ScenarioResult {

    private final String           name;
    private final List<StepResult> steps = new ArrayList<>();
    private StepStatus             status;
    private long                   durationMs;
    private ExecutionResult        owner;

    public ScenarioResult(String name) {
        this.name   = Objects.requireNonNull(name, "scenario name");
        this.status = deriveStatus();
    }

    @JsonCreator
    ScenarioResult(@JsonProperty("name") String name,
                   @JsonProperty("duration_ms") long durationMs,
                   @JsonProperty("steps") List<StepResult> steps) {
        this(name);
        this.durationMs = Math.max(0, durationMs);
        if (steps != null) steps.forEach(this::addStep);
    }

    // ── Mutation ──────────────────────────────────────────────────────────────

    /**
     * Appends a step and re-derives the scenario status.
     */
    public ScenarioResult addStep(StepResult step) {
        steps.add(Objects.requireNonNull(step, "step"));
        status = deriveStatus();
        if (owner != null) owner.refresh();
        return this;
    }

    public ScenarioResult setDurationMs(long durationMs) {
        this.durationMs = Math.max(0, durationMs);
        if (owner != null) owner.refresh();
        return this;
    }

    void attachTo(ExecutionResult result) {
        if (owner != null && owner != result) {
            throw new IllegalStateException(
                "Scenario '" + name + "' already belongs to another execution result");
        }
        owner = result;
    }

    // ── Getters ───────────────────────────────────────────────────────────────

    public String           getName()       { return name; }
    public StepStatus       getStatus()     { return status; }
    @JsonProperty("duration_ms")
    public long             getDurationMs() { return durationMs; }
    public List<StepResult> getSteps()      { return Collections.unmodifiableList(steps); }

    @JsonIgnore public boolean isPassed()  { return status == StepStatus.PASSED; }
    @JsonIgnore public boolean isFailed()  { return status == StepStatus.FAILED; }
    @JsonIgnore public boolean isSkipped() { return status == StepStatus.SKIPPED; }

    // ── Private helpers ───────────────────────────────────────────────────────

    private StepStatus deriveStatus() {
        if (steps.stream().anyMatch(StepResult::isFailed))   return StepStatus.FAILED;
        if (steps.stream().allMatch(StepResult::isSkipped))  return StepStatus.SKIPPED;
        if (steps.stream().anyMatch(StepResult::isPassed))   return StepStatus.PASSED;
        return StepStatus.PENDING;
    }

    @Override
    public String toString() {
        return String.format("ScenarioResult{name='%s', status=%s, steps=%d, %dms}",
            name, status, steps.size(), durationMs);
    }
}
