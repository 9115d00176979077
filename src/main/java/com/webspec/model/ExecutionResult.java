package com.webspec.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Top-level result of running one feature.
 *
 * <p>The summary and the overall status are recomputed on every mutation
 * ({@link #addScenario} and {@link ScenarioResult#addStep} on an attached
 * scenario), so they are never stale with respect to the scenarios. A result
 * with no scenarios yet is {@code pending}. Otherwise the status is
 * {@code failed} when any step failed, {@code passed} when any step passed,
 * and {@code skipped} when neither.
 */
@JsonIgnoreProperties(value = {"status", "summary"}, allowGetters = true, ignoreUnknown = true)
public class ExecutionResult {

    private final FeatureInfo          feature;
    private final Instant              timestamp;
    private final List<ScenarioResult> scenarios = new ArrayList<>();
    private long                       durationMs;
    private StepStatus                 status  = StepStatus.PENDING;
    private ExecutionSummary           summary = ExecutionSummary.EMPTY;

    public ExecutionResult(FeatureInfo feature, Instant timestamp) {
        this.feature   = Objects.requireNonNull(feature, "feature");
        this.timestamp = timestamp != null ? timestamp : Instant.now().truncatedTo(ChronoUnit.MILLIS);
    }

    public ExecutionResult(FeatureInfo feature) {
        this(feature, null);
    }

    @JsonCreator
    ExecutionResult(@JsonProperty("feature") FeatureInfo feature,
                    @JsonProperty("timestamp") Instant timestamp,
                    @JsonProperty("duration_ms") long durationMs,
                    @JsonProperty("scenarios") List<ScenarioResult> scenarios) {
        this(feature != null ? feature : new FeatureInfo(""), timestamp);
        this.durationMs = Math.max(0, durationMs);
        if (scenarios != null) scenarios.forEach(this::addScenario);
    }

    // ── Mutation ──────────────────────────────────────────────────────────────

    public ExecutionResult addScenario(ScenarioResult scenario) {
        Objects.requireNonNull(scenario, "scenario");
        scenario.attachTo(this);
        scenarios.add(scenario);
        refresh();
        return this;
    }

    public ExecutionResult setDurationMs(long durationMs) {
        this.durationMs = Math.max(0, durationMs);
        return this;
    }

    /** Re-folds the summary and re-derives the status from the current scenarios. */
    void refresh() {
        summary = ExecutionSummary.of(scenarios);
        if (summary.getFailedSteps() > 0)      status = StepStatus.FAILED;
        else if (summary.getPassedSteps() > 0) status = StepStatus.PASSED;
        else                                   status = StepStatus.SKIPPED;
    }

    // ── Getters ───────────────────────────────────────────────────────────────

    public StepStatus           getStatus()     { return status; }
    public Instant              getTimestamp()  { return timestamp; }
    @JsonProperty("duration_ms")
    public long                 getDurationMs() { return durationMs; }
    public FeatureInfo          getFeature()    { return feature; }
    public List<ScenarioResult> getScenarios()  { return Collections.unmodifiableList(scenarios); }
    public ExecutionSummary     getSummary()    { return summary; }

    @Override
    public String toString() {
        return String.format("ExecutionResult{feature='%s', status=%s, %s, %dms}",
            feature.getName(), status, summary, durationMs);
    }
}
