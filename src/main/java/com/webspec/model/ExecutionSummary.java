package com.webspec.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collection;

/**
 * Scenario and step counters for one execution.
 *
 * <p>Only {@link #of(Collection)} computes these numbers; it folds every
 * scenario and every step exactly once. Pending scenarios and steps are counted
 * as skipped so that {@code total == passed + failed + skipped} holds at both
 * levels.
 */
public final class ExecutionSummary {

    public static final ExecutionSummary EMPTY = new ExecutionSummary(0, 0, 0, 0, 0, 0, 0, 0);

    private final int totalScenarios;
    private final int passedScenarios;
    private final int failedScenarios;
    private final int skippedScenarios;
    private final int totalSteps;
    private final int passedSteps;
    private final int failedSteps;
    private final int skippedSteps;

    @JsonCreator
    ExecutionSummary(@JsonProperty("total_scenarios")   int totalScenarios,
                     @JsonProperty("passed_scenarios")  int passedScenarios,
                     @JsonProperty("failed_scenarios")  int failedScenarios,
                     @JsonProperty("skipped_scenarios") int skippedScenarios,
                     @JsonProperty("total_steps")       int totalSteps,
                     @JsonProperty("passed_steps")      int passedSteps,
                     @JsonProperty("failed_steps")      int failedSteps,
                     @JsonProperty("skipped_steps")     int skippedSteps) {
        this.totalScenarios   = totalScenarios;
        this.passedScenarios  = passedScenarios;
        this.failedScenarios  = failedScenarios;
        this.skippedScenarios = skippedScenarios;
        this.totalSteps       = totalSteps;
        this.passedSteps      = passedSteps;
        this.failedSteps      = failedSteps;
        this.skippedSteps     = skippedSteps;
    }

    public static ExecutionSummary of(Collection<ScenarioResult> scenarios) {
        int sTotal = 0, sPassed = 0, sFailed = 0, sSkipped = 0;
        int tTotal = 0, tPassed = 0, tFailed = 0, tSkipped = 0;

        for (ScenarioResult scenario : scenarios) {
            sTotal++;
            switch (scenario.getStatus()) {
                case PASSED -> sPassed++;
                case FAILED -> sFailed++;
                default     -> sSkipped++;
            }
            for (StepResult step : scenario.getSteps()) {
                tTotal++;
                switch (step.getStatus()) {
                    case PASSED -> tPassed++;
                    case FAILED -> tFailed++;
                    default     -> tSkipped++;
                }
            }
        }
        return new ExecutionSummary(sTotal, sPassed, sFailed, sSkipped,
                                    tTotal, tPassed, tFailed, tSkipped);
    }

    @JsonProperty("total_scenarios")   public int getTotalScenarios()   { return totalScenarios; }
    @JsonProperty("passed_scenarios")  public int getPassedScenarios()  { return passedScenarios; }
    @JsonProperty("failed_scenarios")  public int getFailedScenarios()  { return failedScenarios; }
    @JsonProperty("skipped_scenarios") public int getSkippedScenarios() { return skippedScenarios; }
    @JsonProperty("total_steps")       public int getTotalSteps()       { return totalSteps; }
    @JsonProperty("passed_steps")      public int getPassedSteps()      { return passedSteps; }
    @JsonProperty("failed_steps")      public int getFailedSteps()      { return failedSteps; }
    @JsonProperty("skipped_steps")     public int getSkippedSteps()     { return skippedSteps; }

    @Override
    public String toString() {
        return String.format(
            "ExecutionSummary{scenarios=%d (passed=%d, failed=%d, skipped=%d), steps=%d (passed=%d, failed=%d, skipped=%d)}",
            totalScenarios, passedScenarios, failedScenarios, skippedScenarios,
            totalSteps, passedSteps, failedSteps, skippedSteps);
    }
}
