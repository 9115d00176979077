package com.webspec.batch;

import com.webspec.model.ExecutionResult;
import com.webspec.model.StepStatus;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Per-file outcome within a batch. A file whose runner failed has status
 * {@code failed}, zero scenario counts and no {@link ExecutionResult}.
 */
public final class FeatureResult {

    private final String          name;
    private final Path            path;
    private final StepStatus      status;
    private final int             scenariosPassed;
    private final int             scenariosFailed;
    private final long            durationMs;
    private final ExecutionResult result;

    private FeatureResult(String name, Path path, StepStatus status, int scenariosPassed,
                          int scenariosFailed, long durationMs, ExecutionResult result) {
        this.name            = name;
        this.path            = path;
        this.status          = status;
        this.scenariosPassed = scenariosPassed;
        this.scenariosFailed = scenariosFailed;
        this.durationMs      = durationMs;
        this.result          = result;
    }

    public static FeatureResult completed(Path path, ExecutionResult result, long durationMs) {
        return new FeatureResult(nameOf(path), path, result.getStatus(),
            result.getSummary().getPassedScenarios(), result.getSummary().getFailedScenarios(),
            durationMs, result);
    }

    public static FeatureResult errored(Path path, long durationMs) {
        return new FeatureResult(nameOf(path), path, StepStatus.FAILED, 0, 0, durationMs, null);
    }

    /** File name without its extension. */
    static String nameOf(Path path) {
        Path fileName = path.getFileName();
        if (fileName == null) return "Unknown";
        String name = fileName.toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }

    public String                    getName()            { return name; }
    public Path                      getPath()            { return path; }
    public StepStatus                getStatus()          { return status; }
    public int                       getScenariosPassed() { return scenariosPassed; }
    public int                       getScenariosFailed() { return scenariosFailed; }
    public long                      getDurationMs()      { return durationMs; }
    public Optional<ExecutionResult> getResult()          { return Optional.ofNullable(result); }

    public boolean isPassed() { return status == StepStatus.PASSED; }
    public boolean isFailed() { return status == StepStatus.FAILED; }

    @Override
    public String toString() {
        return String.format("FeatureResult{name='%s', status=%s, passed=%d, failed=%d, %dms}",
            name, status, scenariosPassed, scenariosFailed, durationMs);
    }
}
