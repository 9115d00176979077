package com.webspec.batch;

import java.util.Comparator;
import java.util.List;

/**
 * Aggregated outcome of a batch run.
 *
 * <p>All counters are folded from {@link #getResults()} by {@link #aggregate};
 * scenario totals count passed plus failed scenarios. In parallel mode the
 * results are in completion order; {@link #sortedByPath()} gives a stable order.
 */
public final class BatchResult {

    private final int                 totalFeatures;
    private final int                 passedFeatures;
    private final int                 failedFeatures;
    private final int                 totalScenarios;
    private final int                 passedScenarios;
    private final int                 failedScenarios;
    private final long                totalDurationMs;
    private final List<FeatureResult> results;
    private final List<BatchError>    errors;

    private BatchResult(int totalFeatures, List<FeatureResult> results, List<BatchError> errors,
                        long totalDurationMs) {
        this.totalFeatures   = totalFeatures;
        this.results         = List.copyOf(results);
        this.errors          = List.copyOf(errors);
        this.totalDurationMs = totalDurationMs;

        int passed = 0, failed = 0, sPassed = 0, sFailed = 0;
        for (FeatureResult r : this.results) {
            if (r.isPassed()) passed++;
            if (r.isFailed()) failed++;
            sPassed += r.getScenariosPassed();
            sFailed += r.getScenariosFailed();
        }
        this.passedFeatures  = passed;
        this.failedFeatures  = failed;
        this.passedScenarios = sPassed;
        this.failedScenarios = sFailed;
        this.totalScenarios  = sPassed + sFailed;
    }

    public static BatchResult aggregate(int totalFeatures, List<FeatureResult> results,
                                        List<BatchError> errors, long totalDurationMs) {
        return new BatchResult(totalFeatures, results, errors, totalDurationMs);
    }

    /** Same batch with results ordered by path. */
    public BatchResult sortedByPath() {
        List<FeatureResult> sorted = results.stream()
            .sorted(Comparator.comparing(FeatureResult::getPath))
            .toList();
        List<BatchError> sortedErrors = errors.stream()
            .sorted(Comparator.comparing(BatchError::path))
            .toList();
        return new BatchResult(totalFeatures, sorted, sortedErrors, totalDurationMs);
    }

    public boolean hasFailures() {
        return failedFeatures > 0 || !errors.isEmpty();
    }

    public int                 getTotalFeatures()   { return totalFeatures; }
    public int                 getPassedFeatures()  { return passedFeatures; }
    public int                 getFailedFeatures()  { return failedFeatures; }
    public int                 getTotalScenarios()  { return totalScenarios; }
    public int                 getPassedScenarios() { return passedScenarios; }
    public int                 getFailedScenarios() { return failedScenarios; }
    public long                getTotalDurationMs() { return totalDurationMs; }
    public List<FeatureResult> getResults()         { return results; }
    public List<BatchError>    getErrors()          { return errors; }

    @Override
    public String toString() {
        return String.format("BatchResult{features=%d (passed=%d, failed=%d), scenarios=%d, errors=%d, %dms}",
            totalFeatures, passedFeatures, failedFeatures, totalScenarios, errors.size(), totalDurationMs);
    }
}
