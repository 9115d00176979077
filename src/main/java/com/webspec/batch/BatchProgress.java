package com.webspec.batch;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Thread-safe collector shared by the batch workers.
 *
 * <p>Each feature index is settled at most once: a worker that finishes after
 * its feature was already recorded as timed out is ignored.
 */
public class BatchProgress {

    private final int                 total;
    private final long                startNanos = System.nanoTime();
    private final boolean[]           settled;
    private final List<FeatureResult> results = new ArrayList<>();
    private final List<BatchError>    errors  = new ArrayList<>();
    private int                       completed;

    public BatchProgress(int total) {
        this.total   = total;
        this.settled = new boolean[total];
    }

    /**
     * Records the outcome of feature {@code index}.
     *
     * @param error may be null when the feature produced a result
     * @return false when the index had already been settled
     */
    public synchronized boolean record(int index, FeatureResult result, BatchError error) {
        if (settled[index]) return false;
        settled[index] = true;
        completed++;
        results.add(result);
        if (error != null) errors.add(error);
        return true;
    }

    public synchronized boolean isSettled(int index) { return settled[index]; }
    public synchronized int     getCompleted()       { return completed; }
    public int                  getTotal()           { return total; }

    /** Fraction of features settled, 1.0 for an empty batch. */
    public synchronized double getProgress() {
        return total == 0 ? 1.0 : (double) completed / total;
    }

    public Duration getElapsed() {
        return Duration.ofNanos(System.nanoTime() - startNanos);
    }

    public synchronized List<FeatureResult> collectResults() { return List.copyOf(results); }
    public synchronized List<BatchError>    collectErrors()  { return List.copyOf(errors); }
}
