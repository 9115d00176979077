package com.webspec.batch;

import com.webspec.core.WebSpecConfig;
import com.webspec.model.ExecutionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs many feature files and aggregates their outcomes.
 *
 * ## Execution model
 *
 *   - Parallel mode (config enabled and more than one path): a fixed pool of
 *     {@code maxWorkers} threads. Features still running when the batch timeout
 *     elapses are cancelled by interrupt and recorded as timed out.
 *   - Otherwise the features run one after another on the calling thread, in
 *     list order, without a timeout.
 *   - A failing runner never stops the batch. Its file gets a {@link BatchError}
 *     and a failed {@link FeatureResult} with zero scenario counts.
 *
 * Aggregate counters are computed after every feature has been settled.
 */
public class BatchExecutor {

    private static final Logger log = LoggerFactory.getLogger(BatchExecutor.class);

    private final WebSpecConfig    config;
    private volatile BatchProgress progress;

    public BatchExecutor(WebSpecConfig config) {
        this.config = config;
    }

    // ── Primary API ───────────────────────────────────────────────────────────

    public BatchResult execute(List<Path> paths, FeatureRunner runner) {
        int total = paths.size();
        BatchProgress current = new BatchProgress(total);
        this.progress = current;
        boolean parallel = config.isParallel() && total > 1;

        log.info("BatchExecutor: running {} feature(s) {}", total,
            parallel ? "in parallel on " + Math.min(config.getMaxWorkers(), total) + " worker(s)" : "sequentially");

        if (parallel) {
            runParallel(paths, runner, current);
        } else {
            for (int i = 0; i < total; i++) {
                runFeature(i, paths.get(i), runner, current);
            }
            for (int i = 0; i < total; i++) {
                if (!current.isSettled(i)) {
                    recordUnfinished(i, paths.get(i), current, "Feature did not complete");
                }
            }
        }

        long durationMs = current.getElapsed().toMillis();
        BatchResult result = BatchResult.aggregate(total, current.collectResults(), current.collectErrors(), durationMs);
        log.info("BatchExecutor: complete - {}", result);
        return result;
    }

    /** Progress of the batch currently (or last) executing, or null before the first run. */
    public BatchProgress getProgress() {
        return progress;
    }

    // ── Private helpers ───────────────────────────────────────────────────────

    private void runParallel(List<Path> paths, FeatureRunner runner, BatchProgress current) {
        int workers = Math.min(config.getMaxWorkers(), paths.size());
        ExecutorService pool = Executors.newFixedThreadPool(workers, namedThreads());

        List<Callable<Void>> tasks = new ArrayList<>();
        for (int i = 0; i < paths.size(); i++) {
            int  index = i;
            Path path  = paths.get(i);
            tasks.add(() -> {
                runFeature(index, path, runner, current);
                return null;
            });
        }

        try {
            List<Future<Void>> futures = pool.invokeAll(tasks, config.getBatchTimeoutSeconds(), TimeUnit.SECONDS);
            for (int i = 0; i < futures.size(); i++) {
                if (futures.get(i).isCancelled()) {
                    recordUnfinished(i, paths.get(i), current,
                        "Timed out after " + config.getBatchTimeoutSeconds() + "s");
                } else if (!current.isSettled(i)) {
                    recordUnfinished(i, paths.get(i), current, "Feature did not complete");
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("BatchExecutor: interrupted - unfinished features are recorded as errors");
            for (int i = 0; i < paths.size(); i++) {
                recordUnfinished(i, paths.get(i), current, "Batch interrupted");
            }
        } finally {
            pool.shutdownNow();
        }
    }

    private void runFeature(int index, Path path, FeatureRunner runner, BatchProgress current) {
        long start = System.nanoTime();
        try {
            ExecutionResult result = runner.run(path);
            long durationMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
            if (result == null) {
                current.record(index, FeatureResult.errored(path, durationMs),
                    BatchError.of(path, "Runner returned no result"));
                return;
            }
            FeatureResult featureResult = FeatureResult.completed(path, result, durationMs);
            if (current.record(index, featureResult, null)) {
                log.info("BatchExecutor: [{}/{}] {}", current.getCompleted(), current.getTotal(), featureResult);
            }
        } catch (InterruptedException e) {
            // cancelled by the batch timeout; the coordinating thread records the outcome
            Thread.currentThread().interrupt();
            log.debug("BatchExecutor: {} interrupted", path);
        } catch (Exception e) {
            long durationMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            if (current.record(index, FeatureResult.errored(path, durationMs), BatchError.of(path, message))) {
                log.warn("BatchExecutor: [{}/{}] {} failed: {}",
                    current.getCompleted(), current.getTotal(), path, message);
            }
        }
    }

    private void recordUnfinished(int index, Path path, BatchProgress current, String reason) {
        if (current.record(index, FeatureResult.errored(path, 0), BatchError.of(path, reason))) {
            log.warn("BatchExecutor: {} - {}", path, reason);
        }
    }

    private static ThreadFactory namedThreads() {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, "webspec-batch-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
