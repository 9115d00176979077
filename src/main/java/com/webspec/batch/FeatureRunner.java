package com.webspec.batch;

import com.webspec.model.ExecutionResult;

import java.nio.file.Path;

/**
 * Runs one feature file. Supplied by the caller of {@link BatchExecutor}; any
 * exception is recorded as a {@link BatchError} for that file only.
 */
@FunctionalInterface
public interface FeatureRunner {
    ExecutionResult run(Path featurePath) throws Exception;
}
