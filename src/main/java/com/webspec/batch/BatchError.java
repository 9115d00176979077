package com.webspec.batch;

import java.nio.file.Path;
import java.time.Instant;

/**
 * A feature that produced no result: its runner threw, returned nothing, or
 * was cancelled by the batch timeout.
 */
public record BatchError(Path path, String message, Instant timestamp) {

    public static BatchError of(Path path, String message) {
        return new BatchError(path, message, Instant.now());
    }
}
