package com.webspec.profiling;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/** Time spent in all executions of one step text. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record StepTiming(String text, long totalMs, int calls, long averageMs) {

    static StepTiming single(String text, long durationMs) {
        return new StepTiming(text, durationMs, 1, durationMs);
    }

    StepTiming plus(long durationMs) {
        long total = totalMs + durationMs;
        return new StepTiming(text, total, calls + 1, total / (calls + 1));
    }
}
