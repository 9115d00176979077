package com.webspec.profiling;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.webspec.model.StepStatus;

/** One step's time and its share of the enclosing scenario's time, in percent. */
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record StepMetrics(String text, long durationMs, double percentage, StepStatus status) {}
