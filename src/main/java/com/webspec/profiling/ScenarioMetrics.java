package com.webspec.profiling;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ScenarioMetrics(
        String name,
        long durationMs,
        int stepCount,
        boolean passed,
        List<StepMetrics> steps,
        StepTiming slowestStep) {}
