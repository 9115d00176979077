package com.webspec.profiling;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ProfilingReport(
        long totalDurationMs,
        List<ScenarioMetrics> scenarios,
        List<StepTiming> slowestSteps,
        BottleneckAnalysis bottleneckAnalysis) {}
