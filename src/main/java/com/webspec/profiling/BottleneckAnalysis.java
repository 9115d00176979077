package com.webspec.profiling;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.util.List;

/**
 * @param topBottleneck text of the step with the largest total time, or null
 * @param slowScenario  name of the longest scenario, or null
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record BottleneckAnalysis(String topBottleneck, List<String> suggestions, String slowScenario) {}
