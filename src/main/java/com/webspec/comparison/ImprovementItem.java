package com.webspec.comparison;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/** A scenario or step that got faster; the value is in milliseconds saved. */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ImprovementItem(
        String description,
        String scenarioName,
        String stepText,
        double improvementValue,
        String improvementUnit) {
}
