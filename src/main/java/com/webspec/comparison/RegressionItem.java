package com.webspec.comparison;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

/**
 * A scenario or step that got worse. Exactly one of {@code scenarioName} and
 * {@code stepText} is set. The impact is in {@code impactUnit} ("count" for a
 * status change, "ms" for durations).
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record RegressionItem(
        String description,
        Severity severity,
        String scenarioName,
        String stepText,
        double impactValue,
        String impactUnit) {
}
