package com.webspec.comparison;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.webspec.model.StepStatus;

/**
 * One scenario compared by name. For {@link ChangeType#NEW} the previous status
 * is null and the previous duration 0; for {@link ChangeType#REMOVED} the same
 * holds for the current side.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record ScenarioChange(
        String scenarioName,
        StepStatus previousStatus,
        StepStatus currentStatus,
        long previousDurationMs,
        long currentDurationMs,
        ChangeType changeType) {
}
