package com.webspec.notify;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.webspec.comparison.ComparisonResult;
import com.webspec.comparison.ComparisonStatus;
import com.webspec.model.ExecutionResult;
import com.webspec.model.ExecutionSummary;
import com.webspec.model.StepStatus;

import java.time.Instant;

/** JSON body posted to webhooks. {@code comparison} is only set for regression/improvement events. */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record WebhookPayload(
        WebhookEvent event,
        Instant timestamp,
        String feature,
        StepStatus status,
        Summary summary,
        Comparison comparison) {

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record Summary(int totalScenarios, int passedScenarios, int failedScenarios,
                          int totalSteps, long durationMs) {}

    @JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
    public record Comparison(ComparisonStatus status, StepStatus baselineStatus, StepStatus currentStatus,
                             int regressions, int improvements) {}

    public static WebhookPayload of(WebhookEvent event, ExecutionResult result, Instant timestamp) {
        ExecutionSummary s = result.getSummary();
        return new WebhookPayload(event, timestamp,
            result.getFeature() != null ? result.getFeature().getName() : null,
            result.getStatus(),
            new Summary(s.getTotalScenarios(), s.getPassedScenarios(), s.getFailedScenarios(),
                s.getTotalSteps(), result.getDurationMs()),
            null);
    }

    public WebhookPayload withComparison(ExecutionResult baseline, ComparisonResult comparison) {
        return new WebhookPayload(event, timestamp, feature, status, summary,
            new Comparison(comparison.status(), baseline.getStatus(), status,
                comparison.regressions().size(), comparison.improvements().size()));
    }
}
