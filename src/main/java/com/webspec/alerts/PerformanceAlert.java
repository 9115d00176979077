package com.webspec.alerts;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Instant;
import java.util.Locale;

/**
 * A threshold that was crossed. {@code feature}, {@code scenario} and
 * {@code step} name the slowest contributor where the monitor knows it.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public record PerformanceAlert(
        Instant timestamp,
        AlertSeverity severity,
        String thresholdName,
        String message,
        String metric,
        double value,
        double thresholdValue,
        String feature,
        String scenario,
        String step) {

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "[%s] %s: %s (value: %.2f, threshold: %.2f)",
            severity.name(), thresholdName, message, value, thresholdValue);
    }
}
