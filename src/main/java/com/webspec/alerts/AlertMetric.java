package com.webspec.alerts;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Metrics a threshold can watch. Durations are means over everything recorded;
 * {@link #TOTAL_DURATION_MS} and the rates use the time since the monitor was
 * created. {@link #CUSTOM} reads a value set with
 * {@link PerformanceMonitor#setMetric(String, double)}.
 */
public enum AlertMetric {
    SCENARIO_DURATION_MS,
    STEP_DURATION_MS,
    FAILURE_RATE_PERCENT,
    TOTAL_DURATION_MS,
    SCENARIOS_PER_SECOND,
    STEPS_PER_SECOND,
    MEMORY_USAGE_MB,
    CUSTOM;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Accepts "scenario_duration_ms" as well as "ScenarioDurationMs". */
    @JsonCreator
    public static AlertMetric fromWireName(String value) {
        return WireNames.lookup(AlertMetric.class, value);
    }
}
