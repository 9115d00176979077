package com.webspec.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Lifecycle status shared by steps, scenarios and whole executions.
 * Serialized in lowercase ("passed", "failed", ...).
 */
public enum StepStatus {
    PENDING,
    PASSED,
    FAILED,
    SKIPPED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static StepStatus fromWireName(String value) {
        if (value == null || value.isBlank()) return PENDING;
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
