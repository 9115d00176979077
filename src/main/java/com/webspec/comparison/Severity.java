package com.webspec.comparison;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Severity of a regression. {@code CRITICAL} is reserved for a scenario going
 * from passed to failed; duration regressions are {@code HIGH} above 50% and
 * {@code MEDIUM} otherwise.
 */
public enum Severity {
    CRITICAL,
    HIGH,
    MEDIUM;

    static Severity forDurationIncrease(double percent) {
        return percent > ComparisonEngine.HIGH_SEVERITY_PERCENT ? HIGH : MEDIUM;
    }

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
