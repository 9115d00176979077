package com.webspec.comparison;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** Overall verdict. Any regression wins over any improvement. */
public enum ComparisonStatus {
    REGRESSION,
    IMPROVEMENT,
    UNCHANGED;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
