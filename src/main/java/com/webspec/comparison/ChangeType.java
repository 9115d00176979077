package com.webspec.comparison;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** How a scenario differs between baseline and current run. */
public enum ChangeType {
    STATUS_CHANGED,
    DURATION_IMPROVED,
    DURATION_REGRESSED,
    UNCHANGED,
    REMOVED,
    NEW;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
