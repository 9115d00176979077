package com.webspec.notify;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum WebhookEvent {
    START,
    COMPLETION,
    FAILURE,
    SUCCESS,
    REGRESSION,
    IMPROVEMENT;

    @JsonValue
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Case-insensitive, so "completion" and "Completion" both work in config files. */
    @JsonCreator
    public static WebhookEvent fromWireName(String value) {
        if (value != null) {
            for (WebhookEvent event : values()) {
                if (event.name().equalsIgnoreCase(value.trim())) return event;
            }
        }
        throw new IllegalArgumentException("Unknown webhook event: '" + value + "'");
    }
}
