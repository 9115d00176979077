package com.webspec.alerts;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Comparison applied as {@code metricValue <op> thresholdValue}. Equality uses
 * an absolute tolerance of {@link #EPSILON}.
 */
public enum AlertOperator {
    GREATER_THAN(">"),
    LESS_THAN("<"),
    EQUAL_TO("=="),
    NOT_EQUAL_TO("!=");

    static final double EPSILON = 1e-9;

    private final String symbol;

    AlertOperator(String symbol) {
        this.symbol = symbol;
    }

    public boolean test(double value, double threshold) {
        return switch (this) {
            case GREATER_THAN -> value > threshold;
            case LESS_THAN    -> value < threshold;
            case EQUAL_TO     -> Math.abs(value - threshold) < EPSILON;
            case NOT_EQUAL_TO -> Math.abs(value - threshold) >= EPSILON;
        };
    }

    @JsonValue
    public String symbol() {
        return symbol;
    }

    /** Accepts the symbol (">") or the name ("greater_than", "GreaterThan"). */
    @JsonCreator
    public static AlertOperator fromWireName(String value) {
        for (AlertOperator op : values()) {
            if (op.symbol.equals(value == null ? null : value.trim())) return op;
        }
        return WireNames.lookup(AlertOperator.class, value);
    }
}
