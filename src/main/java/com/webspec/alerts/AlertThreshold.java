package com.webspec.alerts;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One rule: {@code metric operator value} raises an alert of {@code severity}.
 * For {@link AlertMetric#CUSTOM} the metric is looked up by {@code customKey}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public class AlertThreshold {

    private String        name;
    private AlertMetric   metric;
    @JsonProperty("custom_key")
    private String        customKey;
    private AlertOperator operator = AlertOperator.GREATER_THAN;
    private double        value;
    private AlertSeverity severity = AlertSeverity.WARNING;
    private String        message;

    public AlertThreshold() {}

    public AlertThreshold(String name, AlertMetric metric, AlertOperator operator, double value,
                          AlertSeverity severity, String message) {
        this.name     = name;
        this.metric   = metric;
        this.operator = operator;
        this.value    = value;
        this.severity = severity;
        this.message  = message;
    }

    public static AlertThreshold custom(String name, String key, AlertOperator operator, double value,
                                        AlertSeverity severity, String message) {
        AlertThreshold t = new AlertThreshold(name, AlertMetric.CUSTOM, operator, value, severity, message);
        t.setCustomKey(key);
        return t;
    }

    // ── Getters ───────────────────────────────────────────────────────────────

    public String        getName()      { return name; }
    public AlertMetric   getMetric()    { return metric; }
    public String        getCustomKey() { return customKey; }
    public AlertOperator getOperator()  { return operator; }
    public double        getValue()     { return value; }
    public AlertSeverity getSeverity()  { return severity; }
    public String        getMessage()   { return message; }

    // ── Setters ───────────────────────────────────────────────────────────────

    public void setName(String name)                { this.name = name; }
    public void setMetric(AlertMetric metric)        { this.metric = metric; }
    public void setCustomKey(String customKey)       { this.customKey = customKey; }
    public void setOperator(AlertOperator operator)  { this.operator = operator; }
    public void setValue(double value)               { this.value = value; }
    public void setSeverity(AlertSeverity severity)  { this.severity = severity; }
    public void setMessage(String message)           { this.message = message; }

    /** Metric label used in alerts, e.g. "scenario_duration_ms" or "custom:heap". */
    public String metricLabel() {
        if (metric == null) return "unknown";
        return metric == AlertMetric.CUSTOM ? "custom:" + customKey : metric.wireName();
    }

    @Override
    public String toString() {
        return String.format("AlertThreshold{%s: %s %s %s -> %s}",
            name, metricLabel(), operator != null ? operator.symbol() : "?", value, severity);
    }
}
