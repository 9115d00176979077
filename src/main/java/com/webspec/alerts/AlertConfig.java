package com.webspec.alerts;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * A named set of thresholds. A disabled config never produces alerts.
 *
 * <p>{@link #defaults()} watches for slow scenarios (warning above 30s, critical
 * above 60s), slow steps (warning above 10s) and a failure rate above 10%.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class AlertConfig {

    private String                  name;
    private boolean                 enabled       = true;
    private List<AlertThreshold>    thresholds    = new ArrayList<>();
    private List<AlertNotification> notifications = new ArrayList<>();

    public AlertConfig() {}

    public AlertConfig(String name, List<AlertThreshold> thresholds) {
        this.name       = name;
        this.thresholds = new ArrayList<>(thresholds);
    }

    public static AlertConfig defaults() {
        return new AlertConfig("default", List.of(
            new AlertThreshold("slow_scenario", AlertMetric.SCENARIO_DURATION_MS,
                AlertOperator.GREATER_THAN, 30_000, AlertSeverity.WARNING,
                "Average scenario duration exceeded 30s"),
            new AlertThreshold("very_slow_scenario", AlertMetric.SCENARIO_DURATION_MS,
                AlertOperator.GREATER_THAN, 60_000, AlertSeverity.CRITICAL,
                "Average scenario duration exceeded 60s"),
            new AlertThreshold("slow_step", AlertMetric.STEP_DURATION_MS,
                AlertOperator.GREATER_THAN, 10_000, AlertSeverity.WARNING,
                "Average step duration exceeded 10s"),
            new AlertThreshold("high_failure_rate", AlertMetric.FAILURE_RATE_PERCENT,
                AlertOperator.GREATER_THAN, 10, AlertSeverity.WARNING,
                "Scenario failure rate exceeded 10%")));
    }

    public String                  getName()          { return name; }
    public boolean                 isEnabled()        { return enabled; }
    public List<AlertThreshold>    getThresholds()    { return thresholds; }
    public List<AlertNotification> getNotifications() { return notifications; }

    public void setName(String name)                                  { this.name = name; }
    public void setEnabled(boolean enabled)                           { this.enabled = enabled; }
    public void setThresholds(List<AlertThreshold> thresholds)        { this.thresholds = thresholds != null ? thresholds : new ArrayList<>(); }
    public void setNotifications(List<AlertNotification> notifications) { this.notifications = notifications != null ? notifications : new ArrayList<>(); }
}
