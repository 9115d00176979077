package com.webspec.alerts;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.webspec.util.JsonSupport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Holds named {@link AlertConfig}s and evaluates all of them against a monitor.
 *
 * Config files are a YAML (.yaml/.yml) or JSON list of configs:
 * <pre>
 * - name: ci
 *   thresholds:
 *     - name: slow_scenario
 *       metric: scenario_duration_ms
 *       operator: "&gt;"
 *       value: 20000
 *       severity: warning
 * </pre>
 */
public class AlertManager {

    private static final Logger log = LoggerFactory.getLogger(AlertManager.class);

    private final List<AlertConfig> configs = new ArrayList<>();

    public AlertManager() {}

    public AlertManager(List<AlertConfig> configs) {
        this.configs.addAll(configs);
    }

    /** A manager holding only {@link AlertConfig#defaults()}. */
    public static AlertManager withDefaults() {
        return new AlertManager(List.of(AlertConfig.defaults()));
    }

    /**
     * Loads configs from {@code path}.
     *
     * @throws AlertConfigException if the file cannot be read or does not hold a list of configs
     */
    public static AlertManager fromConfigFile(Path path) {
        ObjectMapper mapper = JsonSupport.forPath(path);
        try {
            String content = Files.readString(path);
            List<AlertConfig> loaded = mapper.readValue(content,
                mapper.getTypeFactory().constructCollectionType(List.class, AlertConfig.class));
            if (loaded == null) {
                throw new AlertConfigException("Alert config " + path + " is empty", null);
            }
            for (int i = 0; i < loaded.size(); i++) {
                checkConfig(path, i, loaded.get(i));
            }
            log.info("AlertManager: loaded {} config(s) from {}", loaded.size(), path);
            return new AlertManager(loaded);
        } catch (IOException | IllegalArgumentException e) {
            throw new AlertConfigException("Failed to load alert config " + path + ": " + e.getMessage(), e);
        }
    }

    // ── Load checks ───────────────────────────────────────────────────────────

    private static void checkConfig(Path path, int index, AlertConfig config) {
        if (config == null) {
            throw malformed(path, "config #" + (index + 1) + " is empty");
        }
        String label = config.getName() != null ? "'" + config.getName() + "'" : "#" + (index + 1);
        List<AlertThreshold> thresholds = config.getThresholds();
        for (int i = 0; i < thresholds.size(); i++) {
            AlertThreshold t = thresholds.get(i);
            String where = "config " + label + " threshold #" + (i + 1);
            if (t == null)                 throw malformed(path, where + " is empty");
            if (t.getMetric() == null)     throw malformed(path, where + " has no metric");
            if (t.getOperator() == null)   throw malformed(path, where + " has no operator");
            if (t.getSeverity() == null)   throw malformed(path, where + " has no severity");
            if (t.getMetric() == AlertMetric.CUSTOM
                    && (t.getCustomKey() == null || t.getCustomKey().isBlank())) {
                throw malformed(path, where + " is a custom metric without custom_key");
            }
        }
    }

    private static AlertConfigException malformed(Path path, String detail) {
        return new AlertConfigException("Malformed alert config " + path + ": " + detail, null);
    }

    public void addConfig(AlertConfig config) {
        configs.add(config);
    }

    public List<AlertConfig> getConfigs() {
        return Collections.unmodifiableList(configs);
    }

    /** Alerts raised by every enabled config, in config order. */
    public List<PerformanceAlert> evaluate(PerformanceMonitor monitor) {
        List<PerformanceAlert> all = new ArrayList<>();
        for (AlertConfig config : configs) {
            all.addAll(monitor.evaluateThresholds(config));
        }
        if (!all.isEmpty()) {
            log.warn("AlertManager: {} alert(s) raised", all.size());
        }
        return all;
    }

    // ── Formatting ────────────────────────────────────────────────────────────

    /**
     * Renders alerts as "text", "json" or "yaml".
     *
     * @throws IllegalArgumentException for any other format
     */
    public static String formatAlerts(List<PerformanceAlert> alerts, String format) {
        String fmt = format == null ? "text" : format.toLowerCase(Locale.ROOT);
        try {
            return switch (fmt) {
                case "json" -> JsonSupport.json().writeValueAsString(Map.of("alerts", alerts));
                case "yaml" -> JsonSupport.yaml().writeValueAsString(Map.of("alerts", alerts));
                case "text" -> toText(alerts);
                default -> throw new IllegalArgumentException("Unsupported alert format: " + format);
            };
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialise alerts: " + e.getOriginalMessage(), e);
        }
    }

    static String toText(List<PerformanceAlert> alerts) {
        if (alerts.isEmpty()) {
            return "No performance alerts triggered";
        }
        int critical = 0, warning = 0, info = 0;
        StringBuilder sb = new StringBuilder("Performance alerts:\n");
        for (PerformanceAlert alert : alerts) {
            sb.append("  ").append(alert).append('\n');
            switch (alert.severity()) {
                case CRITICAL -> critical++;
                case WARNING  -> warning++;
                case INFO     -> info++;
            }
        }
        sb.append(String.format("%d alert(s): %d critical, %d warning, %d info",
            alerts.size(), critical, warning, info));
        return sb.toString();
    }
}
