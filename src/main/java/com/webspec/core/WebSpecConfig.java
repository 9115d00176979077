package com.webspec.core;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Configuration for the web-spec engine.
 *
 * Load from environment variables or construct programmatically.
 *
 * Environment variables:
 *   WEBSPEC_PARALLEL             - Run batch features in parallel (default: true)
 *   WEBSPEC_MAX_WORKERS          - Worker threads for parallel batches (default: available processors)
 *   WEBSPEC_BATCH_TIMEOUT        - Seconds before unfinished parallel features are cancelled (default: 300)
 *   WEBSPEC_FEATURE_EXTENSION    - Extension of feature files during discovery (default: .feature)
 *   WEBSPEC_STEP_CATALOG_PATH    - JSON/YAML step catalog (optional; the bundled catalog is used otherwise)
 *   WEBSPEC_ALERT_CONFIG_PATH    - YAML/JSON list of alert configs (optional; default thresholds otherwise)
 *   WEBSPEC_WEBHOOK_CONFIG_PATH  - YAML/JSON list of webhook configs (optional; no webhooks otherwise)
 *   WEBSPEC_REPORT_DIR           - Directory for written reports (default: target/webspec-reports)
 */
public class WebSpecConfig {

    public static final int    DEFAULT_BATCH_TIMEOUT_SECONDS = 300;
    public static final String DEFAULT_FEATURE_EXTENSION     = ".feature";
    public static final Path   DEFAULT_REPORT_DIR            = Paths.get("target/webspec-reports");

    private final boolean parallel;
    private final int     maxWorkers;
    private final int     batchTimeoutSeconds;
    private final String  featureExtension;
    private final Path    stepCatalogPath;    // null = bundled catalog
    private final Path    alertConfigPath;    // null = default thresholds
    private final Path    webhookConfigPath;  // null = no webhooks
    private final Path    reportDir;

    private WebSpecConfig(Builder b) {
        this.parallel            = b.parallel;
        this.maxWorkers          = Math.max(1, b.maxWorkers);
        this.batchTimeoutSeconds = Math.max(1, b.batchTimeoutSeconds);
        this.featureExtension    = b.featureExtension;
        this.stepCatalogPath     = b.stepCatalogPath;
        this.alertConfigPath     = b.alertConfigPath;
        this.webhookConfigPath   = b.webhookConfigPath;
        this.reportDir           = b.reportDir;
    }

    // ── Static factories ──────────────────────────────────────────────────────

    public static WebSpecConfig defaults() {
        return builder().build();
    }

    public static WebSpecConfig fromEnvironment() {
        return builder()
            .parallel(boolEnvOrDefault("WEBSPEC_PARALLEL", true))
            .maxWorkers(intEnvOrDefault("WEBSPEC_MAX_WORKERS", defaultWorkers()))
            .batchTimeoutSeconds(intEnvOrDefault("WEBSPEC_BATCH_TIMEOUT", DEFAULT_BATCH_TIMEOUT_SECONDS))
            .featureExtension(envOrDefault("WEBSPEC_FEATURE_EXTENSION", DEFAULT_FEATURE_EXTENSION))
            .stepCatalogPath(pathEnvOrNull("WEBSPEC_STEP_CATALOG_PATH"))
            .alertConfigPath(pathEnvOrNull("WEBSPEC_ALERT_CONFIG_PATH"))
            .webhookConfigPath(pathEnvOrNull("WEBSPEC_WEBHOOK_CONFIG_PATH"))
            .reportDir(pathEnvOrDefault("WEBSPEC_REPORT_DIR", DEFAULT_REPORT_DIR))
            .build();
    }

    // ── Getters ───────────────────────────────────────────────────────────────

    public boolean isParallel()              { return parallel; }
    public int     getMaxWorkers()           { return maxWorkers; }
    public int     getBatchTimeoutSeconds()  { return batchTimeoutSeconds; }
    public String  getFeatureExtension()     { return featureExtension; }
    public Path    getStepCatalogPath()      { return stepCatalogPath; }
    public Path    getAlertConfigPath()      { return alertConfigPath; }
    public Path    getWebhookConfigPath()    { return webhookConfigPath; }
    public Path    getReportDir()            { return reportDir; }

    // ── Builder ───────────────────────────────────────────────────────────────

    public static Builder builder() { return new Builder(); }

    public static class Builder {
        private boolean parallel            = true;
        private int     maxWorkers          = defaultWorkers();
        private int     batchTimeoutSeconds = DEFAULT_BATCH_TIMEOUT_SECONDS;
        private String  featureExtension    = DEFAULT_FEATURE_EXTENSION;
        private Path    stepCatalogPath     = null;
        private Path    alertConfigPath     = null;
        private Path    webhookConfigPath   = null;
        private Path    reportDir           = DEFAULT_REPORT_DIR;

        public Builder parallel(boolean b)                { this.parallel = b; return this; }
        public Builder maxWorkers(int n)                  { this.maxWorkers = n; return this; }
        public Builder batchTimeoutSeconds(int s)         { this.batchTimeoutSeconds = s; return this; }
        public Builder featureExtension(String ext)       { this.featureExtension = ext; return this; }
        public Builder stepCatalogPath(Path path)         { this.stepCatalogPath = path; return this; }
        public Builder alertConfigPath(Path path)         { this.alertConfigPath = path; return this; }
        public Builder webhookConfigPath(Path path)       { this.webhookConfigPath = path; return this; }
        public Builder reportDir(Path path)               { this.reportDir = path; return this; }

        public WebSpecConfig build() {
            if (featureExtension == null || featureExtension.isBlank()) {
                throw new IllegalStateException("featureExtension must not be blank");
            }
            return new WebSpecConfig(this);
        }
    }

    // ── Env helpers ───────────────────────────────────────────────────────────

    private static int defaultWorkers() {
        return Runtime.getRuntime().availableProcessors();
    }

    private static String envOrDefault(String key, String defaultValue) {
        String val = System.getenv(key);
        return (val != null && !val.isBlank()) ? val.trim() : defaultValue;
    }

    private static int intEnvOrDefault(String key, int defaultValue) {
        String val = System.getenv(key);
        if (val == null || val.isBlank()) return defaultValue;
        try {
            return Integer.parseInt(val.trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    private static boolean boolEnvOrDefault(String key, boolean defaultValue) {
        String val = System.getenv(key);
        if (val == null || val.isBlank()) return defaultValue;
        return Boolean.parseBoolean(val.trim());
    }

    private static Path pathEnvOrNull(String key) {
        String val = System.getenv(key);
        return (val != null && !val.isBlank()) ? Paths.get(val.trim()) : null;
    }

    private static Path pathEnvOrDefault(String key, Path defaultValue) {
        Path p = pathEnvOrNull(key);
        return p != null ? p : defaultValue;
    }

    @Override
    public String toString() {
        return String.format(
            "WebSpecConfig{parallel=%s, maxWorkers=%d, batchTimeout=%ds, extension=%s, catalog=%s, alerts=%s, webhooks=%s}",
            parallel, maxWorkers, batchTimeoutSeconds, featureExtension,
            stepCatalogPath != null ? stepCatalogPath : "bundled",
            alertConfigPath != null ? alertConfigPath : "defaults",
            webhookConfigPath != null ? webhookConfigPath : "none");
    }
}
