package com.webspec.core;

import com.webspec.alerts.AlertManager;
import com.webspec.alerts.PerformanceAlert;
import com.webspec.alerts.PerformanceMonitor;
import com.webspec.batch.BatchExecutor;
import com.webspec.batch.BatchResult;
import com.webspec.batch.FeatureDiscovery;
import com.webspec.batch.FeatureRunner;
import com.webspec.catalog.CatalogConsistencyChecker;
import com.webspec.catalog.StepCatalog;
import com.webspec.catalog.StepCatalogLoader;
import com.webspec.catalog.StepValidator;
import com.webspec.catalog.ValidationResult;
import com.webspec.comparison.ComparisonEngine;
import com.webspec.comparison.ComparisonResult;
import com.webspec.executor.AutomationBackend;
import com.webspec.executor.FeatureDefinition;
import com.webspec.executor.FeatureExecutor;
import com.webspec.executor.HandlerDispatchBackend;
import com.webspec.executor.StepHandlerRegistry;
import com.webspec.model.ExecutionResult;
import com.webspec.model.FeatureInfo;
import com.webspec.notify.WebhookNotifier;
import com.webspec.profiling.ExecutionProfiler;
import com.webspec.profiling.ProfilingReport;
import com.webspec.registry.CatalogValidation;
import com.webspec.registry.DefaultStepPatterns;
import com.webspec.registry.StepPatternRegistry;
import com.webspec.report.ExecutionReportReader;
import com.webspec.report.ExecutionReportWriter;
import com.webspec.report.ReportParseException;
import org.openqa.selenium.WebDriver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;

/**
 * WebSpecClient: the single entry point for running and analysing features.
 *
 * ## Wiring
 * Built from a {@link WebSpecConfig}:
 *   - the default step pattern registry and the step catalog (bundled, or the
 *     file at {@code stepCatalogPath}), checked against each other at start-up
 *   - an {@link AutomationBackend}: either supplied, or the Selenium handler
 *     table driving the given WebDriver
 *   - alert configs from {@code alertConfigPath}, or the default thresholds
 *   - webhooks from {@code webhookConfigPath}, or none
 *
 * Every feature run through {@link #run(FeatureDefinition)} is recorded by the
 * session's {@link PerformanceMonitor} and announced to subscribed webhooks.
 * The client never opens or closes a browser.
 */
public class WebSpecClient {

    private static final Logger log = LoggerFactory.getLogger(WebSpecClient.class);

    private final WebSpecConfig       config;
    private final StepPatternRegistry patterns;
    private final StepCatalog         catalog;
    private final StepValidator       validator;
    private final FeatureExecutor     featureExecutor;
    private final BatchExecutor       batchExecutor;
    private final ComparisonEngine    comparisonEngine;
    private final AlertManager        alertManager;
    private final PerformanceMonitor  monitor;
    private final WebhookNotifier     notifier;

    /** A client without a browser; browser steps fail with a "No browser attached" error. */
    public WebSpecClient(WebSpecConfig config) {
        this(config, (WebDriver) null);
    }

    public WebSpecClient(WebSpecConfig config, WebDriver driver) {
        this(config, new HandlerDispatchBackend(new StepHandlerRegistry(), driver));
    }

    public WebSpecClient(WebSpecConfig config, AutomationBackend backend) {
        this.config           = config;
        this.patterns         = DefaultStepPatterns.build();
        this.catalog          = loadCatalog(config);
        this.validator        = new StepValidator(catalog);
        this.featureExecutor  = new FeatureExecutor(patterns, backend);
        this.batchExecutor    = new BatchExecutor(config);
        this.comparisonEngine = new ComparisonEngine();
        this.alertManager     = config.getAlertConfigPath() != null
            ? AlertManager.fromConfigFile(config.getAlertConfigPath())
            : AlertManager.withDefaults();
        this.monitor          = new PerformanceMonitor();
        this.notifier         = loadWebhooks(config);

        checkConsistency();
        log.info("WebSpecClient: initialised - {} pattern(s), {} catalog step(s), {}",
            patterns.size(), catalog.totalSteps(), config);
    }

    // ── Execution ─────────────────────────────────────────────────────────────

    /** Runs one feature, records it for alerting and notifies webhooks. */
    public ExecutionResult run(FeatureDefinition feature) {
        notifier.notifyStart(new ExecutionResult(
            new FeatureInfo(feature.name(), feature.file(), feature.description())));
        ExecutionResult result = featureExecutor.execute(feature);
        monitor.recordExecution(result);
        notifier.notifyFinished(result);
        return result;
    }

    public BatchResult runBatch(List<Path> paths, FeatureRunner runner) {
        return batchExecutor.execute(paths, runner);
    }

    /** Discovers feature files under {@code root} with the configured extension and runs them. */
    public BatchResult runBatch(Path root, FeatureRunner runner) throws IOException {
        List<Path> paths = FeatureDiscovery.discover(root, config.getFeatureExtension());
        log.info("WebSpecClient: discovered {} feature file(s) under {}", paths.size(), root);
        return runBatch(paths, runner);
    }

    // ── Validation ────────────────────────────────────────────────────────────

    public ValidationResult validate(String featureContent) {
        return validator.validateFeatureContent(featureContent);
    }

    // ── Analysis ──────────────────────────────────────────────────────────────

    public ComparisonResult compare(ExecutionResult baseline, ExecutionResult current) {
        ComparisonResult comparison = comparisonEngine.compare(baseline, current);
        notifier.notifyComparison(baseline, current, comparison);
        return comparison;
    }

    /** Compares two saved reports. Unreadable reports fail this call only. */
    public ComparisonResult compare(Path baselineReport, Path currentReport) throws ReportParseException {
        return compare(ExecutionReportReader.read(baselineReport), ExecutionReportReader.read(currentReport));
    }

    /** Evaluates every alert config against everything run through this client so far. */
    public List<PerformanceAlert> evaluateAlerts() {
        return alertManager.evaluate(monitor);
    }

    public ProfilingReport profile(ExecutionResult result) {
        return ExecutionProfiler.analyze(result);
    }

    /** Writes {@code result} as JSON into the configured report directory and returns the file. */
    public Path writeReport(ExecutionResult result) throws IOException {
        Path target = config.getReportDir().resolve(reportFileName(result) + ".json");
        ExecutionReportWriter.write(result, target);
        return target;
    }

    // ── Accessors ─────────────────────────────────────────────────────────────

    public WebSpecConfig       getConfig()          { return config; }
    public StepPatternRegistry getPatterns()        { return patterns; }
    public StepCatalog         getCatalog()         { return catalog; }
    public AlertManager        getAlertManager()    { return alertManager; }
    public PerformanceMonitor  getMonitor()         { return monitor; }
    public WebhookNotifier     getNotifier()        { return notifier; }
    public BatchExecutor       getBatchExecutor()   { return batchExecutor; }

    // ── Private helpers ───────────────────────────────────────────────────────

    private void checkConsistency() {
        CatalogValidation validation = patterns.validate();
        validation.getWarnings().forEach(w -> log.warn("WebSpecClient: {}", w.describe()));

        List<CatalogConsistencyChecker.Inconsistency> problems = CatalogConsistencyChecker.check(patterns, catalog);
        problems.forEach(p -> log.warn("WebSpecClient: catalog/registry mismatch for '{}': {}",
            p.identifier(), p.reason()));
    }

    private static StepCatalog loadCatalog(WebSpecConfig config) {
        if (config.getStepCatalogPath() == null) {
            return StepCatalogLoader.loadDefault();
        }
        try {
            return StepCatalogLoader.load(config.getStepCatalogPath());
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot load step catalog " + config.getStepCatalogPath(), e);
        }
    }

    private static WebhookNotifier loadWebhooks(WebSpecConfig config) {
        Path path = config.getWebhookConfigPath();
        if (path == null || !Files.exists(path)) {
            if (path != null) log.warn("WebSpecClient: webhook config {} not found - webhooks disabled", path);
            return new WebhookNotifier(List.of());
        }
        try {
            return WebhookNotifier.fromConfigFile(path);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot load webhook config " + path, e);
        }
    }

    private static String reportFileName(ExecutionResult result) {
        String name = result.getFeature() != null ? result.getFeature().getName() : "";
        String slug = name.trim().toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9]+", "-").replaceAll("(^-|-$)", "");
        return slug.isEmpty() ? "feature" : slug;
    }
}
