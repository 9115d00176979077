package com.webspec.hooks;

import com.webspec.context.ScenarioContext;
import com.webspec.core.WebSpecClient;
import com.webspec.core.WebSpecConfig;
import com.webspec.support.SimulatedBrowser;
import io.cucumber.java.After;
import io.cucumber.java.Before;
import io.cucumber.java.Scenario;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Paths;

/**
 * Per-scenario Cucumber hooks. Each scenario gets a fresh client and simulated
 * browser, so recorded timings and alerts never leak between scenarios.
 */
public class Hooks {

    private static final Logger log = LoggerFactory.getLogger(Hooks.class);

    private final ScenarioContext ctx;

    public Hooks(ScenarioContext ctx) {
        this.ctx = ctx;
    }

    @Before
    public void setUpScenario(Scenario scenario) {
        log.info("--- Scenario START: {} ---", scenario.getName());

        WebSpecConfig config = WebSpecConfig.builder()
            .parallel(false)
            .reportDir(Paths.get("target/webspec-reports/cucumber"))
            .build();
        SimulatedBrowser browser = new SimulatedBrowser();

        ctx.setBrowser(browser);
        ctx.setClient(new WebSpecClient(config, browser));
    }

    @After
    public void tearDownScenario(Scenario scenario) {
        if (ctx.getLastResult() != null) {
            log.info("Hooks: last feature run -> {}", ctx.getLastResult());
        }
        if (!ctx.getAlerts().isEmpty()) {
            log.info("Hooks: {} alert(s) raised", ctx.getAlerts().size());
        }
        log.info("--- Scenario END: {} [{}] ---", scenario.getName(), scenario.getStatus());
    }
}
