package com.webspec.executor;

import org.openqa.selenium.WebDriver;

import java.util.List;

/**
 * Passed to every {@link StepHandler} when it is invoked.
 *
 * Carries the WebDriver to act upon (may be null when no browser is attached),
 * the matched step with its captured parameters, and the scenario's
 * {@link ValueStore}.
 */
public class StepContext {

    private final WebDriver      driver;
    private final StepInvocation invocation;

    public StepContext(WebDriver driver, StepInvocation invocation) {
        this.driver     = driver;
        this.invocation = invocation;
    }

    public WebDriver    getDriver()     { return driver; }
    public boolean      hasDriver()     { return driver != null; }
    public String       getIdentifier() { return invocation.identifier(); }
    public String       getStepText()   { return invocation.text(); }
    public List<String> getParameters() { return invocation.parameters(); }
    public ValueStore   getValues()     { return invocation.values(); }

    /** Returns the captured parameter at {@code index}, or {@code fallback}. */
    public String param(int index, String fallback) {
        List<String> params = invocation.parameters();
        return index < params.size() ? params.get(index) : fallback;
    }

    /** Parses the captured parameter at {@code index} as an int, or returns {@code fallback}. */
    public int intParam(int index, int fallback) {
        String raw = param(index, null);
        if (raw == null) return fallback;
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            return fallback;
        }
    }
}
