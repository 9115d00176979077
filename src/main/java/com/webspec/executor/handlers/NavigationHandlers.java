package com.webspec.executor.handlers;

import com.webspec.executor.HandlesStep;
import com.webspec.executor.StepContext;
import com.webspec.executor.StepOutcome;
import com.webspec.registry.StepIds;
import org.openqa.selenium.JavascriptExecutor;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.support.ui.WebDriverWait;

// ── navigate_to ───────────────────────────────────────────────────────────────

@HandlesStep(StepIds.NAVIGATE_TO)
class NavigateToHandler extends BrowserStepHandler {
    @Override
    protected StepOutcome run(StepContext ctx, WebDriver driver) {
        String url = ctx.param(0, null);
        if (url == null)
            return StepOutcome.failed("No URL captured for navigate_to");
        driver.get(url);
        return StepOutcome.passed("Navigated to: " + url);
    }

    @Override
    protected String failurePrefix(StepContext ctx) {
        return "Could not navigate to '" + ctx.param(0, "") + "'";
    }
}

// ── go_back ───────────────────────────────────────────────────────────────────

@HandlesStep(StepIds.GO_BACK)
class GoBackHandler extends BrowserStepHandler {
    @Override
    protected StepOutcome run(StepContext ctx, WebDriver driver) {
        driver.navigate().back();
        return StepOutcome.passed("Navigated back to: " + driver.getCurrentUrl());
    }
}

// ── go_forward ────────────────────────────────────────────────────────────────

@HandlesStep(StepIds.GO_FORWARD)
class GoForwardHandler extends BrowserStepHandler {
    @Override
    protected StepOutcome run(StepContext ctx, WebDriver driver) {
        driver.navigate().forward();
        return StepOutcome.passed("Navigated forward to: " + driver.getCurrentUrl());
    }
}

// ── refresh_page ──────────────────────────────────────────────────────────────

@HandlesStep(StepIds.REFRESH_PAGE)
class RefreshPageHandler extends BrowserStepHandler {
    @Override
    protected StepOutcome run(StepContext ctx, WebDriver driver) {
        String urlBefore = driver.getCurrentUrl();
        driver.navigate().refresh();
        return StepOutcome.passed("Page refreshed: " + urlBefore);
    }
}

// ── wait_for_page_load ────────────────────────────────────────────────────────

@HandlesStep(StepIds.WAIT_FOR_PAGE_LOAD)
class WaitForPageLoadHandler extends BrowserStepHandler {
    @Override
    protected StepOutcome run(StepContext ctx, WebDriver driver) {
        new WebDriverWait(driver, DEFAULT_TIMEOUT).until(d ->
            "complete".equals(((JavascriptExecutor) d).executeScript("return document.readyState")));
        return StepOutcome.passed("Page loaded: " + driver.getCurrentUrl());
    }
}
