package com.webspec.executor.handlers;

import com.webspec.executor.HandlesStep;
import com.webspec.executor.StepContext;
import com.webspec.executor.StepOutcome;
import com.webspec.registry.StepIds;
import org.openqa.selenium.By;
import org.openqa.selenium.JavascriptExecutor;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebElement;

// ── scroll_to_bottom ──────────────────────────────────────────────────────────

@HandlesStep(StepIds.SCROLL_TO_BOTTOM)
class ScrollToBottomHandler extends BrowserStepHandler {
    @Override
    protected StepOutcome run(StepContext ctx, WebDriver driver) {
        ((JavascriptExecutor) driver).executeScript("window.scrollTo(0, document.body.scrollHeight);");
        return StepOutcome.passed("Scrolled to bottom of page");
    }
}

// ── scroll_to_top ─────────────────────────────────────────────────────────────

@HandlesStep(StepIds.SCROLL_TO_TOP)
class ScrollToTopHandler extends BrowserStepHandler {
    @Override
    protected StepOutcome run(StepContext ctx, WebDriver driver) {
        ((JavascriptExecutor) driver).executeScript("window.scrollTo(0, 0);");
        return StepOutcome.passed("Scrolled to top of page");
    }
}

// ── scroll_to_element ─────────────────────────────────────────────────────────

@HandlesStep(StepIds.SCROLL_TO_ELEMENT)
class ScrollToElementHandler extends BrowserStepHandler {
    @Override
    protected StepOutcome run(StepContext ctx, WebDriver driver) {
        String selector = ctx.param(0, "");
        WebElement el = driver.findElement(By.cssSelector(selector));
        ((JavascriptExecutor) driver)
            .executeScript("arguments[0].scrollIntoView({behavior:'instant',block:'center'});", el);
        return StepOutcome.passed("Scrolled to element: " + selector);
    }

    @Override
    protected String failurePrefix(StepContext ctx) {
        return "Could not scroll to '" + ctx.param(0, "") + "'";
    }
}
