package com.webspec.executor.handlers;

import com.webspec.executor.HandlesStep;
import com.webspec.executor.StepContext;
import com.webspec.executor.StepHandler;
import com.webspec.executor.StepOutcome;
import com.webspec.registry.StepIds;
import org.openqa.selenium.By;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.support.ui.ExpectedConditions;
import org.openqa.selenium.support.ui.WebDriverWait;

import java.time.Duration;

// ── wait_seconds / wait_milliseconds ──────────────────────────────────────────

@HandlesStep(StepIds.WAIT_SECONDS)
class WaitSecondsHandler implements StepHandler {
    @Override
    public StepOutcome execute(StepContext ctx) {
        return FixedWait.sleep(Duration.ofSeconds(ctx.intParam(0, 1)));
    }
}

@HandlesStep(StepIds.WAIT_MILLISECONDS)
class WaitMillisecondsHandler implements StepHandler {
    @Override
    public StepOutcome execute(StepContext ctx) {
        return FixedWait.sleep(Duration.ofMillis(ctx.intParam(0, 0)));
    }
}

final class FixedWait {
    private FixedWait() {}

    static StepOutcome sleep(Duration duration) {
        try {
            Thread.sleep(duration.toMillis());
            return StepOutcome.passed("Waited " + duration.toMillis() + "ms");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return StepOutcome.failed("Wait interrupted after less than " + duration.toMillis() + "ms", e);
        }
    }
}

// ── wait_for_element ──────────────────────────────────────────────────────────

@HandlesStep(StepIds.WAIT_FOR_ELEMENT)
class WaitForElementHandler extends BrowserStepHandler {
    @Override
    protected StepOutcome run(StepContext ctx, WebDriver driver) {
        String selector = ctx.param(0, "");
        new WebDriverWait(driver, DEFAULT_TIMEOUT)
            .until(ExpectedConditions.visibilityOfElementLocated(By.cssSelector(selector)));
        return StepOutcome.passed("Element '" + selector + "' is visible");
    }

    @Override
    protected String failurePrefix(StepContext ctx) {
        return "Timed out waiting for '" + ctx.param(0, "") + "' to be visible";
    }
}

// ── wait_for_element_hidden ───────────────────────────────────────────────────

@HandlesStep(StepIds.WAIT_FOR_ELEMENT_HIDDEN)
class WaitForElementHiddenHandler extends BrowserStepHandler {
    @Override
    protected StepOutcome run(StepContext ctx, WebDriver driver) {
        String selector = ctx.param(0, "");
        new WebDriverWait(driver, DEFAULT_TIMEOUT)
            .until(ExpectedConditions.invisibilityOfElementLocated(By.cssSelector(selector)));
        return StepOutcome.passed("Element '" + selector + "' is gone");
    }

    @Override
    protected String failurePrefix(StepContext ctx) {
        return "Timed out waiting for '" + ctx.param(0, "") + "' to disappear";
    }
}

// ── wait_for_text ─────────────────────────────────────────────────────────────

@HandlesStep(StepIds.WAIT_FOR_TEXT)
class WaitForTextHandler extends BrowserStepHandler {
    @Override
    protected StepOutcome run(StepContext ctx, WebDriver driver) {
        String text = ctx.param(0, "");
        new WebDriverWait(driver, DEFAULT_TIMEOUT)
            .until(ExpectedConditions.textToBePresentInElementLocated(By.tagName("body"), text));
        return StepOutcome.passed("Text '" + text + "' appeared");
    }

    @Override
    protected String failurePrefix(StepContext ctx) {
        return "Timed out waiting for text '" + ctx.param(0, "") + "'";
    }
}
