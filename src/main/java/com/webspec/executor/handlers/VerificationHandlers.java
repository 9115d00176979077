package com.webspec.executor.handlers;

import com.webspec.executor.HandlesStep;
import com.webspec.executor.StepContext;
import com.webspec.executor.StepOutcome;
import com.webspec.registry.StepIds;
import org.openqa.selenium.By;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebElement;

import java.util.List;

// Assertions fail the step with a message naming expected and actual values.

final class PageText {
    private PageText() {}

    static String body(WebDriver driver) {
        return driver.findElement(By.tagName("body")).getText();
    }
}

// ── should_see_text / should_not_see_text ─────────────────────────────────────

@HandlesStep(StepIds.SHOULD_SEE_TEXT)
class ShouldSeeTextHandler extends BrowserStepHandler {
    @Override
    protected StepOutcome run(StepContext ctx, WebDriver driver) {
        String text = ctx.param(0, "");
        return PageText.body(driver).contains(text)
            ? StepOutcome.passed("Page contains '" + text + "'")
            : StepOutcome.failed("Expected page to contain '" + text + "'");
    }
}

@HandlesStep(StepIds.SHOULD_NOT_SEE_TEXT)
class ShouldNotSeeTextHandler extends BrowserStepHandler {
    @Override
    protected StepOutcome run(StepContext ctx, WebDriver driver) {
        String text = ctx.param(0, "");
        return PageText.body(driver).contains(text)
            ? StepOutcome.failed("Expected page not to contain '" + text + "'")
            : StepOutcome.passed("Page does not contain '" + text + "'");
    }
}

// ── element_visible / element_not_visible ─────────────────────────────────────

@HandlesStep(StepIds.ELEMENT_VISIBLE)
class ElementVisibleHandler extends BrowserStepHandler {
    @Override
    protected StepOutcome run(StepContext ctx, WebDriver driver) {
        String selector = ctx.param(0, "");
        List<WebElement> found = driver.findElements(By.cssSelector(selector));
        return !found.isEmpty() && found.get(0).isDisplayed()
            ? StepOutcome.passed("Element '" + selector + "' is visible")
            : StepOutcome.failed("Expected element '" + selector + "' to be visible");
    }
}

@HandlesStep(StepIds.ELEMENT_NOT_VISIBLE)
class ElementNotVisibleHandler extends BrowserStepHandler {
    @Override
    protected StepOutcome run(StepContext ctx, WebDriver driver) {
        String selector = ctx.param(0, "");
        boolean visible = driver.findElements(By.cssSelector(selector)).stream()
            .anyMatch(WebElement::isDisplayed);
        return visible
            ? StepOutcome.failed("Expected element '" + selector + "' not to be visible")
            : StepOutcome.passed("Element '" + selector + "' is not visible");
    }
}

// ── element_text_equals / element_contains_text ───────────────────────────────

@HandlesStep(StepIds.ELEMENT_TEXT_EQUALS)
class ElementTextEqualsHandler extends BrowserStepHandler {
    @Override
    protected StepOutcome run(StepContext ctx, WebDriver driver) {
        String selector = ctx.param(0, "");
        String expected = ctx.param(1, "");
        String actual   = driver.findElement(By.cssSelector(selector)).getText().trim();
        return actual.equals(expected)
            ? StepOutcome.passed("Element '" + selector + "' has text '" + expected + "'")
            : StepOutcome.failed("Expected element '" + selector + "' to have text '" + expected
                + "' but was '" + actual + "'");
    }
}

@HandlesStep(StepIds.ELEMENT_CONTAINS_TEXT)
class ElementContainsTextHandler extends BrowserStepHandler {
    @Override
    protected StepOutcome run(StepContext ctx, WebDriver driver) {
        String selector = ctx.param(0, "");
        String fragment = ctx.param(1, "");
        String actual   = driver.findElement(By.cssSelector(selector)).getText();
        return actual.contains(fragment)
            ? StepOutcome.passed("Element '" + selector + "' contains '" + fragment + "'")
            : StepOutcome.failed("Expected element '" + selector + "' to contain '" + fragment
                + "' but was '" + actual + "'");
    }
}

// ── title_equals / title_contains / url_contains ──────────────────────────────

@HandlesStep(StepIds.TITLE_EQUALS)
class TitleEqualsHandler extends BrowserStepHandler {
    @Override
    protected StepOutcome run(StepContext ctx, WebDriver driver) {
        String expected = ctx.param(0, "");
        String actual   = driver.getTitle();
        return expected.equals(actual)
            ? StepOutcome.passed("Title is '" + expected + "'")
            : StepOutcome.failed("Expected title '" + expected + "' but was '" + actual + "'");
    }
}

@HandlesStep(StepIds.TITLE_CONTAINS)
class TitleContainsHandler extends BrowserStepHandler {
    @Override
    protected StepOutcome run(StepContext ctx, WebDriver driver) {
        String fragment = ctx.param(0, "");
        String actual   = driver.getTitle();
        return actual != null && actual.contains(fragment)
            ? StepOutcome.passed("Title contains '" + fragment + "'")
            : StepOutcome.failed("Expected title to contain '" + fragment + "' but was '" + actual + "'");
    }
}

@HandlesStep(StepIds.URL_CONTAINS)
class UrlContainsHandler extends BrowserStepHandler {
    @Override
    protected StepOutcome run(StepContext ctx, WebDriver driver) {
        String fragment = ctx.param(0, "");
        String actual   = driver.getCurrentUrl();
        return actual != null && actual.contains(fragment)
            ? StepOutcome.passed("URL contains '" + fragment + "'")
            : StepOutcome.failed("Expected URL to contain '" + fragment + "' but was '" + actual + "'");
    }
}
