package com.webspec.executor.handlers;

import com.webspec.executor.HandlesStep;
import com.webspec.executor.StepContext;
import com.webspec.executor.StepOutcome;
import com.webspec.registry.StepIds;
import org.openqa.selenium.By;
import org.openqa.selenium.Keys;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebElement;
import org.openqa.selenium.interactions.Actions;
import org.openqa.selenium.support.ui.ExpectedConditions;
import org.openqa.selenium.support.ui.Select;
import org.openqa.selenium.support.ui.WebDriverWait;

import java.util.Locale;

// ── click ─────────────────────────────────────────────────────────────────────

@HandlesStep(StepIds.CLICK)
class ClickHandler extends BrowserStepHandler {
    @Override
    protected StepOutcome run(StepContext ctx, WebDriver driver) {
        String selector = ctx.param(0, "");
        WebElement el = new WebDriverWait(driver, DEFAULT_TIMEOUT)
            .until(ExpectedConditions.elementToBeClickable(By.cssSelector(selector)));
        el.click();
        return StepOutcome.passed("Clicked: " + selector);
    }

    @Override
    protected String failurePrefix(StepContext ctx) {
        return "Could not click '" + ctx.param(0, "") + "'";
    }
}

// ── double_click ──────────────────────────────────────────────────────────────

@HandlesStep(StepIds.DOUBLE_CLICK)
class DoubleClickHandler extends BrowserStepHandler {
    @Override
    protected StepOutcome run(StepContext ctx, WebDriver driver) {
        String selector = ctx.param(0, "");
        new Actions(driver).doubleClick(driver.findElement(By.cssSelector(selector))).perform();
        return StepOutcome.passed("Double-clicked: " + selector);
    }
}

// ── right_click ───────────────────────────────────────────────────────────────

@HandlesStep(StepIds.RIGHT_CLICK)
class RightClickHandler extends BrowserStepHandler {
    @Override
    protected StepOutcome run(StepContext ctx, WebDriver driver) {
        String selector = ctx.param(0, "");
        new Actions(driver).contextClick(driver.findElement(By.cssSelector(selector))).perform();
        return StepOutcome.passed("Right-clicked: " + selector);
    }
}

// ── hover ─────────────────────────────────────────────────────────────────────

@HandlesStep(StepIds.HOVER)
class HoverHandler extends BrowserStepHandler {
    @Override
    protected StepOutcome run(StepContext ctx, WebDriver driver) {
        String selector = ctx.param(0, "");
        new Actions(driver).moveToElement(driver.findElement(By.cssSelector(selector))).perform();
        return StepOutcome.passed("Hovering over: " + selector);
    }
}

// ── type_text ─────────────────────────────────────────────────────────────────

@HandlesStep(StepIds.TYPE_TEXT)
class TypeTextHandler extends BrowserStepHandler {
    @Override
    protected StepOutcome run(StepContext ctx, WebDriver driver) {
        String text     = ctx.param(0, "");
        String selector = ctx.param(1, "");
        WebElement field = new WebDriverWait(driver, DEFAULT_TIMEOUT)
            .until(ExpectedConditions.visibilityOfElementLocated(By.cssSelector(selector)));
        field.clear();
        field.sendKeys(text);
        return StepOutcome.passed("Typed " + text.length() + " character(s) into " + selector);
    }

    @Override
    protected String failurePrefix(StepContext ctx) {
        return "Could not type into '" + ctx.param(1, "") + "'";
    }
}

// ── clear_field ───────────────────────────────────────────────────────────────

@HandlesStep(StepIds.CLEAR_FIELD)
class ClearFieldHandler extends BrowserStepHandler {
    @Override
    protected StepOutcome run(StepContext ctx, WebDriver driver) {
        String selector = ctx.param(0, "");
        driver.findElement(By.cssSelector(selector)).clear();
        return StepOutcome.passed("Cleared: " + selector);
    }
}

// ── select_option ─────────────────────────────────────────────────────────────

@HandlesStep(StepIds.SELECT_OPTION)
class SelectOptionHandler extends BrowserStepHandler {
    @Override
    protected StepOutcome run(StepContext ctx, WebDriver driver) {
        String option   = ctx.param(0, "");
        String selector = ctx.param(1, "");
        new Select(driver.findElement(By.cssSelector(selector))).selectByVisibleText(option);
        return StepOutcome.passed("Selected '" + option + "' in " + selector);
    }
}

// ── check_checkbox / uncheck_checkbox ─────────────────────────────────────────

@HandlesStep(StepIds.CHECK_CHECKBOX)
class CheckCheckboxHandler extends BrowserStepHandler {
    @Override
    protected StepOutcome run(StepContext ctx, WebDriver driver) {
        String selector = ctx.param(0, "");
        WebElement box = driver.findElement(By.cssSelector(selector));
        if (!box.isSelected()) box.click();
        return StepOutcome.passed("Checked: " + selector);
    }
}

@HandlesStep(StepIds.UNCHECK_CHECKBOX)
class UncheckCheckboxHandler extends BrowserStepHandler {
    @Override
    protected StepOutcome run(StepContext ctx, WebDriver driver) {
        String selector = ctx.param(0, "");
        WebElement box = driver.findElement(By.cssSelector(selector));
        if (box.isSelected()) box.click();
        return StepOutcome.passed("Unchecked: " + selector);
    }
}

// ── press_key ─────────────────────────────────────────────────────────────────

@HandlesStep(StepIds.PRESS_KEY)
class PressKeyHandler extends BrowserStepHandler {
    @Override
    protected StepOutcome run(StepContext ctx, WebDriver driver) {
        String name = ctx.param(0, "").trim().toUpperCase(Locale.ROOT);
        Keys key = Keys.valueOf(name);
        driver.switchTo().activeElement().sendKeys(key);
        return StepOutcome.passed("Pressed " + name);
    }

    @Override
    protected String failurePrefix(StepContext ctx) {
        return "Could not press key '" + ctx.param(0, "") + "'";
    }
}
