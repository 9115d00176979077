package com.webspec.executor.handlers;

import com.webspec.executor.HandlesStep;
import com.webspec.executor.StepContext;
import com.webspec.executor.StepHandler;
import com.webspec.executor.StepOutcome;
import com.webspec.registry.StepIds;
import org.openqa.selenium.By;
import org.openqa.selenium.OutputType;
import org.openqa.selenium.TakesScreenshot;
import org.openqa.selenium.WebDriver;
import org.openqa.selenium.WebElement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.List;
import java.util.Optional;

// ── store_text ────────────────────────────────────────────────────────────────

@HandlesStep(StepIds.STORE_TEXT)
class StoreTextHandler extends BrowserStepHandler {
    @Override
    protected StepOutcome run(StepContext ctx, WebDriver driver) {
        String selector = ctx.param(0, "");
        String key      = ctx.param(1, "");
        String text     = driver.findElement(By.cssSelector(selector)).getText().trim();
        ctx.getValues().put(key, text);
        return StepOutcome.passed("Stored '" + text + "' as " + key);
    }
}

// ── extract_all_text ──────────────────────────────────────────────────────────

@HandlesStep(StepIds.EXTRACT_ALL_TEXT)
class ExtractAllTextHandler extends BrowserStepHandler {
    @Override
    protected StepOutcome run(StepContext ctx, WebDriver driver) {
        String selector = ctx.param(0, "");
        String key      = ctx.param(1, "");
        List<String> items = driver.findElements(By.cssSelector(selector)).stream()
            .map(WebElement::getText)
            .map(String::trim)
            .toList();
        ctx.getValues().putList(key, items);
        return StepOutcome.passed("Extracted " + items.size() + " item(s) as " + key);
    }
}

// ── stored_value_equals ───────────────────────────────────────────────────────

@HandlesStep(StepIds.STORED_VALUE_EQUALS)
class StoredValueEqualsHandler implements StepHandler {
    @Override
    public StepOutcome execute(StepContext ctx) {
        String key      = ctx.param(0, "");
        String expected = ctx.param(1, "");
        Optional<String> actual = ctx.getValues().get(key);
        if (actual.isEmpty())
            return StepOutcome.failed("No value stored under '" + key + "'");
        return actual.get().equals(expected)
            ? StepOutcome.passed("Stored value " + key + " is '" + expected + "'")
            : StepOutcome.failed("Expected stored value " + key + " to be '" + expected
                + "' but was '" + actual.get() + "'");
    }
}

// ── extracted_count_equals ────────────────────────────────────────────────────

@HandlesStep(StepIds.EXTRACTED_COUNT_EQUALS)
class ExtractedCountEqualsHandler implements StepHandler {
    @Override
    public StepOutcome execute(StepContext ctx) {
        String key      = ctx.param(0, "");
        int    expected = ctx.intParam(1, -1);
        if (!ctx.getValues().hasList(key))
            return StepOutcome.failed("Nothing was extracted as '" + key + "'");
        int actual = ctx.getValues().getList(key).size();
        return actual == expected
            ? StepOutcome.passed("Extracted list " + key + " has " + actual + " item(s)")
            : StepOutcome.failed("Expected " + expected + " item(s) in " + key + " but found " + actual);
    }
}

// ── take_screenshot ───────────────────────────────────────────────────────────

@HandlesStep(StepIds.TAKE_SCREENSHOT)
class TakeScreenshotHandler extends BrowserStepHandler {
    private static final Logger log = LoggerFactory.getLogger(TakeScreenshotHandler.class);
    private static final Path SCREENSHOT_DIR = Paths.get("target", "screenshots");

    @Override
    protected StepOutcome run(StepContext ctx, WebDriver driver) throws IOException {
        if (!(driver instanceof TakesScreenshot camera))
            return StepOutcome.failed("Driver " + driver.getClass().getSimpleName() + " cannot take screenshots");

        String name   = ctx.param(0, "screenshot-" + System.currentTimeMillis());
        Path   target = SCREENSHOT_DIR.resolve(name.replaceAll("[^A-Za-z0-9._-]", "_") + ".png");
        Files.createDirectories(SCREENSHOT_DIR);
        Files.copy(camera.getScreenshotAs(OutputType.FILE).toPath(), target, StandardCopyOption.REPLACE_EXISTING);
        log.info("TakeScreenshotHandler: saved {}", target);
        return StepOutcome.passed("Screenshot saved: " + target);
    }
}
