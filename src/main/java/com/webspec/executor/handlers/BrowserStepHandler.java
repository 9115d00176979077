package com.webspec.executor.handlers;

import com.webspec.executor.StepContext;
import com.webspec.executor.StepHandler;
import com.webspec.executor.StepOutcome;
import org.openqa.selenium.WebDriver;

import java.time.Duration;

/**
 * Base for handlers that need a browser. Fails the step when no WebDriver is
 * attached and turns any exception thrown by {@link #run} into a failed outcome.
 */
abstract class BrowserStepHandler implements StepHandler {

    static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(10);

    @Override
    public final StepOutcome execute(StepContext ctx) {
        if (!ctx.hasDriver()) {
            return StepOutcome.failed("No browser attached for step '" + ctx.getIdentifier() + "'");
        }
        try {
            return run(ctx, ctx.getDriver());
        } catch (Exception e) {
            return StepOutcome.failed(failurePrefix(ctx) + ": " + e.getMessage(), e);
        }
    }

    protected abstract StepOutcome run(StepContext ctx, WebDriver driver) throws Exception;

    /** Start of the failure message when {@link #run} throws. */
    protected String failurePrefix(StepContext ctx) {
        return "Step '" + ctx.getStepText() + "' failed";
    }
}
