package com.webspec.executor.handlers;

import com.webspec.executor.HandlesStep;
import com.webspec.executor.StepContext;
import com.webspec.executor.StepHandler;
import com.webspec.executor.StepOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Test-only handler registered from the test source tree.
 *
 * StepHandlerRegistry scans com.webspec.executor.handlers across the whole
 * runtime classpath, so this class is discovered at test time without any
 * registry change. It stores a value without needing a browser, which lets the
 * data assertion steps run end to end in tests.
 *
 * Pattern used by the tests: {@code I remember "value" as "key"}.
 */
@HandlesStep(RememberValueHandler.ID)
public class RememberValueHandler implements StepHandler {

    public static final String ID      = "remember_value";
    public static final String PATTERN = "I remember \"([^\"]*)\" as \"([^\"]+)\"";

    private static final Logger log = LoggerFactory.getLogger(RememberValueHandler.class);

    @Override
    public StepOutcome execute(StepContext ctx) {
        String value = ctx.param(0, "");
        String key   = ctx.param(1, "");
        ctx.getValues().put(key, value);
        log.info("Remembered '{}' as {}", value, key);
        return StepOutcome.passed("Stored " + key);
    }
}
