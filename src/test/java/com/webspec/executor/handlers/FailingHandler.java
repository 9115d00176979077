package com.webspec.executor.handlers;

import com.webspec.executor.HandlesStep;
import com.webspec.executor.StepContext;
import com.webspec.executor.StepExecutionException;
import com.webspec.executor.StepHandler;
import com.webspec.executor.StepOutcome;

/**
 * Test-only handler that always throws: a {@link StepExecutionException} carrying
 * its first parameter, or a message-less IllegalStateException without one.
 */
@HandlesStep(FailingHandler.ID)
public class FailingHandler implements StepHandler {

    public static final String ID = "always_fail";

    @Override
    public StepOutcome execute(StepContext ctx) {
        String message = ctx.param(0, null);
        if (message == null) {
            throw new IllegalStateException();
        }
        throw new StepExecutionException(message);
    }
}
