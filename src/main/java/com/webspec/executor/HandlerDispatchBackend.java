package com.webspec.executor;

import org.openqa.selenium.WebDriver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link AutomationBackend} that dispatches each invocation to the
 * {@link StepHandler} registered for its identifier, giving it the WebDriver.
 */
public class HandlerDispatchBackend implements AutomationBackend {

    private static final Logger log = LoggerFactory.getLogger(HandlerDispatchBackend.class);

    private final StepHandlerRegistry registry;
    private final WebDriver           driver;

    public HandlerDispatchBackend(StepHandlerRegistry registry, WebDriver driver) {
        this.registry = registry;
        this.driver   = driver;
    }

    @Override
    public StepOutcome execute(StepInvocation invocation) {
        return registry.find(invocation.identifier())
            .map(handler -> {
                try {
                    StepOutcome outcome = handler.execute(new StepContext(driver, invocation));
                    log.debug("HandlerDispatchBackend: {} -> {}", invocation.identifier(), outcome);
                    return outcome;
                } catch (Exception e) {
                    log.error("HandlerDispatchBackend: handler for '{}' threw: {}",
                        invocation.identifier(), e.getMessage(), e);
                    return StepOutcome.failed(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName(), e);
                }
            })
            .orElseGet(() -> {
                StepOutcome outcome = StepOutcome.notFound(invocation.identifier());
                log.warn("HandlerDispatchBackend: {}", outcome.getMessage());
                return outcome;
            });
    }
}
