package com.webspec.executor;

import java.util.List;

/**
 * A matched step handed to an {@link AutomationBackend}.
 *
 * @param identifier the handler identifier resolved by the pattern registry
 * @param parameters captured groups from the step text
 * @param text       the step text as written
 * @param values     the store of the scenario this step belongs to
 */
public record StepInvocation(String identifier, List<String> parameters, String text, ValueStore values) {

    public StepInvocation {
        parameters = List.copyOf(parameters);
    }
}
