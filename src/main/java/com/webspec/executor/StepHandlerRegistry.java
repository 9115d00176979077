package com.webspec.executor;

import org.reflections.Reflections;
import org.reflections.scanners.Scanners;
import org.reflections.util.ConfigurationBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Discovers and holds all {@link StepHandler} implementations.
 *
 * At construction time the registry:
 *   1. Uses Reflections to scan {@code com.webspec.executor.handlers}
 *   2. Finds every class annotated with {@link HandlesStep}
 *   3. Instantiates each one via its no-arg constructor
 *   4. Registers it under the step identifier declared in the annotation
 *
 * Adding a step therefore needs a pattern in the registry and one annotated
 * handler class; nothing else changes. Test code can contribute handlers by
 * placing them in the same package on the test classpath.
 *
 * Two handlers for the same identifier cause an {@link IllegalStateException}
 * at startup.
 */
public class StepHandlerRegistry {

    private static final Logger log = LoggerFactory.getLogger(StepHandlerRegistry.class);
    public static final String HANDLERS_PACKAGE = "com.webspec.executor.handlers";

    private final Map<String, StepHandler> handlers = new HashMap<>();

    public StepHandlerRegistry() {
        discoverAndRegister();
        log.info("StepHandlerRegistry: {} handler(s) registered", handlers.size());
    }

    // ── Lookup ────────────────────────────────────────────────────────────────

    public Optional<StepHandler> find(String identifier) {
        return Optional.ofNullable(handlers.get(identifier));
    }

    public boolean hasHandler(String identifier) {
        return handlers.containsKey(identifier);
    }

    public Set<String> identifiers() {
        return Collections.unmodifiableSet(handlers.keySet());
    }

    public int size() {
        return handlers.size();
    }

    // ── Discovery ─────────────────────────────────────────────────────────────

    private void discoverAndRegister() {
        Reflections reflections = new Reflections(
            new ConfigurationBuilder()
                .forPackage(HANDLERS_PACKAGE)
                .setScanners(Scanners.TypesAnnotated)
        );

        Set<Class<?>> annotated = reflections.getTypesAnnotatedWith(HandlesStep.class);

        for (Class<?> cls : annotated) {
            String identifier = cls.getAnnotation(HandlesStep.class).value();

            if (!StepHandler.class.isAssignableFrom(cls)) {
                throw new IllegalStateException(
                    "Class " + cls.getName() + " is annotated @HandlesStep(\"" + identifier +
                    "\") but does not implement StepHandler");
            }

            if (handlers.containsKey(identifier)) {
                throw new IllegalStateException(
                    "Duplicate handler for step '" + identifier +
                    "': " + handlers.get(identifier).getClass().getName() +
                    " and " + cls.getName());
            }

            try {
                var constructor = cls.getDeclaredConstructor();
                constructor.setAccessible(true);
                handlers.put(identifier, (StepHandler) constructor.newInstance());
                log.debug("StepHandlerRegistry: registered {} -> {}", identifier, cls.getSimpleName());
            } catch (ReflectiveOperationException e) {
                throw new IllegalStateException(
                    "Failed to instantiate handler " + cls.getName() +
                    " for step '" + identifier + "'.", e);
            }
        }
    }
}
