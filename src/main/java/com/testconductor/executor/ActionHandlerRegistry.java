package com.testconductor.executor;

import com.testconductor.model.ActionType;
import org.reflections.Reflections;
import org.reflections.scanners.Scanners;
import org.reflections.util.ConfigurationBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Discovers and holds the {@link ActionHandler} for every {@link ActionType}.
 *
 * At construction time the registry:
 *   1. Uses Reflections to scan {@code com.testconductor.executor.handlers}
 *   2. Finds every class annotated with {@link HandlesAction}
 *   3. Instantiates each one via its no-arg constructor
 *   4. Registers it under the action type declared in the annotation
 *   5. Verifies that every action type has a handler
 *
 * Duplicate registrations, annotated classes that are not handlers and action
 * types without a handler all raise {@link IllegalStateException} here, so a
 * step kind can never reach execution without something to run it.
 */
public class ActionHandlerRegistry {

    private static final Logger log = LoggerFactory.getLogger(ActionHandlerRegistry.class);
    private static final String HANDLERS_PACKAGE = "com.testconductor.executor.handlers";

    private final Map<ActionType, ActionHandler> registry = new EnumMap<>(ActionType.class);

    public ActionHandlerRegistry() {
        discoverAndRegister();
        verifyComplete();
        log.info("ActionHandlerRegistry: {} handler(s) registered", registry.size());
    }

    // ── Lookup ────────────────────────────────────────────────────────────────

    public Optional<ActionHandler> find(ActionType actionType) {
        return Optional.ofNullable(registry.get(actionType));
    }

    public boolean hasHandler(ActionType actionType) {
        return registry.containsKey(actionType);
    }

    public int size() {
        return registry.size();
    }

    // ── Discovery ─────────────────────────────────────────────────────────────

    private void discoverAndRegister() {
        Reflections reflections = new Reflections(
            new ConfigurationBuilder()
                .forPackage(HANDLERS_PACKAGE)
                .setScanners(Scanners.TypesAnnotated)
        );

        Set<Class<?>> annotated = reflections.getTypesAnnotatedWith(HandlesAction.class);

        for (Class<?> cls : annotated) {
            ActionType actionType = cls.getAnnotation(HandlesAction.class).value();

            if (!ActionHandler.class.isAssignableFrom(cls)) {
                throw new IllegalStateException(
                    "Class " + cls.getName() + " is annotated @HandlesAction(" + actionType +
                    ") but does not implement ActionHandler");
            }

            if (registry.containsKey(actionType)) {
                throw new IllegalStateException(
                    "Duplicate handler for action type " + actionType +
                    ": " + registry.get(actionType).getClass().getName() +
                    " and " + cls.getName());
            }

            try {
                var constructor = cls.getDeclaredConstructor();
                constructor.setAccessible(true);  // support package-private handlers
                registry.put(actionType, (ActionHandler) constructor.newInstance());
                log.debug("ActionHandlerRegistry: registered {} -> {}", actionType, cls.getSimpleName());
            } catch (ReflectiveOperationException e) {
                throw new IllegalStateException(
                    "Failed to instantiate handler " + cls.getName() +
                    " for action type " + actionType + ".", e);
            }
        }
    }

    private void verifyComplete() {
        Set<ActionType> missing = EnumSet.allOf(ActionType.class);
        missing.removeAll(registry.keySet());
        if (!missing.isEmpty()) {
            throw new IllegalStateException("No handler registered for action type(s): " + missing);
        }
    }
}
