package com.testconductor.executor;

import com.testconductor.model.ActionType;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a class as the handler for one {@link ActionType}.
 *
 * The {@link ActionHandlerRegistry} scans {@code com.testconductor.executor.handlers}
 * at startup and registers every annotated class under its action type.
 *
 * <pre>
 *   {@literal @}HandlesAction(ActionType.CLICK)
 *   class ClickHandler implements ActionHandler { ... }
 * </pre>
 *
 * Rules:
 *   - The annotated class must implement {@link ActionHandler}.
 *   - It must have a no-arg constructor (package-private is fine).
 *   - Each action type has exactly one handler. Duplicates and gaps fail startup.
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.TYPE)
public @interface HandlesAction {
    ActionType value();
}
