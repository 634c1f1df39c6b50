package com.testconductor.interrupt;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Marks a {@link PopupRule} for discovery by the {@link PopupRuleRegistry}.
 *
 * <pre>
 *   {@literal @}ClassifiesPopup(id = "connect-request", priority = 40)
 *   class ConnectRequestRule implements PopupRule { ... }
 * </pre>
 *
 * ids must be unique. Lower priority runs first, and the first rule that
 * recognises a popup decides its classification.
 */
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.TYPE)
public @interface ClassifiesPopup {

    String id();

    int priority() default 100;
}
