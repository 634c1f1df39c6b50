package com.testconductor.interrupt;

import java.util.Optional;

/**
 * One ordered classification rule used by {@link RuleBasedPopupClassifier}.
 *
 * Implementations must:
 *   1. Be annotated with {@link ClassifiesPopup}
 *   2. Have a no-arg constructor
 *   3. Live in {@code com.testconductor.interrupt.rules} so the
 *      {@link PopupRuleRegistry} can discover them
 *
 * Rules are stateless and cheap: they only inspect the captured text and markup.
 * Return empty when the rule does not recognise the popup.
 */
public interface PopupRule {
    Optional<PopupClassification> classify(PopupContent content);
}
