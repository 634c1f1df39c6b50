package com.testconductor.interrupt;

import java.util.List;
import java.util.Optional;

/**
 * Classifies a popup by asking each {@link PopupRule} in priority order; the first
 * rule that recognises it wins. Popups no rule recognises are {@link PopupKind#UNKNOWN}.
 */
public class RuleBasedPopupClassifier implements PopupClassifier {

    private final List<PopupRule> rules;

    public RuleBasedPopupClassifier() {
        this(new PopupRuleRegistry().getRules());
    }

    public RuleBasedPopupClassifier(List<PopupRule> rules) {
        this.rules = List.copyOf(rules);
    }

    @Override
    public PopupClassification classify(PopupContent content) {
        for (PopupRule rule : rules) {
            Optional<PopupClassification> result = rule.classify(content);
            if (result.isPresent()) return result.get();
        }
        return PopupClassification.unknown();
    }
}
