package com.testconductor.interrupt.rules;

import com.testconductor.interrupt.ClassifiesPopup;
import com.testconductor.interrupt.PopupClassification;
import com.testconductor.interrupt.PopupContent;
import com.testconductor.interrupt.PopupErrorKind;
import com.testconductor.interrupt.PopupKind;
import com.testconductor.interrupt.PopupRule;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Recognises a transaction popup that is showing an error. Runs before every
 * other rule: a popup with an error must never be classified as something that
 * could be approved.
 *
 * The bare word "Error" is matched against visible text only; page markup is
 * full of class names and script identifiers containing it.
 */
@ClassifiesPopup(id = "error-indicator", priority = 10)
class ErrorIndicatorRule implements PopupRule {

    private static final Map<String, PopupErrorKind> INDICATORS = new LinkedHashMap<>();
    static {
        INDICATORS.put("Insufficient funds",   PopupErrorKind.INSUFFICIENT_FUNDS);
        INDICATORS.put("insufficient funds",   PopupErrorKind.INSUFFICIENT_FUNDS);
        INDICATORS.put("not enough",           PopupErrorKind.INSUFFICIENT_FUNDS);
        INDICATORS.put("gas required exceeds", PopupErrorKind.GAS_ESTIMATION);
        INDICATORS.put("cannot estimate gas",  PopupErrorKind.GAS_ESTIMATION);
        INDICATORS.put("execution reverted",   PopupErrorKind.EXECUTION_REVERTED);
    }

    private static final String GENERIC_INDICATOR = "Error";

    @Override
    public Optional<PopupClassification> classify(PopupContent content) {
        for (Map.Entry<String, PopupErrorKind> e : INDICATORS.entrySet()) {
            if (content.textOrMarkupContains(e.getKey())) {
                return Optional.of(PopupClassification.withError(
                    PopupKind.TRANSACTION, e.getValue(), e.getKey()));
            }
        }
        if (content.textContains(GENERIC_INDICATOR)) {
            return Optional.of(PopupClassification.withError(
                PopupKind.TRANSACTION, PopupErrorKind.GENERIC, GENERIC_INDICATOR));
        }
        return Optional.empty();
    }
}
