package com.testconductor.interrupt.rules;

import com.testconductor.interrupt.ClassifiesPopup;
import com.testconductor.interrupt.PopupClassification;
import com.testconductor.interrupt.PopupContent;
import com.testconductor.interrupt.PopupKind;
import com.testconductor.interrupt.PopupRule;

import java.util.List;
import java.util.Optional;

/**
 * Transaction confirmations. The indicators are broad ("Total", "Send"), so this
 * rule runs after the signature rule.
 */
@ClassifiesPopup(id = "transaction-request", priority = 30)
class TransactionRequestRule implements PopupRule {

    private static final List<String> INDICATORS = List.of(
        "Gas fee",
        "Estimated gas",
        "Max fee",
        "Total",
        "Amount",
        "Send",
        "Confirm transaction",
        "Contract interaction"
    );

    @Override
    public Optional<PopupClassification> classify(PopupContent content) {
        return INDICATORS.stream()
            .filter(content::textOrMarkupContains)
            .findFirst()
            .map(i -> PopupClassification.of(PopupKind.TRANSACTION));
    }
}
