package com.testconductor.interrupt.rules;

import com.testconductor.interrupt.ClassifiesPopup;
import com.testconductor.interrupt.PopupClassification;
import com.testconductor.interrupt.PopupContent;
import com.testconductor.interrupt.PopupKind;
import com.testconductor.interrupt.PopupRule;

import java.util.List;
import java.util.Optional;

@ClassifiesPopup(id = "connect-request", priority = 40)
class ConnectRequestRule implements PopupRule {

    private static final List<String> INDICATORS = List.of(
        "Connect with MetaMask",
        "Connect to this site",
        "Connect request"
    );

    @Override
    public Optional<PopupClassification> classify(PopupContent content) {
        return INDICATORS.stream()
            .filter(content::textOrMarkupContains)
            .findFirst()
            .map(i -> PopupClassification.of(PopupKind.CONNECT));
    }
}
