package com.testconductor.interrupt.rules;

import com.testconductor.interrupt.ClassifiesPopup;
import com.testconductor.interrupt.PopupClassification;
import com.testconductor.interrupt.PopupContent;
import com.testconductor.interrupt.PopupRule;

import java.util.List;
import java.util.Optional;

/** Message and typed-data signature requests. */
@ClassifiesPopup(id = "signature-request", priority = 20)
class SignatureRequestRule implements PopupRule {

    private static final List<String> INDICATORS = List.of(
        "Signature request",
        "Sign message",
        "personal_sign",
        "Sign typed data",
        "signTypedData",
        "eth_signTypedData",
        "Message:",
        "Sign this message"
    );

    @Override
    public Optional<PopupClassification> classify(PopupContent content) {
        for (String indicator : INDICATORS) {
            if (content.textOrMarkupContains(indicator)) {
                String subtype = content.textContains("signTypedData") || content.textContains("typed data")
                    ? PopupClassification.SUBTYPE_SIGN_TYPED_DATA
                    : PopupClassification.SUBTYPE_PERSONAL_SIGN;
                return Optional.of(PopupClassification.signature(subtype));
            }
        }
        return Optional.empty();
    }
}
