package com.testconductor.interrupt;

import java.util.List;

/**
 * Canonical locations of the approve and reject controls in wallet popups,
 * most specific first. {@code :has-text()} selectors are understood by the
 * Driver implementations.
 */
public final class PopupControls {

    private static final List<String> SIGNATURE_APPROVE = List.of(
        "button[data-testid=\"confirm-footer-button\"]",
        "button[data-testid=\"signature-request-scroll-button\"]",
        "button:has-text(\"Sign\")",
        "button:has-text(\"Confirm\")"
    );

    private static final List<String> TRANSACTION_APPROVE = List.of(
        "button[data-testid=\"confirm-footer-button\"]",
        "button[data-testid=\"page-container-footer-next\"]",
        "button:has-text(\"Confirm\")",
        "button:has-text(\"Approve\")"
    );

    private static final List<String> CONNECT_APPROVE = List.of(
        "button[data-testid=\"confirm-btn\"]",
        "button:has-text(\"Connect\")"
    );

    private static final List<String> GENERIC_APPROVE = List.of(
        "button[data-testid=\"confirm-footer-button\"]",
        "button[data-testid=\"page-container-footer-next\"]",
        "button[data-testid=\"confirm-btn\"]",
        "button:has-text(\"Confirm\")",
        "button:has-text(\"Approve\")",
        "button:has-text(\"Sign\")",
        "button:has-text(\"Connect\")"
    );

    private static final List<String> REJECT = List.of(
        "button[data-testid=\"confirm-footer-cancel-button\"]",
        "button[data-testid=\"page-container-footer-cancel\"]",
        "button:has-text(\"Reject\")",
        "button:has-text(\"Cancel\")"
    );

    private PopupControls() {}

    public static List<String> approveSelectors(PopupKind kind) {
        return switch (kind) {
            case SIGNATURE   -> SIGNATURE_APPROVE;
            case TRANSACTION -> TRANSACTION_APPROVE;
            case CONNECT     -> CONNECT_APPROVE;
            case UNKNOWN     -> GENERIC_APPROVE;
            case ERROR       -> List.of();
        };
    }

    public static List<String> rejectSelectors() {
        return REJECT;
    }
}
