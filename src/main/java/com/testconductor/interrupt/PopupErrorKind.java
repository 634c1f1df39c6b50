package com.testconductor.interrupt;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** The error a popup is displaying. Any of these forces the popup to be rejected. */
public enum PopupErrorKind {
    INSUFFICIENT_FUNDS,
    GAS_ESTIMATION,
    EXECUTION_REVERTED,
    UNREADABLE,
    GENERIC;

    @JsonValue
    public String jsonName() {
        return name().toLowerCase(Locale.ROOT).replace('_', '-');
    }
}
