package com.testconductor.interrupt;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/** The response chosen for a popup. */
public enum PopupAction {
    APPROVED,
    REJECTED;

    @JsonValue
    public String jsonName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
