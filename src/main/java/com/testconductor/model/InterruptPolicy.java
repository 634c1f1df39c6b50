package com.testconductor.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * What to do with a wallet popup that appears after a click-class step.
 *
 *   APPROVE -- click the action-specific approve control (default)
 *   REJECT  -- click the first visible reject/cancel control
 *   IGNORE  -- do not look for a popup at all
 *
 * A popup classified as an errored transaction is always rejected, whatever
 * the requested policy.
 */
public enum InterruptPolicy {
    APPROVE,
    REJECT,
    IGNORE;

    @JsonValue
    public String jsonName() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static InterruptPolicy fromJson(String value) {
        if (value == null || value.isBlank()) return APPROVE;
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
