package com.testconductor.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Load state a navigation waits for before the step is considered done.
 *
 * {@code LOAD} is the default. {@code NETWORK_IDLE} is accepted for task-file
 * compatibility but pages driven by long-polling or websockets never reach it,
 * so follow a navigation with an explicit wait-for-selector step instead.
 */
public enum WaitPolicy {
    COMMIT("commit"),
    DOM_CONTENT_LOADED("domcontentloaded"),
    LOAD("load"),
    NETWORK_IDLE("networkidle");

    private final String jsonName;

    WaitPolicy(String jsonName) {
        this.jsonName = jsonName;
    }

    @JsonValue
    public String jsonName() {
        return jsonName;
    }

    @JsonCreator
    public static WaitPolicy fromJson(String value) {
        if (value == null || value.isBlank()) return LOAD;
        String v = value.trim();
        return Arrays.stream(values())
            .filter(p -> p.jsonName.equalsIgnoreCase(v) || p.name().equalsIgnoreCase(v))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown waitUntil value: " + value));
    }
}
