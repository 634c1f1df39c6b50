package com.testconductor.model;

/**
 * Closed catalogue of step actions.
 *
 * Every constant must have exactly one registered
 * {@link com.testconductor.executor.ActionHandler}; the
 * {@link com.testconductor.executor.ActionHandlerRegistry} refuses to start otherwise.
 *
 * Click-class actions are followed by popup detection unless the step's
 * {@link InterruptPolicy} is {@code IGNORE}.
 */
public enum ActionType {

    // ── Navigation ───────────────────────────────────────────────────────────
    NAVIGATE,           // Load a URL and wait for the configured load state

    // ── Element interaction ──────────────────────────────────────────────────
    CLICK(true),        // Click an element; may open a wallet popup
    FILL,               // Replace an input's value
    SELECT,             // Choose an option in a <select>
    CHECK,              // Ensure a checkbox is checked
    UNCHECK,            // Ensure a checkbox is unchecked
    TYPE,               // Type text key by key with a per-key delay
    HOVER,              // Move the pointer over an element
    PRESS,              // Send a single key to an element

    // ── Waits ────────────────────────────────────────────────────────────────
    WAIT,               // Sleep a fixed number of milliseconds
    WAIT_FOR_SELECTOR,  // Wait until an element is present

    // ── Evidence / scripting ─────────────────────────────────────────────────
    SCREENSHOT,         // Capture evidence; never fails the step
    EVALUATE;           // Run JavaScript in the page and return its value

    private final boolean clickClass;

    ActionType() {
        this(false);
    }

    ActionType(boolean clickClass) {
        this.clickClass = clickClass;
    }

    /** True when a wallet popup may appear as a consequence of this action. */
    public boolean isClickClass() {
        return clickClass;
    }
}
