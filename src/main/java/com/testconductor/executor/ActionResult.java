package com.testconductor.executor;

/**
 * The result returned by an {@link ActionHandler}.
 *
 * Immutable -- use the static factories. {@code value} carries the return value of
 * actions that produce one ({@code evaluate}, or the file written by {@code screenshot}).
 */
public class ActionResult {

    private final ActionOutcome outcome;
    private final String        message;
    private final Object        value;
    private final Throwable     error;   // non-null only when outcome == FAILED

    private ActionResult(ActionOutcome outcome, String message, Object value, Throwable error) {
        this.outcome = outcome;
        this.message = message;
        this.value   = value;
        this.error   = error;
    }

    // ── Static factories ──────────────────────────────────────────────────────

    public static ActionResult executed(String message) {
        return new ActionResult(ActionOutcome.EXECUTED, message, null, null);
    }

    public static ActionResult executed(String message, Object value) {
        return new ActionResult(ActionOutcome.EXECUTED, message, value, null);
    }

    public static ActionResult skipped(String reason) {
        return new ActionResult(ActionOutcome.SKIPPED, reason, null, null);
    }

    public static ActionResult failed(String message, Throwable cause) {
        return new ActionResult(ActionOutcome.FAILED, message, null, cause);
    }

    // ── Getters ───────────────────────────────────────────────────────────────

    public ActionOutcome getOutcome() { return outcome; }
    public String        getMessage() { return message; }
    public Object        getValue()   { return value; }
    public Throwable     getError()   { return error; }

    public boolean isExecuted() { return outcome == ActionOutcome.EXECUTED; }
    public boolean isSkipped()  { return outcome == ActionOutcome.SKIPPED; }
    public boolean isFailed()   { return outcome == ActionOutcome.FAILED; }

    @Override
    public String toString() {
        return String.format("ActionResult{outcome=%s, message='%s'}", outcome, message);
    }
}
