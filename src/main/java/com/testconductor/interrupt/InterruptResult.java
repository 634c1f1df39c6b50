package com.testconductor.interrupt;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

/**
 * What happened when the interrupt protocol ran after a step.
 *
 *   hasPopup=false                        -- nothing appeared; the normal case
 *   hasPopup=true, success=true           -- the popup was answered with {@code action}
 *   hasPopup=true, success=false          -- a popup was found but could not be resolved
 *   testFailed=true                       -- the popup showed an error and was rejected;
 *                                            the step must fail whatever the policy was
 *
 * Immutable -- use the static factories.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"hasPopup", "kind", "subtype", "errorKind", "action", "success", "testFailed", "error", "control"})
public final class InterruptResult {

    private static final InterruptResult NO_POPUP =
        new InterruptResult(false, null, null, null, null, true, false, null, null);

    private final boolean        hasPopup;
    private final PopupKind      kind;
    private final String         subtype;
    private final PopupErrorKind errorKind;
    private final PopupAction    action;
    private final boolean        success;
    private final boolean        testFailed;
    private final String         error;
    private final String         control;   // selector of the control that was clicked

    private InterruptResult(boolean hasPopup, PopupKind kind, String subtype, PopupErrorKind errorKind,
                            PopupAction action, boolean success, boolean testFailed,
                            String error, String control) {
        this.hasPopup   = hasPopup;
        this.kind       = kind;
        this.subtype    = subtype;
        this.errorKind  = errorKind;
        this.action     = action;
        this.success    = success;
        this.testFailed = testFailed;
        this.error      = error;
        this.control    = control;
    }

    // ── Static factories ──────────────────────────────────────────────────────

    public static InterruptResult noPopup() {
        return NO_POPUP;
    }

    /** The popup was answered by clicking {@code control}. */
    public static InterruptResult resolved(PopupClassification c, PopupAction action, String control) {
        return new InterruptResult(true, c.getKind(), c.getSubtype(), null, action, true, false, null, control);
    }

    /** The popup showed an error and was rejected by clicking {@code control}. */
    public static InterruptResult rejectedForError(PopupClassification c, String control) {
        return new InterruptResult(true, c.getKind(), c.getSubtype(), c.getErrorKind(),
            PopupAction.REJECTED, false, true, c.getErrorText(), control);
    }

    /** No control for the chosen action could be clicked. */
    public static InterruptResult unresolved(PopupClassification c, PopupAction action) {
        String error = c.hasError()
            ? c.getErrorText() + " (no reject control found)"
            : "No " + (action == PopupAction.APPROVED ? "approve" : "reject") + " control found in " + c.getKind().jsonName() + " popup";
        return new InterruptResult(true, c.getKind(), c.getSubtype(), c.getErrorKind(),
            action, false, c.hasError(), error, null);
    }

    // ── Getters ───────────────────────────────────────────────────────────────

    @JsonProperty("hasPopup")   public boolean        hasPopup()     { return hasPopup; }
    @JsonProperty("kind")       public PopupKind      getKind()      { return kind; }
    @JsonProperty("subtype")    public String         getSubtype()   { return subtype; }
    @JsonProperty("errorKind")  public PopupErrorKind getErrorKind() { return errorKind; }
    @JsonProperty("action")     public PopupAction    getAction()    { return action; }
    @JsonProperty("success")    public boolean        isSuccess()    { return success; }
    @JsonProperty("testFailed") public boolean        isTestFailed() { return testFailed; }
    @JsonProperty("error")      public String         getError()     { return error; }
    @JsonProperty("control")    public String         getControl()   { return control; }

    @Override
    public String toString() {
        if (!hasPopup) return "InterruptResult{hasPopup=false}";
        return String.format("InterruptResult{kind=%s, action=%s, success=%s, testFailed=%s, error=%s}",
            kind, action, success, testFailed, error);
    }
}
