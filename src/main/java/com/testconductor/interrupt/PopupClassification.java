package com.testconductor.interrupt;

/**
 * The outcome of classifying one popup. Computed fresh for every interrupt and
 * discarded once the step that triggered it has resolved.
 *
 * Immutable -- use the static factories.
 */
public final class PopupClassification {

    public static final String SUBTYPE_PERSONAL_SIGN   = "personal_sign";
    public static final String SUBTYPE_SIGN_TYPED_DATA = "signTypedData_v4";

    private final PopupKind      kind;
    private final String         subtype;    // signature popups only
    private final PopupErrorKind errorKind;  // non-null forces rejection
    private final String         errorText;

    private PopupClassification(PopupKind kind, String subtype, PopupErrorKind errorKind, String errorText) {
        this.kind      = kind;
        this.subtype   = subtype;
        this.errorKind = errorKind;
        this.errorText = errorText;
    }

    // ── Static factories ──────────────────────────────────────────────────────

    public static PopupClassification of(PopupKind kind) {
        return new PopupClassification(kind, null, null, null);
    }

    public static PopupClassification signature(String subtype) {
        return new PopupClassification(PopupKind.SIGNATURE, subtype, null, null);
    }

    public static PopupClassification unknown() {
        return of(PopupKind.UNKNOWN);
    }

    /** A popup displaying an error; {@code kind} is the request it belongs to, when recognisable. */
    public static PopupClassification withError(PopupKind kind, PopupErrorKind errorKind, String errorText) {
        return new PopupClassification(kind, null, errorKind, errorText);
    }

    /** The popup could not be read or classified. */
    public static PopupClassification unreadable(Throwable cause) {
        return new PopupClassification(PopupKind.ERROR, null, PopupErrorKind.UNREADABLE,
            "Could not classify popup: " + cause.getMessage());
    }

    // ── Getters ───────────────────────────────────────────────────────────────

    public PopupKind      getKind()      { return kind; }
    public String         getSubtype()   { return subtype; }
    public PopupErrorKind getErrorKind() { return errorKind; }
    public String         getErrorText() { return errorText; }

    public boolean hasError() {
        return errorKind != null || kind == PopupKind.ERROR;
    }

    @Override
    public String toString() {
        return hasError()
            ? String.format("PopupClassification{kind=%s, errorKind=%s, error='%s'}", kind, errorKind, errorText)
            : String.format("PopupClassification{kind=%s, subtype=%s}", kind, subtype);
    }
}
