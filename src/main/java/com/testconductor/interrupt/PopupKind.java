package com.testconductor.interrupt;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * What a wallet popup is asking the user to do.
 *
 *   SIGNATURE   -- sign a message or typed data
 *   TRANSACTION -- send a transaction or call a contract
 *   CONNECT     -- connect an account to the site
 *   UNKNOWN     -- a popup none of the rules recognised
 *   ERROR       -- the popup shows an error, or could not be read at all
 */
public enum PopupKind {
    SIGNATURE,
    TRANSACTION,
    CONNECT,
    UNKNOWN,
    ERROR;

    @JsonValue
    public String jsonName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
