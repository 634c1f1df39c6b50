package com.testconductor.browser;

/**
 * Unchecked wrapper for failures inside a Driver implementation: a timed-out
 * navigation, a selector that never appeared, a script error, a closed window.
 */
public class BrowserException extends RuntimeException {

    public BrowserException(String message) {
        super(message);
    }

    public BrowserException(String message, Throwable cause) {
        super(message, cause);
    }
}
