package com.testconductor.browser;

import com.testconductor.model.WaitPolicy;

import java.time.Duration;

/**
 * One page of a {@link BrowserContext}. Every primitive either completes or
 * throws {@link BrowserException}; none of them retries on its own.
 */
public interface BrowserPage {

    BrowserContext context();

    String url();

    void navigate(String url, WaitPolicy waitPolicy, Duration timeout);

    void click(String selector, Duration timeout);

    void fill(String selector, String value, Duration timeout);

    void selectOption(String selector, String value, Duration timeout);

    void check(String selector, Duration timeout);

    void uncheck(String selector, Duration timeout);

    void hover(String selector, Duration timeout);

    /** Types {@code text} one character at a time, pausing {@code delayMs} between keys. */
    void type(String selector, String text, long delayMs);

    void press(String selector, String key);

    void waitForTimeout(long ms);

    void waitForSelector(String selector, Duration timeout);

    /** Returns the result of the script, converted to plain Java values. */
    Object evaluate(String script);

    byte[] screenshot(boolean fullPage);

    /** Visible text of the document body. */
    String innerText();

    /** Markup of the document body. */
    String innerHtml();

    /** True when the selector matches an element that is visible and enabled. */
    boolean isActionable(String selector);

    /** Waits until the page has been closed by someone else; false on timeout. */
    boolean waitForClose(Duration timeout);

    boolean isClosed();

    void close();
}
