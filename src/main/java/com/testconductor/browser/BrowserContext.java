package com.testconductor.browser;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * A browsing context: a set of pages sharing one browser profile (cookies,
 * installed extensions). Each scheduled task opens its own page here, and wallet
 * popups appear here as additional pages.
 *
 * Implementations must be safe to call from several task threads at once.
 */
public interface BrowserContext {

    /** Opens a fresh page owned by the caller. */
    BrowserPage newPage();

    /** All currently open pages, including popups the caller did not open. */
    List<BrowserPage> pages();

    /**
     * Waits up to {@code timeout} for a page that the context did not open through
     * {@link #newPage()} to appear, returning empty if none does.
     */
    Optional<BrowserPage> waitForNewPage(Duration timeout);
}
