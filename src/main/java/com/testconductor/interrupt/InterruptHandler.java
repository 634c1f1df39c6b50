package com.testconductor.interrupt;

import com.testconductor.browser.BrowserContext;
import com.testconductor.model.InterruptPolicy;

import java.time.Duration;

/**
 * Looks for a side-channel popup in a browsing context and answers it.
 *
 * Implementations never throw for popup problems: the outcome, including
 * failure to resolve, is described by the returned {@link InterruptResult}.
 * With {@link InterruptPolicy#IGNORE} they return {@link InterruptResult#noPopup()}
 * immediately without touching the context.
 */
public interface InterruptHandler {
    InterruptResult handle(BrowserContext context, InterruptPolicy policy, Duration waitTimeout);
}
