package com.testconductor.executor;

/**
 * The result of a single handler's execution attempt.
 *
 *   EXECUTED -- the action was performed against the page
 *   SKIPPED  -- nothing was done and that is not a failure (evidence that could not be saved)
 *   FAILED   -- the action threw or did not take effect
 */
public enum ActionOutcome {
    EXECUTED,
    SKIPPED,
    FAILED
}
