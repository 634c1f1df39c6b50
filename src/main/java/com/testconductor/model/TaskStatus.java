package com.testconductor.model;

/**
 * Terminal state of one task in a run.
 *
 *   COMPLETED -- every step succeeded
 *   FAILED    -- the task ran and at least one step failed
 *   SKIPPED   -- never executed because a dependency failed
 *   NOT_RUN   -- never dispatched because the run was aborted (fail-fast)
 *
 * Everything except COMPLETED counts as failed in the run totals.
 */
public enum TaskStatus {
    COMPLETED,
    FAILED,
    SKIPPED,
    NOT_RUN;

    public boolean isSuccess() {
        return this == COMPLETED;
    }
}
