package com.testconductor.scheduler;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One-way abort latch shared by the control loop and the task bodies of one run.
 * Only the loop sets it; task bodies only read it, between steps.
 */
public final class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean();

    /** Sets the latch; returns true only for the call that set it. */
    public boolean cancel() {
        return cancelled.compareAndSet(false, true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }
}
