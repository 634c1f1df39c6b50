package com.testconductor.executor.handlers;

import java.time.Duration;

/** Per-action defaults used when a step does not give its own timeout. */
final class DefaultTimeouts {

    static final long NAVIGATE_MS          = 15_000;
    static final long INTERACTION_MS       = 10_000;
    static final long WAIT_FOR_SELECTOR_MS = 30_000;
    static final long WAIT_MS              = 1_000;
    static final long TYPE_DELAY_MS        = 50;

    private DefaultTimeouts() {}

    static Duration orDefault(Long ms, long defaultMs) {
        return Duration.ofMillis(ms != null ? ms : defaultMs);
    }
}
