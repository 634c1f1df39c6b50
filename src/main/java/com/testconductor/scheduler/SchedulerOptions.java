package com.testconductor.scheduler;

import com.testconductor.graph.ConfigException;

/**
 * Knobs for one {@link TaskScheduler#run} call.
 *
 *   maxParallel        -- tasks in flight at once, at least 1 (default 5)
 *   failFast           -- stop dispatching after the first task failure
 *   stopRunningOnAbort -- after an abort, tasks already running stop at their next
 *                         step boundary instead of finishing; never mid-step
 */
public final class SchedulerOptions {

    public static final int DEFAULT_MAX_PARALLEL = 5;

    private final int     maxParallel;
    private final boolean failFast;
    private final boolean stopRunningOnAbort;

    public SchedulerOptions(int maxParallel, boolean failFast, boolean stopRunningOnAbort) {
        if (maxParallel < 1) {
            throw ConfigException.invalidOptions("maxParallel must be at least 1, was " + maxParallel);
        }
        this.maxParallel        = maxParallel;
        this.failFast           = failFast;
        this.stopRunningOnAbort = stopRunningOnAbort;
    }

    public SchedulerOptions(int maxParallel, boolean failFast) {
        this(maxParallel, failFast, false);
    }

    public static SchedulerOptions defaults() {
        return new SchedulerOptions(DEFAULT_MAX_PARALLEL, false, false);
    }

    public int     getMaxParallel()        { return maxParallel; }
    public boolean isFailFast()            { return failFast; }
    public boolean isStopRunningOnAbort()  { return stopRunningOnAbort; }

    @Override
    public String toString() {
        return "SchedulerOptions{maxParallel=" + maxParallel + ", failFast=" + failFast +
            ", stopRunningOnAbort=" + stopRunningOnAbort + "}";
    }
}
