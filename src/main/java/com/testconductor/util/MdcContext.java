package com.testconductor.util;

import org.slf4j.MDC;

/**
 * SLF4J MDC keys used by TestConductor, so interleaved task logs can be told apart.
 */
public final class MdcContext {

    public static final String RUN_ID  = "runId";
    public static final String TASK_ID = "taskId";

    private MdcContext() {}

    public static void setRun(String runId) {
        MDC.put(RUN_ID, runId);
    }

    public static void setTask(String runId, String taskId) {
        MDC.put(RUN_ID, runId);
        MDC.put(TASK_ID, taskId);
    }

    public static void clearTask() {
        MDC.remove(TASK_ID);
    }

    public static void clear() {
        MDC.remove(RUN_ID);
        MDC.remove(TASK_ID);
    }
}
