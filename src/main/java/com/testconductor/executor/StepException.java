package com.testconductor.executor;

import com.testconductor.interrupt.InterruptResult;
import com.testconductor.model.Step;

/**
 * Raised by {@link StepExecutor} when a step fails: the action itself failed, or
 * the popup it triggered showed an error or could not be answered.
 *
 * Local to one task. The scheduler records it against the task and, when the
 * task's {@code stopOnError} is set, stops running that task's remaining steps.
 */
public class StepException extends Exception {

    public enum Reason {
        ACTION_FAILED,
        INTERRUPT_REJECTED_ERROR,
        INTERRUPT_UNRESOLVED,
        NO_HANDLER
    }

    private final Step            step;
    private final Reason          reason;
    private final InterruptResult interrupt;
    private final long            durationMs;

    public StepException(Step step, Reason reason, String message, Throwable cause,
                         InterruptResult interrupt, long durationMs) {
        super(message, cause);
        this.step       = step;
        this.reason     = reason;
        this.interrupt  = interrupt;
        this.durationMs = durationMs;
    }

    public Step            getStep()       { return step; }
    public Reason          getReason()     { return reason; }
    public InterruptResult getInterrupt()  { return interrupt; }
    public long            getDurationMs() { return durationMs; }

    /** The step result to record for this failure. */
    public StepResult toStepResult() {
        return StepResult.failed(step, getMessage(), interrupt, durationMs);
    }
}
