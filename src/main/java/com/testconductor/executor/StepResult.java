package com.testconductor.executor;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.testconductor.interrupt.InterruptResult;
import com.testconductor.model.Step;

/**
 * The recorded outcome of one step, as it appears in the run report.
 *
 * {@code value} is set for steps that produce one (the result of {@code evaluate},
 * the screenshot file). {@code interrupt} is set when a popup was found after the step.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"step", "success", "error", "value", "screenshot", "interrupt", "durationMs"})
public final class StepResult {

    private final Step            step;
    private final boolean         success;
    private final String          error;
    private final Object          value;
    private final String          screenshot;
    private final InterruptResult interrupt;
    private final long            durationMs;

    private StepResult(Step step, boolean success, String error, Object value,
                       String screenshot, InterruptResult interrupt, long durationMs) {
        this.step       = step;
        this.success    = success;
        this.error      = error;
        this.value      = value;
        this.screenshot = screenshot;
        this.interrupt  = interrupt;
        this.durationMs = durationMs;
    }

    public static StepResult succeeded(Step step, Object value, String screenshot,
                                       InterruptResult interrupt, long durationMs) {
        return new StepResult(step, true, null, value, screenshot, visible(interrupt), durationMs);
    }

    public static StepResult failed(Step step, String error, InterruptResult interrupt, long durationMs) {
        return new StepResult(step, false, error, null, null, visible(interrupt), durationMs);
    }

    private static InterruptResult visible(InterruptResult interrupt) {
        return (interrupt != null && interrupt.hasPopup()) ? interrupt : null;
    }

    public Step            getStep()       { return step; }
    public boolean         isSuccess()     { return success; }
    public String          getError()      { return error; }
    public Object          getValue()      { return value; }
    public String          getScreenshot() { return screenshot; }
    public InterruptResult getInterrupt()  { return interrupt; }
    public long            getDurationMs() { return durationMs; }

    @Override
    public String toString() {
        return success
            ? "StepResult{" + step.describe() + ", success}"
            : "StepResult{" + step.describe() + ", error='" + error + "'}";
    }
}
