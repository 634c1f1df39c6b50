package com.testconductor.scheduler;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.testconductor.executor.StepResult;
import com.testconductor.model.TaskStatus;

import java.util.Collections;
import java.util.List;

/**
 * Final outcome of one task in a run.
 *
 *   COMPLETED -- every step succeeded
 *   FAILED    -- a step failed, or the task body crashed
 *   SKIPPED   -- a dependency failed; the task was never started
 *   NOT_RUN   -- the run aborted before the task was dispatched
 *
 * Step results of a failed task are kept up to and including the failing step.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"taskId", "status", "success", "skipped", "steps", "error", "durationMs"})
public final class TaskResult {

    private final String           taskId;
    private final TaskStatus       status;
    private final List<StepResult> steps;
    private final String           error;
    private final long             durationMs;

    private TaskResult(String taskId, TaskStatus status, List<StepResult> steps, String error, long durationMs) {
        this.taskId     = taskId;
        this.status     = status;
        this.steps      = steps != null ? Collections.unmodifiableList(steps) : Collections.emptyList();
        this.error      = error;
        this.durationMs = durationMs;
    }

    // ── Static factories ──────────────────────────────────────────────────────

    public static TaskResult completed(String taskId, List<StepResult> steps, long durationMs) {
        return new TaskResult(taskId, TaskStatus.COMPLETED, steps, null, durationMs);
    }

    public static TaskResult failed(String taskId, List<StepResult> steps, String error, long durationMs) {
        return new TaskResult(taskId, TaskStatus.FAILED, steps, error, durationMs);
    }

    public static TaskResult skipped(String taskId, String failedDependency) {
        return new TaskResult(taskId, TaskStatus.SKIPPED, null,
            "Skipped due to failed dependency: " + failedDependency, 0);
    }

    public static TaskResult notRun(String taskId) {
        return new TaskResult(taskId, TaskStatus.NOT_RUN, null,
            "Not run: the run was aborted before this task started", 0);
    }

    // ── Getters ───────────────────────────────────────────────────────────────

    public String           getTaskId()     { return taskId; }
    public TaskStatus       getStatus()     { return status; }
    public List<StepResult> getSteps()      { return steps; }
    public String           getError()      { return error; }
    public long             getDurationMs() { return durationMs; }

    public boolean isSuccess() { return status.isSuccess(); }

    /** Present in JSON only for dependency skips. */
    @JsonInclude(JsonInclude.Include.NON_DEFAULT)
    public boolean isSkipped() { return status == TaskStatus.SKIPPED; }

    @JsonIgnore
    public boolean isNotRun()  { return status == TaskStatus.NOT_RUN; }

    @Override
    public String toString() {
        return error == null
            ? String.format("TaskResult{%s, %s}", taskId, status)
            : String.format("TaskResult{%s, %s, error='%s'}", taskId, status, error);
    }
}
