package com.testconductor.scheduler;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * The result of one {@link TaskScheduler#run}: every input task exactly once,
 * in input order, with the run totals.
 *
 * {@code failed} counts every task that did not complete, dependency skips and
 * tasks not run after an abort included.
 */
@JsonPropertyOrder({"success", "completed", "failed", "total", "aborted",
    "startedAt", "finishedAt", "durationMs", "results"})
public final class RunReport {

    private final List<TaskResult> results;
    private final boolean          aborted;
    private final Instant          startedAt;
    private final Instant          finishedAt;
    private final int              completed;
    private final int              failed;

    public RunReport(List<TaskResult> results, boolean aborted, Instant startedAt, Instant finishedAt) {
        this.results    = Collections.unmodifiableList(results);
        this.aborted    = aborted;
        this.startedAt  = startedAt;
        this.finishedAt = finishedAt;
        this.completed  = (int) results.stream().filter(TaskResult::isSuccess).count();
        this.failed     = results.size() - completed;
    }

    @JsonProperty("success")    public boolean isSuccess()    { return failed == 0; }
    @JsonProperty("completed")  public int     getCompleted() { return completed; }
    @JsonProperty("failed")     public int     getFailed()    { return failed; }
    @JsonProperty("total")      public int     getTotal()     { return results.size(); }
    @JsonProperty("aborted")    public boolean isAborted()    { return aborted; }
    @JsonProperty("startedAt")  public Instant getStartedAt() { return startedAt; }
    @JsonProperty("finishedAt") public Instant getFinishedAt() { return finishedAt; }
    @JsonProperty("results")    public List<TaskResult> getResults() { return results; }

    @JsonProperty("durationMs")
    public long getDurationMs() {
        return Duration.between(startedAt, finishedAt).toMillis();
    }

    /** The result for one task id. */
    @JsonIgnore
    public Optional<TaskResult> result(String taskId) {
        return results.stream().filter(r -> r.getTaskId().equals(taskId)).findFirst();
    }

    @Override
    public String toString() {
        return String.format("RunReport{success=%s, completed=%d, failed=%d, total=%d, aborted=%s}",
            isSuccess(), completed, failed, getTotal(), aborted);
    }
}
