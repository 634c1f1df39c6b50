package com.testconductor.scheduler;

import com.testconductor.graph.DependencyGraph;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * Mutable state of one scheduler run, owned by the control loop in
 * {@link TaskScheduler}. Not thread-safe and never handed to task bodies:
 * tasks report back through their futures and the loop applies the transition.
 *
 * A task id is in at most one of {@code completed}, {@code failed} and
 * {@code running}; once completed or failed it never moves again.
 */
final class ExecutionState {

    private final DependencyGraph graph;

    private final Set<String>                                   completed = new LinkedHashSet<>();
    private final Set<String>                                   failed    = new LinkedHashSet<>();
    private final Map<String, CompletableFuture<TaskResult>>    running   = new LinkedHashMap<>();
    private final Map<String, TaskResult>                       results   = new HashMap<>();

    private boolean aborted;
    private int     peakRunning;

    ExecutionState(DependencyGraph graph) {
        this.graph = graph;
    }

    // ── Queries ───────────────────────────────────────────────────────────────

    boolean isPending(String taskId) {
        return !completed.contains(taskId) && !failed.contains(taskId) && !running.containsKey(taskId);
    }

    /** Pending tasks whose dependencies have all completed, in input order. */
    List<String> readyTasks() {
        List<String> ready = new ArrayList<>();
        for (String id : graph.taskIds()) {
            if (isPending(id) && completed.containsAll(graph.dependenciesOf(id))) {
                ready.add(id);
            }
        }
        return ready;
    }

    int     runningCount() { return running.size(); }
    int     peakRunning()  { return peakRunning; }
    boolean isAborted()    { return aborted; }

    // ── Transitions ───────────────────────────────────────────────────────────

    /**
     * Marks every pending task with a failed dependency as skipped, repeating until
     * nothing changes so a whole chain of dependents resolves in one call.
     *
     * @return the newly skipped results, in the order they were applied
     */
    List<TaskResult> sweepDependencySkips() {
        List<TaskResult> skipped = new ArrayList<>();
        boolean changed = true;
        while (changed) {
            changed = false;
            for (String id : graph.taskIds()) {
                if (!isPending(id)) continue;
                Optional<String> failedDep = graph.dependenciesOf(id).stream()
                    .filter(failed::contains)
                    .findFirst();
                if (failedDep.isPresent()) {
                    TaskResult result = TaskResult.skipped(id, failedDep.get());
                    record(result);
                    skipped.add(result);
                    changed = true;
                }
            }
        }
        return skipped;
    }

    void markRunning(String taskId, CompletableFuture<TaskResult> handle) {
        if (!isPending(taskId)) {
            throw new IllegalStateException("Task " + taskId + " is not pending");
        }
        running.put(taskId, handle);
        peakRunning = Math.max(peakRunning, running.size());
    }

    /** Applies the outcome reported by a running task. */
    void finish(TaskResult result) {
        if (running.remove(result.getTaskId()) == null) {
            throw new IllegalStateException("Task " + result.getTaskId() + " finished but was not running");
        }
        record(result);
    }

    /** Records every task that was never dispatched as not run. */
    List<TaskResult> markUndispatched() {
        List<TaskResult> notRun = new ArrayList<>();
        for (String id : graph.taskIds()) {
            if (isPending(id)) {
                TaskResult result = TaskResult.notRun(id);
                record(result);
                notRun.add(result);
            }
        }
        return notRun;
    }

    void abort() {
        aborted = true;
    }

    RunReport toReport(Instant startedAt, Instant finishedAt) {
        List<TaskResult> ordered = new ArrayList<>(graph.size());
        for (String id : graph.taskIds()) {
            TaskResult result = results.get(id);
            if (result == null) {
                throw new IllegalStateException("Task " + id + " has no result");
            }
            ordered.add(result);
        }
        return new RunReport(ordered, aborted, startedAt, finishedAt);
    }

    private void record(TaskResult result) {
        String id = result.getTaskId();
        if (result.isSuccess()) completed.add(id);
        else failed.add(id);
        results.put(id, result);
    }
}
