package com.testconductor.scheduler;

import com.testconductor.browser.BrowserContext;
import com.testconductor.executor.StepExecutor;
import com.testconductor.graph.DependencyGraph;
import com.testconductor.graph.DependencyGraphBuilder;
import com.testconductor.model.Task;
import com.testconductor.util.MdcContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs a task list with bounded concurrency, honouring dependencies.
 *
 * <h3>Control loop</h3>
 * One thread (the caller's) owns the {@link ExecutionState}. Each iteration:
 * <ol>
 *   <li>marks tasks with a failed dependency as skipped, transitively</li>
 *   <li>unless aborted, dispatches ready tasks in input order while fewer than
 *       {@code maxParallel} are running</li>
 *   <li>exits if nothing is running</li>
 *   <li>blocks until any one running task reports back, and applies its result</li>
 * </ol>
 * Task bodies run on a pool of {@code maxParallel} worker threads and report
 * through a queue; they never touch the state sets. A slot freed by one task is
 * refilled on the next iteration without waiting for the others.
 *
 * <h3>Abort</h3>
 * With {@code failFast}, the first task failure latches the run as aborted: no
 * further dispatch, running tasks finish (or, with {@code stopRunningOnAbort},
 * stop at their next step boundary), and tasks never dispatched are reported
 * as {@link com.testconductor.model.TaskStatus#NOT_RUN}.
 */
public class TaskScheduler {

    private static final Logger log = LoggerFactory.getLogger(TaskScheduler.class);

    private final StepExecutor           executor;
    private final DependencyGraphBuilder graphBuilder;

    public TaskScheduler(StepExecutor executor) {
        this(executor, new DependencyGraphBuilder());
    }

    public TaskScheduler(StepExecutor executor, DependencyGraphBuilder graphBuilder) {
        this.executor     = executor;
        this.graphBuilder = graphBuilder;
    }

    /**
     * Validates and runs {@code tasks} against {@code context}.
     *
     * @throws com.testconductor.graph.ConfigException if the task list is invalid;
     *         nothing has been executed in that case
     */
    public RunReport run(BrowserContext context, List<Task> tasks, SchedulerOptions options) {
        DependencyGraph graph = graphBuilder.build(tasks);
        String runId = UUID.randomUUID().toString().substring(0, 8);
        MdcContext.setRun(runId);

        ExecutionState            state       = new ExecutionState(graph);
        CancellationToken         token       = new CancellationToken();
        BlockingQueue<TaskResult> completions = new LinkedBlockingQueue<>();
        TaskRunner                runner      = new TaskRunner(executor, context, token,
                                                    options.isStopRunningOnAbort(), runId);
        ExecutorService           pool        = Executors.newFixedThreadPool(
                                                    options.getMaxParallel(), workerThreads(runId));

        log.info("TaskScheduler: run {} starting {} task(s) with {}", runId, graph.size(), options);
        Instant startedAt = Instant.now();
        boolean interrupted = false;
        try {
            while (true) {
                for (TaskResult skip : state.sweepDependencySkips()) {
                    log.info("TaskScheduler: skipped {}: {}", skip.getTaskId(), skip.getError());
                }

                if (!state.isAborted()) {
                    for (String id : state.readyTasks()) {
                        if (state.runningCount() >= options.getMaxParallel()) break;
                        dispatch(graph.task(id), state, runner, pool, completions);
                    }
                }

                if (state.runningCount() == 0) break;

                TaskResult result;
                try {
                    result = completions.take();
                } catch (InterruptedException e) {
                    // Running tasks are never abandoned: stop dispatching and keep draining.
                    interrupted = true;
                    abort(state, token, "caller thread interrupted");
                    continue;
                }
                state.finish(result);

                if (!result.isSuccess() && options.isFailFast() && !state.isAborted()) {
                    abort(state, token, "task " + result.getTaskId() + " failed");
                }
            }

            for (TaskResult notRun : state.markUndispatched()) {
                log.info("TaskScheduler: not run: {}", notRun.getTaskId());
            }
        } finally {
            pool.shutdown();
            MdcContext.clear();
            if (interrupted) Thread.currentThread().interrupt();
        }

        RunReport report = state.toReport(startedAt, Instant.now());
        log.info("TaskScheduler: run {} finished: {} (peak concurrency {})",
            runId, report, state.peakRunning());
        return report;
    }

    private void dispatch(Task task, ExecutionState state, TaskRunner runner,
                          ExecutorService pool, BlockingQueue<TaskResult> completions) {
        CompletableFuture<TaskResult> handle = CompletableFuture.supplyAsync(() -> runner.run(task), pool);
        state.markRunning(task.getId(), handle);
        handle.whenComplete((result, error) -> completions.add(result != null
            ? result
            : TaskResult.failed(task.getId(), List.of(), "Task crashed: " + error, 0)));
        log.debug("TaskScheduler: dispatched {} ({} running)", task.getId(), state.runningCount());
    }

    private static void abort(ExecutionState state, CancellationToken token, String reason) {
        state.abort();
        if (token.cancel()) {
            log.warn("TaskScheduler: run aborted ({}); no further tasks will be dispatched", reason);
        }
    }

    private static ThreadFactory workerThreads(String runId) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, "conductor-" + runId + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
