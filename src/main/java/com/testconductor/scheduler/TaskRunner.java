package com.testconductor.scheduler;

import com.testconductor.browser.BrowserContext;
import com.testconductor.browser.BrowserPage;
import com.testconductor.executor.StepException;
import com.testconductor.executor.StepExecutor;
import com.testconductor.executor.StepResult;
import com.testconductor.model.Step;
import com.testconductor.model.Task;
import com.testconductor.util.MdcContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs the body of one task on a worker thread: opens the task's own page, runs
 * its steps in order and closes the page.
 *
 * Never throws. Step failures and unexpected exceptions become a failed
 * {@link TaskResult}; the control loop applies it.
 */
class TaskRunner {

    private static final Logger log = LoggerFactory.getLogger(TaskRunner.class);

    private final StepExecutor      executor;
    private final BrowserContext    context;
    private final CancellationToken token;
    private final boolean           stopOnAbort;
    private final String            runId;

    TaskRunner(StepExecutor executor, BrowserContext context, CancellationToken token,
               boolean stopOnAbort, String runId) {
        this.executor    = executor;
        this.context     = context;
        this.token       = token;
        this.stopOnAbort = stopOnAbort;
        this.runId       = runId;
    }

    TaskResult run(Task task) {
        MdcContext.setTask(runId, task.getId());
        long start = System.currentTimeMillis();
        List<StepResult> steps = new ArrayList<>();
        String error = null;
        BrowserPage page = null;
        try {
            log.info("TaskRunner: starting task {} ({} steps)", task.getId(), task.getSteps().size());
            page = context.newPage();
            for (Step step : task.getSteps()) {
                if (stopOnAbort && token.isCancelled()) {
                    error = firstOf(error, "Run aborted before step: " + step.describe());
                    break;
                }
                try {
                    steps.add(executor.execute(page, step));
                } catch (StepException e) {
                    steps.add(e.toStepResult());
                    error = firstOf(error, e.getMessage());
                    log.warn("TaskRunner: step '{}' failed in task {}: {}",
                        step.describe(), task.getId(), e.getMessage());
                    if (task.isStopOnError()) break;
                }
            }
        } catch (RuntimeException e) {
            error = firstOf(error, "Task aborted by unexpected error: " + e.getMessage());
            log.error("TaskRunner: task {} crashed", task.getId(), e);
        } finally {
            closeQuietly(page, task.getId());
            MdcContext.clearTask();
        }

        long duration = System.currentTimeMillis() - start;
        if (error == null) {
            log.info("TaskRunner: task {} completed in {}ms", task.getId(), duration);
            return TaskResult.completed(task.getId(), steps, duration);
        }
        log.info("TaskRunner: task {} failed in {}ms: {}", task.getId(), duration, error);
        return TaskResult.failed(task.getId(), steps, error, duration);
    }

    private static String firstOf(String existing, String candidate) {
        return existing != null ? existing : candidate;
    }

    private static void closeQuietly(BrowserPage page, String taskId) {
        if (page == null) return;
        try {
            page.close();
        } catch (RuntimeException e) {
            log.warn("TaskRunner: could not close page of task {}: {}", taskId, e.getMessage());
        }
    }
}
