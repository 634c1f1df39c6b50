package com.testconductor.core;

import com.testconductor.browser.BrowserContext;
import com.testconductor.browser.selenium.DriverFactory;
import com.testconductor.browser.selenium.SeleniumBrowserContext;
import com.testconductor.executor.StepExecutor;
import com.testconductor.graph.DependencyGraph;
import com.testconductor.graph.DependencyGraphBuilder;
import com.testconductor.model.Task;
import com.testconductor.scheduler.RunReport;
import com.testconductor.scheduler.SchedulerOptions;
import com.testconductor.scheduler.TaskScheduler;
import org.openqa.selenium.WebDriver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * TestConductorClient -- the entry point for running task lists.
 *
 * ## Flow
 *   1. load the task file ({@link TaskListLoader})
 *   2. validate it into a dependency graph; a bad list fails here, before any page opens
 *   3. run it with the configured concurrency ({@link TaskScheduler})
 *   4. write the JSON report when a report path is configured ({@link RunReportWriter})
 *
 * Callers that manage their own browser pass a {@link BrowserContext}; {@link #runFile(Path)}
 * launches Chrome through {@link DriverFactory} and quits it afterwards.
 *
 * A file with {@code "parallel": false} runs one task at a time.
 */
public class TestConductorClient {

    private static final Logger log = LoggerFactory.getLogger(TestConductorClient.class);

    private final ConductorConfig        config;
    private final TaskScheduler          scheduler;
    private final TaskListLoader         loader;
    private final RunReportWriter        writer;
    private final DependencyGraphBuilder graphBuilder = new DependencyGraphBuilder();

    public TestConductorClient(ConductorConfig config) {
        this(config, new TaskScheduler(new StepExecutor(config)), new TaskListLoader(), new RunReportWriter());
    }

    public TestConductorClient(ConductorConfig config, TaskScheduler scheduler,
                               TaskListLoader loader, RunReportWriter writer) {
        this.config    = config;
        this.scheduler = scheduler;
        this.loader    = loader;
        this.writer    = writer;
        log.info("TestConductor initialized. maxParallel={}, failFast={}, report={}",
            config.getMaxParallel(), config.isFailFast(),
            config.isReportEnabled() ? config.getReportPath() : "disabled");
    }

    // ── Primary API ───────────────────────────────────────────────────────────

    public RunReport run(BrowserContext context, List<Task> tasks) {
        return run(context, tasks, config.toSchedulerOptions());
    }

    public RunReport run(BrowserContext context, List<Task> tasks, SchedulerOptions options) {
        return scheduler.run(context, tasks, options);
    }

    /** Loads, runs and reports a task file against a caller-managed context. */
    public RunReport runFile(BrowserContext context, Path taskFile) {
        TaskFile file = loader.load(taskFile);
        RunReport report = run(context, file.getTasks(), optionsFor(file));
        writeReport(report);
        return report;
    }

    /** Loads and validates a task file, then runs it in a fresh Chrome session. */
    public RunReport runFile(Path taskFile) {
        TaskFile file = loader.load(taskFile);
        graphBuilder.build(file.getTasks());

        WebDriver driver = DriverFactory.createChrome(config);
        try {
            RunReport report = run(new SeleniumBrowserContext(driver), file.getTasks(), optionsFor(file));
            writeReport(report);
            return report;
        } finally {
            DriverFactory.quit(driver);
        }
    }

    /** Validates a task file without running it. */
    public DependencyGraph validate(Path taskFile) {
        return graphBuilder.build(loader.load(taskFile).getTasks());
    }

    public ConductorConfig getConfig() { return config; }

    // ── Internals ─────────────────────────────────────────────────────────────

    private SchedulerOptions optionsFor(TaskFile file) {
        SchedulerOptions base = config.toSchedulerOptions();
        if (file.isParallel()) return base;
        return new SchedulerOptions(1, base.isFailFast(), base.isStopRunningOnAbort());
    }

    private void writeReport(RunReport report) {
        if (!config.isReportEnabled()) return;
        try {
            writer.write(report, config.getReportPath());
        } catch (IOException e) {
            log.error("TestConductorClient: Failed to write report to {}: {}",
                config.getReportPath(), e.getMessage());
        }
    }
}
