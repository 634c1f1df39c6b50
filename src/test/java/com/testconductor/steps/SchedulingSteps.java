package com.testconductor.steps;

import com.testconductor.browser.BrowserException;
import com.testconductor.context.ScenarioContext;
import com.testconductor.core.TaskListLoader;
import com.testconductor.graph.ConfigException;
import com.testconductor.model.Step;
import com.testconductor.model.Task;
import com.testconductor.model.TaskStatus;
import com.testconductor.scheduler.RunReport;
import com.testconductor.scheduler.SchedulerOptions;
import com.testconductor.scheduler.TaskResult;
import io.cucumber.java.en.And;
import io.cucumber.java.en.Given;
import io.cucumber.java.en.Then;
import io.cucumber.java.en.When;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.InputStream;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Step definitions for building task lists, running them and checking the
 * report.
 *
 * Each task built here has a single step clicking {@code #<id>}, so a task can
 * be made to fail or to take time by scripting that selector.
 */
public class SchedulingSteps {

    private static final Logger log = LoggerFactory.getLogger(SchedulingSteps.class);

    private final ScenarioContext ctx;

    public SchedulingSteps(ScenarioContext ctx) {
        this.ctx = ctx;
    }

    // ── Building the task list ────────────────────────────────────────────────

    @Given("a task {string} with no dependencies")
    public void aTaskWithNoDependencies(String id) {
        ctx.addTask(Task.of(id, List.of(), List.of(Step.click("#" + id))));
    }

    @Given("a task {string} depending on {string}")
    public void aTaskDependingOn(String id, String depends) {
        List<String> deps = Arrays.stream(depends.split(",")).map(String::trim).toList();
        ctx.addTask(Task.of(id, deps, List.of(Step.click("#" + id))));
    }

    @Given("{int} independent slow tasks")
    public void independentSlowTasks(int count) {
        for (int i = 1; i <= count; i++) {
            String id = "slow-" + i;
            ctx.getBrowser().onClick("#" + id, page -> pause(50));
            ctx.addTask(Task.of(id, List.of(), List.of(Step.click("#" + id))));
        }
    }

    @Given("the task list {string}")
    public void theTaskList(String fixture) throws Exception {
        try (InputStream in = getClass().getResourceAsStream("/tasks/" + fixture)) {
            assertThat(in).as("fixture %s", fixture).isNotNull();
            new TaskListLoader().read(in, fixture).getTasks().forEach(ctx::addTask);
        }
    }

    @And("task {string} fails")
    public void taskFails(String id) {
        ctx.getBrowser().failOn("#" + id);
    }

    // ── Running ───────────────────────────────────────────────────────────────

    @When("the tasks run with at most {int} in parallel")
    public void theTasksRun(int maxParallel) {
        run(new SchedulerOptions(maxParallel, false));
    }

    @When("the tasks run with at most {int} in parallel and fail fast")
    public void theTasksRunFailFast(int maxParallel) {
        run(new SchedulerOptions(maxParallel, true));
    }

    private void run(SchedulerOptions options) {
        try {
            RunReport report = ctx.getScheduler().run(ctx.getBrowser(), ctx.getTasks(), options);
            ctx.setReport(report);
            log.info("SchedulingSteps: {}", report);
        } catch (ConfigException e) {
            ctx.setConfigError(e);
            log.info("SchedulingSteps: task list rejected: {}", e.getMessage());
        }
    }

    // ── Run outcome ───────────────────────────────────────────────────────────

    @Then("the run succeeds")
    public void theRunSucceeds() {
        assertThat(report().isSuccess()).as("run success; %s", report()).isTrue();
    }

    @Then("the run fails")
    public void theRunFails() {
        assertThat(report().isSuccess()).isFalse();
    }

    @Then("the run is aborted")
    public void theRunIsAborted() {
        assertThat(report().isAborted()).isTrue();
    }

    @Then("task {string} is {string}")
    public void taskIs(String id, String status) {
        TaskStatus expected = TaskStatus.valueOf(status.trim().replace(' ', '_').toUpperCase(Locale.ROOT));
        assertThat(result(id).getStatus()).as("status of %s", id).isEqualTo(expected);
    }

    @Then("the error of task {string} mentions {string}")
    public void theErrorOfTaskMentions(String id, String text) {
        assertThat(result(id).getError()).contains(text);
    }

    @Then("every task appears exactly once in the report")
    public void everyTaskAppearsExactlyOnce() {
        List<String> expected = ctx.getTasks().stream().map(Task::getId).toList();
        assertThat(report().getResults()).extracting(TaskResult::getTaskId)
            .containsExactlyElementsOf(expected);
    }

    @Then("a configuration error of kind {string} is raised")
    public void aConfigurationErrorIsRaised(String kind) {
        assertThat(ctx.getConfigError()).as("configuration error").isNotNull();
        assertThat(ctx.getConfigError().getKind()).isEqualTo(ConfigException.Kind.valueOf(kind));
        assertThat(ctx.getReport()).isNull();
    }

    // ── Driver interactions ───────────────────────────────────────────────────

    @Then("task {string} started after task {string}")
    public void taskStartedAfter(String later, String earlier) {
        List<String> opened = ctx.getBrowser().openedForTasks();
        assertThat(opened).contains(later, earlier);
        assertThat(opened.indexOf(later)).isGreaterThan(opened.indexOf(earlier));
    }

    @Then("no page was opened for task {string}")
    public void noPageWasOpenedFor(String id) {
        assertThat(ctx.getBrowser().openedForTasks()).doesNotContain(id);
    }

    @Then("no task page was opened")
    public void noTaskPageWasOpened() {
        assertThat(ctx.getBrowser().openedForTasks()).isEmpty();
    }

    @Then("no more than {int} task pages were open at once")
    public void noMoreThanTaskPagesOpenAtOnce(int max) {
        assertThat(ctx.getBrowser().peakOpenTaskPages()).isBetween(1, max);
    }

    // ── Helpers ───────────────────────────────────────────────────────────────

    private RunReport report() {
        assertThat(ctx.getReport()).as("run report").isNotNull();
        return ctx.getReport();
    }

    private TaskResult result(String id) {
        return report().result(id).orElseThrow(() -> new AssertionError("No result for task " + id));
    }

    private static void pause(long ms) {
        try {
            Thread.sleep(ms);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new BrowserException("Interrupted", e);
        }
    }
}
