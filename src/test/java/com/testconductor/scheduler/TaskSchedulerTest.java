package com.testconductor.scheduler;

import com.testconductor.browser.BrowserException;
import com.testconductor.graph.ConfigException;
import com.testconductor.model.Step;
import com.testconductor.model.Task;
import com.testconductor.model.TaskStatus;
import com.testconductor.support.FakeBrowserContext;
import com.testconductor.support.FakeBrowserPage;
import com.testconductor.support.TestConductors;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Scheduling behaviour against the in-memory Driver: dependency order, skip
 * propagation, the concurrency bound, fail-fast and per-task error handling.
 */
public class TaskSchedulerTest {

    private TaskScheduler      scheduler;
    private FakeBrowserContext browser;

    @BeforeMethod
    public void setUp() throws IOException {
        scheduler = TestConductors.scheduler(Files.createTempDirectory("conductor-shots"));
        browser   = new FakeBrowserContext().failOn("#bad");
    }

    private static Task task(String id, List<String> depends, Step... steps) {
        return Task.of(id, depends, Arrays.asList(steps));
    }

    private static Task task(String id, Step... steps) {
        return task(id, List.of(), steps);
    }

    private static Consumer<FakeBrowserPage> await(CountDownLatch latch, long ms) {
        return page -> {
            try {
                if (!latch.await(ms, TimeUnit.MILLISECONDS)) {
                    throw new BrowserException("Timed out waiting for latch");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new BrowserException("Interrupted", e);
            }
        };
    }

    private static Consumer<FakeBrowserPage> sleep(long ms) {
        return page -> {
            try {
                Thread.sleep(ms);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new BrowserException("Interrupted", e);
            }
        };
    }

    // ════════════════════════════════════════════════════════════════════════
    // Dependencies
    // ════════════════════════════════════════════════════════════════════════

    @Test
    public void run_dependentsCompleteAfterTheirDependency() {
        List<Task> tasks = List.of(
            task("A", Step.navigate("https://example.com")),
            task("B", List.of("A"), Step.click("#b")),
            task("C", List.of("A"), Step.click("#c")));

        RunReport report = scheduler.run(browser, tasks, new SchedulerOptions(5, false));

        assertThat(report.isSuccess()).isTrue();
        assertThat(report.getCompleted()).isEqualTo(3);
        assertThat(report.getFailed()).isZero();
        assertThat(report.getTotal()).isEqualTo(3);
        assertThat(report.isAborted()).isFalse();
        assertThat(report.getResults()).extracting(TaskResult::getStatus)
            .containsOnly(TaskStatus.COMPLETED);

        List<String> opened = browser.openedForTasks();
        assertThat(opened.get(0)).isEqualTo("A");
        assertThat(opened).containsExactlyInAnyOrder("A", "B", "C");
    }

    @Test
    public void run_failedDependencySkipsDependentsWithoutOpeningPages() {
        List<Task> tasks = List.of(
            task("A", Step.click("#bad")),
            task("B", List.of("A"), Step.click("#b")),
            task("C", List.of("A"), Step.click("#c")));

        RunReport report = scheduler.run(browser, tasks, new SchedulerOptions(5, false));

        assertThat(report.isSuccess()).isFalse();
        assertThat(report.getFailed()).isEqualTo(3);
        assertThat(report.result("A").orElseThrow().getStatus()).isEqualTo(TaskStatus.FAILED);
        for (String id : List.of("B", "C")) {
            TaskResult skipped = report.result(id).orElseThrow();
            assertThat(skipped.getStatus()).isEqualTo(TaskStatus.SKIPPED);
            assertThat(skipped.isSkipped()).isTrue();
            assertThat(skipped.getSteps()).isEmpty();
            assertThat(skipped.getError()).isEqualTo("Skipped due to failed dependency: A");
        }
        assertThat(browser.openedForTasks()).containsExactly("A");
    }

    @Test
    public void run_skipPropagatesThroughChainListedInReverse() {
        List<Task> tasks = List.of(
            task("D", List.of("C"), Step.click("#d")),
            task("C", List.of("B"), Step.click("#c")),
            task("B", List.of("A"), Step.click("#b")),
            task("A", Step.click("#bad")));

        RunReport report = scheduler.run(browser, tasks, new SchedulerOptions(2, false));

        assertThat(report.getResults()).extracting(TaskResult::getTaskId)
            .containsExactly("D", "C", "B", "A");
        assertThat(report.result("D").orElseThrow().getStatus()).isEqualTo(TaskStatus.SKIPPED);
        assertThat(report.result("C").orElseThrow().getError()).endsWith(": B");
        assertThat(browser.openedForTasks()).containsExactly("A");
    }

    @Test
    public void run_reportsEveryTaskExactlyOnce() {
        List<Task> tasks = List.of(
            task("login", Step.navigate("https://example.com/login")),
            task("profile", List.of("login"), Step.click("#profile")),
            task("broken", List.of("login"), Step.click("#bad")),
            task("afterBroken", List.of("broken"), Step.click("#x")),
            task("settings", List.of("profile"), Step.click("#settings")),
            task("both", List.of("settings", "afterBroken"), Step.click("#y")),
            task("independent", Step.waitMs(5)));

        RunReport report = scheduler.run(browser, tasks, new SchedulerOptions(3, false));

        assertThat(report.getResults()).extracting(TaskResult::getTaskId)
            .containsExactly("login", "profile", "broken", "afterBroken", "settings", "both", "independent");
        assertThat(report.getCompleted() + report.getFailed()).isEqualTo(report.getTotal());
        assertThat(report.result("both").orElseThrow().getStatus()).isEqualTo(TaskStatus.SKIPPED);
        assertThat(report.result("settings").orElseThrow().getStatus()).isEqualTo(TaskStatus.COMPLETED);
        assertThat(browser.openedForTasks()).doesNotContain("afterBroken", "both");
    }

    @Test
    public void run_rejectsCyclicListBeforeOpeningAnyPage() {
        List<Task> tasks = List.of(
            task("A", List.of("B"), Step.click("#a")),
            task("B", List.of("A"), Step.click("#b")));

        assertThatThrownBy(() -> scheduler.run(browser, tasks, SchedulerOptions.defaults()))
            .isInstanceOf(ConfigException.class);
        assertThat(browser.openedForTasks()).isEmpty();
    }

    @Test
    public void options_rejectNonPositiveParallelism() {
        assertThatThrownBy(() -> new SchedulerOptions(0, false))
            .isInstanceOf(ConfigException.class)
            .hasMessageContaining("maxParallel");
    }

    // ════════════════════════════════════════════════════════════════════════
    // Concurrency
    // ════════════════════════════════════════════════════════════════════════

    @Test
    public void run_neverExceedsMaxParallel() {
        browser.onClick("#slow", sleep(40));
        List<Task> tasks = List.of(
            task("t1", Step.click("#slow")), task("t2", Step.click("#slow")),
            task("t3", Step.click("#slow")), task("t4", Step.click("#slow")),
            task("t5", Step.click("#slow")), task("t6", Step.click("#slow")),
            task("t7", Step.click("#slow")), task("t8", Step.click("#slow")));

        RunReport report = scheduler.run(browser, tasks, new SchedulerOptions(3, false));

        assertThat(report.isSuccess()).isTrue();
        assertThat(browser.peakOpenTaskPages()).isBetween(1, 3);
        assertThat(browser.openTaskPages()).isZero();
    }

    @Test
    public void run_independentTasksInterleave() {
        CountDownLatch aStarted = new CountDownLatch(1);
        CountDownLatch bStarted = new CountDownLatch(1);
        browser.onClick("#a-signal", p -> aStarted.countDown())
               .onClick("#a-await", await(bStarted, 2_000))
               .onClick("#b-await", await(aStarted, 2_000))
               .onClick("#b-signal", p -> bStarted.countDown());

        List<Task> tasks = List.of(
            task("A", Step.click("#a-signal"), Step.click("#a-await")),
            task("B", Step.click("#b-await"), Step.click("#b-signal")));

        RunReport report = scheduler.run(browser, tasks, new SchedulerOptions(2, false));

        assertThat(report.isSuccess()).isTrue();
        assertThat(browser.peakOpenTaskPages()).isEqualTo(2);
    }

    @Test
    public void run_singleSlotSerializesTasks() {
        CountDownLatch bStarted = new CountDownLatch(1);
        browser.onClick("#a-await", await(bStarted, 200))
               .onClick("#b-signal", p -> bStarted.countDown());

        List<Task> tasks = List.of(
            task("A", Step.click("#a-await")),
            task("B", Step.click("#b-signal")));

        RunReport report = scheduler.run(browser, tasks, new SchedulerOptions(1, false));

        assertThat(report.result("A").orElseThrow().getStatus()).isEqualTo(TaskStatus.FAILED);
        assertThat(report.result("B").orElseThrow().getStatus()).isEqualTo(TaskStatus.COMPLETED);
        assertThat(browser.peakOpenTaskPages()).isEqualTo(1);
    }

    // ════════════════════════════════════════════════════════════════════════
    // Fail fast
    // ════════════════════════════════════════════════════════════════════════

    @Test
    public void run_failFastLetsRunningTaskFinishAndDispatchesNothingNew() {
        CountDownLatch bStarted = new CountDownLatch(1);
        browser.onClick("#b-start", p -> bStarted.countDown())
               .onClick("#b-hold", sleep(300))
               .onClick("#a-wait", await(bStarted, 2_000));

        List<Task> tasks = List.of(
            task("A", Step.click("#a-wait"), Step.click("#bad")),
            task("B", Step.click("#b-start"), Step.click("#b-hold")),
            task("C", List.of("B"), Step.click("#c")),
            task("D", List.of("A"), Step.click("#d")));

        RunReport report = scheduler.run(browser, tasks, new SchedulerOptions(2, true));

        assertThat(report.isAborted()).isTrue();
        assertThat(report.result("A").orElseThrow().getStatus()).isEqualTo(TaskStatus.FAILED);
        assertThat(report.result("B").orElseThrow().getStatus()).isEqualTo(TaskStatus.COMPLETED);
        assertThat(report.result("C").orElseThrow().getStatus()).isEqualTo(TaskStatus.NOT_RUN);
        assertThat(report.result("D").orElseThrow().getStatus()).isEqualTo(TaskStatus.SKIPPED);
        assertThat(report.getFailed()).isEqualTo(3);
        assertThat(browser.openedForTasks()).containsExactlyInAnyOrder("A", "B");
    }

    @Test
    public void run_stopRunningOnAbortStopsAtNextStepBoundary() {
        CountDownLatch bStarted = new CountDownLatch(1);
        browser.onClick("#b-start", p -> bStarted.countDown())
               .onClick("#b-hold", sleep(300))
               .onClick("#a-wait", await(bStarted, 2_000));

        List<Task> tasks = List.of(
            task("A", Step.click("#a-wait"), Step.click("#bad")),
            task("B", Step.click("#b-start"), Step.click("#b-hold"), Step.click("#b-after")));

        RunReport report = scheduler.run(browser, tasks, new SchedulerOptions(2, true, true));

        TaskResult b = report.result("B").orElseThrow();
        assertThat(b.getStatus()).isEqualTo(TaskStatus.FAILED);
        assertThat(b.getSteps()).hasSize(2).allMatch(s -> s.isSuccess());
        assertThat(b.getError()).startsWith("Run aborted before step");
        assertThat(browser.events()).contains("B:click #b-hold").doesNotContain("B:click #b-after");
    }

    @Test
    public void run_withoutFailFastKeepsDispatchingIndependentWork() {
        List<Task> tasks = List.of(
            task("A", Step.click("#bad")),
            task("B", Step.click("#b")),
            task("C", List.of("B"), Step.click("#c")));

        RunReport report = scheduler.run(browser, tasks, new SchedulerOptions(1, false));

        assertThat(report.isAborted()).isFalse();
        assertThat(report.getCompleted()).isEqualTo(2);
        assertThat(report.result("C").orElseThrow().getStatus()).isEqualTo(TaskStatus.COMPLETED);
    }

    // ════════════════════════════════════════════════════════════════════════
    // Step errors inside a task
    // ════════════════════════════════════════════════════════════════════════

    @Test
    public void run_stopOnErrorAbortsRemainingStepsButKeepsEarlierResults() {
        List<Task> tasks = List.of(
            task("A", Step.click("#ok"), Step.click("#bad"), Step.click("#never")));

        TaskResult a = scheduler.run(browser, tasks, SchedulerOptions.defaults()).result("A").orElseThrow();

        assertThat(a.getStatus()).isEqualTo(TaskStatus.FAILED);
        assertThat(a.getSteps()).hasSize(2);
        assertThat(a.getSteps().get(0).isSuccess()).isTrue();
        assertThat(a.getSteps().get(1).isSuccess()).isFalse();
        assertThat(a.getSteps().get(1).getError()).contains("#bad");
        assertThat(browser.events()).doesNotContain("A:click #never");
    }

    @Test
    public void run_stopOnErrorFalseContinuesButStillFailsTask() {
        Task lenient = task("A", Step.click("#bad"), Step.click("#after")).withStopOnError(false);

        TaskResult a = scheduler.run(browser, List.of(lenient), SchedulerOptions.defaults())
            .result("A").orElseThrow();

        assertThat(a.getStatus()).isEqualTo(TaskStatus.FAILED);
        assertThat(a.getSteps()).extracting(s -> s.isSuccess()).containsExactly(false, true);
        assertThat(a.getError()).contains("#bad");
        assertThat(browser.events()).contains("A:click #after");
    }

    @Test
    public void run_closesEveryTaskPage() {
        List<Task> tasks = List.of(
            task("A", Step.click("#a")),
            task("B", Step.click("#bad")));

        scheduler.run(browser, tasks, SchedulerOptions.defaults());

        assertThat(browser.openTaskPages()).isZero();
    }
}
