package com.testconductor.core;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.testconductor.graph.ConfigException;
import com.testconductor.graph.DependencyGraph;
import com.testconductor.model.TaskStatus;
import com.testconductor.scheduler.RunReport;
import com.testconductor.support.FakeBrowserContext;
import com.testconductor.support.TestConductors;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * End to end through the client: task file in, report file out, against the
 * in-memory Driver.
 */
public class TestConductorClientTest {

    private Path                outputDir;
    private FakeBrowserContext  browser;
    private TestConductorClient client;

    @BeforeMethod
    public void setUp() throws Exception {
        outputDir = Files.createTempDirectory("conductor-out");
        browser   = new FakeBrowserContext();
        ConductorConfig config = ConductorConfig.builder()
            .outputDir(outputDir)
            .reportPath(outputDir.resolve("run-report.json"))
            .maxParallel(4)
            .build();
        client = new TestConductorClient(config, TestConductors.scheduler(outputDir.resolve("screenshots")),
            new TaskListLoader(), new RunReportWriter());
    }

    private static Path fixture(String name) throws Exception {
        return Paths.get(TestConductorClientTest.class.getResource("/tasks/" + name).toURI());
    }

    @Test
    public void runFile_runsTasksAndWritesReport() throws Exception {
        RunReport report = client.runFile(browser, fixture("wallet-flow.json"));

        assertThat(report.isSuccess()).isTrue();
        assertThat(report.getTotal()).isEqualTo(4);
        assertThat(browser.openedForTasks().get(0)).isIn("connect", "settings");
        assertThat(outputDir.resolve("screenshots/swap-rejected.png")).exists();
        assertThat(outputDir.resolve("screenshots/after-sign.png")).exists();

        Path written = outputDir.resolve("run-report.json");
        assertThat(written).exists();
        assertThat(new ObjectMapper().readTree(written.toFile()).get("completed").asInt()).isEqualTo(4);
    }

    @Test
    public void runFile_sequentialFileRunsOneTaskAtATime() throws Exception {
        RunReport report = client.runFile(browser, fixture("sequential.json"));

        assertThat(report.getResults()).allMatch(r -> r.getStatus() == TaskStatus.COMPLETED);
        assertThat(browser.peakOpenTaskPages()).isEqualTo(1);
    }

    @Test
    public void runFile_invalidGraphOpensNoPage() {
        assertThatThrownBy(() -> client.runFile(browser, fixture("cyclic.json")))
            .isInstanceOf(ConfigException.class);
        assertThat(browser.openedForTasks()).isEmpty();
        assertThat(outputDir.resolve("run-report.json")).doesNotExist();
    }

    @Test
    public void validate_returnsGraphWithoutRunning() throws Exception {
        DependencyGraph graph = client.validate(fixture("bare-array.json"));

        assertThat(graph.taskIds()).containsExactly("home", "search");
        assertThat(browser.openedForTasks()).isEmpty();
    }
}
