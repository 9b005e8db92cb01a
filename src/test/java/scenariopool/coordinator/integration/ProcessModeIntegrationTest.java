package scenariopool.coordinator.integration;

import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;
import scenariopool.coordinator.config.PoolConfig;
import scenariopool.coordinator.model.Examples;
import scenariopool.coordinator.model.Feature;
import scenariopool.coordinator.model.RunSummary;
import scenariopool.coordinator.model.Scenario;
import scenariopool.coordinator.model.ScenarioStatus;
import scenariopool.coordinator.model.Step;
import scenariopool.coordinator.scheduler.ParallelOrchestrator;
import scenariopool.protocol.ResultMessage;
import scenariopool.testing.ScriptedExecutorFactory;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Full run with child JVM workers on the test classpath.
 */
class ProcessModeIntegrationTest {

    @TempDir
    Path resultsDir;

    @Test
    @DisplayName("Child JVM workers run items and a crash only loses its own item")
    void runsInChildJvms() {
        PoolConfig config = PoolConfig.defaults()
                .withWorkerMode(PoolConfig.WorkerMode.PROCESS)
                .withMaxWorkers(2)
                .withWorkerHeapMb(128)
                .withWorkerStartupTimeout(Duration.ofSeconds(30))
                .withScenarioTimeout(Duration.ofSeconds(30))
                .withRunTimeout(Duration.ofMinutes(2))
                .withShutdownTimeout(Duration.ofSeconds(10))
                .withResultsDir(resultsDir.toString())
                .withExecutorFactory(ScriptedExecutorFactory.class.getName());

        Scenario outline = new Scenario("Order <qty> items", List.of(),
                List.of(new Step("When ", "I order <qty> items")),
                Examples.inline(List.of("qty", "result"), List.of(
                        List.of("1", "ok"),
                        List.of("5", "fail"))));

        List<Feature> features = List.of(
                Feature.of("Orders", List.of(
                        scenario("Open basket"),
                        outline,
                        scenario("Worker dies", "@crash"),
                        scenario("Close basket", "@slow"))));

        ParallelOrchestrator orchestrator = new ParallelOrchestrator(config);
        Map<String, ResultMessage> results = orchestrator.execute(features);

        RunSummary summary = orchestrator.summary();
        assertEquals(5, summary.total());
        assertEquals(5, summary.completed());
        assertEquals(List.of("work-4"), summary.lost());
        assertFalse(summary.timedOut());

        assertEquals(4, results.size());
        assertEquals(ScenarioStatus.PASSED, results.get("work-1").status());
        assertEquals("Order 5 items", results.get("work-3").name());
        assertEquals(ScenarioStatus.FAILED, results.get("work-3").status());
        assertEquals(ScenarioStatus.PASSED, results.get("work-5").status());

        assertEquals(1, summary.aggregated().size());
        assertEquals("1 of 2 iterations failed. See comment for details.", summary.aggregated().get(0).error());
    }

    private static Scenario scenario(String name, String... tags) {
        return new Scenario(name, List.of(tags), List.of(new Step("Given ", "a basket")), null);
    }
}
