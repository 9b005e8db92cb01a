package scenariopool.coordinator.config;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class PoolConfigTest {

    @Test
    void defaults() {
        PoolConfig config = PoolConfig.defaults();

        assertEquals(Runtime.getRuntime().availableProcessors(), config.maxWorkers());
        assertEquals(PoolConfig.WorkerMode.PROCESS, config.workerMode());
        assertEquals(Duration.ofSeconds(15), config.workerStartupTimeout());
        assertEquals(Duration.ofSeconds(120), config.scenarioTimeout());
        assertEquals(Duration.ofMinutes(10), config.runTimeout());
        assertEquals(Duration.ofMillis(100), config.healthCheckInterval());
        assertEquals(5, config.maxWorkerErrors());
        assertTrue(config.reuseWorkers());
        assertEquals(1024, config.workerHeapMb());
        assertEquals("reports/test-results", config.resultsDir());
        assertEquals("common", config.project());
        assertNull(config.executorFactory());
        assertEquals(10, config.metricsEvery());
        assertSame(config, config.validate());
    }

    @Test
    void fromEnvironment() {
        Map<String, String> env = new HashMap<>();
        env.put("PARALLEL_WORKERS", "3");
        env.put("WORKER_MODE", "thread");
        env.put("SCENARIO_TIMEOUT_MS", "5000");
        env.put("WORKER_STARTUP_TIMEOUT_MS", "2000");
        env.put("MAX_WORKER_ERRORS", "2");
        env.put("REUSE_WORKERS", "false");
        env.put("WORKER_HEAP_SIZE", "512");
        env.put("TEST_RESULTS_DIR", "out/results");
        env.put("PROJECT", "shop");
        env.put("EXECUTOR_FACTORY", "com.example.Factory");
        env.put("BROWSER_REUSE_ENABLED", "true");
        env.put("BROWSER_REUSE_CLEAR_STATE", "false");
        env.put("BROWSER_REUSE_CLOSE_AFTER_SCENARIOS", "20");
        env.put("DEBUG_WORKERS", "true");

        PoolConfig config = PoolConfig.fromEnv(env);

        assertEquals(3, config.maxWorkers());
        assertEquals(PoolConfig.WorkerMode.THREAD, config.workerMode());
        assertEquals(Duration.ofSeconds(5), config.scenarioTimeout());
        assertEquals(Duration.ofSeconds(2), config.workerStartupTimeout());
        assertEquals(2, config.maxWorkerErrors());
        assertFalse(config.reuseWorkers());
        assertEquals(512, config.workerHeapMb());
        assertEquals("out/results", config.resultsDir());
        assertEquals("shop", config.project());
        assertEquals("com.example.Factory", config.executorFactory());
        assertTrue(config.resourceReuse());
        assertFalse(config.clearStateOnReuse());
        assertEquals(20, config.restartAfterScenarios());
        assertTrue(config.debugWorkers());
    }

    @Test
    void blankEnvironmentValuesAreIgnored() {
        PoolConfig config = PoolConfig.fromEnv(Map.of("PARALLEL_WORKERS", "  ", "PROJECT", ""));

        assertEquals(Runtime.getRuntime().availableProcessors(), config.maxWorkers());
        assertEquals("common", config.project());
    }

    @Test
    void invalidEnvironmentValues() {
        assertThrows(IllegalArgumentException.class, () -> PoolConfig.fromEnv(Map.of("PARALLEL_WORKERS", "many")));
        assertThrows(IllegalArgumentException.class, () -> PoolConfig.fromEnv(Map.of("WORKER_MODE", "fiber")));
    }

    @Test
    void validateRejectsOutOfRange() {
        assertThrows(IllegalArgumentException.class, () -> PoolConfig.defaults().withMaxWorkers(0).validate());
        assertThrows(IllegalArgumentException.class,
                () -> PoolConfig.defaults().withScenarioTimeout(Duration.ZERO).validate());
        assertThrows(IllegalArgumentException.class, () -> PoolConfig.defaults().withMetricsEvery(0).validate());
        assertThrows(IllegalArgumentException.class, () -> PoolConfig.defaults().withWorkerHeapMb(8).validate());
    }

    @Test
    void workerConfigNamedKeysWinOverProperties() {
        PoolConfig config = PoolConfig.defaults()
                .withProject("shop")
                .withExecutorFactory("com.example.Factory")
                .withProperty("baseUrl", "https://shop.test")
                .withProperty(PoolConfig.KEY_PROJECT, "ignored");

        Map<String, String> map = config.workerConfig();

        assertEquals("https://shop.test", map.get("baseUrl"));
        assertEquals("shop", map.get(PoolConfig.KEY_PROJECT));
        assertEquals("com.example.Factory", map.get(PoolConfig.KEY_EXECUTOR_FACTORY));
        assertEquals("10", map.get(PoolConfig.KEY_METRICS_EVERY));
        assertEquals("false", map.get(PoolConfig.KEY_RESOURCE_REUSE));
    }

    @Test
    void copyIsIndependent() {
        PoolConfig original = PoolConfig.defaults()
                .withMaxWorkers(3)
                .withScenarioTimeout(Duration.ofSeconds(7))
                .withExecutorFactory("com.example.Factory")
                .withProperty("baseUrl", "http://localhost");

        PoolConfig copy = original.copy();
        original.withReuseWorkers(false).withProperty("baseUrl", "http://changed");
        copy.withWorkerMode(PoolConfig.WorkerMode.THREAD);

        assertEquals(3, copy.maxWorkers());
        assertEquals(Duration.ofSeconds(7), copy.scenarioTimeout());
        assertEquals("com.example.Factory", copy.executorFactory());
        assertTrue(copy.reuseWorkers());
        assertEquals("http://localhost", copy.properties().get("baseUrl"));
        assertEquals(PoolConfig.WorkerMode.PROCESS, original.workerMode());
    }
}
