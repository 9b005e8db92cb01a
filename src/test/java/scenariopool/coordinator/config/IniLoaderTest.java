package scenariopool.coordinator.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class IniLoaderTest {

    @TempDir
    Path dir;

    @Test
    void loadsParallelAndPropertiesSections() throws Exception {
        Path ini = dir.resolve("pool.ini");
        Files.writeString(ini, String.join("\n",
                "[parallel]",
                "workers = 6",
                "mode = thread",
                "scenario_timeout_ms = 45000",
                "run_timeout_ms = 600000",
                "health_check_interval_ms = 250",
                "max_worker_errors = 3",
                "reuse_workers = false",
                "results_dir = build/results",
                "project = admin",
                "executor_factory = com.example.Factory",
                "resource_reuse = true",
                "restart_after_scenarios = 50",
                "capture_console_logs = true",
                "metrics_every = 5",
                "",
                "[properties]",
                "baseUrl = https://admin.test",
                "headless = true",
                ""));

        PoolConfig config = IniLoader.load(ini.toFile());

        assertEquals(6, config.maxWorkers());
        assertEquals(PoolConfig.WorkerMode.THREAD, config.workerMode());
        assertEquals(Duration.ofSeconds(45), config.scenarioTimeout());
        assertEquals(Duration.ofMinutes(10), config.runTimeout());
        assertEquals(Duration.ofMillis(250), config.healthCheckInterval());
        assertEquals(3, config.maxWorkerErrors());
        assertFalse(config.reuseWorkers());
        assertEquals("build/results", config.resultsDir());
        assertEquals("admin", config.project());
        assertEquals("com.example.Factory", config.executorFactory());
        assertTrue(config.resourceReuse());
        assertEquals(50, config.restartAfterScenarios());
        assertTrue(config.captureConsoleLogs());
        assertEquals(5, config.metricsEvery());
        assertEquals("https://admin.test", config.properties().get("baseUrl"));
        assertEquals("true", config.workerConfig().get("headless"));
    }

    @Test
    void missingSectionsKeepDefaults() throws Exception {
        Path ini = dir.resolve("empty.ini");
        Files.writeString(ini, "[other]\nkey = value\n");

        PoolConfig config = IniLoader.load(ini.toFile());

        assertEquals(PoolConfig.defaults().maxWorkers(), config.maxWorkers());
        assertTrue(config.reuseWorkers());
        assertTrue(config.properties().isEmpty());
    }

    @Test
    void invalidNumberNamesTheKey() throws Exception {
        Path ini = dir.resolve("bad.ini");
        Files.writeString(ini, "[parallel]\nworkers = lots\n");

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> IniLoader.load(ini.toFile()));
        assertTrue(e.getMessage().contains("workers"), e.getMessage());
    }

    @Test
    void missingFile() {
        assertThrows(IllegalArgumentException.class, () -> IniLoader.load(new File(dir.toFile(), "nope.ini")));
    }
}
