package scenariopool.coordinator.config;

import org.ini4j.Ini;
import org.ini4j.Profile;

import java.io.File;
import java.io.IOException;
import java.time.Duration;
import java.util.Map;

/**
 * Loads pool settings from an INI file.
 * Supports sections [parallel] and [properties] (optional).
 *
 * <pre>
 * [parallel]
 * workers = 4
 * mode = process
 * scenario_timeout_ms = 60000
 *
 * [properties]
 * baseUrl = https://example.test
 * </pre>
 */
public final class IniLoader {

    private IniLoader() {
    }

    /**
     * @throws IllegalArgumentException if the file is missing, unreadable or holds an invalid value
     */
    public static PoolConfig load(File file) {
        Ini ini;
        try {
            ini = new Ini(file);
        } catch (IOException e) {
            throw new IllegalArgumentException("Cannot read pool config " + file, e);
        }

        PoolConfig cfg = PoolConfig.defaults();
        Profile.Section parallel = ini.get("parallel");
        Profile.Section props = ini.get("properties"); // optional

        if (parallel != null) {
            String workers = opt(parallel, "workers");
            if (workers != null) cfg.withMaxWorkers(toInt(parallel, "workers", workers));

            String mode = opt(parallel, "mode");
            if (mode != null) cfg.withWorkerMode(PoolConfig.parseMode(mode));

            String startup = opt(parallel, "startup_timeout_ms");
            if (startup != null) cfg.withWorkerStartupTimeout(millis(parallel, "startup_timeout_ms", startup));

            String scenario = opt(parallel, "scenario_timeout_ms");
            if (scenario != null) cfg.withScenarioTimeout(millis(parallel, "scenario_timeout_ms", scenario));

            String run = opt(parallel, "run_timeout_ms");
            if (run != null) cfg.withRunTimeout(millis(parallel, "run_timeout_ms", run));

            String shutdown = opt(parallel, "shutdown_timeout_ms");
            if (shutdown != null) cfg.withShutdownTimeout(millis(parallel, "shutdown_timeout_ms", shutdown));

            String health = opt(parallel, "health_check_interval_ms");
            if (health != null) cfg.withHealthCheckInterval(millis(parallel, "health_check_interval_ms", health));

            String errors = opt(parallel, "max_worker_errors");
            if (errors != null) cfg.withMaxWorkerErrors(toInt(parallel, "max_worker_errors", errors));

            cfg.withReuseWorkers(Boolean.parseBoolean(opt(parallel, "reuse_workers", "true")));

            String heap = opt(parallel, "worker_heap_mb");
            if (heap != null) cfg.withWorkerHeapMb(toInt(parallel, "worker_heap_mb", heap));

            cfg.withResultsDir(opt(parallel, "results_dir", cfg.resultsDir()));
            cfg.withProject(opt(parallel, "project", cfg.project()));
            cfg.withExecutorFactory(opt(parallel, "executor_factory"));
            cfg.withDebugWorkers(Boolean.parseBoolean(opt(parallel, "debug", "false")));

            // resource hygiene
            cfg.withResourceReuse(Boolean.parseBoolean(opt(parallel, "resource_reuse", "false")));
            cfg.withClearStateOnReuse(Boolean.parseBoolean(opt(parallel, "clear_state_on_reuse", "true")));
            String restart = opt(parallel, "restart_after_scenarios");
            if (restart != null) cfg.withRestartAfterScenarios(toInt(parallel, "restart_after_scenarios", restart));

            cfg.withCaptureConsoleLogs(Boolean.parseBoolean(opt(parallel, "capture_console_logs", "false")));
            String metrics = opt(parallel, "metrics_every");
            if (metrics != null) cfg.withMetricsEvery(toInt(parallel, "metrics_every", metrics));
        }

        if (props != null) {
            for (Map.Entry<String, String> e : props.entrySet()) {
                cfg.withProperty(e.getKey(), e.getValue() == null ? "" : e.getValue().trim());
            }
        }

        return cfg;
    }

    // ===== helpers =====
    private static String opt(Profile.Section s, String key) {
        String v = s == null ? null : s.get(key);
        return (v == null || v.isBlank()) ? null : v.trim();
    }

    private static String opt(Profile.Section s, String key, String def) {
        String v = opt(s, key);
        return v == null ? def : v;
    }

    private static int toInt(Profile.Section s, String key, String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("[" + s.getName() + "] " + key + " must be an integer, got '" + value + "'", e);
        }
    }

    private static Duration millis(Profile.Section s, String key, String value) {
        return Duration.ofMillis(toInt(s, key, value));
    }
}
