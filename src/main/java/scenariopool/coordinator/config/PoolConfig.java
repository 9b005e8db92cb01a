package scenariopool.coordinator.config;

import java.io.File;
import java.time.Duration;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Configuration holder for the worker pool.
 * All settings have sensible defaults.
 */
public final class PoolConfig {

    /** Keys of the config map forwarded to workers with every execute message */
    public static final String KEY_PROJECT = "project";
    public static final String KEY_EXECUTOR_FACTORY = "executorFactory";
    public static final String KEY_RESOURCE_REUSE = "resourceReuse";
    public static final String KEY_CLEAR_STATE_ON_REUSE = "clearStateOnReuse";
    public static final String KEY_RESTART_AFTER_SCENARIOS = "restartAfterScenarios";
    public static final String KEY_CAPTURE_CONSOLE_LOGS = "captureConsoleLogs";
    public static final String KEY_METRICS_EVERY = "metricsEvery";
    public static final String KEY_DEBUG = "debug";

    public enum WorkerMode {
        /** Each worker is a child JVM */
        PROCESS,
        /** Each worker is a thread of this JVM; no crash isolation */
        THREAD
    }

    // Pool settings
    private int maxWorkers = Runtime.getRuntime().availableProcessors();
    private WorkerMode workerMode = WorkerMode.PROCESS;
    private int maxWorkerErrors = 5;
    private boolean reuseWorkers = true;
    private int workerHeapMb = 1024;

    // Timeouts
    private Duration workerStartupTimeout = Duration.ofSeconds(15);
    private Duration scenarioTimeout = Duration.ofSeconds(120);
    private Duration runTimeout = Duration.ofMinutes(10);
    private Duration shutdownTimeout = Duration.ofSeconds(20);
    private Duration healthCheckInterval = Duration.ofMillis(100);

    // Worker settings
    private String resultsDir = "reports/test-results";
    private String project = "common";
    private String executorFactory = null;
    private boolean debugWorkers = false;
    private boolean resourceReuse = false;
    private boolean clearStateOnReuse = true;
    private int restartAfterScenarios = 0; // 0 = never
    private boolean captureConsoleLogs = false;
    private int metricsEvery = 10;

    // Free-form properties forwarded to workers
    private final Map<String, String> properties = new LinkedHashMap<>();

    private PoolConfig() {
    }

    public static PoolConfig defaults() {
        return new PoolConfig();
    }

    public static PoolConfig fromEnv() {
        return fromEnv(System.getenv());
    }

    /**
     * Build from an environment map. Blank values are ignored.
     *
     * @throws IllegalArgumentException if a numeric value cannot be parsed
     */
    public static PoolConfig fromEnv(Map<String, String> env) {
        PoolConfig config = new PoolConfig();
        config.applyEnv(env);
        return config;
    }

    /**
     * Load from an INI file, then apply environment overrides.
     *
     * @throws IllegalArgumentException if the file cannot be read or a value is invalid
     */
    public static PoolConfig fromIni(File file) {
        PoolConfig config = IniLoader.load(file);
        config.applyEnv(System.getenv());
        return config;
    }

    /** Independent copy; later {@code with*} calls on either side do not affect the other. */
    public PoolConfig copy() {
        PoolConfig c = new PoolConfig();
        c.maxWorkers = maxWorkers;
        c.workerMode = workerMode;
        c.maxWorkerErrors = maxWorkerErrors;
        c.reuseWorkers = reuseWorkers;
        c.workerHeapMb = workerHeapMb;
        c.workerStartupTimeout = workerStartupTimeout;
        c.scenarioTimeout = scenarioTimeout;
        c.runTimeout = runTimeout;
        c.shutdownTimeout = shutdownTimeout;
        c.healthCheckInterval = healthCheckInterval;
        c.resultsDir = resultsDir;
        c.project = project;
        c.executorFactory = executorFactory;
        c.debugWorkers = debugWorkers;
        c.resourceReuse = resourceReuse;
        c.clearStateOnReuse = clearStateOnReuse;
        c.restartAfterScenarios = restartAfterScenarios;
        c.captureConsoleLogs = captureConsoleLogs;
        c.metricsEvery = metricsEvery;
        c.properties.putAll(properties);
        return c;
    }

    void applyEnv(Map<String, String> env) {
        String workers = env.get("PARALLEL_WORKERS");
        if (notBlank(workers)) {
            maxWorkers = parseInt("PARALLEL_WORKERS", workers);
        }

        String mode = env.get("WORKER_MODE");
        if (notBlank(mode)) {
            workerMode = parseMode(mode);
        }

        String startup = env.get("WORKER_STARTUP_TIMEOUT_MS");
        if (notBlank(startup)) {
            workerStartupTimeout = Duration.ofMillis(parseInt("WORKER_STARTUP_TIMEOUT_MS", startup));
        }

        String scenario = env.get("SCENARIO_TIMEOUT_MS");
        if (notBlank(scenario)) {
            scenarioTimeout = Duration.ofMillis(parseInt("SCENARIO_TIMEOUT_MS", scenario));
        }

        String run = env.get("RUN_TIMEOUT_MS");
        if (notBlank(run)) {
            runTimeout = Duration.ofMillis(parseInt("RUN_TIMEOUT_MS", run));
        }

        String shutdown = env.get("WORKER_SHUTDOWN_TIMEOUT_MS");
        if (notBlank(shutdown)) {
            shutdownTimeout = Duration.ofMillis(parseInt("WORKER_SHUTDOWN_TIMEOUT_MS", shutdown));
        }

        String maxErrors = env.get("MAX_WORKER_ERRORS");
        if (notBlank(maxErrors)) {
            maxWorkerErrors = parseInt("MAX_WORKER_ERRORS", maxErrors);
        }

        String reuse = env.get("REUSE_WORKERS");
        if (notBlank(reuse)) {
            reuseWorkers = Boolean.parseBoolean(reuse.trim());
        }

        String heap = env.get("WORKER_HEAP_SIZE");
        if (notBlank(heap)) {
            workerHeapMb = parseInt("WORKER_HEAP_SIZE", heap);
        }

        String dir = env.get("TEST_RESULTS_DIR");
        if (notBlank(dir)) {
            resultsDir = dir.trim();
        }

        String proj = env.get("PROJECT");
        if (notBlank(proj)) {
            project = proj.trim();
        }

        String factory = env.get("EXECUTOR_FACTORY");
        if (notBlank(factory)) {
            executorFactory = factory.trim();
        }

        String debug = env.get("DEBUG_WORKERS");
        if (notBlank(debug)) {
            debugWorkers = Boolean.parseBoolean(debug.trim());
        }

        String browserReuse = env.get("BROWSER_REUSE_ENABLED");
        if (notBlank(browserReuse)) {
            resourceReuse = Boolean.parseBoolean(browserReuse.trim());
        }

        String clearState = env.get("BROWSER_REUSE_CLEAR_STATE");
        if (notBlank(clearState)) {
            clearStateOnReuse = !"false".equalsIgnoreCase(clearState.trim());
        }

        String restartAfter = env.get("BROWSER_REUSE_CLOSE_AFTER_SCENARIOS");
        if (notBlank(restartAfter)) {
            restartAfterScenarios = parseInt("BROWSER_REUSE_CLOSE_AFTER_SCENARIOS", restartAfter);
        }

        String console = env.get("CAPTURE_CONSOLE_LOGS");
        if (notBlank(console)) {
            captureConsoleLogs = Boolean.parseBoolean(console.trim());
        }
    }

    /**
     * Configuration map sent to workers with every execute message.
     * Free-form properties come first so the named settings win on clashes.
     */
    public Map<String, String> workerConfig() {
        Map<String, String> map = new LinkedHashMap<>(properties);
        map.put(KEY_PROJECT, project);
        if (executorFactory != null) {
            map.put(KEY_EXECUTOR_FACTORY, executorFactory);
        }
        map.put(KEY_RESOURCE_REUSE, String.valueOf(resourceReuse));
        map.put(KEY_CLEAR_STATE_ON_REUSE, String.valueOf(clearStateOnReuse));
        map.put(KEY_RESTART_AFTER_SCENARIOS, String.valueOf(restartAfterScenarios));
        map.put(KEY_CAPTURE_CONSOLE_LOGS, String.valueOf(captureConsoleLogs));
        map.put(KEY_METRICS_EVERY, String.valueOf(metricsEvery));
        map.put(KEY_DEBUG, String.valueOf(debugWorkers));
        return map;
    }

    /**
     * @throws IllegalArgumentException if a setting is out of range
     */
    public PoolConfig validate() {
        if (maxWorkers < 1) {
            throw new IllegalArgumentException("maxWorkers must be at least 1, got " + maxWorkers);
        }
        if (maxWorkerErrors < 0) {
            throw new IllegalArgumentException("maxWorkerErrors must not be negative");
        }
        if (workerHeapMb < 16) {
            throw new IllegalArgumentException("workerHeapMb too small: " + workerHeapMb);
        }
        requirePositive("workerStartupTimeout", workerStartupTimeout);
        requirePositive("scenarioTimeout", scenarioTimeout);
        requirePositive("runTimeout", runTimeout);
        requirePositive("shutdownTimeout", shutdownTimeout);
        requirePositive("healthCheckInterval", healthCheckInterval);
        if (restartAfterScenarios < 0) {
            throw new IllegalArgumentException("restartAfterScenarios must not be negative");
        }
        if (metricsEvery < 1) {
            throw new IllegalArgumentException("metricsEvery must be at least 1");
        }
        return this;
    }

    // Getters
    public int maxWorkers() {
        return maxWorkers;
    }

    public WorkerMode workerMode() {
        return workerMode;
    }

    public int maxWorkerErrors() {
        return maxWorkerErrors;
    }

    public boolean reuseWorkers() {
        return reuseWorkers;
    }

    public int workerHeapMb() {
        return workerHeapMb;
    }

    public Duration workerStartupTimeout() {
        return workerStartupTimeout;
    }

    public Duration scenarioTimeout() {
        return scenarioTimeout;
    }

    public Duration runTimeout() {
        return runTimeout;
    }

    public Duration shutdownTimeout() {
        return shutdownTimeout;
    }

    public Duration healthCheckInterval() {
        return healthCheckInterval;
    }

    public String resultsDir() {
        return resultsDir;
    }

    public String project() {
        return project;
    }

    public String executorFactory() {
        return executorFactory;
    }

    public boolean debugWorkers() {
        return debugWorkers;
    }

    public boolean resourceReuse() {
        return resourceReuse;
    }

    public boolean clearStateOnReuse() {
        return clearStateOnReuse;
    }

    public int restartAfterScenarios() {
        return restartAfterScenarios;
    }

    public boolean captureConsoleLogs() {
        return captureConsoleLogs;
    }

    public int metricsEvery() {
        return metricsEvery;
    }

    public Map<String, String> properties() {
        return Collections.unmodifiableMap(properties);
    }

    // Fluent setters for testing/customization
    public PoolConfig withMaxWorkers(int workers) {
        this.maxWorkers = workers;
        return this;
    }

    public PoolConfig withWorkerMode(WorkerMode mode) {
        this.workerMode = mode;
        return this;
    }

    public PoolConfig withMaxWorkerErrors(int errors) {
        this.maxWorkerErrors = errors;
        return this;
    }

    public PoolConfig withReuseWorkers(boolean reuse) {
        this.reuseWorkers = reuse;
        return this;
    }

    public PoolConfig withWorkerHeapMb(int heapMb) {
        this.workerHeapMb = heapMb;
        return this;
    }

    public PoolConfig withWorkerStartupTimeout(Duration timeout) {
        this.workerStartupTimeout = timeout;
        return this;
    }

    public PoolConfig withScenarioTimeout(Duration timeout) {
        this.scenarioTimeout = timeout;
        return this;
    }

    public PoolConfig withRunTimeout(Duration timeout) {
        this.runTimeout = timeout;
        return this;
    }

    public PoolConfig withShutdownTimeout(Duration timeout) {
        this.shutdownTimeout = timeout;
        return this;
    }

    public PoolConfig withHealthCheckInterval(Duration interval) {
        this.healthCheckInterval = interval;
        return this;
    }

    public PoolConfig withResultsDir(String dir) {
        this.resultsDir = dir;
        return this;
    }

    public PoolConfig withProject(String name) {
        this.project = name;
        return this;
    }

    public PoolConfig withExecutorFactory(String className) {
        this.executorFactory = className;
        return this;
    }

    public PoolConfig withDebugWorkers(boolean debug) {
        this.debugWorkers = debug;
        return this;
    }

    public PoolConfig withResourceReuse(boolean reuse) {
        this.resourceReuse = reuse;
        return this;
    }

    public PoolConfig withClearStateOnReuse(boolean clear) {
        this.clearStateOnReuse = clear;
        return this;
    }

    public PoolConfig withRestartAfterScenarios(int scenarios) {
        this.restartAfterScenarios = scenarios;
        return this;
    }

    public PoolConfig withCaptureConsoleLogs(boolean capture) {
        this.captureConsoleLogs = capture;
        return this;
    }

    public PoolConfig withMetricsEvery(int items) {
        this.metricsEvery = items;
        return this;
    }

    public PoolConfig withProperty(String key, String value) {
        this.properties.put(key, value);
        return this;
    }

    private static void requirePositive(String name, Duration value) {
        if (value == null || value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(name + " must be positive, got " + value);
        }
    }

    private static boolean notBlank(String value) {
        return value != null && !value.isBlank();
    }

    private static int parseInt(String name, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " must be an integer, got '" + value + "'", e);
        }
    }

    static WorkerMode parseMode(String value) {
        try {
            return WorkerMode.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown worker mode '" + value + "' (expected PROCESS or THREAD)", e);
        }
    }

    @Override
    public String toString() {
        return "PoolConfig{" +
                "maxWorkers=" + maxWorkers +
                ", mode=" + workerMode +
                ", scenarioTimeout=" + scenarioTimeout.toMillis() + "ms" +
                ", runTimeout=" + runTimeout.toMillis() + "ms" +
                ", reuseWorkers=" + reuseWorkers +
                ", project='" + project + '\'' +
                ", resultsDir='" + resultsDir + '\'' +
                '}';
    }
}
