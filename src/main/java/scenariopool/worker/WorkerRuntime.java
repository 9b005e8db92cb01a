package scenariopool.worker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import scenariopool.coordinator.config.PoolConfig;
import scenariopool.coordinator.model.Scenario;
import scenariopool.coordinator.util.Text;
import scenariopool.engine.ScenarioExecutor;
import scenariopool.engine.ScenarioExecutorFactory;
import scenariopool.engine.ScenarioOutcome;
import scenariopool.engine.ScenarioRequest;
import scenariopool.protocol.Artifacts;
import scenariopool.protocol.ErrorMessage;
import scenariopool.protocol.ExecuteMessage;
import scenariopool.protocol.MetricsMessage;
import scenariopool.protocol.ResultMessage;
import scenariopool.protocol.WorkerMessage;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * Executes work items inside one worker: owns the engine instance, applies
 * configuration changes and keeps resources tidy between items.
 *
 * Not thread-safe; driven by the worker's single execution thread.
 */
public class WorkerRuntime implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(WorkerRuntime.class);

    private final int workerId;
    private final ScenarioExecutorFactory suppliedFactory;
    private final String defaultResultsDir;
    private final String defaultProject;
    private final Consumer<WorkerMessage> outbound;
    private final boolean inProcess;

    private ScenarioExecutor executor;
    private boolean initAttempted;
    private String initError;
    private Map<String, String> lastConfig;
    private String currentProject;

    private int itemsSinceRestart;
    private final Map<String, Long> metrics = new LinkedHashMap<>();
    private int itemsExecuted;
    private long totalItemMs;

    /**
     * @param factory   engine factory, or null to resolve one from the
     *                  {@code executorFactory} configuration key
     * @param outbound  sink for messages to the supervisor other than results
     * @param inProcess true for thread-mode workers sharing the JVM
     */
    public WorkerRuntime(int workerId, ScenarioExecutorFactory factory, String resultsDir, String project,
                         Consumer<WorkerMessage> outbound, boolean inProcess) {
        this.workerId = workerId;
        this.suppliedFactory = factory;
        this.defaultResultsDir = resultsDir;
        this.defaultProject = project;
        this.outbound = Objects.requireNonNull(outbound, "outbound is required");
        this.inProcess = inProcess;
    }

    public int workerId() {
        return workerId;
    }

    public boolean isInitialized() {
        return executor != null;
    }

    /**
     * Create the engine. Runs at most once per worker; a failure is kept and
     * reported on every later item.
     */
    public void initialize(Map<String, String> config) {
        if (initAttempted) {
            return;
        }
        initAttempted = true;
        long start = System.currentTimeMillis();
        Map<String, String> cfg = config == null ? Map.of() : config;
        String project = cfg.getOrDefault(PoolConfig.KEY_PROJECT, defaultProject);
        try {
            ScenarioExecutorFactory factory = suppliedFactory != null
                    ? suppliedFactory
                    : ScenarioExecutorFactory.load(cfg.get(PoolConfig.KEY_EXECUTOR_FACTORY));
            executor = factory.create(new ScenarioExecutorFactory.ExecutorContext(
                    workerId, project, defaultResultsDir, cfg));
            if (!cfg.isEmpty()) {
                executor.configure(cfg);
                lastConfig = cfg;
                currentProject = project;
            }
            metrics.put("initMs", System.currentTimeMillis() - start);
            log.info("Worker {} engine ready in {}ms", workerId, System.currentTimeMillis() - start);
        } catch (VirtualMachineError e) {
            throw e;
        } catch (Throwable t) {
            if (t instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            initError = "Engine initialisation failed: " + Text.describe(t);
            log.error("Worker {} {}", workerId, initError, t);
            outbound.accept(new ErrorMessage(workerId, null, initError));
        }
    }

    /**
     * Run one item and build its result. Every failure other than a
     * {@link VirtualMachineError} is turned into a failed result.
     */
    public ResultMessage execute(ExecuteMessage message) {
        long start = System.currentTimeMillis();
        Map<String, String> config = message.config();
        Map<String, String> iterationData = iterationData(message);

        if (!initAttempted) {
            initialize(config);
        }
        if (executor == null) {
            return ResultMessage.failure(message.scenarioId(), workerId, scenarioName(message, iterationData),
                    System.currentTimeMillis() - start, initError, null, message.iterationNumber(),
                    iterationData.isEmpty() ? null : iterationData);
        }

        ConsoleCapture capture = null;
        ResultMessage result;
        try {
            applyConfig(config);

            Scenario scenario = ExampleInterpolator.interpolate(message.scenario(), iterationData);
            String resultsDir = message.testResultsDir() != null ? message.testResultsDir() : defaultResultsDir;
            ArtifactCollector artifacts = new ArtifactCollector(workerId, Path.of(resultsDir));

            if (flag(config, PoolConfig.KEY_CAPTURE_CONSOLE_LOGS, false)) {
                if (inProcess) {
                    log.debug("Worker {}: console capture skipped for in-process worker", workerId);
                } else {
                    capture = new ConsoleCapture();
                    capture.start();
                }
            }

            ScenarioOutcome outcome = executor.execute(new ScenarioRequest(
                    workerId,
                    message.scenarioId(),
                    message.feature(),
                    scenario,
                    message.exampleHeaders(),
                    message.exampleRow(),
                    message.iterationNumber(),
                    message.totalIterations(),
                    resultsDir,
                    artifacts));

            Artifacts collected = artifacts.collect(outcome.artifacts());
            if (capture != null) {
                List<String> lines = capture.stop();
                capture = null;
                String logFile = artifacts.writeConsoleLog(scenario.name(), lines);
                if (logFile != null) {
                    collected = collected.withLog(logFile);
                }
            }

            String name = outcome.name() != null ? outcome.name() : scenario.name();
            List<String> tags = outcome.tags().isEmpty() ? scenario.tags() : outcome.tags();
            result = new ResultMessage(
                    message.scenarioId(),
                    workerId,
                    null,
                    name,
                    outcome.status(),
                    System.currentTimeMillis() - start,
                    outcome.error(),
                    outcome.stackTrace(),
                    outcome.steps(),
                    collected,
                    tags,
                    message.iterationNumber(),
                    iterationData.isEmpty() ? null : iterationData);
        } catch (VirtualMachineError e) {
            throw e;
        } catch (Throwable t) {
            if (t instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            log.error("Worker {} failed to execute {}", workerId, message.scenarioId(), t);
            outbound.accept(new ErrorMessage(workerId, message.scenarioId(), Text.describe(t)));
            result = ResultMessage.failure(message.scenarioId(), workerId, scenarioName(message, iterationData),
                    System.currentTimeMillis() - start, Text.describe(t), Text.stackTrace(t),
                    message.iterationNumber(), iterationData.isEmpty() ? null : iterationData);
        } finally {
            if (capture != null) {
                capture.stop();
            }
        }

        afterItem(config);
        recordTiming(result.duration(), config);
        return result;
    }

    private void applyConfig(Map<String, String> config) throws Exception {
        if (config.isEmpty() || config.equals(lastConfig)) {
            return;
        }
        String project = config.getOrDefault(PoolConfig.KEY_PROJECT, defaultProject);
        if (currentProject != null && !currentProject.equals(project)) {
            log.info("Worker {} switching project {} -> {}", workerId, currentProject, project);
        }
        executor.configure(config);
        lastConfig = config;
        currentProject = project;
    }

    // resource hygiene between items
    private void afterItem(Map<String, String> config) {
        boolean reuse = flag(config, PoolConfig.KEY_RESOURCE_REUSE, false);
        boolean clearState = flag(config, PoolConfig.KEY_CLEAR_STATE_ON_REUSE, true);
        int restartAfter = number(config, PoolConfig.KEY_RESTART_AFTER_SCENARIOS, 0);
        try {
            if (!reuse) {
                executor.releaseResources();
                return;
            }
            itemsSinceRestart++;
            if (restartAfter > 0 && itemsSinceRestart >= restartAfter) {
                log.info("Worker {} restarting resources after {} scenarios", workerId, itemsSinceRestart);
                executor.releaseResources();
                itemsSinceRestart = 0;
            } else if (clearState) {
                executor.clearState();
            }
        } catch (VirtualMachineError e) {
            throw e;
        } catch (Throwable t) {
            log.warn("Worker {} resource cleanup failed: {}", workerId, Text.describe(t));
            outbound.accept(new ErrorMessage(workerId, null, "Resource cleanup failed: " + Text.describe(t)));
        }
    }

    private void recordTiming(long durationMs, Map<String, String> config) {
        itemsExecuted++;
        totalItemMs += durationMs;
        metrics.put("itemsExecuted", (long) itemsExecuted);
        metrics.put("lastItemMs", durationMs);
        metrics.put("totalItemMs", totalItemMs);
        metrics.put("avgItemMs", totalItemMs / itemsExecuted);

        int every = Math.max(1, number(config, PoolConfig.KEY_METRICS_EVERY, 10));
        if (itemsExecuted % every == 0) {
            outbound.accept(new MetricsMessage(workerId, metrics));
        }
    }

    public Map<String, Long> metrics() {
        return Map.copyOf(metrics);
    }

    /** Final cleanup; the runtime cannot be used afterwards. */
    @Override
    public void close() {
        if (executor == null) {
            return;
        }
        try {
            executor.close();
        } catch (RuntimeException e) {
            log.warn("Worker {} engine close failed: {}", workerId, e.getMessage());
        } finally {
            executor = null;
        }
    }

    private static Map<String, String> iterationData(ExecuteMessage message) {
        if (message.exampleRow() == null || message.exampleHeaders() == null) {
            return Map.of();
        }
        Map<String, String> data = new LinkedHashMap<>();
        for (int i = 0; i < message.exampleHeaders().size(); i++) {
            String value = i < message.exampleRow().size() ? message.exampleRow().get(i) : "";
            data.put(message.exampleHeaders().get(i), value);
        }
        return data;
    }

    private static String scenarioName(ExecuteMessage message, Map<String, String> iterationData) {
        if (message.scenario() == null) {
            return message.scenarioId();
        }
        return ExampleInterpolator.apply(message.scenario().name(), iterationData);
    }

    private static boolean flag(Map<String, String> config, String key, boolean def) {
        String v = config.get(key);
        return (v == null || v.isBlank()) ? def : Boolean.parseBoolean(v.trim());
    }

    private static int number(Map<String, String> config, String key, int def) {
        String v = config.get(key);
        if (v == null || v.isBlank()) {
            return def;
        }
        try {
            return Integer.parseInt(v.trim());
        } catch (NumberFormatException e) {
            log.warn("Ignoring non-numeric {}='{}'", key, v);
            return def;
        }
    }
}
