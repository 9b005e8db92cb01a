package scenariopool.coordinator.scheduler;

import io.netty.channel.Channel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import scenariopool.coordinator.config.PoolConfig;
import scenariopool.coordinator.core.RunListener;
import scenariopool.coordinator.core.RunListeners;
import scenariopool.coordinator.launcher.JvmWorkerLauncher;
import scenariopool.coordinator.launcher.ThreadWorkerLauncher;
import scenariopool.coordinator.launcher.WorkerHandle;
import scenariopool.coordinator.launcher.WorkerLauncher;
import scenariopool.coordinator.model.AggregatedScenarioResult;
import scenariopool.coordinator.model.Feature;
import scenariopool.coordinator.model.RunSummary;
import scenariopool.coordinator.model.ScenarioStatus;
import scenariopool.coordinator.model.WorkItem;
import scenariopool.coordinator.model.Worker;
import scenariopool.coordinator.model.WorkerState;
import scenariopool.coordinator.server.SupervisorEvents;
import scenariopool.coordinator.server.SupervisorServer;
import scenariopool.coordinator.service.ResultAggregator;
import scenariopool.coordinator.service.WorkItemBuilder;
import scenariopool.engine.ScenarioExecutorFactory;
import scenariopool.protocol.ErrorMessage;
import scenariopool.protocol.ExecuteMessage;
import scenariopool.protocol.LogMessage;
import scenariopool.protocol.MetricsMessage;
import scenariopool.protocol.ReadyMessage;
import scenariopool.protocol.ResultMessage;
import scenariopool.protocol.TerminateMessage;
import scenariopool.protocol.WorkerMessage;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs a set of features across a pool of workers and collects one result
 * per work item.
 *
 * All pool state (workers, queue, results) lives on a single supervisor
 * thread. Transport callbacks, process exit notifications and health ticks
 * are posted to it as tasks, so none of that state needs locking.
 *
 * One instance serves exactly one {@link #execute(List)} call.
 */
public class ParallelOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(ParallelOrchestrator.class);

    private final PoolConfig config;
    private final WorkerLauncher launcher;
    private final WorkItemBuilder builder;
    private final WorkerHealthMonitor healthMonitor;
    private final ResultAggregator aggregator = new ResultAggregator();
    private final RunListeners listeners = new RunListeners();
    private final SupervisorServer server;
    private final ScheduledExecutorService loop;
    private final Map<String, String> workerConfig;

    private final AtomicBoolean used = new AtomicBoolean(false);
    private final CompletableFuture<Void> runDone = new CompletableFuture<>();
    private volatile boolean cancelled = false;
    private volatile RunSummary summary;

    // supervisor-thread state
    private final Map<Integer, Worker> workers = new LinkedHashMap<>();
    private final Map<Integer, CompletableFuture<Worker>> pendingStarts = new HashMap<>();
    private final Deque<WorkItem> queue = new ArrayDeque<>();
    private final Map<String, WorkItem> itemsById = new HashMap<>();
    private final Map<String, ResultMessage> results = new LinkedHashMap<>();
    private final List<String> lost = new ArrayList<>();
    private final List<AggregatedScenarioResult> aggregated = new ArrayList<>();
    private final Map<Integer, Map<String, Long>> workerMetrics = new LinkedHashMap<>();
    private int nextWorkerId = 0;
    private int total;
    private int completed;
    private int port;
    private boolean dispatching;
    private boolean shuttingDown;
    private ScheduledFuture<?> healthTask;

    public ParallelOrchestrator(PoolConfig config) {
        this(config, defaultLauncher(config));
    }

    /** Thread-mode pool running the given engine in every worker. */
    public ParallelOrchestrator(PoolConfig config, ScenarioExecutorFactory factory) {
        this(config.copy().withWorkerMode(PoolConfig.WorkerMode.THREAD), new ThreadWorkerLauncher(config, factory));
    }

    public ParallelOrchestrator(PoolConfig config, WorkerLauncher launcher) {
        this(config, launcher, new WorkItemBuilder());
    }

    /**
     * @param config copied here; changing it afterwards does not affect this orchestrator
     */
    public ParallelOrchestrator(PoolConfig config, WorkerLauncher launcher, WorkItemBuilder builder) {
        this.config = config.copy().validate();
        this.launcher = launcher;
        this.builder = builder;
        this.healthMonitor = new WorkerHealthMonitor(this.config);
        this.server = new SupervisorServer(new Events());
        this.workerConfig = this.config.workerConfig();
        this.loop = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "scenariopool-supervisor");
            t.setDaemon(true);
            return t;
        });
    }

    private static WorkerLauncher defaultLauncher(PoolConfig config) {
        return config.workerMode() == PoolConfig.WorkerMode.THREAD
                ? new ThreadWorkerLauncher(config, null)
                : new JvmWorkerLauncher(config);
    }

    public void addListener(RunListener listener) {
        listeners.add(listener);
    }

    /**
     * Run every enabled scenario of {@code features}.
     *
     * @return results keyed by work item id, in completion order. Items lost
     *         to a crashed worker, or still running at timeout, are absent.
     * @throws IllegalStateException  if this orchestrator was already used
     * @throws WorkerStartupException if the initial pool could not start
     * @throws WorkerPoolException    if every worker was lost with work queued
     */
    public Map<String, ResultMessage> execute(List<Feature> features) {
        if (!used.compareAndSet(false, true)) {
            throw new IllegalStateException("ParallelOrchestrator instances are single-use");
        }

        Instant started = Instant.now();
        List<WorkItem> items = builder.build(features);
        if (items.isEmpty()) {
            log.info("No work items to execute");
            summary = RunSummary.empty();
            listeners.onRunFinished(summary);
            stopLoop();
            return new LinkedHashMap<>();
        }

        boolean timedOut = false;
        RuntimeException failure = null;
        try {
            onLoop(() -> {
                total = items.size();
                for (WorkItem item : items) {
                    queue.addLast(item);
                    itemsById.put(item.id(), item);
                }
                return null;
            });
            port = server.start();

            int needed = Math.min(config.maxWorkers(), items.size());
            log.info("Starting {} workers for {} work items ({})", needed, items.size(), config);
            startPool(needed);

            onLoop(() -> {
                dispatching = true;
                assignAll();
                long interval = config.healthCheckInterval().toMillis();
                healthTask = loop.scheduleAtFixedRate(wrapRunnable("health-check", this::healthTick),
                        interval, interval, TimeUnit.MILLISECONDS);
                return null;
            });

            try {
                runDone.get(config.runTimeout().toMillis(), TimeUnit.MILLISECONDS);
            } catch (TimeoutException e) {
                timedOut = true;
                log.warn("Run timed out after {}ms; undelivered results will be missing",
                        config.runTimeout().toMillis());
            } catch (ExecutionException e) {
                Throwable cause = e.getCause();
                failure = cause instanceof RuntimeException re ? re
                        : new WorkerPoolException("Run failed", cause);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while waiting for results");
                cancelled = true;
            }
        } catch (RuntimeException e) {
            failure = e;
        } finally {
            shutdown();
        }

        boolean wasTimedOut = timedOut;
        Map<String, ResultMessage> snapshot = onLoop(() -> new LinkedHashMap<>(results));
        summary = onLoop(() -> buildSummary(started, wasTimedOut));
        stopLoop();

        logSummary(summary);
        listeners.onRunFinished(summary);

        if (failure != null) {
            throw failure;
        }
        return snapshot;
    }

    /**
     * Stop waiting for results. Queued items are abandoned; items already
     * running are not interrupted before shutdown.
     */
    public void cancel() {
        cancelled = true;
        log.warn("Run cancelled");
        runDone.complete(null);
    }

    /** Summary of the finished run, or null while running */
    public RunSummary summary() {
        return summary;
    }

    // ---------------------------------------------------------------- startup

    private void startPool(int count) {
        List<CompletableFuture<Worker>> starts = onLoop(() -> {
            List<CompletableFuture<Worker>> list = new ArrayList<>();
            for (int i = 0; i < count; i++) {
                list.add(startWorker());
            }
            return list;
        });

        try {
            CompletableFuture.allOf(starts.toArray(new CompletableFuture[0])).join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() instanceof TimeoutException
                    ? new WorkerStartupException("Worker did not become ready within "
                    + config.workerStartupTimeout().toMillis() + "ms")
                    : e.getCause();
            log.error("Worker pool failed to start: {}", cause.getMessage());
            if (cause instanceof WorkerStartupException wse) {
                throw wse;
            }
            throw new WorkerStartupException("Worker pool failed to start", cause);
        }
        log.info("All {} workers ready", count);
    }

    /**
     * Launch one worker. Supervisor thread only.
     *
     * @return future completing when the worker's ready message arrives
     */
    private CompletableFuture<Worker> startWorker() {
        int id = ++nextWorkerId;
        WorkerHandle handle;
        try {
            handle = launcher.launch(id, server.host(), port);
        } catch (IOException | RuntimeException e) {
            log.error("Cannot launch worker {}: {}", id, e.getMessage());
            return CompletableFuture.failedFuture(new WorkerStartupException("Cannot launch worker " + id, e));
        }

        Worker worker = new Worker(id, handle, Instant.now());
        workers.put(id, worker);
        CompletableFuture<Worker> ready = new CompletableFuture<>();
        pendingStarts.put(id, ready);

        ready.orTimeout(config.workerStartupTimeout().toMillis(), TimeUnit.MILLISECONDS)
                .whenComplete((w, err) -> {
                    if (err != null) {
                        post(() -> abandonStart(id, err));
                    }
                });
        handle.onExit().thenRun(() -> post(() -> onWorkerExited(id)));
        return ready;
    }

    private void abandonStart(int id, Throwable err) {
        pendingStarts.remove(id);
        Worker w = workers.remove(id);
        if (w == null) {
            return;
        }
        log.error("Worker {} failed to start: {}", id,
                err instanceof TimeoutException ? "no ready message within "
                        + config.workerStartupTimeout().toMillis() + "ms" : err.getMessage());
        w.markState(WorkerState.TERMINATED);
        w.handle().destroy();
    }

    private void startReplacement() {
        startWorker().whenComplete((w, err) -> {
            if (err != null) {
                post(this::checkCapacity);
            }
        });
    }

    // ------------------------------------------------------------- dispatch

    private void assignAll() {
        for (Worker w : new ArrayList<>(workers.values())) {
            if (queue.isEmpty()) {
                return;
            }
            assignWork(w);
        }
    }

    private void assignWork(Worker w) {
        if (!dispatching || shuttingDown || queue.isEmpty() || w.isBusy() || !w.isReady()) {
            return;
        }
        WorkItem item = queue.pollFirst();
        w.assign(item, Instant.now());
        ExecuteMessage message = ExecuteMessage.forItem(item, workerConfig, config.resultsDir());
        SupervisorServer.send(w.channel(), message).addListener(f -> {
            if (!f.isSuccess()) {
                post(() -> onSendFailed(w.id(), item, f.cause()));
            }
        });
        if (config.debugWorkers()) {
            log.debug("Worker {} assigned: {}", w.id(), item.displayName());
        }
    }

    private void onSendFailed(int workerId, WorkItem item, Throwable cause) {
        Worker w = workers.get(workerId);
        if (w == null || w.currentWork() == null || !w.currentWork().id().equals(item.id())) {
            return;
        }
        log.warn("Could not send {} to worker {}: {}", item.id(), workerId,
                cause == null ? "unknown" : cause.getMessage());
        recycle(w, "send failed");
    }

    // --------------------------------------------------------------- events

    private void onReady(Channel channel, ReadyMessage ready) {
        Worker w = workers.get(ready.workerId());
        if (w == null) {
            log.warn("Ready from unknown worker {}, closing", ready.workerId());
            channel.close();
            return;
        }
        CompletableFuture<Worker> pending = pendingStarts.remove(w.id());
        if (pending != null && pending.isDone()) {
            // start already timed out; removal is queued
            return;
        }
        w.markReady(channel);
        log.info("Worker {} ready (pid {})", w.id(), ready.pid());
        if (pending != null) {
            pending.complete(w);
        }
        assignWork(w);
    }

    private void onResult(Channel channel, ResultMessage message) {
        Worker w = workerFor(channel);
        WorkItem item = itemsById.get(message.scenarioId());
        if (item == null) {
            log.warn("Result for unknown item {} ignored", message.scenarioId());
            return;
        }
        if (results.containsKey(item.id())) {
            log.warn("Duplicate result for {} ignored", item.id());
            return;
        }
        if (w == null || w.currentWork() == null || !w.currentWork().id().equals(item.id())) {
            // stale: the worker was recycled and the item handed out again
            log.debug("Stale result for {} from worker {} ignored", item.id(), message.workerId());
            return;
        }

        w.release();
        w.recordCompletion();
        ResultMessage result = message.withFeatureName(item.featureName());
        results.put(item.id(), result);
        completed++;

        log.info("[{}/{}] {} {} ({}ms)", completed, total, result.status().symbol(),
                item.displayName(), result.duration());
        listeners.onScenarioCompleted(item, result, completed, total);
        aggregator.accept(item, result).ifPresent(agg -> {
            aggregated.add(agg);
            listeners.onAggregatedResult(agg);
        });

        if (shuttingDown) {
            // the worker already has its terminate message
            checkCompletion();
            return;
        }
        if (!config.reuseWorkers()) {
            recycle(w, "worker reuse disabled");
        } else if (healthMonitor.isUnhealthy(w)) {
            recycle(w, w.errorCount() + " errors");
        } else {
            assignWork(w);
        }
        checkCompletion();
    }

    private void onError(Channel channel, ErrorMessage message) {
        Worker w = workerFor(channel);
        if (w == null) {
            return;
        }
        int errors = w.recordError();
        log.warn("Worker {} error ({} so far){}: {}", w.id(), errors,
                message.scenarioId() != null ? " on " + message.scenarioId() : "", message.error());
        if (!w.isBusy() && healthMonitor.isUnhealthy(w)) {
            recycle(w, errors + " errors");
        }
    }

    private void onLog(LogMessage message) {
        if (config.debugWorkers()) {
            log.info("[worker-{}] {}: {}", message.workerId(), message.level(), message.message());
        } else {
            log.debug("[worker-{}] {}: {}", message.workerId(), message.level(), message.message());
        }
    }

    private void onMetrics(MetricsMessage message) {
        workerMetrics.put(message.workerId(), message.metrics());
    }

    private void onChannelClosed(Channel channel) {
        if (shuttingDown) {
            return;
        }
        Worker w = workerFor(channel);
        if (w != null && w.channel() == channel) {
            handleDisconnect(w);
        }
    }

    private void onWorkerExited(int id) {
        if (shuttingDown) {
            return;
        }
        Worker w = workers.get(id);
        if (w != null) {
            handleDisconnect(w);
        }
    }

    private Worker workerFor(Channel channel) {
        Integer id = SupervisorServer.workerIdOf(channel);
        return id == null ? null : workers.get(id);
    }

    // ---------------------------------------------------------------- health

    private void healthTick() {
        if (shuttingDown) {
            return;
        }
        Instant now = Instant.now();
        for (HealthVerdict verdict : healthMonitor.inspect(new ArrayList<>(workers.values()), now)) {
            Worker w = workers.get(verdict.workerId());
            if (w == null) {
                continue;
            }
            switch (verdict.problem()) {
                case DISCONNECTED:
                    handleDisconnect(w);
                    break;
                case STUCK:
                    log.warn("Worker {} appears stuck: {}", w.id(), verdict.detail());
                    recycle(w, "scenario timeout");
                    break;
                case UNHEALTHY:
                    log.warn("Worker {} unhealthy: {}", w.id(), verdict.detail());
                    recycle(w, verdict.detail());
                    break;
                default:
                    break;
            }
        }
        checkCompletion();
    }

    /**
     * The worker died. Its in-flight item counts as completed and is recorded
     * as lost; it is not retried.
     */
    private void handleDisconnect(Worker w) {
        workers.remove(w.id());
        w.markState(WorkerState.DISCONNECTED);
        CompletableFuture<Worker> pending = pendingStarts.remove(w.id());
        if (pending != null) {
            pending.completeExceptionally(new WorkerStartupException("Worker " + w.id() + " exited before it was ready"));
        }

        WorkItem item = w.release();
        if (item != null && !results.containsKey(item.id())) {
            completed++;
            lost.add(item.id());
            log.error("Worker {} disconnected while running {}; item lost", w.id(), item.displayName());
            listeners.onItemLost(item);
        } else {
            log.warn("Worker {} disconnected", w.id());
        }
        w.handle().destroy();

        if (!queue.isEmpty()) {
            startReplacement();
        }
        checkCapacity();
        checkCompletion();
    }

    /**
     * Take a worker out of service: kill it, put its in-flight item back at
     * the front of the queue and start a replacement while work remains.
     */
    private void recycle(Worker w, String reason) {
        if (shuttingDown) {
            w.release();
            return;
        }
        workers.remove(w.id());
        w.markState(WorkerState.RECYCLED);
        WorkItem inFlight = w.release();
        if (inFlight != null && !results.containsKey(inFlight.id())) {
            queue.addFirst(inFlight);
            log.info("Requeued {} from worker {}", inFlight.displayName(), w.id());
        }
        Channel ch = w.channel();
        if (ch != null) {
            ch.close();
        }
        w.handle().destroy();
        log.info("Recycled worker {} ({})", w.id(), reason);
        listeners.onWorkerRecycled(w.id(), reason);

        if (!queue.isEmpty()) {
            startReplacement();
        }
        if (inFlight != null) {
            assignAll();
        }
    }

    private void checkCapacity() {
        if (shuttingDown || queue.isEmpty() || !workers.isEmpty()) {
            return;
        }
        String msg = "No workers left with " + queue.size() + " items queued";
        log.error(msg);
        runDone.completeExceptionally(new WorkerPoolException(msg));
    }

    private void checkCompletion() {
        if (completed >= total) {
            runDone.complete(null);
        }
    }

    // -------------------------------------------------------------- shutdown

    private void shutdown() {
        List<Worker> live = onLoop(() -> {
            shuttingDown = true;
            if (healthTask != null) {
                healthTask.cancel(false);
            }
            List<Worker> list = new ArrayList<>(workers.values());
            for (Worker w : list) {
                w.markState(WorkerState.TERMINATING);
                if (w.isConnected()) {
                    SupervisorServer.send(w.channel(), TerminateMessage.shutdown());
                } else {
                    w.handle().destroy();
                }
            }
            for (CompletableFuture<Worker> pending : pendingStarts.values()) {
                pending.cancel(false);
            }
            pendingStarts.clear();
            return list;
        });

        long timeoutMs = config.shutdownTimeout().toMillis();
        List<CompletableFuture<Boolean>> exits = new ArrayList<>();
        for (Worker w : live) {
            exits.add(w.handle().onExit()
                    .thenApply(v -> true)
                    .completeOnTimeout(false, timeoutMs, TimeUnit.MILLISECONDS)
                    .thenApply(exited -> {
                        if (!exited) {
                            log.warn("Worker {} did not exit within {}ms, killing", w.id(), timeoutMs);
                            w.handle().destroy();
                        }
                        return exited;
                    }));
        }
        CompletableFuture.allOf(exits.toArray(new CompletableFuture[0])).join();

        onLoop(() -> {
            for (Worker w : live) {
                w.markState(WorkerState.TERMINATED);
            }
            workers.clear();
            for (WorkItem item : queue) {
                log.warn("Abandoned queued item {}", item.displayName());
            }
            return null;
        });
        server.stop();
        log.info("Worker pool shut down");
    }

    private void stopLoop() {
        loop.shutdown();
        try {
            if (!loop.awaitTermination(5, TimeUnit.SECONDS)) {
                loop.shutdownNow();
                log.warn("Supervisor loop forcefully stopped");
            }
        } catch (InterruptedException e) {
            loop.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    // --------------------------------------------------------------- summary

    private RunSummary buildSummary(Instant started, boolean timedOut) {
        int passed = 0;
        int failed = 0;
        int skipped = 0;
        for (ResultMessage r : results.values()) {
            if (r.status() == ScenarioStatus.PASSED) {
                passed++;
            } else if (r.status() == ScenarioStatus.FAILED) {
                failed++;
            } else {
                skipped++;
            }
        }
        List<String> abandoned = new ArrayList<>();
        for (WorkItem item : queue) {
            abandoned.add(item.id());
        }
        return new RunSummary(total, completed, passed, failed, skipped,
                lost, abandoned, aggregator.pendingKeys(), timedOut, cancelled,
                Duration.between(started, Instant.now()).toMillis(), aggregated);
    }

    private void logSummary(RunSummary s) {
        log.info("Run finished: {}/{} completed, {} passed, {} failed, {} skipped in {}ms",
                s.completed(), s.total(), s.passed(), s.failed(), s.skipped(), s.durationMs());
        if (!s.lost().isEmpty()) {
            log.warn("Lost items (worker crashed): {}", s.lost());
        }
        if (!s.abandoned().isEmpty()) {
            log.warn("Abandoned items: {}", s.abandoned());
        }
        for (String key : s.pending()) {
            log.warn("Incomplete data-driven scenario {}: {} iterations reported", key, aggregator.collected(key));
        }
        if (!workerMetrics.isEmpty()) {
            log.info("Worker performance:");
            for (Map.Entry<Integer, Map<String, Long>> e : Collections.unmodifiableMap(workerMetrics).entrySet()) {
                log.info("  worker {}: {}", e.getKey(), e.getValue());
            }
        }
    }

    // ---------------------------------------------------------------- helpers

    private void post(Runnable task) {
        try {
            loop.execute(wrapRunnable("supervisor-task", task));
        } catch (RejectedExecutionException e) {
            log.debug("Supervisor loop stopped, dropping task");
        }
    }

    private <T> T onLoop(Callable<T> task) {
        try {
            return loop.submit(task).get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted waiting for supervisor", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            throw new IllegalStateException("Supervisor task failed", cause);
        }
    }

    /**
     * Wrap a runnable with error handling.
     */
    private Runnable wrapRunnable(String name, Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (Exception e) {
                log.error("{} error", name, e);
            }
        };
    }

    private final class Events implements SupervisorEvents {

        @Override
        public void onMessage(Channel channel, WorkerMessage message) {
            post(() -> {
                if (message instanceof ReadyMessage ready) {
                    onReady(channel, ready);
                } else if (message instanceof ResultMessage result) {
                    onResult(channel, result);
                } else if (message instanceof ErrorMessage error) {
                    onError(channel, error);
                } else if (message instanceof LogMessage logMessage) {
                    onLog(logMessage);
                } else if (message instanceof MetricsMessage metrics) {
                    onMetrics(metrics);
                } else {
                    log.warn("Unexpected {} from worker", message.getClass().getSimpleName());
                }
            });
        }

        @Override
        public void onDisconnected(Channel channel) {
            post(() -> onChannelClosed(channel));
        }
    }
}
