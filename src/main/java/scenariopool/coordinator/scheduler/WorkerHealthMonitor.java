package scenariopool.coordinator.scheduler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import scenariopool.coordinator.config.PoolConfig;
import scenariopool.coordinator.model.Worker;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Periodic worker inspection.
 *
 * A worker can be:
 * - disconnected: its channel closed or its process exited
 * - stuck: busy longer than the scenario timeout
 * - unhealthy: more errors than allowed, acted on only while idle so the
 *   in-flight item is not thrown away
 *
 * The monitor only reports; the orchestrator decides what to do.
 */
public class WorkerHealthMonitor {

    private static final Logger log = LoggerFactory.getLogger(WorkerHealthMonitor.class);

    private final Duration scenarioTimeout;
    private final int maxWorkerErrors;

    public WorkerHealthMonitor(PoolConfig config) {
        this(config.scenarioTimeout(), config.maxWorkerErrors());
    }

    public WorkerHealthMonitor(Duration scenarioTimeout, int maxWorkerErrors) {
        this.scenarioTimeout = scenarioTimeout;
        this.maxWorkerErrors = maxWorkerErrors;
    }

    /**
     * Inspect ready workers. Workers still starting up are skipped; the
     * startup timeout covers them.
     *
     * @return one verdict per worker needing action, at most one per worker
     */
    public List<HealthVerdict> inspect(Collection<Worker> workers, Instant now) {
        List<HealthVerdict> verdicts = new ArrayList<>();
        for (Worker w : workers) {
            if (w.channel() == null || !w.state().isLive()) {
                continue;
            }
            HealthVerdict verdict = inspect(w, now);
            if (verdict != null) {
                verdicts.add(verdict);
            }
        }
        if (!verdicts.isEmpty()) {
            log.debug("Health check: {} of {} workers need action", verdicts.size(), workers.size());
        }
        return verdicts;
    }

    /**
     * @return the verdict, or null when the worker is healthy
     */
    public HealthVerdict inspect(Worker w, Instant now) {
        if (!w.isConnected() || !w.handle().isAlive()) {
            return new HealthVerdict(w.id(), HealthVerdict.Problem.DISCONNECTED,
                    w.isBusy() ? "disconnected while running " + w.currentWork().id() : "disconnected while idle");
        }
        if (w.isBusy()) {
            Duration busy = w.busyFor(now);
            if (busy.compareTo(scenarioTimeout) > 0) {
                return new HealthVerdict(w.id(), HealthVerdict.Problem.STUCK,
                        "busy " + busy.toMillis() + "ms with " + w.currentWork().id()
                                + " (timeout " + scenarioTimeout.toMillis() + "ms)");
            }
            return null;
        }
        if (isUnhealthy(w)) {
            return new HealthVerdict(w.id(), HealthVerdict.Problem.UNHEALTHY,
                    w.errorCount() + " errors (max " + maxWorkerErrors + ")");
        }
        return null;
    }

    public boolean isUnhealthy(Worker w) {
        return w.errorCount() > maxWorkerErrors;
    }
}
