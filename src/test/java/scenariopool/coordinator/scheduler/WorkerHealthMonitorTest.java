package scenariopool.coordinator.scheduler;

import io.netty.channel.embedded.EmbeddedChannel;
import org.junit.jupiter.api.Test;
import scenariopool.coordinator.launcher.WorkerHandle;
import scenariopool.coordinator.model.Feature;
import scenariopool.coordinator.model.Scenario;
import scenariopool.coordinator.model.WorkItem;
import scenariopool.coordinator.model.Worker;
import scenariopool.coordinator.model.WorkerState;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.*;

class WorkerHealthMonitorTest {

    private final WorkerHealthMonitor monitor = new WorkerHealthMonitor(Duration.ofSeconds(10), 2);
    private final Instant now = Instant.parse("2024-05-01T10:00:00Z");

    private static final WorkItem ITEM = WorkItem.builder()
            .id("work-1")
            .feature(Feature.of("F", List.of()))
            .scenario(Scenario.of("s", List.of()))
            .build();

    private static Worker readyWorker(int id, FakeHandle handle) {
        Worker w = new Worker(id, handle, Instant.EPOCH);
        w.markReady(new EmbeddedChannel());
        return w;
    }

    @Test
    void healthyIdleAndBusyWorkers() {
        Worker idle = readyWorker(1, new FakeHandle(1));
        Worker busy = readyWorker(2, new FakeHandle(2));
        busy.assign(ITEM, now.minusSeconds(5));

        assertTrue(monitor.inspect(List.of(idle, busy), now).isEmpty());
    }

    @Test
    void stuckWhenBusyPastTimeout() {
        Worker w = readyWorker(1, new FakeHandle(1));
        w.assign(ITEM, now.minusSeconds(11));

        HealthVerdict verdict = monitor.inspect(w, now);

        assertEquals(HealthVerdict.Problem.STUCK, verdict.problem());
        assertEquals(1, verdict.workerId());
        assertTrue(verdict.detail().contains("work-1"));
    }

    @Test
    void disconnectedWhenChannelClosedOrProcessGone() {
        Worker closed = readyWorker(1, new FakeHandle(1));
        closed.channel().close();
        FakeHandle deadHandle = new FakeHandle(2);
        Worker dead = readyWorker(2, deadHandle);
        dead.assign(ITEM, now);
        deadHandle.alive = false;

        List<HealthVerdict> verdicts = monitor.inspect(List.of(closed, dead), now);

        assertEquals(2, verdicts.size());
        assertTrue(verdicts.stream().allMatch(v -> v.problem() == HealthVerdict.Problem.DISCONNECTED));
    }

    @Test
    void unhealthyOnlyWhenIdle() {
        Worker w = readyWorker(1, new FakeHandle(1));
        w.recordError();
        w.recordError();
        assertNull(monitor.inspect(w, now));

        w.recordError();
        w.assign(ITEM, now);
        assertNull(monitor.inspect(w, now));

        w.release();
        assertEquals(HealthVerdict.Problem.UNHEALTHY, monitor.inspect(w, now).problem());
        assertTrue(monitor.isUnhealthy(w));
    }

    @Test
    void startingAndRetiredWorkersAreSkipped() {
        Worker starting = new Worker(1, new FakeHandle(1), now);
        Worker recycled = readyWorker(2, new FakeHandle(2));
        recycled.channel().close();
        recycled.markState(WorkerState.RECYCLED);

        assertTrue(monitor.inspect(List.of(starting, recycled), now).isEmpty());
    }

    @Test
    void busyWorkerTakesNoSecondItem() {
        Worker w = readyWorker(9, new FakeHandle(9));
        w.assign(ITEM, now);

        assertThrows(IllegalStateException.class, () -> w.assign(ITEM, now));
        assertSame(ITEM, w.release());
        assertFalse(w.isBusy());
        w.assign(ITEM, now);
        assertTrue(w.isBusy());
    }

    private static final class FakeHandle implements WorkerHandle {
        private final int id;
        volatile boolean alive = true;

        FakeHandle(int id) {
            this.id = id;
        }

        @Override
        public int workerId() {
            return id;
        }

        @Override
        public boolean isAlive() {
            return alive;
        }

        @Override
        public void destroy() {
            alive = false;
        }

        @Override
        public CompletableFuture<Void> onExit() {
            return new CompletableFuture<>();
        }

        @Override
        public long pid() {
            return -1;
        }
    }
}
