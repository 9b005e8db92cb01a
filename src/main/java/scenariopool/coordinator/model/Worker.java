package scenariopool.coordinator.model;

import io.netty.channel.Channel;
import scenariopool.coordinator.launcher.WorkerHandle;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Supervisor-side handle to a live worker.
 *
 * Mutable, and confined to the supervisor thread: every field is read and
 * written from the orchestrator's event loop only.
 */
public final class Worker {

    private final int id;
    private final WorkerHandle handle;
    private final Instant launchedAt;

    private Channel channel;
    private WorkerState state = WorkerState.STARTING;
    private boolean busy;
    private WorkItem currentWork;
    private Instant assignedAt;
    private int errorCount;
    private int completedItems;

    public Worker(int id, WorkerHandle handle, Instant launchedAt) {
        this.id = id;
        this.handle = Objects.requireNonNull(handle, "handle is required");
        this.launchedAt = launchedAt;
    }

    public int id() {
        return id;
    }

    public WorkerHandle handle() {
        return handle;
    }

    public Instant launchedAt() {
        return launchedAt;
    }

    public Channel channel() {
        return channel;
    }

    public WorkerState state() {
        return state;
    }

    public boolean isBusy() {
        return busy;
    }

    public WorkItem currentWork() {
        return currentWork;
    }

    public Instant assignedAt() {
        return assignedAt;
    }

    public int errorCount() {
        return errorCount;
    }

    public int completedItems() {
        return completedItems;
    }

    /** Ready and able to receive work */
    public boolean isReady() {
        return channel != null && state.isLive();
    }

    /** True when the message channel is open */
    public boolean isConnected() {
        return channel != null && channel.isActive();
    }

    public void markReady(Channel readyChannel) {
        this.channel = Objects.requireNonNull(readyChannel, "channel is required");
        this.state = WorkerState.IDLE;
    }

    /**
     * Claim the worker for one item. Must happen before the execute message
     * is written.
     */
    public void assign(WorkItem item, Instant now) {
        if (busy) {
            throw new IllegalStateException("Worker " + id + " is already busy with " + currentWork.id());
        }
        this.busy = true;
        this.currentWork = Objects.requireNonNull(item, "item is required");
        this.assignedAt = now;
        this.state = WorkerState.BUSY;
    }

    /**
     * Release the in-flight item.
     *
     * @return the item that was in flight, or null
     */
    public WorkItem release() {
        WorkItem item = currentWork;
        this.busy = false;
        this.currentWork = null;
        this.assignedAt = null;
        if (state == WorkerState.BUSY) {
            this.state = WorkerState.IDLE;
        }
        return item;
    }

    public void recordCompletion() {
        completedItems++;
    }

    public int recordError() {
        return ++errorCount;
    }

    public void markState(WorkerState newState) {
        this.state = newState;
    }

    /** How long the current item has been in flight */
    public Duration busyFor(Instant now) {
        if (!busy || assignedAt == null) {
            return Duration.ZERO;
        }
        return Duration.between(assignedAt, now);
    }

    @Override
    public String toString() {
        return "Worker{id=" + id + ", state=" + state
                + (currentWork != null ? ", work='" + currentWork.id() + "'" : "") + "}";
    }
}
