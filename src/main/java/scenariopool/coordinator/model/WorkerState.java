package scenariopool.coordinator.model;

/**
 * Supervisor-side lifecycle of a worker process.
 */
public enum WorkerState {
    /** Process launched, waiting for the ready message */
    STARTING,
    /** Ready and waiting for work */
    IDLE,
    /** Exactly one work item in flight */
    BUSY,
    /** Terminate sent, waiting for exit */
    TERMINATING,
    /** Exited after terminate (or force-killed at shutdown) */
    TERMINATED,
    /** Killed by the supervisor and replaced */
    RECYCLED,
    /** Channel lost without a terminate */
    DISCONNECTED;

    public boolean isLive() {
        return this == IDLE || this == BUSY;
    }
}
