package scenariopool.coordinator.scheduler;

/**
 * The initial worker pool could not be brought up.
 */
public class WorkerStartupException extends RuntimeException {

    public WorkerStartupException(String message) {
        super(message);
    }

    public WorkerStartupException(String message, Throwable cause) {
        super(message, cause);
    }
}
