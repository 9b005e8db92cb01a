package scenariopool.coordinator.scheduler;

/**
 * The pool lost all capacity while work was still queued.
 */
public class WorkerPoolException extends RuntimeException {

    public WorkerPoolException(String message) {
        super(message);
    }

    public WorkerPoolException(String message, Throwable cause) {
        super(message, cause);
    }
}
