package scenariopool.coordinator.scheduler;

/**
 * Outcome of inspecting one worker.
 *
 * @param workerId id of the inspected worker
 * @param problem  what is wrong with it
 * @param detail   human readable reason for the log
 */
public record HealthVerdict(int workerId, Problem problem, String detail) {

    public enum Problem {
        /** Message channel closed or process gone */
        DISCONNECTED,
        /** Busy with one item for longer than the scenario timeout */
        STUCK,
        /** Too many errors; recycled once idle */
        UNHEALTHY
    }
}
