package scenariopool.protocol;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Worker to supervisor: advisory log line. Safe to ignore.
 */
public record LogMessage(
        @JsonProperty("workerId") int workerId,
        @JsonProperty("level") String level,
        @JsonProperty("message") String message) implements WorkerMessage {

    public static LogMessage info(int workerId, String message) {
        return new LogMessage(workerId, "info", message);
    }

    public static LogMessage warn(int workerId, String message) {
        return new LogMessage(workerId, "warn", message);
    }
}
