package scenariopool.protocol;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Worker to supervisor: first message on a new connection.
 */
public record ReadyMessage(
        @JsonProperty("workerId") int workerId,
        @JsonProperty("pid") long pid) implements WorkerMessage {
}
