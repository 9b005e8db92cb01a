package scenariopool.protocol;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Supervisor to worker: clean up and exit.
 */
public record TerminateMessage(@JsonProperty("reason") String reason) implements WorkerMessage {

    public static TerminateMessage shutdown() {
        return new TerminateMessage("shutdown");
    }
}
