package scenariopool.protocol;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Worker to supervisor: an execution error that did not come from the
 * scenario's own steps (engine initialisation, hygiene, unexpected
 * exceptions). Counted against the worker's health.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorMessage(
        @JsonProperty("workerId") int workerId,
        @JsonProperty("scenarioId") String scenarioId,
        @JsonProperty("error") String error) implements WorkerMessage {
}
