package scenariopool.protocol;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Worker to supervisor: timing metrics in milliseconds. Advisory.
 */
public record MetricsMessage(
        @JsonProperty("workerId") int workerId,
        @JsonProperty("metrics") Map<String, Long> metrics) implements WorkerMessage {

    public MetricsMessage {
        metrics = metrics == null ? Map.of() : Map.copyOf(metrics);
    }
}
