package scenariopool.protocol;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import scenariopool.coordinator.model.Feature;
import scenariopool.coordinator.model.Scenario;
import scenariopool.coordinator.model.WorkItem;

import java.util.List;
import java.util.Map;

/**
 * Supervisor to worker: run one work item.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ExecuteMessage(
        @JsonProperty("scenarioId") String scenarioId,
        @JsonProperty("feature") Feature feature,
        @JsonProperty("scenario") Scenario scenario,
        @JsonProperty("config") Map<String, String> config,
        @JsonProperty("exampleRow") List<String> exampleRow,
        @JsonProperty("exampleHeaders") List<String> exampleHeaders,
        @JsonProperty("iterationNumber") Integer iterationNumber,
        @JsonProperty("totalIterations") Integer totalIterations,
        @JsonProperty("testResultsDir") String testResultsDir) implements WorkerMessage {

    public ExecuteMessage {
        if (scenarioId == null || scenarioId.isBlank()) {
            throw new IllegalArgumentException("scenarioId is required");
        }
        config = config == null ? Map.of() : Map.copyOf(config);
    }

    public static ExecuteMessage forItem(WorkItem item, Map<String, String> config, String testResultsDir) {
        return new ExecuteMessage(
                item.id(),
                item.feature(),
                item.scenario(),
                config,
                item.exampleRow(),
                item.exampleHeaders(),
                item.iterationNumber(),
                item.totalIterations(),
                testResultsDir);
    }

    @JsonIgnore
    public boolean isDataDriven() {
        return iterationNumber != null;
    }
}
