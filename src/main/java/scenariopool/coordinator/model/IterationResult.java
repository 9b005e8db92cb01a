package scenariopool.coordinator.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import scenariopool.protocol.ResultMessage;

import java.util.Map;

/**
 * One iteration's contribution to an {@link AggregatedScenarioResult}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record IterationResult(
        @JsonProperty("scenarioId") String scenarioId,
        @JsonProperty("iteration") int iteration,
        @JsonProperty("status") ScenarioStatus status,
        @JsonProperty("duration") long duration,
        @JsonProperty("error") String error,
        @JsonProperty("stackTrace") String stackTrace,
        @JsonProperty("iterationData") Map<String, String> iterationData) {

    public IterationResult {
        iterationData = iterationData == null ? Map.of() : iterationData;
    }

    /**
     * @param iteration 1-based ordinal of the originating work item
     */
    public static IterationResult from(ResultMessage result, int iteration) {
        return new IterationResult(
                result.scenarioId(),
                iteration,
                result.status(),
                result.duration(),
                result.error(),
                result.stackTrace(),
                result.iterationData());
    }

    @JsonIgnore
    public boolean isFailed() {
        return status == ScenarioStatus.FAILED;
    }
}
