package scenariopool.protocol;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import scenariopool.coordinator.model.ScenarioStatus;

import java.util.List;
import java.util.Map;

/**
 * Worker to supervisor: outcome of one work item.
 *
 * Iteration fields echo the originating execute message so the result can be
 * interpreted without the work item in scope.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ResultMessage(
        @JsonProperty("scenarioId") String scenarioId,
        @JsonProperty("workerId") int workerId,
        @JsonProperty("featureName") String featureName, // filled in by the supervisor
        @JsonProperty("name") String name, // interpolated scenario name
        @JsonProperty("status") ScenarioStatus status,
        @JsonProperty("duration") long duration,
        @JsonProperty("error") String error,
        @JsonProperty("stackTrace") String stackTrace,
        @JsonProperty("steps") List<StepOutcome> steps,
        @JsonProperty("artifacts") Artifacts artifacts,
        @JsonProperty("tags") List<String> tags,
        @JsonProperty("iteration") Integer iteration,
        @JsonProperty("iterationData") Map<String, String> iterationData) implements WorkerMessage {

    public ResultMessage {
        if (scenarioId == null || scenarioId.isBlank()) {
            throw new IllegalArgumentException("scenarioId is required");
        }
        if (status == null) {
            throw new IllegalArgumentException("status is required");
        }
        steps = steps == null ? List.of() : List.copyOf(steps);
        artifacts = artifacts == null ? Artifacts.empty() : artifacts;
        tags = tags == null ? List.of() : List.copyOf(tags);
    }

    @JsonIgnore
    public boolean isFailed() {
        return status == ScenarioStatus.FAILED;
    }

    @JsonIgnore
    public boolean isPassed() {
        return status == ScenarioStatus.PASSED;
    }

    public ResultMessage withFeatureName(String feature) {
        return new ResultMessage(scenarioId, workerId, feature, name, status, duration, error, stackTrace,
                steps, artifacts, tags, iteration, iterationData);
    }

    /** Failed result for an item the worker could not run at all */
    public static ResultMessage failure(String scenarioId, int workerId, String name, long duration,
            String error, String stackTrace, Integer iteration, Map<String, String> iterationData) {
        return new ResultMessage(scenarioId, workerId, null, name, ScenarioStatus.FAILED, duration, error,
                stackTrace, List.of(), Artifacts.empty(), List.of(), iteration, iterationData);
    }
}
