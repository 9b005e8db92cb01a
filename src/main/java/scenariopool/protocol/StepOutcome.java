package scenariopool.protocol;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import scenariopool.coordinator.model.ScenarioStatus;

/**
 * Outcome of one executed step.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record StepOutcome(
        @JsonProperty("keyword") String keyword,
        @JsonProperty("text") String text,
        @JsonProperty("status") ScenarioStatus status,
        @JsonProperty("duration") long duration,
        @JsonProperty("error") String error) {

    public static StepOutcome passed(String keyword, String text, long duration) {
        return new StepOutcome(keyword, text, ScenarioStatus.PASSED, duration, null);
    }

    public static StepOutcome failed(String keyword, String text, long duration, String error) {
        return new StepOutcome(keyword, text, ScenarioStatus.FAILED, duration, error);
    }

    public static StepOutcome skipped(String keyword, String text) {
        return new StepOutcome(keyword, text, ScenarioStatus.SKIPPED, 0, null);
    }
}
