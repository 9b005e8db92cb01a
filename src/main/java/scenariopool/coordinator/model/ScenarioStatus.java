package scenariopool.coordinator.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Outcome of a scenario, a data-driven iteration, or a step.
 */
public enum ScenarioStatus {
    @JsonProperty("passed")
    PASSED,
    @JsonProperty("failed")
    FAILED,
    @JsonProperty("skipped")
    SKIPPED;

    public String symbol() {
        return this == PASSED ? "✓" : this == FAILED ? "✗" : "-";
    }
}
