package scenariopool.coordinator.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Counters for one finished run.
 *
 * @param lost      ids of items whose worker died mid-execution
 * @param abandoned ids still queued when the run stopped
 * @param pending   aggregation keys that never received all iterations
 */
public record RunSummary(
        @JsonProperty("total") int total,
        @JsonProperty("completed") int completed,
        @JsonProperty("passed") int passed,
        @JsonProperty("failed") int failed,
        @JsonProperty("skipped") int skipped,
        @JsonProperty("lost") List<String> lost,
        @JsonProperty("abandoned") List<String> abandoned,
        @JsonProperty("pending") List<String> pending,
        @JsonProperty("timedOut") boolean timedOut,
        @JsonProperty("cancelled") boolean cancelled,
        @JsonProperty("durationMs") long durationMs,
        @JsonProperty("aggregated") List<AggregatedScenarioResult> aggregated) {

    public RunSummary {
        lost = lost == null ? List.of() : List.copyOf(lost);
        abandoned = abandoned == null ? List.of() : List.copyOf(abandoned);
        pending = pending == null ? List.of() : List.copyOf(pending);
        aggregated = aggregated == null ? List.of() : List.copyOf(aggregated);
    }

    public static RunSummary empty() {
        return new RunSummary(0, 0, 0, 0, 0, null, null, null, false, false, 0, null);
    }

    /** Every item produced a result and none failed */
    @JsonIgnore
    public boolean isSuccessful() {
        return completed >= total && failed == 0 && lost.isEmpty() && !timedOut && !cancelled;
    }
}
