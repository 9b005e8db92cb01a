package scenariopool.coordinator.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import scenariopool.coordinator.util.Text;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * One logical outcome for all iterations of a data-driven scenario.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record AggregatedScenarioResult(
        @JsonProperty("key") String key,
        @JsonProperty("featureName") String featureName,
        @JsonProperty("scenarioName") String scenarioName, // base name, no iteration suffix
        @JsonProperty("status") ScenarioStatus status,
        @JsonProperty("duration") long duration,
        @JsonProperty("error") String error,
        @JsonProperty("firstError") String firstError,
        @JsonProperty("stackTrace") String stackTrace,
        @JsonProperty("iterations") List<IterationResult> iterations) {

    public static final int MAX_COMMENT_LENGTH = 1000;
    static final int ERROR_SNIPPET_LENGTH = 30;

    /**
     * Build the aggregate. Iterations are sorted by iteration number first, so
     * "first failure" means the lowest failing iteration regardless of
     * completion order.
     */
    public static AggregatedScenarioResult of(String featureName, String scenarioName, List<IterationResult> iterations) {
        if (iterations == null || iterations.isEmpty()) {
            throw new IllegalArgumentException("at least one iteration is required");
        }
        List<IterationResult> sorted = new ArrayList<>(iterations);
        sorted.sort(Comparator.comparingInt(IterationResult::iteration));

        long duration = 0;
        int failed = 0;
        IterationResult firstFailure = null;
        for (IterationResult it : sorted) {
            duration += it.duration();
            if (it.isFailed()) {
                failed++;
                if (firstFailure == null) {
                    firstFailure = it;
                }
            }
        }

        ScenarioStatus status = failed > 0 ? ScenarioStatus.FAILED : ScenarioStatus.PASSED;
        String error = failed > 0
                ? failed + " of " + sorted.size() + " iterations failed. See comment for details."
                : null;

        return new AggregatedScenarioResult(
                featureName + "::" + scenarioName,
                featureName,
                scenarioName,
                status,
                duration,
                error,
                firstFailure == null ? null : firstFailure.error(),
                firstFailure == null ? null : firstFailure.stackTrace(),
                List.copyOf(sorted));
    }

    @JsonIgnore
    public boolean isFailed() {
        return status == ScenarioStatus.FAILED;
    }

    public List<Integer> failedIterations() {
        List<Integer> failed = new ArrayList<>();
        for (IterationResult it : iterations) {
            if (it.isFailed()) {
                failed.add(it.iteration());
            }
        }
        return failed;
    }

    /**
     * Human readable per-iteration breakdown, at most 1000 characters.
     */
    public String summaryComment() {
        StringBuilder sb = new StringBuilder();
        sb.append("Data-Driven Test Results (").append(iterations.size()).append(" iterations)\n");
        sb.append("Overall Status: ").append(isFailed() ? "Failed" : "Passed").append("\n\n");
        for (int i = 0; i < iterations.size(); i++) {
            IterationResult it = iterations.get(i);
            if (i > 0) {
                sb.append('\n');
            }
            sb.append("Iteration-").append(it.iteration());
            if (it.isFailed()) {
                sb.append(" ✗ Failed");
                if (it.error() != null && !it.error().isBlank()) {
                    sb.append(" [Error: ").append(shortError(it.error())).append(']');
                }
            } else if (it.status() == ScenarioStatus.SKIPPED) {
                sb.append(" - Skipped");
            } else {
                sb.append(" ✓ Passed");
            }
        }
        return Text.truncate(sb.toString(), MAX_COMMENT_LENGTH);
    }

    private static String shortError(String error) {
        if (error.contains("Element not found")) {
            return "Element not found";
        }
        if (error.contains("Step definition not found")) {
            return "Missing step";
        }
        if (error.contains("Timeout")) {
            return "Timeout";
        }
        return error.length() > ERROR_SNIPPET_LENGTH ? error.substring(0, ERROR_SNIPPET_LENGTH) : error;
    }
}
