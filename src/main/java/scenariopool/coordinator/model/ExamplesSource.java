package scenariopool.coordinator.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Reference to external example data (a CSV or JSON file) declared on an
 * Examples block instead of, or in addition to, inline rows.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ExamplesSource(
        @JsonProperty("type") String type, // csv | json
        @JsonProperty("source") String source,
        @JsonProperty("delimiter") String delimiter,
        @JsonProperty("filter") String filter) {

    public ExamplesSource {
        if (source == null || source.isBlank()) {
            throw new IllegalArgumentException("source is required");
        }
    }

    public static ExamplesSource of(String type, String source) {
        return new ExamplesSource(type, source, null, null);
    }

    public ExamplesSource withFilter(String filterExpression) {
        return new ExamplesSource(type, source, delimiter, filterExpression);
    }
}
