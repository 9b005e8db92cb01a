package scenariopool.coordinator.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Examples table of a scenario outline.
 * Rows are ordered values aligned with {@link #headers()}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Examples(
        @JsonProperty("headers") List<String> headers,
        @JsonProperty("rows") List<List<String>> rows,
        @JsonProperty("dataSource") ExamplesSource dataSource) {

    public Examples {
        headers = headers == null ? List.of() : List.copyOf(headers);
        rows = rows == null ? List.of() : rows.stream().map(List::copyOf).toList();
    }

    public static Examples inline(List<String> headers, List<List<String>> rows) {
        return new Examples(headers, rows, null);
    }

    public static Examples external(ExamplesSource source) {
        return new Examples(List.of(), List.of(), source);
    }

    public Examples withData(List<String> newHeaders, List<List<String>> newRows) {
        return new Examples(newHeaders, newRows, dataSource);
    }

    @JsonIgnore
    public boolean hasDataSource() {
        return dataSource != null;
    }
}
