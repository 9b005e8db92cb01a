package scenariopool.coordinator.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * A single Gherkin step as produced by the parser.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Step(
        @JsonProperty("keyword") String keyword,
        @JsonProperty("text") String text,
        @JsonProperty("docString") String docString) {

    public Step(String keyword, String text) {
        this(keyword, text, null);
    }

    public Step withText(String newText, String newDocString) {
        return new Step(keyword, newText, newDocString);
    }
}
