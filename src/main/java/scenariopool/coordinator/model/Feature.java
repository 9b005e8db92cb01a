package scenariopool.coordinator.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * A parsed feature file. Produced by the Gherkin parser and handed to the
 * workers unchanged.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Feature(
        @JsonProperty("name") String name,
        @JsonProperty("uri") String uri,
        @JsonProperty("tags") List<String> tags,
        @JsonProperty("background") List<Step> background,
        @JsonProperty("scenarios") List<Scenario> scenarios) {

    public Feature {
        tags = tags == null ? List.of() : List.copyOf(tags);
        background = background == null ? List.of() : List.copyOf(background);
        scenarios = scenarios == null ? List.of() : List.copyOf(scenarios);
    }

    public static Feature of(String name, List<Scenario> scenarios) {
        return new Feature(name, null, List.of(), List.of(), scenarios);
    }

    public Feature withBackground(List<Step> steps) {
        return new Feature(name, uri, tags, steps, scenarios);
    }

    public Feature withTags(List<String> newTags) {
        return new Feature(name, uri, newTags, background, scenarios);
    }
}
