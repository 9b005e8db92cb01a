package scenariopool.coordinator.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * A parsed scenario (or scenario outline when {@link #examples()} is set).
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record Scenario(
        @JsonProperty("name") String name,
        @JsonProperty("tags") List<String> tags,
        @JsonProperty("steps") List<Step> steps,
        @JsonProperty("examples") Examples examples) {

    public Scenario {
        tags = tags == null ? List.of() : List.copyOf(tags);
        steps = steps == null ? List.of() : List.copyOf(steps);
    }

    public static Scenario of(String name, List<Step> steps) {
        return new Scenario(name, List.of(), steps, null);
    }

    public Scenario withName(String newName) {
        return new Scenario(newName, tags, steps, examples);
    }

    public Scenario withSteps(List<Step> newSteps) {
        return new Scenario(name, tags, newSteps, examples);
    }

    public Scenario withTags(List<String> newTags) {
        return new Scenario(name, newTags, steps, examples);
    }

    public Scenario withExamples(Examples newExamples) {
        return new Scenario(name, tags, steps, newExamples);
    }
}
