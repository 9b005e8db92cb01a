package scenariopool.protocol;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * Artifact file references produced while running a scenario.
 * All files live under the shared results directory.
 */
public record Artifacts(
        @JsonProperty("screenshots") List<String> screenshots,
        @JsonProperty("videos") List<String> videos,
        @JsonProperty("traces") List<String> traces,
        @JsonProperty("har") List<String> har,
        @JsonProperty("logs") List<String> logs) {

    public Artifacts {
        screenshots = screenshots == null ? List.of() : List.copyOf(screenshots);
        videos = videos == null ? List.of() : List.copyOf(videos);
        traces = traces == null ? List.of() : List.copyOf(traces);
        har = har == null ? List.of() : List.copyOf(har);
        logs = logs == null ? List.of() : List.copyOf(logs);
    }

    public static Artifacts empty() {
        return new Artifacts(null, null, null, null, null);
    }

    public Artifacts withLog(String logFile) {
        List<String> merged = new ArrayList<>(logs);
        merged.add(logFile);
        return new Artifacts(screenshots, videos, traces, har, merged);
    }

    @JsonIgnore
    public int count() {
        return screenshots.size() + videos.size() + traces.size() + har.size() + logs.size();
    }
}
