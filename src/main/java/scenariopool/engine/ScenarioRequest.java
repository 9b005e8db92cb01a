package scenariopool.engine;

import scenariopool.coordinator.model.Feature;
import scenariopool.coordinator.model.Scenario;
import scenariopool.worker.ArtifactCollector;

import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything the engine needs to run one item. {@code scenario} already has
 * example values interpolated into its name and step text.
 *
 * Engines name their screenshots, videos, traces and downloads through
 * {@link #artifactPath} so files from parallel workers never collide; the
 * paths they return in {@link ScenarioOutcome#artifacts()} are reduced to
 * file names before they reach the supervisor.
 */
public record ScenarioRequest(
        int workerId,
        String scenarioId,
        Feature feature,
        Scenario scenario,
        List<String> exampleHeaders,
        List<String> exampleRow,
        Integer iterationNumber,
        Integer totalIterations,
        String resultsDir,
        ArtifactCollector artifacts) {

    /**
     * New file under the results directory named for this worker and scenario,
     * e.g. {@code screenshots/screenshot_Checkout_w3_1700000000000.png}.
     *
     * @throws IOException if the artifact directory cannot be created
     */
    public Path artifactPath(ArtifactCollector.Kind kind, String extension) throws IOException {
        return artifacts.artifactPath(kind, scenario.name(), extension);
    }

    public boolean isDataDriven() {
        return iterationNumber != null;
    }

    public Map<String, String> iterationData() {
        if (exampleRow == null || exampleHeaders == null) {
            return Map.of();
        }
        Map<String, String> data = new LinkedHashMap<>();
        for (int i = 0; i < exampleHeaders.size() && i < exampleRow.size(); i++) {
            data.put(exampleHeaders.get(i), exampleRow.get(i));
        }
        return data;
    }
}
