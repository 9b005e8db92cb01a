package scenariopool.engine;

import scenariopool.coordinator.model.ScenarioStatus;
import scenariopool.protocol.Artifacts;
import scenariopool.protocol.StepOutcome;

import java.util.List;
import java.util.Objects;

/**
 * What the engine reports back for one scenario. Step failures are expressed
 * here as {@link ScenarioStatus#FAILED}, never thrown.
 */
public record ScenarioOutcome(
        String name,
        ScenarioStatus status,
        List<StepOutcome> steps,
        String error,
        String stackTrace,
        Artifacts artifacts,
        List<String> tags) {

    public ScenarioOutcome {
        Objects.requireNonNull(status, "status is required");
        steps = steps == null ? List.of() : List.copyOf(steps);
        artifacts = artifacts == null ? Artifacts.empty() : artifacts;
        tags = tags == null ? List.of() : List.copyOf(tags);
    }

    public static ScenarioOutcome passed(String name, List<StepOutcome> steps) {
        return new ScenarioOutcome(name, ScenarioStatus.PASSED, steps, null, null, null, null);
    }

    public static ScenarioOutcome failed(String name, List<StepOutcome> steps, String error, String stackTrace) {
        return new ScenarioOutcome(name, ScenarioStatus.FAILED, steps, error, stackTrace, null, null);
    }

    public static ScenarioOutcome skipped(String name) {
        return new ScenarioOutcome(name, ScenarioStatus.SKIPPED, List.of(), null, null, null, null);
    }

    public ScenarioOutcome withArtifacts(Artifacts newArtifacts) {
        return new ScenarioOutcome(name, status, steps, error, stackTrace, newArtifacts, tags);
    }
}
