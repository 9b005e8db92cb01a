package scenariopool.coordinator.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import scenariopool.coordinator.model.AggregatedScenarioResult;
import scenariopool.coordinator.model.IterationResult;
import scenariopool.coordinator.model.WorkItem;
import scenariopool.protocol.ResultMessage;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Collects iteration results of data-driven scenarios and emits one
 * {@link AggregatedScenarioResult} per scenario once every iteration has
 * reported, whatever order they arrived in.
 *
 * Not thread-safe; owned by the supervisor thread.
 */
public class ResultAggregator {

    private static final Logger log = LoggerFactory.getLogger(ResultAggregator.class);

    private final Map<String, Pending> pending = new LinkedHashMap<>();
    private final Set<String> emitted = new HashSet<>();

    /**
     * Record one result.
     *
     * @return the aggregate when this result completed its scenario, empty
     *         otherwise (and always for non data-driven items)
     */
    public Optional<AggregatedScenarioResult> accept(WorkItem item, ResultMessage result) {
        if (!item.isDataDriven()) {
            return Optional.empty();
        }

        String key = item.aggregationKey();
        if (emitted.contains(key)) {
            log.warn("Ignoring late iteration {} for already aggregated {}", item.iterationNumber(), key);
            return Optional.empty();
        }

        Pending entry = pending.computeIfAbsent(key,
                k -> new Pending(item.featureName(), item.baseScenarioName(), item.totalIterations()));
        IterationResult previous = entry.iterations.put(item.iterationNumber(),
                IterationResult.from(result, item.iterationNumber()));
        if (previous != null) {
            log.warn("Duplicate result for iteration {} of {}, keeping the latest", item.iterationNumber(), key);
        }
        log.debug("Data-driven iteration {}/{} for {} ({} collected)",
                item.iterationNumber(), entry.total, key, entry.iterations.size());

        if (entry.iterations.size() < entry.total) {
            return Optional.empty();
        }

        pending.remove(key);
        emitted.add(key);
        AggregatedScenarioResult aggregated = AggregatedScenarioResult.of(
                entry.featureName, entry.scenarioName, new ArrayList<>(entry.iterations.values()));
        log.info("All {} iterations complete for {}: {}", entry.total, entry.scenarioName, aggregated.status());
        return Optional.of(aggregated);
    }

    /** Keys whose iterations have not all reported yet */
    public List<String> pendingKeys() {
        return new ArrayList<>(pending.keySet());
    }

    /** Iterations collected so far for an incomplete key */
    public int collected(String key) {
        Pending entry = pending.get(key);
        return entry == null ? 0 : entry.iterations.size();
    }

    private static final class Pending {
        final String featureName;
        final String scenarioName;
        final int total;
        final TreeMap<Integer, IterationResult> iterations = new TreeMap<>();

        Pending(String featureName, String scenarioName, int total) {
            this.featureName = featureName;
            this.scenarioName = scenarioName;
            this.total = total;
        }
    }
}
