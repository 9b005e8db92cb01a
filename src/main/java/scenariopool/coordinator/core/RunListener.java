package scenariopool.coordinator.core;

import scenariopool.coordinator.model.AggregatedScenarioResult;
import scenariopool.coordinator.model.RunSummary;
import scenariopool.coordinator.model.WorkItem;
import scenariopool.protocol.ResultMessage;

/**
 * Observer of a run. Called on the supervisor thread, except
 * {@link #onRunFinished} which runs on the thread that called execute;
 * implementations should return quickly. Exceptions thrown here are logged
 * and otherwise ignored.
 */
public interface RunListener {

    RunListener NONE = new RunListener() {
    };

    default void onScenarioCompleted(WorkItem item, ResultMessage result, int completed, int total) {
    }

    default void onAggregatedResult(AggregatedScenarioResult result) {
    }

    default void onWorkerRecycled(int workerId, String reason) {
    }

    /** The worker running {@code item} died; the item will not be retried. */
    default void onItemLost(WorkItem item) {
    }

    default void onRunFinished(RunSummary summary) {
    }
}
