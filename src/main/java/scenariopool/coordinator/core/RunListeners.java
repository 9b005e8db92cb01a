package scenariopool.coordinator.core;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import scenariopool.coordinator.model.AggregatedScenarioResult;
import scenariopool.coordinator.model.RunSummary;
import scenariopool.coordinator.model.WorkItem;
import scenariopool.protocol.ResultMessage;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Fan-out to registered {@link RunListener}s. A failing listener is logged
 * and does not stop the others.
 */
public final class RunListeners implements RunListener {

    private static final Logger log = LoggerFactory.getLogger(RunListeners.class);

    private final List<RunListener> listeners = new CopyOnWriteArrayList<>();

    public void add(RunListener listener) {
        if (listener != null) {
            listeners.add(listener);
        }
    }

    public int size() {
        return listeners.size();
    }

    @Override
    public void onScenarioCompleted(WorkItem item, ResultMessage result, int completed, int total) {
        fire("onScenarioCompleted", l -> l.onScenarioCompleted(item, result, completed, total));
    }

    @Override
    public void onAggregatedResult(AggregatedScenarioResult result) {
        fire("onAggregatedResult", l -> l.onAggregatedResult(result));
    }

    @Override
    public void onWorkerRecycled(int workerId, String reason) {
        fire("onWorkerRecycled", l -> l.onWorkerRecycled(workerId, reason));
    }

    @Override
    public void onItemLost(WorkItem item) {
        fire("onItemLost", l -> l.onItemLost(item));
    }

    @Override
    public void onRunFinished(RunSummary summary) {
        fire("onRunFinished", l -> l.onRunFinished(summary));
    }

    private void fire(String event, Consumer<RunListener> call) {
        for (RunListener l : listeners) {
            try {
                call.accept(l);
            } catch (RuntimeException e) {
                log.error("Run listener {} failed in {}", l.getClass().getName(), event, e);
            }
        }
    }
}
