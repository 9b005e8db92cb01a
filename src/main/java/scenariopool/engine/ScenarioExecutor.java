package scenariopool.engine;

import java.util.Map;

/**
 * The step-execution engine as seen from a worker. One instance lives for
 * the whole worker process and runs items one at a time.
 */
public interface ScenarioExecutor extends AutoCloseable {

    /**
     * Run one scenario. Step failures must be reported through the returned
     * outcome; a thrown exception is reported as a failed item and counted
     * as a worker error.
     */
    ScenarioOutcome execute(ScenarioRequest request) throws Exception;

    /**
     * Apply run configuration. Called before the first item and again
     * whenever the configuration sent with an item differs from the last.
     */
    default void configure(Map<String, String> config) throws Exception {
    }

    /** Reset session state (cookies, storage) while keeping resources open. */
    default void clearState() throws Exception {
    }

    /** Close stateful sub-resources such as a browser; reopened lazily. */
    default void releaseResources() throws Exception {
    }

    /** Final cleanup when the worker terminates. */
    @Override
    void close();
}
