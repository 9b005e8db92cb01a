package scenariopool.coordinator.launcher;

import java.io.IOException;

/**
 * Starts a worker that will connect back to the supervisor and announce
 * itself with a ready message carrying {@code workerId}.
 */
public interface WorkerLauncher {

    /**
     * @throws IOException if the worker could not be started at all
     */
    WorkerHandle launch(int workerId, String supervisorHost, int supervisorPort) throws IOException;
}
