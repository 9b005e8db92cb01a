package scenariopool.coordinator.launcher;

import java.util.concurrent.CompletableFuture;

/**
 * Handle to a launched worker: a child JVM or, in thread mode, an in-process
 * thread. The supervisor only ever force-kills through it; graceful shutdown
 * goes over the message channel.
 */
public interface WorkerHandle {

    int workerId();

    boolean isAlive();

    /** Forcibly stop the worker. Safe to call more than once. */
    void destroy();

    /** Completes once the worker has exited, for whatever reason. */
    CompletableFuture<Void> onExit();

    /** Operating system pid, or -1 when the worker runs in-process. */
    long pid();
}
