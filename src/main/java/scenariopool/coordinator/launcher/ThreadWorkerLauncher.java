package scenariopool.coordinator.launcher;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import scenariopool.coordinator.config.PoolConfig;
import scenariopool.engine.ScenarioExecutorFactory;
import scenariopool.worker.WorkerClient;
import scenariopool.worker.WorkerRuntime;

import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Runs each worker on a daemon thread of this JVM. Same protocol and worker
 * code as process mode, without crash isolation.
 */
public class ThreadWorkerLauncher implements WorkerLauncher {

    private static final Logger log = LoggerFactory.getLogger(ThreadWorkerLauncher.class);

    private final PoolConfig config;
    private final ScenarioExecutorFactory factory;

    /**
     * @param factory engine factory, or null to resolve it from
     *                {@link PoolConfig#executorFactory()}
     */
    public ThreadWorkerLauncher(PoolConfig config, ScenarioExecutorFactory factory) {
        this.config = config.copy();
        this.factory = factory;
    }

    @Override
    public WorkerHandle launch(int workerId, String supervisorHost, int supervisorPort) {
        WorkerClient client = new WorkerClient(workerId, supervisorHost, supervisorPort,
                outbound -> new WorkerRuntime(workerId, factory, config.resultsDir(), config.project(), outbound, true));
        boolean eager = factory != null || config.executorFactory() != null;
        Map<String, String> initialConfig = eager ? config.workerConfig() : null;

        CompletableFuture<Void> exit = new CompletableFuture<>();
        Thread thread = new Thread(() -> {
            try {
                client.start(-1, initialConfig);
                int code = client.awaitExit();
                log.debug("Worker {} thread finished with code {}", workerId, code);
            } catch (InterruptedException e) {
                client.kill();
                Thread.currentThread().interrupt();
            } finally {
                exit.complete(null);
            }
        }, "worker-" + workerId);
        thread.setDaemon(true);
        thread.start();
        log.info("Worker {} launched in-process", workerId);
        return new ThreadHandle(workerId, client, thread, exit);
    }

    private static final class ThreadHandle implements WorkerHandle {
        private final int workerId;
        private final WorkerClient client;
        private final Thread thread;
        private final CompletableFuture<Void> exit;

        ThreadHandle(int workerId, WorkerClient client, Thread thread, CompletableFuture<Void> exit) {
            this.workerId = workerId;
            this.client = client;
            this.thread = thread;
            this.exit = exit;
        }

        @Override
        public int workerId() {
            return workerId;
        }

        @Override
        public boolean isAlive() {
            return !exit.isDone();
        }

        @Override
        public void destroy() {
            client.kill();
            thread.interrupt();
        }

        @Override
        public CompletableFuture<Void> onExit() {
            return exit;
        }

        @Override
        public long pid() {
            return -1;
        }
    }
}
