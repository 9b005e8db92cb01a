package scenariopool.worker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import scenariopool.coordinator.config.PoolConfig;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Entry point of a worker JVM.
 *
 * Reads {@code WORKER_ID}, {@code SUPERVISOR_HOST} and {@code SUPERVISOR_PORT}
 * from the environment; positional arguments {@code <id> <host> <port>}
 * override them.
 */
public final class WorkerMain {

    private static final Logger log = LoggerFactory.getLogger(WorkerMain.class);

    private WorkerMain() {
    }

    public static void main(String[] args) {
        int code;
        try {
            code = run(args, System.getenv());
        } catch (IllegalArgumentException e) {
            log.error("Invalid worker arguments: {}", e.getMessage());
            code = 64;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            code = WorkerClient.EXIT_KILLED;
        }
        System.exit(code);
    }

    static int run(String[] args, Map<String, String> env) throws InterruptedException {
        int workerId = parseInt("WORKER_ID", arg(args, 0, env.get("WORKER_ID")));
        String host = arg(args, 1, env.getOrDefault("SUPERVISOR_HOST", "127.0.0.1"));
        int port = parseInt("SUPERVISOR_PORT", arg(args, 2, env.get("SUPERVISOR_PORT")));
        String resultsDir = env.getOrDefault("TEST_RESULTS_DIR", PoolConfig.defaults().resultsDir());
        String project = env.getOrDefault("PROJECT", PoolConfig.defaults().project());

        // a factory known up front lets the engine warm up before the first item
        Map<String, String> initialConfig = null;
        String factory = env.get("EXECUTOR_FACTORY");
        if (factory != null && !factory.isBlank()) {
            initialConfig = new LinkedHashMap<>();
            initialConfig.put(PoolConfig.KEY_EXECUTOR_FACTORY, factory.trim());
            initialConfig.put(PoolConfig.KEY_PROJECT, project);
        }

        log.info("Worker {} starting (pid {}), supervisor {}:{}", workerId, ProcessHandle.current().pid(), host, port);
        WorkerClient client = new WorkerClient(workerId, host, port,
                outbound -> new WorkerRuntime(workerId, null, resultsDir, project, outbound, false));
        client.start(ProcessHandle.current().pid(), initialConfig);
        int code = client.awaitExit();
        log.info("Worker {} exiting with code {}", workerId, code);
        return code;
    }

    private static String arg(String[] args, int index, String fallback) {
        return args != null && args.length > index && !args[index].isBlank() ? args[index] : fallback;
    }

    private static int parseInt(String name, String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " is required");
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " must be an integer, got '" + value + "'", e);
        }
    }
}
