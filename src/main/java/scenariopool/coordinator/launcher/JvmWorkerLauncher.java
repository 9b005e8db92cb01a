package scenariopool.coordinator.launcher;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import scenariopool.coordinator.config.PoolConfig;
import scenariopool.worker.WorkerMain;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Runs each worker as a child JVM on this JVM's classpath. Child output is
 * forwarded line by line to the log.
 */
public class JvmWorkerLauncher implements WorkerLauncher {

    private static final Logger log = LoggerFactory.getLogger(JvmWorkerLauncher.class);

    private final PoolConfig config;

    public JvmWorkerLauncher(PoolConfig config) {
        this.config = config.copy();
    }

    @Override
    public WorkerHandle launch(int workerId, String supervisorHost, int supervisorPort) throws IOException {
        List<String> command = buildCommand();
        log.debug("Launching worker {}: {}", workerId, String.join(" ", command));

        ProcessBuilder pb = new ProcessBuilder(command);
        pb.redirectErrorStream(true);
        Map<String, String> env = pb.environment();
        env.put("WORKER_ID", String.valueOf(workerId));
        env.put("SUPERVISOR_HOST", supervisorHost);
        env.put("SUPERVISOR_PORT", String.valueOf(supervisorPort));
        env.put("TEST_RESULTS_DIR", config.resultsDir());
        env.put("PROJECT", config.project());
        if (config.executorFactory() != null) {
            env.put("EXECUTOR_FACTORY", config.executorFactory());
        }

        Process process = pb.start();
        startOutputStreaming(workerId, process);
        log.info("Worker {} launched as pid {}", workerId, process.pid());
        return new ProcessHandleImpl(workerId, process);
    }

    List<String> buildCommand() {
        List<String> command = new ArrayList<>();
        command.add(Path.of(System.getProperty("java.home"), "bin", "java").toString());
        command.add("-Xmx" + config.workerHeapMb() + "m");
        command.add("-cp");
        command.add(System.getProperty("java.class.path"));
        command.add(WorkerMain.class.getName());
        return command;
    }

    private void startOutputStreaming(int workerId, Process process) {
        Thread outputThread = new Thread(() -> {
            try (BufferedReader reader = new BufferedReader(
                    new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
                String line;
                while ((line = reader.readLine()) != null) {
                    if (config.debugWorkers()) {
                        log.info("[worker-{}] {}", workerId, line);
                    } else {
                        log.debug("[worker-{}] {}", workerId, line);
                    }
                }
            } catch (IOException e) {
                log.debug("Worker {} output stream closed: {}", workerId, e.getMessage());
            }
        });
        outputThread.setDaemon(true);
        outputThread.setName("worker-" + workerId + "-output");
        outputThread.start();
    }

    private static final class ProcessHandleImpl implements WorkerHandle {
        private final int workerId;
        private final Process process;
        private final CompletableFuture<Void> exit;

        ProcessHandleImpl(int workerId, Process process) {
            this.workerId = workerId;
            this.process = process;
            this.exit = process.onExit().thenApply(p -> {
                log.debug("Worker {} (pid {}) exited with code {}", workerId, p.pid(), p.exitValue());
                return null;
            });
        }

        @Override
        public int workerId() {
            return workerId;
        }

        @Override
        public boolean isAlive() {
            return process.isAlive();
        }

        @Override
        public void destroy() {
            if (process.isAlive()) {
                process.destroyForcibly();
            }
        }

        @Override
        public CompletableFuture<Void> onExit() {
            return exit;
        }

        @Override
        public long pid() {
            return process.pid();
        }
    }
}
