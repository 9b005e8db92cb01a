package scenariopool.testing;

import scenariopool.engine.ScenarioExecutor;
import scenariopool.engine.ScenarioExecutorFactory;
import scenariopool.engine.ScenarioOutcome;
import scenariopool.engine.ScenarioRequest;
import scenariopool.protocol.Artifacts;
import scenariopool.protocol.StepOutcome;
import scenariopool.worker.ArtifactCollector;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Test engine whose behaviour is driven by scenario tags:
 * <ul>
 *   <li>{@code @fail}: fails with "Element not found"</li>
 *   <li>{@code @throw}: the engine throws</li>
 *   <li>{@code @crash}: throws an {@link InternalError}, taking the worker down</li>
 *   <li>{@code @hang-once}: blocks the first time it runs, passes afterwards</li>
 *   <li>{@code @slow}: sleeps 50ms before passing</li>
 *   <li>{@code @long}: sleeps 700ms before passing</li>
 *   <li>{@code @screenshot}: writes a screenshot through the request's artifact naming</li>
 * </ul>
 * Data-driven rows with {@code result=fail} fail as well.
 *
 * State is static so thread-mode tests can inspect it; call {@link #reset()}
 * before each test.
 */
public class ScriptedExecutorFactory implements ScenarioExecutorFactory {

    public static final Queue<String> EXECUTED = new ConcurrentLinkedQueue<>();
    public static final AtomicInteger CREATED = new AtomicInteger();
    public static final AtomicInteger CLOSED = new AtomicInteger();
    public static final AtomicInteger CLEARED = new AtomicInteger();
    public static final AtomicInteger RELEASED = new AtomicInteger();
    public static final Queue<Map<String, String>> CONFIGS = new ConcurrentLinkedQueue<>();
    private static final Set<String> HUNG = ConcurrentHashMap.newKeySet();

    public static void reset() {
        EXECUTED.clear();
        CREATED.set(0);
        CLOSED.set(0);
        CLEARED.set(0);
        RELEASED.set(0);
        CONFIGS.clear();
        HUNG.clear();
    }

    @Override
    public ScenarioExecutor create(ExecutorContext context) {
        CREATED.incrementAndGet();
        return new ScriptedExecutor();
    }

    static final class ScriptedExecutor implements ScenarioExecutor {

        @Override
        public ScenarioOutcome execute(ScenarioRequest request) throws Exception {
            String name = request.scenario().name();
            List<String> tags = request.scenario().tags();
            EXECUTED.add(name);

            if (tags.contains("@crash")) {
                throw new InternalError("simulated crash in " + name);
            }
            if (tags.contains("@throw")) {
                throw new IllegalStateException("engine blew up in " + name);
            }
            if (tags.contains("@hang-once") && HUNG.add(name)) {
                Thread.sleep(30_000);
            }
            if (tags.contains("@slow")) {
                Thread.sleep(50);
            }
            if (tags.contains("@long")) {
                Thread.sleep(700);
            }
            Artifacts artifacts = Artifacts.empty();
            if (tags.contains("@screenshot")) {
                Path shot = request.artifactPath(ArtifactCollector.Kind.SCREENSHOT, "png");
                Files.write(shot, new byte[]{(byte) 0x89, 'P', 'N', 'G'});
                artifacts = new Artifacts(List.of(shot.toString()), null, null, null, null);
            }

            List<StepOutcome> steps = new ArrayList<>();
            request.scenario().steps().forEach(s -> steps.add(StepOutcome.passed(s.keyword(), s.text(), 1)));

            boolean failRow = "fail".equals(request.iterationData().get("result"));
            if (tags.contains("@fail") || failRow) {
                return ScenarioOutcome.failed(name, steps, "Element not found: #submit", "at scripted")
                        .withArtifacts(artifacts);
            }
            return ScenarioOutcome.passed(name, steps).withArtifacts(artifacts);
        }

        @Override
        public void configure(Map<String, String> config) {
            CONFIGS.add(config);
        }

        @Override
        public void clearState() {
            CLEARED.incrementAndGet();
        }

        @Override
        public void releaseResources() {
            RELEASED.incrementAndGet();
        }

        @Override
        public void close() {
            CLOSED.incrementAndGet();
        }
    }
}
