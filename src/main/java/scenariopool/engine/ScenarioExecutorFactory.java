package scenariopool.engine;

import java.util.Map;

/**
 * Creates the worker's {@link ScenarioExecutor}. Implementations need a
 * public no-arg constructor when named through the {@code executorFactory}
 * configuration key.
 */
@FunctionalInterface
public interface ScenarioExecutorFactory {

    ScenarioExecutor create(ExecutorContext context) throws Exception;

    /**
     * @param workerId   id of the hosting worker
     * @param project    project the step definitions belong to
     * @param resultsDir shared results root
     * @param config     initial configuration forwarded from the supervisor
     */
    record ExecutorContext(int workerId, String project, String resultsDir, Map<String, String> config) {
    }

    /**
     * Instantiate a factory by class name.
     *
     * @throws IllegalArgumentException if the class is missing or unusable
     */
    static ScenarioExecutorFactory load(String className) {
        if (className == null || className.isBlank()) {
            throw new IllegalArgumentException("No scenario executor factory configured (executorFactory)");
        }
        try {
            Class<?> type = Class.forName(className.trim());
            if (!ScenarioExecutorFactory.class.isAssignableFrom(type)) {
                throw new IllegalArgumentException(className + " does not implement ScenarioExecutorFactory");
            }
            return (ScenarioExecutorFactory) type.getDeclaredConstructor().newInstance();
        } catch (ReflectiveOperationException e) {
            throw new IllegalArgumentException("Cannot instantiate executor factory " + className, e);
        }
    }
}
