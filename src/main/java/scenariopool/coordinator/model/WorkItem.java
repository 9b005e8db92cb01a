package scenariopool.coordinator.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Immutable unit of schedulable work: one scenario, or one example-row
 * iteration of a scenario outline.
 */
public final class WorkItem {

    private static final Pattern ITERATION_SUFFIX = Pattern.compile("_Iteration-\\d+$");

    private final String id;
    private final Feature feature;
    private final Scenario scenario; // background already folded into steps
    private final int scenarioIndex;
    private final List<String> exampleRow;
    private final List<String> exampleHeaders;
    private final Integer iterationNumber; // 1-based, null unless data-driven
    private final Integer totalIterations;

    private WorkItem(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.feature = Objects.requireNonNull(builder.feature, "feature is required");
        this.scenario = Objects.requireNonNull(builder.scenario, "scenario is required");
        this.scenarioIndex = builder.scenarioIndex;
        this.exampleRow = builder.exampleRow == null ? null : List.copyOf(builder.exampleRow);
        this.exampleHeaders = builder.exampleHeaders == null ? null : List.copyOf(builder.exampleHeaders);
        this.iterationNumber = builder.iterationNumber;
        this.totalIterations = builder.totalIterations;
        validateIteration();
    }

    private void validateIteration() {
        if ((iterationNumber == null) != (totalIterations == null)) {
            throw new IllegalArgumentException(
                    "iterationNumber and totalIterations must be set together (item " + id + ")");
        }
        if (iterationNumber != null && (iterationNumber < 1 || iterationNumber > totalIterations)) {
            throw new IllegalArgumentException("iterationNumber " + iterationNumber
                    + " outside 1.." + totalIterations + " (item " + id + ")");
        }
        if ((exampleRow == null) != (exampleHeaders == null)) {
            throw new IllegalArgumentException(
                    "exampleRow and exampleHeaders must be set together (item " + id + ")");
        }
        if (exampleRow != null && exampleRow.size() != exampleHeaders.size()) {
            throw new IllegalArgumentException("exampleRow has " + exampleRow.size()
                    + " values for " + exampleHeaders.size() + " headers (item " + id + ")");
        }
    }

    public String id() {
        return id;
    }

    public Feature feature() {
        return feature;
    }

    public Scenario scenario() {
        return scenario;
    }

    public int scenarioIndex() {
        return scenarioIndex;
    }

    public List<String> exampleRow() {
        return exampleRow;
    }

    public List<String> exampleHeaders() {
        return exampleHeaders;
    }

    public Integer iterationNumber() {
        return iterationNumber;
    }

    public Integer totalIterations() {
        return totalIterations;
    }

    /** True when this item is one iteration of a data-driven scenario */
    public boolean isDataDriven() {
        return iterationNumber != null;
    }

    public String featureName() {
        return feature.name();
    }

    public String scenarioName() {
        return scenario.name();
    }

    /** Scenario name without any {@code _Iteration-N} suffix */
    public String baseScenarioName() {
        return stripIterationSuffix(scenario.name());
    }

    /** Key grouping all iterations of one data-driven scenario */
    public String aggregationKey() {
        return feature.name() + "::" + baseScenarioName();
    }

    /**
     * Example row as header to value map, in header order.
     * Empty for items that are not data-driven.
     */
    public Map<String, String> iterationData() {
        if (exampleRow == null) {
            return Collections.emptyMap();
        }
        Map<String, String> data = new LinkedHashMap<>();
        for (int i = 0; i < exampleHeaders.size(); i++) {
            data.put(exampleHeaders.get(i), exampleRow.get(i));
        }
        return data;
    }

    /** Human readable label used in progress lines */
    public String displayName() {
        if (!isDataDriven()) {
            return scenario.name();
        }
        return scenario.name() + " [" + iterationNumber + "/" + totalIterations + "]";
    }

    public static String stripIterationSuffix(String scenarioName) {
        return scenarioName == null ? null : ITERATION_SUFFIX.matcher(scenarioName).replaceFirst("");
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .feature(feature)
                .scenario(scenario)
                .scenarioIndex(scenarioIndex)
                .exampleRow(exampleRow)
                .exampleHeaders(exampleHeaders)
                .iterationNumber(iterationNumber)
                .totalIterations(totalIterations);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private Feature feature;
        private Scenario scenario;
        private int scenarioIndex;
        private List<String> exampleRow;
        private List<String> exampleHeaders;
        private Integer iterationNumber;
        private Integer totalIterations;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder feature(Feature feature) {
            this.feature = feature;
            return this;
        }

        public Builder scenario(Scenario scenario) {
            this.scenario = scenario;
            return this;
        }

        public Builder scenarioIndex(int scenarioIndex) {
            this.scenarioIndex = scenarioIndex;
            return this;
        }

        public Builder exampleRow(List<String> exampleRow) {
            this.exampleRow = exampleRow;
            return this;
        }

        public Builder exampleHeaders(List<String> exampleHeaders) {
            this.exampleHeaders = exampleHeaders;
            return this;
        }

        public Builder iterationNumber(Integer iterationNumber) {
            this.iterationNumber = iterationNumber;
            return this;
        }

        public Builder totalIterations(Integer totalIterations) {
            this.totalIterations = totalIterations;
            return this;
        }

        public WorkItem build() {
            return new WorkItem(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof WorkItem item))
            return false;
        return Objects.equals(id, item.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "WorkItem{id='" + id + "', scenario='" + scenario.name() + "'"
                + (isDataDriven() ? ", iteration=" + iterationNumber + "/" + totalIterations : "") + "}";
    }
}
