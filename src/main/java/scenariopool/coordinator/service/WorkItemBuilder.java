package scenariopool.coordinator.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import scenariopool.coordinator.model.Examples;
import scenariopool.coordinator.model.Feature;
import scenariopool.coordinator.model.Scenario;
import scenariopool.coordinator.model.Step;
import scenariopool.coordinator.model.WorkItem;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Flattens parsed features into the run's FIFO work queue: one item per
 * enabled plain scenario, one item per example row of a data-driven one.
 */
public class WorkItemBuilder {

    private static final Logger log = LoggerFactory.getLogger(WorkItemBuilder.class);

    private final ExamplesLoader examplesLoader;

    public WorkItemBuilder(ExamplesLoader examplesLoader) {
        this.examplesLoader = examplesLoader;
    }

    public WorkItemBuilder() {
        this(new ExamplesLoader());
    }

    /**
     * Build the work items in feature, scenario and row order.
     *
     * @throws IllegalArgumentException if a feature, scenario or scenario name is null
     */
    public List<WorkItem> build(List<Feature> features) {
        List<WorkItem> items = new ArrayList<>();
        if (features == null) {
            return items;
        }

        int workId = 0;
        for (Feature feature : features) {
            if (feature == null) {
                throw new IllegalArgumentException("feature must not be null");
            }
            List<Scenario> scenarios = feature.scenarios();
            for (int i = 0; i < scenarios.size(); i++) {
                Scenario scenario = scenarios.get(i);
                if (scenario == null) {
                    throw new IllegalArgumentException("scenario " + i + " of feature '" + feature.name() + "' is null");
                }
                if (scenario.name() == null) {
                    throw new IllegalArgumentException("scenario " + i + " of feature '" + feature.name() + "' has no name");
                }
                if (!isEnabled(feature, scenario)) {
                    log.debug("Skipping disabled scenario: {}", scenario.name());
                    continue;
                }

                Scenario withBackground = foldBackground(feature, scenario);
                Examples examples = examplesLoader.resolve(scenario.examples());

                if (examples != null && !examples.rows().isEmpty()) {
                    int total = examples.rows().size();
                    int iteration = 1;
                    for (List<String> row : examples.rows()) {
                        items.add(WorkItem.builder()
                                .id("work-" + (++workId))
                                .feature(feature)
                                .scenario(withBackground)
                                .scenarioIndex(i)
                                .exampleRow(alignRow(row, examples.headers()))
                                .exampleHeaders(examples.headers())
                                .iterationNumber(iteration++)
                                .totalIterations(total)
                                .build());
                    }
                } else {
                    // no examples, or an examples table with no rows
                    items.add(WorkItem.builder()
                            .id("work-" + (++workId))
                            .feature(feature)
                            .scenario(withBackground)
                            .scenarioIndex(i)
                            .build());
                }
            }
        }

        log.info("Built {} work items from {} features", items.size(), features.size());
        return items;
    }

    /**
     * Evaluates the first {@code @enabled:<value>} tag found on the feature,
     * then the scenario. Missing tag means enabled.
     */
    public static boolean isEnabled(Feature feature, Scenario scenario) {
        List<String> tags = new ArrayList<>(feature.tags());
        tags.addAll(scenario.tags());
        for (String tag : tags) {
            if (tag == null) {
                continue;
            }
            String lower = tag.trim().toLowerCase(Locale.ROOT);
            if (lower.startsWith("@")) {
                lower = lower.substring(1);
            }
            if (lower.startsWith("enabled:")) {
                String value = lower.substring("enabled:".length()).trim();
                return !(value.equals("false") || value.equals("no") || value.equals("0"));
            }
        }
        return true;
    }

    private static Scenario foldBackground(Feature feature, Scenario scenario) {
        if (feature.background().isEmpty()) {
            return scenario;
        }
        List<Step> steps = new ArrayList<>(feature.background());
        steps.addAll(scenario.steps());
        return scenario.withSteps(steps);
    }

    // pads short rows and cuts long ones so values line up with headers
    private static List<String> alignRow(List<String> row, List<String> headers) {
        if (row.size() == headers.size()) {
            return row;
        }
        List<String> aligned = new ArrayList<>(headers.size());
        for (int i = 0; i < headers.size(); i++) {
            aligned.add(i < row.size() ? row.get(i) : "");
        }
        return aligned;
    }
}
