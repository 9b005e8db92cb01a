package scenariopool.worker;

import scenariopool.coordinator.model.Scenario;
import scenariopool.coordinator.model.Step;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Substitutes {@code <header>} placeholders with example row values in a
 * scenario's name, step text and doc strings. Unknown placeholders are left
 * as they are.
 */
public final class ExampleInterpolator {

    private ExampleInterpolator() {
    }

    public static Scenario interpolate(Scenario scenario, Map<String, String> values) {
        if (values == null || values.isEmpty()) {
            return scenario;
        }
        List<Step> steps = new ArrayList<>(scenario.steps().size());
        for (Step step : scenario.steps()) {
            steps.add(step.withText(apply(step.text(), values), apply(step.docString(), values)));
        }
        return scenario.withName(apply(scenario.name(), values)).withSteps(steps);
    }

    public static String apply(String text, Map<String, String> values) {
        if (text == null || text.indexOf('<') < 0) {
            return text;
        }
        String result = text;
        for (Map.Entry<String, String> e : values.entrySet()) {
            String value = e.getValue() == null ? "" : e.getValue();
            result = result.replace("<" + e.getKey() + ">", value);
        }
        return result;
    }
}
