package scenariopool.worker;

import org.junit.jupiter.api.Test;
import scenariopool.coordinator.model.Scenario;
import scenariopool.coordinator.model.Step;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ExampleInterpolatorTest {

    @Test
    void replacesPlaceholdersEverywhere() {
        Scenario scenario = new Scenario("Login as <user>", List.of("@login"), List.of(
                new Step("Given ", "user <user> with password <password>"),
                new Step("Then ", "I see the payload", "{\"user\":\"<user>\",\"role\":\"<role>\"}")), null);
        Map<String, String> values = new LinkedHashMap<>();
        values.put("user", "alice");
        values.put("password", "s3cret");
        values.put("role", null);

        Scenario result = ExampleInterpolator.interpolate(scenario, values);

        assertEquals("Login as alice", result.name());
        assertEquals("user alice with password s3cret", result.steps().get(0).text());
        assertEquals("{\"user\":\"alice\",\"role\":\"\"}", result.steps().get(1).docString());
        assertEquals(List.of("@login"), result.tags());
        // original untouched
        assertEquals("Login as <user>", scenario.name());
    }

    @Test
    void unknownPlaceholdersStay() {
        assertEquals("pay with <card> and <cvv>", ExampleInterpolator.apply("pay with <card> and <cvv>", Map.of("user", "x")));
        assertEquals("pay with visa and <cvv>", ExampleInterpolator.apply("pay with <card> and <cvv>", Map.of("card", "visa")));
    }

    @Test
    void noValuesReturnsSameScenario() {
        Scenario scenario = Scenario.of("plain", List.of(new Step("Given ", "x")));

        assertSame(scenario, ExampleInterpolator.interpolate(scenario, Map.of()));
        assertSame(scenario, ExampleInterpolator.interpolate(scenario, null));
        assertNull(ExampleInterpolator.apply(null, Map.of("a", "b")));
    }
}
