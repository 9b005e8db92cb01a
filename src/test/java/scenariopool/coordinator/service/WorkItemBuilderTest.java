package scenariopool.coordinator.service;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import scenariopool.coordinator.model.Examples;
import scenariopool.coordinator.model.ExamplesSource;
import scenariopool.coordinator.model.Feature;
import scenariopool.coordinator.model.Scenario;
import scenariopool.coordinator.model.Step;
import scenariopool.coordinator.model.WorkItem;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class WorkItemBuilderTest {

    private final WorkItemBuilder builder = new WorkItemBuilder();

    private static Scenario scenario(String name, String... tags) {
        return new Scenario(name, Arrays.asList(tags), List.of(new Step("Then ", "it works")), null);
    }

    @Test
    void oneItemPerScenarioInOrder() {
        List<Feature> features = List.of(
                Feature.of("A", List.of(scenario("a1"), scenario("a2"))),
                Feature.of("B", List.of(scenario("b1"))));

        List<WorkItem> items = builder.build(features);

        assertEquals(3, items.size());
        assertEquals(List.of("work-1", "work-2", "work-3"), items.stream().map(WorkItem::id).toList());
        assertEquals(List.of("a1", "a2", "b1"), items.stream().map(WorkItem::scenarioName).toList());
        assertEquals(1, items.get(1).scenarioIndex());
        assertFalse(items.get(0).isDataDriven());
    }

    @Test
    void oneItemPerExampleRow() {
        Scenario outline = new Scenario("Search <term>", List.of(), List.of(new Step("When ", "I search <term>")),
                Examples.inline(List.of("term", "hits"), List.of(
                        List.of("shoes", "3"),
                        List.of("hats"),
                        List.of("socks", "0"))));

        List<WorkItem> items = builder.build(List.of(Feature.of("Search", List.of(outline))));

        assertEquals(3, items.size());
        for (int i = 0; i < 3; i++) {
            WorkItem item = items.get(i);
            assertTrue(item.isDataDriven());
            assertEquals(i + 1, item.iterationNumber());
            assertEquals(3, item.totalIterations());
            assertEquals("Search::Search <term>", item.aggregationKey());
        }
        // short rows are padded to the header count
        assertEquals(List.of("hats", ""), items.get(1).exampleRow());
    }

    @Test
    void emptyExamplesGiveOnePlainItem() {
        Scenario outline = scenario("No rows").withExamples(Examples.inline(List.of("x"), List.of()));

        List<WorkItem> items = builder.build(List.of(Feature.of("F", List.of(outline))));

        assertEquals(1, items.size());
        assertFalse(items.get(0).isDataDriven());
    }

    @Test
    void backgroundIsPrepended() {
        Feature feature = Feature.of("F", List.of(scenario("s")))
                .withBackground(List.of(new Step("Given ", "I am logged in")));

        List<Step> steps = builder.build(List.of(feature)).get(0).scenario().steps();

        assertEquals(2, steps.size());
        assertEquals("I am logged in", steps.get(0).text());
        assertEquals("it works", steps.get(1).text());
    }

    @Test
    void disabledScenariosAreSkipped() {
        Feature feature = Feature.of("F", List.of(
                scenario("on"),
                scenario("off", "@enabled:false"),
                scenario("off too", "@Enabled:NO"),
                scenario("zero", "enabled:0"),
                scenario("explicitly on", "@enabled:true")));

        List<WorkItem> items = builder.build(List.of(feature));

        assertEquals(List.of("on", "explicitly on"), items.stream().map(WorkItem::scenarioName).toList());
    }

    @Test
    void featureTagWinsOverScenarioTag() {
        Feature off = Feature.of("F", List.of(scenario("s", "@enabled:true"))).withTags(List.of("@enabled:false"));
        Feature on = Feature.of("F", List.of(scenario("s", "@enabled:false"))).withTags(List.of("@enabled:yes"));

        assertFalse(WorkItemBuilder.isEnabled(off, off.scenarios().get(0)));
        assertTrue(WorkItemBuilder.isEnabled(on, on.scenarios().get(0)));
    }

    @Test
    void idsAreUniqueAcrossFeatures() {
        List<Feature> features = new ArrayList<>();
        for (int f = 0; f < 5; f++) {
            features.add(Feature.of("F" + f, List.of(scenario("a"), scenario("b"))));
        }

        List<WorkItem> items = builder.build(features);

        assertEquals(10, items.stream().map(WorkItem::id).distinct().count());
    }

    @Test
    void rejectsNullScenarioOrName() {
        Feature nullName = Feature.of("F", List.of(new Scenario(null, List.of(), List.of(), null)));
        assertThrows(IllegalArgumentException.class, () -> builder.build(List.of(nullName)));

        List<Feature> withNull = new ArrayList<>();
        withNull.add(null);
        assertThrows(IllegalArgumentException.class, () -> builder.build(withNull));
    }

    @Test
    void nullOrEmptyInputGivesNoItems() {
        assertTrue(builder.build(null).isEmpty());
        assertTrue(builder.build(List.of()).isEmpty());
    }

    @Test
    void externalDataReplacesInlineRows(@TempDir Path dir) throws Exception {
        Files.writeString(dir.resolve("users.csv"), "user,role\nalice,admin\nbob,guest\ncarol,admin\n");
        WorkItemBuilder fromDir = new WorkItemBuilder(new ExamplesLoader(dir));
        Scenario outline = scenario("Login as <user>").withExamples(new Examples(
                List.of("user", "role"),
                List.of(List.of("inline", "x")),
                new ExamplesSource("csv", "users.csv", null, "role=admin")));

        List<WorkItem> items = fromDir.build(List.of(Feature.of("Login", List.of(outline))));

        assertEquals(2, items.size());
        assertEquals(List.of("alice", "admin"), items.get(0).exampleRow());
        assertEquals(List.of("carol", "admin"), items.get(1).exampleRow());
        assertEquals(2, items.get(1).totalIterations());
    }
}
