package scenariopool.coordinator.model;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class AggregatedScenarioResultTest {

    private static IterationResult passed(int iteration, long duration) {
        return new IterationResult("work-" + iteration, iteration, ScenarioStatus.PASSED, duration, null, null, null);
    }

    private static IterationResult failed(int iteration, String error) {
        return new IterationResult("work-" + iteration, iteration, ScenarioStatus.FAILED, 5, error, "trace-" + iteration, null);
    }

    @Test
    void allPassed() {
        AggregatedScenarioResult agg = AggregatedScenarioResult.of("Login", "Login as <user>",
                List.of(passed(1, 10), passed(2, 20)));

        assertEquals("Login::Login as <user>", agg.key());
        assertEquals(ScenarioStatus.PASSED, agg.status());
        assertEquals(30, agg.duration());
        assertNull(agg.error());
        assertNull(agg.firstError());
        assertTrue(agg.failedIterations().isEmpty());
        assertEquals("Data-Driven Test Results (2 iterations)\nOverall Status: Passed\n\n"
                + "Iteration-1 ✓ Passed\nIteration-2 ✓ Passed", agg.summaryComment());
    }

    @Test
    void firstErrorIsLowestFailingIterationRegardlessOfOrder() {
        AggregatedScenarioResult agg = AggregatedScenarioResult.of("F", "S",
                List.of(failed(3, "Timeout waiting"), passed(1, 1), failed(2, "Element not found: #x")));

        assertEquals(ScenarioStatus.FAILED, agg.status());
        assertEquals("2 of 3 iterations failed. See comment for details.", agg.error());
        assertEquals("Element not found: #x", agg.firstError());
        assertEquals("trace-2", agg.stackTrace());
        assertEquals(List.of(2, 3), agg.failedIterations());
        assertEquals(List.of(1, 2, 3), agg.iterations().stream().map(IterationResult::iteration).toList());
    }

    @Test
    void commentShortensKnownErrors() {
        AggregatedScenarioResult agg = AggregatedScenarioResult.of("F", "S", List.of(
                failed(1, "Element not found: button.submit"),
                failed(2, "Step definition not found: I fly"),
                failed(3, "Timeout 30000ms exceeded"),
                failed(4, "Expected 200 but the server answered with 503 Service Unavailable"),
                new IterationResult("work-5", 5, ScenarioStatus.SKIPPED, 0, null, null, null)));

        String comment = agg.summaryComment();
        assertTrue(comment.startsWith("Data-Driven Test Results (5 iterations)\nOverall Status: Failed\n\n"));
        assertTrue(comment.contains("Iteration-1 ✗ Failed [Error: Element not found]"));
        assertTrue(comment.contains("Iteration-2 ✗ Failed [Error: Missing step]"));
        assertTrue(comment.contains("Iteration-3 ✗ Failed [Error: Timeout]"));
        assertTrue(comment.contains("Iteration-4 ✗ Failed [Error: Expected 200 but the server an]"));
        assertTrue(comment.endsWith("Iteration-5 - Skipped"));
    }

    @Test
    void commentIsCappedAt1000Characters() {
        List<IterationResult> many = new ArrayList<>();
        for (int i = 1; i <= 200; i++) {
            many.add(passed(i, 1));
        }
        String comment = AggregatedScenarioResult.of("F", "S", many).summaryComment();

        assertEquals(AggregatedScenarioResult.MAX_COMMENT_LENGTH, comment.length());
        assertTrue(comment.endsWith("..."));
    }

    @Test
    void requiresIterations() {
        assertThrows(IllegalArgumentException.class, () -> AggregatedScenarioResult.of("F", "S", List.of()));
    }
}
