package scenariopool.coordinator.service;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RowFilterTest {

    private static final Map<String, String> ROW = Map.of("status", "active", "age", "42", "region", "EU", "note", "");

    @Test
    void equality() {
        assertTrue(RowFilter.parse("status=active").test(ROW));
        assertFalse(RowFilter.parse("status=inactive").test(ROW));
        assertTrue(RowFilter.parse("region != US").test(ROW));
        assertFalse(RowFilter.parse("region!=EU").test(ROW));
    }

    @Test
    void quotesAreStripped() {
        assertTrue(RowFilter.parse("status = \"active\"").test(ROW));
        assertTrue(RowFilter.parse("status='active'").test(ROW));
    }

    @Test
    void numericComparisons() {
        assertTrue(RowFilter.parse("age>18").test(ROW));
        assertTrue(RowFilter.parse("age>=42").test(ROW));
        assertTrue(RowFilter.parse("age<=42").test(ROW));
        assertFalse(RowFilter.parse("age<42").test(ROW));
        assertTrue(RowFilter.parse("age < 42.5").test(ROW));
    }

    @Test
    void nonNumericCellNeverMatchesOrdering() {
        assertFalse(RowFilter.parse("status>1").test(ROW));
        assertFalse(RowFilter.parse("note<1").test(ROW));
        assertFalse(RowFilter.parse("missing>=0").test(ROW));
    }

    @Test
    void missingColumnComparesAsEmpty() {
        assertTrue(RowFilter.parse("missing!=x").test(ROW));
        assertFalse(RowFilter.parse("missing=x").test(ROW));
    }

    @Test
    void invalidExpressionMatchesEverything() {
        RowFilter filter = RowFilter.parse("this is not a filter");

        assertTrue(filter.isMatchAll());
        assertTrue(filter.test(ROW));
        assertTrue(RowFilter.parse(null).isMatchAll());
        assertTrue(RowFilter.parse("  ").isMatchAll());
        assertFalse(RowFilter.parse("age>1").isMatchAll());
    }
}
