package scenariopool.coordinator.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TextTest {

    @Test
    void truncate() {
        assertEquals("short", Text.truncate("short", 10));
        assertEquals("abcdefg...", Text.truncate("abcdefghijklmnop", 10));
        assertEquals("ab", Text.truncate("abcdef", 2));
        assertNull(Text.truncate(null, 5));
    }

    @Test
    void sanitizeFilename() {
        assertEquals("Login_as_alice_admin_", Text.sanitizeFilename("Login as alice (admin)"));
        assertEquals("a_b", Text.sanitizeFilename("a//..b"));
        assertEquals("unnamed", Text.sanitizeFilename(null));
        assertEquals("unnamed", Text.sanitizeFilename("  "));
        assertEquals(100, Text.sanitizeFilename("x".repeat(300)).length());
    }

    @Test
    void describeFallsBackToClassName() {
        assertEquals("boom", Text.describe(new IllegalStateException("boom")));
        assertEquals("java.lang.NullPointerException", Text.describe(new NullPointerException()));
        assertTrue(Text.stackTrace(new IllegalStateException("boom")).contains("IllegalStateException: boom"));
    }
}
