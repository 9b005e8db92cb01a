package scenariopool.coordinator.util;

import java.io.PrintWriter;
import java.io.StringWriter;

/**
 * Small string helpers shared by supervisor and worker.
 */
public final class Text {

    private static final int MAX_FILENAME = 100;

    private Text() {
    }

    /**
     * Cut {@code value} to at most {@code max} characters, ending in "..." when cut.
     */
    public static String truncate(String value, int max) {
        if (value == null || value.length() <= max) {
            return value;
        }
        if (max <= 3) {
            return value.substring(0, max);
        }
        return value.substring(0, max - 3) + "...";
    }

    /**
     * Make a name safe for use in a file name: every run of characters other
     * than ASCII letters and digits becomes one underscore, at most 100 chars.
     */
    public static String sanitizeFilename(String name) {
        if (name == null || name.isBlank()) {
            return "unnamed";
        }
        String cleaned = name.replaceAll("[^A-Za-z0-9]+", "_");
        if (cleaned.length() > MAX_FILENAME) {
            cleaned = cleaned.substring(0, MAX_FILENAME);
        }
        return cleaned;
    }

    public static String stackTrace(Throwable t) {
        StringWriter sw = new StringWriter();
        t.printStackTrace(new PrintWriter(sw));
        return sw.toString();
    }

    /** Exception message, falling back to the class name */
    public static String describe(Throwable t) {
        String msg = t.getMessage();
        return (msg == null || msg.isBlank()) ? t.getClass().getName() : msg;
    }
}
