package scenariopool.coordinator.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.function.Predicate;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Row predicate parsed from a filter expression such as {@code status=active},
 * {@code region!=EU} or {@code age>=18}.
 *
 * Equality operators compare text; ordering operators compare numbers and
 * reject rows whose cell is not numeric. An expression that cannot be parsed
 * matches every row.
 */
public final class RowFilter implements Predicate<Map<String, String>> {

    private static final Logger log = LoggerFactory.getLogger(RowFilter.class);

    private static final Pattern EXPRESSION = Pattern.compile("^(\\w+)\\s*(!=|>=|<=|=|>|<)\\s*(.+)$");

    private final String column;
    private final String operator;
    private final String value;

    private RowFilter(String column, String operator, String value) {
        this.column = column;
        this.operator = operator;
        this.value = value;
    }

    public static RowFilter parse(String expression) {
        if (expression == null || expression.isBlank()) {
            return new RowFilter(null, null, null);
        }
        Matcher m = EXPRESSION.matcher(expression.trim());
        if (!m.matches()) {
            log.warn("Invalid filter expression '{}', keeping all rows", expression);
            return new RowFilter(null, null, null);
        }
        String raw = m.group(3).trim();
        String unquoted = raw.replaceAll("^[\"']|[\"']$", "");
        return new RowFilter(m.group(1), m.group(2), unquoted);
    }

    /** True when this filter keeps every row */
    public boolean isMatchAll() {
        return column == null;
    }

    @Override
    public boolean test(Map<String, String> row) {
        if (column == null) {
            return true;
        }
        String cell = row.getOrDefault(column, "");
        if (cell == null) {
            cell = "";
        }
        switch (operator) {
            case "=":
                return cell.equals(value);
            case "!=":
                return !cell.equals(value);
            default:
                return compareNumbers(cell);
        }
    }

    private boolean compareNumbers(String cell) {
        double left;
        double right;
        try {
            left = Double.parseDouble(cell.trim());
            right = Double.parseDouble(value);
        } catch (NumberFormatException e) {
            return false;
        }
        switch (operator) {
            case ">":
                return left > right;
            case "<":
                return left < right;
            case ">=":
                return left >= right;
            case "<=":
                return left <= right;
            default:
                return true;
        }
    }

    @Override
    public String toString() {
        return column == null ? "RowFilter{all}" : "RowFilter{" + column + " " + operator + " " + value + "}";
    }
}
