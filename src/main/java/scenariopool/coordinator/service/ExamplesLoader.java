package scenariopool.coordinator.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import scenariopool.coordinator.model.Examples;
import scenariopool.coordinator.model.ExamplesSource;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Resolves external example data (CSV or JSON files) into headers and rows.
 *
 * A failed or empty load never fails the run: the inline examples are used
 * instead and a warning is logged.
 */
public class ExamplesLoader {

    private static final Logger log = LoggerFactory.getLogger(ExamplesLoader.class);

    private final Path baseDir;
    private final ObjectMapper json = new ObjectMapper();
    private final CsvMapper csv = new CsvMapper();

    /**
     * @param baseDir directory relative sources are resolved against
     */
    public ExamplesLoader(Path baseDir) {
        this.baseDir = baseDir;
    }

    public ExamplesLoader() {
        this(Path.of("."));
    }

    /**
     * Return {@code examples} with external data loaded, or unchanged when it
     * has no data source or the source yields nothing.
     */
    public Examples resolve(Examples examples) {
        if (examples == null || !examples.hasDataSource()) {
            return examples;
        }
        ExamplesSource source = examples.dataSource();
        try {
            log.info("Loading external data from {}: {}", source.type(), source.source());
            Table table = load(source);
            if (table.rows.isEmpty()) {
                log.warn("No data loaded from external source: {}", source.source());
                return examples;
            }
            log.info("Loaded {} rows with headers: {}", table.rows.size(), String.join(", ", table.headers));
            return examples.withData(table.headers, table.rows);
        } catch (IOException | RuntimeException e) {
            log.error("Failed to load external data from {}: {}", source.source(), e.getMessage());
            return examples;
        }
    }

    /**
     * Load and filter one source.
     *
     * @throws IOException              if the file cannot be read or parsed
     * @throws IllegalArgumentException if the type is unsupported
     */
    Table load(ExamplesSource source) throws IOException {
        Path file = baseDir.resolve(source.source());
        String type = source.type() == null ? guessType(file) : source.type().toLowerCase(Locale.ROOT);

        Table table;
        switch (type) {
            case "csv":
                table = readCsv(file, source.delimiter());
                break;
            case "json":
                table = readJson(file);
                break;
            default:
                throw new IllegalArgumentException("Unsupported example data type: " + source.type());
        }

        RowFilter filter = RowFilter.parse(source.filter());
        if (filter.isMatchAll()) {
            return table;
        }
        List<List<String>> kept = new ArrayList<>();
        for (List<String> row : table.rows) {
            if (filter.test(table.asMap(row))) {
                kept.add(row);
            }
        }
        log.debug("Filter {} kept {} of {} rows", filter, kept.size(), table.rows.size());
        return new Table(table.headers, kept);
    }

    private Table readCsv(Path file, String delimiter) throws IOException {
        char separator = (delimiter == null || delimiter.isEmpty()) ? ',' : delimiter.charAt(0);
        CsvSchema schema = CsvSchema.emptySchema().withColumnSeparator(separator);

        List<String[]> records;
        try (MappingIterator<String[]> it = csv.readerFor(String[].class)
                .with(CsvParser.Feature.WRAP_AS_ARRAY)
                .with(CsvParser.Feature.SKIP_EMPTY_LINES)
                .with(CsvParser.Feature.TRIM_SPACES)
                .with(schema)
                .readValues(file.toFile())) {
            records = it.readAll();
        }
        if (records.isEmpty()) {
            return new Table(List.of(), List.of());
        }

        List<String> headers = Arrays.asList(records.get(0));
        List<List<String>> rows = new ArrayList<>();
        for (int i = 1; i < records.size(); i++) {
            String[] rec = records.get(i);
            List<String> row = new ArrayList<>(headers.size());
            for (int c = 0; c < headers.size(); c++) {
                row.add(c < rec.length && rec[c] != null ? rec[c] : "");
            }
            rows.add(row);
        }
        return new Table(headers, rows);
    }

    private Table readJson(Path file) throws IOException {
        JsonNode root = json.readTree(Files.readString(file));
        if (root == null || !root.isArray()) {
            throw new IOException("Expected a JSON array of objects in " + file);
        }
        if (root.isEmpty()) {
            return new Table(List.of(), List.of());
        }

        // headers come from the first object, in document order
        List<String> headers = new ArrayList<>();
        Iterator<String> names = root.get(0).fieldNames();
        names.forEachRemaining(headers::add);

        List<List<String>> rows = new ArrayList<>();
        for (JsonNode item : root) {
            List<String> row = new ArrayList<>(headers.size());
            for (String h : headers) {
                row.add(cellText(item.get(h)));
            }
            rows.add(row);
        }
        return new Table(headers, rows);
    }

    private static String cellText(JsonNode value) {
        if (value == null || value.isNull() || value.isMissingNode()) {
            return "";
        }
        if (value.isContainerNode()) {
            return value.toString();
        }
        return value.asText();
    }

    private static String guessType(Path file) {
        String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
        if (name.endsWith(".json")) {
            return "json";
        }
        return "csv";
    }

    static final class Table {
        final List<String> headers;
        final List<List<String>> rows;

        Table(List<String> headers, List<List<String>> rows) {
            this.headers = headers;
            this.rows = rows;
        }

        Map<String, String> asMap(List<String> row) {
            Map<String, String> map = new LinkedHashMap<>();
            for (int i = 0; i < headers.size(); i++) {
                map.put(headers.get(i), i < row.size() ? row.get(i) : "");
            }
            return map;
        }
    }
}
