package scenariopool.worker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import scenariopool.coordinator.util.Text;
import scenariopool.protocol.Artifacts;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.function.LongSupplier;

/**
 * Worker-side artifact naming. Every worker writes into the same results
 * root, so names carry the worker id and a timestamp to stay unique.
 */
public class ArtifactCollector {

    private static final Logger log = LoggerFactory.getLogger(ArtifactCollector.class);

    public enum Kind {
        SCREENSHOT("screenshots", "screenshot"),
        VIDEO("videos", "video"),
        TRACE("traces", "trace"),
        CONSOLE("console-logs", "console"),
        HAR("har", "network"),
        DOWNLOAD("downloads", "download");

        private final String directory;
        private final String prefix;

        Kind(String directory, String prefix) {
            this.directory = directory;
            this.prefix = prefix;
        }

        public String directory() {
            return directory;
        }

        public String prefix() {
            return prefix;
        }
    }

    private final int workerId;
    private final Path resultsDir;
    private final LongSupplier clock;

    public ArtifactCollector(int workerId, Path resultsDir) {
        this(workerId, resultsDir, System::currentTimeMillis);
    }

    ArtifactCollector(int workerId, Path resultsDir, LongSupplier clock) {
        this.workerId = workerId;
        this.resultsDir = resultsDir;
        this.clock = clock;
    }

    public Path resultsDir() {
        return resultsDir;
    }

    /** {@code <kind>_<sanitized-name>_w<workerId>_<timestamp>.<ext>} */
    public String artifactName(Kind kind, String scenarioName, String extension) {
        return kind.prefix() + "_" + Text.sanitizeFilename(scenarioName)
                + "_w" + workerId + "_" + clock.getAsLong() + "." + extension;
    }

    /**
     * Directory for one artifact kind, created on demand.
     *
     * @throws IOException if it cannot be created
     */
    public Path directory(Kind kind) throws IOException {
        Path dir = resultsDir.resolve(kind.directory());
        Files.createDirectories(dir);
        return dir;
    }

    /** Full path for a new artifact of {@code kind} */
    public Path artifactPath(Kind kind, String scenarioName, String extension) throws IOException {
        return directory(kind).resolve(artifactName(kind, scenarioName, extension));
    }

    /**
     * Reduce every reference to its bare filename. Null and blank entries are
     * dropped; files are not copied.
     */
    public Artifacts collect(Artifacts artifacts) {
        if (artifacts == null) {
            return Artifacts.empty();
        }
        return new Artifacts(
                fileNames(artifacts.screenshots()),
                fileNames(artifacts.videos()),
                fileNames(artifacts.traces()),
                fileNames(artifacts.har()),
                fileNames(artifacts.logs()));
    }

    /**
     * Write captured console lines for one scenario.
     *
     * @return the file name, or null if nothing was written
     */
    public String writeConsoleLog(String scenarioName, List<String> lines) {
        if (lines == null || lines.isEmpty()) {
            return null;
        }
        try {
            Path file = artifactPath(Kind.CONSOLE, scenarioName, "log");
            Files.write(file, lines, StandardCharsets.UTF_8);
            return file.getFileName().toString();
        } catch (IOException e) {
            log.warn("Worker {}: cannot write console log for '{}': {}", workerId, scenarioName, e.getMessage());
            return null;
        }
    }

    static List<String> fileNames(List<String> paths) {
        List<String> names = new ArrayList<>(paths.size());
        for (String p : paths) {
            if (p == null || p.isBlank()) {
                continue;
            }
            names.add(fileName(p.trim()));
        }
        return names;
    }

    static String fileName(String path) {
        int slash = Math.max(path.lastIndexOf('/'), path.lastIndexOf('\\'));
        if (slash >= 0) {
            return path.substring(slash + 1);
        }
        Path name = Paths.get(path).getFileName();
        return name == null ? path : name.toString();
    }
}
