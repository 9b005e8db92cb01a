package scenariopool.worker;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Tees {@code System.out} and {@code System.err} into a bounded line buffer
 * while a scenario runs. Output still reaches the original streams.
 *
 * The capture is process-wide: with thread-mode workers the buffer also sees
 * other workers' output.
 */
public final class ConsoleCapture implements AutoCloseable {

    public static final int DEFAULT_MAX_LINES = 100;

    private final int maxLines;
    private final Deque<String> lines = new ArrayDeque<>();

    private PrintStream originalOut;
    private PrintStream originalErr;
    private boolean active;

    public ConsoleCapture() {
        this(DEFAULT_MAX_LINES);
    }

    public ConsoleCapture(int maxLines) {
        if (maxLines < 1) {
            throw new IllegalArgumentException("maxLines must be positive");
        }
        this.maxLines = maxLines;
    }

    public synchronized void start() {
        if (active) {
            return;
        }
        synchronized (lines) {
            lines.clear();
        }
        originalOut = System.out;
        originalErr = System.err;
        System.setOut(new PrintStream(new LineTee(originalOut, ""), true, StandardCharsets.UTF_8));
        System.setErr(new PrintStream(new LineTee(originalErr, "[ERR] "), true, StandardCharsets.UTF_8));
        active = true;
    }

    /**
     * Restore the original streams.
     *
     * @return the captured lines, oldest first
     */
    public synchronized List<String> stop() {
        if (active) {
            System.out.flush();
            System.err.flush();
            System.setOut(originalOut);
            System.setErr(originalErr);
            active = false;
        }
        synchronized (lines) {
            return new ArrayList<>(lines);
        }
    }

    public synchronized boolean isActive() {
        return active;
    }

    @Override
    public void close() {
        stop();
    }

    // separate lock: printing threads hold the PrintStream lock when they get here
    private void append(String line) {
        synchronized (lines) {
            if (lines.size() >= maxLines) {
                lines.removeFirst();
            }
            lines.addLast(line);
        }
    }

    private final class LineTee extends OutputStream {
        private final OutputStream target;
        private final String prefix;
        private final ByteArrayOutputStream pending = new ByteArrayOutputStream();

        LineTee(OutputStream target, String prefix) {
            this.target = target;
            this.prefix = prefix;
        }

        @Override
        public void write(int b) throws IOException {
            target.write(b);
            if (b == '\n') {
                emit();
            } else if (b != '\r') {
                pending.write(b);
            }
        }

        @Override
        public void flush() throws IOException {
            target.flush();
        }

        private void emit() {
            append(prefix + pending.toString(StandardCharsets.UTF_8));
            pending.reset();
        }
    }
}
