package org.jtdd.obs;

import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * JSON-lines event logger for test runs.
 *
 * <p>Every event starts with {@code timestamp}, {@code level}, {@code message} and the
 * correlation fields; caller fields follow in key order and never override those.
 */
public final class StructuredJsonLinesLogger implements JsonLinesLogger {
    private final Writer writer;
    private final Clock clock;
    private final boolean autoFlush;
    private boolean closed;

    public StructuredJsonLinesLogger(OutputStream outputStream) {
        this(new OutputStreamWriter(outputStream, StandardCharsets.UTF_8), Clock.systemUTC(), true);
    }

    public StructuredJsonLinesLogger(OutputStream outputStream, Clock clock, boolean autoFlush) {
        this(new OutputStreamWriter(outputStream, StandardCharsets.UTF_8), clock, autoFlush);
    }

    public StructuredJsonLinesLogger(Writer writer, Clock clock, boolean autoFlush) {
        this.writer = Objects.requireNonNull(writer, "writer");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.autoFlush = autoFlush;
        this.closed = false;
    }

    /**
     * Opens (or truncates) an event log file, creating missing parent directories.
     */
    public static StructuredJsonLinesLogger open(Path path) throws IOException {
        Objects.requireNonNull(path, "path");
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        return new StructuredJsonLinesLogger(
            Files.newBufferedWriter(path, StandardCharsets.UTF_8),
            Clock.systemUTC(),
            false
        );
    }

    @Override
    public synchronized void log(
        String level,
        String message,
        CorrelationContext correlationContext,
        Map<String, ?> fields
    ) {
        ensureOpen();
        CorrelationContext safeCorrelation = Objects.requireNonNull(correlationContext, "correlationContext");

        Map<String, Object> event = new LinkedHashMap<>();
        event.put("timestamp", Instant.now(clock).toString());
        event.put("level", normalizeLevel(level));
        event.put("message", message == null ? "" : message);
        event.putAll(safeCorrelation.asFields());
        if (fields != null) {
            for (Map.Entry<String, ?> entry : new TreeMap<String, Object>(withoutBlankKeys(fields)).entrySet()) {
                event.putIfAbsent(entry.getKey(), entry.getValue());
            }
        }

        writeLine(JsonText.encode(event));
    }

    @Override
    public synchronized void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            writer.flush();
            writer.close();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to close event log writer", e);
        }
    }

    private void writeLine(String encoded) {
        try {
            writer.write(encoded);
            writer.write('\n');
            if (autoFlush) {
                writer.flush();
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write run event", e);
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("logger is already closed");
        }
    }

    private static Map<String, Object> withoutBlankKeys(Map<String, ?> fields) {
        Map<String, Object> copy = new LinkedHashMap<>();
        for (Map.Entry<String, ?> entry : fields.entrySet()) {
            String key = entry.getKey();
            if (key != null && !key.isBlank()) {
                copy.put(key, entry.getValue());
            }
        }
        return copy;
    }

    private static String normalizeLevel(String level) {
        if (level == null || level.isBlank()) {
            return "INFO";
        }
        return level.trim().toUpperCase(Locale.ROOT);
    }
}
