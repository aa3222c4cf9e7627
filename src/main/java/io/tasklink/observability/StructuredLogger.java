package io.tasklink.observability;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.tasklink.util.Jsons;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * Writes one compact JSON object per call, newline-terminated, in a single
 * write to its sink:
 * {@code {"time":...,"level":"INFO","msg":"...",<call attrs>,<context attrs>}}.
 *
 * <p>Loggers derived with {@link #with(Object...)} share the sink, its lock
 * and the level. A {@link Supplier} attribute value is resolved each time a
 * record is written.
 */
public final class StructuredLogger {
    public static final String KEY_TIME = "time";
    public static final String KEY_LEVEL = "level";
    public static final String KEY_MSG = "msg";
    public static final String KEY_ERROR = "error";

    private static final ObjectMapper COMPACT_MAPPER = Jsons.compact();

    private final Sink sink;
    private final List<Object> context;

    public StructuredLogger(OutputStream out) {
        this(out, Clock.systemUTC());
    }

    public StructuredLogger(OutputStream out, Clock clock) {
        this(new Sink(out, clock), List.of());
    }

    private StructuredLogger(Sink sink, List<Object> context) {
        this.sink = sink;
        this.context = context;
    }

    public StructuredLogger with(Object... keyValues) {
        requirePairs(keyValues);
        List<Object> merged = new ArrayList<>(context);
        Collections.addAll(merged, keyValues);
        return new StructuredLogger(sink, Collections.unmodifiableList(merged));
    }

    public void setLevel(Level level) {
        sink.level.set(level);
    }

    public Level level() {
        return sink.level.get();
    }

    public boolean enabled(Level level) {
        return level.ordinal() >= sink.level.get().ordinal();
    }

    public void debug(String msg, Object... keyValues) {
        log(Level.DEBUG, msg, null, keyValues);
    }

    public void info(String msg, Object... keyValues) {
        log(Level.INFO, msg, null, keyValues);
    }

    public void warn(String msg, Object... keyValues) {
        log(Level.WARN, msg, null, keyValues);
    }

    public void error(String msg, Object... keyValues) {
        log(Level.ERROR, msg, null, keyValues);
    }

    /**
     * Logs with the error's message under {@value #KEY_ERROR}, after the
     * other call attributes.
     */
    public void log(Level level, String msg, Throwable error, Object... keyValues) {
        if (!enabled(level)) {
            return;
        }
        requirePairs(keyValues);
        Map<String, Object> row = new LinkedHashMap<>();
        row.put(KEY_TIME, sink.clock.instant().toString());
        row.put(KEY_LEVEL, level.name());
        row.put(KEY_MSG, msg);
        putPairs(row, keyValues);
        if (error != null) {
            row.put(KEY_ERROR, describe(error));
        }
        putPairs(row, context.toArray());
        sink.write(toLine(row));
    }

    private static void putPairs(Map<String, Object> row, Object[] keyValues) {
        for (int i = 0; i + 1 < keyValues.length; i += 2) {
            String key = String.valueOf(keyValues[i]);
            if (!row.containsKey(key)) {
                row.put(key, resolve(keyValues[i + 1]));
            }
        }
    }

    private static Object resolve(Object value) {
        if (value instanceof Supplier) {
            value = ((Supplier<?>) value).get();
        }
        if (value instanceof Throwable) {
            return describe((Throwable) value);
        }
        return value;
    }

    static String describe(Throwable error) {
        String message = error.getMessage();
        return message == null || message.isBlank() ? error.toString() : message;
    }

    private static byte[] toLine(Map<String, Object> row) {
        String json;
        try {
            json = COMPACT_MAPPER.writeValueAsString(row);
        } catch (JsonProcessingException e) {
            Map<String, Object> fallback = new LinkedHashMap<>();
            fallback.put(KEY_TIME, row.get(KEY_TIME));
            fallback.put(KEY_LEVEL, row.get(KEY_LEVEL));
            fallback.put(KEY_MSG, row.get(KEY_MSG));
            fallback.put(KEY_ERROR, "unserializable log attributes: " + e.getOriginalMessage());
            json = Jsons.toCompactJson(fallback);
        }
        return (json + "\n").getBytes(StandardCharsets.UTF_8);
    }

    private static void requirePairs(Object[] keyValues) {
        if (keyValues.length % 2 != 0) {
            throw new IllegalArgumentException("log attributes must be key/value pairs");
        }
    }

    public enum Level {
        DEBUG,
        INFO,
        WARN,
        ERROR
    }

    private static final class Sink {
        private final OutputStream out;
        private final Clock clock;
        private final AtomicReference<Level> level;

        private Sink(OutputStream out, Clock clock) {
            this.out = out;
            this.clock = clock;
            this.level = new AtomicReference<>(Level.INFO);
        }

        private synchronized void write(byte[] line) {
            try {
                out.write(line);
                out.flush();
            } catch (IOException e) {
                System.err.println("WARN log write failed: " + e.getMessage());
            }
        }
    }
}
