package io.tasklink.estream;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectReader;
import io.tasklink.util.Jsons;

import java.io.BufferedReader;
import java.io.Closeable;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.nio.channels.SocketChannel;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * Bidirectional stream of named JSON events over one duplex connection.
 *
 * <p>Each event is two newline-terminated lines: the name as a JSON string,
 * then the payload as any JSON value. Handlers are registered per name with
 * {@link #on(String, Class, EventHandler)}; the handler registered under the
 * empty name receives events nobody else claimed, and events with no handler
 * at all are dropped. Registering a name again replaces the earlier handler.
 *
 * <p>Nothing is read from the connection until {@link #run()} or
 * {@link #runOnce()} is called. Handlers run on the reading thread, one at a
 * time, in arrival order. {@link #send(String, Object)} may be called from
 * any thread; whole frames are never interleaved.
 */
public final class EventStream implements Closeable {
    public static final String DEFAULT_HANDLER = "";

    private final ObjectMapper mapper;
    private final BufferedReader reader;
    private final OutputStream out;
    private final Closeable connection;
    private final ConcurrentMap<String, Dispatcher> handlers;
    private final ReentrantLock readLock;
    private final Object writeLock;
    private final AtomicBoolean closed;
    private volatile Consumer<EventDispatchException> dispatchErrorListener;

    public EventStream(InputStream in, OutputStream out, Closeable connection) {
        this.mapper = Jsons.compact();
        this.reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        this.out = out;
        this.connection = connection;
        this.handlers = new ConcurrentHashMap<>();
        this.readLock = new ReentrantLock();
        this.writeLock = new Object();
        this.closed = new AtomicBoolean(false);
        this.dispatchErrorListener = e -> System.err.println("WARN event stream: " + e.getMessage());
    }

    public static EventStream of(SocketChannel channel) {
        return new EventStream(ChannelStreams.input(channel), ChannelStreams.output(channel), channel);
    }

    public <T> void on(String name, Class<T> type, EventHandler<T> handler) {
        register(name, mapper.getTypeFactory().constructType(type), handler);
    }

    public <T> void on(String name, TypeReference<T> type, EventHandler<T> handler) {
        register(name, mapper.getTypeFactory().constructType(type), handler);
    }

    /**
     * Removes the handler for the given name, if there is one.
     */
    public void off(String name) {
        handlers.remove(name == null ? DEFAULT_HANDLER : name);
    }

    /**
     * Sets what {@link #run()} does with per-message dispatch failures. The
     * default prints a warning to standard error.
     */
    public void onDispatchError(Consumer<EventDispatchException> listener) {
        this.dispatchErrorListener = Objects.requireNonNull(listener, "listener");
    }

    /**
     * Sends one event. The name must not be {@code null}; an empty name is
     * allowed and reaches the peer's default handler.
     */
    public void send(String name, Object payload) throws IOException {
        Objects.requireNonNull(name, "event name");
        byte[] frame;
        try {
            frame = (mapper.writeValueAsString(name) + "\n" + mapper.writeValueAsString(payload) + "\n")
                    .getBytes(StandardCharsets.UTF_8);
        } catch (JsonProcessingException e) {
            throw new IOException("serializing \"" + name + "\" event", e);
        }
        synchronized (writeLock) {
            ensureOpen();
            try {
                out.write(frame);
                out.flush();
            } catch (IOException e) {
                throw closedOr(e);
            }
        }
    }

    /**
     * Reads one event and dispatches it on the calling thread.
     *
     * @throws EOFException when the peer has closed the connection
     * @throws EventDispatchException when the payload did not bind to the
     *                                handler's type or the handler threw
     */
    public void runOnce() throws IOException {
        readLock.lock();
        try {
            ensureOpen();
            String nameLine = nextLine();
            if (nameLine == null) {
                throw new EOFException("end of event stream");
            }
            JsonNode nameNode = parseLine(nameLine, "reading event name");
            if (!nameNode.isTextual()) {
                throw new MalformedFrameException("event name is not a JSON string: " + abbreviate(nameLine));
            }
            String name = nameNode.asText();
            String payloadLine = nextLine();
            if (payloadLine == null) {
                throw new EOFException("end of event stream before \"" + name + "\" payload");
            }
            dispatch(name, parseLine(payloadLine, "reading \"" + name + "\" payload"));
        } catch (EventDispatchException | EventStreamClosedException e) {
            throw e;
        } catch (IOException e) {
            throw closedOr(e);
        } finally {
            readLock.unlock();
        }
    }

    /**
     * Reads and dispatches events until the stream ends. Dispatch failures go
     * to the dispatch-error listener and do not stop the loop; anything else
     * is the terminal condition and is thrown.
     */
    public void run() throws IOException {
        while (true) {
            try {
                runOnce();
            } catch (EventDispatchException e) {
                dispatchErrorListener.accept(e);
            }
        }
    }

    /**
     * Re-sends newline-delimited JSON log records as events, each named by its
     * {@code msg} field and carrying the whole record as payload. Returns
     * only by throwing: {@link EOFException} once the source is exhausted.
     */
    public void sendJsonLogs(InputStream source) throws IOException {
        BufferedReader records = new BufferedReader(new InputStreamReader(source, StandardCharsets.UTF_8));
        String line;
        while ((line = records.readLine()) != null) {
            if (line.isBlank()) {
                continue;
            }
            JsonNode record;
            try {
                record = mapper.readTree(line);
            } catch (JsonProcessingException e) {
                throw new MalformedFrameException("reading next log record", e);
            }
            if (record == null || !record.isObject()) {
                throw new MalformedFrameException("log record is not a JSON object: " + abbreviate(line));
            }
            JsonNode msg = record.get("msg");
            String name;
            if (msg == null || msg.isNull()) {
                name = "";
            } else if (msg.isTextual()) {
                name = msg.asText();
            } else {
                throw new MalformedFrameException("log record msg is not a string: " + abbreviate(line));
            }
            send(name, record);
        }
        throw new EOFException("end of log source");
    }

    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public void close() throws IOException {
        if (closed.compareAndSet(false, true)) {
            connection.close();
        }
    }

    private <T> void register(String name, JavaType type, EventHandler<T> handler) {
        Objects.requireNonNull(handler, "handler");
        ObjectReader decoder = mapper.readerFor(type);
        handlers.put(name == null ? DEFAULT_HANDLER : name, (eventName, payload) -> {
            T value;
            try {
                value = decoder.readValue(payload);
            } catch (IOException | IllegalArgumentException e) {
                throw new EventDecodeException(eventName, e);
            }
            try {
                handler.handle(eventName, value);
            } catch (RuntimeException e) {
                throw new EventHandlerException(eventName, e);
            }
        });
    }

    private void dispatch(String name, JsonNode payload) throws EventDispatchException {
        Dispatcher dispatcher = handlers.get(name);
        if (dispatcher == null) {
            dispatcher = handlers.get(DEFAULT_HANDLER);
        }
        if (dispatcher == null) {
            return;
        }
        dispatcher.dispatch(name, payload);
    }

    private String nextLine() throws IOException {
        String line;
        do {
            line = reader.readLine();
        } while (line != null && line.isEmpty());
        return line;
    }

    private JsonNode parseLine(String line, String what) throws MalformedFrameException {
        try {
            return mapper.readTree(line);
        } catch (JsonProcessingException e) {
            throw new MalformedFrameException(what + ": " + e.getOriginalMessage(), e);
        }
    }

    private void ensureOpen() throws EventStreamClosedException {
        if (closed.get()) {
            throw new EventStreamClosedException();
        }
    }

    private IOException closedOr(IOException e) {
        return closed.get() ? new EventStreamClosedException(e) : e;
    }

    private static String abbreviate(String line) {
        return line.length() <= 64 ? line : line.substring(0, 64) + "...";
    }

    @FunctionalInterface
    private interface Dispatcher {
        void dispatch(String name, JsonNode payload) throws EventDispatchException;
    }
}
