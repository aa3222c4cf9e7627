package io.tasklink.client;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import io.tasklink.estream.EventHandler;
import io.tasklink.estream.EventStream;
import io.tasklink.operator.Events;
import io.tasklink.state.Sighting;

import java.io.Closeable;
import java.io.IOException;
import java.net.SocketAddress;
import java.net.UnixDomainSocketAddress;
import java.nio.channels.SocketChannel;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Operator side of the operator socket. Connecting sends the operator's
 * name and starts a daemon thread reading events; log records the server
 * forwards can be subscribed to by message with {@link #on}.
 */
public final class OperatorClient implements Closeable {
    private static final TypeReference<List<Sighting>> SEEN_LIST = new TypeReference<>() {
    };

    private final EventStream stream;
    private final BlockingQueue<List<Sighting>> seenReplies;
    private final CompletableFuture<String> goodbye;
    private final CompletableFuture<IOException> ended;

    private OperatorClient(EventStream stream) {
        this.stream = stream;
        this.seenReplies = new LinkedBlockingQueue<>();
        this.goodbye = new CompletableFuture<>();
        this.ended = new CompletableFuture<>();
        stream.on(Events.GOODBYE, Events.Goodbye.class, (type, payload) ->
                goodbye.complete(payload == null || payload.message() == null ? "" : payload.message()));
        stream.on(Events.LIST_SEEN, SEEN_LIST, (type, seen) -> seenReplies.add(seen == null ? List.of() : seen));
    }

    public static OperatorClient connect(Path socket, String name) throws IOException {
        return connect(UnixDomainSocketAddress.of(socket), name);
    }

    public static OperatorClient connect(SocketAddress address, String name) throws IOException {
        OperatorClient client = open(address);
        client.start(name);
        return client;
    }

    /**
     * Connects without sending a name or reading anything, so subscriptions
     * can be in place before {@link #start(String)}.
     */
    public static OperatorClient open(SocketAddress address) throws IOException {
        return new OperatorClient(EventStream.of(SocketChannel.open(address)));
    }

    /**
     * Sends the operator's name and starts reading events.
     */
    public void start(String name) throws IOException {
        try {
            stream.send(Events.NAME, name);
        } catch (IOException e) {
            stream.close();
            throw e;
        }
        Thread reader = new Thread(() -> {
            try {
                stream.run();
            } catch (IOException e) {
                ended.complete(e);
            } catch (RuntimeException e) {
                ended.complete(new IOException("event loop failed: " + e.getMessage(), e));
            }
        }, "tasklink-client-reader");
        reader.setDaemon(true);
        reader.start();
    }

    /**
     * Subscribes to an event, usually a forwarded log record such as
     * {@code "Task queued"}. The empty name receives everything without a
     * more specific subscription.
     */
    public <T> void on(String event, Class<T> type, EventHandler<T> handler) {
        stream.on(event, type, handler);
    }

    public void onAny(EventHandler<JsonNode> handler) {
        stream.on(EventStream.DEFAULT_HANDLER, JsonNode.class, handler);
    }

    /**
     * Queues a task. Success shows up as a {@code "Task queued"} log record;
     * a rejected request comes back as an {@code enqueue} event with its
     * error set.
     */
    public void enqueue(String id, String task) throws IOException {
        stream.send(Events.ENQUEUE, Events.Enqueue.of(id, task));
    }

    public void rename(String name) throws IOException {
        stream.send(Events.NAME, name);
    }

    /**
     * Asks for the recently seen implants, newest first.
     */
    public List<Sighting> listSeen(Duration timeout) throws IOException, InterruptedException, TimeoutException {
        seenReplies.clear();
        stream.send(Events.LIST_SEEN, null);
        List<Sighting> seen = seenReplies.poll(timeout.toMillis(), TimeUnit.MILLISECONDS);
        if (seen == null) {
            throw new TimeoutException("no implant list after " + timeout);
        }
        return seen;
    }

    /**
     * The server's goodbye message, once it has said goodbye.
     */
    public Optional<String> goodbyeMessage() {
        return Optional.ofNullable(goodbye.getNow(null));
    }

    public CompletableFuture<String> goodbye() {
        return goodbye;
    }

    /**
     * Completes with what ended the read loop.
     */
    public CompletableFuture<IOException> ended() {
        return ended;
    }

    public boolean isClosed() {
        return stream.isClosed();
    }

    @Override
    public void close() throws IOException {
        stream.close();
    }
}
