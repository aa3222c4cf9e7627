package io.tasklink.operator;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import io.tasklink.estream.EventStream;
import io.tasklink.fanout.FanoutWriter;
import io.tasklink.observability.LogMessages;
import io.tasklink.observability.StructuredLogger;
import io.tasklink.persist.PersistenceManager;
import io.tasklink.state.ServerState;
import io.tasklink.state.Sighting;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.BufferedReader;
import java.io.EOFException;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.net.UnixDomainSocketAddress;
import java.nio.ByteBuffer;
import java.nio.channels.AsynchronousCloseException;
import java.nio.channels.Channels;
import java.nio.channels.SocketChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Predicate;
import java.util.stream.Stream;

final class OperatorSupervisorTest {
    private static final Duration WAIT = Duration.ofSeconds(10);
    private static final TypeReference<List<Sighting>> SEEN_LIST = new TypeReference<>() {
    };

    private Path root;
    private Path socket;
    private LogCapture capture;
    private FanoutWriter fanout;
    private PersistenceManager<ServerState> state;
    private OperatorSupervisor supervisor;
    private StructuredLogger serverLog;
    private final List<Peer> peers = new ArrayList<>();

    @BeforeEach
    void setUp() throws IOException {
        root = Files.createTempDirectory("tasklink-op-");
        socket = root.resolve("op.sock");
        capture = new LogCapture();
        fanout = new FanoutWriter(capture);
        state = ServerState.inMemory();
    }

    @AfterEach
    void tearDown() throws IOException {
        try {
            if (supervisor != null) {
                supervisor.stop("");
            }
            for (Peer peer : peers) {
                peer.close();
            }
            fanout.close();
            state.close();
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void connectedOperatorReceivesItsOwnConnectionEvent() throws Exception {
        start(Duration.ofSeconds(2));
        Peer alice = connect();
        CompletableFuture<Events.OperatorConnected> connected = alice.next(LogMessages.OPERATOR_CONNECTED, Events.OperatorConnected.class);
        alice.start("alice");

        Events.OperatorConnected event = connected.get(WAIT.toMillis(), TimeUnit.MILLISECONDS);
        Assertions.assertEquals("alice", event.operatorName());
        Assertions.assertEquals(1L, event.connectionNumber());
        Assertions.assertEquals(1, supervisor.connectionCount());
        Assertions.assertEquals(2, fanout.size());
    }

    @Test
    void operatorsSeeEachOther() throws Exception {
        start(Duration.ofSeconds(2));
        Peer alice = connect();
        alice.start("alice");
        capture.await(LogCapture.msg(LogMessages.OPERATOR_CONNECTED, LogMessages.KEY_OPERATOR_NAME, "alice"), WAIT);

        CompletableFuture<Events.OperatorConnected> bobArrived = alice.next(
                LogMessages.OPERATOR_CONNECTED, Events.OperatorConnected.class, e -> "bob".equals(e.operatorName()));
        CompletableFuture<Events.OperatorConnected> bobLeft = alice.next(
                LogMessages.OPERATOR_DISCONNECTED, Events.OperatorConnected.class, e -> "bob".equals(e.operatorName()));
        Peer bob = connect();
        bob.start("bob");
        Assertions.assertEquals("bob", bobArrived.get(WAIT.toMillis(), TimeUnit.MILLISECONDS).operatorName());

        bob.close();
        Events.OperatorConnected left = bobLeft.get(WAIT.toMillis(), TimeUnit.MILLISECONDS);
        Assertions.assertEquals("bob", left.operatorName());
        Assertions.assertEquals(2L, left.connectionNumber());
        JsonNode record = capture.await(LogCapture.msg(LogMessages.OPERATOR_DISCONNECTED, LogMessages.KEY_OPERATOR_NAME, "bob"), WAIT);
        Assertions.assertEquals("INFO", record.get("level").asText());
    }

    @Test
    void invalidEnqueueIsEchoedWithError() throws Exception {
        start(Duration.ofSeconds(2));
        Peer peer = connect();
        peer.start("carol");

        CompletableFuture<Events.Enqueue> noId = peer.next(Events.ENQUEUE, Events.Enqueue.class);
        peer.stream.send(Events.ENQUEUE, Events.Enqueue.of("", "uname -a"));
        Events.Enqueue echoed = noId.get(WAIT.toMillis(), TimeUnit.MILLISECONDS);
        Assertions.assertEquals("ID missing", echoed.error());
        Assertions.assertEquals("uname -a", echoed.task());

        CompletableFuture<Events.Enqueue> noTask = peer.next(Events.ENQUEUE, Events.Enqueue.class);
        peer.stream.send(Events.ENQUEUE, Events.Enqueue.of("kittens", ""));
        echoed = noTask.get(WAIT.toMillis(), TimeUnit.MILLISECONDS);
        Assertions.assertEquals("Empty task", echoed.error());
        Assertions.assertEquals("kittens", echoed.id());

        state.acquireShared();
        try {
            Assertions.assertTrue(state.document().taskQueues().isEmpty());
        } finally {
            state.releaseShared();
        }
        Assertions.assertEquals(0L, capture.count(LogCapture.msg(LogMessages.TASK_QUEUED)));
    }

    @Test
    void validEnqueueQueuesTaskAndAnnouncesIt() throws Exception {
        start(Duration.ofSeconds(2));
        Peer peer = connect();
        CompletableFuture<Events.TaskQueued> queued = peer.next(LogMessages.TASK_QUEUED, Events.TaskQueued.class);
        peer.start("dave");

        peer.stream.send(Events.ENQUEUE, Events.Enqueue.of("kittens", "uname -a"));

        Events.TaskQueued event = queued.get(WAIT.toMillis(), TimeUnit.MILLISECONDS);
        Assertions.assertEquals(new Events.TaskQueued("kittens", "uname -a", "dave", 1), event);
        state.acquireShared();
        try {
            Assertions.assertEquals(List.of("uname -a"), state.document().tasksFor("kittens"));
        } finally {
            state.releaseShared();
        }
    }

    @Test
    void listSeenReturnsNewestFirst() throws Exception {
        Instant base = Instant.parse("2024-01-01T00:00:00Z");
        state.acquireExclusive();
        try {
            for (int i = 0; i < 5; i++) {
                state.document().saw("id-" + i, "from-" + i, base.plusSeconds(i));
            }
        } finally {
            state.release();
        }
        start(Duration.ofSeconds(2));
        Peer peer = connect();
        CompletableFuture<List<Sighting>> reply = new CompletableFuture<>();
        peer.stream.on(Events.LIST_SEEN, SEEN_LIST, (name, seen) -> reply.complete(seen));
        peer.start("erin");

        peer.stream.send(Events.LIST_SEEN, null);

        List<Sighting> seen = reply.get(WAIT.toMillis(), TimeUnit.MILLISECONDS);
        Assertions.assertEquals(5, seen.size());
        for (int i = 0; i < 5; i++) {
            Sighting sighting = seen.get(i);
            Assertions.assertEquals("id-" + (4 - i), sighting.id());
            Assertions.assertEquals("from-" + (4 - i), sighting.from());
            Assertions.assertEquals(base.plusSeconds(4 - i), sighting.when());
        }
    }

    @Test
    void renameIsLoggedWithOldName() throws Exception {
        start(Duration.ofSeconds(2));
        Peer peer = connect();
        CompletableFuture<Events.OperatorNameChange> renamed = peer.next(
                LogMessages.OPERATOR_NAME_CHANGE, Events.OperatorNameChange.class);
        peer.start("frank");
        capture.await(LogCapture.msg(LogMessages.OPERATOR_CONNECTED, LogMessages.KEY_OPERATOR_NAME, "frank"), WAIT);

        peer.stream.send(Events.NAME, "francis");

        JsonNode change = capture.await(LogCapture.msg(LogMessages.OPERATOR_NAME_CHANGE), WAIT);
        Assertions.assertEquals("frank", change.get(LogMessages.KEY_OLD_NAME).asText());
        Assertions.assertEquals("francis", change.get(LogMessages.KEY_OPERATOR_NAME).asText());
        Events.OperatorNameChange seen = renamed.get(WAIT.toMillis(), TimeUnit.MILLISECONDS);
        Assertions.assertEquals("francis", seen.operatorName());
        Assertions.assertEquals("frank", seen.oldName());
    }

    @Test
    void unexpectedAndUndecodableMessagesAreLoggedAndSurvived() throws Exception {
        start(Duration.ofSeconds(2));
        Peer peer = connect();
        peer.start("grace");

        peer.stream.send("bogus", new Events.Goodbye("hi"));
        peer.stream.send(Events.ENQUEUE, "not an object");

        JsonNode unexpected = capture.await(LogCapture.msg(LogMessages.UNEXPECTED_MESSAGE), WAIT);
        Assertions.assertEquals("WARN", unexpected.get("level").asText());
        Assertions.assertEquals("bogus", unexpected.get(LogMessages.KEY_MESSAGE_TYPE).asText());
        Assertions.assertEquals("hi", unexpected.get(LogMessages.KEY_MESSAGE).get("Message").asText());
        JsonNode undecodable = capture.await(LogCapture.msg(LogMessages.UNDECODABLE_MESSAGE), WAIT);
        Assertions.assertEquals(Events.ENQUEUE, undecodable.get(LogMessages.KEY_MESSAGE_TYPE).asText());

        CompletableFuture<Events.TaskQueued> queued = peer.next(LogMessages.TASK_QUEUED, Events.TaskQueued.class);
        peer.stream.send(Events.ENQUEUE, Events.Enqueue.of("still", "alive"));
        Assertions.assertEquals("still", queued.get(WAIT.toMillis(), TimeUnit.MILLISECONDS).id());
    }

    @Test
    void silentOperatorIsNamedByConnectionNumber() throws Exception {
        start(Duration.ofMillis(200));
        Peer peer = connect();
        CompletableFuture<Events.OperatorConnected> connected = peer.next(LogMessages.OPERATOR_CONNECTED, Events.OperatorConnected.class);
        peer.startReading();

        Assertions.assertEquals("cnum-1", connected.get(WAIT.toMillis(), TimeUnit.MILLISECONDS).operatorName());
        capture.await(LogCapture.msg(LogMessages.OPERATOR_INITIAL_NAME_ERROR), WAIT);

        peer.stream.send(Events.NAME, "late");
        JsonNode change = capture.await(LogCapture.msg(LogMessages.OPERATOR_NAME_CHANGE), WAIT);
        Assertions.assertEquals("cnum-1", change.get(LogMessages.KEY_OLD_NAME).asText());
    }

    @Test
    void firstEventOtherThanNameDropsConnection() throws Exception {
        start(Duration.ofSeconds(2));
        Peer peer = connect();
        peer.stream.send(Events.ENQUEUE, Events.Enqueue.of("x", "y"));

        capture.await(LogCapture.msg(LogMessages.OPERATOR_INITIAL_NAME_ERROR), WAIT);
        try (InputStream in = Channels.newInputStream(peer.channel)) {
            Assertions.assertEquals(-1, in.read());
        }
        Assertions.assertEquals(0L, capture.count(LogCapture.msg(LogMessages.OPERATOR_CONNECTED)));
    }

    @Test
    void stopSaysGoodbyeAndClosesConnections() throws Exception {
        start(Duration.ofSeconds(2));
        SocketChannel raw = SocketChannel.open(UnixDomainSocketAddress.of(socket));
        try {
            raw.write(ByteBuffer.wrap("\"name\"\n\"heidi\"\n".getBytes(StandardCharsets.UTF_8)));
            BufferedReader in = new BufferedReader(new InputStreamReader(Channels.newInputStream(raw), StandardCharsets.UTF_8));
            String line;
            do {
                line = in.readLine();
                Assertions.assertNotNull(line, "connection ended before the connected event");
            } while (!line.equals("\"" + LogMessages.OPERATOR_CONNECTED + "\""));
            Assertions.assertTrue(in.readLine().contains("\"opname\":\"heidi\""));

            supervisor.stop("test reason");

            StringBuilder rest = new StringBuilder();
            while ((line = in.readLine()) != null) {
                rest.append(line).append('\n');
            }
            Assertions.assertEquals("\"goodbye\"\n{\"Message\":\"test reason\"}\n", rest.toString());
        } finally {
            raw.close();
        }
        Assertions.assertEquals(0, supervisor.connectionCount());
        Assertions.assertTrue(supervisor.termination().isDone());
        Assertions.assertFalse(Files.exists(socket));
        Assertions.assertFalse(canConnect());
    }

    @Test
    void stopWaitsForEveryConnection() throws Exception {
        start(Duration.ofSeconds(2));
        List<Peer> operators = new ArrayList<>();
        List<CompletableFuture<Events.Goodbye>> goodbyes = new ArrayList<>();
        for (int i = 0; i < 3; i++) {
            Peer peer = connect();
            goodbyes.add(peer.next(Events.GOODBYE, Events.Goodbye.class));
            peer.start("op-" + i);
            operators.add(peer);
        }
        capture.awaitCount(LogCapture.msg(LogMessages.OPERATOR_CONNECTED), 3, WAIT);

        supervisor.stop("Error: something broke");

        for (CompletableFuture<Events.Goodbye> goodbye : goodbyes) {
            Assertions.assertEquals("Error: something broke", goodbye.get(WAIT.toMillis(), TimeUnit.MILLISECONDS).message());
        }
        for (Peer peer : operators) {
            Assertions.assertNotNull(peer.ended.get(WAIT.toMillis(), TimeUnit.MILLISECONDS));
        }
        Assertions.assertEquals(0, supervisor.connectionCount());
        Assertions.assertEquals(1, fanout.size());
        Assertions.assertEquals(3L, capture.count(LogCapture.msg(LogMessages.OPERATOR_DISCONNECTED)));

        supervisor.stop("again");
    }

    @Test
    void connectionChurnIsFullyAccountedFor() throws Exception {
        start(Duration.ofSeconds(2));
        int connections = 200;
        Peer watcher = connect();
        Set<String> connectedNames = ConcurrentHashMap.newKeySet();
        Set<String> disconnectedNames = ConcurrentHashMap.newKeySet();
        watcher.stream.on(LogMessages.OPERATOR_CONNECTED, Events.OperatorConnected.class,
                (type, event) -> connectedNames.add(event.operatorName()));
        watcher.stream.on(LogMessages.OPERATOR_DISCONNECTED, Events.OperatorConnected.class,
                (type, event) -> disconnectedNames.add(event.operatorName()));
        watcher.start("watcher");
        capture.await(LogCapture.msg(LogMessages.OPERATOR_CONNECTED, LogMessages.KEY_OPERATOR_NAME, "watcher"), WAIT);
        ExecutorService pool = Executors.newFixedThreadPool(16);
        try {
            List<Future<?>> results = new ArrayList<>();
            for (int i = 0; i < connections; i++) {
                String name = "churn-" + i;
                results.add(pool.submit(() -> {
                    try (SocketChannel channel = SocketChannel.open(UnixDomainSocketAddress.of(socket))) {
                        EventStream.of(channel).send(Events.NAME, name);
                    }
                    return null;
                }));
            }
            for (Future<?> result : results) {
                result.get(30, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        capture.awaitCount(LogCapture.msg(LogMessages.OPERATOR_CONNECTED), connections + 1, Duration.ofSeconds(30));
        capture.awaitCount(LogCapture.msg(LogMessages.OPERATOR_DISCONNECTED), connections, Duration.ofSeconds(30));
        long deadline = System.nanoTime() + Duration.ofSeconds(30).toNanos();
        while ((supervisor.connectionCount() != 1 || fanout.size() != 2 || disconnectedNames.size() < connections)
                && System.nanoTime() < deadline) {
            Thread.sleep(20L);
        }
        Assertions.assertEquals(1, supervisor.connectionCount());
        Assertions.assertEquals(2, fanout.size());
        Assertions.assertEquals(connections + 1, supervisor.connectionsAccepted());
        for (int i = 0; i < connections; i++) {
            Assertions.assertTrue(connectedNames.contains("churn-" + i), "connected event missing for churn-" + i);
            Assertions.assertTrue(disconnectedNames.contains("churn-" + i), "disconnected event missing for churn-" + i);
        }
        Assertions.assertEquals(connections + 1, connectedNames.size());
        Assertions.assertEquals(connections, disconnectedNames.size());
        Assertions.assertEquals(0L, capture.count(LogCapture.msg(LogMessages.OPERATOR_DISCONNECTED)
                .and(record -> "ERROR".equals(record.path("level").asText()))));
    }

    @Test
    void operatorThatStopsReadingIsDroppedWithoutStallingLogging() throws Exception {
        start(Duration.ofSeconds(2), Duration.ofMillis(500));
        SocketChannel stalled = SocketChannel.open(UnixDomainSocketAddress.of(socket));
        try {
            stalled.write(ByteBuffer.wrap("\"name\"\n\"stalled\"\n".getBytes(StandardCharsets.UTF_8)));
            capture.await(LogCapture.msg(LogMessages.OPERATOR_CONNECTED, LogMessages.KEY_OPERATOR_NAME, "stalled"), WAIT);

            int records = 5000;
            String filler = "x".repeat(1024);
            CompletableFuture<Void> logging = CompletableFuture.runAsync(() -> {
                for (int i = 0; i < records; i++) {
                    serverLog.info("filler", "seq", i, "pad", filler);
                }
            });

            logging.get(30, TimeUnit.SECONDS);
            Assertions.assertEquals(records, capture.count(LogCapture.msg("filler")));
            JsonNode dropped = capture.await(LogCapture.msg(LogMessages.OPERATOR_DISCONNECTED, LogMessages.KEY_OPERATOR_NAME, "stalled"), WAIT);
            Assertions.assertEquals("ERROR", dropped.path("level").asText());
            Assertions.assertTrue(dropped.path(StructuredLogger.KEY_ERROR).asText().contains("reader stalled"), dropped.toString());

            CompletableFuture<Void> stopping = CompletableFuture.runAsync(() -> supervisor.stop("bye"));
            stopping.get(WAIT.toMillis(), TimeUnit.MILLISECONDS);
            Assertions.assertEquals(0, supervisor.connectionCount());
            Assertions.assertEquals(1, fanout.size());
        } finally {
            stalled.close();
        }
    }

    @Test
    void stopDoesNotWaitForeverOnOperatorThatStopsReading() throws Exception {
        start(Duration.ofSeconds(2), Duration.ofMillis(500));
        SocketChannel stalled = SocketChannel.open(UnixDomainSocketAddress.of(socket));
        AtomicBoolean keepLogging = new AtomicBoolean(true);
        try {
            stalled.write(ByteBuffer.wrap("\"name\"\n\"stalled\"\n".getBytes(StandardCharsets.UTF_8)));
            capture.await(LogCapture.msg(LogMessages.OPERATOR_CONNECTED, LogMessages.KEY_OPERATOR_NAME, "stalled"), WAIT);

            String filler = "x".repeat(1024);
            CompletableFuture<Void> logging = CompletableFuture.runAsync(() -> {
                for (int i = 0; keepLogging.get() && i < 2000; i++) {
                    serverLog.info("filler", "seq", i, "pad", filler);
                }
            });
            capture.awaitCount(LogCapture.msg("filler"), 200, WAIT);

            CompletableFuture<Void> stopping = CompletableFuture.runAsync(() -> supervisor.stop("bye"));
            stopping.get(WAIT.toMillis(), TimeUnit.MILLISECONDS);
            keepLogging.set(false);
            logging.get(WAIT.toMillis(), TimeUnit.MILLISECONDS);

            Assertions.assertEquals(0, supervisor.connectionCount());
            Assertions.assertTrue(supervisor.termination().isDone());
            Assertions.assertEquals(1L, capture.count(LogCapture.msg(LogMessages.OPERATOR_DISCONNECTED, LogMessages.KEY_OPERATOR_NAME, "stalled")));
        } finally {
            keepLogging.set(false);
            stalled.close();
        }
    }

    @Test
    void nameArrivingAroundTheWaitIsNeverLost() throws Exception {
        Duration nameWait = Duration.ofMillis(100);
        start(nameWait);
        int operators = 12;
        for (int i = 0; i < operators; i++) {
            Peer peer = connect();
            Thread.sleep(nameWait.toMillis() - 6 + i);
            peer.start("late-" + i);
        }

        for (int i = 0; i < operators; i++) {
            String name = "late-" + i;
            capture.await(record -> name.equals(record.path(LogMessages.KEY_OPERATOR_NAME).asText()), WAIT);
        }
    }

    @Test
    void classifiesPeerGoingAwayAsNormal() {
        Assertions.assertTrue(OperatorSupervisor.isNormalEnd(new EOFException("end of event stream")));
        Assertions.assertTrue(OperatorSupervisor.isNormalEnd(new IOException("Broken pipe")));
        Assertions.assertTrue(OperatorSupervisor.isNormalEnd(new IOException("wrapped", new AsynchronousCloseException())));
        Assertions.assertTrue(OperatorSupervisor.isNormalEnd(new IOException("pipe closed")));
        Assertions.assertFalse(OperatorSupervisor.isNormalEnd(
                new IOException("pipe closed: reader stalled", new IOException("reader stalled"))));
        Assertions.assertFalse(OperatorSupervisor.isNormalEnd(new IOException("disk on fire")));
        Assertions.assertTrue(OperatorSupervisor.isTemporary(new IOException("Too many open files")));
        Assertions.assertFalse(OperatorSupervisor.isTemporary(new IOException("Permission denied")));
    }

    private void start(Duration nameWait) throws IOException, InterruptedException {
        start(nameWait, Duration.ofSeconds(2));
    }

    private void start(Duration nameWait, Duration writeTimeout) throws IOException, InterruptedException {
        serverLog = new StructuredLogger(fanout);
        serverLog.setLevel(StructuredLogger.Level.DEBUG);
        supervisor = new OperatorSupervisor(serverLog, fanout, state, Duration.ofMillis(250), nameWait, writeTimeout);
        supervisor.start(socket);
        capture.await(LogCapture.msg(LogMessages.OPERATOR_LISTENING), WAIT);
    }

    private Peer connect() throws IOException {
        Peer peer = new Peer(SocketChannel.open(UnixDomainSocketAddress.of(socket)));
        peers.add(peer);
        return peer;
    }

    private boolean canConnect() {
        try (SocketChannel ignored = SocketChannel.open(UnixDomainSocketAddress.of(socket))) {
            return true;
        } catch (IOException e) {
            return false;
        }
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }

    /**
     * Operator end of a connection, driven directly through an event stream.
     */
    private static final class Peer implements AutoCloseable {
        private final SocketChannel channel;
        private final EventStream stream;
        private final CompletableFuture<IOException> ended = new CompletableFuture<>();

        private Peer(SocketChannel channel) {
            this.channel = channel;
            this.stream = EventStream.of(channel);
            this.stream.onDispatchError(e -> ended.complete(e));
        }

        <T> CompletableFuture<T> next(String event, Class<T> type) {
            return next(event, type, value -> true);
        }

        <T> CompletableFuture<T> next(String event, Class<T> type, Predicate<T> filter) {
            CompletableFuture<T> future = new CompletableFuture<>();
            stream.on(event, type, (name, value) -> {
                if (filter.test(value)) {
                    future.complete(value);
                }
            });
            return future;
        }

        void start(String name) throws IOException {
            stream.send(Events.NAME, name);
            startReading();
        }

        void startReading() {
            Thread reader = new Thread(() -> {
                try {
                    stream.run();
                } catch (IOException e) {
                    ended.complete(e);
                }
            }, "operator-test-peer");
            reader.setDaemon(true);
            reader.start();
        }

        @Override
        public void close() throws IOException {
            stream.close();
        }
    }
}
