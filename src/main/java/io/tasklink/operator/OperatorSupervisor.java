package io.tasklink.operator;

import com.fasterxml.jackson.databind.JsonNode;
import io.tasklink.estream.EventStream;
import io.tasklink.estream.EventStreamClosedException;
import io.tasklink.fanout.FanoutWriter;
import io.tasklink.fanout.LogPipe;
import io.tasklink.observability.LogMessages;
import io.tasklink.observability.StructuredLogger;
import io.tasklink.persist.PersistenceManager;
import io.tasklink.state.ServerState;

import java.io.EOFException;
import java.io.IOException;
import java.net.SocketAddress;
import java.net.StandardProtocolFamily;
import java.net.UnixDomainSocketAddress;
import java.nio.channels.ClosedChannelException;
import java.nio.channels.ServerSocketChannel;
import java.nio.channels.SocketChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Accepts operator connections and runs each one until it ends or the
 * supervisor stops.
 *
 * <p>A new connection has a bounded time to send its name; if it does not,
 * it is named {@code cnum-<n>}. While connected, every log record the server
 * writes is also sent to the operator as an event named by the record's
 * message. An operator that stops reading for longer than the write
 * timeout is disconnected, so it cannot hold up logging for everyone else.
 * {@link #stop(String)} closes the listener, sends every live connection a
 * goodbye (closing any that cannot take it within the write timeout) and
 * returns once all of them have ended.
 */
public final class OperatorSupervisor {
    private static final long JOIN_TIMEOUT_MS = 5_000L;

    private final StructuredLogger log;
    private final FanoutWriter logFanout;
    private final PersistenceManager<ServerState> state;
    private final Duration acceptBackoff;
    private final Duration nameWait;
    private final Duration writeTimeout;
    private final AtomicLong connectionNumbers;
    private final Object registryLock;
    private final ExecutorService connectionThreads;
    private final ExecutorService streamThreads;
    private final CompletableFuture<Void> termination;
    private final CompletableFuture<Void> stopped;
    private final AtomicBoolean started;
    private final AtomicBoolean stopping;
    private Set<OperatorConnection> registry;
    private volatile ServerSocketChannel listener;
    private volatile Thread acceptThread;
    private volatile SocketAddress address;

    public OperatorSupervisor(
            StructuredLogger log,
            FanoutWriter logFanout,
            PersistenceManager<ServerState> state,
            Duration acceptBackoff,
            Duration nameWait,
            Duration writeTimeout
    ) {
        this.log = Objects.requireNonNull(log, "log");
        this.logFanout = Objects.requireNonNull(logFanout, "logFanout");
        this.state = Objects.requireNonNull(state, "state");
        this.acceptBackoff = acceptBackoff;
        this.nameWait = nameWait;
        this.writeTimeout = Objects.requireNonNull(writeTimeout, "writeTimeout");
        this.connectionNumbers = new AtomicLong(0L);
        this.registryLock = new Object();
        this.registry = new HashSet<>();
        this.connectionThreads = Executors.newCachedThreadPool(daemonThreads("tasklink-operator"));
        this.streamThreads = Executors.newCachedThreadPool(daemonThreads("tasklink-operator-io"));
        this.termination = new CompletableFuture<>();
        this.stopped = new CompletableFuture<>();
        this.started = new AtomicBoolean(false);
        this.stopping = new AtomicBoolean(false);
    }

    /**
     * Listens on a Unix domain socket at the given path, replacing any stale
     * socket file left there.
     */
    public void start(Path socketPath) throws IOException {
        Files.deleteIfExists(socketPath);
        ServerSocketChannel channel = ServerSocketChannel.open(StandardProtocolFamily.UNIX);
        try {
            channel.bind(UnixDomainSocketAddress.of(socketPath));
        } catch (IOException e) {
            channel.close();
            throw e;
        }
        start(channel);
    }

    /**
     * Accepts from an already bound listener, which this supervisor now owns.
     */
    public void start(ServerSocketChannel boundListener) throws IOException {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("operator supervisor already started");
        }
        listener = boundListener;
        address = boundListener.getLocalAddress();
        Thread thread = new Thread(this::acceptLoop, "tasklink-operator-accept");
        thread.setDaemon(true);
        acceptThread = thread;
        log.info(LogMessages.OPERATOR_LISTENING, LogMessages.KEY_ADDRESS, String.valueOf(address));
        thread.start();
    }

    public SocketAddress address() {
        return address;
    }

    /**
     * Completes once the supervisor has stopped, or exceptionally if the
     * listener failed with a non-temporary error.
     */
    public CompletableFuture<Void> termination() {
        return termination;
    }

    public int connectionCount() {
        synchronized (registryLock) {
            return registry == null ? 0 : registry.size();
        }
    }

    public long connectionsAccepted() {
        return connectionNumbers.get();
    }

    /**
     * Stops accepting, says goodbye to every connection with the given
     * message and waits for all of them to end. Later calls wait for the
     * first one to finish.
     */
    public void stop(String message) {
        if (!stopping.compareAndSet(false, true)) {
            stopped.join();
            return;
        }
        ServerSocketChannel current = listener;
        if (current != null) {
            try {
                current.close();
            } catch (IOException e) {
                log.log(StructuredLogger.Level.WARN, LogMessages.CLOSE_FAILED, e, LogMessages.KEY_ADDRESS, String.valueOf(address));
            }
        }
        if (address instanceof UnixDomainSocketAddress) {
            Path socketFile = ((UnixDomainSocketAddress) address).getPath();
            try {
                Files.deleteIfExists(socketFile);
            } catch (IOException e) {
                log.log(StructuredLogger.Level.WARN, LogMessages.CLOSE_FAILED, e, LogMessages.KEY_ADDRESS, socketFile.toString());
            }
        }
        Thread accepting = acceptThread;
        if (accepting != null && accepting != Thread.currentThread()) {
            try {
                accepting.join(JOIN_TIMEOUT_MS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }

        List<OperatorConnection> live;
        synchronized (registryLock) {
            live = new ArrayList<>(registry);
            registry = null;
        }
        sayGoodbye(live, message);

        connectionThreads.shutdown();
        try {
            connectionThreads.awaitTermination(Long.MAX_VALUE, TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        streamThreads.shutdown();
        termination.complete(null);
        stopped.complete(null);
    }

    private void sayGoodbye(List<OperatorConnection> live, String message) {
        List<CompletableFuture<Void>> goodbyes = new ArrayList<>(live.size());
        for (OperatorConnection connection : live) {
            goodbyes.add(CompletableFuture.runAsync(() -> connection.goodbye(message), streamThreads));
        }
        try {
            CompletableFuture.allOf(goodbyes.toArray(new CompletableFuture[0]))
                    .get(writeTimeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            log.debug(LogMessages.GOODBYE_FAILED, StructuredLogger.KEY_ERROR, "no room after " + writeTimeout);
        } catch (ExecutionException e) {
            log.log(StructuredLogger.Level.WARN, LogMessages.GOODBYE_FAILED, e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        for (int i = 0; i < live.size(); i++) {
            if (!goodbyes.get(i).isDone()) {
                // Unblocks the stuck send along with the connection's readers.
                live.get(i).close();
            }
        }
    }

    private void acceptLoop() {
        while (true) {
            SocketChannel channel;
            try {
                channel = listener.accept();
            } catch (ClosedChannelException e) {
                return;
            } catch (IOException e) {
                if (stopping.get()) {
                    return;
                }
                if (isTemporary(e)) {
                    log.log(StructuredLogger.Level.WARN, LogMessages.TEMPORARY_ACCEPT_ERROR, e);
                    if (!pause(acceptBackoff)) {
                        return;
                    }
                    continue;
                }
                termination.completeExceptionally(new IOException("accepting operator connections: " + e.getMessage(), e));
                return;
            }
            try {
                connectionThreads.execute(() -> handle(channel));
            } catch (RejectedExecutionException e) {
                closeChannel(channel);
                return;
            }
        }
    }

    private void handle(SocketChannel channel) {
        long number = connectionNumbers.incrementAndGet();
        OperatorConnection connection = new OperatorConnection(number, EventStream.of(channel), state, log);
        synchronized (registryLock) {
            if (registry == null) {
                connection.close();
                return;
            }
            registry.add(connection);
        }
        try {
            serve(connection);
        } finally {
            synchronized (registryLock) {
                if (registry != null) {
                    registry.remove(connection);
                }
            }
            connection.close();
        }
    }

    private void serve(OperatorConnection connection) {
        EventStream stream = connection.stream();
        BlockingQueue<Throwable> failures = new LinkedBlockingQueue<>();

        if (!awaitInitialName(connection, failures)) {
            return;
        }
        connection.installHandlers();

        LogPipe logs = new LogPipe(LogPipe.DEFAULT_CAPACITY, writeTimeout);
        logFanout.add(logs.sink(), cause -> {
            if (cause != null) {
                failures.add(cause);
            }
        });
        Throwable failure;
        try {
            streamThreads.execute(() -> {
                try {
                    stream.sendJsonLogs(logs.source());
                } catch (IOException | RuntimeException e) {
                    failures.add(e);
                }
            });
            streamThreads.execute(() -> {
                try {
                    stream.run();
                } catch (IOException | RuntimeException e) {
                    failures.add(e);
                }
            });
            connection.log().info(LogMessages.OPERATOR_CONNECTED);
            failure = failures.take();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            failure = e;
        } catch (RejectedExecutionException e) {
            failure = e;
        } finally {
            // Closing the pipe first releases a fan-out write blocked on it.
            logs.close(null);
            connection.close();
            logFanout.remove(logs.sink());
        }

        if (isNormalEnd(failure)) {
            connection.log().info(LogMessages.OPERATOR_DISCONNECTED);
        } else {
            connection.log().log(
                    StructuredLogger.Level.ERROR,
                    LogMessages.OPERATOR_DISCONNECTED,
                    failure,
                    LogMessages.KEY_ERROR_TYPE, failure.getClass().getName()
            );
        }
    }

    /**
     * Reads the first event, which should be the operator's name, and names
     * the connection. Returns {@code false} if the connection failed first; a
     * read still outstanding after the wait reports its failure to
     * {@code failures}, and a name it delivers renames the connection.
     */
    private boolean awaitInitialName(OperatorConnection connection, BlockingQueue<Throwable> failures) {
        EventStream stream = connection.stream();
        CompletableFuture<String> initialName = new CompletableFuture<>();
        Object naming = new Object();
        stream.on(EventStream.DEFAULT_HANDLER, JsonNode.class, (type, payload) ->
                initialName.completeExceptionally(new IOException("expected a name event, got \"" + type + "\"")));
        stream.on(Events.NAME, String.class, (type, value) -> {
            synchronized (naming) {
                if (!initialName.complete(value)) {
                    connection.rename(value);
                }
            }
        });
        try {
            streamThreads.execute(() -> {
                try {
                    stream.runOnce();
                } catch (IOException | RuntimeException e) {
                    if (!initialName.completeExceptionally(e)) {
                        failures.add(e);
                    }
                }
            });
        } catch (RejectedExecutionException e) {
            return false;
        }
        try {
            initialName.get(nameWait.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            String synthesized = "cnum-" + connection.number();
            synchronized (naming) {
                if (initialName.complete(synthesized)) {
                    connection.named(synthesized);
                    connection.log().info(
                            LogMessages.OPERATOR_INITIAL_NAME_ERROR,
                            StructuredLogger.KEY_ERROR, "no name after " + nameWait
                    );
                    return true;
                }
            }
            // Otherwise the first event arrived between the wait ending and the name being made up.
        } catch (ExecutionException e) {
            connection.log().log(StructuredLogger.Level.INFO, LogMessages.OPERATOR_INITIAL_NAME_ERROR, e.getCause());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
        return nameFrom(connection, initialName);
    }

    private boolean nameFrom(OperatorConnection connection, CompletableFuture<String> initialName) {
        try {
            String name = initialName.join();
            if (name == null) {
                connection.log().info(LogMessages.OPERATOR_INITIAL_NAME_ERROR, StructuredLogger.KEY_ERROR, "null name");
                return false;
            }
            connection.named(name);
            return true;
        } catch (CompletionException e) {
            connection.log().log(StructuredLogger.Level.INFO, LogMessages.OPERATOR_INITIAL_NAME_ERROR, e.getCause());
            return false;
        }
    }

    static boolean isNormalEnd(Throwable failure) {
        for (Throwable t = failure; t != null; t = t.getCause()) {
            if (t instanceof EOFException
                    || t instanceof EventStreamClosedException
                    || t instanceof ClosedChannelException) {
                return true;
            }
            String message = t.getMessage();
            if (t instanceof IOException && message != null
                    && (message.contains("Broken pipe")
                    || message.contains("Connection reset"))) {
                return true;
            }
            // A pipe closed for a reason, such as a stalled reader, is not a normal end.
            if (t instanceof IOException && t.getCause() == null
                    && message != null && message.contains("pipe closed")) {
                return true;
            }
        }
        return false;
    }

    static boolean isTemporary(IOException e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            String message = t.getMessage();
            if (message != null && message.contains("Too many open files")) {
                return true;
            }
        }
        return false;
    }

    private boolean pause(Duration duration) {
        try {
            Thread.sleep(duration.toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private void closeChannel(SocketChannel channel) {
        try {
            channel.close();
        } catch (IOException e) {
            log.log(StructuredLogger.Level.DEBUG, LogMessages.CLOSE_FAILED, e);
        }
    }

    private static ThreadFactory daemonThreads(String prefix) {
        AtomicLong seq = new AtomicLong(0L);
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + seq.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
