package io.tasklink.server;

import io.tasklink.config.TaskLinkConfig;
import io.tasklink.fanout.FanoutWriter;
import io.tasklink.observability.LogMessages;
import io.tasklink.observability.StructuredLogger;
import io.tasklink.operator.OperatorSupervisor;
import io.tasklink.persist.PersistenceException;
import io.tasklink.persist.PersistenceManager;
import io.tasklink.state.ServerState;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Wires logging, persistent state and the operator supervisor together for
 * one working directory.
 *
 * <p>Start with {@link #start()}, then {@link #await()} until something stops
 * the server: a call to {@link #stop(Throwable)}, a state write failure or a
 * fatal listener error.
 */
public final class TaskLinkServer {
    private final TaskLinkConfig config;
    private final OutputStream console;
    private final AtomicBoolean stopping;
    private final CompletableFuture<Throwable> stopped;

    private OutputStream logFile;
    private FanoutWriter logFanout;
    private StructuredLogger log;
    private PersistenceManager<ServerState> state;
    private OperatorSupervisor operators;

    public TaskLinkServer(TaskLinkConfig config) {
        this(config, System.out);
    }

    /**
     * @param console where log records go besides the log file; {@code null}
     *                for nowhere else
     */
    public TaskLinkServer(TaskLinkConfig config, OutputStream console) {
        this.config = Objects.requireNonNull(config, "config");
        this.console = console;
        this.stopping = new AtomicBoolean(false);
        this.stopped = new CompletableFuture<>();
    }

    public void start() throws IOException {
        createDir(config.dir());
        initLogging();

        try {
            state = ServerState.open(config, this::stateFailed);
        } catch (PersistenceException e) {
            closeLogging();
            throw new IOException("initializing persistent state: " + e.getMessage(), e);
        }

        operators = new OperatorSupervisor(
                log,
                logFanout,
                state,
                config.acceptBackoff(),
                config.operatorNameWait(),
                config.operatorWriteTimeout()
        );
        try {
            operators.start(config.operatorSocket());
        } catch (IOException e) {
            IOException failure = new IOException("starting operator service: " + e.getMessage(), e);
            stop(failure);
            throw failure;
        }
        operators.termination().whenComplete((ignored, error) -> {
            if (error != null) {
                stopAsync(error);
            }
        });

        log.info(LogMessages.SERVER_READY, LogMessages.KEY_DIRNAME, config.dir().toString());
    }

    /**
     * Stops the operator service, telling operators {@code Error: <reason>}
     * when there is a cause, then flushes state and closes the log. Returns
     * what {@link #await()} returns. Safe to call more than once.
     */
    public Throwable stop(Throwable cause) {
        if (!stopping.compareAndSet(false, true)) {
            return await();
        }
        Throwable result = cause;
        if (operators != null) {
            operators.stop(cause == null ? "" : "Error: " + describe(cause));
        }
        if (state != null) {
            try {
                state.close();
            } catch (PersistenceException e) {
                if (result == null) {
                    result = new IOException("flushing state: " + e.getMessage(), e);
                }
            }
        }
        if (log != null) {
            if (result == null) {
                log.info(LogMessages.SERVER_STOPPED);
            } else {
                log.log(StructuredLogger.Level.ERROR, LogMessages.SERVER_STOPPED, result);
            }
        }
        closeLogging();
        stopped.complete(result);
        return result;
    }

    /**
     * Waits for the server to stop.
     *
     * @return why it stopped, or {@code null} after a clean stop
     */
    public Throwable await() {
        return stopped.join();
    }

    public boolean isStopped() {
        return stopped.isDone();
    }

    /**
     * Records that an implant checked in, logging the first sighting of an
     * ID not already in the last-seen list.
     *
     * @return whether the ID was new to the list
     */
    public boolean recordSighting(String id, String from) {
        boolean fresh;
        state.acquireExclusive();
        try {
            fresh = state.document().saw(id, from);
        } finally {
            state.release();
        }
        if (fresh) {
            log.info(LogMessages.NEW_IMPLANT, LogMessages.KEY_ID, id, LogMessages.KEY_FROM, from);
        }
        return fresh;
    }

    /**
     * Hands out the next task queued for an implant, if any.
     */
    public Optional<String> nextTask(String id) {
        Optional<String> task;
        state.acquireExclusive();
        try {
            task = state.document().nextTask(id);
        } finally {
            state.releaseAndWriteNow();
        }
        task.ifPresent(t -> log.info(LogMessages.TASK_REQUEST, LogMessages.KEY_ID, id, LogMessages.KEY_TASK, t));
        return task;
    }

    public TaskLinkConfig config() {
        return config;
    }

    public StructuredLogger log() {
        return log;
    }

    public PersistenceManager<ServerState> state() {
        return state;
    }

    public OperatorSupervisor operators() {
        return operators;
    }

    private void initLogging() throws IOException {
        Path logPath = config.logFile();
        if (!Files.exists(logPath)) {
            createFile(logPath);
        }
        logFile = Files.newOutputStream(logPath, StandardOpenOption.WRITE, StandardOpenOption.APPEND);
        logFanout = new FanoutWriter(logFile);
        logFanout.add(console, null);
        log = new StructuredLogger(logFanout);
        if (config.debug()) {
            log.setLevel(StructuredLogger.Level.DEBUG);
        }
    }

    private void closeLogging() {
        if (logFanout != null) {
            logFanout.close();
        }
        if (logFile != null) {
            try {
                logFile.close();
            } catch (IOException e) {
                System.err.println("WARN closing log file: " + e.getMessage());
            }
        }
    }

    private void stateFailed(PersistenceException e) {
        log.log(StructuredLogger.Level.ERROR, LogMessages.STATE_WRITE_FAILED, e);
        stopAsync(new IOException("persistent state: " + e.getMessage(), e));
    }

    // Failure callbacks run on threads stop() waits for.
    private void stopAsync(Throwable cause) {
        Thread thread = new Thread(() -> stop(cause), "tasklink-stop");
        thread.setDaemon(false);
        thread.start();
    }

    private static String describe(Throwable cause) {
        String message = cause.getMessage();
        return message == null || message.isBlank() ? cause.toString() : message;
    }

    private static boolean posix() {
        return FileSystems.getDefault().supportedFileAttributeViews().contains("posix");
    }

    private static void createDir(Path dir) throws IOException {
        if (Files.isDirectory(dir)) {
            return;
        }
        if (posix()) {
            Files.createDirectories(dir, PosixFilePermissions.asFileAttribute(TaskLinkConfig.DIR_PERMISSIONS));
        } else {
            Files.createDirectories(dir);
        }
    }

    private static void createFile(Path file) throws IOException {
        if (posix()) {
            Files.createFile(file, PosixFilePermissions.asFileAttribute(TaskLinkConfig.FILE_PERMISSIONS));
        } else {
            Files.createFile(file);
        }
    }
}
