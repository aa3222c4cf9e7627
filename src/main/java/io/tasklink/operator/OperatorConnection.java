package io.tasklink.operator;

import com.fasterxml.jackson.databind.JsonNode;
import io.tasklink.estream.EventStream;
import io.tasklink.observability.LogMessages;
import io.tasklink.observability.StructuredLogger;
import io.tasklink.persist.PersistenceException;
import io.tasklink.persist.PersistenceManager;
import io.tasklink.state.ServerState;
import io.tasklink.state.Sighting;

import java.io.IOException;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Supplier;

/**
 * One operator's connection: its event stream, name, logger and the handlers
 * for the events operators send.
 */
final class OperatorConnection {
    private final long number;
    private final EventStream stream;
    private final PersistenceManager<ServerState> state;
    private final AtomicReference<String> name;
    private volatile StructuredLogger log;

    OperatorConnection(long number, EventStream stream, PersistenceManager<ServerState> state, StructuredLogger serverLog) {
        this.number = number;
        this.stream = stream;
        this.state = state;
        this.name = new AtomicReference<>();
        this.log = serverLog.with(LogMessages.KEY_CONN_NUMBER, number);
    }

    long number() {
        return number;
    }

    EventStream stream() {
        return stream;
    }

    String name() {
        return name.get();
    }

    StructuredLogger log() {
        return log;
    }

    /**
     * Sets the first name and adds it to this connection's log records. Later
     * changes arrive as name events.
     */
    void named(String initial) {
        name.set(initial);
        Supplier<String> current = name::get;
        log = log.with(LogMessages.KEY_OPERATOR_NAME, current);
    }

    void rename(String newName) {
        handleName(Events.NAME, newName);
    }

    void installHandlers() {
        stream.on(EventStream.DEFAULT_HANDLER, JsonNode.class, this::handleUnexpected);
        stream.on(Events.NAME, String.class, this::handleName);
        stream.on(Events.ENQUEUE, Events.Enqueue.class, this::handleEnqueue);
        stream.on(Events.LIST_SEEN, JsonNode.class, this::handleListSeen);
        stream.onDispatchError(e -> log.log(
                StructuredLogger.Level.WARN,
                LogMessages.UNDECODABLE_MESSAGE,
                e,
                LogMessages.KEY_MESSAGE_TYPE, e.eventName()
        ));
    }

    /**
     * Sends a goodbye, best-effort, and closes the connection.
     */
    void goodbye(String message) {
        try {
            stream.send(Events.GOODBYE, new Events.Goodbye(message == null ? "" : message));
        } catch (IOException e) {
            log.log(StructuredLogger.Level.DEBUG, LogMessages.GOODBYE_FAILED, e);
        } finally {
            close();
        }
    }

    void close() {
        try {
            stream.close();
        } catch (IOException e) {
            log.log(StructuredLogger.Level.DEBUG, LogMessages.CLOSE_FAILED, e);
        }
    }

    private void handleUnexpected(String type, JsonNode payload) {
        log.warn(
                LogMessages.UNEXPECTED_MESSAGE,
                LogMessages.KEY_MESSAGE_TYPE, type,
                LogMessages.KEY_MESSAGE, payload
        );
    }

    private void handleName(String type, String newName) {
        String old = name.getAndSet(newName);
        log.info(LogMessages.OPERATOR_NAME_CHANGE, LogMessages.KEY_OLD_NAME, old);
    }

    private void handleEnqueue(String type, Events.Enqueue request) {
        if (request == null || request.id() == null || request.id().isEmpty()) {
            reply(type, (request == null ? Events.Enqueue.of(null, null) : request).withError("ID missing"));
            return;
        }
        if (request.task() == null || request.task().isEmpty()) {
            reply(type, request.withError("Empty task"));
            return;
        }
        int queueLength;
        state.acquireExclusive();
        try {
            queueLength = state.document().enqueue(request.id(), request.task());
        } finally {
            try {
                state.releaseAndWriteNow();
            } catch (PersistenceException e) {
                // Already with the state's error callback; the task is queued in memory.
                log.log(StructuredLogger.Level.DEBUG, LogMessages.STATE_WRITE_FAILED, e);
            }
        }
        log.info(
                LogMessages.TASK_QUEUED,
                LogMessages.KEY_ID, request.id(),
                LogMessages.KEY_TASK, request.task(),
                LogMessages.KEY_QUEUE_LENGTH, queueLength
        );
    }

    private void handleListSeen(String type, JsonNode ignored) {
        List<Sighting> seen;
        state.acquireShared();
        try {
            seen = state.document().lastSeen();
        } finally {
            state.releaseShared();
        }
        if (reply(Events.LIST_SEEN, seen)) {
            log.debug(LogMessages.SENT_SEEN_LIST);
        }
    }

    private boolean reply(String type, Object payload) {
        try {
            stream.send(type, payload);
            return true;
        } catch (IOException e) {
            log.log(StructuredLogger.Level.WARN, LogMessages.REPLY_FAILED, e, LogMessages.KEY_MESSAGE_TYPE, type);
            return false;
        }
    }
}
