package io.tasklink.operator;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Event names and payloads exchanged with operators. Events carrying log
 * records are named by the record's message (see
 * {@link io.tasklink.observability.LogMessages}); the records here bind the
 * fields operators care about and ignore the rest.
 */
public final class Events {
    /** Server to operator: the server is shutting down. */
    public static final String GOODBYE = "goodbye";
    /** Operator to server: sets or changes the operator's name; payload is a JSON string. */
    public static final String NAME = "name";
    /** Operator to server: queue a task. Echoed back with an error when rejected. */
    public static final String ENQUEUE = "enqueue";
    /** Both ways: request, then reply with the last-seen list. */
    public static final String LIST_SEEN = "listseen";

    private Events() {
    }

    public record Goodbye(@JsonProperty("Message") String message) {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record Enqueue(
            @JsonProperty("ID") String id,
            @JsonProperty("Task") String task,
            @JsonProperty("Error") String error
    ) {
        public static Enqueue of(String id, String task) {
            return new Enqueue(id, task, null);
        }

        public Enqueue withError(String message) {
            return new Enqueue(id, task, message);
        }
    }

    public record TaskQueued(
            @JsonProperty("id") String id,
            @JsonProperty("task") String task,
            @JsonProperty("opname") String operatorName,
            @JsonProperty("qlen") int queueLength
    ) {
    }

    public record OperatorConnected(
            @JsonProperty("opname") String operatorName,
            @JsonProperty("cnum") long connectionNumber
    ) {
    }

    public record OperatorNameChange(
            @JsonProperty("opname") String operatorName,
            @JsonProperty("oldname") String oldName
    ) {
    }
}
