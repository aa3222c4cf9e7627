package io.tasklink.observability;

/**
 * Log messages and attribute keys. Operators subscribe to log records by
 * message, so these strings are part of the wire protocol.
 */
public final class LogMessages {
    public static final String OPERATOR_LISTENING = "Operator listener started";
    public static final String OPERATOR_CONNECTED = "Operator connected";
    public static final String OPERATOR_DISCONNECTED = "Operator disconnected";
    public static final String OPERATOR_NAME_CHANGE = "Operator name change";
    public static final String OPERATOR_INITIAL_NAME_ERROR = "Error getting initial operator name";
    public static final String TASK_QUEUED = "Task queued";
    public static final String TASK_REQUEST = "Task request";
    public static final String NEW_IMPLANT = "New implant";
    public static final String SENT_SEEN_LIST = "Sent implant list";
    public static final String UNEXPECTED_MESSAGE = "Unexpected message";
    public static final String UNDECODABLE_MESSAGE = "Undecodable message";
    public static final String TEMPORARY_ACCEPT_ERROR = "Temporary accept error";
    public static final String SERVER_READY = "Server ready";
    public static final String SERVER_STOPPED = "Server stopped";
    public static final String STATE_WRITE_FAILED = "State write failed";
    public static final String CAUGHT_SIGNAL = "Caught signal, exiting";
    public static final String GOODBYE_FAILED = "Goodbye not delivered";
    public static final String REPLY_FAILED = "Reply not delivered";
    public static final String CLOSE_FAILED = "Close failed";

    public static final String KEY_ADDRESS = "address";
    public static final String KEY_DIRNAME = "dirname";
    public static final String KEY_CONN_NUMBER = "cnum";
    public static final String KEY_OPERATOR_NAME = "opname";
    public static final String KEY_OLD_NAME = "oldname";
    public static final String KEY_ID = "id";
    public static final String KEY_FROM = "from";
    public static final String KEY_TASK = "task";
    public static final String KEY_QUEUE_LENGTH = "qlen";
    public static final String KEY_MESSAGE_TYPE = "message_type";
    public static final String KEY_MESSAGE = "message";
    public static final String KEY_ERROR_TYPE = "error_type";

    private LogMessages() {
    }
}
