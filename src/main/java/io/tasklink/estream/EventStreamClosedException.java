package io.tasklink.estream;

import java.io.IOException;

/**
 * Thrown by send and receive operations once the stream has been closed.
 */
public class EventStreamClosedException extends IOException {
    public EventStreamClosedException() {
        super("event stream closed");
    }

    public EventStreamClosedException(Throwable cause) {
        super("event stream closed", cause);
    }
}
