package io.tasklink.estream;

import java.io.IOException;

/**
 * A complete frame was read but could not be delivered. The stream is still
 * in sync; {@link EventStream#run()} reports these and keeps reading.
 */
public abstract class EventDispatchException extends IOException {
    private final String eventName;

    protected EventDispatchException(String eventName, String message, Throwable cause) {
        super(message, cause);
        this.eventName = eventName;
    }

    public String eventName() {
        return eventName;
    }
}
