package io.tasklink.estream;

import java.io.IOException;

/**
 * A line on the connection was not the JSON a frame requires. The two-line
 * framing can no longer be trusted, so this ends the receive loop.
 */
public class MalformedFrameException extends IOException {
    public MalformedFrameException(String message) {
        super(message);
    }

    public MalformedFrameException(String message, Throwable cause) {
        super(message, cause);
    }
}
