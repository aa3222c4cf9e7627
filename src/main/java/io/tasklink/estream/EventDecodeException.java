package io.tasklink.estream;

public class EventDecodeException extends EventDispatchException {
    public EventDecodeException(String eventName, Throwable cause) {
        super(eventName, "unmarshalling \"" + eventName + "\" payload: " + cause.getMessage(), cause);
    }
}
