package io.tasklink.estream;

public class EventHandlerException extends EventDispatchException {
    public EventHandlerException(String eventName, RuntimeException cause) {
        super(eventName, "\"" + eventName + "\" handler failed: " + cause, cause);
    }
}
