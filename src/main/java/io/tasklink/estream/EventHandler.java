package io.tasklink.estream;

/**
 * Receives one decoded event. Invoked on the thread running the stream's
 * receive loop; handlers for one stream never run concurrently.
 *
 * @param <T> payload type the raw JSON payload is bound to
 */
@FunctionalInterface
public interface EventHandler<T> {
    void handle(String name, T payload);
}
