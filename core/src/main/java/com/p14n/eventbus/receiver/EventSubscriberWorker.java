package com.p14n.eventbus.receiver;

/**
 * Logic run inside a receiver's isolated worker.
 *
 * <p>
 * A worker instance is created on its own thread when the receiver launches
 * and is only ever called from that thread, so implementations may keep
 * unsynchronized state. Messages arrive in serialized form
 * ({@link com.p14n.eventbus.data.EventMessage#toJson()}); the worker never
 * shares objects with the broker.
 * </p>
 *
 * <p>
 * Implementations must not block indefinitely: a stuck call holds up every
 * later delivery to the same receiver.
 * </p>
 */
public interface EventSubscriberWorker {

    /**
     * Handles one delivered message.
     *
     * @param serializedMessage The message as JSON
     */
    void receive(String serializedMessage);

    /**
     * Handles an out-of-band control message such as a file name or a pause
     * request. Ignored unless overridden.
     *
     * @param key   The control message name
     * @param value The control message argument, may be null
     */
    default void configure(String key, Object value) {
    }
}
