package com.p14n.eventbus.bus;

import com.p14n.eventbus.data.EventMessage;

/**
 * Pluggable delivery strategy between the bus and its subscribers.
 */
public interface MessageEventBusForwarder extends AutoCloseable {

    /**
     * Hands a persisted message on for delivery.
     *
     * @param message The message, already frozen by the bus
     * @return true when at least one subscriber was present to receive it,
     *         which lets the bus confirm the message
     */
    boolean forward(EventMessage message);

    @Override
    default void close() {
    }
}
