package com.p14n.eventbus.errors;

/**
 * Base class for failures raised by the event bus, its log store and its
 * broker.
 */
public class EventBusException extends RuntimeException {

    public EventBusException(String message) {
        super(message);
    }

    public EventBusException(String message, Throwable cause) {
        super(message, cause);
    }
}
