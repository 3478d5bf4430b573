package com.p14n.eventbus.errors;

/**
 * A receiver's worker could not be started.
 */
public class SpawnException extends EventBusException {

    public SpawnException(String message, Throwable cause) {
        super(message, cause);
    }
}
