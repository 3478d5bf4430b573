package com.p14n.eventbus.errors;

/**
 * A retention sweep of delivered messages failed. The next scheduled sweep
 * retries.
 */
public class CompactionException extends EventBusException {

    public CompactionException(String message, Throwable cause) {
        super(message, cause);
    }
}
