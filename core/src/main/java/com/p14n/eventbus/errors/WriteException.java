package com.p14n.eventbus.errors;

/**
 * The log store could not append or confirm a message. When raised from
 * publish the message must be treated as not recorded.
 */
public class WriteException extends EventBusException {

    public WriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
