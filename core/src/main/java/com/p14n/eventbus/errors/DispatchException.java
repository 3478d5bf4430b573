package com.p14n.eventbus.errors;

/**
 * Delivery of a message to one receiver's worker failed.
 */
public class DispatchException extends EventBusException {

    private final String receiverName;

    public DispatchException(String receiverName, String message, Throwable cause) {
        super(message, cause);
        this.receiverName = receiverName;
    }

    public String getReceiverName() {
        return receiverName;
    }
}
