package com.p14n.eventbus.broker;

/**
 * Outcome of routing one message through the broker.
 *
 * @param subscribersProcessed receivers with a live worker that were
 *                             considered, matching or not
 * @param subscribersSent      receivers the message was handed to
 */
public record DeliveryResult(int subscribersProcessed, int subscribersSent) {
}
