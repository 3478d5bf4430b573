package com.p14n.eventbus.store;

import com.p14n.eventbus.data.EventMessage;

import java.util.List;
import java.util.Set;

/**
 * Durable log store used by the event bus.
 *
 * <p>
 * Messages live in exactly one of two partitions: {@code unsent} after
 * {@link #putMessage(EventMessage)} and {@code sent} after
 * {@link #confirmMessageSent(String)}. Moving between them is atomic. Every
 * list operation returns messages in key order, which is time order.
 * </p>
 */
public interface MessageEventBusWriter extends AutoCloseable {

    /**
     * Appends a message to the {@code unsent} partition under its key.
     *
     * @param message The message to persist
     * @throws com.p14n.eventbus.errors.WriteException if the store could not
     *                                                 write the message
     */
    void putMessage(EventMessage message);

    /**
     * Atomically moves a message from {@code unsent} to {@code sent}. Unknown
     * and already confirmed keys are ignored.
     *
     * @param key The message key
     * @throws com.p14n.eventbus.errors.WriteException if the store could not
     *                                                 complete the move
     */
    void confirmMessageSent(String key);

    /**
     * @return messages from both partitions in key order
     */
    List<EventMessage> getMessages();

    /**
     * @return messages confirmed as delivered, in key order
     */
    List<EventMessage> getMessagesSent();

    /**
     * @return messages awaiting confirmation, in key order
     */
    List<EventMessage> getMessagesUnsent();

    /**
     * Lists the keys left in {@code unsent}, i.e. messages persisted by an
     * earlier run that never got confirmed.
     *
     * @return the unsent keys in key order
     */
    Set<String> recoverUnsentMessages();

    /**
     * Removes {@code sent} messages whose key timestamp is older than now minus
     * the age limit.
     *
     * @param ageLimitSeconds Age in seconds after which delivered messages are
     *                        dropped
     * @return the number of messages removed
     * @throws com.p14n.eventbus.errors.CompactionException if the sweep failed
     */
    int flushSentMessages(long ageLimitSeconds);

    /**
     * Releases the underlying storage. Further calls fail with
     * {@link IllegalStateException}.
     */
    @Override
    void close();
}
