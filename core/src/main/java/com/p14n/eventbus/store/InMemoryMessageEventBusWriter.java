package com.p14n.eventbus.store;

import com.p14n.eventbus.broker.AsyncExecutor;
import com.p14n.eventbus.data.EventMessage;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Non-durable {@link MessageEventBusWriter} holding both partitions in sorted
 * maps. Values are kept in serialized form so reads behave like the durable
 * store. Everything is lost when the process exits.
 */
public final class InMemoryMessageEventBusWriter implements MessageEventBusWriter {
    private static final Logger logger = LoggerFactory.getLogger(InMemoryMessageEventBusWriter.class);

    private final TreeMap<String, String> unsent = new TreeMap<>();
    private final TreeMap<String, String> sent = new TreeMap<>();
    private final ScheduledFuture<?> compaction;
    private boolean closed;

    public InMemoryMessageEventBusWriter() {
        this.compaction = null;
    }

    /**
     * Creates a writer that sweeps delivered messages on the given executor.
     */
    public InMemoryMessageEventBusWriter(AsyncExecutor asyncExecutor, int compactionIntervalSeconds,
            long sentRetentionSeconds) {
        this.compaction = asyncExecutor.scheduleAtFixedRate(() -> {
            try {
                if (!isClosed()) {
                    flushSentMessages(sentRetentionSeconds);
                }
            } catch (RuntimeException e) {
                logger.atWarn().setCause(e).log("Retention sweep failed, retrying on next tick");
            }
        }, compactionIntervalSeconds, compactionIntervalSeconds, TimeUnit.SECONDS);
    }

    @Override
    public synchronized void putMessage(EventMessage message) {
        checkOpen();
        if (message == null) {
            throw new IllegalArgumentException("Message cannot be null");
        }
        if (!sent.containsKey(message.key())) {
            unsent.put(message.key(), message.toJson());
        }
    }

    @Override
    public synchronized void confirmMessageSent(String key) {
        checkOpen();
        String value = unsent.remove(key);
        if (value != null) {
            sent.put(key, value);
        }
    }

    @Override
    public synchronized List<EventMessage> getMessages() {
        checkOpen();
        TreeMap<String, String> all = new TreeMap<>(sent);
        all.putAll(unsent);
        return deserialize(all.values());
    }

    @Override
    public synchronized List<EventMessage> getMessagesSent() {
        checkOpen();
        return deserialize(sent.values());
    }

    @Override
    public synchronized List<EventMessage> getMessagesUnsent() {
        checkOpen();
        return deserialize(unsent.values());
    }

    @Override
    public synchronized Set<String> recoverUnsentMessages() {
        checkOpen();
        return new LinkedHashSet<>(unsent.keySet());
    }

    @Override
    public synchronized int flushSentMessages(long ageLimitSeconds) {
        checkOpen();
        long cutoff = System.currentTimeMillis() - TimeUnit.SECONDS.toMillis(ageLimitSeconds);
        int before = sent.size();
        sent.keySet().removeIf(key -> EventMessage.timestampOfKey(key) < cutoff);
        return before - sent.size();
    }

    @Override
    public void close() {
        if (compaction != null) {
            compaction.cancel(false);
        }
        synchronized (this) {
            closed = true;
        }
    }

    private synchronized boolean isClosed() {
        return closed;
    }

    private void checkOpen() {
        if (closed) {
            throw new IllegalStateException("Writer is closed");
        }
    }

    private static List<EventMessage> deserialize(Collection<String> values) {
        List<EventMessage> messages = new ArrayList<>(values.size());
        for (String value : values) {
            messages.add(EventMessage.fromJson(value));
        }
        return messages;
    }
}
