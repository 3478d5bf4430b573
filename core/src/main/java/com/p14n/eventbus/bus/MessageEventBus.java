package com.p14n.eventbus.bus;

import com.p14n.eventbus.data.EventMessage;
import com.p14n.eventbus.data.EventMessageLevel;
import com.p14n.eventbus.data.EventMessageSeverity;
import com.p14n.eventbus.store.MessageEventBusWriter;
import com.p14n.eventbus.telemetry.BrokerMetrics;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Tracer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;

import static com.p14n.eventbus.telemetry.OpenTelemetryFunctions.processWithTelemetry;

/**
 * Durable publish/confirm hub.
 *
 * <p>
 * Every published message is persisted to all writers, in registration
 * order, before it is forwarded. It is confirmed (moved to the {@code sent}
 * partition of every writer) only when at least one forwarder reports that a
 * subscriber was present. Messages left unconfirmed, by a crash or by the
 * lack of subscribers, are forwarded again the next time the bus is
 * initialized.
 * </p>
 *
 * <p>
 * Example usage:
 * </p>
 *
 * <pre>{@code
 * MessageEventBus bus = new MessageEventBus(OpenTelemetry.noop());
 * bus.initialize(List.of(writer), List.of(forwarder));
 * bus.publish(EventMessage.create("n8n.workflow.workflowStarted", Map.of("id", "42")));
 * bus.close();
 * }</pre>
 */
public class MessageEventBus implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(MessageEventBus.class);

    public static final String EVENT_BUS_INITIALIZED = "n8n.core.eventBusInitialized";

    private final BrokerMetrics metrics;
    private final Tracer tracer;
    private final Set<String> pendingConfirmation = ConcurrentHashMap.newKeySet();
    private volatile List<MessageEventBusWriter> writers = List.of();
    private volatile List<MessageEventBusForwarder> forwarders = List.of();
    private volatile boolean initialized;

    public MessageEventBus(OpenTelemetry ot) {
        this.metrics = new BrokerMetrics(ot.getMeter("event_bus"));
        this.tracer = ot.getTracer("event_bus");
    }

    /**
     * Configures the bus, replacing any earlier configuration, publishes the
     * startup event and forwards every message still unsent from earlier
     * runs, oldest first. Writers and forwarders of an earlier configuration
     * that are not passed again are closed.
     *
     * @param writers    Log stores every message is persisted to
     * @param forwarders Delivery strategies every message is handed to
     * @throws com.p14n.eventbus.errors.WriteException if the startup event
     *                                                 could not be persisted
     */
    public synchronized void initialize(List<? extends MessageEventBusWriter> writers,
            List<? extends MessageEventBusForwarder> forwarders) {
        if (writers == null || forwarders == null) {
            throw new IllegalArgumentException("Writers and forwarders cannot be null");
        }
        List<MessageEventBusWriter> previousWriters = this.writers;
        List<MessageEventBusForwarder> previousForwarders = this.forwarders;
        this.writers = List.copyOf(writers);
        this.forwarders = List.copyOf(forwarders);
        if (initialized) {
            logger.atWarn().log("Event bus initialized again without close, releasing replaced writers and forwarders");
            closeWriters(previousWriters, this.writers);
            closeForwarders(previousForwarders, this.forwarders);
        }
        this.pendingConfirmation.clear();
        this.initialized = true;

        publish(EventMessage.create(EVENT_BUS_INITIALIZED, EventMessageLevel.DEBUG, EventMessageSeverity.NORMAL,
                null));
        replayUnsent();
        logger.atInfo().log("Event bus initialized with {} writers and {} forwarders",
                this.writers.size(), this.forwarders.size());
    }

    /**
     * Persists a message to every writer, then forwards it. The message is
     * frozen first and cannot be changed afterwards.
     *
     * @param message The message to publish
     * @throws com.p14n.eventbus.errors.WriteException if a writer could not
     *                                                 persist the message;
     *                                                 the message was not
     *                                                 forwarded
     * @throws IllegalStateException                   if the bus is not
     *                                                 initialized
     */
    public void publish(EventMessage message) {
        if (message == null) {
            throw new IllegalArgumentException("Message cannot be null");
        }
        checkInitialized();
        message.freeze();
        processWithTelemetry(tracer, message, "event_bus_publish", () -> {
            for (MessageEventBusWriter writer : writers) {
                writer.putMessage(message);
            }
            logger.atDebug().log("Message {} {} written", message.eventName(), message.id());
            pendingConfirmation.add(message.key());
            metrics.recordPublished(message.group().orElse(""));
            forwardMessage(message);
            return null;
        });
    }

    /**
     * Moves a message to the {@code sent} partition of every writer.
     * Confirming an unknown or already confirmed message does nothing.
     *
     * @throws com.p14n.eventbus.errors.WriteException if a writer could not
     *                                                 complete the move
     */
    public void confirmSent(EventMessage message) {
        checkInitialized();
        for (MessageEventBusWriter writer : writers) {
            writer.confirmMessageSent(message.key());
        }
        pendingConfirmation.remove(message.key());
        metrics.recordConfirmed();
        logger.atDebug().log("Message {} confirmed", message.key());
    }

    /**
     * Lists messages from every writer. Messages held by more than one writer
     * appear once.
     *
     * @param returnUnsent true for unconfirmed messages, false for confirmed
     * @return the messages in key order
     */
    public List<EventMessage> getEvents(boolean returnUnsent) {
        checkInitialized();
        List<MessageEventBusWriter> current = writers;
        if (current.isEmpty()) {
            return List.of();
        }
        if (current.size() == 1) {
            return query(current.get(0), returnUnsent);
        }
        Map<String, EventMessage> byId = new LinkedHashMap<>();
        for (MessageEventBusWriter writer : current) {
            for (EventMessage message : query(writer, returnUnsent)) {
                byId.putIfAbsent(message.id(), message);
            }
        }
        List<EventMessage> union = new ArrayList<>(byId.values());
        union.sort(Comparator.comparing(EventMessage::key));
        return union;
    }

    public List<EventMessage> getEventsSent() {
        List<EventMessage> sent = getEvents(false);
        logger.atDebug().log("Sent messages: {}", sent.size());
        return sent;
    }

    public List<EventMessage> getEventsUnsent() {
        List<EventMessage> unsent = getEvents(true);
        logger.atDebug().log("Unsent messages: {}", unsent.size());
        return unsent;
    }

    /**
     * @return keys published by this bus since it was initialized that no
     *         forwarder has accepted yet
     */
    public Set<String> getPendingConfirmation() {
        return Set.copyOf(pendingConfirmation);
    }

    public boolean isInitialized() {
        return initialized;
    }

    /**
     * Closes every writer and forwarder. Messages still waiting for
     * confirmation stay in the {@code unsent} partition and are replayed on the
     * next start.
     */
    @Override
    public synchronized void close() {
        if (!initialized) {
            return;
        }
        initialized = false;
        closeWriters(writers, List.of());
        closeForwarders(forwarders, List.of());
        if (!pendingConfirmation.isEmpty()) {
            logger.atWarn().log("Event bus closed with {} messages not confirmed as delivered",
                    pendingConfirmation.size());
        }
        writers = List.of();
        forwarders = List.of();
        logger.atInfo().log("Event bus closed");
    }

    private static void closeWriters(List<MessageEventBusWriter> closing, List<MessageEventBusWriter> kept) {
        for (MessageEventBusWriter writer : closing) {
            if (containsInstance(kept, writer)) {
                continue;
            }
            try {
                writer.close();
            } catch (RuntimeException e) {
                logger.atError().setCause(e).log("Error closing writer {}", writer.getClass().getSimpleName());
            }
        }
    }

    private static void closeForwarders(List<MessageEventBusForwarder> closing, List<MessageEventBusForwarder> kept) {
        for (MessageEventBusForwarder forwarder : closing) {
            if (containsInstance(kept, forwarder)) {
                continue;
            }
            try {
                forwarder.close();
            } catch (RuntimeException e) {
                logger.atError().setCause(e).log("Error closing forwarder {}", forwarder.getClass().getSimpleName());
            }
        }
    }

    private static boolean containsInstance(List<?> list, Object candidate) {
        for (Object item : list) {
            if (item == candidate) {
                return true;
            }
        }
        return false;
    }

    private void replayUnsent() {
        processWithTelemetry(tracer, "event_bus_replay", () -> {
            Set<String> recovered = new TreeSet<>();
            for (MessageEventBusWriter writer : writers) {
                recovered.addAll(writer.recoverUnsentMessages());
            }
            recovered.removeAll(pendingConfirmation);
            if (!recovered.isEmpty()) {
                logger.atWarn().log("Recovered {} unsent event messages from a previous run: {}",
                        recovered.size(), recovered);
            }
            List<EventMessage> unsent = getEventsUnsent();
            for (EventMessage message : unsent) {
                message.freeze();
                pendingConfirmation.add(message.key());
                forwardMessage(message);
            }
            return null;
        });
    }

    private void forwardMessage(EventMessage message) {
        boolean accepted = false;
        for (MessageEventBusForwarder forwarder : forwarders) {
            try {
                if (forwarder.forward(message)) {
                    accepted = true;
                }
                logger.atDebug().log("Message {} {} forwarded by {}", message.eventName(), message.id(),
                        forwarder.getClass().getSimpleName());
            } catch (RuntimeException e) {
                logger.atError().setCause(e).log("Forwarder {} failed on message {}",
                        forwarder.getClass().getSimpleName(), message.key());
            }
        }
        if (accepted) {
            confirmSent(message);
        } else {
            logger.atDebug().log("No subscribers for message {}, left unsent", message.key());
        }
    }

    private static List<EventMessage> query(MessageEventBusWriter writer, boolean returnUnsent) {
        return returnUnsent ? writer.getMessagesUnsent() : writer.getMessagesSent();
    }

    private void checkInitialized() {
        if (!initialized) {
            throw new IllegalStateException("Event bus is not initialized");
        }
    }
}
