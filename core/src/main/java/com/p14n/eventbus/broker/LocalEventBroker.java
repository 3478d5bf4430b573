package com.p14n.eventbus.broker;

import com.p14n.eventbus.data.EventMessage;
import com.p14n.eventbus.data.MessageEventSubscriptionSet;
import com.p14n.eventbus.errors.DispatchException;
import com.p14n.eventbus.errors.SpawnException;
import com.p14n.eventbus.receiver.MessageEventSubscriptionReceiver;
import com.p14n.eventbus.receiver.ReceiverWorker;
import com.p14n.eventbus.telemetry.BrokerMetrics;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Tracer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

import static com.p14n.eventbus.telemetry.OpenTelemetryFunctions.processWithTelemetry;

/**
 * In-process fan-out router. Keeps a table of named receivers, each with its
 * own subscription sets, and hands every message to the workers of the
 * receivers whose sets match it.
 *
 * <p>
 * Dispatch holds the read lock on the receiver table; every change to the
 * table holds the write lock, so a receiver cannot be removed in the middle
 * of a dispatch. Hand-off to a worker only queues the message, so a slow
 * receiver does not hold up the others.
 * </p>
 */
public class LocalEventBroker implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(LocalEventBroker.class);

    private record Registration(MessageEventSubscriptionReceiver receiver,
            List<MessageEventSubscriptionSet> subscriptionSets) {
    }

    private final Map<String, Registration> receivers = new LinkedHashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final BrokerMetrics metrics;
    private final Tracer tracer;

    public LocalEventBroker(OpenTelemetry ot) {
        this.metrics = new BrokerMetrics(ot.getMeter("local_event_broker"));
        this.tracer = ot.getTracer("local_event_broker");
    }

    public void addReceiver(MessageEventSubscriptionReceiver receiver, MessageEventSubscriptionSet... subscriptionSets) {
        addReceiver(receiver, Arrays.asList(subscriptionSets));
    }

    /**
     * Registers a receiver and starts its worker. A receiver already
     * registered under the same name is terminated and replaced, along with
     * its subscription sets.
     *
     * <p>
     * If the worker cannot be started the registration is kept without a live
     * worker, so the receiver is skipped by dispatch until it is added again.
     * </p>
     *
     * @param receiver         The receiver to register
     * @param subscriptionSets Filters deciding which messages it gets
     */
    public void addReceiver(MessageEventSubscriptionReceiver receiver,
            Collection<MessageEventSubscriptionSet> subscriptionSets) {
        if (receiver == null) {
            throw new IllegalArgumentException("Receiver cannot be null");
        }
        String name = receiver.getName();
        lock.writeLock().lock();
        try {
            Registration existing = receivers.remove(name);
            if (existing != null) {
                existing.receiver().terminateThread();
                metrics.recordReceiverRemoved(name);
                logger.atDebug().log("Replacing receiver {}", name);
            }
            try {
                receiver.launchThread();
            } catch (SpawnException e) {
                logger.atError().setCause(e).log("Failed to start worker of receiver {}", name);
            }
            receivers.put(name, new Registration(receiver, merge(List.of(), subscriptionSets)));
            metrics.recordReceiverAdded(name);
            logger.atInfo().log("Receiver {} registered", name);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Terminates a receiver's worker and removes its registration.
     *
     * @return true if a receiver with that name was registered
     */
    public boolean removeReceiver(String receiverName) {
        lock.writeLock().lock();
        try {
            Registration removed = receivers.remove(receiverName);
            if (removed == null) {
                return false;
            }
            removed.receiver().terminateThread();
            metrics.recordReceiverRemoved(receiverName);
            logger.atInfo().log("Receiver {} removed", receiverName);
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Merges subscription sets into a receiver's list. A set with the same
     * name as one already present replaces it. Unknown receivers are ignored.
     */
    public void addSubscriptionSets(String receiverName, Collection<MessageEventSubscriptionSet> subscriptionSets) {
        lock.writeLock().lock();
        try {
            Registration registration = receivers.get(receiverName);
            if (registration == null) {
                logger.atDebug().log("No receiver {} to add subscription sets to", receiverName);
                return;
            }
            receivers.put(receiverName, new Registration(registration.receiver(),
                    merge(registration.subscriptionSets(), subscriptionSets)));
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Removes every subscription set with the given name, from every receiver.
     *
     * @return the number of sets removed
     */
    public int removeSubscriptionSet(String subscriptionSetName) {
        lock.writeLock().lock();
        try {
            int removed = 0;
            for (Map.Entry<String, Registration> entry : receivers.entrySet()) {
                List<MessageEventSubscriptionSet> remaining = new ArrayList<>();
                for (MessageEventSubscriptionSet set : entry.getValue().subscriptionSets()) {
                    if (set.name().equals(subscriptionSetName)) {
                        removed++;
                    } else {
                        remaining.add(set);
                    }
                }
                entry.setValue(new Registration(entry.getValue().receiver(), List.copyOf(remaining)));
            }
            return removed;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Hands a message to every running receiver with a matching subscription
     * set.
     *
     * @param message The message to route
     * @return how many running receivers were considered and how many got the
     *         message
     */
    public DeliveryResult addMessage(EventMessage message) {
        if (message == null) {
            throw new IllegalArgumentException("Message cannot be null");
        }
        return processWithTelemetry(tracer, message, "local_broker_dispatch", () -> {
            lock.readLock().lock();
            try {
                return dispatch(message);
            } finally {
                lock.readLock().unlock();
            }
        });
    }

    private DeliveryResult dispatch(EventMessage message) {
        int processed = 0;
        int sent = 0;
        String serialized = null;
        for (Map.Entry<String, Registration> entry : receivers.entrySet()) {
            String name = entry.getKey();
            Optional<ReceiverWorker> worker = entry.getValue().receiver().getWorker();
            if (worker.isEmpty()) {
                continue;
            }
            processed++;
            if (!matchesAny(entry.getValue().subscriptionSets(), message)) {
                continue;
            }
            if (serialized == null) {
                serialized = message.toJson();
            }
            try {
                worker.get().receive(serialized);
                sent++;
                metrics.recordDelivered(name);
            } catch (DispatchException e) {
                metrics.recordDispatchFailed(name);
                logger.atWarn().setCause(e).log("Could not hand {} to receiver {}", message.key(), name);
            }
        }
        logger.atDebug().log("Message {} {} processed by {} receivers, sent to {}",
                message.eventName(), message.id(), processed, sent);
        return new DeliveryResult(processed, sent);
    }

    private static boolean matchesAny(List<MessageEventSubscriptionSet> subscriptionSets, EventMessage message) {
        for (MessageEventSubscriptionSet set : subscriptionSets) {
            if (set.matches(message)) {
                return true;
            }
        }
        return false;
    }

    public void terminateReceiver(String receiverName) {
        lock.writeLock().lock();
        try {
            Registration registration = receivers.get(receiverName);
            if (registration != null) {
                registration.receiver().terminateThread();
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Terminates the worker of every registered receiver. Registrations are
     * kept.
     */
    public void terminateReceivers() {
        lock.writeLock().lock();
        try {
            for (Registration registration : receivers.values()) {
                registration.receiver().terminateThread();
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    public List<String> getReceiverNames() {
        lock.readLock().lock();
        try {
            return List.copyOf(receivers.keySet());
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<MessageEventSubscriptionSet> getSubscriptionSets(String receiverName) {
        lock.readLock().lock();
        try {
            Registration registration = receivers.get(receiverName);
            return registration == null ? Collections.emptyList() : registration.subscriptionSets();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Terminates every worker and clears the receiver table.
     */
    @Override
    public void close() {
        lock.writeLock().lock();
        try {
            for (Map.Entry<String, Registration> entry : receivers.entrySet()) {
                entry.getValue().receiver().terminateThread();
                metrics.recordReceiverRemoved(entry.getKey());
            }
            receivers.clear();
            logger.atInfo().log("Local event broker closed");
        } finally {
            lock.writeLock().unlock();
        }
    }

    private static List<MessageEventSubscriptionSet> merge(List<MessageEventSubscriptionSet> existing,
            Collection<MessageEventSubscriptionSet> added) {
        Map<String, MessageEventSubscriptionSet> byName = new LinkedHashMap<>();
        for (MessageEventSubscriptionSet set : existing) {
            byName.put(set.name(), set);
        }
        if (added != null) {
            for (MessageEventSubscriptionSet set : added) {
                if (set != null) {
                    byName.put(set.name(), set);
                }
            }
        }
        return List.copyOf(byName.values());
    }
}
