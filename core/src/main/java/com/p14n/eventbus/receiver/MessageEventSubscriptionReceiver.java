package com.p14n.eventbus.receiver;

import com.p14n.eventbus.errors.SpawnException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * A named subscriber registered with the local broker. The receiver itself
 * only holds the worker's entry point and lifecycle; messages are handled by
 * the {@link EventSubscriberWorker} running on the receiver's own thread.
 *
 * <p>
 * Subclasses that need the worker configured before first use override
 * {@link #launchThread()} and send their control messages after calling
 * {@code super.launchThread()}.
 * </p>
 */
public class MessageEventSubscriptionReceiver {
    private static final Logger logger = LoggerFactory.getLogger(MessageEventSubscriptionReceiver.class);

    private final String name;
    private final Supplier<? extends EventSubscriberWorker> workerEntryPoint;
    private ReceiverWorker worker;
    private ReceiverState state = ReceiverState.UNSPAWNED;

    public MessageEventSubscriptionReceiver(String name, Supplier<? extends EventSubscriberWorker> workerEntryPoint) {
        if (name == null || name.trim().isEmpty()) {
            throw new IllegalArgumentException("Receiver name cannot be null or empty");
        }
        if (workerEntryPoint == null) {
            throw new IllegalArgumentException("Worker entry point cannot be null");
        }
        this.name = name;
        this.workerEntryPoint = workerEntryPoint;
    }

    public String getName() {
        return name;
    }

    /**
     * Starts a fresh worker for this receiver. A worker still running from an
     * earlier launch is terminated first, so a failed relaunch leaves the
     * receiver {@link ReceiverState#TERMINATED}.
     *
     * @return the handle of the new worker
     * @throws SpawnException if the worker could not be started
     */
    public synchronized ReceiverWorker launchThread() {
        if (worker != null) {
            worker.terminate();
            worker = null;
            state = ReceiverState.TERMINATED;
        }
        worker = ReceiverWorker.spawn(name, workerEntryPoint);
        state = ReceiverState.RUNNING;
        logger.atDebug().log("Receiver {} launched", name);
        return worker;
    }

    /**
     * Stops the worker immediately. Does nothing if the receiver was never
     * launched or is already terminated.
     */
    public synchronized void terminateThread() {
        if (worker == null) {
            return;
        }
        worker.terminate();
        worker = null;
        state = ReceiverState.TERMINATED;
        logger.atDebug().log("Receiver {} terminated", name);
    }

    public synchronized boolean isRunning() {
        return state == ReceiverState.RUNNING && worker != null && worker.isAlive();
    }

    public synchronized ReceiverState getState() {
        return state;
    }

    /**
     * @return the live worker handle, empty before launch and after
     *         termination
     */
    public synchronized Optional<ReceiverWorker> getWorker() {
        return isRunning() ? Optional.of(worker) : Optional.empty();
    }

    /**
     * Sends a control message to the running worker.
     *
     * @throws IllegalStateException if the receiver is not running
     */
    public CompletableFuture<Void> configure(String key, Object value) {
        return getWorker()
                .orElseThrow(() -> new IllegalStateException("Receiver " + name + " is not running"))
                .configure(key, value);
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "[" + name + ", " + getState() + "]";
    }
}
