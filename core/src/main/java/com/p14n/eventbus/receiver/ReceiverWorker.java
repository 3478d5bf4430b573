package com.p14n.eventbus.receiver;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.p14n.eventbus.errors.DispatchException;
import com.p14n.eventbus.errors.SpawnException;

import io.opentelemetry.context.Context;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;

/**
 * Handle to a running worker: a dedicated thread with its own queue and its
 * own {@link EventSubscriberWorker} instance.
 *
 * <p>
 * Calls are one-way. Each call is queued and runs after every earlier call
 * to the same worker, so one receiver sees messages in the order they were
 * sent. A call that throws is logged on the worker thread and does not stop
 * the worker. {@link #terminate()} discards queued calls and interrupts the
 * running one.
 * </p>
 */
public final class ReceiverWorker {
    private static final Logger logger = LoggerFactory.getLogger(ReceiverWorker.class);

    private final String receiverName;
    private final ExecutorService executor;
    private final EventSubscriberWorker worker;
    private final AtomicBoolean terminated = new AtomicBoolean(false);

    private ReceiverWorker(String receiverName, ExecutorService executor, EventSubscriberWorker worker) {
        this.receiverName = receiverName;
        this.executor = executor;
        this.worker = worker;
    }

    /**
     * Starts a worker thread and creates the worker instance on it.
     *
     * @param receiverName Name of the owning receiver, used for the thread name
     * @param entryPoint   Creates the worker instance
     * @return a handle to the running worker
     * @throws SpawnException if the worker instance could not be created
     */
    public static ReceiverWorker spawn(String receiverName, Supplier<? extends EventSubscriberWorker> entryPoint) {
        ExecutorService executor = Executors.newSingleThreadExecutor(new ThreadFactoryBuilder()
                .setNameFormat("event-receiver-" + receiverName.replace("%", "%%") + "-%d")
                .setDaemon(true)
                .build());
        Callable<EventSubscriberWorker> create = entryPoint::get;
        try {
            EventSubscriberWorker worker = executor.submit(create).get();
            if (worker == null) {
                throw new SpawnException("Worker entry point of receiver " + receiverName + " returned null", null);
            }
            logger.atDebug().log("Spawned worker for receiver {}", receiverName);
            return new ReceiverWorker(receiverName, executor, worker);
        } catch (ExecutionException e) {
            executor.shutdownNow();
            throw new SpawnException("Worker of receiver " + receiverName + " failed to start", e.getCause());
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
            throw new SpawnException("Interrupted while starting worker of receiver " + receiverName, e);
        } catch (RuntimeException e) {
            executor.shutdownNow();
            throw e;
        }
    }

    /**
     * Queues a message for the worker.
     *
     * @param serializedMessage The message as JSON
     * @return completes when the worker has handled the message
     * @throws DispatchException if the worker is no longer accepting calls
     */
    public CompletableFuture<Void> receive(String serializedMessage) {
        return call("receive", () -> worker.receive(serializedMessage));
    }

    /**
     * Queues a control message for the worker.
     *
     * @return completes when the worker has applied the control message
     * @throws DispatchException if the worker is no longer accepting calls
     */
    public CompletableFuture<Void> configure(String key, Object value) {
        return call("configure " + key, () -> worker.configure(key, value));
    }

    /**
     * Stops the worker immediately. Safe to call more than once.
     */
    public void terminate() {
        if (terminated.compareAndSet(false, true)) {
            int dropped = executor.shutdownNow().size();
            logger.atDebug().log("Terminated worker for receiver {}, {} queued calls dropped", receiverName, dropped);
        }
    }

    public boolean isAlive() {
        return !terminated.get() && !executor.isShutdown();
    }

    private CompletableFuture<Void> call(String operation, Runnable action) {
        if (terminated.get()) {
            throw new DispatchException(receiverName,
                    "Worker of receiver " + receiverName + " is terminated", null);
        }
        Runnable task = Context.current().wrap(() -> {
            try {
                action.run();
            } catch (RuntimeException e) {
                logger.atError().setCause(e).log("Receiver {} failed on {}", receiverName, operation);
                throw e;
            }
        });
        try {
            return CompletableFuture.runAsync(task, executor);
        } catch (RejectedExecutionException e) {
            throw new DispatchException(receiverName,
                    "Worker of receiver " + receiverName + " rejected " + operation, e);
        }
    }
}
