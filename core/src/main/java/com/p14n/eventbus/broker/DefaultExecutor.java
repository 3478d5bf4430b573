package com.p14n.eventbus.broker;

import java.util.List;
import java.util.concurrent.*;

import com.google.common.util.concurrent.ThreadFactoryBuilder;

/**
 * Default implementation of {@link AsyncExecutor} backed by a scheduled thread
 * pool with named daemon threads, so a forgotten executor never keeps the
 * host process alive.
 */
public class DefaultExecutor implements AsyncExecutor {

        private final ScheduledExecutorService se;

        /**
         * Creates a new executor with a scheduled thread pool.
         *
         * @param scheduledSize the size of the scheduled thread pool
         */
        public DefaultExecutor(int scheduledSize) {
                this.se = createScheduledExecutorService(scheduledSize);
        }

        /**
         * Creates a scheduled thread pool with named threads.
         *
         * @param size the number of threads in the pool
         * @return a scheduled thread pool executor service
         */
        protected ScheduledExecutorService createScheduledExecutorService(int size) {
                return Executors.newScheduledThreadPool(size,
                                new ThreadFactoryBuilder().setNameFormat("eventbus-scheduled-%d").setDaemon(true)
                                                .build());
        }

        @Override
        public ScheduledFuture<?> scheduleAtFixedRate(Runnable command, long initialDelay, long period, TimeUnit unit) {
                return se.scheduleAtFixedRate(command, initialDelay, period, unit);
        }

        @Override
        public List<Runnable> shutdownNow() {
                return se.shutdownNow();
        }

        @Override
        public void close() {
                shutdownNow();
        }
}
