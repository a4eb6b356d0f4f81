package com.p14n.eventrelay.broker;

import java.util.concurrent.*;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.util.concurrent.ThreadFactoryBuilder;

/**
 * Default implementation of {@link AsyncExecutor}: a scheduled thread pool for
 * timers and a single named worker thread for submitted tasks.
 *
 * <p>
 * {@link #close()} lets the worker finish the tasks already queued, waiting
 * up to the configured grace period, before forcing a shutdown.
 * </p>
 */
public class DefaultExecutor implements AsyncExecutor {

        private static final Logger logger = LoggerFactory.getLogger(DefaultExecutor.class);

        private final ScheduledExecutorService se;
        private final ExecutorService es;
        private final long shutdownGraceMillis;

        /**
         * Creates a new executor with a scheduled thread pool and one worker.
         *
         * @param scheduledSize the size of the scheduled thread pool
         */
        public DefaultExecutor(int scheduledSize) {
                this(scheduledSize, 5000);
        }

        /**
         * Creates a new executor with a scheduled thread pool and one worker.
         *
         * @param scheduledSize       the size of the scheduled thread pool
         * @param shutdownGraceMillis how long close waits for queued tasks
         */
        public DefaultExecutor(int scheduledSize, long shutdownGraceMillis) {
                this.se = createScheduledExecutorService(scheduledSize);
                this.es = createSerialExecutorService();
                this.shutdownGraceMillis = shutdownGraceMillis;
        }

        protected ThreadFactory createNamedFactory(String nameFormat) {
                return new ThreadFactoryBuilder()
                                .setNameFormat(nameFormat)
                                .setDaemon(true)
                                .build();
        }

        /**
         * Creates the single worker that runs submitted tasks in order.
         *
         * @return a single-threaded executor service
         */
        protected ExecutorService createSerialExecutorService() {
                return Executors.newSingleThreadExecutor(createNamedFactory("event-relay-pipeline-%d"));
        }

        /**
         * Creates a scheduled thread pool with named threads.
         *
         * @param size the number of threads in the pool
         * @return a scheduled thread pool executor service
         */
        protected ScheduledExecutorService createScheduledExecutorService(int size) {
                return Executors.newScheduledThreadPool(size, createNamedFactory("event-relay-timer-%d"));
        }

        @Override
        public ScheduledFuture<?> scheduleAtFixedRate(Runnable command, long initialDelay, long period, TimeUnit unit) {
                return se.scheduleAtFixedRate(command, initialDelay, period, unit);
        }

        @Override
        public <T> Future<T> submit(Callable<T> task) {
                return es.submit(task);
        }

        @Override
        public void close() {
                se.shutdownNow();
                es.shutdown();
                try {
                        if (!es.awaitTermination(shutdownGraceMillis, TimeUnit.MILLISECONDS)) {
                                logger.atWarn()
                                                .addArgument(shutdownGraceMillis)
                                                .log("Worker did not finish within {}ms, forcing shutdown");
                                es.shutdownNow();
                        }
                } catch (InterruptedException e) {
                        Thread.currentThread().interrupt();
                        es.shutdownNow();
                }
        }
}
