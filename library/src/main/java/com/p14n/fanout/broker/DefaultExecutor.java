package com.p14n.fanout.broker;

import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.util.concurrent.ThreadFactoryBuilder;

/**
 * Default implementation of {@link AsyncExecutor} backed by JDK thread pools.
 *
 * <p>
 * Delivery runs either on a cached pool, where every blocked handler holds
 * only its own thread, or on a fixed-size pool. A separate scheduled pool runs
 * periodic work such as the retention sweep. All threads are named daemon
 * threads.
 * </p>
 */
public class DefaultExecutor implements AsyncExecutor {
        private static final Logger logger = LoggerFactory.getLogger(DefaultExecutor.class);

        private final ScheduledExecutorService se;
        private final ExecutorService es;

        /**
         * Creates a new executor with a scheduled thread pool and a cached
         * delivery pool.
         *
         * @param scheduledSize the size of the scheduled thread pool
         */
        public DefaultExecutor(int scheduledSize) {
                this.se = createScheduledExecutorService(scheduledSize);
                this.es = createCachedExecutorService();
        }

        /**
         * Creates a new executor with both scheduled and fixed-size thread pools.
         *
         * @param scheduledSize the size of the scheduled thread pool
         * @param fixedSize     the size of the fixed delivery pool
         */
        public DefaultExecutor(int scheduledSize, int fixedSize) {
                this.se = createScheduledExecutorService(scheduledSize);
                this.es = createFixedExecutorService(fixedSize);
        }

        protected ExecutorService createFixedExecutorService(int size) {
                return Executors.newFixedThreadPool(size,
                                new ThreadFactoryBuilder().setNameFormat("fanout-fixed-%d").setDaemon(true).build());
        }

        protected ExecutorService createCachedExecutorService() {
                return Executors.newCachedThreadPool(
                                new ThreadFactoryBuilder().setNameFormat("fanout-delivery-%d").setDaemon(true).build());
        }

        protected ScheduledExecutorService createScheduledExecutorService(int size) {
                return Executors.newScheduledThreadPool(size,
                                new ThreadFactoryBuilder().setNameFormat("fanout-scheduled-%d").setDaemon(true).build());
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
                int discarded = es.shutdownNow().size() + se.shutdownNow().size();
                if (discarded > 0) {
                        logger.atDebug().addArgument(discarded).log("Discarded {} tasks on close");
                }
        }
}
