package com.p14n.fanout.broker;

import java.util.concurrent.Callable;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Runs delivery units and periodic broker housekeeping off the publishing
 * thread. Closing the executor discards units that have not started.
 */
public interface AsyncExecutor extends AutoCloseable {

    /**
     * Schedules broker housekeeping, such as the retention sweep, at a fixed
     * rate.
     *
     * @param command      the task to run
     * @param initialDelay delay before the first run
     * @param period       period between runs
     * @param unit         unit of {@code initialDelay} and {@code period}
     * @return a future that cancels the schedule
     */
    ScheduledFuture<?> scheduleAtFixedRate(Runnable command,
            long initialDelay,
            long period,
            TimeUnit unit);

    /**
     * @throws java.util.concurrent.RejectedExecutionException if the executor
     *                                                         no longer accepts
     *                                                         tasks
     */
    <T> Future<T> submit(Callable<T> task);

    /**
     * Runs one delivery unit. Nobody waits on the unit, so it must handle its
     * own failures.
     *
     * @param unit the unit to run
     * @return a future completed when the unit has run
     * @throws java.util.concurrent.RejectedExecutionException if the executor
     *                                                         no longer accepts
     *                                                         tasks
     */
    default Future<?> execute(Runnable unit) {
        return submit(() -> {
            unit.run();
            return null;
        });
    }

    @Override
    void close();
}
