package com.p14n.fanout.broker;

/**
 * Decides how the delivery units of a topic are run.
 */
public interface Dispatcher {

    /**
     * Schedules one delivery unit for a consumer. Must not wait for the unit to
     * run.
     *
     * @param consumer the consumer the unit delivers to
     * @param unit     the delivery unit
     * @throws java.util.concurrent.RejectedExecutionException if the unit cannot
     *                                                         be scheduled
     */
    void dispatch(Consumer consumer, Runnable unit);

    /**
     * Drops any per-consumer state once the consumer leaves the topic.
     *
     * @param consumer the consumer that left
     */
    default void release(Consumer consumer) {
    }
}
