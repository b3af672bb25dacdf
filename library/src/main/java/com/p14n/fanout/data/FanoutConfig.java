package com.p14n.fanout.data;

import java.time.Duration;

/**
 * Configuration interface for the broker.
 * Defines the settings that shape topic buffers, delivery and the retention
 * sweep.
 */
public interface FanoutConfig {

    /**
     * Gets the capacity given to topics created without an explicit one.
     *
     * @return the default topic capacity, always positive
     */
    int defaultCapacity();

    /**
     * Gets the largest payload accepted by publish.
     *
     * @return the maximum payload size in bytes
     */
    int maxMessageSize();

    /**
     * Gets how long a message may stay in a topic buffer before the retention
     * sweep evicts it. {@link Duration#ZERO} disables the sweep.
     *
     * @return the retention window
     */
    Duration retention();

    /**
     * Gets the period between two retention sweeps.
     *
     * @return the sweep interval
     */
    Duration sweepInterval();

    /**
     * Gets the number of delivery threads. Zero means an unbounded cached pool,
     * so a hanging handler never starves other deliveries.
     *
     * @return the delivery thread count
     */
    default int deliveryThreads() {
        return 0;
    }

    /**
     * Whether deliveries for one consumer on one topic run one at a time in
     * publish order.
     *
     * @return true for ordered delivery
     */
    default boolean orderedDelivery() {
        return false;
    }

    /**
     * Gets the size of the scheduled pool that runs the retention sweep.
     *
     * @return the scheduled pool size
     */
    default int scheduledThreads() {
        return 1;
    }
}
