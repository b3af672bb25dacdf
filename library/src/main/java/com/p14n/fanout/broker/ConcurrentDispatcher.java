package com.p14n.fanout.broker;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Submits every delivery unit to the executor on its own. Units for the same
 * consumer may run in parallel and finish in any order.
 */
public class ConcurrentDispatcher implements Dispatcher {
    private static final Logger logger = LoggerFactory.getLogger(ConcurrentDispatcher.class);

    private final AsyncExecutor asyncExecutor;

    public ConcurrentDispatcher(AsyncExecutor asyncExecutor) {
        this.asyncExecutor = asyncExecutor;
    }

    @Override
    public void dispatch(Consumer consumer, Runnable unit) {
        asyncExecutor.execute(() -> {
            try {
                unit.run();
            } catch (RuntimeException | Error e) {
                logger.atError()
                        .setCause(e)
                        .addArgument(consumer.getId())
                        .log("Delivery unit for consumer {} failed");
            }
        });
    }
}
