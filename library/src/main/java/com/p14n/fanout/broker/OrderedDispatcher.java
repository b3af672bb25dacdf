package com.p14n.fanout.broker;

import java.util.Queue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the delivery units of each consumer one at a time, in the order they
 * were dispatched. Different consumers still run in parallel. One instance
 * serves a single topic, so ordering holds per (topic, consumer) pair.
 *
 * <p>
 * A consumer has at most one lane. Releasing a consumer whose lane still has
 * work only marks the lane; the drain retires it once it is idle. A consumer
 * that subscribes again before that keeps using the same lane.
 * </p>
 */
public class OrderedDispatcher implements Dispatcher {
    private static final Logger logger = LoggerFactory.getLogger(OrderedDispatcher.class);

    private final AsyncExecutor asyncExecutor;
    private final ConcurrentHashMap<Consumer, Lane> lanes = new ConcurrentHashMap<>();

    private static class Lane {
        final Queue<Runnable> pending = new ConcurrentLinkedQueue<>();
        final AtomicBoolean running = new AtomicBoolean(false);
        volatile boolean released;

        boolean idle() {
            return !running.get() && pending.isEmpty();
        }
    }

    public OrderedDispatcher(AsyncExecutor asyncExecutor) {
        this.asyncExecutor = asyncExecutor;
    }

    @Override
    public void dispatch(Consumer consumer, Runnable unit) {
        Lane lane = lanes.compute(consumer, (c, existing) -> {
            Lane l = existing == null ? new Lane() : existing;
            l.released = false;
            l.pending.add(unit);
            return l;
        });
        if (lane.running.compareAndSet(false, true)) {
            try {
                asyncExecutor.execute(() -> drain(consumer, lane));
            } catch (RejectedExecutionException e) {
                lane.pending.remove(unit);
                lane.running.set(false);
                throw e;
            }
        }
    }

    @Override
    public void release(Consumer consumer) {
        lanes.computeIfPresent(consumer, (c, lane) -> {
            if (lane.idle()) {
                return null;
            }
            lane.released = true;
            return lane;
        });
    }

    int laneCount() {
        return lanes.size();
    }

    private void drain(Consumer consumer, Lane lane) {
        do {
            Runnable next;
            while ((next = lane.pending.poll()) != null) {
                try {
                    next.run();
                } catch (RuntimeException | Error e) {
                    logger.atError()
                            .setCause(e)
                            .addArgument(consumer.getId())
                            .log("Delivery unit for consumer {} failed");
                }
            }
            lane.running.set(false);
        } while (!lane.pending.isEmpty() && lane.running.compareAndSet(false, true));
        lanes.computeIfPresent(consumer, (c, l) -> l == lane && l.released && l.idle() ? null : l);
    }
}
