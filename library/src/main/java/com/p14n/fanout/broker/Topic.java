package com.p14n.fanout.broker;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.RejectedExecutionException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.p14n.fanout.data.Message;
import com.p14n.fanout.telemetry.BrokerMetrics;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Tracer;

import static com.p14n.fanout.telemetry.OpenTelemetryFunctions.processWithTelemetry;

/**
 * A named channel with a bounded FIFO buffer and a set of subscribers.
 *
 * <p>
 * The buffer only accounts for capacity: once it holds {@code capacity}
 * messages every further message is dropped until the retention sweep evicts
 * old ones. Delivery never removes messages from the buffer.
 * </p>
 *
 * <p>
 * The buffer and the subscriber list are guarded by separate locks, and no
 * lock is held while a consumer handles a message.
 * </p>
 */
public class Topic {
    private static final Logger logger = LoggerFactory.getLogger(Topic.class);

    private final String name;
    private final int capacity;

    private final Object bufferLock = new Object();
    private final Deque<Message> buffer = new ArrayDeque<>();
    private long messageCount;
    private long droppedCount;

    private final Object subscriberLock = new Object();
    private final List<Consumer> subscribers = new ArrayList<>();

    private final Dispatcher dispatcher;
    private final BrokerMetrics metrics;
    private final OpenTelemetry openTelemetry;
    private final Tracer tracer;

    public Topic(String name, int capacity, Dispatcher dispatcher) {
        this(name, capacity, dispatcher, OpenTelemetry.noop());
    }

    public Topic(String name, int capacity, Dispatcher dispatcher, OpenTelemetry ot) {
        this(name, capacity, dispatcher, ot, new BrokerMetrics(ot.getMeter("fanout")));
    }

    Topic(String name, int capacity, Dispatcher dispatcher, OpenTelemetry ot, BrokerMetrics metrics) {
        if (name == null || name.trim().isEmpty()) {
            throw new IllegalArgumentException("Topic name cannot be null or empty");
        }
        if (capacity <= 0) {
            throw new IllegalArgumentException("Topic capacity must be positive, was " + capacity);
        }
        if (dispatcher == null) {
            throw new IllegalArgumentException("Dispatcher cannot be null");
        }
        this.name = name;
        this.capacity = capacity;
        this.dispatcher = dispatcher;
        this.openTelemetry = ot;
        this.tracer = ot.getTracer("fanout");
        this.metrics = metrics;
    }

    /**
     * Appends the message to the buffer if there is room.
     *
     * @param message the message to admit
     * @return true if the message was accepted, false if the buffer was full and
     *         the message was dropped
     */
    public boolean enqueue(Message message) {
        boolean accepted;
        synchronized (bufferLock) {
            if (buffer.size() >= capacity) {
                droppedCount++;
                accepted = false;
            } else {
                buffer.addLast(message);
                messageCount++;
                accepted = true;
            }
        }
        if (accepted) {
            metrics.recordPublished(name);
        } else {
            metrics.recordDropped(name);
            logger.atDebug()
                    .addArgument(name)
                    .addArgument(message::id)
                    .log("Topic {} is full, dropping message {}");
        }
        return accepted;
    }

    /**
     * Fans the message out to the current subscribers. Stopped consumers are
     * pruned instead of receiving it. Returns once every delivery has been
     * handed to the dispatcher; handlers may still be running.
     *
     * @param message an accepted message
     */
    public void deliver(Message message) {
        List<Consumer> snapshot;
        synchronized (subscriberLock) {
            snapshot = new ArrayList<>(subscribers);
        }
        for (Consumer consumer : snapshot) {
            if (!consumer.isActive()) {
                if (unsubscribe(consumer)) {
                    logger.atDebug()
                            .addArgument(consumer::getId)
                            .addArgument(name)
                            .log("Pruned inactive consumer {} from topic {}");
                }
                continue;
            }
            try {
                dispatcher.dispatch(consumer, () -> deliverTo(consumer, message));
            } catch (RejectedExecutionException e) {
                metrics.recordDeliveryFailure(name);
                logger.atWarn()
                        .setCause(e)
                        .addArgument(message::id)
                        .addArgument(consumer::getId)
                        .log("Could not dispatch message {} to consumer {}");
            }
        }
    }

    private void deliverTo(Consumer consumer, Message message) {
        processWithTelemetry(openTelemetry, tracer, message, "deliver_message", () -> {
            switch (consumer.onMessage(message)) {
                case HANDLED -> metrics.recordDelivered(name);
                case FAILED -> metrics.recordDeliveryFailure(name);
                case INACTIVE -> logger.atTrace()
                        .addArgument(consumer::getId)
                        .log("Consumer {} stopped before delivery");
            }
            return null;
        });
    }

    /**
     * Adds the consumer to this topic. Calling it again for the same consumer
     * changes nothing.
     *
     * @param consumer the consumer to add
     * @return true if the consumer was not subscribed before
     */
    public boolean subscribe(Consumer consumer) {
        boolean added;
        synchronized (subscriberLock) {
            added = !subscribers.contains(consumer);
            if (added) {
                subscribers.add(consumer);
            }
            consumer.addSubscription(this);
        }
        if (added) {
            metrics.recordSubscriberAdded(name);
        }
        return added;
    }

    /**
     * Removes the consumer from this topic and this topic from the consumer.
     *
     * @param consumer the consumer to remove
     * @return true if the consumer was subscribed
     */
    public boolean unsubscribe(Consumer consumer) {
        boolean removed;
        synchronized (subscriberLock) {
            removed = subscribers.remove(consumer);
            if (removed) {
                consumer.removeSubscription(this);
            }
        }
        if (removed) {
            dispatcher.release(consumer);
            metrics.recordSubscriberRemoved(name);
        }
        return removed;
    }

    /**
     * Evicts buffered messages created before the cutoff, oldest first.
     *
     * @param cutoff messages older than this are evicted
     * @return the number of evicted messages
     */
    public int evictOlderThan(Instant cutoff) {
        int evicted = 0;
        synchronized (bufferLock) {
            while (!buffer.isEmpty() && buffer.peekFirst().createdAt().isBefore(cutoff)) {
                buffer.pollFirst();
                evicted++;
            }
        }
        return evicted;
    }

    public TopicStats getStats() {
        long accepted;
        long dropped;
        int buffered;
        synchronized (bufferLock) {
            accepted = messageCount;
            dropped = droppedCount;
            buffered = buffer.size();
        }
        int subscriberCount;
        synchronized (subscriberLock) {
            subscriberCount = subscribers.size();
        }
        return new TopicStats(name, accepted, buffered, subscriberCount, capacity, dropped);
    }

    /**
     * @return a copy of the buffered messages, oldest first
     */
    public List<Message> bufferedMessages() {
        synchronized (bufferLock) {
            return List.copyOf(buffer);
        }
    }

    /**
     * @return a copy of the subscriber list in subscription order
     */
    public List<Consumer> subscribers() {
        synchronized (subscriberLock) {
            return List.copyOf(subscribers);
        }
    }

    public String getName() {
        return name;
    }

    public int getCapacity() {
        return capacity;
    }
}
