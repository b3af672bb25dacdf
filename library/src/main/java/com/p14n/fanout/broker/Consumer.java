package com.p14n.fanout.broker;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.p14n.fanout.data.Message;

/**
 * An addressable sink for messages. A consumer may be subscribed to several
 * topics at once; its state is safe to read from concurrent fan-outs and holds
 * no lock shared with any topic.
 *
 * <p>
 * {@link #stop()} is terminal: a stopped consumer never becomes active again
 * and is pruned from each topic the next time that topic delivers.
 * </p>
 */
public class Consumer {
    private static final Logger logger = LoggerFactory.getLogger(Consumer.class);

    /**
     * Result of handing one message to the consumer.
     */
    public enum Outcome {
        HANDLED,
        FAILED,
        INACTIVE
    }

    private final String id;
    private final MessageHandler handler;
    private final ConcurrentMap<String, Topic> subscribedTopics = new ConcurrentHashMap<>();
    private final AtomicBoolean active = new AtomicBoolean(true);

    public Consumer(String id, MessageHandler handler) {
        if (id == null || id.trim().isEmpty()) {
            throw new IllegalArgumentException("Consumer id cannot be null or empty");
        }
        if (handler == null) {
            throw new IllegalArgumentException("Handler cannot be null");
        }
        this.id = id;
        this.handler = handler;
    }

    /**
     * Passes the message to the handler unless the consumer has been stopped.
     * Failures raised by the handler are logged and reported to
     * {@link MessageHandler#onError(Message, Throwable)}; they never escape this
     * method.
     *
     * @param message the message to handle
     * @return what happened to the message
     */
    public Outcome onMessage(Message message) {
        if (!active.get()) {
            return Outcome.INACTIVE;
        }
        try {
            handler.handle(message);
            return Outcome.HANDLED;
        } catch (Throwable e) {
            logger.atWarn()
                    .setCause(e)
                    .addArgument(id)
                    .addArgument(message.id())
                    .addArgument(message.topic())
                    .log("Consumer {} failed to handle message {} on topic {}");
            try {
                handler.onError(message, e);
            } catch (Throwable onErrorFailure) {
                logger.atWarn()
                        .setCause(onErrorFailure)
                        .addArgument(id)
                        .log("Error callback of consumer {} failed");
            }
            return Outcome.FAILED;
        }
    }

    /**
     * Deactivates the consumer permanently.
     */
    public void stop() {
        if (active.compareAndSet(true, false)) {
            logger.atInfo().addArgument(id).log("Consumer {} stopped");
        }
    }

    public boolean isActive() {
        return active.get();
    }

    public String getId() {
        return id;
    }

    /**
     * @return a snapshot of the names of the topics this consumer is subscribed
     *         to
     */
    public Set<String> getSubscribedTopics() {
        return Set.copyOf(subscribedTopics.keySet());
    }

    void addSubscription(Topic topic) {
        subscribedTopics.put(topic.getName(), topic);
    }

    // A deleted topic must not remove the entry of a recreated topic with the same name.
    void removeSubscription(Topic topic) {
        subscribedTopics.remove(topic.getName(), topic);
    }

    @Override
    public String toString() {
        return "Consumer[" + id + (active.get() ? "" : ", stopped") + "]";
    }
}
