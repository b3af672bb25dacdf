package com.p14n.fanout.broker;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.p14n.fanout.data.ConfigData;
import com.p14n.fanout.data.FanoutConfig;
import com.p14n.fanout.data.Message;
import com.p14n.fanout.telemetry.BrokerMetrics;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Tracer;

import static com.p14n.fanout.telemetry.OpenTelemetryFunctions.processWithTelemetry;

/**
 * In-memory {@link MessageBroker}.
 *
 * <p>
 * Owns the topic registry and the registry of every consumer that subscribed
 * through it. Topics are created on first reference. The registries are
 * concurrent maps, independent of the locks inside each {@link Topic}, and are
 * never modified while a topic lock is held.
 * </p>
 *
 * <p>
 * Example usage:
 * </p>
 *
 * <pre>{@code
 * try (var broker = new DefaultMessageBroker()) {
 *     broker.subscribe(new Consumer("audit", m -> log(m.payloadAsString())), "orders");
 *     broker.publish("orders", "order 1001 created");
 * }
 * }</pre>
 */
public class DefaultMessageBroker implements MessageBroker {
    private static final Logger logger = LoggerFactory.getLogger(DefaultMessageBroker.class);

    private final ConcurrentHashMap<String, Topic> topics = new ConcurrentHashMap<>();
    private final Set<Consumer> consumers = ConcurrentHashMap.newKeySet();
    private final Set<Producer> producers = ConcurrentHashMap.newKeySet();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    private final FanoutConfig config;
    private final AsyncExecutor asyncExecutor;
    private final boolean ownsExecutor;
    private final Dispatcher sharedDispatcher;
    private final IdGenerator idGenerator;
    private final Clock clock;
    private final BrokerMetrics metrics;
    private final Tracer tracer;
    private final OpenTelemetry openTelemetry;
    private final ScheduledFuture<?> sweep;

    public DefaultMessageBroker() {
        this(new ConfigData(), OpenTelemetry.noop());
    }

    public DefaultMessageBroker(FanoutConfig config, OpenTelemetry ot) {
        this(config, createExecutor(config), true, IdGenerator.uuid(), Clock.systemUTC(), ot);
    }

    /**
     * Creates a broker that runs on an executor owned by the caller. Closing the
     * broker leaves the executor running.
     *
     * @param config        broker configuration
     * @param asyncExecutor executor for delivery and the retention sweep
     * @param idGenerator   source of message ids
     * @param clock         clock for message timestamps and retention
     * @param ot            OpenTelemetry instance for metrics and tracing
     */
    public DefaultMessageBroker(FanoutConfig config, AsyncExecutor asyncExecutor, IdGenerator idGenerator,
            Clock clock, OpenTelemetry ot) {
        this(config, asyncExecutor, false, idGenerator, clock, ot);
    }

    private DefaultMessageBroker(FanoutConfig config, AsyncExecutor asyncExecutor, boolean ownsExecutor,
            IdGenerator idGenerator, Clock clock, OpenTelemetry ot) {
        if (config == null || asyncExecutor == null || idGenerator == null || clock == null || ot == null) {
            throw new IllegalArgumentException("Broker collaborators cannot be null");
        }
        this.config = config;
        this.asyncExecutor = asyncExecutor;
        this.ownsExecutor = ownsExecutor;
        this.idGenerator = idGenerator;
        this.clock = clock;
        this.openTelemetry = ot;
        this.metrics = new BrokerMetrics(ot.getMeter("fanout"));
        this.tracer = ot.getTracer("fanout");
        this.sharedDispatcher = config.orderedDelivery() ? null : new ConcurrentDispatcher(asyncExecutor);
        this.sweep = scheduleSweep();
    }

    private static AsyncExecutor createExecutor(FanoutConfig config) {
        if (config.deliveryThreads() > 0) {
            return new DefaultExecutor(config.scheduledThreads(), config.deliveryThreads());
        }
        return new DefaultExecutor(config.scheduledThreads());
    }

    private ScheduledFuture<?> scheduleSweep() {
        if (config.retention().isZero()) {
            return null;
        }
        long interval = config.sweepInterval().toMillis();
        return asyncExecutor.scheduleAtFixedRate(() -> {
            try {
                sweepExpired();
            } catch (RuntimeException e) {
                logger.atError().setCause(e).log("Retention sweep failed");
            }
        }, interval, interval, TimeUnit.MILLISECONDS);
    }

    private void checkOpen() {
        if (closed.get()) {
            throw new IllegalStateException("Broker is closed");
        }
    }

    private static void checkTopicName(String name) {
        if (name == null || name.trim().isEmpty()) {
            throw new IllegalArgumentException("Topic cannot be null or empty");
        }
    }

    @Override
    public Message newMessage(String topic, byte[] payload, Map<String, String> headers) {
        return Message.create(idGenerator.nextId(), topic, payload, headers, clock.instant());
    }

    @Override
    public String publish(String topicName, byte[] payload, Map<String, String> headers) {
        checkOpen();
        checkTopicName(topicName);
        if (payload == null) {
            throw new IllegalArgumentException("Payload cannot be null");
        }
        if (payload.length > config.maxMessageSize()) {
            throw new IllegalArgumentException("Payload of " + payload.length
                    + " bytes exceeds the maximum message size of " + config.maxMessageSize());
        }

        Topic topic = createTopic(topicName);
        Message message = newMessage(topicName, payload, headers);

        return processWithTelemetry(openTelemetry, tracer, message, "publish_message", () -> {
            if (topic.enqueue(message)) {
                topic.deliver(message);
            }
            return message.id();
        });
    }

    @Override
    public boolean subscribe(Consumer consumer, String topicName) {
        checkOpen();
        if (consumer == null) {
            throw new IllegalArgumentException("Consumer cannot be null");
        }
        checkTopicName(topicName);

        Topic topic = createTopic(topicName);
        consumers.add(consumer);
        boolean added = topic.subscribe(consumer);
        if (added) {
            logger.atDebug()
                    .addArgument(consumer::getId)
                    .addArgument(topicName)
                    .log("Consumer {} subscribed to topic {}");
        }
        return added;
    }

    @Override
    public boolean unsubscribe(Consumer consumer, String topicName) {
        if (consumer == null || topicName == null) {
            return false;
        }
        Topic topic = topics.get(topicName);
        if (topic == null) {
            return false;
        }
        boolean removed = topic.unsubscribe(consumer);
        if (removed) {
            logger.atDebug()
                    .addArgument(consumer::getId)
                    .addArgument(topicName)
                    .log("Consumer {} unsubscribed from topic {}");
        }
        return removed;
    }

    @Override
    public Topic createTopic(String name) {
        return createTopic(name, config.defaultCapacity());
    }

    @Override
    public Topic createTopic(String name, int capacity) {
        checkOpen();
        checkTopicName(name);
        if (capacity <= 0) {
            throw new IllegalArgumentException("Topic capacity must be positive, was " + capacity);
        }
        return topics.computeIfAbsent(name, n -> {
            logger.atInfo()
                    .addArgument(n)
                    .addArgument(capacity)
                    .log("Creating topic {} with capacity {}");
            Dispatcher dispatcher = sharedDispatcher != null ? sharedDispatcher
                    : new OrderedDispatcher(asyncExecutor);
            return new Topic(n, capacity, dispatcher, openTelemetry, metrics);
        });
    }

    @Override
    public boolean deleteTopic(String name) {
        if (name == null) {
            return false;
        }
        Topic topic = topics.remove(name);
        if (topic == null) {
            return false;
        }
        for (Consumer consumer : consumers) {
            topic.unsubscribe(consumer);
        }
        for (Consumer consumer : topic.subscribers()) {
            topic.unsubscribe(consumer);
        }
        logger.atInfo().addArgument(name).log("Deleted topic {}");
        return true;
    }

    @Override
    public Optional<Topic> getTopic(String name) {
        return name == null ? Optional.empty() : Optional.ofNullable(topics.get(name));
    }

    @Override
    public Optional<TopicStats> getTopicStats(String name) {
        return getTopic(name).map(Topic::getStats);
    }

    @Override
    public Map<String, TopicStats> getAllTopicStats() {
        Map<String, TopicStats> stats = new LinkedHashMap<>();
        for (Topic topic : topics.values()) {
            stats.put(topic.getName(), topic.getStats());
        }
        return stats;
    }

    @Override
    public BrokerStats getStats() {
        var topicStats = getAllTopicStats();
        return new BrokerStats(topicStats, topicStats.size(), consumers.size(), producers.size());
    }

    @Override
    public void registerProducer(Producer producer) {
        if (producer == null) {
            throw new IllegalArgumentException("Producer cannot be null");
        }
        producers.add(producer);
    }

    /**
     * Evicts messages older than the configured retention from every topic
     * buffer.
     *
     * @return the number of evicted messages
     */
    public int sweepExpired() {
        Duration retention = config.retention();
        if (retention.isZero()) {
            return 0;
        }
        Instant cutoff = clock.instant().minus(retention);
        int total = 0;
        for (Topic topic : topics.values()) {
            int evicted = topic.evictOlderThan(cutoff);
            if (evicted > 0) {
                logger.atDebug()
                        .addArgument(evicted)
                        .addArgument(topic::getName)
                        .log("Evicted {} expired messages from topic {}");
            }
            total += evicted;
        }
        return total;
    }

    public boolean isClosed() {
        return closed.get();
    }

    @Override
    public void close() {
        if (!closed.compareAndSet(false, true)) {
            return;
        }
        if (sweep != null) {
            sweep.cancel(false);
        }
        if (ownsExecutor) {
            try {
                asyncExecutor.close();
            } catch (RuntimeException e) {
                logger.atWarn()
                        .setCause(e)
                        .addArgument(asyncExecutor.getClass().getSimpleName())
                        .log("Error closing {}");
            }
        }
        logger.atInfo().log("Broker closed");
    }
}
