package com.p14n.fanout.telemetry;

import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongUpDownCounter;
import io.opentelemetry.api.metrics.Meter;

/**
 * Manages OpenTelemetry metrics for broker operations.
 *
 * <p>
 * Every instrument is tagged with the {@code topic} attribute:
 * </p>
 * <ul>
 * <li>messages_published: messages accepted into a topic buffer</li>
 * <li>messages_dropped: messages rejected because the topic buffer was
 * full</li>
 * <li>messages_delivered: handler invocations that completed normally</li>
 * <li>delivery_failures: handler invocations that threw, or deliveries the
 * executor refused</li>
 * <li>active_subscribers: current number of subscribers</li>
 * </ul>
 */
public class BrokerMetrics {
        private static final AttributeKey<String> TOPIC = AttributeKey.stringKey("topic");

        private final LongCounter publishedMessages;
        private final LongCounter droppedMessages;
        private final LongCounter deliveredMessages;
        private final LongCounter deliveryFailures;
        private final LongUpDownCounter activeSubscribers;

        /**
         * Creates a new BrokerMetrics instance with the provided OpenTelemetry meter.
         *
         * @param meter OpenTelemetry meter used to create the metric instruments
         */
        public BrokerMetrics(Meter meter) {
                publishedMessages = meter.counterBuilder("messages_published")
                                .setDescription("Number of messages accepted by a topic")
                                .build();

                droppedMessages = meter.counterBuilder("messages_dropped")
                                .setDescription("Number of messages dropped because a topic was full")
                                .build();

                deliveredMessages = meter.counterBuilder("messages_delivered")
                                .setDescription("Number of messages handled by subscribers")
                                .build();

                deliveryFailures = meter.counterBuilder("delivery_failures")
                                .setDescription("Number of failed deliveries to subscribers")
                                .build();

                activeSubscribers = meter.upDownCounterBuilder("active_subscribers")
                                .setDescription("Number of active subscribers")
                                .build();
        }

        public void recordPublished(String topic) {
                publishedMessages.add(1, Attributes.of(TOPIC, topic));
        }

        public void recordDropped(String topic) {
                droppedMessages.add(1, Attributes.of(TOPIC, topic));
        }

        public void recordDelivered(String topic) {
                deliveredMessages.add(1, Attributes.of(TOPIC, topic));
        }

        public void recordDeliveryFailure(String topic) {
                deliveryFailures.add(1, Attributes.of(TOPIC, topic));
        }

        public void recordSubscriberAdded(String topic) {
                activeSubscribers.add(1, Attributes.of(TOPIC, topic));
        }

        public void recordSubscriberRemoved(String topic) {
                activeSubscribers.add(-1, Attributes.of(TOPIC, topic));
        }
}
