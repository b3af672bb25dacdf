package com.p14n.fanout.broker;

import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Optional;

import com.p14n.fanout.data.Message;

/**
 * Thread-safe topic broker: publishes messages into bounded topics and fans
 * them out to subscribed consumers.
 */
public interface MessageBroker extends AutoCloseable {

    /**
     * Publishes a message, creating the topic on first use. The message is
     * delivered to every active subscriber if the topic accepts it. A full topic
     * drops the message silently; the drop shows up only in the topic stats.
     *
     * @param topic   The topic to publish to
     * @param payload The message body
     * @param headers Message headers, null for none
     * @return The id of the new message, whether or not it was accepted
     * @throws IllegalArgumentException if the topic is null or empty, or the
     *                                  payload is null or too large
     * @throws IllegalStateException    if the broker is closed
     */
    String publish(String topic, byte[] payload, Map<String, String> headers);

    default String publish(String topic, byte[] payload) {
        return publish(topic, payload, null);
    }

    default String publish(String topic, String payload, Map<String, String> headers) {
        if (payload == null) {
            throw new IllegalArgumentException("Payload cannot be null");
        }
        return publish(topic, payload.getBytes(StandardCharsets.UTF_8), headers);
    }

    default String publish(String topic, String payload) {
        return publish(topic, payload, null);
    }

    /**
     * Builds a message with a fresh id and the current time without publishing
     * it.
     *
     * @param topic   The topic name
     * @param payload The message body
     * @param headers Message headers, null for none
     * @return The new message
     */
    Message newMessage(String topic, byte[] payload, Map<String, String> headers);

    /**
     * Subscribes a consumer to a topic, creating the topic on first use.
     *
     * @param consumer The consumer to subscribe
     * @param topic    The topic name
     * @return true if the consumer was added, false if it was already subscribed
     */
    boolean subscribe(Consumer consumer, String topic);

    /**
     * Removes a consumer from a topic.
     *
     * @param consumer The consumer to remove
     * @param topic    The topic name
     * @return true if the consumer was removed, false if the topic is unknown or
     *         the consumer was not subscribed
     */
    boolean unsubscribe(Consumer consumer, String topic);

    /**
     * Returns the named topic, creating it with the default capacity if needed.
     *
     * @param name The topic name
     * @return The existing or new topic
     */
    Topic createTopic(String name);

    /**
     * Returns the named topic, creating it with the given capacity if needed. An
     * existing topic keeps its original capacity.
     *
     * @param name     The topic name
     * @param capacity The buffer bound for a new topic
     * @return The existing or new topic
     * @throws IllegalArgumentException if the capacity is not positive
     */
    Topic createTopic(String name, int capacity);

    /**
     * Removes a topic and detaches it from every consumer that was subscribed.
     *
     * @param name The topic name
     * @return true if the topic existed
     */
    boolean deleteTopic(String name);

    Optional<Topic> getTopic(String name);

    Optional<TopicStats> getTopicStats(String name);

    Map<String, TopicStats> getAllTopicStats();

    BrokerStats getStats();

    /**
     * Records a producer for accounting.
     *
     * @param producer The producer publishing through this broker
     */
    void registerProducer(Producer producer);

    /**
     * Closes the broker. After closing, no more messages can be published and
     * no subscribers or topics added.
     */
    @Override
    void close();
}
