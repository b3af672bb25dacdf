package com.p14n.fanout.broker;

import java.util.Map;

/**
 * Aggregate view of a broker.
 *
 * @param topics         stats per topic name
 * @param totalTopics    number of registered topics
 * @param totalConsumers number of consumers ever subscribed through the broker
 * @param totalProducers number of producers registered with the broker
 */
public record BrokerStats(Map<String, TopicStats> topics,
                          int totalTopics,
                          int totalConsumers,
                          int totalProducers) {
}
