package com.p14n.fanout.broker;

/**
 * Point-in-time view of one topic. Each counter is read on its own, so the
 * values are not guaranteed to be consistent with each other under concurrent
 * publishing.
 *
 * @param name            the topic name
 * @param messageCount    messages ever accepted by the topic
 * @param bufferedCount   messages currently held in the buffer
 * @param subscriberCount current number of subscribers
 * @param capacity        the buffer bound
 * @param droppedCount    messages rejected because the buffer was full
 */
public record TopicStats(String name,
                         long messageCount,
                         int bufferedCount,
                         int subscriberCount,
                         int capacity,
                         long droppedCount) {
}
