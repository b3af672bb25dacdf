package com.p14n.fanout.data;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Immutable message held in a topic buffer and handed to consumers.
 * The payload is copied on the way in and on the way out so no caller can
 * mutate a message after it has been published.
 */
public record Message(String id,
                      String topic,
                      byte[] payload,
                      Instant createdAt,
                      Map<String, String> headers) implements Traceable {

    /**
     * Header carrying the W3C trace context of the publisher.
     */
    public static final String TRACEPARENT_HEADER = "traceparent";

    /**
     * @throws IllegalArgumentException if any field is null, the id or topic is
     *                                  blank, or a header key or value is null
     */
    public Message {
        if (id == null || id.trim().isEmpty()) {
            throw new IllegalArgumentException("id cannot be null or empty");
        }
        if (topic == null || topic.trim().isEmpty()) {
            throw new IllegalArgumentException("topic cannot be null or empty");
        }
        if (payload == null) {
            throw new IllegalArgumentException("payload cannot be null");
        }
        if (createdAt == null) {
            throw new IllegalArgumentException("createdAt cannot be null");
        }
        if (headers == null) {
            throw new IllegalArgumentException("headers cannot be null");
        }
        for (var e : headers.entrySet()) {
            if (e.getKey() == null || e.getValue() == null) {
                throw new IllegalArgumentException("header keys and values cannot be null");
            }
        }
        payload = payload.clone();
        headers = Collections.unmodifiableMap(new LinkedHashMap<>(headers));
    }

    /**
     * Creates a new Message instance, treating null headers as none.
     *
     * @param id        unique message id
     * @param topic     the topic the message is published to
     * @param payload   the message body
     * @param headers   optional headers, null means no headers
     * @param createdAt creation time
     * @return the new message
     * @throws IllegalArgumentException if any required field is null or empty,
     *                                  or a header key or value is null
     */
    public static Message create(String id, String topic, byte[] payload, Map<String, String> headers,
            Instant createdAt) {
        return new Message(id, topic, payload, createdAt, headers == null ? Map.of() : headers);
    }

    @Override
    public byte[] payload() {
        return payload.clone();
    }

    /**
     * Decodes the payload as UTF-8 text.
     *
     * @return the payload as a string
     */
    public String payloadAsString() {
        return new String(payload, StandardCharsets.UTF_8);
    }

    /**
     * @return the size of the payload in bytes
     */
    public int size() {
        return payload.length;
    }

    @Override
    public String traceparent() {
        return headers.get(TRACEPARENT_HEADER);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Message)) {
            return false;
        }
        Message other = (Message) o;
        return id.equals(other.id)
                && topic.equals(other.topic)
                && Arrays.equals(payload, other.payload)
                && createdAt.equals(other.createdAt)
                && headers.equals(other.headers);
    }

    @Override
    public int hashCode() {
        return 31 * id.hashCode() + Arrays.hashCode(payload);
    }

    @Override
    public String toString() {
        return "Message[id=" + id + ", topic=" + topic + ", size=" + payload.length
                + ", createdAt=" + createdAt + ", headers=" + headers + "]";
    }
}
