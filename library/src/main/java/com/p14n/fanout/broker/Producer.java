package com.p14n.fanout.broker;

import java.util.HashMap;
import java.util.Map;

import com.p14n.fanout.data.Message;

import io.opentelemetry.api.OpenTelemetry;

import static com.p14n.fanout.telemetry.OpenTelemetryFunctions.serializeTraceContext;

/**
 * Publishes through a broker under a fixed producer id. The producer registers
 * itself with the broker when created and adds the caller's trace context to
 * the message headers when none is given.
 */
public class Producer {

    private final String id;
    private final MessageBroker broker;
    private final OpenTelemetry openTelemetry;

    public Producer(String id, MessageBroker broker) {
        this(id, broker, OpenTelemetry.noop());
    }

    public Producer(String id, MessageBroker broker, OpenTelemetry ot) {
        if (id == null || id.trim().isEmpty()) {
            throw new IllegalArgumentException("Producer id cannot be null or empty");
        }
        if (broker == null) {
            throw new IllegalArgumentException("Broker cannot be null");
        }
        this.id = id;
        this.broker = broker;
        this.openTelemetry = ot;
        broker.registerProducer(this);
    }

    public String publish(String topic, byte[] payload, Map<String, String> headers) {
        return broker.publish(topic, payload, withTraceContext(headers));
    }

    public String publish(String topic, String payload, Map<String, String> headers) {
        return broker.publish(topic, payload, withTraceContext(headers));
    }

    public String publish(String topic, String payload) {
        return publish(topic, payload, null);
    }

    private Map<String, String> withTraceContext(Map<String, String> headers) {
        Map<String, String> h = headers == null ? Map.of() : headers;
        if (h.containsKey(Message.TRACEPARENT_HEADER)) {
            return h;
        }
        String traceparent = serializeTraceContext(openTelemetry);
        if (traceparent == null) {
            return h;
        }
        var withTrace = new HashMap<>(h);
        withTrace.put(Message.TRACEPARENT_HEADER, traceparent);
        return withTrace;
    }

    public String getId() {
        return id;
    }
}
