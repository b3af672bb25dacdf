package com.p14n.fanout.data;

/**
 * Interface for objects that can be traced and identified as they move
 * through the broker.
 *
 * <p>
 * Key attributes:
 * </p>
 * <ul>
 * <li>{@code id}: Unique identifier for the traceable object</li>
 * <li>{@code topic}: Message routing identifier</li>
 * <li>{@code traceparent}: OpenTelemetry trace context identifier, may be
 * null</li>
 * </ul>
 */
public interface Traceable {

    /**
     * Returns the unique identifier of the traceable object.
     *
     * @return the unique identifier string
     */
    String id();

    /**
     * Returns the topic the object is routed through.
     *
     * @return the topic string
     */
    String topic();

    /**
     * Returns the OpenTelemetry trace parent identifier for distributed tracing.
     *
     * @return the trace parent string, or null when the object carries no trace
     *         context
     */
    String traceparent();
}
