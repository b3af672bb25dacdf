package com.p14n.fanout.telemetry;

import java.util.HashMap;
import java.util.Map;
import java.util.function.Supplier;

import com.p14n.fanout.data.Message;
import com.p14n.fanout.data.Traceable;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanBuilder;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Context;
import io.opentelemetry.context.Scope;
import io.opentelemetry.context.propagation.TextMapSetter;

public class OpenTelemetryFunctions {

        private OpenTelemetryFunctions() {
        }

        /**
         * Serializes the current trace context as a W3C traceparent value.
         *
         * @param ot the OpenTelemetry instance whose propagators are used
         * @return the traceparent, or null when there is no active trace
         */
        public static String serializeTraceContext(OpenTelemetry ot) {
                Map<String, String> carrier = new HashMap<>();
                TextMapSetter<Map<String, String>> setter = Map::put;
                ot.getPropagators().getTextMapPropagator().inject(Context.current(), carrier, setter);
                return carrier.get(Message.TRACEPARENT_HEADER);
        }

        public static Context deserializeTraceContext(OpenTelemetry ot, String traceparent) {
                return ot.getPropagators().getTextMapPropagator().extract(Context.current(),
                                Map.of(Message.TRACEPARENT_HEADER, traceparent), TraceHeaderGetter.INSTANCE);
        }

        public static <T> T processWithTelemetry(OpenTelemetry ot, Tracer tracer, String spanName, String topic,
                        String messageId, String traceparent, Supplier<T> action) {

                Context parentContext = traceparent == null ? null
                                : OpenTelemetryFunctions.deserializeTraceContext(ot, traceparent);
                SpanBuilder sb = tracer.spanBuilder(spanName)
                                .setAttribute("topic", topic)
                                .setAttribute("message.id", messageId);
                if (parentContext != null) {
                        sb.setParent(parentContext);
                }
                Span span = sb.startSpan();
                try (Scope scope = span.makeCurrent()) {
                        return action.get();
                } catch (RuntimeException | Error e) {
                        span.recordException(e);
                        span.setStatus(StatusCode.ERROR);
                        throw e;
                } finally {
                        span.end();
                }
        }

        public static <T> T processWithTelemetry(OpenTelemetry ot, Tracer tracer, Traceable message, String spanName,
                        Supplier<T> action) {
                return processWithTelemetry(ot, tracer, spanName, message.topic(), message.id(),
                                message.traceparent(), action);
        }

}
