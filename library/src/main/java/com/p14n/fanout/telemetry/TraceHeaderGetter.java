package com.p14n.fanout.telemetry;

import java.util.Collections;
import java.util.Map;

import io.opentelemetry.context.propagation.TextMapGetter;

/**
 * Reads propagation fields from message headers. A message without headers
 * yields no fields.
 */
public final class TraceHeaderGetter implements TextMapGetter<Map<String, String>> {

    public static final TraceHeaderGetter INSTANCE = new TraceHeaderGetter();

    private TraceHeaderGetter() {
    }

    @Override
    public String get(Map<String, String> headers, String key) {
        return headers == null ? null : headers.get(key);
    }

    @Override
    public Iterable<String> keys(Map<String, String> headers) {
        return headers == null ? Collections.emptySet() : headers.keySet();
    }
}
