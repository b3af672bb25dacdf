package com.p14n.fanout.telemetry;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.propagation.W3CTraceContextPropagator;
import io.opentelemetry.context.propagation.ContextPropagators;
import io.opentelemetry.sdk.OpenTelemetrySdk;
import io.opentelemetry.sdk.metrics.SdkMeterProvider;
import io.opentelemetry.sdk.metrics.SdkMeterProviderBuilder;
import io.opentelemetry.sdk.metrics.export.MetricReader;
import io.opentelemetry.sdk.resources.Resource;
import io.opentelemetry.sdk.trace.SdkTracerProvider;

/**
 * Builds an OpenTelemetry SDK instance for the broker with W3C trace context
 * propagation. A {@link MetricReader} may be supplied to export or inspect the
 * broker metrics.
 */
public class DefaultTelemetryConfig implements AutoCloseable {
    private static final AttributeKey<String> SERVICE_NAME = AttributeKey.stringKey("service.name");

    private final OpenTelemetrySdk openTelemetry;

    public DefaultTelemetryConfig(String serviceName) {
        this(serviceName, null);
    }

    public DefaultTelemetryConfig(String serviceName, MetricReader metricReader) {
        Resource resource = Resource.getDefault()
                .merge(Resource.create(Attributes.of(SERVICE_NAME, serviceName)));

        SdkMeterProviderBuilder meterProvider = SdkMeterProvider.builder()
                .setResource(resource);
        if (metricReader != null) {
            meterProvider.registerMetricReader(metricReader);
        }

        SdkTracerProvider tracerProvider = SdkTracerProvider.builder()
                .setResource(resource)
                .build();

        openTelemetry = OpenTelemetrySdk.builder()
                .setMeterProvider(meterProvider.build())
                .setTracerProvider(tracerProvider)
                .setPropagators(ContextPropagators.create(W3CTraceContextPropagator.getInstance()))
                .build();
    }

    public OpenTelemetry getOpenTelemetry() {
        return openTelemetry;
    }

    @Override
    public void close() {
        openTelemetry.close();
    }
}
