package com.p14n.fanout.telemetry;

import com.p14n.fanout.broker.Consumer;
import com.p14n.fanout.broker.DefaultMessageBroker;
import com.p14n.fanout.broker.IdGenerator;
import com.p14n.fanout.broker.TestAsyncExecutor;
import com.p14n.fanout.data.ConfigData;

import io.opentelemetry.sdk.metrics.data.LongPointData;
import io.opentelemetry.sdk.testing.exporter.InMemoryMetricReader;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;

import static org.junit.jupiter.api.Assertions.*;

class BrokerMetricsTest {

    private InMemoryMetricReader reader;
    private DefaultTelemetryConfig telemetry;
    private TestAsyncExecutor executor;
    private DefaultMessageBroker broker;

    @BeforeEach
    void setUp() {
        reader = InMemoryMetricReader.create();
        telemetry = new DefaultTelemetryConfig(BrokerMetricsTest.class.getSimpleName(), reader);
        executor = new TestAsyncExecutor();
        broker = new DefaultMessageBroker(new ConfigData(), executor, IdGenerator.uuid(), Clock.systemUTC(),
                telemetry.getOpenTelemetry());
    }

    @AfterEach
    void tearDown() {
        broker.close();
        telemetry.close();
    }

    private long sum(String metric, String topic) {
        return reader.collectAllMetrics().stream()
                .filter(m -> m.getName().equals(metric))
                .flatMap(m -> m.getLongSumData().getPoints().stream())
                .filter(p -> topic.equals(p.getAttributes().get(
                        io.opentelemetry.api.common.AttributeKey.stringKey("topic"))))
                .mapToLong(LongPointData::getValue)
                .sum();
    }

    @Test
    void shouldRecordPublishedAndDropped() {
        broker.createTopic("orders", 2);
        broker.publish("orders", "M1");
        broker.publish("orders", "M2");
        broker.publish("orders", "M3");

        assertEquals(2, sum("messages_published", "orders"));
        assertEquals(1, sum("messages_dropped", "orders"));
    }

    @Test
    void shouldRecordDeliveriesAndFailures() {
        broker.subscribe(new Consumer("ok", m -> {
        }), "t");
        broker.subscribe(new Consumer("bad", m -> {
            throw new IllegalStateException("boom");
        }), "t");

        broker.publish("t", "one");
        broker.publish("t", "two");
        executor.runAll();

        assertEquals(2, sum("messages_delivered", "t"));
        assertEquals(2, sum("delivery_failures", "t"));
    }

    @Test
    void shouldTrackActiveSubscribers() {
        var c1 = new Consumer("c1", m -> {
        });
        var c2 = new Consumer("c2", m -> {
        });
        broker.subscribe(c1, "t");
        broker.subscribe(c2, "t");
        broker.subscribe(c2, "t");
        assertEquals(2, sum("active_subscribers", "t"));

        broker.unsubscribe(c1, "t");
        c2.stop();
        broker.publish("t", "prunes c2");
        assertEquals(0, sum("active_subscribers", "t"));
    }
}
