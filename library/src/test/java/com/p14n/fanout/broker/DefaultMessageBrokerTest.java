package com.p14n.fanout.broker;

import com.p14n.fanout.data.ConfigData;
import com.p14n.fanout.data.Message;

import io.opentelemetry.api.OpenTelemetry;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

@Timeout(value = 5, unit = TimeUnit.SECONDS)
class DefaultMessageBrokerTest {

    private volatile DefaultMessageBroker broker;

    @BeforeEach
    void setUp() {
        broker = new DefaultMessageBroker(new ConfigData(), OpenTelemetry.noop());
    }

    @AfterEach
    void tearDown() {
        if (broker != null) {
            broker.close();
            broker = null;
        }
    }

    private static class RecordingHandler implements MessageHandler {
        final List<String> received = new CopyOnWriteArrayList<>();
        final CountDownLatch latch;

        RecordingHandler(int expected) {
            this.latch = new CountDownLatch(expected);
        }

        @Override
        public void handle(Message message) {
            received.add(message.payloadAsString());
            latch.countDown();
        }

        boolean await() throws InterruptedException {
            return latch.await(2, TimeUnit.SECONDS);
        }
    }

    @Test
    void shouldFanOutAndStopAfterUnsubscribe() throws InterruptedException {
        var h1 = new RecordingHandler(1);
        var h2 = new RecordingHandler(2);
        var c1 = new Consumer("c1", h1);
        var c2 = new Consumer("c2", h2);

        broker.subscribe(c1, "alerts");
        broker.subscribe(c2, "alerts");
        broker.publish("alerts", "fire");

        assertTrue(h1.await());
        assertEquals(List.of("fire"), h1.received);

        assertTrue(broker.unsubscribe(c1, "alerts"));
        broker.publish("alerts", "flood");

        assertTrue(h2.await());
        assertEquals(List.of("fire", "flood"), h2.received.stream().sorted().toList());
        Thread.sleep(100);
        assertEquals(List.of("fire"), h1.received);
    }

    @Test
    void failingConsumerDoesNotAffectOthers() throws InterruptedException {
        var errors = new CountDownLatch(1);
        var failing = new Consumer("failing", new MessageHandler() {
            @Override
            public void handle(Message message) {
                throw new IllegalStateException("boom");
            }

            @Override
            public void onError(Message message, Throwable error) {
                errors.countDown();
            }
        });
        var healthy = new RecordingHandler(1);

        broker.subscribe(failing, "t");
        broker.subscribe(new Consumer("healthy", healthy), "t");

        assertDoesNotThrow(() -> broker.publish("t", "payload"));
        assertTrue(healthy.await());
        assertTrue(errors.await(2, TimeUnit.SECONDS));
        assertEquals(List.of("payload"), healthy.received);
    }

    @Test
    void orderedConsumerRecoversFromHandlerError() throws InterruptedException {
        var second = new CountDownLatch(1);
        try (var ordered = new DefaultMessageBroker(new ConfigData().withOrderedDelivery(true),
                OpenTelemetry.noop())) {
            ordered.subscribe(new Consumer("c1", m -> {
                if (m.payloadAsString().equals("M1")) {
                    throw new AssertionError("handler bug");
                }
                second.countDown();
            }), "t");

            ordered.publish("t", "M1");
            ordered.publish("t", "M2");

            assertTrue(second.await(2, TimeUnit.SECONDS));
        }
    }

    @Test
    void slowConsumerDoesNotBlockPublisherOrOthers() throws InterruptedException {
        var release = new CountDownLatch(1);
        var slow = new Consumer("slow", m -> release.await());
        var fast = new RecordingHandler(3);
        broker.subscribe(slow, "t");
        broker.subscribe(new Consumer("fast", fast), "t");

        for (int i = 0; i < 3; i++) {
            broker.publish("t", "m" + i);
        }

        assertTrue(fast.await());
        release.countDown();
    }

    @Test
    void publishWithoutSubscribersKeepsCapacityAccounting() {
        broker.createTopic("orders", 2);
        var id1 = broker.publish("orders", "M1");
        var id2 = broker.publish("orders", "M2");
        var id3 = broker.publish("orders", "M3");

        assertNotNull(id3);
        assertEquals(3, Set.of(id1, id2, id3).size());

        var stats = broker.getTopicStats("orders").orElseThrow();
        assertEquals(2, stats.messageCount());
        assertEquals(2, stats.bufferedCount());
        assertEquals(1, stats.droppedCount());
        var buffered = broker.getTopic("orders").orElseThrow().bufferedMessages();
        assertEquals(List.of("M1", "M2"), buffered.stream().map(Message::payloadAsString).toList());
    }

    @Test
    void subscribeTwiceRegistersOnce() {
        var consumer = new Consumer("c1", m -> {
        });
        assertTrue(broker.subscribe(consumer, "t"));
        assertFalse(broker.subscribe(consumer, "t"));

        assertEquals(1, broker.getTopicStats("t").orElseThrow().subscriberCount());
        assertEquals(Set.of("t"), consumer.getSubscribedTopics());
        assertEquals(1, broker.getStats().totalConsumers());
    }

    @Test
    void deleteTopicCleansBackReferences() {
        var c1 = new Consumer("c1", m -> {
        });
        var c2 = new Consumer("c2", m -> {
        });
        broker.subscribe(c1, "t");
        broker.subscribe(c2, "t");
        broker.subscribe(c2, "other");

        assertTrue(broker.deleteTopic("t"));

        assertTrue(c1.getSubscribedTopics().isEmpty());
        assertEquals(Set.of("other"), c2.getSubscribedTopics());
        assertTrue(broker.getTopicStats("t").isEmpty());
        assertFalse(broker.deleteTopic("t"));
    }

    @Test
    void stoppedConsumerIsSkippedAndPruned() throws InterruptedException {
        var calls = new AtomicInteger();
        var c1 = new Consumer("c1", m -> calls.incrementAndGet());
        var c2 = new RecordingHandler(1);
        broker.subscribe(c1, "x");
        broker.subscribe(new Consumer("c2", c2), "x");

        c1.stop();
        broker.publish("x", "after stop");

        assertTrue(c2.await());
        assertEquals(0, calls.get());
        assertEquals(1, broker.getTopicStats("x").orElseThrow().subscriberCount());
        assertFalse(c1.getSubscribedTopics().contains("x"));
    }

    @Test
    void createTopicIsGetOrCreate() {
        var first = broker.createTopic("t", 5);
        var second = broker.createTopic("t", 50);

        assertSame(first, second);
        assertEquals(5, second.getCapacity());
        assertEquals(ConfigData.DEFAULT_CAPACITY, broker.createTopic("defaulted").getCapacity());
        assertThrows(IllegalArgumentException.class, () -> broker.createTopic("bad", 0));
        assertThrows(IllegalArgumentException.class, () -> broker.createTopic("", 10));
    }

    @Test
    void unknownTopicsNeverThrow() {
        var consumer = new Consumer("c1", m -> {
        });
        assertTrue(broker.getTopicStats("missing").isEmpty());
        assertFalse(broker.unsubscribe(consumer, "missing"));
        assertFalse(broker.deleteTopic("missing"));
        assertTrue(broker.getTopic("missing").isEmpty());
    }

    @Test
    void shouldRejectInvalidPublishArguments() {
        assertThrows(IllegalArgumentException.class, () -> broker.publish(null, "x"));
        assertThrows(IllegalArgumentException.class, () -> broker.publish("", "x"));
        assertThrows(IllegalArgumentException.class, () -> broker.publish("t", (byte[]) null));
        assertThrows(IllegalArgumentException.class, () -> broker.subscribe(null, "t"));
    }

    @Test
    void shouldRejectOversizedPayload() {
        var small = new DefaultMessageBroker(new ConfigData(10, 4, Duration.ZERO, Duration.ofMinutes(1), 0, false),
                OpenTelemetry.noop());
        try {
            assertNotNull(small.publish("t", new byte[4]));
            var e = assertThrows(IllegalArgumentException.class, () -> small.publish("t", new byte[5]));
            assertTrue(e.getMessage().contains("maximum message size"));
            assertEquals(1, small.getTopicStats("t").orElseThrow().messageCount());
        } finally {
            small.close();
        }
    }

    @Test
    void shouldCarryHeadersToConsumers() throws InterruptedException {
        var headers = new CopyOnWriteArrayList<Map<String, String>>();
        var latch = new CountDownLatch(1);
        broker.subscribe(new Consumer("c1", m -> {
            headers.add(m.headers());
            latch.countDown();
        }), "t");

        broker.publish("t", "body", Map.of("content-type", "text/plain"));

        assertTrue(latch.await(2, TimeUnit.SECONDS));
        assertEquals(Map.of("content-type", "text/plain"), headers.get(0));
    }

    @Test
    void shouldPreventUseAfterClose() {
        broker.publish("t", "before");
        broker.close();
        broker.close();

        assertTrue(broker.isClosed());
        assertThrows(IllegalStateException.class, () -> broker.publish("t", "after"));
        assertThrows(IllegalStateException.class, () -> broker.subscribe(new Consumer("c", m -> {
        }), "t"));
        assertThrows(IllegalStateException.class, () -> broker.createTopic("new"));
        assertEquals(1, broker.getTopicStats("t").orElseThrow().messageCount());
    }

    @Test
    void shouldAggregateStats() {
        new Producer("p1", broker).publish("a", "1");
        new Producer("p2", broker).publish("b", "2");
        broker.subscribe(new Consumer("c1", m -> {
        }), "a");

        var stats = broker.getStats();
        assertEquals(2, stats.totalTopics());
        assertEquals(1, stats.totalConsumers());
        assertEquals(2, stats.totalProducers());
        assertEquals(Set.of("a", "b"), stats.topics().keySet());
        assertEquals(1, stats.topics().get("a").subscriberCount());
        assertEquals(stats.topics(), broker.getAllTopicStats());
    }

    @Test
    void shouldHandleConcurrentPublishers() throws InterruptedException {
        int threadCount = 4;
        int perThread = 50;
        broker.createTopic("busy", threadCount * perThread);
        var handler = new RecordingHandler(threadCount * perThread);
        broker.subscribe(new Consumer("c1", handler), "busy");

        var start = new CountDownLatch(1);
        var threads = new Thread[threadCount];
        for (int t = 0; t < threadCount; t++) {
            final int n = t;
            threads[t] = new Thread(() -> {
                try {
                    start.await();
                    for (int i = 0; i < perThread; i++) {
                        broker.publish("busy", n + "-" + i);
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
            });
            threads[t].start();
        }
        start.countDown();
        for (Thread thread : threads) {
            thread.join();
        }

        assertTrue(handler.await());
        assertEquals(threadCount * perThread, Set.copyOf(handler.received).size());
        assertEquals(threadCount * perThread, broker.getTopicStats("busy").orElseThrow().messageCount());
    }

    @Test
    void retentionSweepFreesCapacity() {
        var executor = new TestAsyncExecutor();
        var clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        var config = new ConfigData(2).withRetention(Duration.ofMinutes(10));
        var swept = new DefaultMessageBroker(config, executor, IdGenerator.uuid(), clock, OpenTelemetry.noop());

        assertEquals(1, executor.scheduledCount());
        swept.publish("t", "a");
        swept.publish("t", "b");
        swept.publish("t", "dropped");
        assertEquals(1, swept.getTopicStats("t").orElseThrow().droppedCount());

        clock.advance(Duration.ofMinutes(5));
        executor.runScheduled();
        assertEquals(2, swept.getTopicStats("t").orElseThrow().bufferedCount());

        clock.advance(Duration.ofMinutes(6));
        executor.runScheduled();
        assertEquals(0, swept.getTopicStats("t").orElseThrow().bufferedCount());

        swept.publish("t", "c");
        assertEquals(3, swept.getTopicStats("t").orElseThrow().messageCount());

        swept.close();
        assertEquals(0, executor.scheduledCount());
    }

    @Test
    void zeroRetentionSchedulesNoSweep() {
        var executor = new TestAsyncExecutor();
        var config = new ConfigData(5).withRetention(Duration.ZERO);
        var b = new DefaultMessageBroker(config, executor, IdGenerator.uuid(), java.time.Clock.systemUTC(),
                OpenTelemetry.noop());

        assertEquals(0, executor.scheduledCount());
        assertEquals(0, b.sweepExpired());
        b.close();
    }

    @Test
    void closingLeavesInjectedExecutorRunning() {
        var executor = new TestAsyncExecutor();
        var b = new DefaultMessageBroker(new ConfigData(), executor, IdGenerator.uuid(),
                java.time.Clock.systemUTC(), OpenTelemetry.noop());
        b.close();

        assertDoesNotThrow(() -> executor.submit(() -> null));
    }

    @Test
    void shouldUseSuppliedIdsAndClock() {
        var executor = new TestAsyncExecutor();
        var counter = new AtomicInteger();
        var at = Instant.parse("2026-03-01T12:00:00Z");
        var b = new DefaultMessageBroker(new ConfigData(), executor, () -> "id-" + counter.incrementAndGet(),
                new MutableClock(at), OpenTelemetry.noop());

        assertEquals("id-1", b.publish("t", "x"));
        var message = b.newMessage("t", new byte[0], null);
        assertEquals("id-2", message.id());
        assertEquals(at, message.createdAt());
        assertTrue(message.headers().isEmpty());
        b.close();
    }
}
