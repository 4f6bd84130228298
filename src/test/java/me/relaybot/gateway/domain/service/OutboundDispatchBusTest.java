package me.relaybot.gateway.domain.service;

import me.relaybot.gateway.domain.model.OutboundMessage;
import me.relaybot.gateway.port.outbound.OutboundChannelPort;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class OutboundDispatchBusTest {

    private OutboundDispatchBus bus;

    @AfterEach
    void tearDown() {
        if (bus != null) {
            bus.stop();
        }
    }

    @Test
    void shouldDeliverMessagesPublishedBeforeStartInOrder() throws InterruptedException {
        RecordingSender feishu = new RecordingSender("feishu", true, 2);
        bus = new OutboundDispatchBus(List.of(feishu));

        bus.publish(new OutboundMessage("feishu", "oc_1", "hi"));
        bus.publish(new OutboundMessage("feishu", "oc_1", "second"));
        assertEquals(2, bus.pendingCount());

        bus.start();

        assertTrue(feishu.delivered.await(5, TimeUnit.SECONDS));
        assertEquals(List.of(new OutboundMessage("feishu", "oc_1", "hi"),
                new OutboundMessage("feishu", "oc_1", "second")), feishu.sent);
    }

    @Test
    void shouldDropMessagesForUnknownChannels() throws InterruptedException {
        RecordingSender feishu = new RecordingSender("feishu", true, 1);
        bus = new OutboundDispatchBus(List.of(feishu));
        bus.start();

        bus.publish(new OutboundMessage("slack", "C1", "lost"));
        bus.publish(new OutboundMessage("feishu", "oc_1", "kept"));

        assertTrue(feishu.delivered.await(5, TimeUnit.SECONDS));
        assertEquals(List.of(new OutboundMessage("feishu", "oc_1", "kept")), feishu.sent);
    }

    @Test
    void shouldDropMessagesForUnconfiguredChannels() throws InterruptedException {
        RecordingSender telegram = new RecordingSender("telegram", false, 1);
        RecordingSender feishu = new RecordingSender("feishu", true, 1);
        bus = new OutboundDispatchBus(List.of(telegram, feishu));
        bus.start();

        bus.publish(new OutboundMessage("telegram", "42", "nope"));
        bus.publish(new OutboundMessage("feishu", "oc_1", "yes"));

        assertTrue(feishu.delivered.await(5, TimeUnit.SECONDS));
        assertTrue(telegram.sent.isEmpty());
    }

    @Test
    void shouldKeepDrainingAfterSenderFailure() throws InterruptedException {
        RecordingSender feishu = new RecordingSender("feishu", true, 2);
        feishu.failFirst = true;
        bus = new OutboundDispatchBus(List.of(feishu));
        bus.start();

        bus.publish(new OutboundMessage("feishu", "oc_1", "first"));
        bus.publish(new OutboundMessage("feishu", "oc_1", "second"));

        assertTrue(feishu.delivered.await(5, TimeUnit.SECONDS));
        assertEquals(2, feishu.sent.size());
        assertTrue(bus.isRunning());
    }

    @Test
    void shouldDiscardQueuedMessagesOnStop() throws InterruptedException {
        BlockingSender sender = new BlockingSender();
        bus = new OutboundDispatchBus(List.of(sender));
        bus.start();

        bus.publish(new OutboundMessage("feishu", "oc_1", "in flight"));
        assertTrue(sender.entered.await(5, TimeUnit.SECONDS));
        bus.publish(new OutboundMessage("feishu", "oc_1", "queued 1"));
        bus.publish(new OutboundMessage("feishu", "oc_1", "queued 2"));
        assertEquals(2, bus.pendingCount());

        bus.stop();

        assertFalse(bus.isRunning());
        assertEquals(0, bus.pendingCount());
    }

    @Test
    void shouldIgnoreRepeatedStart() {
        bus = new OutboundDispatchBus(List.of());
        bus.start();
        bus.start();

        assertTrue(bus.isRunning());
    }

    private static final class RecordingSender implements OutboundChannelPort {

        private final String type;
        private final boolean configured;
        private final CountDownLatch delivered;
        private final List<OutboundMessage> sent = new CopyOnWriteArrayList<>();
        private volatile boolean failFirst;

        RecordingSender(String type, boolean configured, int expected) {
            this.type = type;
            this.configured = configured;
            this.delivered = new CountDownLatch(expected);
        }

        @Override
        public String getChannelType() {
            return type;
        }

        @Override
        public boolean isConfigured() {
            return configured;
        }

        @Override
        public CompletableFuture<Void> send(OutboundMessage message) {
            sent.add(message);
            delivered.countDown();
            if (failFirst && sent.size() == 1) {
                return CompletableFuture.failedFuture(new IllegalStateException("upstream 500"));
            }
            return CompletableFuture.completedFuture(null);
        }
    }

    private static final class BlockingSender implements OutboundChannelPort {

        private final CountDownLatch entered = new CountDownLatch(1);
        private final CountDownLatch release = new CountDownLatch(1);

        @Override
        public String getChannelType() {
            return "feishu";
        }

        @Override
        public boolean isConfigured() {
            return true;
        }

        @Override
        public CompletableFuture<Void> send(OutboundMessage message) {
            entered.countDown();
            try {
                release.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return CompletableFuture.failedFuture(e);
            }
            return CompletableFuture.completedFuture(null);
        }
    }
}
