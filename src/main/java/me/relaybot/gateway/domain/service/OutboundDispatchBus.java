package me.relaybot.gateway.domain.service;

/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.relaybot.gateway.domain.model.OutboundMessage;
import me.relaybot.gateway.infrastructure.task.BackgroundTaskRegistry;
import me.relaybot.gateway.port.outbound.OutboundChannelPort;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Unbounded FIFO of agent-produced messages drained by a single consumer
 * thread. Each message goes to the sender registered for its channel tag;
 * messages for unknown or unconfigured channels are dropped, and a failing
 * sender never stops the loop. Delivery is at most once.
 */
@Service
@Slf4j
public class OutboundDispatchBus {

    private final BlockingQueue<OutboundMessage> queue = new LinkedBlockingQueue<>();
    private final Map<String, OutboundChannelPort> senders = new LinkedHashMap<>();

    private ExecutorService consumer;
    private volatile boolean running;

    public OutboundDispatchBus(List<OutboundChannelPort> channelPorts) {
        for (OutboundChannelPort port : channelPorts) {
            senders.put(port.getChannelType(), port);
        }
    }

    /**
     * Enqueue a message. Never blocks; safe to call before {@link #start()}.
     */
    public void publish(OutboundMessage message) {
        queue.add(message);
        log.debug("[Dispatch] Queued message for {}:{} ({} pending)", message.channel(), message.chatId(),
                queue.size());
    }

    @PostConstruct
    public synchronized void start() {
        if (running) {
            return;
        }
        running = true;
        consumer = Executors.newSingleThreadExecutor(new BackgroundTaskRegistry.NamedThreadFactory("dispatch"));
        consumer.execute(this::drain);
        log.info("[Dispatch] Started with senders: {}", senders.keySet());
    }

    @PreDestroy
    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        consumer.shutdownNow();
        try {
            if (!consumer.awaitTermination(2, TimeUnit.SECONDS)) {
                log.warn("[Dispatch] Consumer did not terminate within timeout");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        int discarded = queue.size();
        queue.clear();
        log.info("[Dispatch] Stopped, discarded {} queued message(s)", discarded);
    }

    public int pendingCount() {
        return queue.size();
    }

    public boolean isRunning() {
        return running;
    }

    private void drain() {
        while (running) {
            OutboundMessage message;
            try {
                message = queue.take();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return;
            }
            deliver(message);
        }
    }

    private void deliver(OutboundMessage message) {
        OutboundChannelPort sender = senders.get(message.channel());
        if (sender == null) {
            log.warn("[Dispatch] No sender for channel '{}', dropping message to {}", message.channel(),
                    message.chatId());
            return;
        }
        if (!sender.isConfigured()) {
            log.warn("[Dispatch] Channel '{}' is not configured, dropping message to {}", message.channel(),
                    message.chatId());
            return;
        }
        try {
            sender.send(message).join();
            log.debug("[Dispatch] Delivered message to {}:{}", message.channel(), message.chatId());
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.error("[Dispatch] Delivery to {}:{} failed: {}", message.channel(), message.chatId(),
                    cause.getMessage());
        } catch (RuntimeException e) { // NOSONAR
            log.error("[Dispatch] Delivery to {}:{} failed: {}", message.channel(), message.chatId(),
                    e.getMessage());
        }
    }
}
