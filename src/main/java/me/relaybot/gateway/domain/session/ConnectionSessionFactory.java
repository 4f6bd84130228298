package me.relaybot.gateway.domain.session;

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

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.relaybot.gateway.domain.service.EmotionClassifier;
import me.relaybot.gateway.infrastructure.config.GatewayProperties;
import me.relaybot.gateway.infrastructure.task.BackgroundTaskRegistry.NamedThreadFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Creates {@link ConnectionSession}s and owns the threads they share: the
 * heartbeat scheduler and the pool that turns run on.
 */
@Component
@Slf4j
public class ConnectionSessionFactory {

    private final ChatTurnService chatTurnService;
    private final EmotionClassifier emotionClassifier;
    private final ObjectMapper objectMapper;
    private final GatewayProperties properties;
    private final Clock clock;

    private final ScheduledExecutorService heartbeatScheduler = Executors
            .newSingleThreadScheduledExecutor(new NamedThreadFactory("session-heartbeat"));
    private final ExecutorService turnExecutor = Executors.newCachedThreadPool(new NamedThreadFactory("turn"));

    public ConnectionSessionFactory(ChatTurnService chatTurnService, EmotionClassifier emotionClassifier,
            ObjectMapper objectMapper, GatewayProperties properties, Clock clock) {
        this.chatTurnService = chatTurnService;
        this.emotionClassifier = emotionClassifier;
        this.objectMapper = objectMapper;
        this.properties = properties;
        this.clock = clock;
    }

    public ConnectionSession create(EventChannel channel) {
        return new ConnectionSession(UUID.randomUUID().toString().substring(0, 8), channel, chatTurnService,
                emotionClassifier, objectMapper, heartbeatScheduler, properties, clock);
    }

    /**
     * Pool that runs turns, so a dropped connection never interrupts one.
     */
    public ExecutorService getTurnExecutor() {
        return turnExecutor;
    }

    @PreDestroy
    public void shutdown() {
        heartbeatScheduler.shutdownNow();
        turnExecutor.shutdownNow();
        try {
            if (!turnExecutor.awaitTermination(2, TimeUnit.SECONDS)) {
                log.warn("[Session] Turn executor did not terminate within timeout");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
