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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.relaybot.gateway.domain.model.ChatReply;
import me.relaybot.gateway.domain.model.TurnEvent;
import me.relaybot.gateway.domain.service.EmotionClassifier;
import me.relaybot.gateway.infrastructure.config.GatewayProperties;

import java.time.Clock;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Drives one live connection: validates each inbound frame, runs at most one
 * turn at a time, keeps the client alive with heartbeats while the turn runs,
 * and finishes every accepted frame with exactly one {@code final} or
 * {@code error} event.
 *
 * <p>
 * A disconnect does not interrupt a running turn; its remaining events are
 * dropped.
 */
@Slf4j
public class ConnectionSession {

    static final String INVALID_JSON = "Invalid JSON";
    static final String EMPTY_MESSAGE = "Empty message";
    static final String AGENT_NOT_READY = "Agent not ready";

    private final String id;
    private final EventChannel channel;
    private final ChatTurnService chatTurnService;
    private final EmotionClassifier emotionClassifier;
    private final ObjectMapper objectMapper;
    private final ScheduledExecutorService heartbeatScheduler;
    private final GatewayProperties properties;
    private final Clock clock;

    private volatile ConnectionState state = ConnectionState.IDLE;

    @SuppressWarnings("java:S107")
    public ConnectionSession(String id, EventChannel channel, ChatTurnService chatTurnService,
            EmotionClassifier emotionClassifier, ObjectMapper objectMapper,
            ScheduledExecutorService heartbeatScheduler, GatewayProperties properties, Clock clock) {
        this.id = id;
        this.channel = channel;
        this.chatTurnService = chatTurnService;
        this.emotionClassifier = emotionClassifier;
        this.objectMapper = objectMapper;
        this.heartbeatScheduler = heartbeatScheduler;
        this.properties = properties;
        this.clock = clock;
    }

    public String getId() {
        return id;
    }

    public ConnectionState getState() {
        return state;
    }

    /**
     * Handles one raw inbound frame to completion. Blocks the calling thread for
     * the whole turn.
     */
    public synchronized void handlePayload(String raw) {
        if (state == ConnectionState.CLOSED) {
            log.debug("[Session] {} closed, ignoring payload", id);
            return;
        }
        transition(ConnectionState.RECEIVING);
        try {
            InboundFrame frame = parse(raw);
            if (frame == null) {
                return;
            }
            if (!chatTurnService.isReady()) {
                sendQuietly(TurnEvent.error(AGENT_NOT_READY));
                return;
            }
            runTurn(frame);
        } finally {
            transition(ConnectionState.IDLE);
        }
    }

    /**
     * Marks the connection closed. Later events are discarded.
     */
    public void close() {
        state = ConnectionState.CLOSED;
        log.debug("[Session] {} closed", id);
    }

    private InboundFrame parse(String raw) {
        JsonNode node;
        try {
            node = raw != null ? objectMapper.readTree(raw) : null;
        } catch (JsonProcessingException e) {
            node = null;
        }
        if (node == null || !node.isObject()) {
            sendQuietly(TurnEvent.error(INVALID_JSON));
            return null;
        }

        JsonNode messageNode = node.get("message");
        String message = messageNode != null && messageNode.isTextual() ? messageNode.asText().strip() : "";
        if (message.isEmpty()) {
            sendQuietly(TurnEvent.error(EMPTY_MESSAGE));
            return null;
        }

        String session = textOrNull(node.get("session"));
        if (session == null) {
            session = properties.getSession().getDefaultSessionKey();
        }
        return new InboundFrame(message, session, textOrNull(node.get("constraint")));
    }

    private void runTurn(InboundFrame frame) {
        log.debug("[Session] {} accepted message for session '{}'", id, frame.session());
        transition(ConnectionState.TURN_RUNNING);

        ChatReply reply;
        try {
            AtomicBoolean gateOpen = new AtomicBoolean(true);
            Heartbeat heartbeat = new Heartbeat();
            heartbeat.start(properties.getSession().getHeartbeatIntervalMs());
            try {
                reply = chatTurnService.execute(frame.message(), frame.session(), frame.constraint(),
                        properties.getSession().getChannelType(), event -> {
                            if (gateOpen.get()) {
                                sendQuietly(event.withEmotion(emotionClassifier.forEvent(event.type())));
                            }
                        });
            } finally {
                gateOpen.set(false);
                heartbeat.stop();
            }
        } catch (RuntimeException e) { // NOSONAR
            log.warn("[Session] {} turn failed: {}", id, e.getMessage());
            sendQuietly(TurnEvent.error(e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName()));
            return;
        }

        sendQuietly(TurnEvent.finalAnswer(reply.text(), reply.emotion(), reply.session(), reply.timestamp()));
    }

    private void sendQuietly(TurnEvent event) {
        if (state == ConnectionState.CLOSED || !channel.isOpen()) {
            log.trace("[Session] {} dropping {} event, connection gone", id, event.type());
            return;
        }
        try {
            channel.send(event);
        } catch (RuntimeException e) { // NOSONAR
            log.debug("[Session] {} failed to send {} event: {}", id, event.type(), e.getMessage());
        }
    }

    private void transition(ConnectionState next) {
        if (state != ConnectionState.CLOSED) {
            state = next;
        }
    }

    private double nowSeconds() {
        return clock.millis() / 1000.0;
    }

    private static String textOrNull(JsonNode node) {
        if (node == null || !node.isTextual() || node.asText().isBlank()) {
            return null;
        }
        return node.asText();
    }

    private record InboundFrame(String message, String session, String constraint) {
    }

    /**
     * Periodic keep-alive for one turn. Once stopped it never emits again.
     */
    private final class Heartbeat {

        private ScheduledFuture<?> task;
        private boolean stopped;

        synchronized void start(long intervalMs) {
            long interval = Math.max(1, intervalMs);
            task = heartbeatScheduler.scheduleAtFixedRate(this::beat, interval, interval, TimeUnit.MILLISECONDS);
        }

        private synchronized void beat() {
            if (!stopped) {
                sendQuietly(TurnEvent.heartbeat(nowSeconds()));
            }
        }

        synchronized void stop() {
            stopped = true;
            if (task != null) {
                task.cancel(false);
            }
        }
    }
}
