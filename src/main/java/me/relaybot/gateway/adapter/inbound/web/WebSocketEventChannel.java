package me.relaybot.gateway.adapter.inbound.web;

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
import com.fasterxml.jackson.databind.ObjectMapper;
import me.relaybot.gateway.domain.model.TurnEvent;
import me.relaybot.gateway.domain.session.EventChannel;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;

import java.io.UncheckedIOException;

/**
 * {@link EventChannel} over a unicast sink that feeds one WebSocket session.
 * Emission is serialized because heartbeats and turn events come from
 * different threads.
 */
class WebSocketEventChannel implements EventChannel {

    private final Sinks.Many<String> sink = Sinks.many().unicast().onBackpressureBuffer();
    private final ObjectMapper objectMapper;

    private volatile boolean open = true;

    WebSocketEventChannel(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    public synchronized void send(TurnEvent event) {
        if (!open) {
            throw new IllegalStateException("WebSocket connection closed");
        }
        String json;
        try {
            json = objectMapper.writeValueAsString(event.toFrame());
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException(e);
        }
        Sinks.EmitResult result = sink.tryEmitNext(json);
        if (result.isFailure()) {
            throw new IllegalStateException("Failed to emit " + event.type().getWireName() + ": " + result);
        }
    }

    @Override
    public boolean isOpen() {
        return open;
    }

    synchronized void close() {
        if (open) {
            open = false;
            sink.tryEmitComplete();
        }
    }

    Flux<String> frames() {
        return sink.asFlux();
    }
}
