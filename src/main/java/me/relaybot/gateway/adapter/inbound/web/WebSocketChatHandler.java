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

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.relaybot.gateway.domain.session.ConnectionSession;
import me.relaybot.gateway.domain.session.ConnectionSessionFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.socket.WebSocketHandler;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.WebSocketSession;
import reactor.core.publisher.Mono;

import java.util.concurrent.CompletableFuture;

/**
 * Live chat endpoint. Inbound frames are handled one at a time, in arrival
 * order, each on the turn pool so that a disconnect never interrupts a running
 * turn. Outbound events flow through a per-connection
 * {@link WebSocketEventChannel}.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class WebSocketChatHandler implements WebSocketHandler {

    private final ConnectionSessionFactory sessionFactory;
    private final ObjectMapper objectMapper;

    @Override
    public Mono<Void> handle(WebSocketSession session) {
        WebSocketEventChannel channel = new WebSocketEventChannel(objectMapper);
        ConnectionSession connection = sessionFactory.create(channel);
        log.info("[WebSocket] Connection established: connectionId={}", connection.getId());

        Mono<Void> input = session.receive()
                .map(WebSocketMessage::getPayloadAsText)
                .concatMap(payload -> Mono.fromFuture(() -> CompletableFuture.runAsync(
                        () -> connection.handlePayload(payload), sessionFactory.getTurnExecutor())))
                .doFinally(signal -> {
                    log.info("[WebSocket] Connection closed: connectionId={}, signal={}", connection.getId(),
                            signal);
                    connection.close();
                    channel.close();
                })
                .then();

        Mono<Void> output = session.send(channel.frames()
                .doFinally(signal -> channel.close())
                .map(session::textMessage));

        return Mono.when(input, output);
    }
}
