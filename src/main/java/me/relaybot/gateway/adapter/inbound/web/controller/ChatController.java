package me.relaybot.gateway.adapter.inbound.web.controller;


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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.relaybot.gateway.adapter.inbound.web.dto.ChatRequest;
import me.relaybot.gateway.adapter.inbound.web.dto.ChatResponse;
import me.relaybot.gateway.domain.session.ChatTurnService;
import me.relaybot.gateway.infrastructure.config.GatewayProperties;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

/**
 * Request/response chat. Runs the same pipeline as the live endpoint without
 * progress events and answers once the turn is done.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Slf4j
public class ChatController {

    static final String CHANNEL_TYPE = "api";

    private final ChatTurnService chatTurnService;
    private final GatewayProperties properties;

    @PostMapping("/chat")
    public Mono<ResponseEntity<ChatResponse>> chat(@RequestBody ChatRequest request) {
        if (!chatTurnService.isReady()) {
            throw new ResponseStatusException(HttpStatus.SERVICE_UNAVAILABLE, "Agent not ready");
        }
        String message = request.getMessage() != null ? request.getMessage().strip() : "";
        if (message.isEmpty()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Empty message");
        }
        String session = isBlank(request.getSession())
                ? properties.getSession().getDefaultSessionKey()
                : request.getSession();
        String constraint = isBlank(request.getConstraint()) ? null : request.getConstraint();

        return Mono.fromCallable(() -> chatTurnService.execute(message, session, constraint, CHANNEL_TYPE, null))
                .subscribeOn(Schedulers.boundedElastic())
                .map(reply -> ResponseEntity.ok(ChatResponse.builder()
                        .response(reply.text())
                        .session(reply.session())
                        .timestamp(reply.timestamp())
                        .emotion(reply.emotion())
                        .build()));
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
