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
import me.relaybot.gateway.adapter.inbound.web.dto.HealthResponse;
import me.relaybot.gateway.domain.session.ChatTurnService;
import me.relaybot.gateway.port.outbound.RagPort;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Mono;

@RestController
@RequiredArgsConstructor
public class HealthController {

    private final ChatTurnService chatTurnService;
    private final RagPort ragPort;

    @GetMapping("/health")
    public Mono<ResponseEntity<HealthResponse>> health() {
        HealthResponse response = HealthResponse.builder()
                .status("ok")
                .agentReady(chatTurnService.isReady())
                .ragReady(ragPort.isAvailable())
                .build();
        return Mono.just(ResponseEntity.ok(response));
    }
}
