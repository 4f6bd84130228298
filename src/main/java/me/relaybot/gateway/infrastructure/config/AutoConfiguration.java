package me.relaybot.gateway.infrastructure.config;

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

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.relaybot.gateway.port.outbound.LlmPort;
import me.relaybot.gateway.port.outbound.OutboundChannelPort;
import me.relaybot.gateway.port.outbound.RagPort;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.List;

/**
 * Shared infrastructure beans and startup diagnostics.
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class AutoConfiguration {

    private final GatewayProperties properties;
    private final LlmPort llmPort;
    private final RagPort ragPort;
    private final List<OutboundChannelPort> channelPorts;

    @Bean
    public static Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @PostConstruct
    public void init() {
        log.info("Relay gateway starting...");
        log.info("LLM: {} at {} (configured: {})", llmPort.getCurrentModel(), properties.getLlm().getBaseUrl(),
                llmPort.isAvailable());
        log.info("WebSocket endpoint: {}", properties.getSession().getPath());
        log.info("Storage Path: {}", properties.getStorage().getBasePath());
        log.info("Retrieval store: {}", ragPort.isAvailable() ? properties.getRag().getUrl() : "disabled");
        for (OutboundChannelPort channel : channelPorts) {
            log.info("Outbound channel {}: {}", channel.getChannelType(),
                    channel.isConfigured() ? "configured" : "not configured");
        }
    }
}
