package me.relaybot.gateway.adapter.outbound.channel;

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

import lombok.extern.slf4j.Slf4j;
import me.relaybot.gateway.domain.model.OutboundMessage;
import me.relaybot.gateway.infrastructure.config.GatewayProperties;
import me.relaybot.gateway.port.outbound.OutboundChannelPort;
import org.springframework.stereotype.Component;
import org.telegram.telegrambots.client.okhttp.OkHttpTelegramClient;
import org.telegram.telegrambots.meta.api.methods.send.SendMessage;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;
import org.telegram.telegrambots.meta.generics.TelegramClient;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Delivers outbound messages through the Telegram Bot API. Texts longer than
 * Telegram's message limit are split into consecutive messages.
 */
@Component
@Slf4j
public class TelegramChannelAdapter implements OutboundChannelPort {

    static final String CHANNEL_TYPE = "telegram";
    static final int MAX_MESSAGE_LENGTH = 4096;

    private final GatewayProperties properties;
    private final AtomicReference<TelegramClient> telegramClient = new AtomicReference<>();

    public TelegramChannelAdapter(GatewayProperties properties) {
        this.properties = properties;
    }

    /**
     * Set the TelegramClient instance. Package-private for testing.
     */
    void setTelegramClient(TelegramClient client) {
        this.telegramClient.set(client);
    }

    @Override
    public String getChannelType() {
        return CHANNEL_TYPE;
    }

    @Override
    public boolean isConfigured() {
        GatewayProperties.TelegramProperties telegram = properties.getChannels().getTelegram();
        return telegram.isEnabled() && telegram.getToken() != null && !telegram.getToken().isBlank();
    }

    @Override
    public CompletableFuture<Void> send(OutboundMessage message) {
        return CompletableFuture.runAsync(() -> {
            TelegramClient client = getOrCreateClient();
            if (client == null) {
                throw new IllegalStateException("Telegram channel is not configured");
            }
            try {
                for (String part : split(message.content())) {
                    client.execute(SendMessage.builder()
                            .chatId(message.chatId())
                            .text(part)
                            .build());
                }
                log.debug("[Telegram] Sent message to {}", message.chatId());
            } catch (TelegramApiException e) {
                throw new CompletionException(e);
            }
        });
    }

    static List<String> split(String text) {
        List<String> parts = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            parts.add(" ");
            return parts;
        }
        for (int start = 0; start < text.length(); start += MAX_MESSAGE_LENGTH) {
            parts.add(text.substring(start, Math.min(text.length(), start + MAX_MESSAGE_LENGTH)));
        }
        return parts;
    }

    private TelegramClient getOrCreateClient() {
        TelegramClient client = this.telegramClient.get();
        if (client != null) {
            return client;
        }
        if (!isConfigured()) {
            return null;
        }
        TelegramClient newClient = new OkHttpTelegramClient(properties.getChannels().getTelegram().getToken());
        if (this.telegramClient.compareAndSet(null, newClient)) {
            log.debug("[Telegram] TelegramClient lazily initialized");
            return newClient;
        }
        return this.telegramClient.get();
    }
}
