package me.relaybot.gateway.tools;

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
import me.relaybot.gateway.domain.component.ToolComponent;
import me.relaybot.gateway.domain.model.OutboundMessage;
import me.relaybot.gateway.domain.model.ToolDefinition;
import me.relaybot.gateway.domain.model.ToolResult;
import me.relaybot.gateway.domain.model.Turn;
import me.relaybot.gateway.domain.service.OutboundDispatchBus;
import me.relaybot.gateway.domain.system.toolloop.TurnContextHolder;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Lets the agent send a message to a chat on another channel (e.g. a Feishu
 * group). Messages are queued on the {@link OutboundDispatchBus}; messages
 * aimed at the conversation the turn came from are refused, since the final
 * answer already reaches it.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class MessageTool implements ToolComponent {

    static final String TOOL_NAME = "message";

    private static final String PARAM_TYPE = "type";
    private static final String PARAM_DESCRIPTION = "description";
    private static final String TYPE_STRING = "string";

    private final OutboundDispatchBus dispatchBus;

    @Override
    public ToolDefinition getDefinition() {
        return ToolDefinition.builder()
                .name(TOOL_NAME)
                .description("""
                        Send a message to a chat on an external channel, for example a Feishu group or a Telegram chat.
                        Do not use it to answer the current conversation; reply normally instead.""")
                .inputSchema(Map.of(
                        PARAM_TYPE, "object",
                        "properties", Map.of(
                                "content", Map.of(
                                        PARAM_TYPE, TYPE_STRING,
                                        PARAM_DESCRIPTION, "Message text"),
                                "channel", Map.of(
                                        PARAM_TYPE, TYPE_STRING,
                                        PARAM_DESCRIPTION, "Target channel, e.g. feishu or telegram"),
                                "chat_id", Map.of(
                                        PARAM_TYPE, TYPE_STRING,
                                        PARAM_DESCRIPTION, "Target chat or user id on that channel")),
                        "required", List.of("content", "channel", "chat_id")))
                .build();
    }

    @Override
    public CompletableFuture<ToolResult> execute(Map<String, Object> parameters) {
        String content = asString(parameters.get("content"));
        String channel = asString(parameters.get("channel"));
        String chatId = asString(parameters.get("chat_id"));
        if (content == null || channel == null || chatId == null) {
            return CompletableFuture.completedFuture(
                    ToolResult.failure("Missing required parameters: content, channel, chat_id"));
        }

        Turn turn = TurnContextHolder.get();
        if (turn != null && channel.equals(turn.getOriginChannel()) && chatId.equals(turn.getChatId())) {
            return CompletableFuture.completedFuture(ToolResult.success(
                    "Not sent: this is the current conversation. Put the text in your reply instead."));
        }

        dispatchBus.publish(new OutboundMessage(channel, chatId, content));
        log.info("[Message] Queued message for {}:{}", channel, chatId);
        return CompletableFuture.completedFuture(ToolResult.success("Message queued for " + channel + ":" + chatId));
    }

    private static String asString(Object value) {
        if (value instanceof String text && !text.isBlank()) {
            return text;
        }
        return null;
    }
}
