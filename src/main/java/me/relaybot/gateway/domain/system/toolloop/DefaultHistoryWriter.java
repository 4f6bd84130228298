package me.relaybot.gateway.domain.system.toolloop;

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

import me.relaybot.gateway.domain.model.LlmResponse;
import me.relaybot.gateway.domain.model.Message;

import java.time.Clock;
import java.util.List;
import java.util.UUID;

/**
 * Default implementation that appends timestamped messages to the working
 * history list.
 */
public class DefaultHistoryWriter implements HistoryWriter {

    private final Clock clock;

    public DefaultHistoryWriter(Clock clock) {
        this.clock = clock;
    }

    @Override
    public void appendAssistantToolCalls(List<Message> history, LlmResponse llmResponse) {
        history.add(Message.builder()
                .id(UUID.randomUUID().toString())
                .role(Message.ROLE_ASSISTANT)
                .content(llmResponse.getContent())
                .toolCalls(llmResponse.getToolCalls())
                .timestamp(clock.instant())
                .build());
    }

    @Override
    public void appendToolResult(List<Message> history, ToolExecutionOutcome outcome) {
        history.add(Message.builder()
                .id(UUID.randomUUID().toString())
                .role(Message.ROLE_TOOL)
                .toolCallId(outcome.toolCallId())
                .toolName(outcome.toolName())
                .content(outcome.messageContent())
                .timestamp(clock.instant())
                .build());
    }

    @Override
    public void appendFinalAssistantAnswer(List<Message> history, String finalText) {
        history.add(Message.builder()
                .id(UUID.randomUUID().toString())
                .role(Message.ROLE_ASSISTANT)
                .content(finalText)
                .timestamp(clock.instant())
                .build());
    }
}
