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

import java.util.List;

/**
 * Single point of mutation for the working history of a turn.
 *
 * <p>
 * The orchestrator should not write messages directly.
 */
public interface HistoryWriter {

    void appendAssistantToolCalls(List<Message> history, LlmResponse llmResponse);

    void appendToolResult(List<Message> history, ToolExecutionOutcome outcome);

    void appendFinalAssistantAnswer(List<Message> history, String finalText);
}
