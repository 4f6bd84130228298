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

import me.relaybot.gateway.domain.model.Message;
import me.relaybot.gateway.domain.model.ToolDefinition;

import java.util.List;

/**
 * Hexagonal outbound port for executing a single tool call.
 *
 * <p>
 * The orchestrator owns the loop; it invokes this port for each tool call and
 * advertises {@link #getToolDefinitions()} to the model.
 */
public interface ToolExecutorPort {

    ToolExecutionOutcome execute(Message.ToolCall toolCall);

    List<ToolDefinition> getToolDefinitions();
}
