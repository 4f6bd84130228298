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

import lombok.extern.slf4j.Slf4j;
import me.relaybot.gateway.domain.component.ToolComponent;
import me.relaybot.gateway.domain.model.Message;
import me.relaybot.gateway.domain.model.ToolDefinition;
import me.relaybot.gateway.domain.model.ToolResult;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionException;

/**
 * Default ToolExecutorPort implementation that dispatches calls to the
 * registered {@link ToolComponent} beans by tool name.
 */
@Slf4j
public class DefaultToolExecutor implements ToolExecutorPort {

    private final Map<String, ToolComponent> tools = new LinkedHashMap<>();

    public DefaultToolExecutor(List<ToolComponent> toolComponents) {
        for (ToolComponent tool : toolComponents) {
            tools.put(tool.getToolName(), tool);
        }
        log.info("[Tools] Registered {} tool(s): {}", tools.size(), tools.keySet());
    }

    @Override
    public ToolExecutionOutcome execute(Message.ToolCall toolCall) {
        ToolComponent tool = tools.get(toolCall.getName());
        if (tool == null) {
            log.warn("[Tools] Unknown tool requested: {}", toolCall.getName());
            return ToolExecutionOutcome.synthetic(toolCall, "Unknown tool: " + toolCall.getName());
        }
        if (!tool.isEnabled()) {
            return ToolExecutionOutcome.synthetic(toolCall, "Tool is disabled: " + toolCall.getName());
        }

        Map<String, Object> arguments = toolCall.getArguments() != null ? toolCall.getArguments() : Map.of();
        ToolResult result;
        try {
            result = tool.execute(arguments).join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("[Tools] {} failed: {}", toolCall.getName(), cause.getMessage());
            return ToolExecutionOutcome.synthetic(toolCall, "Tool execution failed: " + cause.getMessage());
        }
        if (result == null) {
            return ToolExecutionOutcome.synthetic(toolCall, "Tool returned no result");
        }
        return new ToolExecutionOutcome(toolCall.getId(), toolCall.getName(), result, result.toMessageContent(),
                false);
    }

    @Override
    public List<ToolDefinition> getToolDefinitions() {
        return tools.values().stream()
                .filter(ToolComponent::isEnabled)
                .map(ToolComponent::getDefinition)
                .toList();
    }
}
