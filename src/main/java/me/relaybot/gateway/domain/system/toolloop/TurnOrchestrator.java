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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.relaybot.gateway.domain.model.LlmRequest;
import me.relaybot.gateway.domain.model.LlmResponse;
import me.relaybot.gateway.domain.model.Message;
import me.relaybot.gateway.domain.model.ToolInvocation;
import me.relaybot.gateway.domain.model.Turn;
import me.relaybot.gateway.domain.model.TurnEvent;
import me.relaybot.gateway.domain.model.TurnResult;
import me.relaybot.gateway.infrastructure.config.GatewayProperties;
import me.relaybot.gateway.port.outbound.LlmPort;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletionException;
import java.util.regex.Pattern;

/**
 * Bounded tool-calling loop for a single turn.
 *
 * <p>
 * Each iteration emits {@code thinking}, calls the model with the working
 * history and the tool catalogue, and either returns the final answer or
 * executes the requested tools in order, emitting {@code tool_call} and
 * {@code tool_result} around each one. Running with or without an event sink
 * yields the same final text.
 */
@Slf4j
public class TurnOrchestrator {

    static final String FALLBACK_TEXT = "I've completed processing but have no response to give.";

    private static final Pattern THINK_BLOCK = Pattern.compile("<think>[\\s\\S]*?</think>");

    private final LlmPort llmPort;
    private final ToolExecutorPort toolExecutor;
    private final HistoryWriter historyWriter;
    private final ObjectMapper objectMapper;
    private final GatewayProperties properties;

    public TurnOrchestrator(LlmPort llmPort, ToolExecutorPort toolExecutor, HistoryWriter historyWriter,
            ObjectMapper objectMapper, GatewayProperties properties) {
        this.llmPort = llmPort;
        this.toolExecutor = toolExecutor;
        this.historyWriter = historyWriter;
        this.objectMapper = objectMapper;
        this.properties = properties;
    }

    /**
     * Whether the model provider is configured and can take turns.
     */
    public boolean isReady() {
        return llmPort.isAvailable();
    }

    public TurnResult run(Turn turn, List<Message> initialContext) {
        return run(turn, initialContext, null);
    }

    /**
     * Runs the turn to completion.
     *
     * @throws TurnExecutionException
     *             when a model call fails
     */
    public TurnResult run(Turn turn, List<Message> initialContext, TurnEventSink sink) {
        List<Message> history = new ArrayList<>(initialContext);
        List<String> toolsUsed = new ArrayList<>();
        int maxIterations = Math.max(1, properties.getTurn().getMaxIterations());
        String lastAssistantText = null;
        Set<String> usedCallIds = new HashSet<>();

        TurnContextHolder.set(turn);
        try {
            for (int iteration = 1; iteration <= maxIterations; iteration++) {
                turn.setIteration(iteration);
                emit(sink, TurnEvent.thinking(iteration));

                LlmResponse response = callModel(turn, history);

                if (response == null || !response.hasToolCalls()) {
                    String text = stripThinkBlocks(response != null ? response.getContent() : null);
                    if (text == null || text.isBlank()) {
                        text = FALLBACK_TEXT;
                    }
                    historyWriter.appendFinalAssistantAnswer(history, text);
                    turn.complete(text);
                    log.debug("[Turn] {} completed after {} iteration(s), tools: {}", turn.getId(), iteration,
                            toolsUsed);
                    return new TurnResult(text, List.copyOf(toolsUsed), false, iteration);
                }

                if (response.getContent() != null && !response.getContent().isBlank()) {
                    lastAssistantText = response.getContent();
                }
                response.setToolCalls(normalizeCallIds(response.getToolCalls(), iteration, usedCallIds));
                historyWriter.appendAssistantToolCalls(history, response);

                for (Message.ToolCall toolCall : response.getToolCalls()) {
                    emit(sink, TurnEvent.toolCall(toolCall.getId(), toolCall.getName(),
                            encodeArguments(toolCall.getArguments())));

                    ToolExecutionOutcome outcome = executeTool(toolCall);

                    emit(sink, TurnEvent.toolResult(outcome.toolCallId(), outcome.toolName(),
                            outcome.messageContent()));
                    historyWriter.appendToolResult(history, outcome);
                    turn.recordInvocation(new ToolInvocation(toolCall.getId(), toolCall.getName(),
                            toolCall.getArguments(), outcome.messageContent()));
                    toolsUsed.add(toolCall.getName());
                }
            }

            String stripped = stripThinkBlocks(lastAssistantText);
            String degraded = stripped != null && !stripped.isBlank() ? stripped : FALLBACK_TEXT;
            log.warn("[Turn] {} reached iteration limit ({}), returning degraded answer", turn.getId(),
                    maxIterations);
            turn.complete(degraded);
            return new TurnResult(degraded, List.copyOf(toolsUsed), true, maxIterations);
        } finally {
            TurnContextHolder.clear();
        }
    }

    private LlmResponse callModel(Turn turn, List<Message> history) {
        LlmRequest request = LlmRequest.builder()
                .model(llmPort.getCurrentModel())
                .messages(new ArrayList<>(history))
                .tools(toolExecutor.getToolDefinitions())
                .temperature(properties.getLlm().getTemperature())
                .maxTokens(properties.getLlm().getMaxTokens())
                .sessionId(turn.getSessionKey())
                .build();
        try {
            return llmPort.chat(request).join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            turn.fail(cause.getMessage());
            throw new TurnExecutionException("Model call failed: " + cause.getMessage(), cause);
        } catch (RuntimeException e) {
            turn.fail(e.getMessage());
            throw new TurnExecutionException("Model call failed: " + e.getMessage(), e);
        }
    }

    private ToolExecutionOutcome executeTool(Message.ToolCall toolCall) {
        ToolExecutionOutcome outcome;
        try {
            outcome = toolExecutor.execute(toolCall);
        } catch (Exception e) { // NOSONAR
            log.warn("[Turn] Tool {} threw: {}", toolCall.getName(), e.getMessage());
            outcome = ToolExecutionOutcome.synthetic(toolCall, "Tool execution failed: " + e.getMessage());
        }
        if (outcome == null) {
            outcome = ToolExecutionOutcome.synthetic(toolCall, "Tool returned no outcome");
        }
        return outcome;
    }

    /**
     * Replaces missing, blank or already used call ids so that every tool call
     * of the turn pairs with exactly one result.
     */
    static List<Message.ToolCall> normalizeCallIds(List<Message.ToolCall> toolCalls, int iteration,
            Set<String> usedCallIds) {
        List<Message.ToolCall> normalized = new ArrayList<>(toolCalls.size());
        for (int index = 0; index < toolCalls.size(); index++) {
            Message.ToolCall toolCall = toolCalls.get(index);
            String id = toolCall.getId();
            if (id == null || id.isBlank() || usedCallIds.contains(id)) {
                String generated = "call_" + iteration + "_" + index;
                int attempt = 1;
                while (usedCallIds.contains(generated)) {
                    generated = "call_" + iteration + "_" + index + "_" + attempt++;
                }
                log.debug("[Turn] Replacing tool call id '{}' with '{}'", id, generated);
                toolCall = Message.ToolCall.builder()
                        .id(generated)
                        .name(toolCall.getName())
                        .arguments(toolCall.getArguments())
                        .build();
            }
            usedCallIds.add(toolCall.getId());
            normalized.add(toolCall);
        }
        return normalized;
    }

    private String encodeArguments(Map<String, Object> arguments) {
        if (arguments == null) {
            return "{}";
        }
        try {
            return objectMapper.writeValueAsString(arguments);
        } catch (JsonProcessingException e) {
            return String.valueOf(arguments);
        }
    }

    private void emit(TurnEventSink sink, TurnEvent event) {
        if (sink != null) {
            sink.emit(event);
        }
    }

    static String stripThinkBlocks(String text) {
        if (text == null) {
            return null;
        }
        return THINK_BLOCK.matcher(text).replaceAll("").trim();
    }
}
