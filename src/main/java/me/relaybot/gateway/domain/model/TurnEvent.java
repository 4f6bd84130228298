package me.relaybot.gateway.domain.model;

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

import lombok.Builder;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Typed progress notification emitted while a turn runs. {@link #toFrame()}
 * produces the exact JSON object sent over the wire; internal correlation
 * fields such as the tool call id are not part of it.
 */
@Builder(toBuilder = true)
public record TurnEvent(
        TurnEventType type,
        Integer iteration,
        String toolCallId,
        String name,
        String arguments,
        String result,
        String content,
        String emotion,
        String session,
        Double timestamp,
        String message) {

    public static TurnEvent thinking(int iteration) {
        return TurnEvent.builder().type(TurnEventType.THINKING).iteration(iteration).build();
    }

    public static TurnEvent toolCall(String toolCallId, String name, String arguments) {
        return TurnEvent.builder()
                .type(TurnEventType.TOOL_CALL)
                .toolCallId(toolCallId)
                .name(name)
                .arguments(arguments)
                .build();
    }

    public static TurnEvent toolResult(String toolCallId, String name, String result) {
        return TurnEvent.builder()
                .type(TurnEventType.TOOL_RESULT)
                .toolCallId(toolCallId)
                .name(name)
                .result(result)
                .build();
    }

    public static TurnEvent finalAnswer(String content, String emotion, String session, double timestamp) {
        return TurnEvent.builder()
                .type(TurnEventType.FINAL)
                .content(content)
                .emotion(emotion)
                .session(session)
                .timestamp(timestamp)
                .build();
    }

    public static TurnEvent error(String message) {
        return TurnEvent.builder().type(TurnEventType.ERROR).message(message).build();
    }

    public static TurnEvent heartbeat(double timestamp) {
        return TurnEvent.builder().type(TurnEventType.HEARTBEAT).timestamp(timestamp).build();
    }

    public TurnEvent withEmotion(String emotion) {
        return toBuilder().emotion(emotion).build();
    }

    /**
     * Final and error events end a turn.
     */
    public boolean isTerminal() {
        return type == TurnEventType.FINAL || type == TurnEventType.ERROR;
    }

    public Map<String, Object> toFrame() {
        Map<String, Object> frame = new LinkedHashMap<>();
        frame.put("type", type.getWireName());
        switch (type) {
        case THINKING -> frame.put("iteration", iteration);
        case TOOL_CALL -> {
            frame.put("name", name);
            frame.put("arguments", arguments);
        }
        case TOOL_RESULT -> {
            frame.put("name", name);
            frame.put("result", result);
        }
        case FINAL -> {
            frame.put("content", content);
            frame.put("emotion", emotion);
            frame.put("session", session);
            frame.put("timestamp", timestamp);
        }
        case ERROR -> frame.put("message", message);
        case HEARTBEAT -> frame.put("timestamp", timestamp);
        default -> {
            // no payload
        }
        }
        if (emotion != null && (type == TurnEventType.THINKING || type == TurnEventType.TOOL_CALL
                || type == TurnEventType.TOOL_RESULT)) {
            frame.put("emotion", emotion);
        }
        return frame;
    }
}
