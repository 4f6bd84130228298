package me.relaybot.gateway.domain.session;


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
import me.relaybot.gateway.domain.model.ChatReply;
import me.relaybot.gateway.domain.model.Message;
import me.relaybot.gateway.domain.model.Turn;
import me.relaybot.gateway.domain.model.TurnResult;
import me.relaybot.gateway.domain.service.ConversationContextBuilder;
import me.relaybot.gateway.domain.service.ConversationHistoryService;
import me.relaybot.gateway.domain.service.EmotionClassifier;
import me.relaybot.gateway.domain.service.MemoryScheduler;
import me.relaybot.gateway.domain.service.ResponseCleaner;
import me.relaybot.gateway.domain.system.toolloop.TurnEventSink;
import me.relaybot.gateway.domain.system.toolloop.TurnOrchestrator;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.UUID;

/**
 * One chat exchange from user text to client-ready answer: memory
 * augmentation, the optional reply constraint, the orchestrated turn, answer
 * cleanup with emotion classification, and the history and memory writes.
 *
 * <p>
 * Live connections pass a sink to receive progress events; request/response
 * callers pass {@code null}.
 */
@Service
@Slf4j
public class ChatTurnService {

    private final TurnOrchestrator orchestrator;
    private final MemoryScheduler memoryScheduler;
    private final ConversationContextBuilder contextBuilder;
    private final ConversationHistoryService historyService;
    private final EmotionClassifier emotionClassifier;
    private final ResponseCleaner responseCleaner;
    private final Clock clock;

    @SuppressWarnings("java:S107")
    public ChatTurnService(TurnOrchestrator orchestrator, MemoryScheduler memoryScheduler,
            ConversationContextBuilder contextBuilder, ConversationHistoryService historyService,
            EmotionClassifier emotionClassifier, ResponseCleaner responseCleaner, Clock clock) {
        this.orchestrator = orchestrator;
        this.memoryScheduler = memoryScheduler;
        this.contextBuilder = contextBuilder;
        this.historyService = historyService;
        this.emotionClassifier = emotionClassifier;
        this.responseCleaner = responseCleaner;
        this.clock = clock;
    }

    public boolean isReady() {
        return orchestrator.isReady();
    }

    /**
     * Runs one exchange to completion on the calling thread.
     *
     * @param channelType
     *            origin channel recorded on the turn
     * @param sink
     *            receives progress events, or {@code null} for a silent run
     * @throws RuntimeException
     *             when the turn fails; nothing is recorded in that case
     */
    public ChatReply execute(String message, String sessionKey, String constraint, String channelType,
            TurnEventSink sink) {
        Turn turn = Turn.builder()
                .id(UUID.randomUUID().toString())
                .sessionKey(sessionKey)
                .originChannel(channelType)
                .chatId(sessionKey)
                .constraint(constraint)
                .build();
        log.info("[Chat] Turn {} started for session '{}' via {}", turn.getId(), sessionKey, channelType);

        TurnResult result;
        try {
            String augmented = memoryScheduler.augment(message);
            String content = constraint != null
                    ? augmented + "\n\n(Reply requirements: " + constraint + ")"
                    : augmented;
            List<Message> context = contextBuilder.build(sessionKey, content);
            result = sink != null ? orchestrator.run(turn, context, sink) : orchestrator.run(turn, context);
        } catch (RuntimeException e) {
            log.warn("[Chat] Turn {} failed: {}", turn.getId(), e.getMessage());
            turn.fail(e.getMessage());
            throw e;
        }

        String clean = responseCleaner.clean(result.finalText());
        String emotion = emotionClassifier.classify(clean);
        historyService.appendExchange(sessionKey, message, result.finalText());
        memoryScheduler.recordAsync(sessionKey, message, clean);
        log.info("[Chat] Turn {} finished after {} iteration(s){}", turn.getId(), result.iterations(),
                result.budgetExhausted() ? " (iteration limit reached)" : "");
        return new ChatReply(clean, emotion, sessionKey, clock.millis() / 1000.0);
    }
}
