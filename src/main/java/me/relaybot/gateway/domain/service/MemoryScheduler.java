package me.relaybot.gateway.domain.service;

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
import me.relaybot.gateway.domain.model.LlmRequest;
import me.relaybot.gateway.domain.model.LlmResponse;
import me.relaybot.gateway.domain.model.Message;
import me.relaybot.gateway.infrastructure.config.GatewayProperties;
import me.relaybot.gateway.infrastructure.task.BackgroundTaskRegistry;
import me.relaybot.gateway.port.outbound.LlmPort;
import me.relaybot.gateway.port.outbound.RagPort;
import me.relaybot.gateway.port.outbound.StoragePort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.CompletionException;
import java.util.concurrent.atomic.AtomicLong;
import java.util.regex.Pattern;

/**
 * Long-term memory around turns.
 *
 * <p>
 * Before a turn, {@link #augment(String)} prepends passages from the retrieval
 * store. After a turn, {@link #record} appends a one-line exchange summary to
 * the history log and, every {@code consolidation-period} recordings, schedules
 * {@link #consolidate()}, which asks the model to rewrite the long-term memory
 * document from its previous version and the recent history. Nothing here ever
 * fails a turn: every error is logged and absorbed.
 *
 * <p>
 * Consolidations are not serialized against each other; if two overlap, the
 * last one to finish wins.
 */
@Service
@Slf4j
public class MemoryScheduler {

    static final String CONTEXT_HEADER = "[Context retrieved from the knowledge base, for reference only]";
    static final String CONTEXT_FOOTER = "[End of context]";

    private static final DateTimeFormatter ENTRY_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");
    private static final Pattern LINE_BREAKS = Pattern.compile("\\r?\\n");
    private static final Pattern OPENING_FENCE = Pattern.compile("^```[\\w-]*\\s*\\n?");
    private static final Pattern CLOSING_FENCE = Pattern.compile("\\n?```\\s*$");

    private static final String CONSOLIDATION_PROMPT = """
            You maintain the long-term memory document of a personal assistant.
            You receive the current document and the most recent conversation log entries.
            Produce the complete replacement document:
            - keep every durable fact from the current document that is still valid
            - add durable facts revealed by the new entries (user preferences, names, projects, decisions)
            - drop facts that the new entries show to be outdated
            - ignore small talk and one-off requests
            Write concise Markdown in the language the user speaks.
            Output only the document itself, without commentary or code fences.""";

    private final GatewayProperties properties;
    private final StoragePort storagePort;
    private final LlmPort llmPort;
    private final RagPort ragPort;
    private final BackgroundTaskRegistry backgroundTasks;
    private final Clock clock;

    private final AtomicLong recordedTurns = new AtomicLong();

    public MemoryScheduler(GatewayProperties properties, StoragePort storagePort, LlmPort llmPort, RagPort ragPort,
            BackgroundTaskRegistry backgroundTasks, Clock clock) {
        this.properties = properties;
        this.storagePort = storagePort;
        this.llmPort = llmPort;
        this.ragPort = ragPort;
        this.backgroundTasks = backgroundTasks;
        this.clock = clock;
    }

    /**
     * Prepends retrieved context to the message, or returns it untouched when
     * retrieval is unavailable, empty or failing.
     */
    public String augment(String message) {
        if (ragPort == null || !ragPort.isAvailable()) {
            return message;
        }
        try {
            List<String> passages = ragPort.retrieve(message, properties.getMemory().getRetrievalTopK()).join();
            if (passages == null || passages.isEmpty()) {
                return message;
            }
            log.debug("[Memory] Augmenting message with {} passage(s)", passages.size());
            return CONTEXT_HEADER + "\n" + String.join("\n", passages) + "\n" + CONTEXT_FOOTER + "\n\n" + message;
        } catch (RuntimeException e) { // NOSONAR
            Throwable cause = e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
            log.error("[Memory] Augmentation failed: {}", cause.getMessage());
            return message;
        }
    }

    /**
     * Schedules {@link #record} on the background pool and returns immediately.
     */
    public void recordAsync(String sessionKey, String userText, String assistantText) {
        backgroundTasks.submit("memory-record", () -> record(sessionKey, userText, assistantText));
    }

    /**
     * Appends the exchange to the history log and schedules consolidation when
     * the turn counter reaches a multiple of the consolidation period.
     *
     * @return true if a consolidation was scheduled
     */
    public boolean record(String sessionKey, String userText, String assistantText) {
        GatewayProperties.MemoryProperties memory = properties.getMemory();
        String entry = formatEntry(sessionKey, userText, assistantText);
        try {
            storagePort.appendText(memory.getDirectory(), memory.getHistoryFile(), entry + "\n").join();
        } catch (RuntimeException e) { // NOSONAR
            Throwable cause = e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
            log.warn("[Memory] Failed to append history entry: {}", cause.getMessage());
        }

        long count = recordedTurns.incrementAndGet();
        int period = Math.max(1, memory.getConsolidationPeriod());
        if (count % period != 0) {
            return false;
        }
        log.info("[Memory] {} turns recorded, scheduling consolidation", count);
        backgroundTasks.submit("memory-consolidation", this::consolidate);
        return true;
    }

    /**
     * Rewrites the long-term memory document in full.
     *
     * @return true if a new document was written
     */
    public boolean consolidate() {
        GatewayProperties.MemoryProperties memory = properties.getMemory();
        try {
            String history = orEmpty(storagePort.getText(memory.getDirectory(), memory.getHistoryFile()).join());
            String current = orEmpty(storagePort.getText(memory.getDirectory(), memory.getMemoryFile()).join());
            List<String> recent = lastEntries(history, memory.getConsolidationWindow());
            if (recent.isEmpty()) {
                log.debug("[Memory] No history entries, skipping consolidation");
                return false;
            }

            LlmRequest request = LlmRequest.builder()
                    .model(llmPort.getCurrentModel())
                    .systemPrompt(CONSOLIDATION_PROMPT)
                    .messages(List.of(Message.user("## Current memory document\n"
                            + (current.isBlank() ? "(empty)" : current.strip())
                            + "\n\n## Recent conversation log\n"
                            + String.join("\n", recent))))
                    .temperature(0.3)
                    .build();

            LlmResponse response = llmPort.chat(request).join();
            String document = stripCodeFences(response != null ? response.getContent() : null);
            if (document.isBlank()) {
                log.warn("[Memory] Consolidation returned an empty document, keeping the previous one");
                return false;
            }

            storagePort.putTextAtomic(memory.getDirectory(), memory.getMemoryFile(), document + "\n").join();
            log.info("[Memory] Consolidated {} entries into {} chars of long-term memory", recent.size(),
                    document.length());
            return true;
        } catch (RuntimeException e) { // NOSONAR
            Throwable cause = e instanceof CompletionException && e.getCause() != null ? e.getCause() : e;
            log.error("[Memory] Consolidation failed: {}", cause.getMessage());
            return false;
        }
    }

    public long getRecordedTurns() {
        return recordedTurns.get();
    }

    String formatEntry(String sessionKey, String userText, String assistantText) {
        GatewayProperties.MemoryProperties memory = properties.getMemory();
        return "[" + ZonedDateTime.now(clock).format(ENTRY_TIME) + "] [" + sessionKey + "] Q: "
                + flatten(userText, memory.getQuestionLimit()) + " | A: "
                + flatten(assistantText, memory.getAnswerLimit());
    }

    static String stripCodeFences(String text) {
        if (text == null) {
            return "";
        }
        String stripped = text.strip();
        if (stripped.startsWith("```")) {
            stripped = OPENING_FENCE.matcher(stripped).replaceFirst("");
            stripped = CLOSING_FENCE.matcher(stripped).replaceFirst("");
        }
        return stripped.strip();
    }

    private static String flatten(String text, int limit) {
        if (text == null) {
            return "";
        }
        String flat = LINE_BREAKS.matcher(text).replaceAll(" ");
        if (flat.codePointCount(0, flat.length()) <= limit) {
            return flat;
        }
        // limit counts code points so a surrogate pair is never split
        return flat.substring(0, flat.offsetByCodePoints(0, limit));
    }

    private static List<String> lastEntries(String history, int window) {
        List<String> entries = Arrays.stream(history.split("\n"))
                .map(String::strip)
                .filter(line -> !line.isEmpty())
                .toList();
        int from = Math.max(0, entries.size() - Math.max(1, window));
        return entries.subList(from, entries.size());
    }

    private static String orEmpty(String text) {
        return text != null ? text : "";
    }
}
