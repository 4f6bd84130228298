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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.relaybot.gateway.domain.model.Message;
import me.relaybot.gateway.infrastructure.config.GatewayProperties;
import me.relaybot.gateway.port.outbound.StoragePort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletionException;

/**
 * Builds the initial model context for a turn: a system prompt assembled from
 * the workspace bootstrap files and the long-term memory document, followed by
 * the session's recent exchanges and the (already augmented) user content.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ConversationContextBuilder {

    static final List<String> BOOTSTRAP_FILES = List.of("SOUL.md", "AGENTS.md", "USER.md");

    private static final DateTimeFormatter NOW_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm (EEEE)");

    private final StoragePort storagePort;
    private final ConversationHistoryService historyService;
    private final GatewayProperties properties;
    private final Clock clock;

    public List<Message> build(String sessionKey, String userContent) {
        List<Message> context = new ArrayList<>();
        context.add(Message.system(buildSystemPrompt()));
        context.addAll(historyService.recent(sessionKey));
        context.add(Message.user(userContent));
        return context;
    }

    String buildSystemPrompt() {
        StringBuilder prompt = new StringBuilder();
        prompt.append("# Runtime\n")
                .append("Current time: ").append(ZonedDateTime.now(clock).format(NOW_FORMAT)).append('\n');

        String promptDirectory = properties.getMemory().getPromptDirectory();
        for (String file : BOOTSTRAP_FILES) {
            String content = readQuietly(promptDirectory, file);
            if (content != null && !content.isBlank()) {
                prompt.append("\n## ").append(file).append("\n\n").append(content.strip()).append('\n');
            }
        }

        GatewayProperties.MemoryProperties memory = properties.getMemory();
        String longTerm = readQuietly(memory.getDirectory(), memory.getMemoryFile());
        if (longTerm != null && !longTerm.isBlank()) {
            prompt.append("\n# Memory\n\n## Long-term Memory\n").append(longTerm.strip()).append('\n');
        }
        return prompt.toString();
    }

    private String readQuietly(String directory, String file) {
        try {
            return storagePort.getText(directory, file).join();
        } catch (CompletionException | IllegalArgumentException e) {
            log.warn("[Context] Failed to read {}/{}: {}", directory, file, e.getMessage());
            return null;
        }
    }
}
