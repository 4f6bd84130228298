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
import me.relaybot.gateway.domain.model.Message;
import me.relaybot.gateway.infrastructure.config.GatewayProperties;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Bounded in-memory window of user/assistant exchanges per session key. Only
 * the final exchange of each turn is kept; intermediate tool traffic is not.
 * At most {@code max-sessions} keys are held, the least recently used one is
 * evicted first.
 */
@Service
@Slf4j
public class ConversationHistoryService {

    private final Map<String, Deque<Message>> sessions;
    private final GatewayProperties properties;
    private final Clock clock;

    public ConversationHistoryService(GatewayProperties properties, Clock clock) {
        this.properties = properties;
        this.clock = clock;
        int maxSessions = Math.max(1, properties.getSession().getMaxSessions());
        this.sessions = Collections.synchronizedMap(new LinkedHashMap<String, Deque<Message>>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, Deque<Message>> eldest) {
                boolean evict = size() > maxSessions;
                if (evict) {
                    log.debug("[History] Evicting least recently used session {}", eldest.getKey());
                }
                return evict;
            }
        });
    }

    public List<Message> recent(String sessionKey) {
        Deque<Message> window = sessions.get(sessionKey);
        if (window == null) {
            return List.of();
        }
        synchronized (window) {
            return List.copyOf(window);
        }
    }

    public void appendExchange(String sessionKey, String userText, String assistantText) {
        int limit = Math.max(2, properties.getSession().getMaxHistoryMessages());
        Deque<Message> window = sessions.computeIfAbsent(sessionKey, key -> new ArrayDeque<>());
        synchronized (window) {
            window.addLast(timestamped(Message.user(userText)));
            window.addLast(timestamped(Message.assistant(assistantText)));
            while (window.size() > limit) {
                window.removeFirst();
            }
        }
        log.trace("[History] Session {} now holds {} message(s)", sessionKey, window.size());
    }

    public int sessionCount() {
        return sessions.size();
    }

    private Message timestamped(Message message) {
        message.setTimestamp(clock.instant());
        return message;
    }
}
