package me.relaybot.gateway.infrastructure.config;

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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Type-safe configuration for the gateway, bound from the {@code gateway.*}
 * keys of application.yml.
 */
@Component
@ConfigurationProperties(prefix = "gateway")
@Data
public class GatewayProperties {

    private LlmProperties llm = new LlmProperties();
    private TurnProperties turn = new TurnProperties();
    private SessionProperties session = new SessionProperties();
    private MemoryProperties memory = new MemoryProperties();
    private RagProperties rag = new RagProperties();
    private StorageProperties storage = new StorageProperties();
    private HttpProperties http = new HttpProperties();
    private ChannelsProperties channels = new ChannelsProperties();
    private ToolsProperties tools = new ToolsProperties();

    @Data
    public static class LlmProperties {
        private String baseUrl = "https://api.openai.com/v1";
        private String apiKey;
        private String model = "gpt-4o-mini";
        private Double temperature = 0.7;
        private Integer maxTokens = 4096;
        private long timeoutMs = 120000;
    }

    @Data
    public static class TurnProperties {
        private int maxIterations = 20;
    }

    @Data
    public static class SessionProperties {
        private String path = "/ws/chat";
        private long heartbeatIntervalMs = 15000;
        private String defaultSessionKey = "default";
        private String channelType = "ws";
        private int maxHistoryMessages = 40;
        private int maxSessions = 1000;
    }

    // ==================== MEMORY ====================

    @Data
    public static class MemoryProperties {
        private String directory = "memory";
        private String historyFile = "HISTORY.md";
        private String memoryFile = "MEMORY.md";
        private int retrievalTopK = 3;
        private int consolidationPeriod = 10;
        private int consolidationWindow = 50;
        private int questionLimit = 200;
        private int answerLimit = 300;
        private String promptDirectory = "";
    }

    @Data
    public static class RagProperties {
        private boolean enabled = false;
        private String url = "http://localhost:9621";
        private String apiKey = "";
        private String queryMode = "hybrid";
        private int timeoutSeconds = 10;
    }

    @Data
    public static class StorageProperties {
        private String basePath = "${user.home}/.relaybot/workspace";
    }

    @Data
    public static class HttpProperties {
        private long connectTimeout = 10000;
        private long readTimeout = 60000;
        private long writeTimeout = 60000;
        private int maxIdleConnections = 5;
        private long keepAliveDuration = 300000;
    }

    // ==================== CHANNELS ====================

    @Data
    public static class ChannelsProperties {
        private FeishuProperties feishu = new FeishuProperties();
        private TelegramProperties telegram = new TelegramProperties();
    }

    @Data
    public static class FeishuProperties {
        private boolean enabled = false;
        private String appId = "";
        private String appSecret = "";
        private String baseUrl = "https://open.feishu.cn";
    }

    @Data
    public static class TelegramProperties {
        private boolean enabled = false;
        private String token = "";
    }

    // ==================== TOOLS ====================

    @Data
    public static class ToolsProperties {
        private ExecToolProperties exec = new ExecToolProperties();
    }

    @Data
    public static class ExecToolProperties {
        private boolean enabled = true;
        private String workspace = "${user.home}/.relaybot/sandbox";
        private int defaultTimeout = 30;
        private int maxTimeout = 300;
    }
}
