package me.relaybot.gateway.adapter.outbound.rag;

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

import me.relaybot.gateway.infrastructure.config.GatewayProperties;
import me.relaybot.gateway.port.outbound.RagPort;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/**
 * Retrieval store backed by a LightRAG server. Queries run in context-only
 * mode, so the server returns the matched passages instead of a generated
 * answer.
 */
@Component
@Slf4j
public class LightRagAdapter implements RagPort {

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");

    private final GatewayProperties properties;
    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;

    public LightRagAdapter(GatewayProperties properties, OkHttpClient baseHttpClient, ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;

        int timeoutSeconds = properties.getRag().getTimeoutSeconds();
        this.httpClient = baseHttpClient.newBuilder()
                .callTimeout(timeoutSeconds, TimeUnit.SECONDS)
                .readTimeout(timeoutSeconds, TimeUnit.SECONDS)
                .build();
    }

    @Override
    public CompletableFuture<List<String>> retrieve(String query, int topK) {
        if (!isAvailable()) {
            return CompletableFuture.completedFuture(List.of());
        }

        return CompletableFuture.supplyAsync(() -> {
            GatewayProperties.RagProperties rag = properties.getRag();
            try {
                String body = objectMapper.writeValueAsString(
                        new QueryRequest(query, rag.getQueryMode(), true, topK));

                Request.Builder requestBuilder = new Request.Builder()
                        .url(rag.getUrl() + "/query")
                        .post(RequestBody.create(body, JSON));
                addApiKeyHeader(requestBuilder);

                try (Response response = httpClient.newCall(requestBuilder.build()).execute()) {
                    ResponseBody responseBody = response.body();
                    if (!response.isSuccessful() || responseBody == null) {
                        throw new IOException("LightRAG query failed: HTTP " + response.code());
                    }
                    List<String> passages = parsePassages(responseBody.string(), topK);
                    log.debug("[RAG] Retrieved {} passage(s)", passages.size());
                    return passages;
                }
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        });
    }

    @Override
    public boolean isAvailable() {
        GatewayProperties.RagProperties rag = properties.getRag();
        return rag.isEnabled() && rag.getUrl() != null && !rag.getUrl().isBlank();
    }

    private void addApiKeyHeader(Request.Builder builder) {
        String apiKey = properties.getRag().getApiKey();
        if (apiKey != null && !apiKey.isBlank()) {
            builder.header("Authorization", "Bearer " + apiKey);
        }
    }

    private List<String> parsePassages(String responseBody, int topK) {
        List<String> passages = new ArrayList<>();
        try {
            JsonNode node = objectMapper.readTree(responseBody);
            JsonNode chunks = node.path("chunks");
            if (chunks.isArray()) {
                for (JsonNode chunk : chunks) {
                    String text = chunk.isTextual() ? chunk.asText() : chunk.path("content").asText("");
                    addIfPresent(passages, text, topK);
                }
                return passages;
            }
            // {"response": "..."} carries the whole context block as one passage
            addIfPresent(passages, node.path("response").asText(""), topK);
        } catch (JsonProcessingException e) {
            log.debug("[RAG] Failed to parse query response, using raw text");
            addIfPresent(passages, responseBody, topK);
        }
        return passages;
    }

    private static void addIfPresent(List<String> passages, String text, int limit) {
        if (text != null && !text.isBlank() && passages.size() < limit) {
            passages.add(text.trim());
        }
    }

    record QueryRequest(String query, String mode,
            @JsonProperty("only_need_context") boolean onlyNeedContext,
            @JsonProperty("top_k") int topK) {
    }
}
