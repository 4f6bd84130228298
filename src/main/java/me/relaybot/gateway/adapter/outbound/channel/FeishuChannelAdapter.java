package me.relaybot.gateway.adapter.outbound.channel;

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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.relaybot.gateway.domain.model.OutboundMessage;
import me.relaybot.gateway.infrastructure.config.GatewayProperties;
import me.relaybot.gateway.port.outbound.OutboundChannelPort;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Delivers outbound messages as plain-text messages through the Feishu (Lark)
 * open platform. The tenant access token is cached until shortly before it
 * expires.
 */
@Component
@Slf4j
public class FeishuChannelAdapter implements OutboundChannelPort {

    static final String CHANNEL_TYPE = "feishu";

    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final long TOKEN_REFRESH_MARGIN_SECONDS = 60;

    private final GatewayProperties properties;
    private final OkHttpClient httpClient;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private String cachedToken;
    private Instant tokenExpiresAt = Instant.EPOCH;

    public FeishuChannelAdapter(GatewayProperties properties, OkHttpClient httpClient, ObjectMapper objectMapper,
            Clock clock) {
        this.properties = properties;
        this.httpClient = httpClient;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public String getChannelType() {
        return CHANNEL_TYPE;
    }

    @Override
    public boolean isConfigured() {
        GatewayProperties.FeishuProperties feishu = properties.getChannels().getFeishu();
        return feishu.isEnabled() && isSet(feishu.getAppId()) && isSet(feishu.getAppSecret());
    }

    @Override
    public CompletableFuture<Void> send(OutboundMessage message) {
        return CompletableFuture.runAsync(() -> {
            try {
                String token = getTenantToken();
                String receiveIdType = message.chatId() != null && message.chatId().startsWith("ou_")
                        ? "open_id"
                        : "chat_id";

                Map<String, Object> body = new LinkedHashMap<>();
                body.put("receive_id", message.chatId());
                body.put("msg_type", "text");
                body.put("content", objectMapper.writeValueAsString(Map.of("text", message.content())));

                HttpUrl url = HttpUrl.get(baseUrl() + "/open-apis/im/v1/messages").newBuilder()
                        .addQueryParameter("receive_id_type", receiveIdType)
                        .build();
                Request request = new Request.Builder()
                        .url(url)
                        .header("Authorization", "Bearer " + token)
                        .post(RequestBody.create(objectMapper.writeValueAsString(body), JSON))
                        .build();

                JsonNode response = execute(request);
                int code = response.path("code").asInt(-1);
                if (code != 0) {
                    throw new IOException("Feishu send failed: code=" + code + ", msg="
                            + response.path("msg").asText(""));
                }
                log.debug("[Feishu] Sent message to {} ({})", message.chatId(), receiveIdType);
            } catch (IOException e) {
                throw new UncheckedIOException(e);
            }
        });
    }

    synchronized String getTenantToken() throws IOException {
        Instant now = clock.instant();
        if (cachedToken != null && now.isBefore(tokenExpiresAt)) {
            return cachedToken;
        }

        GatewayProperties.FeishuProperties feishu = properties.getChannels().getFeishu();
        Map<String, String> body = Map.of("app_id", feishu.getAppId(), "app_secret", feishu.getAppSecret());
        Request request = new Request.Builder()
                .url(baseUrl() + "/open-apis/auth/v3/tenant_access_token/internal")
                .post(RequestBody.create(objectMapper.writeValueAsString(body), JSON))
                .build();

        JsonNode response = execute(request);
        if (response.path("code").asInt(-1) != 0 || !response.hasNonNull("tenant_access_token")) {
            throw new IOException("Feishu token request failed: " + response.path("msg").asText("unknown error"));
        }
        cachedToken = response.get("tenant_access_token").asText();
        long expiresIn = response.path("expire").asLong(7200);
        tokenExpiresAt = now.plusSeconds(Math.max(0, expiresIn - TOKEN_REFRESH_MARGIN_SECONDS));
        log.debug("[Feishu] Tenant access token refreshed, valid for {}s", expiresIn);
        return cachedToken;
    }

    private JsonNode execute(Request request) throws IOException {
        try (Response response = httpClient.newCall(request).execute()) {
            ResponseBody responseBody = response.body();
            if (!response.isSuccessful() || responseBody == null) {
                throw new IOException("Feishu API HTTP " + response.code());
            }
            return objectMapper.readTree(responseBody.string());
        }
    }

    private String baseUrl() {
        String baseUrl = properties.getChannels().getFeishu().getBaseUrl();
        return baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    }

    private static boolean isSet(String value) {
        return value != null && !value.isBlank();
    }
}
