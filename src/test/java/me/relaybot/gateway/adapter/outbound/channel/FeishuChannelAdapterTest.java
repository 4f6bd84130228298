package me.relaybot.gateway.adapter.outbound.channel;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.relaybot.gateway.domain.model.OutboundMessage;
import me.relaybot.gateway.infrastructure.config.GatewayProperties;
import okhttp3.OkHttpClient;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FeishuChannelAdapterTest {

    private static final String TOKEN_PATH = "/open-apis/auth/v3/tenant_access_token/internal";
    private static final String TOKEN_BODY = "{\"code\":0,\"msg\":\"ok\",\"tenant_access_token\":\"t-123\",\"expire\":7200}";
    private static final String SEND_OK = "{\"code\":0,\"msg\":\"success\",\"data\":{}}";

    private MockWebServer server;
    private GatewayProperties properties;
    private ObjectMapper objectMapper;
    private FeishuChannelAdapter adapter;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();

        properties = new GatewayProperties();
        GatewayProperties.FeishuProperties feishu = properties.getChannels().getFeishu();
        feishu.setEnabled(true);
        feishu.setAppId("cli_app");
        feishu.setAppSecret("secret");
        feishu.setBaseUrl(server.url("/").toString());

        objectMapper = new ObjectMapper();
        Clock clock = Clock.fixed(Instant.parse("2026-03-01T10:00:00Z"), ZoneId.of("UTC"));
        adapter = new FeishuChannelAdapter(properties, new OkHttpClient(), objectMapper, clock);
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    void shouldSendTextMessageToChat() throws Exception {
        server.enqueue(new MockResponse().setBody(TOKEN_BODY));
        server.enqueue(new MockResponse().setBody(SEND_OK));

        adapter.send(new OutboundMessage("feishu", "oc_1", "hi")).get(5, TimeUnit.SECONDS);

        RecordedRequest tokenRequest = server.takeRequest();
        assertEquals(TOKEN_PATH, tokenRequest.getPath());
        JsonNode tokenBody = objectMapper.readTree(tokenRequest.getBody().readUtf8());
        assertEquals("cli_app", tokenBody.get("app_id").asText());
        assertEquals("secret", tokenBody.get("app_secret").asText());

        RecordedRequest sendRequest = server.takeRequest();
        assertEquals("/open-apis/im/v1/messages?receive_id_type=chat_id", sendRequest.getPath());
        assertEquals("Bearer t-123", sendRequest.getHeader("Authorization"));
        JsonNode body = objectMapper.readTree(sendRequest.getBody().readUtf8());
        assertEquals("oc_1", body.get("receive_id").asText());
        assertEquals("text", body.get("msg_type").asText());
        assertEquals("hi", objectMapper.readTree(body.get("content").asText()).get("text").asText());
    }

    @Test
    void shouldAddressUsersByOpenId() throws Exception {
        server.enqueue(new MockResponse().setBody(TOKEN_BODY));
        server.enqueue(new MockResponse().setBody(SEND_OK));

        adapter.send(new OutboundMessage("feishu", "ou_42", "ping")).get(5, TimeUnit.SECONDS);

        server.takeRequest();
        assertEquals("/open-apis/im/v1/messages?receive_id_type=open_id", server.takeRequest().getPath());
    }

    @Test
    void shouldReuseCachedToken() throws Exception {
        server.enqueue(new MockResponse().setBody(TOKEN_BODY));
        server.enqueue(new MockResponse().setBody(SEND_OK));
        server.enqueue(new MockResponse().setBody(SEND_OK));

        adapter.send(new OutboundMessage("feishu", "oc_1", "one")).get(5, TimeUnit.SECONDS);
        adapter.send(new OutboundMessage("feishu", "oc_1", "two")).get(5, TimeUnit.SECONDS);

        assertEquals(3, server.getRequestCount());
        assertEquals(TOKEN_PATH, server.takeRequest().getPath());
        assertTrue(server.takeRequest().getPath().startsWith("/open-apis/im/v1/messages"));
        assertTrue(server.takeRequest().getPath().startsWith("/open-apis/im/v1/messages"));
    }

    @Test
    void shouldFailWhenApiReturnsErrorCode() {
        server.enqueue(new MockResponse().setBody(TOKEN_BODY));
        server.enqueue(new MockResponse().setBody("{\"code\":230002,\"msg\":\"bot not in chat\"}"));

        ExecutionException error = assertThrows(ExecutionException.class,
                () -> adapter.send(new OutboundMessage("feishu", "oc_1", "hi")).get(5, TimeUnit.SECONDS));
        assertTrue(error.getCause().getMessage().contains("230002"));
    }

    @Test
    void shouldFailWhenTokenRequestRejected() {
        server.enqueue(new MockResponse().setResponseCode(500));

        assertThrows(ExecutionException.class,
                () -> adapter.send(new OutboundMessage("feishu", "oc_1", "hi")).get(5, TimeUnit.SECONDS));
        assertEquals(1, server.getRequestCount());
    }

    @Test
    void shouldRequireCredentialsToBeConfigured() {
        assertTrue(adapter.isConfigured());
        assertEquals("feishu", adapter.getChannelType());

        properties.getChannels().getFeishu().setAppSecret("");
        assertFalse(adapter.isConfigured());

        properties.getChannels().getFeishu().setAppSecret("secret");
        properties.getChannels().getFeishu().setEnabled(false);
        assertFalse(adapter.isConfigured());
    }
}
