package me.relaybot.gateway.domain.service;

import me.relaybot.gateway.domain.model.Message;
import me.relaybot.gateway.infrastructure.config.GatewayProperties;
import me.relaybot.gateway.port.outbound.StoragePort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class ConversationContextBuilderTest {

    private StoragePort storagePort;
    private ConversationHistoryService historyService;
    private ConversationContextBuilder builder;

    @BeforeEach
    void setUp() {
        storagePort = mock(StoragePort.class);
        GatewayProperties properties = new GatewayProperties();
        Clock clock = Clock.fixed(Instant.parse("2026-03-01T10:15:00Z"), ZoneId.of("UTC"));
        historyService = new ConversationHistoryService(properties, clock);
        builder = new ConversationContextBuilder(storagePort, historyService, properties, clock);

        when(storagePort.getText(anyString(), anyString())).thenReturn(CompletableFuture.completedFuture(null));
    }

    @Test
    void shouldPlaceSystemPromptHistoryAndUserMessageInOrder() {
        historyService.appendExchange("s1", "earlier question", "earlier answer");

        List<Message> context = builder.build("s1", "new question");

        assertEquals(4, context.size());
        assertTrue(context.get(0).isSystemMessage());
        assertEquals("earlier question", context.get(1).getContent());
        assertEquals("earlier answer", context.get(2).getContent());
        assertTrue(context.get(3).isUserMessage());
        assertEquals("new question", context.get(3).getContent());
    }

    @Test
    void shouldIncludeRuntimeTime() {
        String prompt = builder.buildSystemPrompt();

        assertTrue(prompt.startsWith("# Runtime\nCurrent time: 2026-03-01 10:15"));
        assertFalse(prompt.contains("# Memory"));
    }

    @Test
    void shouldIncludeBootstrapFilesAndLongTermMemory() {
        when(storagePort.getText("", "SOUL.md"))
                .thenReturn(CompletableFuture.completedFuture("You are Relay, a calm assistant.\n"));
        when(storagePort.getText("memory", "MEMORY.md"))
                .thenReturn(CompletableFuture.completedFuture("- User name is Ada\n"));

        String prompt = builder.buildSystemPrompt();

        assertTrue(prompt.contains("\n## SOUL.md\n\nYou are Relay, a calm assistant.\n"));
        assertFalse(prompt.contains("## AGENTS.md"));
        assertTrue(prompt.endsWith("\n# Memory\n\n## Long-term Memory\n- User name is Ada\n"));
    }

    @Test
    void shouldSkipUnreadableFiles() {
        when(storagePort.getText("", "USER.md")).thenReturn(
                CompletableFuture.failedFuture(new UncheckedIOException(new IOException("permission denied"))));

        String prompt = builder.buildSystemPrompt();

        assertFalse(prompt.contains("USER.md"));
    }
}
