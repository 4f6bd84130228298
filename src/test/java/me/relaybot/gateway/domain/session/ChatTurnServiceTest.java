package me.relaybot.gateway.domain.session;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.relaybot.gateway.domain.model.ChatReply;
import me.relaybot.gateway.domain.model.LlmResponse;
import me.relaybot.gateway.domain.model.Message;
import me.relaybot.gateway.domain.model.Turn;
import me.relaybot.gateway.domain.model.TurnEvent;
import me.relaybot.gateway.domain.model.TurnResult;
import me.relaybot.gateway.domain.service.ConversationContextBuilder;
import me.relaybot.gateway.domain.service.ConversationHistoryService;
import me.relaybot.gateway.domain.service.EmotionClassifier;
import me.relaybot.gateway.domain.service.MemoryScheduler;
import me.relaybot.gateway.domain.service.ResponseCleaner;
import me.relaybot.gateway.domain.system.toolloop.DefaultHistoryWriter;
import me.relaybot.gateway.domain.system.toolloop.ToolExecutorPort;
import me.relaybot.gateway.domain.system.toolloop.TurnExecutionException;
import me.relaybot.gateway.domain.system.toolloop.TurnOrchestrator;
import me.relaybot.gateway.infrastructure.config.GatewayProperties;
import me.relaybot.gateway.port.outbound.LlmPort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ChatTurnServiceTest {

    private static final Instant NOW = Instant.parse("2026-03-01T10:00:00Z");
    private static final String ANSWER = "好的，已完成\n- 第一项\n- 第二项";
    private static final String CLEAN_ANSWER = "好的，已完成\n第一项\n第二项";

    private LlmPort llmPort;
    private MemoryScheduler memoryScheduler;
    private ConversationContextBuilder contextBuilder;
    private ConversationHistoryService historyService;
    private Clock clock;
    private ChatTurnService service;

    @BeforeEach
    void setUp() {
        llmPort = mock(LlmPort.class);
        ToolExecutorPort toolExecutor = mock(ToolExecutorPort.class);
        memoryScheduler = mock(MemoryScheduler.class);
        contextBuilder = mock(ConversationContextBuilder.class);
        historyService = mock(ConversationHistoryService.class);
        clock = Clock.fixed(NOW, ZoneId.of("UTC"));

        when(llmPort.isAvailable()).thenReturn(true);
        when(llmPort.getCurrentModel()).thenReturn("test-model");
        when(llmPort.chat(any())).thenAnswer(invocation -> CompletableFuture.completedFuture(
                LlmResponse.builder().content(ANSWER).build()));
        when(toolExecutor.getToolDefinitions()).thenReturn(List.of());
        when(memoryScheduler.augment(anyString())).thenAnswer(invocation -> invocation.getArgument(0));
        when(contextBuilder.build(anyString(), anyString()))
                .thenAnswer(invocation -> List.of(Message.user(invocation.getArgument(1))));

        TurnOrchestrator orchestrator = new TurnOrchestrator(llmPort, toolExecutor, new DefaultHistoryWriter(clock),
                new ObjectMapper(), new GatewayProperties());
        service = new ChatTurnService(orchestrator, memoryScheduler, contextBuilder, historyService,
                new EmotionClassifier(), new ResponseCleaner(), clock);
    }

    @Test
    void shouldRunSilentlyAndReturnCleanedReply() {
        when(memoryScheduler.augment("hello")).thenReturn("CTX\n\nhello");

        ChatReply reply = service.execute("hello", "s1", "short", "api", null);

        assertEquals(new ChatReply(CLEAN_ANSWER, "happy", "s1", NOW.toEpochMilli() / 1000.0), reply);
        verify(contextBuilder).build("s1", "CTX\n\nhello\n\n(Reply requirements: short)");
        verify(historyService).appendExchange("s1", "hello", ANSWER);
        verify(memoryScheduler).recordAsync("s1", "hello", CLEAN_ANSWER);
    }

    @Test
    void shouldGiveSameReplyWithAndWithoutSink() {
        List<TurnEvent> events = new ArrayList<>();

        ChatReply silent = service.execute("hello", "s1", null, "api", null);
        ChatReply streamed = service.execute("hello", "s1", null, "ws", events::add);

        assertEquals(silent, streamed);
        assertEquals(List.of(TurnEvent.thinking(1)), events);
        verify(contextBuilder, times(2)).build("s1", "hello");
    }

    @Test
    void shouldRethrowTurnFailureWithoutRecording() {
        TurnOrchestrator orchestrator = mock(TurnOrchestrator.class);
        when(orchestrator.run(any(Turn.class), anyList()))
                .thenThrow(new TurnExecutionException("Model call failed: down", new IllegalStateException("down")));
        ChatTurnService failing = new ChatTurnService(orchestrator, memoryScheduler, contextBuilder, historyService,
                new EmotionClassifier(), new ResponseCleaner(), clock);

        TurnExecutionException error = assertThrows(TurnExecutionException.class,
                () -> failing.execute("hello", "s1", null, "api", null));

        assertEquals("Model call failed: down", error.getMessage());
        verify(historyService, never()).appendExchange(anyString(), anyString(), anyString());
        verify(memoryScheduler, never()).recordAsync(anyString(), anyString(), anyString());
    }

    @Test
    void shouldRecordOriginChannelOnTurn() {
        TurnOrchestrator orchestrator = mock(TurnOrchestrator.class);
        when(orchestrator.run(any(Turn.class), anyList()))
                .thenReturn(new TurnResult("ok", List.of(), false, 1));
        ChatTurnService recording = new ChatTurnService(orchestrator, memoryScheduler, contextBuilder,
                historyService, new EmotionClassifier(), new ResponseCleaner(), clock);

        recording.execute("hi", "s9", null, "api", null);

        ArgumentCaptor<Turn> captor = ArgumentCaptor.forClass(Turn.class);
        verify(orchestrator).run(captor.capture(), anyList());
        assertEquals("api", captor.getValue().getOriginChannel());
        assertEquals("s9", captor.getValue().getSessionKey());
        assertFalse(captor.getValue().getId().isBlank());
    }

    @Test
    void shouldReportReadinessFromProvider() {
        when(llmPort.isAvailable()).thenReturn(false);

        assertFalse(service.isReady());
    }
}
