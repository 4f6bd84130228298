package me.relaybot.gateway.tools;

import me.relaybot.gateway.domain.model.OutboundMessage;
import me.relaybot.gateway.domain.model.ToolResult;
import me.relaybot.gateway.domain.model.Turn;
import me.relaybot.gateway.domain.service.OutboundDispatchBus;
import me.relaybot.gateway.domain.system.toolloop.TurnContextHolder;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

class MessageToolTest {

    private OutboundDispatchBus dispatchBus;
    private MessageTool tool;

    @BeforeEach
    void setUp() {
        dispatchBus = mock(OutboundDispatchBus.class);
        tool = new MessageTool(dispatchBus);
    }

    @AfterEach
    void tearDown() {
        TurnContextHolder.clear();
    }

    @Test
    void shouldQueueMessageForOtherChannel() {
        TurnContextHolder.set(Turn.builder().originChannel("ws").chatId("default").build());

        ToolResult result = tool.execute(Map.of("content", "hi", "channel", "feishu", "chat_id", "oc_1")).join();

        assertTrue(result.isSuccess());
        assertEquals("Message queued for feishu:oc_1", result.getOutput());
        verify(dispatchBus).publish(new OutboundMessage("feishu", "oc_1", "hi"));
    }

    @Test
    void shouldRefuseSendingToCurrentConversation() {
        TurnContextHolder.set(Turn.builder().originChannel("feishu").chatId("oc_1").build());

        ToolResult result = tool.execute(Map.of("content", "hi", "channel", "feishu", "chat_id", "oc_1")).join();

        assertTrue(result.isSuccess());
        assertTrue(result.getOutput().startsWith("Not sent"));
        verify(dispatchBus, never()).publish(any());
    }

    @Test
    void shouldQueueWithoutActiveTurn() {
        ToolResult result = tool.execute(Map.of("content", "hi", "channel", "telegram", "chat_id", "42")).join();

        assertTrue(result.isSuccess());
        verify(dispatchBus).publish(new OutboundMessage("telegram", "42", "hi"));
    }

    @Test
    void shouldFailOnMissingParameters() {
        ToolResult result = tool.execute(Map.of("content", "hi", "channel", " ")).join();

        assertFalse(result.isSuccess());
        assertEquals("Missing required parameters: content, channel, chat_id", result.getError());
        verify(dispatchBus, never()).publish(any());
    }
}
