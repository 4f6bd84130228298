package me.relaybot.gateway.domain.system.toolloop;

import me.relaybot.gateway.domain.component.ToolComponent;
import me.relaybot.gateway.domain.model.Message;
import me.relaybot.gateway.domain.model.ToolDefinition;
import me.relaybot.gateway.domain.model.ToolResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class DefaultToolExecutorTest {

    private ToolComponent echo;
    private ToolComponent disabled;
    private DefaultToolExecutor executor;

    @BeforeEach
    void setUp() {
        echo = tool("echo", true);
        disabled = tool("browse", false);
        executor = new DefaultToolExecutor(List.of(echo, disabled));
    }

    @Test
    void shouldDispatchToToolByName() {
        when(echo.execute(any())).thenReturn(CompletableFuture.completedFuture(ToolResult.success("pong")));

        ToolExecutionOutcome outcome = executor.execute(call("echo", Map.of("text", "ping")));

        assertFalse(outcome.synthetic());
        assertEquals("c1", outcome.toolCallId());
        assertEquals("echo", outcome.toolName());
        assertEquals("pong", outcome.messageContent());
        verify(echo).execute(Map.of("text", "ping"));
    }

    @Test
    void shouldPassEmptyArgumentsWhenNoneGiven() {
        when(echo.execute(any())).thenReturn(CompletableFuture.completedFuture(ToolResult.success("ok")));

        executor.execute(call("echo", null));

        verify(echo).execute(Map.of());
    }

    @Test
    void shouldReportFailureResultContent() {
        when(echo.execute(any())).thenReturn(CompletableFuture.completedFuture(ToolResult.failure("bad input")));

        ToolExecutionOutcome outcome = executor.execute(call("echo", Map.of()));

        assertFalse(outcome.synthetic());
        assertEquals("Error: bad input", outcome.messageContent());
    }

    @Test
    void shouldSynthesizeResultForUnknownTool() {
        ToolExecutionOutcome outcome = executor.execute(call("teleport", Map.of()));

        assertTrue(outcome.synthetic());
        assertEquals("Error: Unknown tool: teleport", outcome.messageContent());
    }

    @Test
    void shouldSynthesizeResultForDisabledTool() {
        ToolExecutionOutcome outcome = executor.execute(call("browse", Map.of()));

        assertTrue(outcome.synthetic());
        assertEquals("Error: Tool is disabled: browse", outcome.messageContent());
    }

    @Test
    void shouldSynthesizeResultWhenToolFails() {
        when(echo.execute(any())).thenReturn(CompletableFuture.failedFuture(new IllegalStateException("crashed")));

        ToolExecutionOutcome outcome = executor.execute(call("echo", Map.of()));

        assertTrue(outcome.synthetic());
        assertEquals("Error: Tool execution failed: crashed", outcome.messageContent());
    }

    @Test
    void shouldListOnlyEnabledTools() {
        List<ToolDefinition> definitions = executor.getToolDefinitions();

        assertEquals(1, definitions.size());
        assertEquals("echo", definitions.get(0).getName());
    }

    private static ToolComponent tool(String name, boolean enabled) {
        ToolComponent tool = mock(ToolComponent.class);
        when(tool.getToolName()).thenReturn(name);
        when(tool.isEnabled()).thenReturn(enabled);
        when(tool.getDefinition()).thenReturn(ToolDefinition.builder().name(name).description(name).build());
        return tool;
    }

    private static Message.ToolCall call(String name, Map<String, Object> arguments) {
        return Message.ToolCall.builder().id("c1").name(name).arguments(arguments).build();
    }
}
