package me.relaybot.gateway.adapter.inbound.web;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.relaybot.gateway.domain.model.TurnEvent;
import me.relaybot.gateway.domain.session.ConnectionSession;
import me.relaybot.gateway.domain.session.ConnectionSessionFactory;
import me.relaybot.gateway.domain.session.EventChannel;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;
import org.reactivestreams.Publisher;
import org.springframework.core.io.buffer.DefaultDataBufferFactory;
import org.springframework.web.reactive.socket.WebSocketMessage;
import org.springframework.web.reactive.socket.WebSocketSession;
import reactor.core.publisher.Flux;
import reactor.test.StepVerifier;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class WebSocketChatHandlerTest {

    private ConnectionSessionFactory sessionFactory;
    private ConnectionSession connection;
    private ExecutorService turnExecutor;
    private ObjectMapper objectMapper;
    private WebSocketChatHandler handler;
    private final AtomicReference<EventChannel> channelRef = new AtomicReference<>();

    @BeforeEach
    void setUp() {
        sessionFactory = mock(ConnectionSessionFactory.class);
        connection = mock(ConnectionSession.class);
        turnExecutor = Executors.newSingleThreadExecutor();
        objectMapper = new ObjectMapper();

        when(connection.getId()).thenReturn("conn-1");
        when(sessionFactory.getTurnExecutor()).thenReturn(turnExecutor);
        when(sessionFactory.create(any(EventChannel.class))).thenAnswer(invocation -> {
            channelRef.set(invocation.getArgument(0));
            return connection;
        });

        handler = new WebSocketChatHandler(sessionFactory, objectMapper);
    }

    @AfterEach
    void tearDown() {
        turnExecutor.shutdownNow();
    }

    @Test
    void shouldStreamTurnEventsAsJsonFrames() throws Exception {
        doAnswer(invocation -> {
            channelRef.get().send(TurnEvent.thinking(1).withEmotion("thinking"));
            channelRef.get().send(TurnEvent.finalAnswer("Hi!", "happy", "s1", 1772359200.0));
            return null;
        }).when(connection).handlePayload(anyString());

        List<String> sent = new CopyOnWriteArrayList<>();
        WebSocketSession session = mockSession(List.of("{\"message\":\"hello\",\"session\":\"s1\"}"), sent);

        StepVerifier.create(handler.handle(session))
                .expectComplete()
                .verify(Duration.ofSeconds(5));

        assertEquals(2, sent.size());
        JsonNode thinking = objectMapper.readTree(sent.get(0));
        assertEquals("thinking", thinking.get("type").asText());
        assertEquals(1, thinking.get("iteration").asInt());
        assertEquals("thinking", thinking.get("emotion").asText());

        JsonNode answer = objectMapper.readTree(sent.get(1));
        assertEquals("final", answer.get("type").asText());
        assertEquals("Hi!", answer.get("content").asText());
        assertEquals("happy", answer.get("emotion").asText());
        assertEquals("s1", answer.get("session").asText());

        verify(connection).handlePayload("{\"message\":\"hello\",\"session\":\"s1\"}");
        verify(connection).close();
    }

    @Test
    void shouldHandleFramesInArrivalOrder() {
        List<String> sent = new CopyOnWriteArrayList<>();
        WebSocketSession session = mockSession(List.of("first", "second", "third"), sent);

        StepVerifier.create(handler.handle(session))
                .expectComplete()
                .verify(Duration.ofSeconds(5));

        InOrder order = inOrder(connection);
        order.verify(connection).handlePayload("first");
        order.verify(connection).handlePayload("second");
        order.verify(connection).handlePayload("third");
        order.verify(connection).close();
    }

    @Test
    void shouldCloseChannelWhenClientDisconnects() {
        WebSocketSession session = mockSession(List.of(), new CopyOnWriteArrayList<>());

        StepVerifier.create(handler.handle(session))
                .expectComplete()
                .verify(Duration.ofSeconds(5));

        EventChannel channel = channelRef.get();
        assertFalse(channel.isOpen());
        assertThrows(IllegalStateException.class, () -> channel.send(TurnEvent.heartbeat(1.0)));
    }

    @Test
    void shouldCompleteFramesWhenChannelCloses() {
        WebSocketEventChannel channel = new WebSocketEventChannel(objectMapper);
        channel.send(TurnEvent.error("Invalid JSON"));
        channel.close();

        StepVerifier.create(channel.frames())
                .expectNext("{\"type\":\"error\",\"message\":\"Invalid JSON\"}")
                .verifyComplete();
        assertFalse(channel.isOpen());
    }

    @SuppressWarnings("unchecked")
    private WebSocketSession mockSession(List<String> inbound, List<String> sent) {
        WebSocketSession session = mock(WebSocketSession.class);
        when(session.receive()).thenReturn(Flux.fromIterable(inbound).map(WebSocketChatHandlerTest::textFrame));
        when(session.textMessage(anyString())).thenAnswer(invocation -> textFrame(invocation.getArgument(0)));
        when(session.send(any(Publisher.class))).thenAnswer(invocation -> {
            Publisher<WebSocketMessage> publisher = invocation.getArgument(0);
            return Flux.from(publisher)
                    .doOnNext(message -> sent.add(message.getPayloadAsText()))
                    .then();
        });
        return session;
    }

    private static WebSocketMessage textFrame(String payload) {
        return new WebSocketMessage(WebSocketMessage.Type.TEXT,
                DefaultDataBufferFactory.sharedInstance.wrap(payload.getBytes(StandardCharsets.UTF_8)));
    }
}
