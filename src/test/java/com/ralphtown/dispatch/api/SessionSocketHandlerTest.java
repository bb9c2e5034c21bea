package com.ralphtown.dispatch.api;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ralphtown.core.events.EventBus;
import com.ralphtown.core.events.SessionEvent;
import com.ralphtown.core.process.NotRunningException;
import com.ralphtown.core.session.SessionService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class SessionSocketHandlerTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private EventBus eventBus;
    private SessionService sessionService;
    private SessionSocketHandler handler;
    private WebSocketSession socket;
    private List<String> sent;

    @BeforeEach
    void setUp() throws Exception {
        eventBus = new EventBus();
        sessionService = mock(SessionService.class);
        handler = new SessionSocketHandler(eventBus, sessionService, objectMapper, Runnable::run);

        sent = new CopyOnWriteArrayList<>();
        socket = mock(WebSocketSession.class);
        when(socket.getId()).thenReturn("ws-1");
        doAnswer(inv -> {
            sent.add(((TextMessage) inv.getArgument(0)).getPayload());
            return null;
        }).when(socket).sendMessage(any());
        handler.afterConnectionEstablished(socket);
    }

    private void receive(String json) {
        handler.handleTextMessage(socket, new TextMessage(json));
    }

    private Map<String, Object> lastMessage() throws Exception {
        assertFalse(sent.isEmpty(), "nothing was sent");
        return objectMapper.readValue(sent.get(sent.size() - 1), new TypeReference<>() {});
    }

    @Nested
    @DisplayName("subscriptions")
    class SubscriptionTests {

        @Test
        @DisplayName("subscribe is acknowledged and forwards the session's events")
        void subscribeForwardsEvents() throws Exception {
            receive("{\"type\":\"subscribe\",\"session_id\":\"S-1\"}");
            assertEquals(Map.of("type", "subscribed", "session_id", "S-1"), lastMessage());

            eventBus.publish(SessionEvent.output("S-1", "stdout", "hello"));
            assertEquals(Map.of("type", "output", "session_id", "S-1", "stream", "stdout", "content", "hello"),
                    lastMessage());

            eventBus.publish(SessionEvent.status("S-1", "completed"));
            assertEquals(Map.of("type", "status", "session_id", "S-1", "status", "completed"), lastMessage());
        }

        @Test
        @DisplayName("events of other sessions are not forwarded")
        void otherSessionsIgnored() {
            receive("{\"type\":\"subscribe\",\"session_id\":\"S-1\"}");
            int acked = sent.size();

            eventBus.publish(SessionEvent.output("S-2", "stdout", "elsewhere"));

            assertEquals(acked, sent.size());
        }

        @Test
        @DisplayName("subscribing twice delivers each event once")
        void duplicateSubscribe() {
            receive("{\"type\":\"subscribe\",\"session_id\":\"S-1\"}");
            receive("{\"type\":\"subscribe\",\"session_id\":\"S-1\"}");
            int acked = sent.size();

            eventBus.publish(SessionEvent.status("S-1", "running"));

            assertEquals(acked + 1, sent.size());
        }

        @Test
        @DisplayName("unsubscribe is acknowledged and stops delivery")
        void unsubscribeStopsDelivery() throws Exception {
            receive("{\"type\":\"subscribe\",\"session_id\":\"S-1\"}");
            receive("{\"type\":\"unsubscribe\",\"session_id\":\"S-1\"}");
            assertEquals(Map.of("type", "unsubscribed", "session_id", "S-1"), lastMessage());
            int acked = sent.size();

            eventBus.publish(SessionEvent.status("S-1", "running"));

            assertEquals(acked, sent.size());
        }

        @Test
        @DisplayName("closing the connection drops its subscriptions")
        void closeDropsSubscriptions() {
            receive("{\"type\":\"subscribe\",\"session_id\":\"S-1\"}");
            int acked = sent.size();

            handler.afterConnectionClosed(socket, CloseStatus.NORMAL);
            eventBus.publish(SessionEvent.status("S-1", "running"));

            assertEquals(acked, sent.size());
            assertEquals(0, handler.connectionCount());
        }
    }

    @Nested
    @DisplayName("requests")
    class RequestTests {

        @Test
        @DisplayName("ping is answered with pong")
        void pingPong() throws Exception {
            receive("{\"type\":\"ping\"}");
            assertEquals(Map.of("type", "pong"), lastMessage());
        }

        @Test
        @DisplayName("cancel stops the session")
        void cancel() {
            receive("{\"type\":\"cancel\",\"session_id\":\"S-1\"}");
            verify(sessionService).cancel("S-1");
        }

        @Test
        @DisplayName("cancel of an idle session reports an error and keeps the connection")
        void cancelNotRunning() throws Exception {
            doThrow(new NotRunningException("S-1")).when(sessionService).cancel("S-1");

            receive("{\"type\":\"cancel\",\"session_id\":\"S-1\"}");
            assertEquals("error", lastMessage().get("type"));

            receive("{\"type\":\"ping\"}");
            assertEquals(Map.of("type", "pong"), lastMessage());
        }

        @Test
        @DisplayName("malformed JSON is reported as an error")
        void malformedJson() throws Exception {
            receive("{not json");
            Map<String, Object> reply = lastMessage();
            assertEquals("error", reply.get("type"));
            assertTrue(reply.get("message").toString().startsWith("Invalid message"));
        }

        @Test
        @DisplayName("unknown message types are reported as errors")
        void unknownType() throws Exception {
            receive("{\"type\":\"launch\"}");
            assertEquals(Map.of("type", "error", "message", "Unknown message type: launch"), lastMessage());
        }

        @Test
        @DisplayName("session requests without a session_id are rejected")
        void missingSessionId() throws Exception {
            receive("{\"type\":\"subscribe\"}");
            assertEquals(Map.of("type", "error", "message", "session_id is required for subscribe"),
                    lastMessage());
        }
    }

    @Test
    @DisplayName("a stalled socket never blocks the event publisher")
    void stalledSocketDoesNotBlockPublisher() throws Exception {
        ExecutorService pool = Executors.newCachedThreadPool();
        SessionSocketHandler pooled = new SessionSocketHandler(eventBus, sessionService, objectMapper, pool);
        WebSocketSession stalled = mock(WebSocketSession.class);
        CountDownLatch entered = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        AtomicInteger writes = new AtomicInteger();
        when(stalled.getId()).thenReturn("ws-2");
        doAnswer(inv -> {
            entered.countDown();
            release.await();
            writes.incrementAndGet();
            return null;
        }).when(stalled).sendMessage(any());

        try {
            pooled.afterConnectionEstablished(stalled);
            pooled.handleTextMessage(stalled, new TextMessage("{\"type\":\"subscribe\",\"session_id\":\"S-1\"}"));
            assertTrue(entered.await(5, TimeUnit.SECONDS));

            assertTimeoutPreemptively(Duration.ofSeconds(5), () -> {
                for (int i = 0; i < 1_000; i++) {
                    eventBus.publish(SessionEvent.output("S-1", "stdout", "line " + i));
                }
            });

            release.countDown();
            long deadline = System.nanoTime() + Duration.ofSeconds(5).toNanos();
            while (writes.get() < SessionSocketHandler.OUTBOX_CAPACITY + 1 && System.nanoTime() < deadline) {
                Thread.sleep(20);
            }
            Thread.sleep(100);
            assertEquals(SessionSocketHandler.OUTBOX_CAPACITY + 1, writes.get());
        } finally {
            release.countDown();
            pool.shutdownNow();
        }
    }
}
