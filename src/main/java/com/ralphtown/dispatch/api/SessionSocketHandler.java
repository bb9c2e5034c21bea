package com.ralphtown.dispatch.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ralphtown.core.events.EventBus;
import com.ralphtown.core.events.SessionEvent;
import com.ralphtown.core.persistence.RecordNotFoundException;
import com.ralphtown.core.process.ProcessControlException;
import com.ralphtown.core.session.SessionService;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;
import org.springframework.web.socket.CloseStatus;
import org.springframework.web.socket.TextMessage;
import org.springframework.web.socket.WebSocketSession;
import org.springframework.web.socket.handler.TextWebSocketHandler;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Live session channel at {@code /api/ws}.
 * <p>
 * Clients send JSON objects tagged by {@code type}:
 * <ul>
 *   <li>{@code subscribe} / {@code unsubscribe} with a {@code session_id}, answered by
 *       {@code subscribed} / {@code unsubscribed}</li>
 *   <li>{@code cancel} with a {@code session_id}, which stops a running session</li>
 *   <li>{@code ping}, answered by {@code pong}</li>
 * </ul>
 * Subscribed connections receive {@code output} and {@code status} messages for
 * their sessions. Malformed or failed requests are answered with
 * {@code {"type":"error","message":...}} and the connection stays open.
 * Every outgoing message goes through a {@link ClientOutbox}, so a stalled
 * connection never blocks the event publisher.
 */
@Component
public class SessionSocketHandler extends TextWebSocketHandler {

    private static final Logger log = LoggerFactory.getLogger(SessionSocketHandler.class);

    static final int OUTBOX_CAPACITY = 256;

    private static final Set<String> SESSION_REQUESTS = Set.of("subscribe", "unsubscribe", "cancel");

    private final EventBus eventBus;
    private final SessionService sessionService;
    private final ObjectMapper objectMapper;
    private final Executor sender;
    private final Map<String, Connection> connections = new ConcurrentHashMap<>();

    @Autowired
    public SessionSocketHandler(EventBus eventBus, SessionService sessionService, ObjectMapper objectMapper) {
        this(eventBus, sessionService, objectMapper, newSenderPool());
    }

    SessionSocketHandler(EventBus eventBus, SessionService sessionService, ObjectMapper objectMapper,
                         Executor sender) {
        this.eventBus = eventBus;
        this.sessionService = sessionService;
        this.objectMapper = objectMapper;
        this.sender = sender;
    }

    private static ExecutorService newSenderPool() {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "ws-sender-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    @PreDestroy
    public void shutdown() {
        connections.values().forEach(Connection::close);
        connections.clear();
        if (sender instanceof ExecutorService) {
            ((ExecutorService) sender).shutdownNow();
        }
    }

    @Override
    public void afterConnectionEstablished(WebSocketSession session) {
        connections.put(session.getId(), new Connection(session));
        log.debug("WebSocket {} connected", session.getId());
    }

    @Override
    public void afterConnectionClosed(WebSocketSession session, CloseStatus status) {
        Connection connection = connections.remove(session.getId());
        if (connection != null) {
            connection.close();
        }
        log.debug("WebSocket {} closed: {}", session.getId(), status);
    }

    @Override
    public void handleTransportError(WebSocketSession session, Throwable exception) {
        log.debug("WebSocket {} transport error: {}", session.getId(), exception.getMessage());
    }

    @Override
    protected void handleTextMessage(WebSocketSession session, TextMessage message) {
        Connection connection = connections.get(session.getId());
        if (connection == null) {
            return;
        }

        JsonNode request;
        try {
            request = objectMapper.readTree(message.getPayload());
        } catch (JsonProcessingException e) {
            connection.send(error("Invalid message: " + e.getOriginalMessage()));
            return;
        }

        String type = request.path("type").asText("");
        String sessionId = request.path("session_id").asText("");
        if (SESSION_REQUESTS.contains(type) && sessionId.isBlank()) {
            connection.send(error("session_id is required for " + type));
            return;
        }

        switch (type) {
            case "subscribe" -> {
                connection.subscribe(sessionId);
                connection.send(ack("subscribed", sessionId));
            }
            case "unsubscribe" -> {
                connection.unsubscribe(sessionId);
                connection.send(ack("unsubscribed", sessionId));
            }
            case "cancel" -> sender.execute(() -> cancel(connection, sessionId));
            case "ping" -> connection.send(Map.of("type", "pong"));
            default -> connection.send(error("Unknown message type: " + type));
        }
    }

    private void cancel(Connection connection, String sessionId) {
        try {
            sessionService.cancel(sessionId);
        } catch (RecordNotFoundException | ProcessControlException e) {
            connection.send(error(e.getMessage()));
        }
    }

    int connectionCount() {
        return connections.size();
    }

    private static Map<String, Object> ack(String type, String sessionId) {
        return Map.of("type", type, "session_id", sessionId);
    }

    private static Map<String, Object> error(String message) {
        return Map.of("type", "error", "message", message);
    }

    static Map<String, Object> toMessage(SessionEvent event) {
        Map<String, Object> message = new LinkedHashMap<>();
        message.put("type", event.eventType());
        message.put("session_id", event.sessionId());
        message.putAll(event.payload());
        return message;
    }

    /** One open socket and the sessions it listens to. */
    private final class Connection {

        private final WebSocketSession socket;
        private final ClientOutbox<String> outbox;
        private final Map<String, EventBus.Subscription> subscriptions = new ConcurrentHashMap<>();

        Connection(WebSocketSession socket) {
            this.socket = socket;
            this.outbox = new ClientOutbox<>("websocket " + socket.getId(), new ClientOutbox.Sink<>() {
                @Override
                public void send(String json) throws IOException {
                    socket.sendMessage(new TextMessage(json));
                }

                @Override
                public void complete() {
                    try {
                        socket.close();
                    } catch (IOException e) {
                        log.debug("Closing WebSocket {} failed: {}", socket.getId(), e.getMessage());
                    }
                }
            }, sender, OUTBOX_CAPACITY);
        }

        void subscribe(String sessionId) {
            subscriptions.computeIfAbsent(sessionId,
                    id -> eventBus.subscribe(id, event -> send(toMessage(event))));
        }

        void unsubscribe(String sessionId) {
            EventBus.Subscription subscription = subscriptions.remove(sessionId);
            if (subscription != null) {
                subscription.unsubscribe();
            }
        }

        void send(Map<String, Object> message) {
            try {
                outbox.offer(objectMapper.writeValueAsString(message));
            } catch (JsonProcessingException e) {
                log.warn("Could not encode {} message for WebSocket {}", message.get("type"), socket.getId(), e);
            }
        }

        void close() {
            subscriptions.values().forEach(EventBus.Subscription::unsubscribe);
            subscriptions.clear();
            outbox.close();
        }
    }
}
