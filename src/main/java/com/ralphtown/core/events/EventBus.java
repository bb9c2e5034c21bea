package com.ralphtown.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Broadcasts session events to the SSE streams and other listeners.
 * <p>
 * Listeners attach to one session id or to {@link #subscribeAll all sessions}.
 * Events are handed over on the publishing thread, so listeners must not block;
 * the SSE layer queues per client for that reason. A listener that throws is
 * logged and the remaining listeners still receive the event.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final Map<String, List<Consumer<SessionEvent>>> bySession = new ConcurrentHashMap<>();
    private final List<Consumer<SessionEvent>> everySession = new CopyOnWriteArrayList<>();

    public void publish(SessionEvent event) {
        List<Consumer<SessionEvent>> listeners = bySession.getOrDefault(event.sessionId(), List.of());
        log.debug("Session {}: {} event to {} listener(s)", event.sessionId(), event.eventType(),
                listeners.size() + everySession.size());
        listeners.forEach(listener -> hand(listener, event));
        everySession.forEach(listener -> hand(listener, event));
    }

    /**
     * Listen to one session. The session's entry is dropped once its last
     * listener unsubscribes.
     */
    public Subscription subscribe(String sessionId, Consumer<SessionEvent> listener) {
        Objects.requireNonNull(sessionId, "sessionId");
        bySession.computeIfAbsent(sessionId, id -> new CopyOnWriteArrayList<>()).add(listener);
        return () -> bySession.computeIfPresent(sessionId, (id, listeners) -> {
            listeners.remove(listener);
            return listeners.isEmpty() ? null : listeners;
        });
    }

    public Subscription subscribeAll(Consumer<SessionEvent> listener) {
        everySession.add(listener);
        return () -> everySession.remove(listener);
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private static void hand(Consumer<SessionEvent> listener, SessionEvent event) {
        try {
            listener.accept(event);
        } catch (RuntimeException e) {
            log.warn("Listener failed on {} event for session {}", event.eventType(), event.sessionId(), e);
        }
    }
}
