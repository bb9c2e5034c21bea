package com.ralphtown.dispatch.api;

import com.ralphtown.core.clone.CloneEvent;
import com.ralphtown.core.clone.CloneProgress;
import com.ralphtown.core.clone.CloneProgressRelay;
import com.ralphtown.core.events.EventBus;
import com.ralphtown.core.events.SessionEvent;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Turns live session events and clone progress into {@link SseEmitter} streams.
 * <p>
 * Session streams subscribe to the {@link EventBus} for one session and forward
 * {@code status} and {@code output} events until the client goes away. Clone streams
 * forward the events of one {@link CloneProgressRelay} run and complete after its
 * terminal event. Every open stream receives a comment heartbeat every 30 seconds.
 * <p>
 * Events reach a client through its {@link ClientOutbox}, so publishers and the
 * heartbeat never wait on a slow connection.
 */
@Service
public class SseStreamingService {

    private static final Logger log = LoggerFactory.getLogger(SseStreamingService.class);

    /** Session streams stay open while agents run for a long time. */
    private static final long DEFAULT_TIMEOUT_MS = 30 * 60 * 1000L;

    private static final long HEARTBEAT_INTERVAL_SECONDS = 30;

    static final int OUTBOX_CAPACITY = 256;

    private final EventBus eventBus;
    private final CloneProgressRelay cloneRelay;
    private final long timeoutMs;

    private final CopyOnWriteArrayList<EmitterRegistration> activeRegistrations = new CopyOnWriteArrayList<>();

    private final ScheduledExecutorService heartbeatScheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "sse-heartbeat");
        t.setDaemon(true);
        return t;
    });

    private final ExecutorService sender = newSenderPool();

    @Autowired
    public SseStreamingService(EventBus eventBus, CloneProgressRelay cloneRelay) {
        this(eventBus, cloneRelay, DEFAULT_TIMEOUT_MS);
    }

    SseStreamingService(EventBus eventBus, CloneProgressRelay cloneRelay, long timeoutMs) {
        this.eventBus = eventBus;
        this.cloneRelay = cloneRelay;
        this.timeoutMs = timeoutMs;
    }

    private static ExecutorService newSenderPool() {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "sse-sender-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /** Creates the emitter behind each stream. */
    SseEmitter newEmitter(long timeout) {
        return new SseEmitter(timeout);
    }

    @PostConstruct
    void startHeartbeat() {
        heartbeatScheduler.scheduleAtFixedRate(
                this::sendHeartbeats,
                HEARTBEAT_INTERVAL_SECONDS,
                HEARTBEAT_INTERVAL_SECONDS,
                TimeUnit.SECONDS
        );
    }

    @PreDestroy
    void stopHeartbeat() {
        heartbeatScheduler.shutdown();
        try {
            if (!heartbeatScheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                heartbeatScheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            heartbeatScheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        sender.shutdownNow();
    }

    private void sendHeartbeats() {
        for (EmitterRegistration registration : activeRegistrations) {
            registration.outbox().offer(SseEmitter.event().comment("heartbeat"));
        }
    }

    /**
     * Creates an emitter streaming {@code status} and {@code output} events for a session.
     */
    public SseEmitter createEmitter(String sessionId) {
        SseEmitter emitter = newEmitter(timeoutMs);
        ClientOutbox<SseEmitter.SseEventBuilder> outbox =
                ClientOutbox.forEmitter("session " + sessionId, emitter, sender, OUTBOX_CAPACITY);

        EventBus.Subscription subscription = eventBus.subscribe(sessionId, event -> outbox.offer(toSse(event)));
        register(new EmitterRegistration("session " + sessionId, emitter, outbox, subscription));
        outbox.offer(SseEmitter.event().comment("connected"));

        log.info("SSE emitter created for session {} (timeout={}ms)", sessionId, timeoutMs);
        return emitter;
    }

    /**
     * Starts a clone and returns an emitter carrying its progress, completing after the
     * terminal {@code complete} or {@code error} event.
     */
    public SseEmitter createCloneEmitter(String url) {
        SseEmitter emitter = newEmitter(0L);
        ClientOutbox<SseEmitter.SseEventBuilder> outbox =
                ClientOutbox.forEmitter("clone " + url, emitter, sender, OUTBOX_CAPACITY);
        register(new EmitterRegistration("clone " + url, emitter, outbox, () -> {}));

        cloneRelay.relay(url, event -> {
            SseEmitter.SseEventBuilder sse = SseEmitter.event().name(event.type()).data(clonePayload(event));
            if (event.isTerminal()) {
                outbox.offerFinal(sse);
            } else {
                outbox.offer(sse);
            }
        });
        return emitter;
    }

    public int activeEmitterCount() {
        return activeRegistrations.size();
    }

    static Map<String, Object> clonePayload(CloneEvent event) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("type", event.type());
        if (event instanceof CloneEvent.Progress progress) {
            CloneProgress p = progress.progress();
            data.put("received_objects", p.receivedObjects());
            data.put("total_objects", p.totalObjects());
            data.put("received_bytes", p.receivedBytes());
            data.put("indexed_objects", p.indexedObjects());
            data.put("total_deltas", p.totalDeltas());
            data.put("indexed_deltas", p.indexedDeltas());
        } else if (event instanceof CloneEvent.Complete complete) {
            data.put("repo", complete.repo());
            data.put("message", complete.message());
        } else if (event instanceof CloneEvent.Failed failed) {
            data.put("message", failed.message());
            data.put("help_steps", failed.helpSteps());
        }
        return data;
    }

    private void register(EmitterRegistration registration) {
        activeRegistrations.add(registration);
        SseEmitter emitter = registration.emitter();
        emitter.onCompletion(() -> cleanup(registration));
        emitter.onTimeout(() -> {
            log.debug("SSE emitter timed out for {}", registration.topic());
            cleanup(registration);
        });
        emitter.onError(ex -> {
            log.debug("SSE emitter error for {}: {}", registration.topic(), ex.getMessage());
            cleanup(registration);
        });
    }

    private static SseEmitter.SseEventBuilder toSse(SessionEvent event) {
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("session_id", event.sessionId());
        data.putAll(event.payload());
        data.put("timestamp", event.timestamp().toString());
        return SseEmitter.event().name(event.eventType()).data(data);
    }

    private void cleanup(EmitterRegistration registration) {
        registration.subscription().unsubscribe();
        registration.outbox().close();
        activeRegistrations.remove(registration);
    }

    private record EmitterRegistration(
            String topic,
            SseEmitter emitter,
            ClientOutbox<SseEmitter.SseEventBuilder> outbox,
            EventBus.Subscription subscription
    ) {}
}
