package com.ralphtown.core.events;

import java.time.Instant;
import java.util.Map;

/**
 * A live event about one session, fanned out to SSE clients and CLI watchers.
 *
 * @param eventType  {@link #STATUS} or {@link #OUTPUT}
 * @param sessionId  the session (and broadcast topic) this event belongs to
 * @param payload    event data, e.g. {@code status} or {@code stream}/{@code content}
 * @param timestamp  when the event occurred
 */
public record SessionEvent(
    String eventType,
    String sessionId,
    Map<String, Object> payload,
    Instant timestamp
) {

    public static final String STATUS = "status";
    public static final String OUTPUT = "output";

    public static SessionEvent status(String sessionId, String status) {
        return new SessionEvent(STATUS, sessionId, Map.of("status", status), Instant.now());
    }

    public static SessionEvent output(String sessionId, String stream, String content) {
        return new SessionEvent(OUTPUT, sessionId, Map.of("stream", stream, "content", content), Instant.now());
    }
}
