package com.ralphtown.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * One line of agent output. Append-only; {@code id} increases monotonically.
 */
public record OutputLog(
    long id,
    @JsonProperty("session_id") String sessionId,
    LogStream stream,
    String content,
    @JsonProperty("created_at") Instant createdAt
) {}
