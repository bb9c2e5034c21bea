package com.ralphtown.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public record Message(
    String id,
    @JsonProperty("session_id") String sessionId,
    MessageRole role,
    String content,
    @JsonProperty("created_at") Instant createdAt
) {}
