package com.ralphtown.core.git;

import com.fasterxml.jackson.annotation.JsonProperty;

public record CommitInfo(
    String id,
    @JsonProperty("short_id") String shortId,
    String message,
    String author,
    String email,
    String timestamp
) {}
