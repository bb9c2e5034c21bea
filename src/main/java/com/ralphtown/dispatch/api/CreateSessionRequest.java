package com.ralphtown.dispatch.api;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Inbound JSON body for POST /api/sessions.
 *
 * @param repoId repository the session works in
 * @param name   optional display name
 */
public record CreateSessionRequest(
    @JsonProperty("repo_id") String repoId,
    String name
) {}
