package com.ralphtown.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * A unit of work pairing one repository with runs of the agent process.
 *
 * @param id           UUID string
 * @param repoId       owning repository
 * @param name         optional display name; nullable
 * @param orchestrator agent flavour, always "ralph" for now
 * @param status       current lifecycle status
 * @param createdAt    creation time
 * @param updatedAt    time of the last status change
 */
public record Session(
    String id,
    @JsonProperty("repo_id") String repoId,
    String name,
    String orchestrator,
    SessionStatus status,
    @JsonProperty("created_at") Instant createdAt,
    @JsonProperty("updated_at") Instant updatedAt
) {}
