package com.ralphtown.core.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * A git working tree registered with Ralphtown.
 *
 * @param id        UUID string
 * @param path      canonical absolute path of the working tree
 * @param name      display name, usually the directory name
 * @param createdAt when the repo was registered
 * @param updatedAt last modification of the record
 */
public record Repo(
    String id,
    String path,
    String name,
    @JsonProperty("created_at") Instant createdAt,
    @JsonProperty("updated_at") Instant updatedAt
) {}
