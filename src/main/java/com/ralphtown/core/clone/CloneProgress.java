package com.ralphtown.core.clone;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Point-in-time counters from an in-flight clone. Later snapshots supersede earlier ones.
 */
public record CloneProgress(
    @JsonProperty("received_objects") long receivedObjects,
    @JsonProperty("total_objects") long totalObjects,
    @JsonProperty("received_bytes") long receivedBytes,
    @JsonProperty("indexed_objects") long indexedObjects,
    @JsonProperty("total_deltas") long totalDeltas,
    @JsonProperty("indexed_deltas") long indexedDeltas
) {}
