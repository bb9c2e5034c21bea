package com.ralphtown.core.session;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.ralphtown.core.model.OutputLog;

import java.util.List;

/**
 * One page of a session's output records.
 *
 * @param total number of records matching the stream filter, ignoring paging
 */
public record OutputPage(
    @JsonProperty("session_id") String sessionId,
    List<OutputLog> logs,
    long total
) {}
