package com.ralphtown.core.git;

import com.fasterxml.jackson.annotation.JsonProperty;

public record BranchInfo(
    String name,
    @JsonProperty("is_current") boolean current,
    @JsonProperty("is_remote") boolean remote,
    String upstream
) {}
