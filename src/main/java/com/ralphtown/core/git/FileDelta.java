package com.ralphtown.core.git;

/** Line counts for one changed file. */
public record FileDelta(String path, int added, int removed) {}
