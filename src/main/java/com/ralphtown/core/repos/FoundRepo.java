package com.ralphtown.core.repos;

/** A git working tree discovered by a directory scan. */
public record FoundRepo(String path, String name) {}
