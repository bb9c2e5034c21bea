package com.ralphtown.core.git;

/** Result of running a git command. */
public record CommandOutput(boolean success, String stdout, String stderr) {}
