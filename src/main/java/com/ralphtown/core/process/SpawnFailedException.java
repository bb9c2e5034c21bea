package com.ralphtown.core.process;

/**
 * The agent executable was found but the process could not be started.
 */
public class SpawnFailedException extends ProcessControlException {

    public SpawnFailedException(String detail) {
        super("Failed to spawn ralph process: " + detail);
    }

    public SpawnFailedException(String detail, Throwable cause) {
        super("Failed to spawn ralph process: " + detail, cause);
    }
}
