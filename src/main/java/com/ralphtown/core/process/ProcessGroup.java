package com.ralphtown.core.process;

/**
 * The set of OS processes a cancel request must reach: the agent process and,
 * where the platform supports it, everything it spawned.
 */
public interface ProcessGroup {

    /** Ask every member to terminate (SIGTERM on POSIX). */
    void requestGracefulStop();

    /** Kill every member that is still alive (SIGKILL on POSIX). */
    void forceStop();

    /** True while the process or any member seen so far is still running. */
    boolean isAlive();

    /**
     * Chooses the group implementation for the current platform: the whole process
     * subtree where graceful termination is supported, the direct child otherwise.
     */
    static ProcessGroup of(Process process) {
        if (process.supportsNormalTermination()) {
            return new SubtreeProcessGroup(process);
        }
        return new SingleProcessGroup(process);
    }
}
