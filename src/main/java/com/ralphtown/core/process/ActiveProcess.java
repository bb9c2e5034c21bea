package com.ralphtown.core.process;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Registry entry for a session that owns its repository's run slot.
 * <p>
 * The entry is reserved before spawning, so {@link #process()} is null until the
 * spawn succeeds. Exactly one of the exit path and the cancel path may record the
 * session's terminal status; {@link #claimTerminalStatus()} decides which.
 */
public final class ActiveProcess {

    private final String sessionId;
    private final String repoId;
    private volatile AgentProcess process;
    private final AtomicBoolean terminalClaimed = new AtomicBoolean();

    ActiveProcess(String sessionId, String repoId) {
        this.sessionId = sessionId;
        this.repoId = repoId;
    }

    public String sessionId() {
        return sessionId;
    }

    public String repoId() {
        return repoId;
    }

    public AgentProcess process() {
        return process;
    }

    void attach(AgentProcess process) {
        this.process = process;
    }

    boolean claimTerminalStatus() {
        return terminalClaimed.compareAndSet(false, true);
    }
}
