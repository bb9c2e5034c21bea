package com.ralphtown.core.process;

public class SessionAlreadyRunningException extends ProcessControlException {

    private final String sessionId;

    public SessionAlreadyRunningException(String sessionId) {
        super("Session %s already has a running process".formatted(sessionId));
        this.sessionId = sessionId;
    }

    public String sessionId() {
        return sessionId;
    }
}
