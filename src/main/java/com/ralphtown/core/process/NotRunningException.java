package com.ralphtown.core.process;

public class NotRunningException extends ProcessControlException {

    private final String sessionId;

    public NotRunningException(String sessionId) {
        super("Session %s has no running process".formatted(sessionId));
        this.sessionId = sessionId;
    }

    public String sessionId() {
        return sessionId;
    }
}
