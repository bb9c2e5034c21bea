package com.ralphtown.core.process;

public class RepoBusyException extends ProcessControlException {

    private final String repoId;

    public RepoBusyException(String repoId) {
        super("Repository %s already has a running ralph process".formatted(repoId));
        this.repoId = repoId;
    }

    public String repoId() {
        return repoId;
    }
}
