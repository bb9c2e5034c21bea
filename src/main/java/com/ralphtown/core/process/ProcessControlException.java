package com.ralphtown.core.process;

import java.util.List;

/**
 * Base type for rejections and failures raised when starting or stopping a session's
 * agent process. All of them are local outcomes reported straight to the caller; none
 * is retried.
 */
public abstract class ProcessControlException extends RuntimeException {

    protected ProcessControlException(String message) {
        super(message);
    }

    protected ProcessControlException(String message, Throwable cause) {
        super(message, cause);
    }

    /** Remediation steps for the user; empty unless the failure is user-actionable. */
    public List<String> helpSteps() {
        return List.of();
    }
}
