package com.ralphtown.core.clone;

import java.util.List;

/**
 * A clone failure classified by {@link CloneErrorClassifier}. Authentication failures
 * carry remediation steps for the user; the other kinds never do.
 */
public class CloneException extends Exception {

    private final CloneFailure failure;
    private final String detail;
    private final List<String> helpSteps;

    public CloneException(CloneFailure failure, String detail, List<String> helpSteps, Throwable cause) {
        super(describe(failure, detail), cause);
        this.failure = failure;
        this.detail = detail;
        this.helpSteps = List.copyOf(helpSteps);
    }

    public CloneFailure failure() {
        return failure;
    }

    public String detail() {
        return detail;
    }

    public List<String> helpSteps() {
        return helpSteps;
    }

    /** Text shown to the user in the terminal error event. */
    public String userMessage() {
        return switch (failure) {
            case SSH_AUTH_FAILED, HTTPS_AUTH_FAILED -> detail;
            case NETWORK_ERROR -> "Network error: " + detail;
            case OPERATION_FAILED -> "Clone failed: " + detail;
        };
    }

    private static String describe(CloneFailure failure, String detail) {
        return switch (failure) {
            case SSH_AUTH_FAILED -> "SSH authentication failed: " + detail;
            case HTTPS_AUTH_FAILED -> "HTTPS authentication failed: " + detail;
            case NETWORK_ERROR -> "Network error: " + detail;
            case OPERATION_FAILED -> "Clone operation failed: " + detail;
        };
    }
}
