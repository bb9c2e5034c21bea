package com.ralphtown.core.git;

/**
 * Failure of a git inspection or git command.
 */
public class GitOperationException extends RuntimeException {

    public enum Kind { NOT_A_REPO, OPERATION_FAILED, COMMAND_FAILED, INVALID_BRANCH }

    private final Kind kind;

    public GitOperationException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public GitOperationException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public Kind kind() {
        return kind;
    }

    static GitOperationException notARepo(String path) {
        return new GitOperationException(Kind.NOT_A_REPO, "Not a git repository: " + path);
    }
}
