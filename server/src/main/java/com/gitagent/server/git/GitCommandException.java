package com.gitagent.server.git;

/**
 * Thrown when a git (or deploy) command cannot be started, times out, or exits non-zero.
 */
public class GitCommandException extends RuntimeException {

    private final int exitCode;

    public GitCommandException(String message) {
        this(message, -1);
    }

    public GitCommandException(String message, int exitCode) {
        super(message);
        this.exitCode = exitCode;
    }

    public GitCommandException(String message, Throwable cause) {
        super(message, cause);
        this.exitCode = -1;
    }

    /** Exit status of the failed command, or -1 if it never completed. */
    public int exitCode() {
        return exitCode;
    }
}
