package io.mindmesh.error;

/**
 * Error categories surfaced to operators and automated callers.
 *
 * <p>The exit code is what the CLI returns when a command fails with this kind.
 */
public enum ErrorKind {
    PROTOCOL(3),
    MALFORMED_REQUEST(3),
    CONNECTION(4),
    TIMEOUT(5),
    METHOD_NOT_FOUND(6),
    NO_AVAILABLE_AGENT(7),
    STATE_NOT_FOUND(8),
    REMOTE(9);

    private final int exitCode;

    ErrorKind(int exitCode) {
        this.exitCode = exitCode;
    }

    public int exitCode() {
        return exitCode;
    }
}
