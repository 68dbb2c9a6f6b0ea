package io.mindmesh.error;

/**
 * Corrupt frame or undecodable envelope. Fatal to the connection it happened on.
 */
public class ProtocolException extends MeshException {
    public ProtocolException(String message) {
        super(message);
    }

    public ProtocolException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.PROTOCOL;
    }
}
