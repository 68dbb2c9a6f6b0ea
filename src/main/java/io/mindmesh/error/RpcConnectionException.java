package io.mindmesh.error;

public class RpcConnectionException extends MeshException {
    public RpcConnectionException(String message) {
        super(message);
    }

    public RpcConnectionException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.CONNECTION;
    }
}
