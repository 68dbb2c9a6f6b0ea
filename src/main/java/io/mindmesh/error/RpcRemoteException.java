package io.mindmesh.error;

/**
 * An error response returned by the remote handler.
 */
public class RpcRemoteException extends MeshException {
    private final int code;

    public RpcRemoteException(int code, String message) {
        super(message);
        this.code = code;
    }

    public int code() {
        return code;
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.REMOTE;
    }
}
