package io.mindmesh.rpc;

import io.mindmesh.error.MethodNotFoundException;
import io.mindmesh.error.NoAvailableAgentException;
import io.mindmesh.error.RpcRemoteException;
import io.mindmesh.error.StateNotFoundException;

/**
 * JSON-RPC 2.0 error codes plus the mesh application codes in the server error range.
 */
public final class RpcErrorCodes {
    public static final int PARSE_ERROR = -32700;
    public static final int INVALID_REQUEST = -32600;
    public static final int METHOD_NOT_FOUND = -32601;
    public static final int INVALID_PARAMS = -32602;
    public static final int INTERNAL_ERROR = -32603;
    public static final int STATE_NOT_FOUND = -32004;
    public static final int NO_AVAILABLE_AGENT = -32010;

    private RpcErrorCodes() {
    }

    /**
     * Maps an error response back to the typed exception a local call would have thrown.
     */
    public static RpcRemoteException toException(RpcError error) {
        return switch (error.code()) {
            case METHOD_NOT_FOUND -> new MethodNotFoundException(error.message());
            case NO_AVAILABLE_AGENT -> new NoAvailableAgentException(error.message());
            case STATE_NOT_FOUND -> new StateNotFoundException(error.message());
            default -> new RpcRemoteException(error.code(), error.message());
        };
    }
}
