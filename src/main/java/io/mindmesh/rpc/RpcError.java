package io.mindmesh.rpc;

public record RpcError(int code, String message) {
    public RpcError {
        message = message == null ? "" : message;
    }
}
