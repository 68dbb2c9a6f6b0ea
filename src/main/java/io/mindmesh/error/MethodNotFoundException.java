package io.mindmesh.error;

import io.mindmesh.rpc.RpcErrorCodes;

public class MethodNotFoundException extends RpcRemoteException {
    public MethodNotFoundException(String message) {
        super(RpcErrorCodes.METHOD_NOT_FOUND, message);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.METHOD_NOT_FOUND;
    }
}
