package io.mindmesh.error;

import io.mindmesh.rpc.RpcErrorCodes;

public class StateNotFoundException extends RpcRemoteException {
    public StateNotFoundException(String message) {
        super(RpcErrorCodes.STATE_NOT_FOUND, message);
    }

    public static StateNotFoundException forKey(String key) {
        return new StateNotFoundException("state key not found: " + key);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.STATE_NOT_FOUND;
    }
}
