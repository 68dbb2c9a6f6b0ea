package io.mindmesh.error;

import io.mindmesh.rpc.RpcErrorCodes;

/**
 * No candidate agent met the capability and health criteria. The task stays pending.
 */
public class NoAvailableAgentException extends RpcRemoteException {
    public NoAvailableAgentException(String message) {
        super(RpcErrorCodes.NO_AVAILABLE_AGENT, message);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.NO_AVAILABLE_AGENT;
    }
}
