package io.mindmesh.error;

import java.time.Duration;

public class RpcTimeoutException extends MeshException {
    public RpcTimeoutException(String method, String endpoint, Duration timeout) {
        super("no response for " + method + " from " + endpoint + " within " + timeout.toMillis() + "ms");
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.TIMEOUT;
    }
}
