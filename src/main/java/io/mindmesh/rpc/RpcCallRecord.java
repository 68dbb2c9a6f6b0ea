package io.mindmesh.rpc;

public record RpcCallRecord(
        String requestId,
        String method,
        long startedAtMs,
        long durationMicros,
        boolean success,
        Integer errorCode,
        String error
) {
}
