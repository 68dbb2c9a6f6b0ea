package io.mindmesh.rpc;

import java.util.Map;

public record RpcCallStats(
        long totalCalls,
        long successfulCalls,
        long failedCalls,
        double averageMillis,
        Map<String, MethodStats> methods
) {
    public record MethodStats(long count, long successful, long failed, double averageMillis) {
    }
}
