package io.mindmesh.runtime;

import io.mindmesh.balancer.BalancerStats;
import io.mindmesh.recovery.CircuitState;
import io.mindmesh.recovery.HealthSummary;
import io.mindmesh.registry.RegistryStats;
import io.mindmesh.rpc.RpcCallStats;

import java.util.Map;

public record MeshStats(
        String nodeId,
        long uptimeMs,
        RegistryStats registry,
        BalancerStats balancer,
        RpcCallStats rpc,
        int openConnections,
        int stateLiveKeys,
        long stateHighestVersion,
        Map<String, Integer> replicationQueueDepths,
        long replicationDropped,
        Map<String, CircuitState> circuits,
        HealthSummary health
) {
}
