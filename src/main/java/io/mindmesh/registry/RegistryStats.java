package io.mindmesh.registry;

import java.util.Map;

public record RegistryStats(
        int total,
        Map<AgentStatus, Integer> byStatus,
        Map<String, Integer> activeByCapability
) {
    public int count(AgentStatus status) {
        return byStatus.getOrDefault(status, 0);
    }
}
