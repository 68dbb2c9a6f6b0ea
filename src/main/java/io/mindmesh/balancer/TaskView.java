package io.mindmesh.balancer;

import com.fasterxml.jackson.databind.JsonNode;

public record TaskView(
        String taskId,
        String requiredCapability,
        JsonNode payload,
        TaskStatus status,
        String assignedAgentId,
        int attemptCount,
        String strategy,
        JsonNode result,
        String lastError,
        long createdAtMs,
        long updatedAtMs
) {
}
