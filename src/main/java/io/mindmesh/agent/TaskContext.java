package io.mindmesh.agent;

import com.fasterxml.jackson.databind.JsonNode;

public record TaskContext(
        String taskId,
        String capability,
        int attempt,
        String agentId,
        JsonNode payload
) {
}
