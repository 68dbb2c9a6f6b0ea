package io.mindmesh.balancer;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Mutable task state, only touched under the balancer's monitor.
 */
final class Task {
    final String id;
    final String requiredCapability;
    final JsonNode payload;
    final long createdAtMs;
    TaskStatus status = TaskStatus.PENDING;
    String assignedAgentId;
    LoadBalancingStrategy strategy;
    int attemptCount = 1;
    JsonNode result;
    String lastError;
    long updatedAtMs;

    Task(String id, String requiredCapability, JsonNode payload, long nowMs) {
        this.id = id;
        this.requiredCapability = requiredCapability;
        this.payload = payload;
        this.createdAtMs = nowMs;
        this.updatedAtMs = nowMs;
    }

    TaskView view() {
        return new TaskView(
                id,
                requiredCapability,
                payload,
                status,
                assignedAgentId,
                attemptCount,
                strategy == null ? null : strategy.wireName(),
                result,
                lastError,
                createdAtMs,
                updatedAtMs
        );
    }
}
