package io.mindmesh.registry;

public enum AgentStatus {
    ACTIVE,
    SUSPECT,
    DEAD
}
