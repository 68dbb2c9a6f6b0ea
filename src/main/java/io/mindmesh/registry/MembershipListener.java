package io.mindmesh.registry;

/**
 * Notified after a registry change, outside the registry lock. {@code before} is null for a new
 * registration and {@code after} is null for a removal.
 */
@FunctionalInterface
public interface MembershipListener {
    void onChange(AgentRecord before, AgentRecord after);
}
