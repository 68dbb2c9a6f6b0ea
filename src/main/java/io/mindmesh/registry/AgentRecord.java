package io.mindmesh.registry;

import io.mindmesh.rpc.Endpoint;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Snapshot of one agent as known to the registry. Records are immutable; the registry replaces
 * them on every change.
 */
public record AgentRecord(
        String id,
        String host,
        int port,
        List<String> capabilities,
        AgentStatus status,
        Instant lastHeartbeat,
        Instant registeredAt,
        Instant statusChangedAt
) {
    public AgentRecord {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("agent id cannot be empty");
        }
        if (host == null || host.isBlank()) {
            throw new IllegalArgumentException("agent host cannot be empty: " + id);
        }
        if (port <= 0 || port > 65535) {
            throw new IllegalArgumentException("agent port out of range: " + port);
        }
        capabilities = capabilities == null ? List.of() : List.copyOf(capabilities);
        status = status == null ? AgentStatus.ACTIVE : status;
        Objects.requireNonNull(lastHeartbeat, "lastHeartbeat");
        registeredAt = registeredAt == null ? lastHeartbeat : registeredAt;
        statusChangedAt = statusChangedAt == null ? lastHeartbeat : statusChangedAt;
    }

    public static AgentRecord active(String id, String host, int port, List<String> capabilities, Instant now) {
        return new AgentRecord(id, host, port, capabilities, AgentStatus.ACTIVE, now, now, now);
    }

    public boolean hasCapability(String capability) {
        return capabilities.contains(capability);
    }

    public Endpoint endpoint() {
        return new Endpoint(host, port);
    }

    AgentRecord withStatus(AgentStatus next, Instant at) {
        return new AgentRecord(id, host, port, capabilities, next, lastHeartbeat, registeredAt, at);
    }

    AgentRecord withHeartbeat(Instant at) {
        AgentStatus next = status == AgentStatus.SUSPECT ? AgentStatus.ACTIVE : status;
        Instant changed = next == status ? statusChangedAt : at;
        return new AgentRecord(id, host, port, capabilities, next, at, registeredAt, changed);
    }
}
