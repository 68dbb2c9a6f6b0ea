package io.mindmesh.state;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;

import java.util.Comparator;

/**
 * One versioned value. A JSON null value marks a deleted key.
 */
public record StateEntry(String key, JsonNode value, long version, String originAgentId, long writtenAtMs) {
    /** Version first, origin id breaking ties. */
    public static final Comparator<StateEntry> ORDER = Comparator
            .comparingLong(StateEntry::version)
            .thenComparing(StateEntry::originAgentId);

    public StateEntry {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("state key cannot be empty");
        }
        if (version < 1) {
            throw new IllegalArgumentException("state version must be >= 1: " + version);
        }
        if (originAgentId == null || originAgentId.isBlank()) {
            throw new IllegalArgumentException("state origin cannot be empty: " + key);
        }
        value = value == null ? NullNode.getInstance() : value;
    }

    @JsonIgnore
    public boolean isTombstone() {
        return value.isNull();
    }

    public boolean supersedes(StateEntry other) {
        return other == null || ORDER.compare(this, other) > 0;
    }
}
