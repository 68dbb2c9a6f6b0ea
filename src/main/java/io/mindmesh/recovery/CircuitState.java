package io.mindmesh.recovery;

public enum CircuitState {
    CLOSED,
    OPEN,
    HALF_OPEN
}
