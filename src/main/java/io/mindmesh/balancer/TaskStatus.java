package io.mindmesh.balancer;

public enum TaskStatus {
    PENDING,
    ASSIGNED,
    RUNNING,
    COMPLETED,
    FAILED;

    public boolean inFlight() {
        return this == ASSIGNED || this == RUNNING;
    }

    public boolean terminal() {
        return this == COMPLETED || this == FAILED;
    }
}
