package io.mindmesh.registry;

public enum HeartbeatOutcome {
    ACCEPTED,
    /** Agent was SUSPECT and is ACTIVE again. */
    RECOVERED,
    UNKNOWN,
    /** Dead agents have to register again. */
    REJECTED_DEAD
}
