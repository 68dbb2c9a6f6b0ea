package io.mindmesh.recovery;

import java.util.Map;

public record HealthSummary(
        int totalAgents,
        int healthyAgents,
        int failingAgents,
        int recoveringAgents,
        long totalFailures,
        long recoveredFailures,
        double percentHealthy
) {
    /**
     * Agents are healthy, failing or recovering by the state of their circuit: CLOSED, OPEN or
     * HALF_OPEN.
     */
    public static HealthSummary of(Map<String, CircuitState> circuits, long totalFailures, long recoveredFailures) {
        int healthy = 0;
        int failing = 0;
        int recovering = 0;
        for (CircuitState state : circuits.values()) {
            switch (state) {
                case CLOSED -> healthy++;
                case OPEN -> failing++;
                case HALF_OPEN -> recovering++;
            }
        }
        int total = circuits.size();
        double percent = total == 0 ? 100.0 : healthy * 100.0 / total;
        return new HealthSummary(total, healthy, failing, recovering, totalFailures, recoveredFailures, percent);
    }
}
