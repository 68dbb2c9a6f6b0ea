package io.mindmesh.balancer;

import java.util.Map;

public record BalancerStats(
        Map<String, AgentLoad> agents,
        Map<LoadBalancingStrategy, StrategyCounters> strategies,
        Map<TaskStatus, Integer> tasksByStatus
) {
    public record AgentLoad(
            long assigned,
            long completed,
            long failed,
            int inFlight,
            double averageExecutionMs,
            double successRate,
            double weight
    ) {
    }

    public record StrategyCounters(long selections, long successes, long failures) {
    }
}
