package io.mindmesh.observability;

import io.mindmesh.balancer.BalancerStats;
import io.mindmesh.balancer.LoadBalancingStrategy;
import io.mindmesh.balancer.TaskStatus;
import io.mindmesh.recovery.CircuitState;
import io.mindmesh.recovery.HealthSummary;
import io.mindmesh.registry.AgentStatus;
import io.mindmesh.rpc.RpcCallStats;
import io.mindmesh.runtime.MeshStats;

import java.util.Locale;
import java.util.Map;

public final class PrometheusFormatter {
    private PrometheusFormatter() {
    }

    public static String format(MeshStats stats) {
        StringBuilder sb = new StringBuilder();
        appendGauge(sb, "mindmesh_uptime_ms", "Node uptime in milliseconds", null, null, stats.uptimeMs());

        for (AgentStatus status : AgentStatus.values()) {
            appendGauge(sb, "mindmesh_agents", "Registered agents grouped by status", "status",
                    status.name().toLowerCase(Locale.ROOT), stats.registry().count(status));
        }
        appendMapGauge(sb, "mindmesh_active_agents_by_capability", "ACTIVE agents owning a capability", "capability",
                stats.registry().activeByCapability());

        for (Map.Entry<TaskStatus, Integer> e : stats.balancer().tasksByStatus().entrySet()) {
            appendGauge(sb, "mindmesh_tasks", "Tasks grouped by status", "status",
                    e.getKey().name().toLowerCase(Locale.ROOT), e.getValue());
        }
        for (Map.Entry<String, BalancerStats.AgentLoad> e : stats.balancer().agents().entrySet()) {
            appendGauge(sb, "mindmesh_agent_in_flight", "In-flight tasks per agent", "agent", e.getKey(), e.getValue().inFlight());
            appendGauge(sb, "mindmesh_agent_assigned_total", "Task assignments per agent", "agent", e.getKey(), e.getValue().assigned());
            appendGauge(sb, "mindmesh_agent_completed_total", "Completed tasks per agent", "agent", e.getKey(), e.getValue().completed());
            appendGauge(sb, "mindmesh_agent_failed_total", "Failed task attempts per agent", "agent", e.getKey(), e.getValue().failed());
        }
        for (Map.Entry<LoadBalancingStrategy, BalancerStats.StrategyCounters> e : stats.balancer().strategies().entrySet()) {
            appendGauge(sb, "mindmesh_strategy_selections_total", "Agent selections per strategy", "strategy",
                    e.getKey().wireName(), e.getValue().selections());
        }

        RpcCallStats rpc = stats.rpc();
        appendGauge(sb, "mindmesh_rpc_calls_total", "Dispatched RPC calls", "result", "ok", rpc.successfulCalls());
        appendGauge(sb, "mindmesh_rpc_calls_total", "Dispatched RPC calls", "result", "error", rpc.failedCalls());
        for (Map.Entry<String, RpcCallStats.MethodStats> e : rpc.methods().entrySet()) {
            appendGauge(sb, "mindmesh_rpc_method_calls_total", "Dispatched RPC calls per method", "method", e.getKey(), e.getValue().count());
        }
        appendGauge(sb, "mindmesh_rpc_open_connections", "Open server connections", null, null, stats.openConnections());

        appendGauge(sb, "mindmesh_state_live_keys", "Live keys in the replicated state store", null, null, stats.stateLiveKeys());
        appendGauge(sb, "mindmesh_state_highest_version", "Highest state version seen", null, null, stats.stateHighestVersion());
        appendMapGauge(sb, "mindmesh_replication_queue_depth", "Queued state entries per peer", "peer", stats.replicationQueueDepths());
        appendGauge(sb, "mindmesh_replication_dropped_total", "State entries dropped from full replication queues", null, null,
                stats.replicationDropped());

        for (CircuitState state : CircuitState.values()) {
            long count = stats.circuits().values().stream().filter(s -> s == state).count();
            appendGauge(sb, "mindmesh_circuits", "Agent circuit breakers grouped by state", "state",
                    state.name().toLowerCase(Locale.ROOT), count);
        }
        HealthSummary health = stats.health();
        appendGauge(sb, "mindmesh_agent_health", "Agents grouped by circuit health", "health", "healthy", health.healthyAgents());
        appendGauge(sb, "mindmesh_agent_health", "Agents grouped by circuit health", "health", "failing", health.failingAgents());
        appendGauge(sb, "mindmesh_agent_health", "Agents grouped by circuit health", "health", "recovering", health.recoveringAgents());
        appendGauge(sb, "mindmesh_agent_failures_total", "Recorded agent failures", null, null, health.totalFailures());
        appendGauge(sb, "mindmesh_agent_failures_recovered_total", "Agent failures followed by a success", null, null,
                health.recoveredFailures());
        return sb.toString();
    }

    private static void appendMapGauge(StringBuilder sb, String metric, String help, String label, Map<String, Integer> values) {
        sb.append("# HELP ").append(metric).append(" ").append(help).append('\n');
        sb.append("# TYPE ").append(metric).append(" gauge").append('\n');
        for (Map.Entry<String, Integer> e : values.entrySet()) {
            sb.append(metric).append('{')
                    .append(label).append("=\"").append(escapeLabel(e.getKey())).append("\"}")
                    .append(' ').append(e.getValue()).append('\n');
        }
    }

    private static void appendGauge(StringBuilder sb, String metric, String help, String label, String labelValue, long value) {
        if (sb.indexOf("# HELP " + metric + " ") < 0) {
            sb.append("# HELP ").append(metric).append(" ").append(help).append('\n');
            sb.append("# TYPE ").append(metric).append(" gauge").append('\n');
        }
        sb.append(metric);
        if (label != null && labelValue != null) {
            sb.append('{').append(label).append("=\"").append(escapeLabel(labelValue)).append("\"}");
        }
        sb.append(' ').append(value).append('\n');
    }

    private static String escapeLabel(String v) {
        return v.replace("\\", "\\\\").replace("\"", "\\\"").replace("\n", "\\n");
    }
}
