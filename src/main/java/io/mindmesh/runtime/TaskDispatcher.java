package io.mindmesh.runtime;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.mindmesh.balancer.LoadBalancer;
import io.mindmesh.balancer.LoadBalancingStrategy;
import io.mindmesh.balancer.TaskView;
import io.mindmesh.error.MeshException;
import io.mindmesh.error.NoAvailableAgentException;
import io.mindmesh.recovery.CircuitBreaker;
import io.mindmesh.recovery.CircuitBreakers;
import io.mindmesh.recovery.FailureLog;
import io.mindmesh.registry.AgentRecord;
import io.mindmesh.registry.AgentRegistry;
import io.mindmesh.registry.AgentStatus;
import io.mindmesh.rpc.RpcClient;
import io.mindmesh.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Moves PENDING tasks onto agents: each pass assigns up to {@code batchSize} tasks and sends
 * {@code task.execute} to the chosen agent. Results come back on a separate pool so a slow agent
 * never stalls the pass.
 */
public final class TaskDispatcher implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(TaskDispatcher.class);
    static final String EXECUTE_METHOD = "task.execute";
    static final String TASK_ERROR = "TASK_ERROR";
    static final String INTERNAL_ERROR = "INTERNAL";

    private final LoadBalancer balancer;
    private final AgentRegistry registry;
    private final RpcClient client;
    private final CircuitBreakers breakers;
    private final FailureLog failureLog;
    private final LoadBalancingStrategy strategy;
    private final int batchSize;
    private final Duration interval;
    private final Duration callTimeout;
    private ScheduledExecutorService scheduler;
    private ExecutorService executions;

    public TaskDispatcher(
            LoadBalancer balancer,
            AgentRegistry registry,
            RpcClient client,
            CircuitBreakers breakers,
            FailureLog failureLog,
            LoadBalancingStrategy strategy,
            int batchSize,
            Duration interval,
            Duration callTimeout
    ) {
        this.balancer = balancer;
        this.registry = registry;
        this.client = client;
        this.breakers = breakers;
        this.failureLog = failureLog;
        this.strategy = strategy;
        this.batchSize = batchSize;
        this.interval = interval;
        this.callTimeout = callTimeout;
    }

    public synchronized void start() {
        if (scheduler != null) {
            return;
        }
        executions = Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "task-execution");
            thread.setDaemon(true);
            return thread;
        });
        scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "task-dispatcher");
            thread.setDaemon(true);
            return thread;
        });
        long periodMs = Math.max(10L, interval.toMillis());
        scheduler.scheduleWithFixedDelay(this::dispatchQuietly, periodMs, periodMs, TimeUnit.MILLISECONDS);
    }

    /**
     * Assigns what it can and returns the tasks it assigned. Tasks with no reachable candidate
     * stay PENDING for the next pass.
     */
    public List<TaskView> dispatchOnce() {
        List<TaskView> assigned = new ArrayList<>();
        for (TaskView pending : balancer.pending(batchSize)) {
            List<AgentRecord> candidates = new ArrayList<>();
            for (AgentRecord agent : registry.list(pending.requiredCapability())) {
                if (pending.requiredCapability() == null && agent.status() != AgentStatus.ACTIVE) {
                    continue;
                }
                if (breakers.allows(agent.id())) {
                    candidates.add(agent);
                }
            }
            if (candidates.isEmpty()) {
                continue;
            }
            TaskView view;
            try {
                view = balancer.assign(pending.taskId(), candidates, strategy);
            } catch (NoAvailableAgentException | IllegalStateException e) {
                logger.debug("task {} not assigned this pass: {}", pending.taskId(), e.getMessage());
                continue;
            }
            AgentRecord target = null;
            for (AgentRecord candidate : candidates) {
                if (candidate.id().equals(view.assignedAgentId())) {
                    target = candidate;
                }
            }
            TaskView running;
            try {
                running = balancer.markRunning(view.taskId());
            } catch (IllegalStateException e) {
                // taken back by fault recovery between assign and start
                logger.debug("task {} not started this pass: {}", view.taskId(), e.getMessage());
                continue;
            }
            assigned.add(running);
            launch(running, target);
        }
        return assigned;
    }

    @Override
    public synchronized void close() {
        if (scheduler != null) {
            scheduler.shutdownNow();
            scheduler = null;
        }
        if (executions != null) {
            executions.shutdownNow();
            executions = null;
        }
    }

    private void launch(TaskView task, AgentRecord target) {
        ExecutorService pool = executions;
        if (pool == null) {
            execute(task, target);
            return;
        }
        try {
            pool.execute(() -> execute(task, target));
        } catch (RejectedExecutionException e) {
            balancer.failAttempt(task.taskId(), target.id(), task.attemptCount(), "dispatcher stopped");
        }
    }

    private void execute(TaskView task, AgentRecord target) {
        CircuitBreaker breaker = breakers.forAgent(target.id());
        ObjectNode params = Jsons.object();
        params.put("taskId", task.taskId());
        params.put("capability", task.requiredCapability());
        params.put("attempt", task.attemptCount());
        params.put("agentId", target.id());
        params.set("payload", task.payload());
        long started = System.nanoTime();
        try {
            JsonNode reply = client.call(target.endpoint(), EXECUTE_METHOD, params, callTimeout);
            long elapsedMs = (System.nanoTime() - started) / 1_000_000L;
            breaker.recordSuccess();
            if (reply.path("success").asBoolean(false)) {
                failureLog.markRecovered(target.id());
                balancer.completeAttempt(task.taskId(), target.id(), task.attemptCount(), reply.get("output"), elapsedMs);
            } else {
                String error = reply.path("error").asText("task failed");
                failureLog.record(target.id(), TASK_ERROR, error, task.taskId());
                balancer.failAttempt(task.taskId(), target.id(), task.attemptCount(), error);
            }
        } catch (MeshException e) {
            breaker.recordFailure();
            logger.warn("task {} attempt {} on {} failed: {}", task.taskId(), task.attemptCount(), target.id(), e.getMessage());
            failureLog.record(target.id(), e.kind().name(), e.getMessage(), task.taskId());
            balancer.failAttempt(task.taskId(), target.id(), task.attemptCount(), e.kind() + ": " + e.getMessage());
        } catch (RuntimeException e) {
            logger.error("task {} attempt {} on {} aborted", task.taskId(), task.attemptCount(), target.id(), e);
            failureLog.record(target.id(), INTERNAL_ERROR, String.valueOf(e.getMessage()), task.taskId());
            balancer.failAttempt(task.taskId(), target.id(), task.attemptCount(), INTERNAL_ERROR + ": " + e.getMessage());
        }
    }

    private void dispatchQuietly() {
        try {
            List<TaskView> assigned = dispatchOnce();
            if (!assigned.isEmpty()) {
                logger.debug("dispatched {} task(s)", assigned.size());
            }
        } catch (RuntimeException e) {
            logger.error("dispatch pass failed", e);
        }
    }
}
