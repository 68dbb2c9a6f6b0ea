package io.mindmesh.balancer;

import com.fasterxml.jackson.databind.JsonNode;
import io.mindmesh.error.NoAvailableAgentException;
import io.mindmesh.registry.AgentRecord;
import io.mindmesh.registry.AgentStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Owns the task table and picks agents for tasks.
 *
 * <p>All state sits behind this object's monitor. Failure listeners run after the monitor is
 * released.
 */
public final class LoadBalancer {
    private static final Logger logger = LoggerFactory.getLogger(LoadBalancer.class);
    private static final String DEFAULT_CURSOR = "*";
    private static final double IN_FLIGHT_SATURATION = 10.0;

    private final int maxAttempts;
    private final Random random;
    private final Clock clock;
    private final Map<String, Task> tasks = new LinkedHashMap<>();
    private final Map<String, Integer> cursors = new HashMap<>();
    private final Map<String, AgentCounters> agents = new TreeMap<>();
    private final Map<String, Double> weights = new HashMap<>();
    private final Map<LoadBalancingStrategy, long[]> strategyCounters = new EnumMap<>(LoadBalancingStrategy.class);
    private final List<TaskFailureListener> failureListeners = new CopyOnWriteArrayList<>();

    public LoadBalancer(int maxAttempts, Random random, Clock clock) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("maxAttempts must be >= 1");
        }
        this.maxAttempts = maxAttempts;
        this.random = random;
        this.clock = clock;
        for (LoadBalancingStrategy strategy : LoadBalancingStrategy.values()) {
            strategyCounters.put(strategy, new long[3]);
        }
    }

    public LoadBalancer(int maxAttempts) {
        this(maxAttempts, new Random(), Clock.systemUTC());
    }

    public void addFailureListener(TaskFailureListener listener) {
        failureListeners.add(listener);
    }

    public int maxAttempts() {
        return maxAttempts;
    }

    public synchronized TaskView submit(String taskId, String requiredCapability, JsonNode payload) {
        String id = taskId == null || taskId.isBlank() ? UUID.randomUUID().toString() : taskId.trim();
        if (tasks.containsKey(id)) {
            throw new IllegalArgumentException("task already exists: " + id);
        }
        Task task = new Task(id, blankToNull(requiredCapability), payload, clock.millis());
        tasks.put(id, task);
        logger.debug("task {} submitted capability={}", id, task.requiredCapability);
        return task.view();
    }

    public synchronized Optional<TaskView> get(String taskId) {
        Task task = tasks.get(taskId);
        return task == null ? Optional.empty() : Optional.of(task.view());
    }

    public synchronized List<TaskView> list(TaskStatus status) {
        List<TaskView> out = new ArrayList<>();
        for (Task task : tasks.values()) {
            if (status == null || task.status == status) {
                out.add(task.view());
            }
        }
        return out;
    }

    /**
     * Pending tasks in submission order, at most {@code limit} of them.
     */
    public synchronized List<TaskView> pending(int limit) {
        List<TaskView> out = new ArrayList<>();
        for (Task task : tasks.values()) {
            if (out.size() >= limit) {
                break;
            }
            if (task.status == TaskStatus.PENDING) {
                out.add(task.view());
            }
        }
        return out;
    }

    /**
     * Assigns a PENDING task to one of the ACTIVE candidates.
     *
     * @throws NoAvailableAgentException when no candidate is ACTIVE; the task stays PENDING
     */
    public synchronized TaskView assign(String taskId, List<AgentRecord> candidates, LoadBalancingStrategy strategy) {
        Task task = require(taskId);
        if (task.status != TaskStatus.PENDING) {
            throw new IllegalStateException("task " + taskId + " is " + task.status + ", only PENDING tasks can be assigned");
        }
        String cursorKey = task.requiredCapability == null ? DEFAULT_CURSOR : task.requiredCapability;
        AgentRecord chosen = pick(cursorKey, candidates, strategy);
        task.status = TaskStatus.ASSIGNED;
        task.assignedAgentId = chosen.id();
        task.strategy = strategy;
        task.updatedAtMs = clock.millis();
        AgentCounters counters = counters(chosen.id());
        counters.assigned++;
        counters.inFlight++;
        logger.info("task {} attempt {} assigned to {} via {}", taskId, task.attemptCount, chosen.id(), strategy.wireName());
        return task.view();
    }

    /**
     * Picks an agent without touching any task, for callers that only need a target.
     */
    public synchronized AgentRecord select(String capability, List<AgentRecord> candidates, LoadBalancingStrategy strategy) {
        return pick(capability == null ? DEFAULT_CURSOR : capability, candidates, strategy);
    }

    public synchronized TaskView markRunning(String taskId) {
        Task task = require(taskId);
        if (task.status != TaskStatus.ASSIGNED) {
            throw new IllegalStateException("task " + taskId + " is " + task.status + ", only ASSIGNED tasks can start");
        }
        task.status = TaskStatus.RUNNING;
        task.updatedAtMs = clock.millis();
        return task.view();
    }

    public synchronized TaskView complete(String taskId, JsonNode result, long executionMs) {
        Task task = require(taskId);
        if (!task.status.inFlight()) {
            throw new IllegalStateException("task " + taskId + " is " + task.status + ", cannot complete");
        }
        AgentCounters counters = counters(task.assignedAgentId);
        counters.inFlight = Math.max(0, counters.inFlight - 1);
        counters.completed++;
        counters.totalExecutionMs += Math.max(0L, executionMs);
        strategyCounters.get(task.strategy)[1]++;
        task.status = TaskStatus.COMPLETED;
        task.result = result;
        task.lastError = null;
        task.updatedAtMs = clock.millis();
        logger.info("task {} completed by {} in {}ms", taskId, task.assignedAgentId, executionMs);
        return task.view();
    }

    /**
     * Records a failed attempt. With {@code retry} the task goes back to PENDING while attempts
     * remain; otherwise, or once attempts are exhausted, it becomes FAILED.
     */
    public TaskView fail(String taskId, String error, boolean retry) {
        TaskView view;
        boolean exhausted;
        synchronized (this) {
            Task task = require(taskId);
            if (!task.status.inFlight()) {
                throw new IllegalStateException("task " + taskId + " is " + task.status + ", cannot fail");
            }
            AgentCounters counters = counters(task.assignedAgentId);
            counters.failed++;
            strategyCounters.get(task.strategy)[2]++;
            exhausted = releaseAttempt(task, error, retry);
            view = task.view();
        }
        if (exhausted) {
            notifyFailed(List.of(view));
        }
        return view;
    }

    /**
     * Completes the task only if {@code attempt} on {@code agentId} is still the current
     * in-flight attempt. A result from an attempt that was already taken back is ignored.
     */
    public synchronized Optional<TaskView> completeAttempt(String taskId, String agentId, int attempt, JsonNode result, long executionMs) {
        if (!isCurrent(taskId, agentId, attempt)) {
            return Optional.empty();
        }
        return Optional.of(complete(taskId, result, executionMs));
    }

    /**
     * Like {@link #fail(String, String, boolean)} with retry, for the current attempt only.
     */
    public Optional<TaskView> failAttempt(String taskId, String agentId, int attempt, String error) {
        TaskView view;
        boolean exhausted;
        synchronized (this) {
            if (!isCurrent(taskId, agentId, attempt)) {
                return Optional.empty();
            }
            Task task = tasks.get(taskId);
            counters(agentId).failed++;
            strategyCounters.get(task.strategy)[2]++;
            exhausted = releaseAttempt(task, error, true);
            view = task.view();
        }
        if (exhausted) {
            notifyFailed(List.of(view));
        }
        return Optional.of(view);
    }

    /**
     * Takes back every in-flight task of an agent. Each goes back to PENDING with one more
     * attempt, or to FAILED when it has none left.
     */
    public List<TaskView> requeueFromAgent(String agentId, String reason) {
        List<TaskView> affected = new ArrayList<>();
        List<TaskView> failed = new ArrayList<>();
        synchronized (this) {
            for (Task task : tasks.values()) {
                if (task.status.inFlight() && agentId.equals(task.assignedAgentId)) {
                    AgentCounters counters = counters(agentId);
                    counters.failed++;
                    strategyCounters.get(task.strategy)[2]++;
                    if (releaseAttempt(task, reason, true)) {
                        failed.add(task.view());
                    }
                    affected.add(task.view());
                }
            }
        }
        if (!affected.isEmpty()) {
            logger.warn("requeued {} task(s) from agent {}: {}", affected.size(), agentId, reason);
        }
        notifyFailed(failed);
        return affected;
    }

    public synchronized void setWeight(String agentId, double weight) {
        if (!(weight > 0.0) || Double.isInfinite(weight)) {
            throw new IllegalArgumentException("weight must be a positive number: " + weight);
        }
        weights.put(agentId, weight);
    }

    public synchronized int inFlight(String agentId) {
        AgentCounters counters = agents.get(agentId);
        return counters == null ? 0 : counters.inFlight;
    }

    public synchronized BalancerStats stats() {
        Map<String, BalancerStats.AgentLoad> agentStats = new LinkedHashMap<>();
        for (Map.Entry<String, AgentCounters> e : agents.entrySet()) {
            AgentCounters c = e.getValue();
            agentStats.put(e.getKey(), new BalancerStats.AgentLoad(
                    c.assigned,
                    c.completed,
                    c.failed,
                    c.inFlight,
                    c.averageExecutionMs(),
                    c.successRate(),
                    weights.getOrDefault(e.getKey(), 1.0)
            ));
        }
        Map<LoadBalancingStrategy, BalancerStats.StrategyCounters> strategyStats = new EnumMap<>(LoadBalancingStrategy.class);
        for (Map.Entry<LoadBalancingStrategy, long[]> e : strategyCounters.entrySet()) {
            long[] v = e.getValue();
            strategyStats.put(e.getKey(), new BalancerStats.StrategyCounters(v[0], v[1], v[2]));
        }
        Map<TaskStatus, Integer> byStatus = new EnumMap<>(TaskStatus.class);
        for (TaskStatus status : TaskStatus.values()) {
            byStatus.put(status, 0);
        }
        for (Task task : tasks.values()) {
            byStatus.merge(task.status, 1, Integer::sum);
        }
        return new BalancerStats(agentStats, strategyStats, byStatus);
    }

    private AgentRecord pick(String cursorKey, List<AgentRecord> candidates, LoadBalancingStrategy strategy) {
        if (strategy == null) {
            throw new IllegalArgumentException("strategy is required");
        }
        List<AgentRecord> active = new ArrayList<>();
        if (candidates != null) {
            for (AgentRecord candidate : candidates) {
                if (candidate != null && candidate.status() == AgentStatus.ACTIVE) {
                    active.add(candidate);
                }
            }
        }
        if (active.isEmpty()) {
            throw new NoAvailableAgentException("no active agent available"
                    + (DEFAULT_CURSOR.equals(cursorKey) ? "" : " for capability " + cursorKey));
        }
        AgentRecord chosen = switch (strategy) {
            case ROUND_ROBIN -> active.get(nextCursor(cursorKey, active.size()));
            case RANDOM -> active.get(random.nextInt(active.size()));
            case LEAST_LOADED -> bestByScore(cursorKey, active, a -> -inFlightOf(a));
            case WEIGHTED -> weightedPick(active);
            case PERFORMANCE_BASED -> bestByScore(cursorKey, active, this::performanceScore);
        };
        strategyCounters.get(strategy)[0]++;
        return chosen;
    }

    private int nextCursor(String cursorKey, int size) {
        int cursor = cursors.getOrDefault(cursorKey, 0);
        cursors.put(cursorKey, cursor == Integer.MAX_VALUE ? 0 : cursor + 1);
        return Math.floorMod(cursor, size);
    }

    // Highest score wins; ties go to whoever comes first from the round-robin cursor.
    private AgentRecord bestByScore(String cursorKey, List<AgentRecord> active, Scorer scorer) {
        int start = nextCursor(cursorKey, active.size());
        AgentRecord best = null;
        double bestScore = Double.NEGATIVE_INFINITY;
        for (int i = 0; i < active.size(); i++) {
            AgentRecord candidate = active.get((start + i) % active.size());
            double score = scorer.score(candidate);
            if (best == null || score > bestScore) {
                best = candidate;
                bestScore = score;
            }
        }
        return best;
    }

    private AgentRecord weightedPick(List<AgentRecord> active) {
        double total = 0.0;
        for (AgentRecord agent : active) {
            total += weights.getOrDefault(agent.id(), 1.0);
        }
        double point = random.nextDouble() * total;
        for (AgentRecord agent : active) {
            point -= weights.getOrDefault(agent.id(), 1.0);
            if (point < 0.0) {
                return agent;
            }
        }
        return active.get(active.size() - 1);
    }

    private double performanceScore(AgentRecord agent) {
        AgentCounters counters = agents.get(agent.id());
        double successRate = counters == null ? 1.0 : counters.successRate();
        int inFlight = counters == null ? 0 : counters.inFlight;
        return successRate * (1.0 - Math.min(inFlight, IN_FLIGHT_SATURATION) / IN_FLIGHT_SATURATION);
    }

    private int inFlightOf(AgentRecord agent) {
        AgentCounters counters = agents.get(agent.id());
        return counters == null ? 0 : counters.inFlight;
    }

    // Returns true when the task ended up FAILED.
    private boolean releaseAttempt(Task task, String error, boolean retry) {
        AgentCounters counters = counters(task.assignedAgentId);
        counters.inFlight = Math.max(0, counters.inFlight - 1);
        task.lastError = error;
        task.updatedAtMs = clock.millis();
        if (retry && task.attemptCount < maxAttempts) {
            task.attemptCount++;
            task.status = TaskStatus.PENDING;
            task.assignedAgentId = null;
            return false;
        }
        task.status = TaskStatus.FAILED;
        logger.warn("task {} failed after {} attempt(s): {}", task.id, task.attemptCount, error);
        return true;
    }

    private boolean isCurrent(String taskId, String agentId, int attempt) {
        Task task = tasks.get(taskId);
        return task != null
                && task.status.inFlight()
                && task.attemptCount == attempt
                && agentId.equals(task.assignedAgentId);
    }

    private Task require(String taskId) {
        Task task = tasks.get(taskId);
        if (task == null) {
            throw new IllegalArgumentException("unknown task: " + taskId);
        }
        return task;
    }

    private AgentCounters counters(String agentId) {
        return agents.computeIfAbsent(agentId, ignored -> new AgentCounters());
    }

    private void notifyFailed(List<TaskView> failed) {
        for (TaskView view : failed) {
            for (TaskFailureListener listener : failureListeners) {
                try {
                    listener.onTaskFailed(view);
                } catch (RuntimeException e) {
                    logger.warn("task failure listener failed for {}", view.taskId(), e);
                }
            }
        }
    }

    private static String blankToNull(String raw) {
        return raw == null || raw.isBlank() ? null : raw.trim();
    }

    @FunctionalInterface
    private interface Scorer {
        double score(AgentRecord agent);
    }

    private static final class AgentCounters {
        long assigned;
        long completed;
        long failed;
        int inFlight;
        long totalExecutionMs;

        double averageExecutionMs() {
            return completed == 0 ? 0.0 : (double) totalExecutionMs / completed;
        }

        double successRate() {
            long finished = completed + failed;
            return finished == 0 ? 1.0 : (double) completed / finished;
        }
    }
}
