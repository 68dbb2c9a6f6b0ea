package io.mindmesh.recovery;

import io.mindmesh.balancer.LoadBalancer;
import io.mindmesh.balancer.TaskView;
import io.mindmesh.error.MeshException;
import io.mindmesh.error.RpcConnectionException;
import io.mindmesh.error.RpcTimeoutException;
import io.mindmesh.registry.AgentRecord;
import io.mindmesh.registry.AgentRegistry;
import io.mindmesh.registry.AgentStatus;
import io.mindmesh.util.Backoff;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Periodic health audit over the registry.
 *
 * <p>An agent moves at most one step per pass: ACTIVE agents silent for longer than
 * {@code suspectAfter} become SUSPECT, SUSPECT agents silent for longer than {@code deadAfter}
 * become DEAD and lose their in-flight tasks back to the balancer.
 */
public final class FaultRecovery implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(FaultRecovery.class);
    public static final String AGENT_DEAD = "AGENT_DEAD";

    private final AgentRegistry registry;
    private final LoadBalancer balancer;
    private final Clock clock;
    private final Settings settings;
    private final FailureLog failureLog;
    private ScheduledExecutorService scheduler;

    public FaultRecovery(AgentRegistry registry, LoadBalancer balancer, Clock clock, Settings settings, FailureLog failureLog) {
        this.registry = registry;
        this.balancer = balancer;
        this.clock = clock;
        this.settings = settings;
        this.failureLog = failureLog;
    }

    public FaultRecovery(AgentRegistry registry, LoadBalancer balancer, Clock clock, Settings settings) {
        this(registry, balancer, clock, settings, new FailureLog(FailureLog.DEFAULT_CAPACITY, clock));
    }

    public FailureLog failureLog() {
        return failureLog;
    }

    public synchronized void start() {
        if (scheduler != null) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "fault-recovery");
            thread.setDaemon(true);
            return thread;
        });
        long periodMs = Math.max(10L, settings.auditInterval().toMillis());
        scheduler.scheduleWithFixedDelay(this::auditQuietly, periodMs, periodMs, TimeUnit.MILLISECONDS);
        logger.info("fault recovery auditing every {}ms (suspect after {}ms, dead after {}ms)",
                periodMs, settings.suspectAfter().toMillis(), settings.deadAfter().toMillis());
    }

    public AuditReport auditOnce() {
        long nowMs = clock.millis();
        List<String> suspected = new ArrayList<>();
        List<String> died = new ArrayList<>();
        List<TaskView> requeued = new ArrayList<>();
        for (AgentRecord record : registry.list()) {
            long silentMs = nowMs - record.lastHeartbeat().toEpochMilli();
            if (record.status() == AgentStatus.ACTIVE && silentMs > settings.suspectAfter().toMillis()) {
                if (registry.markSuspect(record.id())) {
                    suspected.add(record.id());
                }
            } else if (record.status() == AgentStatus.SUSPECT && silentMs > settings.deadAfter().toMillis()) {
                if (registry.markDead(record.id())) {
                    died.add(record.id());
                    String reason = "agent " + record.id() + " declared dead after " + silentMs + "ms without heartbeat";
                    List<TaskView> taken = balancer.requeueFromAgent(record.id(), reason);
                    if (taken.isEmpty()) {
                        failureLog.record(record.id(), AGENT_DEAD, reason, null);
                    }
                    for (TaskView task : taken) {
                        failureLog.record(record.id(), AGENT_DEAD, reason, task.taskId());
                    }
                    requeued.addAll(taken);
                }
            }
        }
        List<String> purged = registry.purgeDead(settings.deadRetention());
        return new AuditReport(suspected, died, requeued, purged);
    }

    /**
     * Runs an idempotent operation, retrying connection failures and timeouts with backoff.
     * Any other failure, remote errors included, is thrown at once.
     */
    public static <T> T retryIdempotent(Supplier<T> operation, Backoff backoff) {
        MeshException last = null;
        for (int attempt = 1; attempt <= backoff.maxAttempts(); attempt++) {
            if (attempt > 1) {
                Backoff.sleep(backoff.delayBefore(attempt - 1));
            }
            try {
                return operation.get();
            } catch (RpcConnectionException | RpcTimeoutException e) {
                last = e;
                logger.debug("idempotent attempt {}/{} failed: {}", attempt, backoff.maxAttempts(), e.getMessage());
            }
        }
        throw last;
    }

    @Override
    public synchronized void close() {
        if (scheduler != null) {
            scheduler.shutdownNow();
            scheduler = null;
        }
    }

    private void auditQuietly() {
        try {
            AuditReport report = auditOnce();
            if (!report.isEmpty()) {
                logger.info("audit: suspect={} dead={} requeued={} purged={}",
                        report.suspected(), report.died(), report.requeued().size(), report.purged());
            }
        } catch (RuntimeException e) {
            logger.error("fault recovery audit failed", e);
        }
    }

    public record Settings(Duration suspectAfter, Duration deadAfter, Duration deadRetention, Duration auditInterval) {
        public Settings {
            if (suspectAfter.isNegative() || suspectAfter.isZero()) {
                throw new IllegalArgumentException("suspectAfter must be positive");
            }
            if (deadAfter.compareTo(suspectAfter) <= 0) {
                throw new IllegalArgumentException("deadAfter must be longer than suspectAfter");
            }
        }
    }

    public record AuditReport(List<String> suspected, List<String> died, List<TaskView> requeued, List<String> purged) {
        public boolean isEmpty() {
            return suspected.isEmpty() && died.isEmpty() && requeued.isEmpty() && purged.isEmpty();
        }
    }
}
