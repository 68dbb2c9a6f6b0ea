package io.mindmesh.recovery;

import io.mindmesh.balancer.LoadBalancer;
import io.mindmesh.balancer.LoadBalancingStrategy;
import io.mindmesh.balancer.TaskStatus;
import io.mindmesh.balancer.TaskView;
import io.mindmesh.error.MethodNotFoundException;
import io.mindmesh.error.RpcConnectionException;
import io.mindmesh.registry.AgentRegistry;
import io.mindmesh.registry.AgentStatus;
import io.mindmesh.testing.MutableClock;
import io.mindmesh.util.Backoff;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;
import java.util.concurrent.atomic.AtomicInteger;

import static org.awaitility.Awaitility.await;

final class FaultRecoveryTest {
    private static final FaultRecovery.Settings SETTINGS = new FaultRecovery.Settings(
            Duration.ofSeconds(5), Duration.ofSeconds(15), Duration.ofMinutes(1), Duration.ofMillis(20));

    @Test
    void silentAgentGoesSuspectThenDeadOnLaterPass() {
        MutableClock clock = MutableClock.startingAt(0L);
        AgentRegistry registry = new AgentRegistry(clock);
        LoadBalancer balancer = new LoadBalancer(3, new Random(1L), clock);
        FaultRecovery recovery = new FaultRecovery(registry, balancer, clock, SETTINGS);
        registry.register("quiet", "127.0.0.1", 7401, List.of("echo"));
        registry.register("chatty", "127.0.0.1", 7402, List.of("echo"));

        clock.advance(Duration.ofSeconds(4));
        registry.heartbeat("chatty");
        Assertions.assertTrue(recovery.auditOnce().isEmpty());

        clock.advance(Duration.ofSeconds(20));
        registry.heartbeat("chatty");
        FaultRecovery.AuditReport first = recovery.auditOnce();
        Assertions.assertEquals(List.of("quiet"), first.suspected());
        Assertions.assertTrue(first.died().isEmpty());

        FaultRecovery.AuditReport second = recovery.auditOnce();
        Assertions.assertEquals(List.of("quiet"), second.died());
        Assertions.assertEquals(AgentStatus.DEAD, registry.get("quiet").orElseThrow().status());
        Assertions.assertEquals(AgentStatus.ACTIVE, registry.get("chatty").orElseThrow().status());
    }

    @Test
    void deadAgentTasksAreRequeuedWithNextAttempt() {
        MutableClock clock = MutableClock.startingAt(0L);
        AgentRegistry registry = new AgentRegistry(clock);
        LoadBalancer balancer = new LoadBalancer(3, new Random(1L), clock);
        FaultRecovery recovery = new FaultRecovery(registry, balancer, clock, SETTINGS);
        registry.register("worker", "127.0.0.1", 7401, List.of("echo"));
        balancer.submit("t1", "echo", null);
        balancer.assign("t1", registry.list("echo"), LoadBalancingStrategy.ROUND_ROBIN);

        clock.advance(Duration.ofSeconds(30));
        recovery.auditOnce();
        FaultRecovery.AuditReport report = recovery.auditOnce();

        Assertions.assertEquals(1, report.requeued().size());
        TaskView task = balancer.get("t1").orElseThrow();
        Assertions.assertEquals(TaskStatus.PENDING, task.status());
        Assertions.assertEquals(2, task.attemptCount());
        Assertions.assertEquals(0, balancer.inFlight("worker"));
    }

    @Test
    void runningTaskOfSilentAgentMovesToSurvivor() {
        MutableClock clock = MutableClock.startingAt(0L);
        AgentRegistry registry = new AgentRegistry(clock);
        LoadBalancer balancer = new LoadBalancer(3, new Random(1L), clock);
        FaultRecovery recovery = new FaultRecovery(registry, balancer, clock, SETTINGS);
        registry.register("a", "127.0.0.1", 7401, List.of("echo"));
        registry.register("b", "127.0.0.1", 7402, List.of("echo"));
        balancer.submit("t1", "echo", null);
        balancer.assign("t1", List.of(registry.get("a").orElseThrow()), LoadBalancingStrategy.ROUND_ROBIN);
        Assertions.assertEquals(TaskStatus.RUNNING, balancer.markRunning("t1").status());

        clock.advance(Duration.ofSeconds(10));
        registry.heartbeat("b");
        Assertions.assertEquals(List.of("a"), recovery.auditOnce().suspected());
        Assertions.assertEquals(TaskStatus.RUNNING, balancer.get("t1").orElseThrow().status());

        clock.advance(Duration.ofSeconds(10));
        registry.heartbeat("b");
        FaultRecovery.AuditReport report = recovery.auditOnce();
        Assertions.assertEquals(List.of("a"), report.died());

        TaskView requeued = balancer.get("t1").orElseThrow();
        Assertions.assertEquals(TaskStatus.PENDING, requeued.status());
        Assertions.assertEquals(2, requeued.attemptCount());
        Assertions.assertEquals(0, balancer.inFlight("a"));

        TaskView reassigned = balancer.assign("t1", registry.list("echo"), LoadBalancingStrategy.ROUND_ROBIN);
        Assertions.assertEquals("b", reassigned.assignedAgentId());
        Assertions.assertEquals(2, reassigned.attemptCount());

        FailureRecord failure = recovery.failureLog().recent("a", 10).get(0);
        Assertions.assertEquals(FaultRecovery.AGENT_DEAD, failure.errorType());
        Assertions.assertEquals("t1", failure.taskId());
    }

    @Test
    void deathWithoutTasksIsStillLogged() {
        MutableClock clock = MutableClock.startingAt(0L);
        AgentRegistry registry = new AgentRegistry(clock);
        FaultRecovery recovery = new FaultRecovery(registry, new LoadBalancer(3, new Random(1L), clock), clock, SETTINGS);
        registry.register("idle", "127.0.0.1", 7401, List.of());

        clock.advance(Duration.ofSeconds(30));
        recovery.auditOnce();
        recovery.auditOnce();

        List<FailureRecord> failures = recovery.failureLog().recent(null, 10);
        Assertions.assertEquals(1, failures.size());
        Assertions.assertNull(failures.get(0).taskId());
        Assertions.assertTrue(failures.get(0).message().contains("declared dead"));
    }

    @Test
    void exhaustedTaskFailsAndListenerHears() {
        MutableClock clock = MutableClock.startingAt(0L);
        AgentRegistry registry = new AgentRegistry(clock);
        LoadBalancer balancer = new LoadBalancer(1, new Random(1L), clock);
        List<TaskView> failed = new ArrayList<>();
        balancer.addFailureListener(failed::add);
        FaultRecovery recovery = new FaultRecovery(registry, balancer, clock, SETTINGS);
        registry.register("worker", "127.0.0.1", 7401, List.of("echo"));
        balancer.submit("t1", "echo", null);
        balancer.assign("t1", registry.list("echo"), LoadBalancingStrategy.ROUND_ROBIN);

        clock.advance(Duration.ofSeconds(30));
        recovery.auditOnce();
        recovery.auditOnce();

        Assertions.assertEquals(TaskStatus.FAILED, balancer.get("t1").orElseThrow().status());
        Assertions.assertEquals(1, failed.size());
        Assertions.assertTrue(failed.get(0).lastError().contains("declared dead"));
    }

    @Test
    void deadAgentsArePurgedAfterRetention() {
        MutableClock clock = MutableClock.startingAt(0L);
        AgentRegistry registry = new AgentRegistry(clock);
        FaultRecovery recovery = new FaultRecovery(registry, new LoadBalancer(3, new Random(1L), clock), clock, SETTINGS);
        registry.register("gone", "127.0.0.1", 7401, List.of());

        clock.advance(Duration.ofSeconds(30));
        recovery.auditOnce();
        recovery.auditOnce();
        Assertions.assertEquals(1, registry.size());

        clock.advance(Duration.ofMinutes(2));
        Assertions.assertEquals(List.of("gone"), recovery.auditOnce().purged());
        Assertions.assertEquals(0, registry.size());
    }

    @Test
    void scheduledAuditRunsInBackground() {
        MutableClock clock = MutableClock.startingAt(0L);
        AgentRegistry registry = new AgentRegistry(clock);
        registry.register("quiet", "127.0.0.1", 7401, List.of());
        try (FaultRecovery recovery = new FaultRecovery(registry, new LoadBalancer(3), clock, SETTINGS)) {
            recovery.start();
            clock.advance(Duration.ofSeconds(30));
            await().atMost(Duration.ofSeconds(5))
                    .until(() -> registry.get("quiet").orElseThrow().status() == AgentStatus.DEAD);
        }
    }

    @Test
    void settingsRequireDeadAfterPastSuspectAfter() {
        Assertions.assertThrows(IllegalArgumentException.class, () -> new FaultRecovery.Settings(
                Duration.ofSeconds(10), Duration.ofSeconds(10), Duration.ofMinutes(1), Duration.ofSeconds(1)));
        Assertions.assertThrows(IllegalArgumentException.class, () -> new FaultRecovery.Settings(
                Duration.ZERO, Duration.ofSeconds(10), Duration.ofMinutes(1), Duration.ofSeconds(1)));
    }

    @Test
    void retryIdempotentRetriesOnlyTransportFailures() {
        AtomicInteger calls = new AtomicInteger();
        String result = FaultRecovery.retryIdempotent(() -> {
            if (calls.incrementAndGet() < 3) {
                throw new RpcConnectionException("refused");
            }
            return "ok";
        }, new Backoff(3, 1L, 2L));
        Assertions.assertEquals("ok", result);
        Assertions.assertEquals(3, calls.get());

        AtomicInteger remoteCalls = new AtomicInteger();
        Assertions.assertThrows(MethodNotFoundException.class, () -> FaultRecovery.retryIdempotent(() -> {
            remoteCalls.incrementAndGet();
            throw new MethodNotFoundException("Method not found: x");
        }, new Backoff(3, 1L, 2L)));
        Assertions.assertEquals(1, remoteCalls.get());

        Assertions.assertThrows(RpcConnectionException.class, () -> FaultRecovery.retryIdempotent(() -> {
            throw new RpcConnectionException("still down");
        }, new Backoff(2, 1L, 2L)));
    }
}
