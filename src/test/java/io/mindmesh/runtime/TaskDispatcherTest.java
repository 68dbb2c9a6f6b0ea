package io.mindmesh.runtime;

import com.fasterxml.jackson.databind.JsonNode;
import io.mindmesh.balancer.LoadBalancer;
import io.mindmesh.balancer.LoadBalancingStrategy;
import io.mindmesh.balancer.TaskStatus;
import io.mindmesh.balancer.TaskView;
import io.mindmesh.recovery.CircuitBreakers;
import io.mindmesh.recovery.CircuitState;
import io.mindmesh.recovery.FailureLog;
import io.mindmesh.recovery.FailureRecord;
import io.mindmesh.recovery.FaultRecovery;
import io.mindmesh.registry.AgentRegistry;
import io.mindmesh.rpc.RpcClient;
import io.mindmesh.rpc.RpcServer;
import io.mindmesh.testing.MutableClock;
import io.mindmesh.util.Backoff;
import io.mindmesh.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.net.ServerSocket;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Random;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.awaitility.Awaitility.await;

final class TaskDispatcherTest {

    @Test
    void dispatchesPendingTaskToAgentAndRecordsResult() throws Exception {
        AgentRegistry registry = new AgentRegistry();
        LoadBalancer balancer = new LoadBalancer(3, new Random(1L), Clock.systemUTC());
        CircuitBreakers breakers = new CircuitBreakers(3, Duration.ofMinutes(1), Clock.systemUTC());
        RpcServer agent = RpcServer.builder()
                .bind("127.0.0.1", 0)
                .method("task.execute", params -> {
                    var outcome = Jsons.object().put("success", true);
                    outcome.putObject("output").put("upper", params.path("payload").path("text").asText().toUpperCase());
                    return outcome;
                })
                .build();
        try (agent; RpcClient client = RpcClient.withDefaults()) {
            int port = agent.start();
            registry.register("agent-1", "127.0.0.1", port, List.of("upper"));
            balancer.submit("t1", "upper", Jsons.object().put("text", "abc"));
            balancer.submit("t2", "other", Jsons.object());
            FailureLog failures = new FailureLog(100, Clock.systemUTC());
            TaskDispatcher dispatcher = new TaskDispatcher(balancer, registry, client, breakers, failures,
                    LoadBalancingStrategy.ROUND_ROBIN, 10, Duration.ofSeconds(1), Duration.ofSeconds(5));

            List<TaskView> dispatched = dispatcher.dispatchOnce();

            Assertions.assertEquals(1, dispatched.size());
            Assertions.assertEquals(TaskStatus.RUNNING, dispatched.get(0).status());
            Assertions.assertEquals("ABC", balancer.get("t1").orElseThrow().result().path("upper").asText());
            Assertions.assertEquals(TaskStatus.COMPLETED, balancer.get("t1").orElseThrow().status());
            Assertions.assertEquals(TaskStatus.PENDING, balancer.get("t2").orElseThrow().status());
            Assertions.assertEquals(0L, failures.totalFailures());
            dispatcher.close();
        }
    }

    @Test
    void unreachableAgentFailsAttemptAndOpensBreaker() throws Exception {
        int port;
        try (ServerSocket spare = new ServerSocket(0)) {
            port = spare.getLocalPort();
        }
        AgentRegistry registry = new AgentRegistry();
        LoadBalancer balancer = new LoadBalancer(2, new Random(1L), Clock.systemUTC());
        CircuitBreakers breakers = new CircuitBreakers(1, Duration.ofMinutes(1), Clock.systemUTC());
        FailureLog failures = new FailureLog(100, Clock.systemUTC());
        RpcClient client = new RpcClient(RpcClient.Options.defaults().withConnectBackoff(new Backoff(1, 0L, 0L)));
        try (client; TaskDispatcher dispatcher = new TaskDispatcher(balancer, registry, client, breakers, failures,
                LoadBalancingStrategy.ROUND_ROBIN, 10, Duration.ofMillis(20), Duration.ofSeconds(2))) {
            registry.register("down", "127.0.0.1", port, List.of("echo"));
            balancer.submit("t1", "echo", null);
            dispatcher.start();

            await().atMost(Duration.ofSeconds(5)).until(() -> balancer.get("t1").orElseThrow().lastError() != null);
            Assertions.assertEquals(CircuitState.OPEN, breakers.states().get("down"));
            TaskView task = balancer.get("t1").orElseThrow();
            Assertions.assertEquals(TaskStatus.PENDING, task.status());
            Assertions.assertEquals(2, task.attemptCount());
            Assertions.assertTrue(task.lastError().startsWith("CONNECTION"));
            Assertions.assertTrue(dispatcher.dispatchOnce().isEmpty());

            FailureRecord failure = failures.recent("down", 10).get(0);
            Assertions.assertEquals("CONNECTION", failure.errorType());
            Assertions.assertEquals("t1", failure.taskId());
            Assertions.assertFalse(failure.recovered());
        }
    }

    @Test
    void taskTakenFromDeadAgentIsDispatchedToSurvivor() throws Exception {
        MutableClock clock = MutableClock.startingAt(0L);
        AgentRegistry registry = new AgentRegistry(clock);
        LoadBalancer balancer = new LoadBalancer(3, new Random(1L), clock);
        CircuitBreakers breakers = new CircuitBreakers(3, Duration.ofMinutes(1), clock);
        FaultRecovery recovery = new FaultRecovery(registry, balancer, clock, new FaultRecovery.Settings(
                Duration.ofSeconds(5), Duration.ofSeconds(15), Duration.ofMinutes(1), Duration.ofSeconds(1)));
        List<JsonNode> received = new CopyOnWriteArrayList<>();
        RpcServer survivor = RpcServer.builder()
                .bind("127.0.0.1", 0)
                .method("task.execute", params -> {
                    received.add(params);
                    return Jsons.object().put("success", true);
                })
                .build();
        try (survivor; RpcClient client = RpcClient.withDefaults()) {
            int port = survivor.start();
            registry.register("a", "127.0.0.1", 9, List.of("echo"));
            registry.register("b", "127.0.0.1", port, List.of("echo"));
            balancer.submit("t1", "echo", null);
            balancer.assign("t1", List.of(registry.get("a").orElseThrow()), LoadBalancingStrategy.ROUND_ROBIN);
            balancer.markRunning("t1");

            clock.advance(Duration.ofSeconds(10));
            registry.heartbeat("b");
            recovery.auditOnce();
            clock.advance(Duration.ofSeconds(10));
            registry.heartbeat("b");
            recovery.auditOnce();
            Assertions.assertEquals(TaskStatus.PENDING, balancer.get("t1").orElseThrow().status());
            Assertions.assertEquals(2, balancer.get("t1").orElseThrow().attemptCount());

            TaskDispatcher dispatcher = new TaskDispatcher(balancer, registry, client, breakers, recovery.failureLog(),
                    LoadBalancingStrategy.ROUND_ROBIN, 10, Duration.ofSeconds(1), Duration.ofSeconds(5));
            List<TaskView> dispatched = dispatcher.dispatchOnce();

            Assertions.assertEquals(1, dispatched.size());
            Assertions.assertEquals("b", dispatched.get(0).assignedAgentId());
            Assertions.assertEquals(TaskStatus.COMPLETED, balancer.get("t1").orElseThrow().status());
            Assertions.assertEquals(1, received.size());
            Assertions.assertEquals("b", received.get(0).path("agentId").asText());
            Assertions.assertEquals(2, received.get(0).path("attempt").asInt());
            dispatcher.close();
        }
    }

    @Test
    void unexpectedClientErrorFailsAttemptInsteadOfStrandingTask() {
        AgentRegistry registry = new AgentRegistry();
        LoadBalancer balancer = new LoadBalancer(3, new Random(1L), Clock.systemUTC());
        CircuitBreakers breakers = new CircuitBreakers(1, Duration.ofMinutes(1), Clock.systemUTC());
        FailureLog failures = new FailureLog(100, Clock.systemUTC());
        RpcClient client = RpcClient.withDefaults();
        client.close();
        TaskDispatcher dispatcher = new TaskDispatcher(balancer, registry, client, breakers, failures,
                LoadBalancingStrategy.ROUND_ROBIN, 10, Duration.ofSeconds(1), Duration.ofSeconds(1));
        registry.register("agent-1", "127.0.0.1", 9, List.of("echo"));
        balancer.submit("t1", "echo", null);

        List<TaskView> dispatched = dispatcher.dispatchOnce();

        Assertions.assertEquals(1, dispatched.size());
        TaskView task = balancer.get("t1").orElseThrow();
        Assertions.assertEquals(TaskStatus.PENDING, task.status());
        Assertions.assertEquals(2, task.attemptCount());
        Assertions.assertTrue(task.lastError().startsWith("INTERNAL"), task.lastError());
        Assertions.assertEquals(0, balancer.inFlight("agent-1"));
        Assertions.assertEquals(CircuitState.CLOSED, breakers.states().get("agent-1"));
        Assertions.assertEquals("INTERNAL", failures.recent(null, 10).get(0).errorType());
        dispatcher.close();
    }
}
