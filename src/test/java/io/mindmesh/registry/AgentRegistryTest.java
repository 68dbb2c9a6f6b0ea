package io.mindmesh.registry;

import io.mindmesh.testing.MutableClock;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

final class AgentRegistryTest {

    @Test
    void listsInRegistrationOrderAndFiltersByCapability() {
        AgentRegistry registry = new AgentRegistry(MutableClock.startingAt(1_000L));
        registry.register("a", "127.0.0.1", 7401, List.of("echo"));
        registry.register("b", "127.0.0.1", 7402, List.of("summarize", "echo"));
        registry.register("c", "127.0.0.1", 7403, List.of("summarize"));

        Assertions.assertEquals(List.of("a", "b", "c"), ids(registry.list()));
        Assertions.assertEquals(List.of("a", "b"), ids(registry.list("echo")));
        Assertions.assertEquals(List.of("b", "c"), ids(registry.list("summarize")));
        Assertions.assertTrue(registry.list("translate").isEmpty());
        Assertions.assertEquals(List.of("a", "b", "c"), ids(registry.list(" ")));
    }

    @Test
    void capabilityFilterSkipsAgentsThatAreNotActive() {
        AgentRegistry registry = new AgentRegistry(MutableClock.startingAt(0L));
        registry.register("a", "127.0.0.1", 7401, List.of("echo"));
        registry.register("b", "127.0.0.1", 7402, List.of("echo"));
        Assertions.assertTrue(registry.markSuspect("a"));

        Assertions.assertEquals(List.of("b"), ids(registry.list("echo")));
        Assertions.assertEquals(2, registry.list().size());
    }

    @Test
    void reRegistrationKeepsPositionAndReplacesAddress() {
        MutableClock clock = MutableClock.startingAt(5_000L);
        AgentRegistry registry = new AgentRegistry(clock);
        registry.register("a", "127.0.0.1", 7401, List.of("echo"));
        registry.register("b", "127.0.0.1", 7402, List.of("echo"));
        clock.advance(Duration.ofSeconds(3));

        AgentRecord updated = registry.register("a", "10.0.0.9", 9000, List.of("fail"));

        Assertions.assertEquals(List.of("a", "b"), ids(registry.list()));
        Assertions.assertEquals("10.0.0.9", updated.host());
        Assertions.assertEquals(9000, updated.endpoint().port());
        Assertions.assertEquals(List.of("fail"), updated.capabilities());
        Assertions.assertEquals(5_000L, updated.registeredAt().toEpochMilli());
        Assertions.assertEquals(8_000L, updated.lastHeartbeat().toEpochMilli());
    }

    @Test
    void statusMovesOneStepAtATime() {
        AgentRegistry registry = new AgentRegistry(MutableClock.startingAt(0L));
        registry.register("a", "127.0.0.1", 7401, List.of());

        Assertions.assertFalse(registry.markDead("a"));
        Assertions.assertTrue(registry.markSuspect("a"));
        Assertions.assertFalse(registry.markSuspect("a"));
        Assertions.assertTrue(registry.markDead("a"));
        Assertions.assertEquals(AgentStatus.DEAD, registry.get("a").orElseThrow().status());
        Assertions.assertFalse(registry.markSuspect("missing"));
    }

    @Test
    void heartbeatRecoversSuspectButNotDead() {
        MutableClock clock = MutableClock.startingAt(0L);
        AgentRegistry registry = new AgentRegistry(clock);
        registry.register("a", "127.0.0.1", 7401, List.of("echo"));

        Assertions.assertEquals(HeartbeatOutcome.UNKNOWN, registry.heartbeat("ghost"));
        clock.advance(Duration.ofSeconds(1));
        Assertions.assertEquals(HeartbeatOutcome.ACCEPTED, registry.heartbeat("a"));
        Assertions.assertEquals(1_000L, registry.get("a").orElseThrow().lastHeartbeat().toEpochMilli());

        registry.markSuspect("a");
        Assertions.assertEquals(HeartbeatOutcome.RECOVERED, registry.heartbeat("a"));
        Assertions.assertEquals(AgentStatus.ACTIVE, registry.get("a").orElseThrow().status());

        registry.markSuspect("a");
        registry.markDead("a");
        Assertions.assertEquals(HeartbeatOutcome.REJECTED_DEAD, registry.heartbeat("a"));
        Assertions.assertEquals(AgentStatus.DEAD, registry.get("a").orElseThrow().status());
    }

    @Test
    void deadAgentRegisteringAgainJoinsAsNewAgent() {
        MutableClock clock = MutableClock.startingAt(1_000L);
        AgentRegistry registry = new AgentRegistry(clock);
        List<String> events = new ArrayList<>();
        registry.register("a", "127.0.0.1", 7401, List.of("echo"));
        registry.register("b", "127.0.0.1", 7402, List.of("echo"));
        registry.markSuspect("a");
        registry.markDead("a");
        registry.addListener((before, after) -> events.add(
                (before == null ? "-" : before.status().name()) + ">" + (after == null ? "-" : after.status().name())));
        clock.advance(Duration.ofSeconds(30));

        AgentRecord back = registry.register("a", "10.0.0.7", 7409, List.of("summarize"));

        Assertions.assertEquals(AgentStatus.ACTIVE, back.status());
        Assertions.assertEquals(31_000L, back.registeredAt().toEpochMilli());
        Assertions.assertEquals(31_000L, back.statusChangedAt().toEpochMilli());
        Assertions.assertEquals(List.of("b", "a"), ids(registry.list()));
        Assertions.assertEquals(List.of("DEAD>-", "->ACTIVE"), events);
        Assertions.assertEquals(List.of("a"), ids(registry.list("summarize")));
    }

    @Test
    void invalidReRegistrationKeepsDeadRecord() {
        AgentRegistry registry = new AgentRegistry(MutableClock.startingAt(0L));
        registry.register("a", "127.0.0.1", 7401, List.of());
        registry.markSuspect("a");
        registry.markDead("a");

        Assertions.assertThrows(IllegalArgumentException.class, () -> registry.register("a", "h", 70_000, List.of()));
        Assertions.assertEquals(AgentStatus.DEAD, registry.get("a").orElseThrow().status());
    }

    @Test
    void purgeRemovesOnlyDeadAgentsPastRetention() {
        MutableClock clock = MutableClock.startingAt(0L);
        AgentRegistry registry = new AgentRegistry(clock);
        registry.register("old", "127.0.0.1", 7401, List.of());
        registry.register("fresh", "127.0.0.1", 7402, List.of());
        registry.register("alive", "127.0.0.1", 7403, List.of());
        registry.markSuspect("old");
        registry.markDead("old");
        clock.advance(Duration.ofMinutes(10));
        registry.markSuspect("fresh");
        registry.markDead("fresh");
        clock.advance(Duration.ofMinutes(1));

        Assertions.assertEquals(List.of("old"), registry.purgeDead(Duration.ofMinutes(5)));
        Assertions.assertEquals(List.of("fresh", "alive"), ids(registry.list()));
    }

    @Test
    void listenersSeeEveryMembershipChange() {
        AgentRegistry registry = new AgentRegistry(MutableClock.startingAt(0L));
        List<String> events = new ArrayList<>();
        registry.addListener((before, after) -> events.add(
                (before == null ? "-" : before.status().name()) + ">" + (after == null ? "-" : after.status().name())));
        registry.addListener((before, after) -> {
            throw new IllegalStateException("listener failure must not break the registry");
        });

        registry.register("a", "127.0.0.1", 7401, List.of());
        registry.markSuspect("a");
        registry.heartbeat("a");
        registry.deregister("a");

        Assertions.assertEquals(List.of("->ACTIVE", "ACTIVE>SUSPECT", "SUSPECT>ACTIVE", "ACTIVE>-"), events);
        Assertions.assertFalse(registry.deregister("a"));
    }

    @Test
    void statsCountStatusesAndActiveCapabilities() {
        AgentRegistry registry = new AgentRegistry(MutableClock.startingAt(0L));
        registry.register("a", "127.0.0.1", 7401, List.of("echo"));
        registry.register("b", "127.0.0.1", 7402, List.of("echo", "fail"));
        registry.register("c", "127.0.0.1", 7403, List.of("fail"));
        registry.markSuspect("c");

        RegistryStats stats = registry.stats();

        Assertions.assertEquals(3, stats.total());
        Assertions.assertEquals(2, stats.count(AgentStatus.ACTIVE));
        Assertions.assertEquals(1, stats.count(AgentStatus.SUSPECT));
        Assertions.assertEquals(0, stats.count(AgentStatus.DEAD));
        Assertions.assertEquals(2, stats.activeByCapability().get("echo"));
        Assertions.assertEquals(1, stats.activeByCapability().get("fail"));
    }

    @Test
    void recordRejectsInvalidInput() {
        AgentRegistry registry = new AgentRegistry();
        Assertions.assertThrows(IllegalArgumentException.class, () -> registry.register("", "h", 1, List.of()));
        Assertions.assertThrows(IllegalArgumentException.class, () -> registry.register("a", "h", 70_000, List.of()));
        Assertions.assertEquals(0, registry.size());
    }

    private static List<String> ids(List<AgentRecord> records) {
        List<String> ids = new ArrayList<>();
        for (AgentRecord record : records) {
            ids.add(record.id());
        }
        return ids;
    }
}
