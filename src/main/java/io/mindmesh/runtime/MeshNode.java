package io.mindmesh.runtime;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.mindmesh.agent.CapabilityHandler;
import io.mindmesh.agent.CapabilityHandlers;
import io.mindmesh.agent.HeartbeatSender;
import io.mindmesh.agent.TaskContext;
import io.mindmesh.agent.TaskOutcome;
import io.mindmesh.balancer.LoadBalancer;
import io.mindmesh.balancer.LoadBalancingStrategy;
import io.mindmesh.balancer.TaskView;
import io.mindmesh.config.MeshSettings;
import io.mindmesh.observability.AuditLogger;
import io.mindmesh.observability.PrometheusFormatter;
import io.mindmesh.recovery.CircuitBreakers;
import io.mindmesh.recovery.CircuitState;
import io.mindmesh.recovery.FaultRecovery;
import io.mindmesh.registry.AgentRecord;
import io.mindmesh.registry.AgentRegistry;
import io.mindmesh.registry.HeartbeatOutcome;
import io.mindmesh.rpc.Endpoint;
import io.mindmesh.rpc.RpcClient;
import io.mindmesh.rpc.RpcServer;
import io.mindmesh.security.MeshTls;
import io.mindmesh.state.StateEntry;
import io.mindmesh.state.StateReplicator;
import io.mindmesh.state.StateStore;
import io.mindmesh.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.net.ssl.SSLContext;
import java.io.IOException;
import java.security.GeneralSecurityException;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Random;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * One mesh process: RPC listener, membership registry, load balancer, replicated state and the
 * background loops that keep them healthy.
 */
public final class MeshNode implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(MeshNode.class);

    private final MeshSettings settings;
    private final Clock clock;
    private final CapabilityHandlers capabilityHandlers;
    private final AgentRegistry registry;
    private final LoadBalancer balancer;
    private final StateStore stateStore;
    private final CircuitBreakers breakers;
    private final RpcClient client;
    private final RpcServer server;
    private final StateReplicator replicator;
    private final FaultRecovery faultRecovery;
    private final TaskDispatcher dispatcher;
    private final AuditLogger auditLogger;
    private HeartbeatSender heartbeatSender;
    private ScheduledExecutorService maintenance;
    private long startedAtMs;
    private int boundPort;

    public MeshNode(MeshSettings settings, CapabilityHandlers capabilityHandlers, Clock clock)
            throws IOException, GeneralSecurityException {
        this.settings = settings;
        this.clock = clock;
        this.capabilityHandlers = capabilityHandlers;
        this.registry = new AgentRegistry(clock);
        this.balancer = new LoadBalancer(settings.maxAttempts(), new Random(), clock);
        this.stateStore = new StateStore(settings.nodeId(), clock);
        this.breakers = new CircuitBreakers(
                settings.circuitFailureThreshold(), Duration.ofMillis(settings.circuitResetTimeoutMs()), clock);

        SSLContext clientTls = settings.tls().clientEnabled()
                ? MeshTls.clientContext(tlsSettings(settings.tls()))
                : null;
        this.client = new RpcClient(new RpcClient.Options(
                settings.connectTimeout(),
                settings.callTimeout(),
                settings.backoff(),
                clientTls,
                settings.maxFrameBytes()
        ));
        this.server = buildServer(settings);
        this.replicator = new StateReplicator(stateStore, client, settings.peers(), new StateReplicator.Settings(
                settings.replicationQueueLimit(),
                settings.backoff(),
                settings.callTimeout(),
                Duration.ofMillis(settings.antiEntropyIntervalMs())
        ));
        this.faultRecovery = new FaultRecovery(registry, balancer, clock, new FaultRecovery.Settings(
                Duration.ofMillis(settings.suspectAfterMs()),
                Duration.ofMillis(settings.deadAfterMs()),
                Duration.ofMillis(settings.deadRetentionMs()),
                Duration.ofMillis(settings.auditIntervalMs())
        ));
        this.dispatcher = new TaskDispatcher(
                balancer,
                registry,
                client,
                breakers,
                faultRecovery.failureLog(),
                settings.defaultStrategy(),
                settings.dispatchBatchSize(),
                Duration.ofMillis(settings.dispatchIntervalMs()),
                settings.callTimeout()
        );
        this.auditLogger = settings.auditDir() == null ? null : new AuditLogger(settings.auditDir(), settings.nodeId(), clock);
        wireAudit();
    }

    /**
     * Binds the listener and starts the background loops.
     *
     * @return the bound port
     */
    public synchronized int start() throws IOException {
        boundPort = server.start();
        startedAtMs = clock.millis();
        replicator.start();
        faultRecovery.start();
        dispatcher.start();
        maintenance = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "mesh-maintenance");
            thread.setDaemon(true);
            return thread;
        });
        long compactEveryMs = Math.max(1_000L, Math.min(60_000L, settings.tombstoneRetentionMs()));
        maintenance.scheduleWithFixedDelay(
                () -> stateStore.compact(Duration.ofMillis(settings.tombstoneRetentionMs())),
                compactEveryMs, compactEveryMs, TimeUnit.MILLISECONDS);

        if (!settings.capabilities().isEmpty()) {
            Endpoint coordinator = settings.coordinator() == null
                    ? new Endpoint(settings.advertisedHost(), boundPort)
                    : settings.coordinator();
            heartbeatSender = new HeartbeatSender(
                    client,
                    coordinator,
                    settings.nodeId(),
                    settings.advertisedHost(),
                    boundPort,
                    settings.capabilities(),
                    Duration.ofMillis(settings.heartbeatIntervalMs()),
                    settings.backoff()
            );
            heartbeatSender.start();
        }
        logger.info("mesh node {} started on port {} peers={} coordinator={}",
                settings.nodeId(), boundPort, settings.peers(), settings.coordinator());
        return boundPort;
    }

    /**
     * Stops background loops, then drains the listener for up to the configured grace period.
     */
    public synchronized RpcServer.ShutdownReport stop() {
        if (heartbeatSender != null) {
            heartbeatSender.close();
        }
        if (maintenance != null) {
            maintenance.shutdownNow();
        }
        dispatcher.close();
        faultRecovery.close();
        replicator.close();
        RpcServer.ShutdownReport report = server.shutdown(Duration.ofMillis(settings.shutdownGraceMs()));
        client.close();
        logger.info("mesh node {} stopped", settings.nodeId());
        return report;
    }

    @Override
    public void close() {
        stop();
    }

    public int port() {
        return boundPort;
    }

    public MeshSettings settings() {
        return settings;
    }

    public AgentRegistry registry() {
        return registry;
    }

    public LoadBalancer balancer() {
        return balancer;
    }

    public StateStore stateStore() {
        return stateStore;
    }

    public StateReplicator replicator() {
        return replicator;
    }

    public FaultRecovery faultRecovery() {
        return faultRecovery;
    }

    public TaskDispatcher dispatcher() {
        return dispatcher;
    }

    public RpcServer server() {
        return server;
    }

    public MeshStats stats() {
        Map<String, CircuitState> circuits = breakers.states();
        return new MeshStats(
                settings.nodeId(),
                startedAtMs == 0L ? 0L : clock.millis() - startedAtMs,
                registry.stats(),
                balancer.stats(),
                server.callStats(),
                server.openConnections(),
                stateStore.liveKeys(),
                stateStore.highestVersion(),
                replicator.queueDepths(),
                replicator.droppedEntries(),
                circuits,
                faultRecovery.failureLog().health(circuits)
        );
    }

    private RpcServer buildServer(MeshSettings settings) throws IOException, GeneralSecurityException {
        RpcServer.Builder builder = RpcServer.builder()
                .name(settings.nodeId())
                .bind(settings.bindHost(), settings.port())
                .maxFrameBytes(settings.maxFrameBytes())
                .callLogCapacity(settings.rpcHistoryCapacity())
                .shutdownGrace(Duration.ofMillis(settings.shutdownGraceMs()));
        if (settings.tls().serverEnabled()) {
            builder.tls(MeshTls.serverContext(tlsSettings(settings.tls())), settings.tls().requireClientAuth());
        }
        builder.method("mesh.ping", params -> {
            ObjectNode out = Jsons.object();
            out.put("nodeId", settings.nodeId());
            out.put("time", clock.instant().toString());
            return out;
        });
        builder.method("echo", params -> params);
        builder.method("mesh.stats", params -> Jsons.toTree(stats()));
        builder.method("metrics", params -> {
            ObjectNode out = Jsons.object();
            out.put("text", PrometheusFormatter.format(stats()));
            return out;
        });
        registerRegistryMethods(builder);
        registerBalancerMethods(builder);
        registerStateMethods(builder);
        registerRecoveryMethods(builder);
        builder.method("rpc.stats", params -> {
            ObjectNode out = Jsons.object();
            out.set("stats", Jsons.toTree(server.callStats()));
            out.set("recent", Jsons.toTree(server.recentCalls((int) Params.optLong(params, "limit", 20L))));
            return out;
        });
        return builder.build();
    }

    private void registerRegistryMethods(RpcServer.Builder builder) {
        builder.method("registry.register", params -> Jsons.toTree(registry.register(
                Params.requireText(params, "agentId"),
                Params.requireText(params, "host"),
                Params.requireInt(params, "port"),
                Params.textList(params, "capabilities")
        )));
        builder.method("registry.deregister", params -> {
            String agentId = Params.requireText(params, "agentId");
            boolean removed = registry.deregister(agentId);
            if (removed) {
                breakers.forget(agentId);
            }
            ObjectNode out = Jsons.object();
            out.put("removed", removed);
            return out;
        });
        builder.method("registry.heartbeat", params -> {
            HeartbeatOutcome outcome = registry.heartbeat(Params.requireText(params, "agentId"));
            ObjectNode out = Jsons.object();
            out.put("outcome", outcome.name());
            return out;
        });
        builder.method("registry.list", params -> {
            ObjectNode out = Jsons.object();
            out.set("agents", Jsons.toTree(registry.list(Params.optText(params, "capability"))));
            return out;
        });
        builder.method("registry.stats", params -> Jsons.toTree(registry.stats()));
    }

    private void registerBalancerMethods(RpcServer.Builder builder) {
        builder.method("task.submit", params -> Jsons.toTree(balancer.submit(
                Params.optText(params, "taskId"),
                Params.optText(params, "capability"),
                Params.value(params, "payload")
        )));
        builder.method("task.get", params -> {
            String taskId = Params.requireText(params, "taskId");
            return Jsons.toTree(balancer.get(taskId)
                    .orElseThrow(() -> new IllegalArgumentException("unknown task: " + taskId)));
        });
        builder.method("task.execute", this::executeLocally);
        builder.method("lb.assign", params -> {
            String taskId = Params.requireText(params, "taskId");
            LoadBalancingStrategy strategy = Optional.ofNullable(Params.optText(params, "strategy"))
                    .map(LoadBalancingStrategy::parse)
                    .orElse(settings.defaultStrategy());
            Optional<TaskView> existing = balancer.get(taskId);
            TaskView task = existing.isPresent()
                    ? existing.get()
                    : balancer.submit(taskId, Params.optText(params, "capability"), Params.value(params, "payload"));
            List<String> agentIds = Params.textList(params, "agentIds");
            List<AgentRecord> candidates = new ArrayList<>();
            if (agentIds.isEmpty()) {
                candidates.addAll(registry.list(task.requiredCapability()));
            } else {
                for (String agentId : agentIds) {
                    registry.get(agentId).ifPresent(candidates::add);
                }
            }
            TaskView assigned = balancer.assign(taskId, candidates, strategy);
            audit("task.assign", taskId, "ok", Map.of(
                    "agent", assigned.assignedAgentId(),
                    "strategy", strategy.wireName(),
                    "attempt", assigned.attemptCount()));
            return Jsons.toTree(assigned);
        });
        builder.method("lb.complete", params -> Jsons.toTree(balancer.complete(
                Params.requireText(params, "taskId"),
                Params.value(params, "result"),
                Params.optLong(params, "executionMs", 0L)
        )));
        builder.method("lb.fail", params -> Jsons.toTree(balancer.fail(
                Params.requireText(params, "taskId"),
                Optional.ofNullable(Params.optText(params, "error")).orElse("failed by caller"),
                Params.optBoolean(params, "retry", true)
        )));
        builder.method("lb.stats", params -> Jsons.toTree(balancer.stats()));
    }

    private void registerStateMethods(RpcServer.Builder builder) {
        builder.method("state.set", params -> Jsons.toTree(stateStore.set(
                Params.requireText(params, "key"),
                Params.value(params, "value")
        )));
        builder.method("state.get", params -> Jsons.toTree(stateStore.require(Params.requireText(params, "key"))));
        builder.method("state.delete", params -> {
            Optional<StateEntry> tombstone = stateStore.delete(Params.requireText(params, "key"));
            ObjectNode out = Jsons.object();
            out.put("deleted", tombstone.isPresent());
            tombstone.ifPresent(entry -> out.put("version", entry.version()));
            return out;
        });
        builder.method(StateReplicator.APPLY_METHOD, params -> {
            int accepted = stateStore.mergeAll(StateReplicator.decodeEntries(params));
            ObjectNode out = Jsons.object();
            out.put("accepted", accepted);
            return out;
        });
        builder.method(StateReplicator.SNAPSHOT_METHOD, params -> StateReplicator.encodeEntries(stateStore.snapshot()));
    }

    private void registerRecoveryMethods(RpcServer.Builder builder) {
        builder.method("recovery.health", params -> {
            ObjectNode out = Jsons.object();
            Map<String, CircuitState> circuits = breakers.states();
            out.set("summary", Jsons.toTree(faultRecovery.failureLog().health(circuits)));
            out.set("circuits", Jsons.toTree(circuits));
            return out;
        });
        builder.method("recovery.failures", params -> {
            ObjectNode out = Jsons.object();
            out.set("failures", Jsons.toTree(faultRecovery.failureLog().recent(
                    Params.optText(params, "agentId"),
                    (int) Params.optLong(params, "limit", 50L))));
            return out;
        });
    }

    private JsonNode executeLocally(JsonNode params) throws Exception {
        String taskId = Params.requireText(params, "taskId");
        String capability = Params.optText(params, "capability");
        CapabilityHandler handler = capability == null
                ? null
                : capabilityHandlers.find(capability).orElse(null);
        if (handler == null) {
            throw new IllegalArgumentException("capability not served by " + settings.nodeId() + ": " + capability);
        }
        TaskContext context = new TaskContext(
                taskId,
                capability,
                params.path("attempt").asInt(1),
                settings.nodeId(),
                Params.value(params, "payload")
        );
        TaskOutcome outcome = handler.execute(context);
        return Jsons.toTree(outcome);
    }

    private void wireAudit() {
        if (auditLogger == null) {
            return;
        }
        registry.addListener((before, after) -> {
            AgentRecord subject = after == null ? before : after;
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("from", before == null ? null : before.status().name());
            details.put("to", after == null ? "REMOVED" : after.status().name());
            audit("agent.membership", subject.id(), "ok", details);
        });
        balancer.addFailureListener(task -> audit("task.failed", task.taskId(), "failed", Map.of(
                "attempts", task.attemptCount(),
                "error", task.lastError() == null ? "" : task.lastError())));
        stateStore.addWriteListener(entry -> audit("state.write", entry.key(), entry.isTombstone() ? "deleted" : "ok",
                Map.of("version", entry.version())));
    }

    private void audit(String action, String resource, String result, Map<String, Object> details) {
        if (auditLogger != null) {
            auditLogger.log(action, resource, result, details);
        }
    }

    private static MeshTls.TlsSettings tlsSettings(MeshSettings.Tls tls) {
        return new MeshTls.TlsSettings(
                tls.keystorePath(),
                tls.keystorePassword(),
                tls.truststorePath(),
                tls.truststorePassword(),
                "PKCS12",
                tls.revocationPath(),
                tls.insecureClient()
        );
    }
}
