package io.mindmesh.agent;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.mindmesh.error.MeshException;
import io.mindmesh.recovery.FaultRecovery;
import io.mindmesh.rpc.Endpoint;
import io.mindmesh.rpc.RpcClient;
import io.mindmesh.util.Backoff;
import io.mindmesh.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Keeps this node registered with a coordinator: registers on start, then heartbeats on a
 * fixed delay and registers again whenever the coordinator no longer knows the node or has
 * declared it dead.
 */
public final class HeartbeatSender implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(HeartbeatSender.class);

    private final RpcClient client;
    private final Endpoint coordinator;
    private final String agentId;
    private final String advertisedHost;
    private final int advertisedPort;
    private final List<String> capabilities;
    private final Duration interval;
    private final Backoff retry;
    private ScheduledExecutorService scheduler;
    private volatile boolean registered;

    public HeartbeatSender(
            RpcClient client,
            Endpoint coordinator,
            String agentId,
            String advertisedHost,
            int advertisedPort,
            List<String> capabilities,
            Duration interval,
            Backoff retry
    ) {
        this.client = client;
        this.coordinator = coordinator;
        this.agentId = agentId;
        this.advertisedHost = advertisedHost;
        this.advertisedPort = advertisedPort;
        this.capabilities = List.copyOf(capabilities);
        this.interval = interval;
        this.retry = retry;
    }

    public synchronized void start() {
        if (scheduler != null) {
            return;
        }
        scheduler = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "heartbeat-" + agentId);
            thread.setDaemon(true);
            return thread;
        });
        scheduler.scheduleWithFixedDelay(this::tickQuietly, 0L, Math.max(10L, interval.toMillis()), TimeUnit.MILLISECONDS);
    }

    public boolean registered() {
        return registered;
    }

    /**
     * One registration or heartbeat round trip. Both calls are idempotent on the coordinator and
     * are retried on connection failures and timeouts.
     */
    public void tick() {
        if (!registered) {
            ObjectNode registration = registrationParams();
            FaultRecovery.retryIdempotent(() -> client.call(coordinator, "registry.register", registration), retry);
            registered = true;
            logger.info("registered {} with coordinator {}", agentId, coordinator);
            return;
        }
        ObjectNode params = Jsons.object();
        params.put("agentId", agentId);
        JsonNode reply = FaultRecovery.retryIdempotent(() -> client.call(coordinator, "registry.heartbeat", params), retry);
        String outcome = reply.path("outcome").asText("");
        if ("UNKNOWN".equals(outcome) || "REJECTED_DEAD".equals(outcome)) {
            logger.warn("coordinator {} answered {} for {}, registering again", coordinator, outcome, agentId);
            registered = false;
            tick();
        }
    }

    @Override
    public synchronized void close() {
        if (scheduler != null) {
            scheduler.shutdownNow();
            scheduler = null;
        }
    }

    private ObjectNode registrationParams() {
        ObjectNode params = Jsons.object();
        params.put("agentId", agentId);
        params.put("host", advertisedHost);
        params.put("port", advertisedPort);
        params.set("capabilities", Jsons.toTree(capabilities));
        return params;
    }

    private void tickQuietly() {
        try {
            tick();
        } catch (MeshException e) {
            logger.warn("heartbeat to coordinator {} failed: {}", coordinator, e.getMessage());
        }
    }
}
