package io.mindmesh.config;

import io.mindmesh.balancer.LoadBalancingStrategy;
import io.mindmesh.rpc.Endpoint;
import io.mindmesh.util.Backoff;

import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * Fully resolved node settings. Produced by {@link MeshConfig}; every value is already checked.
 */
public record MeshSettings(
        String nodeId,
        String bindHost,
        int port,
        String advertisedHost,
        List<String> capabilities,
        List<Endpoint> peers,
        Endpoint coordinator,
        int maxFrameBytes,
        long connectTimeoutMs,
        long callTimeoutMs,
        int connectMaxAttempts,
        long baseBackoffMs,
        long maxBackoffMs,
        long shutdownGraceMs,
        long heartbeatIntervalMs,
        long suspectAfterMs,
        long deadAfterMs,
        long deadRetentionMs,
        long auditIntervalMs,
        int maxAttempts,
        LoadBalancingStrategy defaultStrategy,
        long dispatchIntervalMs,
        int dispatchBatchSize,
        int circuitFailureThreshold,
        long circuitResetTimeoutMs,
        int replicationQueueLimit,
        long antiEntropyIntervalMs,
        long tombstoneRetentionMs,
        int rpcHistoryCapacity,
        Path auditDir,
        Tls tls
) {
    public Backoff backoff() {
        return new Backoff(connectMaxAttempts, baseBackoffMs, maxBackoffMs);
    }

    public Duration callTimeout() {
        return Duration.ofMillis(callTimeoutMs);
    }

    public Duration connectTimeout() {
        return Duration.ofMillis(connectTimeoutMs);
    }

    public Endpoint advertisedEndpoint(int boundPort) {
        return new Endpoint(advertisedHost, boundPort);
    }

    public record Tls(
            String keystorePath,
            String keystorePassword,
            String truststorePath,
            String truststorePassword,
            String revocationPath,
            boolean requireClientAuth,
            boolean insecureClient
    ) {
        public static final Tls DISABLED = new Tls(null, null, null, null, null, false, false);

        public boolean serverEnabled() {
            return keystorePath != null && !keystorePath.isBlank();
        }

        public boolean clientEnabled() {
            return insecureClient || (truststorePath != null && !truststorePath.isBlank());
        }
    }
}
