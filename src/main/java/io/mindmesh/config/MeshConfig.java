package io.mindmesh.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.mindmesh.balancer.LoadBalancingStrategy;
import io.mindmesh.rpc.Endpoint;
import io.mindmesh.transport.FrameCodec;
import io.mindmesh.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Loads node settings from {@code mindmesh-settings.json}, layers command line overrides on top
 * and clamps every value against the defaults below.
 */
public final class MeshConfig {
    public static final String SETTINGS_FILE = "mindmesh-settings.json";
    public static final String DEFAULT_NODE_ID = "mindmesh-node";
    public static final String DEFAULT_BIND_HOST = "127.0.0.1";
    public static final int DEFAULT_PORT = 7400;
    public static final long DEFAULT_CONNECT_TIMEOUT_MS = 3_000L;
    public static final long DEFAULT_CALL_TIMEOUT_MS = 10_000L;
    public static final int DEFAULT_CONNECT_MAX_ATTEMPTS = 3;
    public static final long DEFAULT_BASE_BACKOFF_MS = 100L;
    public static final long DEFAULT_MAX_BACKOFF_MS = 2_000L;
    public static final long DEFAULT_SHUTDOWN_GRACE_MS = 5_000L;
    public static final long DEFAULT_HEARTBEAT_INTERVAL_MS = 1_000L;
    public static final long DEFAULT_SUSPECT_AFTER_MS = 5_000L;
    public static final long DEFAULT_DEAD_AFTER_MS = 15_000L;
    public static final long DEFAULT_DEAD_RETENTION_MS = 5L * 60L * 1000L;
    public static final long DEFAULT_AUDIT_INTERVAL_MS = 1_000L;
    public static final int DEFAULT_MAX_ATTEMPTS = 3;
    public static final long DEFAULT_DISPATCH_INTERVAL_MS = 200L;
    public static final int DEFAULT_DISPATCH_BATCH_SIZE = 32;
    public static final int DEFAULT_CIRCUIT_FAILURE_THRESHOLD = 5;
    public static final long DEFAULT_CIRCUIT_RESET_TIMEOUT_MS = 30_000L;
    public static final int DEFAULT_REPLICATION_QUEUE_LIMIT = 10_000;
    public static final long DEFAULT_ANTI_ENTROPY_INTERVAL_MS = 5_000L;
    public static final long DEFAULT_TOMBSTONE_RETENTION_MS = 24L * 60L * 60L * 1000L;
    public static final int DEFAULT_RPC_HISTORY_CAPACITY = 1_024;

    private MeshConfig() {
    }

    public static MeshSettings defaults() {
        return resolve(null);
    }

    /**
     * Reads {@code settingsFile} when it exists, applies {@code overrides} key by key and
     * resolves the result.
     */
    public static MeshSettings load(Path settingsFile, ObjectNode overrides) throws IOException {
        ObjectNode merged = Jsons.object();
        if (settingsFile != null && Files.exists(settingsFile)) {
            JsonNode fromFile = Jsons.mapper().readTree(settingsFile.toFile());
            if (fromFile != null && !fromFile.isNull()) {
                if (!fromFile.isObject()) {
                    throw new IllegalArgumentException("settings file must hold a JSON object: " + settingsFile);
                }
                merged.setAll((ObjectNode) fromFile);
            }
        }
        if (overrides != null) {
            merged.setAll(overrides);
        }
        SettingsFile file;
        try {
            file = Jsons.mapper().treeToValue(merged, SettingsFile.class);
        } catch (IOException e) {
            throw new IllegalArgumentException("invalid settings"
                    + (settingsFile == null ? "" : " in " + settingsFile) + ": " + e.getMessage(), e);
        }
        return resolve(file);
    }

    static MeshSettings resolve(SettingsFile file) {
        SettingsFile f = file == null ? SettingsFile.EMPTY : file;
        String nodeId = sanitizeText(f.nodeId(), DEFAULT_NODE_ID);
        String bindHost = sanitizeText(f.bindHost(), DEFAULT_BIND_HOST);
        int port = sanitizePort(f.port());
        String advertisedHost = sanitizeText(f.advertisedHost(), bindHost);
        List<String> capabilities = f.capabilities() == null ? List.of("echo") : cleanList(f.capabilities());
        List<Endpoint> peers = f.peers() == null ? List.of() : Endpoint.parseAll(cleanList(f.peers()));
        Endpoint coordinator = f.coordinator() == null || f.coordinator().isBlank() ? null : Endpoint.parse(f.coordinator());

        int maxFrameBytes = sanitizeInt(f.maxFrameBytes(), FrameCodec.DEFAULT_MAX_FRAME_BYTES, 1_024);
        long connectTimeout = sanitizeLong(f.connectTimeoutMs(), DEFAULT_CONNECT_TIMEOUT_MS, 10L);
        long callTimeout = sanitizeLong(f.callTimeoutMs(), DEFAULT_CALL_TIMEOUT_MS, 10L);
        int connectAttempts = sanitizeInt(f.connectMaxAttempts(), DEFAULT_CONNECT_MAX_ATTEMPTS, 1);
        long baseBackoff = sanitizeLong(f.baseBackoffMs(), DEFAULT_BASE_BACKOFF_MS, 1L);
        long maxBackoff = sanitizeLong(f.maxBackoffMs(), DEFAULT_MAX_BACKOFF_MS, baseBackoff);
        long shutdownGrace = sanitizeLong(f.shutdownGraceMs(), DEFAULT_SHUTDOWN_GRACE_MS, 0L);

        long heartbeatInterval = sanitizeLong(f.heartbeatIntervalMs(), DEFAULT_HEARTBEAT_INTERVAL_MS, 10L);
        long suspectAfter = sanitizeLong(f.suspectAfterMs(), DEFAULT_SUSPECT_AFTER_MS, heartbeatInterval);
        long deadAfter = sanitizeLong(f.deadAfterMs(), Math.max(DEFAULT_DEAD_AFTER_MS, suspectAfter + 1L), suspectAfter + 1L);
        long deadRetention = sanitizeLong(f.deadRetentionMs(), DEFAULT_DEAD_RETENTION_MS, 0L);
        long auditInterval = sanitizeLong(f.auditIntervalMs(), DEFAULT_AUDIT_INTERVAL_MS, 10L);

        int maxAttempts = sanitizeInt(f.maxAttempts(), DEFAULT_MAX_ATTEMPTS, 1);
        LoadBalancingStrategy strategy = f.defaultStrategy() == null || f.defaultStrategy().isBlank()
                ? LoadBalancingStrategy.ROUND_ROBIN
                : LoadBalancingStrategy.parse(f.defaultStrategy());
        long dispatchInterval = sanitizeLong(f.dispatchIntervalMs(), DEFAULT_DISPATCH_INTERVAL_MS, 10L);
        int dispatchBatch = sanitizeInt(f.dispatchBatchSize(), DEFAULT_DISPATCH_BATCH_SIZE, 1);
        int circuitThreshold = sanitizeInt(f.circuitFailureThreshold(), DEFAULT_CIRCUIT_FAILURE_THRESHOLD, 1);
        long circuitReset = sanitizeLong(f.circuitResetTimeoutMs(), DEFAULT_CIRCUIT_RESET_TIMEOUT_MS, 0L);

        int queueLimit = sanitizeInt(f.replicationQueueLimit(), DEFAULT_REPLICATION_QUEUE_LIMIT, 1);
        long antiEntropy = sanitizeLong(f.antiEntropyIntervalMs(), DEFAULT_ANTI_ENTROPY_INTERVAL_MS, 0L);
        long tombstoneRetention = sanitizeLong(f.tombstoneRetentionMs(), DEFAULT_TOMBSTONE_RETENTION_MS, 0L);
        int historyCapacity = sanitizeInt(f.rpcHistoryCapacity(), DEFAULT_RPC_HISTORY_CAPACITY, 1);
        Path auditDir = f.auditDir() == null || f.auditDir().isBlank() ? null : Path.of(f.auditDir());

        MeshSettings.Tls tls = new MeshSettings.Tls(
                blankToNull(f.tlsKeystore()),
                f.tlsKeystorePassword(),
                blankToNull(f.tlsTruststore()),
                f.tlsTruststorePassword(),
                blankToNull(f.tlsRevocationFile()),
                f.tlsRequireClientAuth() != null && f.tlsRequireClientAuth(),
                f.tlsInsecure() != null && f.tlsInsecure()
        );

        return new MeshSettings(
                nodeId,
                bindHost,
                port,
                advertisedHost,
                capabilities,
                peers,
                coordinator,
                maxFrameBytes,
                connectTimeout,
                callTimeout,
                connectAttempts,
                baseBackoff,
                maxBackoff,
                shutdownGrace,
                heartbeatInterval,
                suspectAfter,
                deadAfter,
                deadRetention,
                auditInterval,
                maxAttempts,
                strategy,
                dispatchInterval,
                dispatchBatch,
                circuitThreshold,
                circuitReset,
                queueLimit,
                antiEntropy,
                tombstoneRetention,
                historyCapacity,
                auditDir,
                tls
        );
    }

    private static int sanitizePort(Integer raw) {
        if (raw == null) {
            return DEFAULT_PORT;
        }
        if (raw < 0 || raw > 65535) {
            throw new IllegalArgumentException("port out of range: " + raw);
        }
        return raw;
    }

    private static int sanitizeInt(Integer raw, int fallback, int min) {
        if (raw == null) {
            return fallback;
        }
        return Math.max(min, raw);
    }

    private static long sanitizeLong(Long raw, long fallback, long min) {
        if (raw == null) {
            return fallback;
        }
        return Math.max(min, raw);
    }

    private static String sanitizeText(String raw, String fallback) {
        if (raw == null || raw.isBlank()) {
            return fallback;
        }
        return raw.trim();
    }

    private static String blankToNull(String raw) {
        return raw == null || raw.isBlank() ? null : raw.trim();
    }

    private static List<String> cleanList(List<String> raw) {
        List<String> out = new ArrayList<>();
        for (String value : raw) {
            if (value != null && !value.isBlank()) {
                out.add(value.trim());
            }
        }
        return List.copyOf(out);
    }

    record SettingsFile(
            String nodeId,
            String bindHost,
            Integer port,
            String advertisedHost,
            List<String> capabilities,
            List<String> peers,
            String coordinator,
            Integer maxFrameBytes,
            Long connectTimeoutMs,
            Long callTimeoutMs,
            Integer connectMaxAttempts,
            Long baseBackoffMs,
            Long maxBackoffMs,
            Long shutdownGraceMs,
            Long heartbeatIntervalMs,
            Long suspectAfterMs,
            Long deadAfterMs,
            Long deadRetentionMs,
            Long auditIntervalMs,
            Integer maxAttempts,
            String defaultStrategy,
            Long dispatchIntervalMs,
            Integer dispatchBatchSize,
            Integer circuitFailureThreshold,
            Long circuitResetTimeoutMs,
            Integer replicationQueueLimit,
            Long antiEntropyIntervalMs,
            Long tombstoneRetentionMs,
            Integer rpcHistoryCapacity,
            String auditDir,
            String tlsKeystore,
            String tlsKeystorePassword,
            String tlsTruststore,
            String tlsTruststorePassword,
            String tlsRevocationFile,
            Boolean tlsRequireClientAuth,
            Boolean tlsInsecure
    ) {
        static final SettingsFile EMPTY = new SettingsFile(
                null, null, null, null, null, null, null, null, null, null,
                null, null, null, null, null, null, null, null, null, null,
                null, null, null, null, null, null, null, null, null, null,
                null, null, null, null, null, null, null
        );
    }
}
