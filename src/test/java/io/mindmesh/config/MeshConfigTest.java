package io.mindmesh.config;

import io.mindmesh.balancer.LoadBalancingStrategy;
import io.mindmesh.rpc.Endpoint;
import io.mindmesh.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

final class MeshConfigTest {

    @Test
    void defaultsWhenNothingIsConfigured() throws Exception {
        MeshSettings settings = MeshConfig.load(null, null);

        Assertions.assertEquals(MeshConfig.DEFAULT_NODE_ID, settings.nodeId());
        Assertions.assertEquals("127.0.0.1", settings.bindHost());
        Assertions.assertEquals(MeshConfig.DEFAULT_PORT, settings.port());
        Assertions.assertEquals(List.of("echo"), settings.capabilities());
        Assertions.assertTrue(settings.peers().isEmpty());
        Assertions.assertNull(settings.coordinator());
        Assertions.assertEquals(LoadBalancingStrategy.ROUND_ROBIN, settings.defaultStrategy());
        Assertions.assertEquals(16 * 1024 * 1024, settings.maxFrameBytes());
        Assertions.assertEquals(3, settings.backoff().maxAttempts());
        Assertions.assertFalse(settings.tls().serverEnabled());
        Assertions.assertFalse(settings.tls().clientEnabled());
        Assertions.assertEquals(settings, MeshConfig.defaults());
    }

    @Test
    void overridesWinOverFileValues() throws Exception {
        Path root = Files.createTempDirectory("mindmesh-config-test-");
        try {
            Path file = root.resolve(MeshConfig.SETTINGS_FILE);
            Files.writeString(file, """
                    {
                      "nodeId": "node-a",
                      "port": 7411,
                      "capabilities": ["echo", " summarize ", ""],
                      "peers": ["127.0.0.1:7412", "127.0.0.1:7412", "10.0.0.2:7400"],
                      "coordinator": "127.0.0.1:7400",
                      "defaultStrategy": "least-loaded",
                      "auditDir": "data/audit"
                    }
                    """, StandardCharsets.UTF_8);

            MeshSettings settings = MeshConfig.load(file, Jsons.object().put("port", 7500).put("nodeId", "node-b"));

            Assertions.assertEquals("node-b", settings.nodeId());
            Assertions.assertEquals(7500, settings.port());
            Assertions.assertEquals(List.of("echo", "summarize"), settings.capabilities());
            Assertions.assertEquals(List.of(new Endpoint("127.0.0.1", 7412), new Endpoint("10.0.0.2", 7400)), settings.peers());
            Assertions.assertEquals(new Endpoint("127.0.0.1", 7400), settings.coordinator());
            Assertions.assertEquals(LoadBalancingStrategy.LEAST_LOADED, settings.defaultStrategy());
            Assertions.assertEquals(Path.of("data/audit"), settings.auditDir());
            Assertions.assertEquals(new Endpoint("127.0.0.1", 7500), settings.advertisedEndpoint(7500));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void missingFileFallsBackToOverridesOnly() throws Exception {
        Path missing = Path.of("does-not-exist", MeshConfig.SETTINGS_FILE);
        MeshSettings settings = MeshConfig.load(missing, Jsons.object().put("bindHost", "0.0.0.0").put("advertisedHost", "10.1.1.1"));

        Assertions.assertEquals("0.0.0.0", settings.bindHost());
        Assertions.assertEquals("10.1.1.1", settings.advertisedHost());
    }

    @Test
    void outOfRangeNumbersAreClamped() throws Exception {
        MeshSettings settings = MeshConfig.load(null, Jsons.object()
                .put("maxFrameBytes", 1)
                .put("callTimeoutMs", -5)
                .put("connectMaxAttempts", 0)
                .put("heartbeatIntervalMs", 2_000)
                .put("suspectAfterMs", 500)
                .put("deadAfterMs", 100)
                .put("baseBackoffMs", 300)
                .put("maxBackoffMs", 10));

        Assertions.assertEquals(1_024, settings.maxFrameBytes());
        Assertions.assertEquals(10L, settings.callTimeoutMs());
        Assertions.assertEquals(1, settings.connectMaxAttempts());
        Assertions.assertEquals(2_000L, settings.suspectAfterMs());
        Assertions.assertEquals(2_001L, settings.deadAfterMs());
        Assertions.assertEquals(300L, settings.maxBackoffMs());
    }

    @Test
    void invalidSettingsAreRejected() throws Exception {
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> MeshConfig.load(null, Jsons.object().put("port", 70_000)));
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> MeshConfig.load(null, Jsons.object().put("nodeIdentifier", "typo")));
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> MeshConfig.load(null, Jsons.object().put("defaultStrategy", "fastest")));
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> MeshConfig.load(null, Jsons.object().put("coordinator", "no-port")));

        Path root = Files.createTempDirectory("mindmesh-config-test-");
        try {
            Path file = root.resolve(MeshConfig.SETTINGS_FILE);
            Files.writeString(file, "[1, 2]", StandardCharsets.UTF_8);
            Assertions.assertThrows(IllegalArgumentException.class, () -> MeshConfig.load(file, null));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void tlsSettingsEnableServerAndClient() throws Exception {
        MeshSettings settings = MeshConfig.load(null, Jsons.object()
                .put("tlsKeystore", "node.p12")
                .put("tlsKeystorePassword", "secret")
                .put("tlsInsecure", true));

        Assertions.assertTrue(settings.tls().serverEnabled());
        Assertions.assertTrue(settings.tls().clientEnabled());
        Assertions.assertEquals("secret", settings.tls().keystorePassword());
        Assertions.assertFalse(settings.tls().requireClientAuth());
    }

    private static void deleteRecursively(Path root) throws Exception {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (var walk = Files.walk(root)) {
            for (Path p : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(p);
            }
        }
    }
}
