package io.mindmesh.rpc;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.mindmesh.error.MethodNotFoundException;
import io.mindmesh.error.RpcConnectionException;
import io.mindmesh.error.RpcRemoteException;
import io.mindmesh.error.RpcTimeoutException;
import io.mindmesh.transport.FrameCodec;
import io.mindmesh.util.Backoff;
import io.mindmesh.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Assumptions;
import org.junit.jupiter.api.Test;

import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

final class RpcServerClientTest {

    private static RpcServer.Builder echoServer() {
        return RpcServer.builder()
                .name("test-rpc")
                .bind("127.0.0.1", 0)
                .method("echo", params -> params)
                .method("boom", params -> {
                    throw new IllegalStateException("kaput");
                })
                .method("needs.key", params -> {
                    if (!params.hasNonNull("key")) {
                        throw new IllegalArgumentException("key is required");
                    }
                    return params.get("key");
                })
                .method("custom.error", params -> {
                    throw new RpcRemoteException(-32050, "quota exceeded");
                });
    }

    private static RpcClient fastClient() {
        return new RpcClient(RpcClient.Options.defaults()
                .withCallTimeout(Duration.ofSeconds(5))
                .withConnectBackoff(new Backoff(2, 10L, 20L)));
    }

    @Test
    void echoesParamsBack() throws Exception {
        try (RpcServer server = echoServer().build(); RpcClient client = fastClient()) {
            int port = server.start();
            ObjectNode params = Jsons.object().put("msg", "hi").put("n", 3);

            JsonNode result = client.call(new Endpoint("127.0.0.1", port), "echo", params);

            Assertions.assertEquals(params, result);
        }
    }

    @Test
    void concurrentCallsOnOneConnectionGetTheirOwnResponses() throws Exception {
        ExecutorService callers = Executors.newFixedThreadPool(8);
        try (RpcServer server = echoServer().build(); RpcClient client = fastClient()) {
            Endpoint endpoint = new Endpoint("127.0.0.1", server.start());
            List<Future<JsonNode>> futures = new ArrayList<>();
            for (int i = 0; i < 64; i++) {
                int n = i;
                futures.add(callers.submit(() -> client.call(endpoint, "echo", Jsons.object().put("n", n))));
            }
            for (int i = 0; i < futures.size(); i++) {
                Assertions.assertEquals(i, futures.get(i).get(10, TimeUnit.SECONDS).path("n").asInt());
            }
            Assertions.assertEquals(1, server.openConnections());
        } finally {
            callers.shutdownNow();
        }
    }

    @Test
    void unknownMethodIsReportedAndConnectionSurvives() throws Exception {
        try (RpcServer server = echoServer().build(); RpcClient client = fastClient()) {
            Endpoint endpoint = new Endpoint("127.0.0.1", server.start());

            MethodNotFoundException error = Assertions.assertThrows(MethodNotFoundException.class,
                    () -> client.call(endpoint, "nope", Jsons.object()));
            Assertions.assertEquals(RpcErrorCodes.METHOD_NOT_FOUND, error.code());
            Assertions.assertTrue(error.getMessage().contains("nope"));

            Assertions.assertEquals("ok", client.call(endpoint, "echo", Jsons.object().put("v", "ok")).path("v").asText());
        }
    }

    @Test
    void handlerFailuresMapToErrorCodes() throws Exception {
        try (RpcServer server = echoServer().build(); RpcClient client = fastClient()) {
            Endpoint endpoint = new Endpoint("127.0.0.1", server.start());

            RpcRemoteException internal = Assertions.assertThrows(RpcRemoteException.class,
                    () -> client.call(endpoint, "boom", Jsons.object()));
            Assertions.assertEquals(RpcErrorCodes.INTERNAL_ERROR, internal.code());
            Assertions.assertTrue(internal.getMessage().contains("kaput"));

            RpcRemoteException invalid = Assertions.assertThrows(RpcRemoteException.class,
                    () -> client.call(endpoint, "needs.key", Jsons.object()));
            Assertions.assertEquals(RpcErrorCodes.INVALID_PARAMS, invalid.code());

            RpcRemoteException custom = Assertions.assertThrows(RpcRemoteException.class,
                    () -> client.call(endpoint, "custom.error", Jsons.object()));
            Assertions.assertEquals(-32050, custom.code());
            Assertions.assertEquals("quota exceeded", custom.getMessage());

            Assertions.assertEquals("k1", client.call(endpoint, "needs.key", Jsons.object().put("key", "k1")).asText());
        }
    }

    @Test
    void requestWithoutMethodGetsInvalidRequestOnSameConnection() throws Exception {
        try (RpcServer server = echoServer().build(); Socket socket = new Socket()) {
            int port = server.start();
            socket.connect(new java.net.InetSocketAddress("127.0.0.1", port), 2_000);
            socket.setSoTimeout(5_000);
            FrameCodec codec = FrameCodec.withDefaults();

            codec.writeFrame(socket.getOutputStream(), "{\"id\":\"x1\",\"params\":{}}".getBytes(StandardCharsets.UTF_8));
            RpcResponse first = RpcCodec.decodeResponse(codec.readFrame(socket.getInputStream()).orElseThrow());
            Assertions.assertEquals("x1", first.id());
            Assertions.assertEquals(RpcErrorCodes.INVALID_REQUEST, first.error().code());

            codec.writeFrame(socket.getOutputStream(), RpcCodec.encodeRequest(
                    new RpcRequest("x2", "echo", Jsons.object().put("a", 1))));
            RpcResponse second = RpcCodec.decodeResponse(codec.readFrame(socket.getInputStream()).orElseThrow());
            Assertions.assertEquals("x2", second.id());
            Assertions.assertEquals(1, second.result().path("a").asInt());
        }
    }

    @Test
    void requestsOnOneConnectionAreHandledInArrivalOrder() throws Exception {
        List<Integer> seen = Collections.synchronizedList(new ArrayList<>());
        RpcServer.Builder builder = RpcServer.builder().bind("127.0.0.1", 0).method("record", params -> {
            seen.add(params.path("n").asInt());
            return null;
        });
        try (RpcServer server = builder.build(); Socket socket = new Socket()) {
            int port = server.start();
            socket.connect(new java.net.InetSocketAddress("127.0.0.1", port), 2_000);
            socket.setSoTimeout(5_000);
            FrameCodec codec = FrameCodec.withDefaults();
            for (int i = 0; i < 20; i++) {
                codec.writeFrame(socket.getOutputStream(), RpcCodec.encodeRequest(
                        new RpcRequest("r" + i, "record", Jsons.object().put("n", i))));
            }
            for (int i = 0; i < 20; i++) {
                RpcResponse response = RpcCodec.decodeResponse(codec.readFrame(socket.getInputStream()).orElseThrow());
                Assertions.assertEquals("r" + i, response.id());
                Assertions.assertTrue(response.result().isNull());
            }
            List<Integer> expected = new ArrayList<>();
            for (int i = 0; i < 20; i++) {
                expected.add(i);
            }
            Assertions.assertEquals(expected, seen);
        }
    }

    @Test
    void slowHandlerTimesOutWithoutPoisoningTheConnection() throws Exception {
        RpcServer.Builder builder = echoServer().method("slow", params -> {
            Thread.sleep(600L);
            return params;
        });
        try (RpcServer server = builder.build(); RpcClient client = fastClient()) {
            Endpoint endpoint = new Endpoint("127.0.0.1", server.start());

            Assertions.assertThrows(RpcTimeoutException.class,
                    () -> client.call(endpoint, "slow", Jsons.object(), Duration.ofMillis(100)));

            JsonNode result = client.call(endpoint, "echo", Jsons.object().put("after", true));
            Assertions.assertTrue(result.path("after").asBoolean());
        }
    }

    @Test
    void unreachableEndpointFailsWithConnectionError() throws Exception {
        int port;
        try (ServerSocket spare = new ServerSocket(0)) {
            port = spare.getLocalPort();
        }
        try (RpcClient client = fastClient()) {
            Endpoint endpoint = new Endpoint("127.0.0.1", port);
            RpcConnectionException error = Assertions.assertThrows(RpcConnectionException.class,
                    () -> client.call(endpoint, "echo", Jsons.object()));
            Assertions.assertTrue(error.getMessage().contains("2 attempt"));
        }
    }

    @Test
    void connectingToAStalledEndpointDoesNotHoldUpOtherEndpoints() throws Exception {
        List<Socket> backlog = new ArrayList<>();
        ExecutorService callers = Executors.newSingleThreadExecutor();
        try (ServerSocket stalled = new ServerSocket(0, 1, InetAddress.getLoopbackAddress());
             RpcServer healthy = echoServer().build()) {
            boolean full = false;
            for (int i = 0; i < 32 && !full; i++) {
                Socket filler = new Socket();
                backlog.add(filler);
                try {
                    filler.connect(new InetSocketAddress(stalled.getInetAddress(), stalled.getLocalPort()), 200);
                } catch (SocketTimeoutException e) {
                    full = true;
                }
            }
            Assumptions.assumeTrue(full, "listen backlog never filled on this platform");

            RpcClient client = new RpcClient(new RpcClient.Options(
                    Duration.ofMillis(1_000L),
                    Duration.ofSeconds(5),
                    new Backoff(2, 300L, 300L),
                    null,
                    FrameCodec.DEFAULT_MAX_FRAME_BYTES));
            try (client) {
                Endpoint slow = new Endpoint(stalled.getInetAddress().getHostAddress(), stalled.getLocalPort());
                Endpoint fast = new Endpoint("127.0.0.1", healthy.start());
                Future<JsonNode> stuck = callers.submit(() -> client.call(slow, "echo", Jsons.object()));
                Thread.sleep(150L);

                long started = System.nanoTime();
                JsonNode reply = client.call(fast, "echo", Jsons.object().put("n", 1));
                long elapsedMs = (System.nanoTime() - started) / 1_000_000L;

                Assertions.assertEquals(1, reply.path("n").asInt());
                Assertions.assertTrue(elapsedMs < 1_000L, "healthy call took " + elapsedMs + "ms");
                ExecutionException failure = Assertions.assertThrows(ExecutionException.class,
                        () -> stuck.get(10, TimeUnit.SECONDS));
                Assertions.assertInstanceOf(RpcConnectionException.class, failure.getCause());
            }
        } finally {
            callers.shutdownNow();
            for (Socket socket : backlog) {
                socket.close();
            }
        }
    }

    @Test
    void gracefulShutdownLetsInFlightRequestFinish() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        RpcServer.Builder builder = echoServer().method("slow", params -> {
            entered.countDown();
            Thread.sleep(300L);
            return Jsons.object().put("done", true);
        });
        RpcServer server = builder.build();
        try (RpcClient client = fastClient()) {
            Endpoint endpoint = new Endpoint("127.0.0.1", server.start());
            CompletableFuture<JsonNode> inFlight = CompletableFuture.supplyAsync(
                    () -> client.call(endpoint, "slow", Jsons.object()));
            Assertions.assertTrue(entered.await(5, TimeUnit.SECONDS));

            RpcServer.ShutdownReport report = server.shutdown(Duration.ofSeconds(5));

            Assertions.assertEquals(1, report.connections());
            Assertions.assertEquals(1, report.closedGracefully());
            Assertions.assertEquals(0, report.forceClosed());
            Assertions.assertTrue(inFlight.get(5, TimeUnit.SECONDS).path("done").asBoolean());
            Assertions.assertEquals(RpcServer.State.STOPPED, server.state());
            Assertions.assertSame(report, server.shutdown(Duration.ZERO));
        }
    }

    @Test
    void shutdownForceClosesHandlersThatOverrunGrace() throws Exception {
        CountDownLatch entered = new CountDownLatch(1);
        RpcServer.Builder builder = echoServer().method("stuck", params -> {
            entered.countDown();
            Thread.sleep(10_000L);
            return params;
        });
        RpcServer server = builder.build();
        try (RpcClient client = fastClient()) {
            Endpoint endpoint = new Endpoint("127.0.0.1", server.start());
            CompletableFuture<JsonNode> inFlight = CompletableFuture.supplyAsync(
                    () -> client.call(endpoint, "stuck", Jsons.object()));
            Assertions.assertTrue(entered.await(5, TimeUnit.SECONDS));

            RpcServer.ShutdownReport report = server.shutdown(Duration.ofMillis(200));

            Assertions.assertEquals(1, report.forceClosed());
            Assertions.assertThrows(Exception.class, () -> inFlight.get(5, TimeUnit.SECONDS));
        }
    }

    @Test
    void callStatsCountSuccessesAndFailuresPerMethod() throws Exception {
        try (RpcServer server = echoServer().build(); RpcClient client = fastClient()) {
            Endpoint endpoint = new Endpoint("127.0.0.1", server.start());
            client.call(endpoint, "echo", Jsons.object());
            client.call(endpoint, "echo", Jsons.object());
            Assertions.assertThrows(RpcRemoteException.class, () -> client.call(endpoint, "boom", Jsons.object()));

            RpcCallStats stats = server.callStats();
            Assertions.assertEquals(3, stats.totalCalls());
            Assertions.assertEquals(2, stats.successfulCalls());
            Assertions.assertEquals(1, stats.failedCalls());
            Assertions.assertEquals(2, stats.methods().get("echo").count());
            Assertions.assertEquals(1, stats.methods().get("boom").failed());

            List<RpcCallRecord> recent = server.recentCalls(10);
            Assertions.assertEquals(3, recent.size());
        }
    }

    @Test
    void builderRejectsDuplicateMethods() {
        RpcServer.Builder builder = RpcServer.builder().method("a", params -> params);
        Assertions.assertThrows(IllegalArgumentException.class, () -> builder.method("a", params -> params));
        Assertions.assertThrows(IllegalArgumentException.class, () -> builder.method(" ", params -> params));
    }

    @Test
    void serverCannotStartTwice() throws Exception {
        try (RpcServer server = echoServer().build()) {
            server.start();
            Assertions.assertThrows(IllegalStateException.class, server::start);
        }
    }
}
