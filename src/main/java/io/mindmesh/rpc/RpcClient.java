package io.mindmesh.rpc;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import io.mindmesh.error.MeshException;
import io.mindmesh.error.RpcConnectionException;
import io.mindmesh.error.RpcTimeoutException;
import io.mindmesh.transport.FrameCodec;
import io.mindmesh.util.Backoff;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.net.ssl.SSLContext;
import javax.net.ssl.SSLException;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Client side of the framed RPC protocol. Keeps one multiplexed connection per endpoint, so
 * concurrent callers share a socket and are matched to their responses by request id.
 *
 * <p>Only connection establishment is retried. Once a request has been written the caller gets
 * the response, a remote error, a timeout or a connection error, never a silent resend.
 */
public final class RpcClient implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(RpcClient.class);

    private final Options options;
    private final FrameCodec codec;
    private final Map<Endpoint, RpcConnection> pool = new ConcurrentHashMap<>();
    private final Map<Endpoint, CompletableFuture<RpcConnection>> connecting = new ConcurrentHashMap<>();
    private volatile boolean closed;

    public RpcClient(Options options) {
        this.options = Objects.requireNonNull(options, "options");
        this.codec = new FrameCodec(options.maxFrameBytes());
    }

    public static RpcClient withDefaults() {
        return new RpcClient(Options.defaults());
    }

    public Options options() {
        return options;
    }

    public JsonNode call(Endpoint endpoint, String method, JsonNode params) {
        return call(endpoint, method, params, options.callTimeout());
    }

    /**
     * Sends one request and waits for its response.
     *
     * @throws RpcTimeoutException    when no response arrives within {@code timeout}
     * @throws RpcConnectionException when the endpoint cannot be reached or drops the connection
     * @throws io.mindmesh.error.RpcRemoteException when the server answers with an error
     */
    public JsonNode call(Endpoint endpoint, String method, JsonNode params, Duration timeout) {
        if (closed) {
            throw new IllegalStateException("rpc client is closed");
        }
        RpcRequest request = RpcRequest.create(method, params);
        RpcConnection connection = connection(endpoint);
        CompletableFuture<RpcResponse> future;
        try {
            future = connection.send(request);
        } catch (IOException e) {
            throw new RpcConnectionException("failed to send " + method + " to " + endpoint + ": " + e.getMessage(), e);
        }
        RpcResponse response = await(connection, request, future, timeout);
        if (response.isError()) {
            throw RpcErrorCodes.toException(response.error());
        }
        return response.result() == null ? NullNode.getInstance() : response.result();
    }

    private RpcResponse await(
            RpcConnection connection,
            RpcRequest request,
            CompletableFuture<RpcResponse> future,
            Duration timeout
    ) {
        try {
            return future.get(Math.max(1L, timeout.toMillis()), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            connection.abandon(request.id());
            throw new RpcTimeoutException(request.method(), connection.endpoint().toString(), timeout);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof MeshException mesh) {
                throw mesh;
            }
            throw new RpcConnectionException("call " + request.method() + " to " + connection.endpoint() + " failed", e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            connection.abandon(request.id());
            throw new RpcConnectionException("interrupted waiting for " + request.method() + " from " + connection.endpoint(), e);
        }
    }

    /**
     * Returns the pooled connection, opening one when needed. Concurrent callers for the same
     * endpoint share one connect attempt; other endpoints are never held up by it.
     */
    private RpcConnection connection(Endpoint endpoint) {
        RpcConnection existing = pool.get(endpoint);
        if (existing != null && existing.isOpen()) {
            return existing;
        }
        CompletableFuture<RpcConnection> mine = new CompletableFuture<>();
        CompletableFuture<RpcConnection> inFlight = connecting.putIfAbsent(endpoint, mine);
        if (inFlight != null) {
            return joinConnect(inFlight, endpoint);
        }
        try {
            existing = pool.get(endpoint);
            RpcConnection opened = existing != null && existing.isOpen() ? existing : connectWithRetry(endpoint);
            mine.complete(opened);
            return opened;
        } catch (RuntimeException e) {
            mine.completeExceptionally(e);
            throw e;
        } finally {
            connecting.remove(endpoint, mine);
        }
    }

    private RpcConnection connectWithRetry(Endpoint endpoint) {
        Backoff backoff = options.connectBackoff();
        IOException last = null;
        for (int attempt = 1; attempt <= backoff.maxAttempts(); attempt++) {
            if (attempt > 1) {
                Backoff.sleep(backoff.delayBefore(attempt - 1));
            }
            try {
                RpcConnection opened = RpcConnection.open(
                        endpoint, options.connectTimeout(), options.sslContext(), codec, this::evict);
                if (closed) {
                    opened.close();
                    throw new IllegalStateException("rpc client is closed");
                }
                pool.put(endpoint, opened);
                return opened;
            } catch (SSLException e) {
                throw new RpcConnectionException("tls handshake with " + endpoint + " failed: " + e.getMessage(), e);
            } catch (IOException e) {
                last = e;
                logger.debug("connect attempt {}/{} to {} failed: {}", attempt, backoff.maxAttempts(), endpoint, e.getMessage());
            }
        }
        throw new RpcConnectionException(
                "cannot connect to " + endpoint + " after " + backoff.maxAttempts() + " attempt(s): "
                        + (last == null ? "unknown error" : last.getMessage()),
                last);
    }

    private static RpcConnection joinConnect(CompletableFuture<RpcConnection> inFlight, Endpoint endpoint) {
        try {
            return inFlight.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw new RpcConnectionException("cannot connect to " + endpoint, e.getCause());
        }
    }

    private void evict(RpcConnection connection) {
        pool.remove(connection.endpoint(), connection);
    }

    @Override
    public void close() {
        closed = true;
        for (RpcConnection connection : new ArrayList<>(pool.values())) {
            connection.close();
        }
        pool.clear();
    }

    public record Options(
            Duration connectTimeout,
            Duration callTimeout,
            Backoff connectBackoff,
            SSLContext sslContext,
            int maxFrameBytes
    ) {
        public Options {
            Objects.requireNonNull(connectTimeout, "connectTimeout");
            Objects.requireNonNull(callTimeout, "callTimeout");
            Objects.requireNonNull(connectBackoff, "connectBackoff");
            if (maxFrameBytes <= 0) {
                throw new IllegalArgumentException("maxFrameBytes must be > 0");
            }
        }

        public static Options defaults() {
            return new Options(
                    Duration.ofSeconds(3),
                    Duration.ofSeconds(10),
                    new Backoff(3, 100L, 2_000L),
                    null,
                    FrameCodec.DEFAULT_MAX_FRAME_BYTES
            );
        }

        public Options withCallTimeout(Duration timeout) {
            return new Options(connectTimeout, timeout, connectBackoff, sslContext, maxFrameBytes);
        }

        public Options withConnectBackoff(Backoff backoff) {
            return new Options(connectTimeout, callTimeout, backoff, sslContext, maxFrameBytes);
        }

        public Options withTls(SSLContext context) {
            return new Options(connectTimeout, callTimeout, connectBackoff, context, maxFrameBytes);
        }
    }
}
