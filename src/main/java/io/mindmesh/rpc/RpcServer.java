package io.mindmesh.rpc;

import com.fasterxml.jackson.databind.JsonNode;
import io.mindmesh.error.MalformedRequestException;
import io.mindmesh.error.ProtocolException;
import io.mindmesh.error.RpcRemoteException;
import io.mindmesh.transport.FrameCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.net.ssl.SSLContext;
import javax.net.ssl.SSLException;
import javax.net.ssl.SSLServerSocket;
import javax.net.ssl.SSLSocket;
import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Framed RPC server with one worker thread per accepted connection.
 *
 * <p>Each connection loops read, dispatch, write, so responses leave in the order the requests
 * arrived. Handlers come from a fixed name-to-handler map built before the server starts.
 */
public final class RpcServer implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(RpcServer.class);
    private static final int HANDSHAKE_TIMEOUT_MS = 10_000;

    public enum State {
        CREATED,
        RUNNING,
        DRAINING,
        STOPPED
    }

    private final String name;
    private final String bindHost;
    private final int requestedPort;
    private final SSLContext sslContext;
    private final boolean requireClientAuth;
    private final FrameCodec codec;
    private final Map<String, RpcHandler> handlers;
    private final RpcCallLog callLog;
    private final Duration defaultShutdownGrace;
    private final AtomicReference<State> state;
    private final Set<Connection> connections;
    private final AtomicInteger connectionSeq;

    private ServerSocket serverSocket;
    private ExecutorService workers;
    private Thread acceptThread;
    private ShutdownReport shutdownReport;

    private RpcServer(Builder builder) {
        this.name = builder.name;
        this.bindHost = builder.bindHost;
        this.requestedPort = builder.port;
        this.sslContext = builder.sslContext;
        this.requireClientAuth = builder.requireClientAuth;
        this.codec = new FrameCodec(builder.maxFrameBytes);
        this.handlers = Map.copyOf(builder.handlers);
        this.callLog = new RpcCallLog(builder.callLogCapacity);
        this.defaultShutdownGrace = builder.shutdownGrace;
        this.state = new AtomicReference<>(State.CREATED);
        this.connections = ConcurrentHashMap.newKeySet();
        this.connectionSeq = new AtomicInteger();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Binds the listening socket and starts accepting.
     *
     * @return the bound port, useful when the server was configured with port 0
     */
    public synchronized int start() throws IOException {
        if (!state.compareAndSet(State.CREATED, State.RUNNING)) {
            throw new IllegalStateException("server " + name + " already started (state=" + state.get() + ")");
        }
        ServerSocket socket;
        if (sslContext != null) {
            SSLServerSocket ssl = (SSLServerSocket) sslContext.getServerSocketFactory().createServerSocket();
            ssl.setNeedClientAuth(requireClientAuth);
            socket = ssl;
        } else {
            socket = new ServerSocket();
        }
        socket.setReuseAddress(true);
        try {
            socket.bind(new InetSocketAddress(bindHost, requestedPort));
        } catch (IOException e) {
            state.set(State.STOPPED);
            socket.close();
            throw e;
        }
        this.serverSocket = socket;
        this.workers = Executors.newCachedThreadPool(namedDaemonFactory(name + "-conn"));
        this.acceptThread = new Thread(this::acceptLoop, name + "-accept");
        this.acceptThread.setDaemon(true);
        this.acceptThread.start();
        logger.info("rpc server {} listening on {}:{} tls={} methods={}",
                name, bindHost, socket.getLocalPort(), sslContext != null, handlers.size());
        return socket.getLocalPort();
    }

    public int port() {
        ServerSocket socket = serverSocket;
        if (socket == null) {
            throw new IllegalStateException("server " + name + " is not bound");
        }
        return socket.getLocalPort();
    }

    public State state() {
        return state.get();
    }

    public boolean tlsEnabled() {
        return sslContext != null;
    }

    public Set<String> methods() {
        return handlers.keySet();
    }

    public RpcCallStats callStats() {
        return callLog.stats();
    }

    public List<RpcCallRecord> recentCalls(int limit) {
        return callLog.recent(limit);
    }

    public int openConnections() {
        return connections.size();
    }

    /**
     * Stops accepting, lets in-flight requests finish until {@code grace} runs out, then
     * force-closes whatever is left. Returns once every connection worker has exited or been
     * abandoned. Calling it again returns the first report.
     */
    public synchronized ShutdownReport shutdown(Duration grace) {
        if (shutdownReport != null) {
            return shutdownReport;
        }
        if (state.compareAndSet(State.CREATED, State.STOPPED)) {
            shutdownReport = new ShutdownReport(0, 0, 0);
            return shutdownReport;
        }
        state.set(State.DRAINING);
        closeListener();
        joinQuietly(acceptThread, 1_000L);

        List<Connection> open = new ArrayList<>(connections);
        for (Connection connection : open) {
            connection.drain();
        }
        workers.shutdown();
        boolean drained = awaitWorkers(grace);
        int forced = 0;
        if (!drained) {
            for (Connection connection : new ArrayList<>(connections)) {
                connection.forceClose();
                forced++;
            }
            workers.shutdownNow();
            awaitWorkers(Duration.ofSeconds(1));
        }
        state.set(State.STOPPED);
        shutdownReport = new ShutdownReport(open.size(), open.size() - forced, forced);
        logger.info("rpc server {} stopped: connections={} graceful={} forced={}",
                name, shutdownReport.connections(), shutdownReport.closedGracefully(), shutdownReport.forceClosed());
        return shutdownReport;
    }

    @Override
    public void close() {
        shutdown(defaultShutdownGrace);
    }

    private void acceptLoop() {
        while (state.get() == State.RUNNING) {
            Socket socket;
            try {
                socket = serverSocket.accept();
            } catch (SocketException e) {
                if (state.get() == State.RUNNING) {
                    logger.warn("rpc server {} accept failed: {}", name, e.getMessage());
                }
                return;
            } catch (IOException e) {
                logger.warn("rpc server {} accept failed: {}", name, e.getMessage());
                continue;
            }
            if (state.get() != State.RUNNING) {
                closeQuietly(socket);
                return;
            }
            Connection connection = new Connection(socket, connectionSeq.incrementAndGet());
            connections.add(connection);
            try {
                workers.execute(connection);
            } catch (RuntimeException e) {
                connections.remove(connection);
                closeQuietly(socket);
            }
        }
    }

    RpcResponse dispatch(byte[] payload) {
        RpcRequest request;
        try {
            request = RpcCodec.decodeRequest(payload);
        } catch (MalformedRequestException e) {
            if (!e.recoverable()) {
                throw new ProtocolException(e.getMessage(), e);
            }
            return RpcResponse.failure(e.requestId(), RpcErrorCodes.INVALID_REQUEST, "Invalid Request: " + e.getMessage());
        }
        long startedAtMs = System.currentTimeMillis();
        long startNs = System.nanoTime();
        RpcHandler handler = handlers.get(request.method());
        RpcResponse response;
        if (handler == null) {
            response = RpcResponse.failure(request.id(), RpcErrorCodes.METHOD_NOT_FOUND, "Method not found: " + request.method());
        } else {
            response = invoke(handler, request);
        }
        long micros = (System.nanoTime() - startNs) / 1_000L;
        callLog.record(new RpcCallRecord(
                request.id(),
                request.method(),
                startedAtMs,
                micros,
                !response.isError(),
                response.isError() ? response.error().code() : null,
                response.isError() ? response.error().message() : null
        ));
        return response;
    }

    private RpcResponse invoke(RpcHandler handler, RpcRequest request) {
        try {
            JsonNode result = handler.handle(request.params());
            return RpcResponse.success(request.id(), result);
        } catch (RpcRemoteException e) {
            return RpcResponse.failure(request.id(), e.code(), e.getMessage());
        } catch (IllegalArgumentException e) {
            return RpcResponse.failure(request.id(), RpcErrorCodes.INVALID_PARAMS, "Invalid params: " + e.getMessage());
        } catch (Exception e) {
            logger.warn("rpc server {} handler {} failed for request {}", name, request.method(), request.id(), e);
            return RpcResponse.failure(request.id(), RpcErrorCodes.INTERNAL_ERROR, "Server error: " + e.getMessage());
        }
    }

    private boolean awaitWorkers(Duration timeout) {
        try {
            return workers.awaitTermination(Math.max(0L, timeout.toMillis()), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    private void closeListener() {
        ServerSocket socket = serverSocket;
        if (socket == null) {
            return;
        }
        try {
            socket.close();
        } catch (IOException e) {
            logger.debug("rpc server {} listener close failed: {}", name, e.getMessage());
        }
    }

    private static void joinQuietly(Thread thread, long millis) {
        if (thread == null) {
            return;
        }
        try {
            thread.join(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static void closeQuietly(Socket socket) {
        try {
            socket.close();
        } catch (IOException e) {
            logger.debug("socket close failed: {}", e.getMessage());
        }
    }

    static ThreadFactory namedDaemonFactory(String prefix) {
        AtomicInteger seq = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable, prefix + "-" + seq.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    public record ShutdownReport(int connections, int closedGracefully, int forceClosed) {
    }

    private final class Connection implements Runnable {
        private final Socket socket;
        private final int seq;
        private final Object lock = new Object();
        private boolean busy;
        private boolean draining;

        private Connection(Socket socket, int seq) {
            this.socket = socket;
            this.seq = seq;
        }

        @Override
        public void run() {
            String peer = String.valueOf(socket.getRemoteSocketAddress());
            try {
                if (socket instanceof SSLSocket ssl) {
                    ssl.setSoTimeout(HANDSHAKE_TIMEOUT_MS);
                    ssl.startHandshake();
                    ssl.setSoTimeout(0);
                }
                InputStream in = new BufferedInputStream(socket.getInputStream());
                OutputStream out = new BufferedOutputStream(socket.getOutputStream());
                while (true) {
                    Optional<byte[]> frame = codec.readFrame(in);
                    if (frame.isEmpty() || !beginRequest()) {
                        break;
                    }
                    boolean proceed;
                    try {
                        RpcResponse response = dispatch(frame.get());
                        codec.writeFrame(out, RpcCodec.encodeResponse(response));
                    } finally {
                        proceed = endRequest();
                    }
                    if (!proceed) {
                        break;
                    }
                }
            } catch (ProtocolException e) {
                logger.warn("rpc server {} closing connection #{} from {}: {}", name, seq, peer, e.getMessage());
            } catch (SSLException e) {
                logger.warn("rpc server {} tls handshake with {} failed: {}", name, peer, e.getMessage());
            } catch (IOException e) {
                if (!isDraining()) {
                    logger.debug("rpc server {} connection #{} from {} ended: {}", name, seq, peer, e.getMessage());
                }
            } finally {
                connections.remove(this);
                closeQuietly(socket);
            }
        }

        private boolean beginRequest() {
            synchronized (lock) {
                if (draining) {
                    return false;
                }
                busy = true;
                return true;
            }
        }

        private boolean endRequest() {
            synchronized (lock) {
                busy = false;
                if (draining) {
                    closeQuietly(socket);
                    return false;
                }
                return true;
            }
        }

        private boolean isDraining() {
            synchronized (lock) {
                return draining;
            }
        }

        private void drain() {
            synchronized (lock) {
                draining = true;
                if (!busy) {
                    closeQuietly(socket);
                }
            }
        }

        private void forceClose() {
            logger.warn("rpc server {} force-closing connection #{} after grace period", name, seq);
            closeQuietly(socket);
        }
    }

    public static final class Builder {
        private String name = "rpc";
        private String bindHost = "127.0.0.1";
        private int port;
        private SSLContext sslContext;
        private boolean requireClientAuth;
        private int maxFrameBytes = FrameCodec.DEFAULT_MAX_FRAME_BYTES;
        private int callLogCapacity = RpcCallLog.DEFAULT_CAPACITY;
        private Duration shutdownGrace = Duration.ofSeconds(5);
        private final Map<String, RpcHandler> handlers = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder bind(String host, int port) {
            this.bindHost = host;
            this.port = port;
            return this;
        }

        public Builder tls(SSLContext sslContext, boolean requireClientAuth) {
            this.sslContext = sslContext;
            this.requireClientAuth = requireClientAuth;
            return this;
        }

        public Builder maxFrameBytes(int maxFrameBytes) {
            this.maxFrameBytes = maxFrameBytes;
            return this;
        }

        public Builder callLogCapacity(int callLogCapacity) {
            this.callLogCapacity = callLogCapacity;
            return this;
        }

        public Builder shutdownGrace(Duration shutdownGrace) {
            this.shutdownGrace = shutdownGrace;
            return this;
        }

        public Builder method(String method, RpcHandler handler) {
            if (method == null || method.isBlank()) {
                throw new IllegalArgumentException("method name cannot be empty");
            }
            if (handler == null) {
                throw new IllegalArgumentException("handler cannot be null: " + method);
            }
            if (handlers.putIfAbsent(method, handler) != null) {
                throw new IllegalArgumentException("duplicate rpc method: " + method);
            }
            return this;
        }

        public RpcServer build() {
            return new RpcServer(this);
        }
    }
}
