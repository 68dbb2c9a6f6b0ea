package io.mindmesh.rpc;

import io.mindmesh.error.ProtocolException;
import io.mindmesh.error.RpcConnectionException;
import io.mindmesh.transport.FrameCodec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.net.ssl.SSLContext;
import javax.net.ssl.SSLSocket;
import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Consumer;

/**
 * One client socket shared by concurrent callers. Requests are written under a lock and a
 * reader thread hands each response to the caller waiting on the same request id.
 */
final class RpcConnection implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(RpcConnection.class);

    private final Endpoint endpoint;
    private final Socket socket;
    private final FrameCodec codec;
    private final OutputStream out;
    private final Object writeLock = new Object();
    private final Map<String, CompletableFuture<RpcResponse>> pending = new ConcurrentHashMap<>();
    private final Consumer<RpcConnection> onClose;
    private volatile boolean closed;

    private RpcConnection(Endpoint endpoint, Socket socket, FrameCodec codec, Consumer<RpcConnection> onClose) throws IOException {
        this.endpoint = endpoint;
        this.socket = socket;
        this.codec = codec;
        this.out = new BufferedOutputStream(socket.getOutputStream());
        this.onClose = onClose;
    }

    static RpcConnection open(
            Endpoint endpoint,
            Duration connectTimeout,
            SSLContext sslContext,
            FrameCodec codec,
            Consumer<RpcConnection> onClose
    ) throws IOException {
        Socket socket = sslContext == null ? new Socket() : sslContext.getSocketFactory().createSocket();
        try {
            socket.setTcpNoDelay(true);
            socket.connect(new InetSocketAddress(endpoint.host(), endpoint.port()), (int) connectTimeout.toMillis());
            if (socket instanceof SSLSocket ssl) {
                ssl.setSoTimeout((int) Math.max(1L, connectTimeout.toMillis()));
                ssl.startHandshake();
                ssl.setSoTimeout(0);
            }
            RpcConnection connection = new RpcConnection(endpoint, socket, codec, onClose);
            connection.startReader();
            return connection;
        } catch (IOException | RuntimeException e) {
            try {
                socket.close();
            } catch (IOException closeError) {
                e.addSuppressed(closeError);
            }
            throw e;
        }
    }

    Endpoint endpoint() {
        return endpoint;
    }

    boolean isOpen() {
        return !closed && !socket.isClosed();
    }

    CompletableFuture<RpcResponse> send(RpcRequest request) throws IOException {
        if (!isOpen()) {
            throw new IOException("connection to " + endpoint + " is closed");
        }
        CompletableFuture<RpcResponse> future = new CompletableFuture<>();
        if (pending.putIfAbsent(request.id(), future) != null) {
            throw new IllegalStateException("duplicate in-flight request id: " + request.id());
        }
        byte[] payload = RpcCodec.encodeRequest(request);
        try {
            synchronized (writeLock) {
                codec.writeFrame(out, payload);
            }
        } catch (IOException | RuntimeException e) {
            pending.remove(request.id());
            close();
            throw e;
        }
        return future;
    }

    /**
     * Forgets a request whose caller stopped waiting; a late response for it is dropped.
     */
    void abandon(String requestId) {
        pending.remove(requestId);
    }

    int inFlight() {
        return pending.size();
    }

    private void startReader() throws IOException {
        InputStream in = new BufferedInputStream(socket.getInputStream());
        Thread reader = new Thread(() -> readLoop(in), "rpc-client-" + endpoint);
        reader.setDaemon(true);
        reader.start();
    }

    private void readLoop(InputStream in) {
        String reason = "connection to " + endpoint + " closed by peer";
        try {
            while (true) {
                Optional<byte[]> frame = codec.readFrame(in);
                if (frame.isEmpty()) {
                    break;
                }
                RpcResponse response = RpcCodec.decodeResponse(frame.get());
                CompletableFuture<RpcResponse> future = pending.remove(response.id());
                if (future == null) {
                    logger.debug("dropping response for unknown or abandoned request {} from {}", response.id(), endpoint);
                    continue;
                }
                future.complete(response);
            }
        } catch (ProtocolException e) {
            reason = "protocol error from " + endpoint + ": " + e.getMessage();
            logger.warn(reason);
        } catch (IOException e) {
            if (!closed) {
                reason = "connection to " + endpoint + " lost: " + e.getMessage();
            }
        }
        failPending(reason);
        close();
    }

    private void failPending(String reason) {
        for (String id : new ArrayList<>(pending.keySet())) {
            CompletableFuture<RpcResponse> future = pending.remove(id);
            if (future != null) {
                future.completeExceptionally(new RpcConnectionException(reason));
            }
        }
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            socket.close();
        } catch (IOException e) {
            logger.debug("close of connection to {} failed: {}", endpoint, e.getMessage());
        }
        failPending("connection to " + endpoint + " closed");
        if (onClose != null) {
            onClose.accept(this);
        }
    }
}
