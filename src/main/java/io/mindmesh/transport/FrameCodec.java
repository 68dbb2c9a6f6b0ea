package io.mindmesh.transport;

import io.mindmesh.error.ProtocolException;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.Optional;

/**
 * Length-prefixed framing: {@code length:uint32 big-endian || payload}.
 *
 * <p>The codec only sees byte streams, so it works the same over plain sockets and TLS sockets.
 * Reads loop until the header and payload are complete; TCP may deliver either in pieces.
 */
public final class FrameCodec {
    public static final int HEADER_BYTES = 4;
    public static final int DEFAULT_MAX_FRAME_BYTES = 16 * 1024 * 1024;

    private final int maxFrameBytes;

    public FrameCodec(int maxFrameBytes) {
        if (maxFrameBytes <= 0) {
            throw new IllegalArgumentException("maxFrameBytes must be > 0");
        }
        this.maxFrameBytes = maxFrameBytes;
    }

    public static FrameCodec withDefaults() {
        return new FrameCodec(DEFAULT_MAX_FRAME_BYTES);
    }

    public int maxFrameBytes() {
        return maxFrameBytes;
    }

    public void writeFrame(OutputStream out, byte[] payload) throws IOException {
        byte[] body = payload == null ? new byte[0] : payload;
        if (body.length > maxFrameBytes) {
            throw new ProtocolException("outgoing frame of " + body.length + " bytes exceeds limit " + maxFrameBytes);
        }
        byte[] header = new byte[HEADER_BYTES];
        int length = body.length;
        header[0] = (byte) (length >>> 24);
        header[1] = (byte) (length >>> 16);
        header[2] = (byte) (length >>> 8);
        header[3] = (byte) length;
        out.write(header);
        out.write(body);
        out.flush();
    }

    /**
     * Blocks until one full frame has been read.
     *
     * @return the payload, or empty when the peer closed the stream cleanly between frames
     * @throws ProtocolException when the declared length is over the limit or the stream ends mid-frame
     */
    public Optional<byte[]> readFrame(InputStream in) throws IOException {
        byte[] header = new byte[HEADER_BYTES];
        int got = readFully(in, header);
        if (got == 0) {
            return Optional.empty();
        }
        if (got < HEADER_BYTES) {
            throw new ProtocolException("stream closed inside frame header after " + got + " bytes");
        }
        long length = ((header[0] & 0xFFL) << 24)
                | ((header[1] & 0xFFL) << 16)
                | ((header[2] & 0xFFL) << 8)
                | (header[3] & 0xFFL);
        if (length > maxFrameBytes) {
            throw new ProtocolException("declared frame length " + length + " exceeds limit " + maxFrameBytes);
        }
        byte[] payload = new byte[(int) length];
        int read = readFully(in, payload);
        if (read < payload.length) {
            throw new ProtocolException("stream closed inside frame payload: " + read + "/" + length + " bytes");
        }
        return Optional.of(payload);
    }

    private static int readFully(InputStream in, byte[] target) throws IOException {
        int offset = 0;
        while (offset < target.length) {
            int n = in.read(target, offset, target.length - offset);
            if (n < 0) {
                break;
            }
            offset += n;
        }
        return offset;
    }
}
