package io.enforcerlink.rpc;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.enforcerlink.util.Jsons;

import java.io.EOFException;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.ReadableByteChannel;
import java.nio.channels.WritableByteChannel;

/**
 * Length-prefixed JSON frames.
 *
 * <pre>
 * [4 bytes uint32 big-endian body_length] [body_length bytes compact JSON]
 * </pre>
 */
public final class FrameCodec {
    private static final int HEADER_BYTES = 4;

    private final int maxFrameBytes;

    public FrameCodec(int maxFrameBytes) {
        if (maxFrameBytes < 1) {
            throw new IllegalArgumentException("maxFrameBytes must be positive");
        }
        this.maxFrameBytes = maxFrameBytes;
    }

    public void writeCall(WritableByteChannel channel, CallFrame frame) throws IOException {
        writeFrame(channel, Jsons.toCompactBytes(frame));
    }

    public void writeReply(WritableByteChannel channel, ReplyFrame frame) throws IOException {
        writeFrame(channel, Jsons.toCompactBytes(frame));
    }

    // Null means the peer closed cleanly between frames.
    public CallFrame readCall(ReadableByteChannel channel) throws IOException {
        byte[] body = readFrame(channel);
        return body == null ? null : Jsons.compact().readValue(body, CallFrame.class);
    }

    public ReplyFrame readReply(ReadableByteChannel channel) throws IOException {
        byte[] body = readFrame(channel);
        return body == null ? null : Jsons.compact().readValue(body, ReplyFrame.class);
    }

    void writeFrame(WritableByteChannel channel, byte[] body) throws IOException {
        if (body.length > maxFrameBytes) {
            throw new IOException("frame too large: " + body.length + " bytes, max=" + maxFrameBytes);
        }
        ByteBuffer buffer = ByteBuffer.allocate(HEADER_BYTES + body.length);
        buffer.putInt(body.length);
        buffer.put(body);
        buffer.flip();
        while (buffer.hasRemaining()) {
            channel.write(buffer);
        }
    }

    byte[] readFrame(ReadableByteChannel channel) throws IOException {
        ByteBuffer header = ByteBuffer.allocate(HEADER_BYTES);
        if (!readFully(channel, header, true)) {
            return null;
        }
        header.flip();
        int length = header.getInt();
        if (length < 0 || length > maxFrameBytes) {
            throw new IOException("invalid frame length: " + length + ", max=" + maxFrameBytes);
        }
        ByteBuffer body = ByteBuffer.allocate(length);
        readFully(channel, body, false);
        return body.array();
    }

    private static boolean readFully(ReadableByteChannel channel, ByteBuffer buffer, boolean eofAllowedAtStart)
            throws IOException {
        while (buffer.hasRemaining()) {
            int n = channel.read(buffer);
            if (n < 0) {
                if (eofAllowedAtStart && buffer.position() == 0) {
                    return false;
                }
                throw new EOFException("connection closed mid-frame");
            }
        }
        return true;
    }

    public record CallFrame(
            long id,
            String method,
            byte[] payload,
            @JsonProperty("hash_auth") byte[] hashAuth
    ) {
    }

    public record ReplyFrame(long id, byte[] payload, String error) {
    }
}
