package io.enforcerlink.rpc;

import java.io.Closeable;
import java.io.EOFException;
import java.io.IOException;
import java.net.StandardProtocolFamily;
import java.net.UnixDomainSocketAddress;
import java.nio.channels.SocketChannel;
import java.nio.file.Path;
import java.util.concurrent.atomic.AtomicLong;

/**
 * One blocking connection to a unix-socket RPC endpoint. Calls on the same
 * client are serialized; each call writes one frame and waits for its reply.
 */
public final class RpcClient implements Closeable {
    private final String socketPath;
    private final SocketChannel channel;
    private final FrameCodec codec;
    private final AtomicLong nextId;

    private RpcClient(String socketPath, SocketChannel channel, FrameCodec codec) {
        this.socketPath = socketPath;
        this.channel = channel;
        this.codec = codec;
        this.nextId = new AtomicLong(0L);
    }

    public static RpcClient dial(String socketPath, FrameCodec codec) throws IOException {
        if (socketPath == null || socketPath.isBlank()) {
            throw new IllegalArgumentException("socket path is required");
        }
        SocketChannel channel = SocketChannel.open(StandardProtocolFamily.UNIX);
        try {
            channel.connect(UnixDomainSocketAddress.of(Path.of(socketPath)));
        } catch (IOException e) {
            channel.close();
            throw e;
        }
        return new RpcClient(socketPath, channel, codec);
    }

    public synchronized RpcResponse call(String method, RpcRequest request) throws IOException {
        if (method == null || method.isBlank()) {
            throw new IllegalArgumentException("rpc method is required");
        }
        long id = nextId.incrementAndGet();
        codec.writeCall(channel, new FrameCodec.CallFrame(id, method, request.payload(), request.hashAuth()));
        FrameCodec.ReplyFrame reply = codec.readReply(channel);
        if (reply == null) {
            throw new EOFException("connection closed by " + socketPath);
        }
        if (reply.id() != id) {
            throw new IOException("reply id mismatch: expected " + id + " got " + reply.id());
        }
        return new RpcResponse(reply.payload(), reply.error());
    }

    public boolean isOpen() {
        return channel.isOpen();
    }

    @Override
    public void close() throws IOException {
        channel.close();
    }
}
