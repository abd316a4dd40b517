package io.enforcerlink.rpc;

import java.io.Closeable;
import java.io.IOException;
import java.net.BindException;
import java.net.StandardProtocolFamily;
import java.net.UnixDomainSocketAddress;
import java.nio.channels.ClosedChannelException;
import java.nio.channels.ServerSocketChannel;
import java.nio.channels.SocketChannel;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Unix-socket RPC listener.
 *
 * <p>{@link #bind} claims the socket path, {@link #serve} blocks in the accept
 * loop and hands every connection to its own pooled thread. {@link #close}
 * (from any thread) or interrupting the serving thread ends the loop. Stopping
 * shuts the read side of every connection, so a call whose frame was already
 * read still gets its reply and the connection closes right after. A frame not
 * yet read when stopping begins is never handed to the endpoint.
 */
public final class RpcServer implements Closeable {
    public static final String UNIX = "unix";

    private final Path socketPath;
    private final RpcEndpoint endpoint;
    private final FrameCodec codec;
    private final ServerSocketChannel listener;
    private final ExecutorService connectionPool;
    private final Set<Connection> connections;
    private final AtomicBoolean stopping;
    private final AtomicLong acceptedTotal;
    private final AtomicLong connectionErrorTotal;

    private RpcServer(Path socketPath, RpcEndpoint endpoint, FrameCodec codec, ServerSocketChannel listener) {
        this.socketPath = socketPath;
        this.endpoint = endpoint;
        this.codec = codec;
        this.listener = listener;
        AtomicInteger threadSeq = new AtomicInteger(0);
        this.connectionPool = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "enforcerlink-rpc-conn-" + threadSeq.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        this.connections = ConcurrentHashMap.newKeySet();
        this.stopping = new AtomicBoolean(false);
        this.acceptedTotal = new AtomicLong(0L);
        this.connectionErrorTotal = new AtomicLong(0L);
    }

    public static RpcServer bind(String protocol, String path, RpcEndpoint endpoint, FrameCodec codec) throws IOException {
        if (!UNIX.equals(protocol)) {
            throw new IllegalArgumentException("unsupported rpc protocol: " + protocol);
        }
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("socket path is required");
        }
        Objects.requireNonNull(endpoint, "endpoint");
        Objects.requireNonNull(codec, "codec");
        Path socket = Path.of(path);
        clearStaleSocket(socket);
        ServerSocketChannel listener = ServerSocketChannel.open(StandardProtocolFamily.UNIX);
        try {
            listener.bind(UnixDomainSocketAddress.of(socket));
        } catch (IOException e) {
            listener.close();
            throw e;
        }
        return new RpcServer(socket, endpoint, codec, listener);
    }

    // A leftover file with nobody accepting on it is removed; a live listener is not stolen.
    static void clearStaleSocket(Path socket) throws IOException {
        if (!Files.exists(socket, LinkOption.NOFOLLOW_LINKS)) {
            return;
        }
        boolean live;
        try (SocketChannel probe = SocketChannel.open(StandardProtocolFamily.UNIX)) {
            probe.connect(UnixDomainSocketAddress.of(socket));
            live = true;
        } catch (IOException e) {
            live = false;
        }
        if (live) {
            throw new BindException("socket already in use: " + socket);
        }
        Files.deleteIfExists(socket);
    }

    public void serve() throws IOException {
        try {
            while (!stopping.get()) {
                SocketChannel channel;
                try {
                    channel = listener.accept();
                } catch (ClosedChannelException e) {
                    // close() or an interrupt of this thread.
                    break;
                }
                acceptedTotal.incrementAndGet();
                Connection connection = new Connection(channel);
                connections.add(connection);
                try {
                    connectionPool.execute(connection);
                } catch (RejectedExecutionException e) {
                    connections.remove(connection);
                    connection.closeChannel();
                }
            }
        } finally {
            close();
        }
    }

    @Override
    public void close() throws IOException {
        if (!stopping.compareAndSet(false, true)) {
            return;
        }
        IOException failure = null;
        try {
            listener.close();
        } catch (IOException e) {
            failure = e;
        }
        for (Connection connection : connections) {
            connection.stopReading();
        }
        connectionPool.shutdown();
        try {
            Files.deleteIfExists(socketPath);
        } catch (IOException e) {
            if (failure == null) {
                failure = e;
            } else {
                failure.addSuppressed(e);
            }
        }
        if (failure != null) {
            throw failure;
        }
    }

    public boolean isStopped() {
        return stopping.get();
    }

    public long acceptedTotal() {
        return acceptedTotal.get();
    }

    public long connectionErrorTotal() {
        return connectionErrorTotal.get();
    }

    private RpcResponse invoke(FrameCodec.CallFrame call) {
        try {
            RpcResponse response = endpoint.handle(call.method(), new RpcRequest(call.payload(), call.hashAuth()));
            return response == null ? RpcResponse.ok() : response;
        } catch (Exception e) {
            return RpcResponse.failed(e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
        }
    }

    private final class Connection implements Runnable {
        private final SocketChannel channel;

        private Connection(SocketChannel channel) {
            this.channel = channel;
        }

        @Override
        public void run() {
            try {
                while (!stopping.get()) {
                    FrameCodec.CallFrame call = codec.readCall(channel);
                    if (call == null) {
                        break;
                    }
                    RpcResponse response = invoke(call);
                    codec.writeReply(channel, new FrameCodec.ReplyFrame(call.id(), response.payload(), response.error()));
                }
            } catch (IOException e) {
                // Peer reset, malformed frame, or stopReading() cut a frame short.
                if (!stopping.get()) {
                    connectionErrorTotal.incrementAndGet();
                }
            } finally {
                connections.remove(this);
                closeChannel();
            }
        }

        // The write side stays open for a reply to a frame already read.
        private synchronized void stopReading() {
            if (!channel.isOpen()) {
                return;
            }
            try {
                channel.shutdownInput();
            } catch (IOException e) {
                connectionErrorTotal.incrementAndGet();
            }
        }

        private synchronized void closeChannel() {
            try {
                channel.close();
            } catch (IOException e) {
                connectionErrorTotal.incrementAndGet();
            }
        }
    }
}
