package io.enforcerlink.rpc;

import io.enforcerlink.config.LinkSettings;
import io.enforcerlink.observability.AuditLogger;
import io.enforcerlink.security.IntegrityException;
import io.enforcerlink.security.MessageIntegrity;

import java.io.Closeable;
import java.io.IOException;
import java.io.InterruptedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Controller-side view of every remote enforcer session.
 *
 * <p>{@link #connect} dials with a fixed backoff until the configured attempt
 * budget runs out. {@link #call} signs the payload with the session secret and
 * makes exactly one attempt; retries only happen at dial time.
 */
public final class SecureTransport implements Closeable {
    private final LinkSettings settings;
    private final FrameCodec codec;
    private final ClientRegistry registry;
    private final Dialer dialer;
    private final AuditLogger auditLogger;

    public SecureTransport(LinkSettings settings) {
        this(settings, null);
    }

    public SecureTransport(LinkSettings settings, AuditLogger auditLogger) {
        this(settings, auditLogger, null);
    }

    SecureTransport(LinkSettings settings, AuditLogger auditLogger, Dialer dialer) {
        this.settings = Objects.requireNonNull(settings, "settings");
        FrameCodec frameCodec = new FrameCodec(settings.maxFrameBytes());
        this.codec = frameCodec;
        this.registry = new ClientRegistry();
        this.dialer = dialer == null ? path -> RpcClient.dial(path, frameCodec) : dialer;
        this.auditLogger = auditLogger;
    }

    public void connect(String contextId, String socketPath, String sharedSecret) throws IOException {
        requireText(contextId, "context id");
        requireText(socketPath, "socket path");
        requireText(sharedSecret, "shared secret");
        if (registry.contains(contextId)) {
            throw new IllegalStateException("session already exists for context: " + contextId);
        }
        Dialed dialed = dialWithRetry(socketPath);
        try {
            registry.add(new Session(contextId, socketPath, sharedSecret, dialed.client()));
        } catch (IllegalStateException e) {
            // Lost a race with a concurrent connect for the same context.
            dialed.client().close();
            throw e;
        }
        audit("transport.connect", contextId, "ok", Map.of(
                "socket", socketPath,
                "attempts", dialed.attempts()
        ));
    }

    public Session session(String contextId) {
        return registry.get(contextId);
    }

    public RpcResponse call(String contextId, String methodName, RpcRequest request) throws IOException {
        Objects.requireNonNull(request, "request");
        Session session = registry.get(contextId);
        RpcRequest signed = request.withHashAuth(MessageIntegrity.tag(request.payload(), session.sharedSecret()));
        return session.client().call(methodName, signed);
    }

    public static boolean verify(RpcRequest request, String secret) {
        if (request == null) {
            return false;
        }
        return MessageIntegrity.verify(request.payload(), request.hashAuth(), secret);
    }

    // Requests that fail verification never reach the delegate.
    public static RpcEndpoint authenticated(String secret, RpcEndpoint delegate) {
        requireText(secret, "shared secret");
        Objects.requireNonNull(delegate, "delegate");
        return (method, request) -> {
            if (!verify(request, secret)) {
                throw new IntegrityException("integrity check failed for " + method);
            }
            return delegate.handle(method, request);
        };
    }

    public RpcServer bind(String protocol, String path, RpcEndpoint endpoint) throws IOException {
        return RpcServer.bind(protocol, path, endpoint, codec);
    }

    // Blocks until the calling thread is interrupted.
    public void serve(String protocol, String path, RpcEndpoint endpoint) throws IOException {
        try (RpcServer server = bind(protocol, path, endpoint)) {
            audit("transport.serve", path, "listening", Map.of("protocol", protocol));
            server.serve();
        }
        audit("transport.serve", path, "stopped", Map.of("protocol", protocol));
    }

    public void destroy(String contextId) throws IOException {
        Optional<Session> removed = registry.remove(contextId);
        if (removed.isEmpty()) {
            return;
        }
        Session session = removed.get();
        try {
            session.client().close();
        } finally {
            Files.deleteIfExists(Path.of(session.socketPath()));
        }
        audit("transport.destroy", contextId, "ok", Map.of("socket", session.socketPath()));
    }

    public List<String> listContexts() {
        return registry.contextIds();
    }

    @Override
    public void close() throws IOException {
        IOException failure = null;
        for (Session session : registry.removeAll()) {
            try {
                session.client().close();
                Files.deleteIfExists(Path.of(session.socketPath()));
            } catch (IOException e) {
                if (failure == null) {
                    failure = e;
                } else {
                    failure.addSuppressed(e);
                }
            }
        }
        if (failure != null) {
            throw failure;
        }
    }

    private Dialed dialWithRetry(String socketPath) throws IOException {
        int maxAttempts = Math.max(1, settings.maxDialAttempts());
        IOException last = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return new Dialed(dialer.dial(socketPath), attempt);
            } catch (IOException e) {
                last = e;
            }
            if (attempt < maxAttempts) {
                sleepBackoff();
            }
        }
        audit("transport.connect", socketPath, "failed", Map.of(
                "attempts", maxAttempts,
                "error", String.valueOf(last.getMessage())
        ));
        throw last;
    }

    private void sleepBackoff() throws InterruptedIOException {
        try {
            Thread.sleep(settings.dialBackoffMs());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            InterruptedIOException interrupted = new InterruptedIOException("dial interrupted");
            interrupted.initCause(e);
            throw interrupted;
        }
    }

    private void audit(String action, String resource, String result, Map<String, Object> details) {
        if (auditLogger != null) {
            auditLogger.log(AuditLogger.AuditEvent.of(action, resource, result, details));
        }
    }

    private static void requireText(String value, String name) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(name + " is required");
        }
    }

    @FunctionalInterface
    interface Dialer {
        RpcClient dial(String socketPath) throws IOException;
    }

    private record Dialed(RpcClient client, int attempts) {
    }
}
