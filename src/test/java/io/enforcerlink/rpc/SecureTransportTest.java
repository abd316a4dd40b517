package io.enforcerlink.rpc;

import io.enforcerlink.config.LinkSettings;
import io.enforcerlink.security.IntegrityException;
import io.enforcerlink.security.MessageIntegrity;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

final class SecureTransportTest {
    private static final String SECRET = "context-secret";

    private Path dir;

    @BeforeEach
    void setUp() throws IOException {
        dir = Files.createTempDirectory("el-tx-");
    }

    @AfterEach
    void tearDown() throws IOException {
        deleteRecursively(dir);
    }

    @Test
    void dialRetriesUpToBudgetAndSurfacesLastError() {
        AtomicInteger attempts = new AtomicInteger();
        SecureTransport transport = new SecureTransport(settings(3), null, path -> {
            throw new IOException("dial failed #" + attempts.incrementAndGet());
        });

        IOException error = Assertions.assertThrows(IOException.class,
                () -> transport.connect("ctx-1", dir.resolve("missing.sock").toString(), SECRET));

        Assertions.assertEquals(3, attempts.get());
        Assertions.assertEquals("dial failed #3", error.getMessage());
        Assertions.assertTrue(transport.listContexts().isEmpty());
    }

    @Test
    void dialFailureWithoutRetriesAgainstMissingSocket() {
        SecureTransport transport = new SecureTransport(settings(1));

        Assertions.assertThrows(IOException.class,
                () -> transport.connect("ctx-1", dir.resolve("missing.sock").toString(), SECRET));
        Assertions.assertThrows(UnknownContextException.class, () -> transport.session("ctx-1"));
    }

    @Test
    void transientDialFailuresAreRetried() throws Exception {
        Path socket = dir.resolve("s.sock");
        RpcServer server = serve(socket, (method, request) -> RpcResponse.ok());
        AtomicInteger attempts = new AtomicInteger();
        FrameCodec codec = new FrameCodec(64 * 1_024);
        SecureTransport transport = new SecureTransport(settings(5), null, path -> {
            if (attempts.incrementAndGet() < 3) {
                throw new IOException("not yet");
            }
            return RpcClient.dial(path, codec);
        });
        try {
            transport.connect("ctx-1", socket.toString(), SECRET);

            Assertions.assertEquals(3, attempts.get());
            Assertions.assertEquals(List.of("ctx-1"), transport.listContexts());
        } finally {
            transport.close();
            server.close();
        }
    }

    @Test
    void connectValidatesInputsAndRefusesLiveContext() throws Exception {
        Path socket = dir.resolve("s.sock");
        RpcServer server = serve(socket, (method, request) -> RpcResponse.ok());
        SecureTransport transport = new SecureTransport(settings(1));
        try {
            Assertions.assertThrows(IllegalArgumentException.class, () -> transport.connect("", socket.toString(), SECRET));
            Assertions.assertThrows(IllegalArgumentException.class, () -> transport.connect("ctx-1", " ", SECRET));
            Assertions.assertThrows(IllegalArgumentException.class, () -> transport.connect("ctx-1", socket.toString(), ""));

            transport.connect("ctx-1", socket.toString(), SECRET);
            Assertions.assertThrows(IllegalStateException.class,
                    () -> transport.connect("ctx-1", socket.toString(), SECRET));
            Assertions.assertEquals(List.of("ctx-1"), transport.listContexts());
        } finally {
            transport.close();
            server.close();
        }
    }

    @Test
    void callToUnknownContextFails() {
        SecureTransport transport = new SecureTransport(settings(1));

        Assertions.assertThrows(UnknownContextException.class,
                () -> transport.call("nobody", "Policy.Push", RpcRequest.of(new byte[0])));
    }

    @Test
    void callSignsPayloadWithSessionSecret() throws Exception {
        Path socket = dir.resolve("s.sock");
        AtomicBoolean verified = new AtomicBoolean(false);
        RpcServer server = serve(socket, (method, request) -> {
            verified.set(SecureTransport.verify(request, SECRET));
            return RpcResponse.ok(request.payload());
        });
        SecureTransport transport = new SecureTransport(settings(1));
        try {
            transport.connect("ctx-1", socket.toString(), SECRET);
            byte[] payload = "{\"rules\":[]}".getBytes(StandardCharsets.UTF_8);

            RpcResponse response = transport.call("ctx-1", "Policy.Push", RpcRequest.of(payload));

            Assertions.assertTrue(verified.get());
            Assertions.assertArrayEquals(payload, response.payload());
        } finally {
            transport.close();
            server.close();
        }
    }

    @Test
    void authenticatedServerRejectsSessionWithWrongSecret() throws Exception {
        Path socket = dir.resolve("s.sock");
        AtomicInteger delegateCalls = new AtomicInteger();
        RpcServer server = serve(socket, SecureTransport.authenticated(SECRET, (method, request) -> {
            delegateCalls.incrementAndGet();
            return RpcResponse.ok();
        }));
        SecureTransport transport = new SecureTransport(settings(1));
        try {
            transport.connect("good", socket.toString(), SECRET);
            transport.connect("bad", socket.toString(), "not-the-secret");

            RpcResponse accepted = transport.call("good", "Policy.Push", RpcRequest.of(new byte[0]));
            RpcResponse rejected = transport.call("bad", "Policy.Push", RpcRequest.of(new byte[0]));

            Assertions.assertFalse(accepted.isError());
            Assertions.assertTrue(rejected.isError());
            Assertions.assertTrue(rejected.error().contains("integrity check failed"));
            Assertions.assertEquals(1, delegateCalls.get());
        } finally {
            transport.close();
            server.close();
        }
    }

    @Test
    void authenticatedEndpointThrowsBeforeDelegateRuns() throws Exception {
        AtomicInteger delegateCalls = new AtomicInteger();
        RpcEndpoint endpoint = SecureTransport.authenticated(SECRET, (method, request) -> {
            delegateCalls.incrementAndGet();
            return RpcResponse.ok();
        });
        byte[] payload = "event".getBytes(StandardCharsets.UTF_8);

        Assertions.assertThrows(IntegrityException.class, () -> endpoint.handle("M", RpcRequest.of(payload)));
        Assertions.assertEquals(0, delegateCalls.get());

        endpoint.handle("M", RpcRequest.of(payload).withHashAuth(MessageIntegrity.tag(payload, SECRET)));
        Assertions.assertEquals(1, delegateCalls.get());
    }

    @Test
    void destroyClosesSessionRemovesSocketAndIsIdempotent() throws Exception {
        Path socket = dir.resolve("s.sock");
        RpcServer server = serve(socket, (method, request) -> RpcResponse.ok());
        SecureTransport transport = new SecureTransport(settings(1));
        try {
            transport.connect("ctx-1", socket.toString(), SECRET);
            RpcClient client = transport.session("ctx-1").client();

            transport.destroy("ctx-1");
            transport.destroy("ctx-1");

            Assertions.assertFalse(client.isOpen());
            Assertions.assertFalse(Files.exists(socket));
            Assertions.assertTrue(transport.listContexts().isEmpty());
            Assertions.assertThrows(UnknownContextException.class,
                    () -> transport.call("ctx-1", "Policy.Push", RpcRequest.of(new byte[0])));
        } finally {
            transport.close();
            server.close();
        }
    }

    @Test
    void serveBlocksUntilInterruptedThenCleansUp() throws Exception {
        Path socket = dir.resolve("s.sock");
        SecureTransport transport = new SecureTransport(settings(200));
        Thread serving = new Thread(() -> {
            try {
                transport.serve(RpcServer.UNIX, socket.toString(), (method, request) -> RpcResponse.ok(request.payload()));
            } catch (IOException ignored) {
            }
        }, "transport-serve-test");
        serving.setDaemon(true);
        serving.start();

        SecureTransport caller = new SecureTransport(settings(200));
        try {
            caller.connect("ctx-1", socket.toString(), SECRET);
            RpcResponse response = caller.call("ctx-1", "Echo.Say", RpcRequest.of("ping".getBytes(StandardCharsets.UTF_8)));
            Assertions.assertEquals("ping", new String(response.payload(), StandardCharsets.UTF_8));
            Assertions.assertTrue(serving.isAlive());
        } finally {
            caller.session("ctx-1").client().close();
        }

        Assertions.assertTrue(Files.exists(socket));
        serving.interrupt();
        serving.join(2_000L);

        Assertions.assertFalse(serving.isAlive());
        Assertions.assertFalse(Files.exists(socket));
    }

    private static LinkSettings settings(int attempts) {
        return LinkSettings.defaults().withMaxDialAttempts(attempts);
    }

    private static RpcServer serve(Path socket, RpcEndpoint endpoint) throws IOException {
        RpcServer server = RpcServer.bind(RpcServer.UNIX, socket.toString(), endpoint, new FrameCodec(64 * 1_024));
        Thread thread = new Thread(() -> {
            try {
                server.serve();
            } catch (IOException ignored) {
            }
        }, "transport-test-server");
        thread.setDaemon(true);
        thread.start();
        return server;
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
