package io.enforcerlink.monitor;

import io.enforcerlink.config.LinkSettings;
import io.enforcerlink.rpc.FrameCodec;
import io.enforcerlink.rpc.RpcClient;
import io.enforcerlink.rpc.RpcRequest;
import io.enforcerlink.rpc.RpcResponse;
import io.enforcerlink.security.MessageIntegrity;

import java.io.Closeable;
import java.io.IOException;
import java.util.Objects;

/**
 * Caller side of {@code Server.HandleEvent}. Payloads are signed when a
 * shared secret is given.
 */
public final class MonitorClient implements Closeable {
    private final RpcClient client;
    private final String sharedSecret;

    private MonitorClient(RpcClient client, String sharedSecret) {
        this.client = client;
        this.sharedSecret = sharedSecret == null ? "" : sharedSecret.trim();
    }

    public static MonitorClient connect(String socketPath, String sharedSecret, LinkSettings settings) throws IOException {
        LinkSettings effective = settings == null ? LinkSettings.defaults() : settings;
        RpcClient client = RpcClient.dial(socketPath, new FrameCodec(effective.maxFrameBytes()));
        return new MonitorClient(client, sharedSecret);
    }

    public void sendEvent(EventInfo event) throws IOException {
        Objects.requireNonNull(event, "event");
        RpcRequest request = RpcRequest.of(event.encode());
        if (!sharedSecret.isEmpty()) {
            request = request.withHashAuth(MessageIntegrity.tag(request.payload(), sharedSecret));
        }
        RpcResponse response = client.call(MonitorServer.HANDLE_EVENT, request);
        if (response.isError()) {
            throw new RemoteEventException(response.error());
        }
    }

    @Override
    public void close() throws IOException {
        client.close();
    }
}
