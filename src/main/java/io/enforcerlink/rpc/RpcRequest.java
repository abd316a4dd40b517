package io.enforcerlink.rpc;

/**
 * Opaque payload plus the integrity tag computed over it.
 */
public record RpcRequest(byte[] payload, byte[] hashAuth) {
    public RpcRequest {
        payload = payload == null ? new byte[0] : payload;
    }

    public static RpcRequest of(byte[] payload) {
        return new RpcRequest(payload, null);
    }

    public RpcRequest withHashAuth(byte[] tag) {
        return new RpcRequest(payload, tag);
    }
}
