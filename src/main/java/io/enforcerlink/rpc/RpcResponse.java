package io.enforcerlink.rpc;

public record RpcResponse(byte[] payload, String error) {
    public RpcResponse {
        payload = payload == null ? new byte[0] : payload;
    }

    public static RpcResponse ok(byte[] payload) {
        return new RpcResponse(payload, null);
    }

    public static RpcResponse ok() {
        return new RpcResponse(new byte[0], null);
    }

    public static RpcResponse failed(String error) {
        return new RpcResponse(new byte[0], error == null || error.isBlank() ? "unknown error" : error);
    }

    public boolean isError() {
        return error != null;
    }
}
