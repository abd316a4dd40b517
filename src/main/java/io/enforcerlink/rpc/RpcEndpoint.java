package io.enforcerlink.rpc;

/**
 * Callable surface registered with an {@link RpcServer}. An exception thrown
 * here becomes the {@code error} of the reply; the connection stays open.
 */
@FunctionalInterface
public interface RpcEndpoint {
    RpcResponse handle(String method, RpcRequest request) throws Exception;
}
