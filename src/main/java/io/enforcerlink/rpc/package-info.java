/**
 * Authenticated RPC over unix-domain sockets.
 *
 * <p>{@link io.enforcerlink.rpc.SecureTransport} keeps one
 * {@link io.enforcerlink.rpc.Session} per enforced context and signs every
 * outbound payload; {@link io.enforcerlink.rpc.RpcServer} is the serving side
 * used by the lifecycle monitor and by remote enforcers.
 */
package io.enforcerlink.rpc;
