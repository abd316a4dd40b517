/**
 * Lifecycle monitor package.
 *
 * <p>{@link io.enforcerlink.monitor.LifecycleMonitor} receives unit lifecycle
 * events over RPC, routes them through the
 * {@link io.enforcerlink.monitor.EventDispatcher} and rebuilds its view of
 * running units from a {@link io.enforcerlink.monitor.ContextStore} on start.
 */
package io.enforcerlink.monitor;
