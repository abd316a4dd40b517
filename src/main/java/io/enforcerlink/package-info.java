/**
 * EnforcerLink source tree root.
 *
 * <p>Primary entry points while reading code:
 *
 * <ul>
 *   <li>{@code io.enforcerlink.Main} bootstraps the CLI process.</li>
 *   <li>{@code io.enforcerlink.rpc.SecureTransport} holds per-context sessions to remote enforcers.</li>
 *   <li>{@code io.enforcerlink.monitor.LifecycleMonitor} serves lifecycle events and resyncs on start.</li>
 *   <li>{@code io.enforcerlink.monitor.EventDispatcher} routes each event to the processor for its unit type.</li>
 * </ul>
 */
package io.enforcerlink;
