package io.enforcerlink.monitor;

import io.enforcerlink.config.LinkSettings;
import io.enforcerlink.observability.AuditLogger;
import io.enforcerlink.rpc.FrameCodec;
import io.enforcerlink.rpc.RpcEndpoint;
import io.enforcerlink.rpc.RpcServer;
import io.enforcerlink.rpc.SecureTransport;

import java.io.Closeable;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Owns the monitor socket, the processor table and the context store.
 *
 * <p>{@link #start()} binds the socket, replays the context store through the
 * same path as live events and only then starts accepting. Connections that
 * arrive during resync wait in the listen backlog, so a live event can never
 * race a replayed record for the same unit.
 *
 * <p>A stored record replays as {@code create} so the unit is re-established,
 * whatever transition it last recorded. Only a recorded {@code start} is kept,
 * since it registers the unit too. The other fields replay unchanged.
 *
 * <p>{@code start()} is accepted once, from {@link State#CREATED}; any later
 * call fails. {@code stop()} outside {@link State#STARTED} does nothing, and a
 * stopped monitor cannot be restarted.
 */
public final class LifecycleMonitor implements Closeable {
    private static final long SERVE_JOIN_MS = 2_000L;

    private final String rpcAddress;
    private final UnitHandler unitHandler;
    private final ContextStore contextStore;
    private final LinkSettings settings;
    private final AuditLogger auditLogger;
    private final EventDispatcher dispatcher;
    private final MonitorServer monitorServer;
    private final AtomicReference<State> state;
    private final Object lifecycleLock;
    private RpcServer rpcServer;
    private Thread serveThread;
    private volatile ResyncOutcome lastResync;

    public LifecycleMonitor(String rpcAddress, UnitHandler unitHandler) {
        this(rpcAddress, unitHandler, ContextStore.empty(), LinkSettings.defaults(), null);
    }

    public LifecycleMonitor(
            String rpcAddress,
            UnitHandler unitHandler,
            ContextStore contextStore,
            LinkSettings settings,
            AuditLogger auditLogger
    ) {
        if (rpcAddress == null || rpcAddress.isBlank()) {
            throw new IllegalArgumentException("rpc address is required");
        }
        if (unitHandler == null) {
            throw new IllegalArgumentException("unit handler is required");
        }
        if (contextStore == null) {
            throw new IllegalArgumentException("context store is required");
        }
        this.rpcAddress = rpcAddress;
        this.unitHandler = unitHandler;
        this.contextStore = contextStore;
        this.settings = settings == null ? LinkSettings.defaults() : settings;
        this.auditLogger = auditLogger;
        this.dispatcher = new EventDispatcher();
        this.monitorServer = new MonitorServer(dispatcher, auditLogger);
        this.state = new AtomicReference<>(State.CREATED);
        this.lifecycleLock = new Object();
        this.lastResync = ResyncOutcome.none();
    }

    public void registerProcessor(UnitType unitType, EventProcessor processor) {
        dispatcher.register(unitType, processor);
    }

    public ResyncOutcome start() throws IOException {
        synchronized (lifecycleLock) {
            State current = state.get();
            if (current != State.CREATED) {
                throw new IllegalStateException("monitor cannot start from state " + current);
            }
            RpcServer server = RpcServer.bind(
                    RpcServer.UNIX,
                    rpcAddress,
                    endpoint(),
                    new FrameCodec(settings.maxFrameBytes())
            );
            ResyncOutcome outcome;
            try {
                outcome = resync();
            } catch (RuntimeException e) {
                server.close();
                throw e;
            }
            Thread thread = new Thread(() -> serveLoop(server), "enforcerlink-monitor-serve");
            thread.setDaemon(true);
            rpcServer = server;
            serveThread = thread;
            lastResync = outcome;
            state.set(State.STARTED);
            thread.start();
            audit("monitor.start", rpcAddress, "ok", outcome.toDetails());
            return outcome;
        }
    }

    public void stop() throws IOException {
        synchronized (lifecycleLock) {
            if (state.get() != State.STARTED) {
                return;
            }
            state.set(State.STOPPED);
            try {
                rpcServer.close();
            } finally {
                awaitServeThread();
                audit("monitor.stop", rpcAddress, "ok", Map.of());
            }
        }
    }

    @Override
    public void close() throws IOException {
        stop();
    }

    public void handleEvent(EventInfo event) throws Exception {
        monitorServer.handleEvent(event);
    }

    ResyncOutcome resync() {
        BlockingQueue<String> walker;
        try {
            walker = contextStore.walkStore();
        } catch (IOException e) {
            audit("monitor.resync", "store", "walk_failed", Map.of("error", String.valueOf(e.getMessage())));
            return ResyncOutcome.none();
        }
        if (walker == null) {
            return ResyncOutcome.none();
        }
        int discovered = 0;
        int replayed = 0;
        int reconciled = 0;
        int skipped = 0;
        while (true) {
            String fragment;
            try {
                fragment = walker.poll(settings.resyncWalkTimeoutMs(), TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                audit("monitor.resync", "store", "interrupted", Map.of());
                break;
            }
            if (fragment == null) {
                audit("monitor.resync", "store", "walk_timeout", Map.of("timeout_ms", settings.resyncWalkTimeoutMs()));
                break;
            }
            if (ContextStore.END_OF_WALK.equals(fragment)) {
                break;
            }
            discovered++;
            String path = fragment.startsWith("/") ? fragment : "/" + fragment;
            byte[] raw;
            try {
                raw = contextStore.getContextInfo(path);
            } catch (IOException e) {
                skipped++;
                audit("monitor.resync.skip", path, "unreadable", Map.of("error", String.valueOf(e.getMessage())));
                continue;
            }
            EventInfo event;
            try {
                event = EventInfo.decode(raw);
            } catch (IOException e) {
                skipped++;
                audit("monitor.resync.skip", path, "invalid_record", Map.of("error", String.valueOf(e.getMessage())));
                continue;
            }
            try {
                monitorServer.handleEvent(asReplay(event));
                replayed++;
            } catch (UnitAlreadyTrackedException e) {
                reconciled++;
            } catch (Exception e) {
                skipped++;
                audit("monitor.resync.skip", path, "rejected", Map.of(
                        "error", e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage()
                ));
            }
        }
        ResyncOutcome outcome = new ResyncOutcome(discovered, replayed, reconciled, skipped);
        audit("monitor.resync", rpcAddress, "done", outcome.toDetails());
        return outcome;
    }

    public String rpcAddress() {
        return rpcAddress;
    }

    public State state() {
        return state.get();
    }

    public ResyncOutcome lastResync() {
        return lastResync;
    }

    public UnitHandler unitHandler() {
        return unitHandler;
    }

    private RpcEndpoint endpoint() {
        String secret = settings.monitorSharedSecret();
        return secret.isEmpty() ? monitorServer : SecureTransport.authenticated(secret, monitorServer);
    }

    private void serveLoop(RpcServer server) {
        try {
            server.serve();
        } catch (IOException e) {
            audit("monitor.serve", rpcAddress, "failed", Map.of("error", String.valueOf(e.getMessage())));
        }
    }

    private void awaitServeThread() {
        Thread thread = serveThread;
        if (thread == null) {
            return;
        }
        try {
            thread.join(SERVE_JOIN_MS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    static EventInfo asReplay(EventInfo stored) {
        if (EventType.fromWire(stored.eventType()).orElse(null) == EventType.START) {
            return stored;
        }
        return stored.withEventType(EventType.CREATE.wire());
    }

    private void audit(String action, String resource, String result, Map<String, Object> details) {
        if (auditLogger != null) {
            auditLogger.log(AuditLogger.AuditEvent.of(action, resource, result, details));
        }
    }

    public enum State {
        CREATED,
        STARTED,
        STOPPED
    }

    public record ResyncOutcome(int discovered, int replayed, int reconciled, int skipped) {
        static ResyncOutcome none() {
            return new ResyncOutcome(0, 0, 0, 0);
        }

        Map<String, Object> toDetails() {
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("discovered", discovered);
            out.put("replayed", replayed);
            out.put("reconciled", reconciled);
            out.put("skipped", skipped);
            return out;
        }
    }
}
