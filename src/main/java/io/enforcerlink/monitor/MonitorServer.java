package io.enforcerlink.monitor;

import io.enforcerlink.observability.AuditLogger;
import io.enforcerlink.rpc.RpcEndpoint;
import io.enforcerlink.rpc.RpcRequest;
import io.enforcerlink.rpc.RpcResponse;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * The RPC surface of the monitor. Live callers and the startup resync both
 * funnel through {@link #handleEvent(EventInfo)}.
 */
public final class MonitorServer implements RpcEndpoint {
    public static final String HANDLE_EVENT = "Server.HandleEvent";

    private final EventDispatcher dispatcher;
    private final AuditLogger auditLogger;

    public MonitorServer(EventDispatcher dispatcher, AuditLogger auditLogger) {
        this.dispatcher = Objects.requireNonNull(dispatcher, "dispatcher");
        this.auditLogger = auditLogger;
    }

    public void handleEvent(EventInfo event) throws Exception {
        dispatcher.dispatch(event);
    }

    @Override
    public RpcResponse handle(String method, RpcRequest request) {
        if (!HANDLE_EVENT.equals(method)) {
            return RpcResponse.failed("rpc: can't find method " + method);
        }
        EventInfo event;
        try {
            event = EventInfo.decode(request.payload());
        } catch (IOException e) {
            audit("monitor.event", "rpc", "invalid_payload", Map.of("error", String.valueOf(e.getMessage())));
            return RpcResponse.failed("invalid event payload: " + e.getMessage());
        }
        try {
            handleEvent(event);
        } catch (Exception e) {
            String message = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
            audit("monitor.event", resourceOf(event), "rejected", details(event, message));
            return RpcResponse.failed(message);
        }
        audit("monitor.event", resourceOf(event), "ok", details(event, null));
        return RpcResponse.ok();
    }

    private void audit(String action, String resource, String result, Map<String, Object> details) {
        if (auditLogger != null) {
            auditLogger.log(AuditLogger.AuditEvent.of(action, resource, result, details));
        }
    }

    private static String resourceOf(EventInfo event) {
        return "unit/" + (event.unitId() == null ? "" : event.unitId());
    }

    private static Map<String, Object> details(EventInfo event, String error) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("event_type", event.eventType() == null ? "" : event.eventType());
        out.put("unit_type", String.valueOf(event.unitType()));
        if (error != null) {
            out.put("error", error);
        }
        return out;
    }
}
