package io.enforcerlink.cli;

import io.enforcerlink.monitor.EventType;
import io.enforcerlink.monitor.UnitHandler;
import io.enforcerlink.monitor.UnitRuntime;
import io.enforcerlink.observability.AuditLogger;
import io.enforcerlink.util.Jsons;

import java.util.LinkedHashMap;
import java.util.Map;

// Stand-in policy side for the standalone monitor: records what it is told.
final class AuditingUnitHandler implements UnitHandler {
    private final AuditLogger auditLogger;

    AuditingUnitHandler(AuditLogger auditLogger) {
        this.auditLogger = auditLogger;
    }

    @Override
    public void createUnitRuntime(String unitId, UnitRuntime runtime) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("pid", runtime.pid());
        details.put("name", runtime.name());
        details.put("tags", runtime.tags());
        details.put("ips", runtime.ipAddresses());
        auditLogger.log(AuditLogger.AuditEvent.of("unit.runtime", "unit/" + unitId, "created", details));
        emit(unitId, "runtime", details);
    }

    @Override
    public void handleUnitEvent(String unitId, EventType event) {
        auditLogger.log(AuditLogger.AuditEvent.of("unit.event", "unit/" + unitId, event.wire(), Map.of()));
        emit(unitId, event.wire(), Map.of());
    }

    private static void emit(String unitId, String kind, Map<String, Object> details) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("unit", unitId);
        out.put("event", kind);
        if (!details.isEmpty()) {
            out.put("details", details);
        }
        System.out.println(Jsons.toJson(out));
    }
}
