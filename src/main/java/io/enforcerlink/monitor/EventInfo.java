package io.enforcerlink.monitor;

import com.fasterxml.jackson.annotation.JsonProperty;
import io.enforcerlink.util.Jsons;

import java.io.IOException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One lifecycle transition of one enforced unit, as sent by remote callers
 * and as persisted in the context store.
 */
public record EventInfo(
        @JsonProperty("EventType") String eventType,
        @JsonProperty("PUType") UnitType unitType,
        @JsonProperty("PUID") String unitId,
        @JsonProperty("Name") String name,
        @JsonProperty("Tags") Map<String, String> tags,
        @JsonProperty("PID") String processId,
        @JsonProperty("IPs") Map<String, String> ipAddresses
) {
    public EventInfo {
        tags = tags == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(tags));
        ipAddresses = ipAddresses == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(ipAddresses));
    }

    public static EventInfo of(EventType eventType, UnitType unitType, String unitId, String name, String processId) {
        return new EventInfo(eventType == null ? null : eventType.wire(), unitType, unitId, name, Map.of(), processId, Map.of());
    }

    public static EventInfo decode(byte[] raw) throws IOException {
        if (raw == null || raw.length == 0) {
            throw new IOException("empty event record");
        }
        EventInfo event = Jsons.compact().readValue(raw, EventInfo.class);
        if (event == null) {
            throw new IOException("event record is null");
        }
        return event;
    }

    public byte[] encode() {
        return Jsons.toCompactBytes(this);
    }

    public EventInfo withEventType(String type) {
        return new EventInfo(type, unitType, unitId, name, tags, processId, ipAddresses);
    }
}
