package io.enforcerlink.monitor;

import java.util.Optional;

public enum EventType {
    CREATE("create"),
    START("start"),
    STOP("stop"),
    DESTROY("destroy"),
    PAUSE("pause"),
    UNPAUSE("unpause");

    private final String wire;

    EventType(String wire) {
        this.wire = wire;
    }

    public String wire() {
        return wire;
    }

    public static Optional<EventType> fromWire(String raw) {
        if (raw == null || raw.isBlank()) {
            return Optional.empty();
        }
        String value = raw.trim();
        for (EventType type : values()) {
            if (type.wire.equalsIgnoreCase(value) || type.name().equalsIgnoreCase(value)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
