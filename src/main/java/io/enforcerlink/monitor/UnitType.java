package io.enforcerlink.monitor;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kind of enforced unit. Serialized as its numeric code; names are accepted
 * on input as well.
 */
public enum UnitType {
    CONTAINER(0),
    LINUX_PROCESS(1);

    private final int code;

    UnitType(int code) {
        this.code = code;
    }

    @JsonValue
    public int code() {
        return code;
    }

    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static UnitType fromJson(Object raw) {
        if (raw instanceof Number) {
            return fromCode(((Number) raw).intValue());
        }
        if (raw instanceof String && !((String) raw).isBlank()) {
            String value = ((String) raw).trim();
            for (UnitType type : values()) {
                if (type.name().equalsIgnoreCase(value)) {
                    return type;
                }
            }
            try {
                return fromCode(Integer.parseInt(value));
            } catch (NumberFormatException ignored) {
                // Fall through to the unknown-type error below.
            }
        }
        throw new IllegalArgumentException("Unknown unit type: " + raw);
    }

    public static UnitType fromCode(int code) {
        for (UnitType type : values()) {
            if (type.code == code) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown unit type code: " + code);
    }
}
