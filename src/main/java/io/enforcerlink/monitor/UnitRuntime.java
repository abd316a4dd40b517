package io.enforcerlink.monitor;

import java.util.Map;

/**
 * Normalized runtime descriptor derived from an {@link EventInfo}.
 */
public record UnitRuntime(
        int pid,
        String name,
        Map<String, String> tags,
        Map<String, String> ipAddresses
) {
    public UnitRuntime {
        tags = tags == null ? Map.of() : Map.copyOf(tags);
        ipAddresses = ipAddresses == null ? Map.of() : Map.copyOf(ipAddresses);
    }
}
