package io.enforcerlink.collector;

import java.util.Objects;

/**
 * One observed flow between two units, with how many times it was seen.
 */
public record FlowRecord(
        String contextId,
        String sourceId,
        String destinationId,
        String sourceIp,
        String destinationIp,
        int destinationPort,
        String action,
        long count
) {
    public FlowRecord {
        contextId = normalize(contextId);
        sourceId = normalize(sourceId);
        destinationId = normalize(destinationId);
        sourceIp = normalize(sourceIp);
        destinationIp = normalize(destinationIp);
        action = normalize(action);
        if (destinationPort < 0 || destinationPort > 65_535) {
            throw new IllegalArgumentException("destination port out of range: " + destinationPort);
        }
        if (count < 0) {
            throw new IllegalArgumentException("count cannot be negative: " + count);
        }
    }

    public FlowRecord withCount(long newCount) {
        return new FlowRecord(contextId, sourceId, destinationId, sourceIp, destinationIp, destinationPort, action, newCount);
    }

    private static String normalize(String value) {
        return Objects.requireNonNullElse(value, "").trim();
    }
}
