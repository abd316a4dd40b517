package io.enforcerlink.monitor;

/**
 * Metadata extraction for process-originated events: name, unit id and a
 * positive numeric pid are mandatory.
 */
public final class DefaultMetadataExtractor implements MetadataExtractor {

    @Override
    public UnitRuntime extract(EventInfo event) {
        if (event == null) {
            throw new MetadataException("event is required");
        }
        if (isBlank(event.name())) {
            throw new MetadataException("event name cannot be empty");
        }
        if (isBlank(event.processId())) {
            throw new MetadataException("event pid cannot be empty");
        }
        if (isBlank(event.unitId())) {
            throw new MetadataException("event unit id cannot be empty");
        }
        int pid;
        try {
            pid = Integer.parseInt(event.processId().trim());
        } catch (NumberFormatException e) {
            throw new MetadataException("event pid is not a number: " + event.processId());
        }
        if (pid <= 0) {
            throw new MetadataException("event pid must be positive: " + pid);
        }
        return new UnitRuntime(pid, event.name().trim(), event.tags(), event.ipAddresses());
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
