package io.enforcerlink.monitor;

@FunctionalInterface
public interface MetadataExtractor {
    UnitRuntime extract(EventInfo event);
}
