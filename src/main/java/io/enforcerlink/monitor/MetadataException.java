package io.enforcerlink.monitor;

public final class MetadataException extends EventValidationException {
    public MetadataException(String message) {
        super(message);
    }
}
