package io.enforcerlink.monitor;

public final class UnknownEventTypeException extends EventValidationException {
    public UnknownEventTypeException(String eventType) {
        super("unknown event type: '" + (eventType == null ? "" : eventType) + "'");
    }
}
