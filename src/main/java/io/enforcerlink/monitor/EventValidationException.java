package io.enforcerlink.monitor;

/**
 * An event rejected before any processor ran.
 */
public class EventValidationException extends IllegalArgumentException {
    public EventValidationException(String message) {
        super(message);
    }
}
