package io.enforcerlink.monitor;

public final class NoProcessorException extends EventValidationException {
    public NoProcessorException(UnitType unitType) {
        super("no processor registered for unit type: " + unitType);
    }
}
