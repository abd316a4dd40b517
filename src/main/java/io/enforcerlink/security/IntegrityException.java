package io.enforcerlink.security;

public final class IntegrityException extends RuntimeException {
    public IntegrityException(String message) {
        super(message);
    }
}
