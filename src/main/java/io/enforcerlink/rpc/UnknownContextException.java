package io.enforcerlink.rpc;

public final class UnknownContextException extends RuntimeException {
    private final String contextId;

    public UnknownContextException(String contextId) {
        super("no rpc session for context: " + contextId);
        this.contextId = contextId;
    }

    public String contextId() {
        return contextId;
    }
}
