package io.enforcerlink.monitor;

/**
 * The monitor answered a {@code HandleEvent} call with an error.
 */
public final class RemoteEventException extends RuntimeException {
    private final String remoteError;

    public RemoteEventException(String remoteError) {
        super("monitor rejected event: " + remoteError);
        this.remoteError = remoteError;
    }

    public String remoteError() {
        return remoteError;
    }
}
