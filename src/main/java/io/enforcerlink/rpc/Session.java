package io.enforcerlink.rpc;

import io.enforcerlink.security.SensitiveDataMasker;

/**
 * An authenticated connection bound to one enforced context.
 */
public record Session(String contextId, String socketPath, String sharedSecret, RpcClient client) {
    @Override
    public String toString() {
        return "Session[contextId=" + contextId
                + ", socketPath=" + socketPath
                + ", sharedSecret=" + SensitiveDataMasker.maskSecret(sharedSecret) + "]";
    }
}
