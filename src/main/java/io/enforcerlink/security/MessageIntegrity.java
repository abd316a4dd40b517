package io.enforcerlink.security;

import io.enforcerlink.util.Hashing;

import java.security.MessageDigest;

/**
 * Keyed digest over RPC payloads.
 *
 * <p>The tag is HMAC-SHA256 of the raw payload bytes keyed with the UTF-8
 * bytes of the session secret. Comparison is constant time.
 */
public final class MessageIntegrity {
    public static final int TAG_BYTES = 32;

    private MessageIntegrity() {
    }

    public static byte[] tag(byte[] payload, String secret) {
        if (secret == null || secret.isEmpty()) {
            throw new IllegalArgumentException("shared secret is required to sign a payload");
        }
        return Hashing.hmacSha256(secret, payload == null ? new byte[0] : payload);
    }

    public static boolean verify(byte[] payload, byte[] tag, String secret) {
        if (tag == null || tag.length != TAG_BYTES || secret == null || secret.isEmpty()) {
            return false;
        }
        byte[] expected = Hashing.hmacSha256(secret, payload == null ? new byte[0] : payload);
        return MessageDigest.isEqual(expected, tag);
    }
}
