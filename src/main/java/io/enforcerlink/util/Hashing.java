package io.enforcerlink.util;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.util.HexFormat;

public final class Hashing {
    private static final String HMAC_SHA256 = "HmacSHA256";

    private Hashing() {
    }

    public static String sha256Hex(String value) {
        return HexFormat.of().formatHex(sha256(value == null ? new byte[0] : value.getBytes(StandardCharsets.UTF_8)));
    }

    public static byte[] sha256(byte[] value) {
        try {
            return MessageDigest.getInstance("SHA-256").digest(value);
        } catch (GeneralSecurityException e) {
            throw new RuntimeException("SHA-256 not available", e);
        }
    }

    // SecretKeySpec refuses an empty key, so callers must reject blank secrets first.
    public static byte[] hmacSha256(String secret, byte[] message) {
        if (secret == null || secret.isEmpty()) {
            throw new IllegalArgumentException("hmac secret cannot be empty");
        }
        try {
            Mac mac = Mac.getInstance(HMAC_SHA256);
            mac.init(new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), HMAC_SHA256));
            return mac.doFinal(message == null ? new byte[0] : message);
        } catch (GeneralSecurityException e) {
            throw new RuntimeException("Failed to compute HMAC", e);
        }
    }

    public static String hmacSha256Hex(String secret, String message) {
        byte[] body = message == null ? new byte[0] : message.getBytes(StandardCharsets.UTF_8);
        return HexFormat.of().formatHex(hmacSha256(secret, body));
    }
}
