package io.enforcerlink.config;

import io.enforcerlink.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

/**
 * Tunables shared by the transport and the monitor.
 *
 * <p>Values come from {@code enforcerlink-settings.json} when present, then the
 * {@code REMOTE_RPCRETRIES} environment override is applied once. Nothing here
 * reads process state after construction.
 */
public record LinkSettings(
        int maxDialAttempts,
        long dialBackoffMs,
        int maxFrameBytes,
        long resyncWalkTimeoutMs,
        String monitorSharedSecret
) {
    public LinkSettings {
        monitorSharedSecret = monitorSharedSecret == null ? "" : monitorSharedSecret.trim();
    }

    public static LinkSettings defaults() {
        return new LinkSettings(
                EnforcerLinkConfig.DEFAULT_MAX_DIAL_ATTEMPTS,
                EnforcerLinkConfig.DEFAULT_DIAL_BACKOFF_MS,
                EnforcerLinkConfig.DEFAULT_MAX_FRAME_BYTES,
                EnforcerLinkConfig.DEFAULT_RESYNC_WALK_TIMEOUT_MS,
                ""
        );
    }

    public static LinkSettings load(Path settingsFile) {
        LinkSettings defaults = defaults();
        if (settingsFile == null || !Files.exists(settingsFile)) {
            return defaults;
        }
        try {
            SettingsFile file = Jsons.mapper().readValue(settingsFile.toFile(), SettingsFile.class);
            return fromFile(file, defaults);
        } catch (IOException e) {
            throw new RuntimeException("Failed to load settings: " + settingsFile, e);
        }
    }

    public static LinkSettings fromSystem(EnforcerLinkConfig config) {
        return load(config.settingsFile()).withEnvironment(System.getenv());
    }

    // An unset, unparsable or non-positive override keeps the current value.
    public LinkSettings withEnvironment(Map<String, String> env) {
        if (env == null) {
            return this;
        }
        String raw = env.get(EnforcerLinkConfig.RETRY_ENV);
        if (raw == null || raw.isBlank()) {
            return this;
        }
        int attempts;
        try {
            attempts = Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            return this;
        }
        if (attempts < 1) {
            return this;
        }
        return withMaxDialAttempts(attempts);
    }

    public LinkSettings withMaxDialAttempts(int attempts) {
        return new LinkSettings(Math.max(1, attempts), dialBackoffMs, maxFrameBytes, resyncWalkTimeoutMs, monitorSharedSecret);
    }

    public LinkSettings withMonitorSharedSecret(String secret) {
        return new LinkSettings(maxDialAttempts, dialBackoffMs, maxFrameBytes, resyncWalkTimeoutMs, secret);
    }

    public LinkSettings withResyncWalkTimeoutMs(long timeoutMs) {
        return new LinkSettings(maxDialAttempts, dialBackoffMs, maxFrameBytes, Math.max(1L, timeoutMs), monitorSharedSecret);
    }

    static LinkSettings fromFile(SettingsFile file, LinkSettings defaults) {
        if (file == null) {
            return defaults;
        }
        return new LinkSettings(
                sanitizeInt(file.maxDialAttempts(), defaults.maxDialAttempts(), 1),
                sanitizeLong(file.dialBackoffMs(), defaults.dialBackoffMs(), 0L),
                sanitizeInt(file.maxFrameBytes(), defaults.maxFrameBytes(), 1_024),
                sanitizeLong(file.resyncWalkTimeoutMs(), defaults.resyncWalkTimeoutMs(), 1L),
                file.monitorSharedSecret() == null ? defaults.monitorSharedSecret() : file.monitorSharedSecret()
        );
    }

    private static int sanitizeInt(Integer raw, int fallback, int min) {
        if (raw == null) {
            return fallback;
        }
        return Math.max(min, raw);
    }

    private static long sanitizeLong(Long raw, long fallback, long min) {
        if (raw == null) {
            return fallback;
        }
        return Math.max(min, raw);
    }

    @Override
    public String toString() {
        return "LinkSettings[maxDialAttempts=" + maxDialAttempts
                + ", dialBackoffMs=" + dialBackoffMs
                + ", maxFrameBytes=" + maxFrameBytes
                + ", resyncWalkTimeoutMs=" + resyncWalkTimeoutMs
                + ", monitorSharedSecret=" + (monitorSharedSecret.isEmpty() ? "" : "***") + "]";
    }

    record SettingsFile(
            Integer maxDialAttempts,
            Long dialBackoffMs,
            Integer maxFrameBytes,
            Long resyncWalkTimeoutMs,
            String monitorSharedSecret
    ) {
    }
}
