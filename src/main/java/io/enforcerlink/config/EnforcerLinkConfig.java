package io.enforcerlink.config;

import java.nio.file.Path;
import java.nio.file.Paths;

public final class EnforcerLinkConfig {
    public static final String DEFAULT_ROOT = "data";
    public static final String SETTINGS_FILE = "enforcerlink-settings.json";
    public static final String RETRY_ENV = "REMOTE_RPCRETRIES";
    public static final int DEFAULT_MAX_DIAL_ATTEMPTS = 1000;
    public static final long DEFAULT_DIAL_BACKOFF_MS = 5L;
    public static final int DEFAULT_MAX_FRAME_BYTES = 16 * 1024 * 1024;
    public static final long DEFAULT_RESYNC_WALK_TIMEOUT_MS = 5_000L;

    private final Path rootDir;

    public EnforcerLinkConfig(Path rootDir) {
        this.rootDir = rootDir;
    }

    public static EnforcerLinkConfig fromRoot(String root) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get(DEFAULT_ROOT)
                : Paths.get(root);
        return new EnforcerLinkConfig(resolved.toAbsolutePath().normalize());
    }

    public Path rootDir() {
        return rootDir;
    }

    public Path settingsFile() {
        return rootDir.resolve(SETTINGS_FILE);
    }

    public Path auditRoot() {
        return rootDir.resolve("audit");
    }

    public Path auditFile() {
        return auditRoot().resolve("audit.log");
    }
}
