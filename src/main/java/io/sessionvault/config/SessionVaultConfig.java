package io.sessionvault.config;

import io.sessionvault.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Resolved engine configuration. Task and queue files live under {@link #storageDir()};
 * session, checkpoint and audit files live next to it, under {@link #sessionsDir()},
 * so that every engine pointed at the same storage directory sees the same peers.
 */
public final class SessionVaultConfig {
    public static final String DEFAULT_STORAGE_DIR = ".persistence";
    public static final String SETTINGS_FILE_NAME = "sessionvault-settings.json";
    public static final String DEFAULT_CONFLICT_RESOLUTION = "timestamp";
    public static final int DEFAULT_MAX_BACKUP_VERSIONS = 5;
    public static final long DEFAULT_HEARTBEAT_INTERVAL_MS = 30_000L;
    public static final long DEFAULT_CHECKPOINT_INTERVAL_MS = 300_000L;
    public static final long DEFAULT_WRITE_BUFFER_FLUSH_INTERVAL_MS = 10_000L;
    public static final int DEFAULT_WRITE_BUFFER_CAPACITY = 100;
    public static final int DEFAULT_PREFETCH_CAPACITY = 1_000;
    public static final long DEFAULT_PREFETCH_TTL_MS = 300_000L;
    public static final int DEFAULT_MAX_CHECKPOINTS = 10;
    public static final long DEFAULT_CHECKPOINT_EVERY_OPERATIONS = 1_000L;

    private final Path storageDir;
    private final Settings settings;

    public SessionVaultConfig(Path storageDir, Settings settings) {
        this.storageDir = storageDir.toAbsolutePath().normalize();
        this.settings = settings == null ? Settings.defaults() : settings;
    }

    public static SessionVaultConfig fromStorageDir(String storageDir) {
        Path resolved = resolveStorageDir(storageDir);
        Path parent = resolved.getParent() == null ? resolved : resolved.getParent();
        return fromStorageDir(storageDir, parent.resolve(SETTINGS_FILE_NAME));
    }

    public static SessionVaultConfig fromStorageDir(String storageDir, Path settingsFile) {
        Path resolved = resolveStorageDir(storageDir);
        Settings settings = Settings.defaults();
        if (settingsFile != null && Files.isRegularFile(settingsFile)) {
            try {
                SettingsFile file = Jsons.mapper().readValue(settingsFile.toFile(), SettingsFile.class);
                settings = Settings.fromFile(file, settings);
            } catch (IOException e) {
                throw new IllegalArgumentException("Invalid settings file: " + settingsFile, e);
            }
        }
        return new SessionVaultConfig(resolved, settings);
    }

    private static Path resolveStorageDir(String storageDir) {
        Path raw = storageDir == null || storageDir.isBlank()
                ? Paths.get(DEFAULT_STORAGE_DIR)
                : Paths.get(storageDir);
        return raw.toAbsolutePath().normalize();
    }

    public SessionVaultConfig withSettings(Settings newSettings) {
        return new SessionVaultConfig(storageDir, newSettings);
    }

    public Settings settings() {
        return settings;
    }

    public Path storageDir() {
        return storageDir;
    }

    public Path tasksDir() {
        return storageDir.resolve("tasks");
    }

    public Path queuesDir() {
        return storageDir.resolve("queues");
    }

    public Path backupsDir() {
        return storageDir.resolve("backups");
    }

    public Path sessionsDir() {
        Path parent = storageDir.getParent();
        return parent == null ? storageDir : parent;
    }

    public Path sessionFile(String sessionId) {
        return sessionsDir().resolve("session-" + sessionId + ".json");
    }

    public Path checkpointsDir() {
        return sessionsDir().resolve("checkpoints");
    }

    public Path checkpointFile(String checkpointId) {
        return checkpointsDir().resolve("checkpoint-" + checkpointId + ".json");
    }

    public Path auditDir() {
        return sessionsDir().resolve("audit");
    }

    public Path auditFile(String sessionId) {
        return auditDir().resolve("audit-" + sessionId + ".log");
    }

    public record SettingsFile(
            Boolean enableCompression,
            Integer maxBackupVersions,
            Boolean enableMetrics,
            String conflictResolution,
            Boolean realtimeSync,
            Long heartbeatIntervalMs,
            Long checkpointIntervalMs,
            Long writeBufferFlushIntervalMs,
            Integer writeBufferCapacity,
            Integer prefetchCapacity,
            Long prefetchTtlMs,
            Integer maxCheckpoints,
            Long checkpointEveryOperations,
            Boolean crashRecoveryEnabled,
            Boolean autoRepair,
            Boolean auditEnabled
    ) {
    }

    public record Settings(
            boolean enableCompression,
            int maxBackupVersions,
            boolean enableMetrics,
            String conflictResolution,
            boolean realtimeSync,
            long heartbeatIntervalMs,
            long checkpointIntervalMs,
            long writeBufferFlushIntervalMs,
            int writeBufferCapacity,
            int prefetchCapacity,
            long prefetchTtlMs,
            int maxCheckpoints,
            long checkpointEveryOperations,
            boolean crashRecoveryEnabled,
            boolean autoRepair,
            boolean auditEnabled
    ) {
        public static Settings defaults() {
            return new Settings(
                    true,
                    DEFAULT_MAX_BACKUP_VERSIONS,
                    true,
                    DEFAULT_CONFLICT_RESOLUTION,
                    false,
                    DEFAULT_HEARTBEAT_INTERVAL_MS,
                    DEFAULT_CHECKPOINT_INTERVAL_MS,
                    DEFAULT_WRITE_BUFFER_FLUSH_INTERVAL_MS,
                    DEFAULT_WRITE_BUFFER_CAPACITY,
                    DEFAULT_PREFETCH_CAPACITY,
                    DEFAULT_PREFETCH_TTL_MS,
                    DEFAULT_MAX_CHECKPOINTS,
                    DEFAULT_CHECKPOINT_EVERY_OPERATIONS,
                    true,
                    true,
                    true
            );
        }

        public static Settings fromFile(SettingsFile file, Settings defaults) {
            if (file == null) {
                return defaults;
            }
            return new Settings(
                    sanitizeBoolean(file.enableCompression(), defaults.enableCompression()),
                    sanitizeInt(file.maxBackupVersions(), defaults.maxBackupVersions(), 0),
                    sanitizeBoolean(file.enableMetrics(), defaults.enableMetrics()),
                    file.conflictResolution() == null || file.conflictResolution().isBlank()
                            ? defaults.conflictResolution()
                            : file.conflictResolution().trim(),
                    sanitizeBoolean(file.realtimeSync(), defaults.realtimeSync()),
                    sanitizeLong(file.heartbeatIntervalMs(), defaults.heartbeatIntervalMs(), 100L),
                    sanitizeLong(file.checkpointIntervalMs(), defaults.checkpointIntervalMs(), 100L),
                    sanitizeLong(file.writeBufferFlushIntervalMs(), defaults.writeBufferFlushIntervalMs(), 100L),
                    sanitizeInt(file.writeBufferCapacity(), defaults.writeBufferCapacity(), 1),
                    sanitizeInt(file.prefetchCapacity(), defaults.prefetchCapacity(), 1),
                    sanitizeLong(file.prefetchTtlMs(), defaults.prefetchTtlMs(), 1L),
                    sanitizeInt(file.maxCheckpoints(), defaults.maxCheckpoints(), 1),
                    sanitizeLong(file.checkpointEveryOperations(), defaults.checkpointEveryOperations(), 1L),
                    sanitizeBoolean(file.crashRecoveryEnabled(), defaults.crashRecoveryEnabled()),
                    sanitizeBoolean(file.autoRepair(), defaults.autoRepair()),
                    sanitizeBoolean(file.auditEnabled(), defaults.auditEnabled())
            );
        }

        public Settings withConflictResolution(String value) {
            return new Settings(enableCompression, maxBackupVersions, enableMetrics, value, realtimeSync,
                    heartbeatIntervalMs, checkpointIntervalMs, writeBufferFlushIntervalMs, writeBufferCapacity,
                    prefetchCapacity, prefetchTtlMs, maxCheckpoints, checkpointEveryOperations,
                    crashRecoveryEnabled, autoRepair, auditEnabled);
        }

        public Settings withMaxBackupVersions(int value) {
            return new Settings(enableCompression, value, enableMetrics, conflictResolution, realtimeSync,
                    heartbeatIntervalMs, checkpointIntervalMs, writeBufferFlushIntervalMs, writeBufferCapacity,
                    prefetchCapacity, prefetchTtlMs, maxCheckpoints, checkpointEveryOperations,
                    crashRecoveryEnabled, autoRepair, auditEnabled);
        }

        public Settings withMaxCheckpoints(int value) {
            return new Settings(enableCompression, maxBackupVersions, enableMetrics, conflictResolution, realtimeSync,
                    heartbeatIntervalMs, checkpointIntervalMs, writeBufferFlushIntervalMs, writeBufferCapacity,
                    prefetchCapacity, prefetchTtlMs, value, checkpointEveryOperations,
                    crashRecoveryEnabled, autoRepair, auditEnabled);
        }

        public Settings withCheckpointEveryOperations(long value) {
            return new Settings(enableCompression, maxBackupVersions, enableMetrics, conflictResolution, realtimeSync,
                    heartbeatIntervalMs, checkpointIntervalMs, writeBufferFlushIntervalMs, writeBufferCapacity,
                    prefetchCapacity, prefetchTtlMs, maxCheckpoints, value,
                    crashRecoveryEnabled, autoRepair, auditEnabled);
        }

        public Settings withCrashRecoveryEnabled(boolean value) {
            return new Settings(enableCompression, maxBackupVersions, enableMetrics, conflictResolution, realtimeSync,
                    heartbeatIntervalMs, checkpointIntervalMs, writeBufferFlushIntervalMs, writeBufferCapacity,
                    prefetchCapacity, prefetchTtlMs, maxCheckpoints, checkpointEveryOperations,
                    value, autoRepair, auditEnabled);
        }

        public Settings withAuditEnabled(boolean value) {
            return new Settings(enableCompression, maxBackupVersions, enableMetrics, conflictResolution, realtimeSync,
                    heartbeatIntervalMs, checkpointIntervalMs, writeBufferFlushIntervalMs, writeBufferCapacity,
                    prefetchCapacity, prefetchTtlMs, maxCheckpoints, checkpointEveryOperations,
                    crashRecoveryEnabled, autoRepair, value);
        }

        private static long sanitizeLong(Long value, long fallback, long min) {
            if (value == null) {
                return fallback;
            }
            return Math.max(min, value);
        }

        private static int sanitizeInt(Integer value, int fallback, int min) {
            if (value == null) {
                return fallback;
            }
            return Math.max(min, value);
        }

        private static boolean sanitizeBoolean(Boolean value, boolean fallback) {
            return value == null ? fallback : value;
        }
    }
}
