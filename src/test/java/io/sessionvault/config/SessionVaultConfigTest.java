package io.sessionvault.config;

import io.sessionvault.TestFixtures;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

final class SessionVaultConfigTest {

    @Test
    void layoutKeepsSessionFilesNextToStorageDir() throws Exception {
        Path root = Files.createTempDirectory("sessionvault-config-");
        try {
            SessionVaultConfig config = SessionVaultConfig.fromStorageDir(root.resolve("store").toString());

            Assertions.assertEquals(root.resolve("store").toAbsolutePath().normalize(), config.storageDir());
            Assertions.assertEquals(config.storageDir().resolve("tasks"), config.tasksDir());
            Assertions.assertEquals(config.sessionsDir().resolve("session-abc.json"), config.sessionFile("abc"));
            Assertions.assertEquals(config.sessionsDir().resolve("checkpoints").resolve("checkpoint-cp.json"),
                    config.checkpointFile("cp"));
            Assertions.assertEquals(SessionVaultConfig.Settings.defaults(), config.settings());
        } finally {
            TestFixtures.deleteRecursively(root);
        }
    }

    @Test
    void settingsFileOverridesDefaultsAndClampsValues() throws Exception {
        Path root = Files.createTempDirectory("sessionvault-config-settings-");
        try {
            Files.writeString(root.resolve(SessionVaultConfig.SETTINGS_FILE_NAME), """
                    {
                      "conflictResolution": "merge",
                      "maxCheckpoints": 0,
                      "heartbeatIntervalMs": 5000,
                      "auditEnabled": false
                    }
                    """, StandardCharsets.UTF_8);

            SessionVaultConfig.Settings settings =
                    SessionVaultConfig.fromStorageDir(root.resolve("store").toString()).settings();

            Assertions.assertEquals("merge", settings.conflictResolution());
            Assertions.assertEquals(1, settings.maxCheckpoints());
            Assertions.assertEquals(5_000L, settings.heartbeatIntervalMs());
            Assertions.assertFalse(settings.auditEnabled());
            Assertions.assertEquals(SessionVaultConfig.DEFAULT_WRITE_BUFFER_CAPACITY, settings.writeBufferCapacity());
        } finally {
            TestFixtures.deleteRecursively(root);
        }
    }

    @Test
    void invalidSettingsFileIsRejected() throws Exception {
        Path root = Files.createTempDirectory("sessionvault-config-bad-");
        try {
            Path file = root.resolve("custom.json");
            Files.writeString(file, "{\"maxCheckpoints\": \"many\"}", StandardCharsets.UTF_8);

            Assertions.assertThrows(IllegalArgumentException.class,
                    () -> SessionVaultConfig.fromStorageDir(root.resolve("store").toString(), file));
        } finally {
            TestFixtures.deleteRecursively(root);
        }
    }
}
