package io.sessionvault.migration;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.sessionvault.TestFixtures;
import io.sessionvault.integrity.DataIntegrityManager;
import io.sessionvault.model.Checkpoint;
import io.sessionvault.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;

final class SchemaMigrationManagerTest {
    private final TestFixtures.MutableClock clock = new TestFixtures.MutableClock(TestFixtures.T0);
    private final DataIntegrityManager integrity = new DataIntegrityManager(clock);
    private final SchemaMigrationManager manager = new SchemaMigrationManager(integrity, clock);

    @Test
    void comparesVersionsNumerically() {
        Assertions.assertTrue(SchemaMigrationManager.compareVersions("1.10.0", "1.9.0") > 0);
        Assertions.assertEquals(0, SchemaMigrationManager.compareVersions("2.0.0", "2.0.0"));
        Assertions.assertTrue(SchemaMigrationManager.compareVersions("1.0.0", "1.1.0") < 0);
        Assertions.assertThrows(IllegalArgumentException.class, () -> SchemaMigrationManager.compareVersions("1.x", "1.0.0"));
    }

    @Test
    void plansUpgradeAndDowngradePaths() {
        Assertions.assertEquals(
                List.of(TaskStructureMigration.ID, StorageFormatMigration.ID),
                manager.planMigrationPath("1.0.0", "1.2.0"));
        Assertions.assertEquals(List.of(TaskStructureMigration.ID),
                manager.planMigrationPath(DataKind.TASK, "1.0.0", "1.2.0"));
        Assertions.assertEquals(List.of(TaskStructureMigration.ID),
                manager.planMigrationPath(DataKind.TASK, "1.1.0", "1.0.0"));
        Assertions.assertTrue(manager.planMigrationPath(DataKind.CHECKPOINT, "2.0.0", "1.0.0").isEmpty());
        Assertions.assertTrue(manager.planMigrationPath("1.1.0", "1.1.0").isEmpty());
    }

    @Test
    void upgradesLegacyTaskDocument() {
        ObjectNode legacy = legacyTask();
        Assertions.assertEquals("1.0.0", manager.detectDataVersion(legacy));

        SchemaMigrationManager.MigrationOutcome outcome = manager.migrate(DataKind.TASK, "1.0.0", "1.1.0", legacy);

        Assertions.assertTrue(outcome.success());
        Assertions.assertEquals("1.1.0", outcome.reachedVersion());
        Assertions.assertEquals(List.of(TaskStructureMigration.ID), outcome.appliedMigrations());
        Assertions.assertEquals(30_000, outcome.migratedData().path("context").path("timeout").asInt());
        Assertions.assertTrue(outcome.migratedData().path("subtasks").isArray());
        Assertions.assertEquals("1.1.0", manager.detectDataVersion(outcome.migratedData()));
        Assertions.assertFalse(legacy.has("context"));
    }

    @Test
    void rollsTaskDocumentBack() {
        ObjectNode current = manager.migrate(DataKind.TASK, "1.0.0", "1.1.0", legacyTask()).migratedData();

        SchemaMigrationManager.MigrationOutcome outcome = manager.migrate(DataKind.TASK, "1.1.0", "1.0.0", current);

        Assertions.assertTrue(outcome.success());
        Assertions.assertFalse(outcome.migratedData().has("context"));
        Assertions.assertFalse(outcome.migratedData().has("parameters"));
    }

    @Test
    void stopsAtFirstFailingStep() {
        manager.register(new SchemaMigration() {
            @Override
            public String id() {
                return "task_broken_1_1_0_to_1_2_0";
            }

            @Override
            public String description() {
                return "always fails";
            }

            @Override
            public DataKind kind() {
                return DataKind.TASK;
            }

            @Override
            public String fromVersion() {
                return "1.1.0";
            }

            @Override
            public String toVersion() {
                return "1.2.0";
            }

            @Override
            public boolean reversible() {
                return false;
            }

            @Override
            public ObjectNode migrate(ObjectNode data) {
                throw new IllegalStateException("boom");
            }

            @Override
            public boolean validate(ObjectNode data) {
                return true;
            }

            @Override
            public boolean validateAfter(ObjectNode data) {
                return true;
            }
        });

        SchemaMigrationManager.MigrationOutcome outcome = manager.migrate(DataKind.TASK, "1.0.0", "1.2.0", legacyTask());

        Assertions.assertFalse(outcome.success());
        Assertions.assertEquals("1.1.0", outcome.reachedVersion());
        Assertions.assertEquals(List.of(TaskStructureMigration.ID), outcome.appliedMigrations());
        Assertions.assertTrue(outcome.error().contains("task_broken_1_1_0_to_1_2_0"));
        Assertions.assertTrue(outcome.migratedData().has("context"));

        SchemaMigrationManager.MigrationStats stats = manager.migrationStats();
        Assertions.assertEquals(2L, stats.executedSteps());
        Assertions.assertEquals(1L, stats.failedSteps());
    }

    @Test
    void upgradedCheckpointPassesIntegrityCheck() throws Exception {
        ObjectNode legacy = Jsons.mapper().createObjectNode();
        legacy.put("id", "cp-legacy");
        legacy.put("timestamp", TestFixtures.T0.toString());
        legacy.put("sessionId", "session-old");
        legacy.putObject("taskSnapshot").set("task-0001", Jsons.mapper().valueToTree(TestFixtures.task("task-0001")));
        legacy.putObject("queueSnapshot");
        Assertions.assertEquals("1.0.0", manager.detectDataVersion(legacy));

        SchemaMigrationManager.MigrationOutcome outcome =
                manager.migrate(DataKind.CHECKPOINT, "1.0.0", SchemaMigrationManager.CHECKPOINT_SCHEMA_VERSION, legacy);

        Assertions.assertTrue(outcome.success());
        Checkpoint checkpoint = Jsons.mapper().treeToValue(outcome.migratedData(), Checkpoint.class);
        Assertions.assertTrue(checkpoint.size() > 0);
        Assertions.assertTrue(integrity.validateCheckpointIntegrity(checkpoint));
        Assertions.assertTrue(manager.validateDataVersion(outcome.migratedData(), "2.0.0").compatible());
    }

    private static ObjectNode legacyTask() {
        ObjectNode legacy = Jsons.mapper().createObjectNode();
        legacy.put("id", "task-legacy");
        legacy.put("name", "Legacy");
        legacy.put("description", "Written before context existed");
        legacy.put("type", "implementation");
        legacy.put("priority", "medium");
        legacy.put("status", "pending");
        legacy.put("createdAt", TestFixtures.T0.toString());
        legacy.put("updatedAt", TestFixtures.T0.toString());
        legacy.putArray("tags");
        return legacy;
    }
}
