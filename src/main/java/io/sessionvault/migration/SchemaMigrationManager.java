package io.sessionvault.migration;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.sessionvault.integrity.DataIntegrityManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

public final class SchemaMigrationManager {
    private static final Logger log = LoggerFactory.getLogger(SchemaMigrationManager.class);

    public static final String TASK_SCHEMA_VERSION = "1.1.0";
    public static final String STORAGE_SCHEMA_VERSION = "1.2.0";
    public static final String CHECKPOINT_SCHEMA_VERSION = "2.0.0";
    public static final String BASELINE_VERSION = "1.0.0";
    static final int MAX_HISTORY_PER_MIGRATION = 100;

    private final Clock clock;
    private final Map<String, SchemaMigration> migrations = new LinkedHashMap<>();
    private final Map<String, Deque<MigrationRecord>> history = new ConcurrentHashMap<>();

    public SchemaMigrationManager(DataIntegrityManager integrity, Clock clock) {
        this.clock = clock;
        register(new TaskStructureMigration());
        register(new StorageFormatMigration());
        register(new CheckpointFormatMigration(integrity));
    }

    public synchronized void register(SchemaMigration migration) {
        SchemaVersion.parse(migration.fromVersion());
        SchemaVersion.parse(migration.toVersion());
        migrations.put(migration.id(), migration);
    }

    public synchronized List<SchemaMigration> migrations() {
        return List.copyOf(migrations.values());
    }

    public static String currentVersion(DataKind kind) {
        return switch (kind) {
            case TASK -> TASK_SCHEMA_VERSION;
            case STORAGE -> STORAGE_SCHEMA_VERSION;
            case CHECKPOINT -> CHECKPOINT_SCHEMA_VERSION;
        };
    }

    public static int compareVersions(String left, String right) {
        return SchemaVersion.compare(left, right);
    }

    public List<String> planMigrationPath(String fromVersion, String toVersion) {
        return planMigrationPath(null, fromVersion, toVersion);
    }

    /**
     * Upgrades use every migration inside {@code [from, to]} in ascending {@code fromVersion}
     * order. Downgrades use only reversible migrations inside {@code [to, from]} in
     * descending {@code toVersion} order. A null kind considers every registered migration.
     */
    public synchronized List<String> planMigrationPath(DataKind kind, String fromVersion, String toVersion) {
        SchemaVersion from = SchemaVersion.parse(fromVersion);
        SchemaVersion to = SchemaVersion.parse(toVersion);
        int direction = from.compareTo(to);
        if (direction == 0) {
            return List.of();
        }
        List<SchemaMigration> selected = new ArrayList<>();
        for (SchemaMigration migration : migrations.values()) {
            if (kind != null && migration.kind() != kind) {
                continue;
            }
            SchemaVersion mFrom = SchemaVersion.parse(migration.fromVersion());
            SchemaVersion mTo = SchemaVersion.parse(migration.toVersion());
            if (direction < 0) {
                if (mFrom.compareTo(from) >= 0 && mTo.compareTo(to) <= 0) {
                    selected.add(migration);
                }
            } else if (migration.reversible() && mTo.compareTo(from) <= 0 && mFrom.compareTo(to) >= 0) {
                selected.add(migration);
            }
        }
        if (direction < 0) {
            selected.sort(Comparator.comparing(m -> SchemaVersion.parse(m.fromVersion())));
        } else {
            selected.sort(Comparator.comparing((SchemaMigration m) -> SchemaVersion.parse(m.toVersion())).reversed());
        }
        List<String> ids = new ArrayList<>(selected.size());
        for (SchemaMigration migration : selected) {
            ids.add(migration.id());
        }
        return ids;
    }

    public MigrationOutcome migrate(String fromVersion, String toVersion, ObjectNode data) {
        return migrate(null, fromVersion, toVersion, data);
    }

    public MigrationOutcome migrate(DataKind kind, String fromVersion, String toVersion, ObjectNode data) {
        long startNs = System.nanoTime();
        boolean upgrade = compareVersions(fromVersion, toVersion) < 0;
        List<String> path = planMigrationPath(kind, fromVersion, toVersion);
        ObjectNode current = data.deepCopy();
        String reached = fromVersion;
        List<String> applied = new ArrayList<>();
        for (String migrationId : path) {
            SchemaMigration migration;
            synchronized (this) {
                migration = migrations.get(migrationId);
            }
            long stepStartNs = System.nanoTime();
            String error = null;
            ObjectNode next = null;
            try {
                next = upgrade ? runUpgrade(migration, current) : runRollback(migration, current);
            } catch (RuntimeException e) {
                error = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
            }
            long stepMs = (System.nanoTime() - stepStartNs) / 1_000_000L;
            recordHistory(new MigrationRecord(migrationId, upgrade ? "up" : "down", error == null,
                    clock.instant(), stepMs, error));
            if (error != null) {
                log.warn("Migration {} failed at {}: {}", migrationId, reached, error);
                return new MigrationOutcome(false, fromVersion, toVersion, reached, current, List.copyOf(applied),
                        "Migration " + migrationId + " failed: " + error, elapsedMs(startNs));
            }
            current = next;
            reached = upgrade ? migration.toVersion() : migration.fromVersion();
            applied.add(migrationId);
            log.debug("Applied migration {} ({} -> {})", migrationId, migration.fromVersion(), migration.toVersion());
        }
        return new MigrationOutcome(true, fromVersion, toVersion, reached, current, List.copyOf(applied), null,
                elapsedMs(startNs));
    }

    private static ObjectNode runUpgrade(SchemaMigration migration, ObjectNode current) {
        if (!migration.validate(current)) {
            throw new IllegalStateException("pre-migration validation failed");
        }
        ObjectNode next = migration.migrate(current.deepCopy());
        if (!migration.validateAfter(next)) {
            throw new IllegalStateException("post-migration validation failed");
        }
        return next;
    }

    private static ObjectNode runRollback(SchemaMigration migration, ObjectNode current) {
        if (!migration.validateAfter(current)) {
            throw new IllegalStateException("pre-rollback validation failed");
        }
        ObjectNode next = migration.rollback(current.deepCopy());
        if (!migration.validate(next)) {
            throw new IllegalStateException("post-rollback validation failed");
        }
        return next;
    }

    public String detectDataVersion(JsonNode data) {
        if (data == null || !data.isObject()) {
            return BASELINE_VERSION;
        }
        if (data.path("version").isTextual()) {
            return data.get("version").asText();
        }
        if (data.has("id") && data.has("name") && data.has("type")) {
            return data.path("context").isObject() && data.path("parameters").isObject() ? "1.1.0" : BASELINE_VERSION;
        }
        if (data.has("taskSnapshot") && data.has("queueSnapshot")) {
            return data.hasNonNull("integrityHash") && data.hasNonNull("size") ? "2.0.0" : BASELINE_VERSION;
        }
        return BASELINE_VERSION;
    }

    public VersionCheck validateDataVersion(JsonNode data, String expectedVersion) {
        String detected = detectDataVersion(data);
        int comparison = compareVersions(detected, expectedVersion);
        return new VersionCheck(detected, expectedVersion, comparison == 0, comparison < 0, comparison);
    }

    private void recordHistory(MigrationRecord record) {
        Deque<MigrationRecord> records = history.computeIfAbsent(record.migrationId(), k -> new ArrayDeque<>());
        synchronized (records) {
            records.addLast(record);
            while (records.size() > MAX_HISTORY_PER_MIGRATION) {
                records.removeFirst();
            }
        }
    }

    public List<MigrationRecord> history(String migrationId) {
        Deque<MigrationRecord> records = history.get(migrationId);
        if (records == null) {
            return List.of();
        }
        synchronized (records) {
            return List.copyOf(records);
        }
    }

    public MigrationStats migrationStats() {
        long executed = 0L;
        long successful = 0L;
        long totalMs = 0L;
        Map<String, Long> byMigration = new LinkedHashMap<>();
        for (Map.Entry<String, Deque<MigrationRecord>> entry : history.entrySet()) {
            List<MigrationRecord> records;
            synchronized (entry.getValue()) {
                records = List.copyOf(entry.getValue());
            }
            byMigration.put(entry.getKey(), (long) records.size());
            for (MigrationRecord record : records) {
                executed++;
                totalMs += record.durationMs();
                if (record.success()) {
                    successful++;
                }
            }
        }
        double averageMs = executed == 0 ? 0.0 : (double) totalMs / executed;
        return new MigrationStats(migrations().size(), executed, successful, executed - successful, averageMs, byMigration);
    }

    private static long elapsedMs(long startNs) {
        return (System.nanoTime() - startNs) / 1_000_000L;
    }

    public record MigrationOutcome(
            boolean success,
            String fromVersion,
            String toVersion,
            String reachedVersion,
            ObjectNode migratedData,
            List<String> appliedMigrations,
            String error,
            long durationMs
    ) {
    }

    public record MigrationRecord(
            String migrationId,
            String direction,
            boolean success,
            Instant timestamp,
            long durationMs,
            String error
    ) {
    }

    public record VersionCheck(
            String detectedVersion,
            String expectedVersion,
            boolean compatible,
            boolean needsMigration,
            int comparison
    ) {
    }

    public record MigrationStats(
            int registeredMigrations,
            long executedSteps,
            long successfulSteps,
            long failedSteps,
            double averageDurationMs,
            Map<String, Long> stepsByMigration
    ) {
    }
}
