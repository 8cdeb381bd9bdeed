package io.sessionvault.runtime;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.sessionvault.TestFixtures;
import io.sessionvault.checkpoint.CheckpointManager;
import io.sessionvault.config.SessionVaultConfig;
import io.sessionvault.error.PersistenceException;
import io.sessionvault.error.TaskValidationException;
import io.sessionvault.event.PersistenceEvent;
import io.sessionvault.event.PersistenceEventType;
import io.sessionvault.integrity.DataIntegrityManager;
import io.sessionvault.model.Checkpoint;
import io.sessionvault.model.CheckpointType;
import io.sessionvault.model.SessionMetadata;
import io.sessionvault.model.SessionState;
import io.sessionvault.model.Task;
import io.sessionvault.model.TaskQueue;
import io.sessionvault.model.TaskStatus;
import io.sessionvault.observability.AuditLogger;
import io.sessionvault.observability.PrometheusFormatter;
import io.sessionvault.session.SessionRegistry;
import io.sessionvault.storage.TaskFilter;
import io.sessionvault.transaction.Transaction;
import io.sessionvault.transaction.TransactionCoordinator;
import io.sessionvault.util.Jsons;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

final class CrossSessionPersistenceEngineTest {
    private final TestFixtures.MutableClock clock = new TestFixtures.MutableClock(TestFixtures.T0);

    @Test
    void savedTaskIsVisibleBeforeAndAfterFlush() throws Exception {
        Path root = Files.createTempDirectory("sessionvault-engine-");
        CrossSessionPersistenceEngine engine = new CrossSessionPersistenceEngine(TestFixtures.config(root), clock);
        try {
            List<PersistenceEvent> saved = new ArrayList<>();
            engine.events().subscribe(PersistenceEventType.TASK_SAVED, saved::add);
            engine.initialize();
            Task task = TestFixtures.task("task-0001").withTags(List.of("backend"));

            CrossSessionPersistenceEngine.SaveResult result = engine.saveTask(task);

            Assertions.assertTrue(result.buffered());
            Assertions.assertFalse(result.conflictResolved());
            Assertions.assertEquals(task, engine.loadTask("task-0001").orElseThrow());
            Assertions.assertEquals(1, engine.flushWriteBuffer());
            Assertions.assertEquals(task, engine.loadTask("task-0001", false).orElseThrow());
            Assertions.assertEquals(task, engine.loadTask("task-0001").orElseThrow());
            Assertions.assertTrue(engine.loadTask("task-missing").isEmpty());

            Assertions.assertEquals(1, saved.size());
            Assertions.assertEquals("task-0001", saved.get(0).get("taskId"));
            Assertions.assertEquals(engine.sessionId(), saved.get(0).sessionId());
            Assertions.assertEquals(result.operationId(), saved.get(0).get("operationId"));
        } finally {
            engine.shutdown(true);
            TestFixtures.deleteRecursively(root);
        }
    }

    @Test
    void callerEditsDoNotReachBufferedOrCachedTasks() throws Exception {
        Path root = Files.createTempDirectory("sessionvault-engine-copies-");
        CrossSessionPersistenceEngine engine = new CrossSessionPersistenceEngine(TestFixtures.config(root), clock);
        try {
            engine.initialize();
            ObjectNode parameters = Jsons.mapper().createObjectNode().put("attempts", 1);
            Task task = TestFixtures.task("task-0001").withParameters(parameters);
            engine.saveTask(task);
            parameters.put("attempts", 99);
            task.parameters().put("injected", true);

            Task buffered = engine.loadTask("task-0001").orElseThrow();
            buffered.parameters().put("injected", true);
            Assertions.assertThrows(UnsupportedOperationException.class, () -> buffered.tags().add("leak"));
            Assertions.assertEquals("{\"attempts\":1}", engine.loadTask("task-0001").orElseThrow().parameters().toString());

            engine.flushWriteBuffer();
            Task cached = engine.loadTask("task-0001").orElseThrow();
            cached.parameters().put("injected", true);
            cached.context().put("injected", true);
            Task reloaded = engine.loadTask("task-0001").orElseThrow();
            Assertions.assertFalse(reloaded.parameters().has("injected"));
            Assertions.assertTrue(reloaded.context().isEmpty());
            Assertions.assertEquals(task, reloaded);
        } finally {
            engine.shutdown(true);
            TestFixtures.deleteRecursively(root);
        }
    }

    @Test
    void invalidTaskIsRejectedWithErrorEvent() throws Exception {
        Path root = Files.createTempDirectory("sessionvault-engine-invalid-");
        CrossSessionPersistenceEngine engine = new CrossSessionPersistenceEngine(TestFixtures.config(root), clock);
        try {
            List<PersistenceEvent> errors = new ArrayList<>();
            engine.events().subscribe(PersistenceEventType.SAVE_ERROR, errors::add);
            engine.initialize();

            Assertions.assertThrows(TaskValidationException.class, () -> engine.saveTask(TestFixtures.task("bad")));

            Assertions.assertEquals(1, errors.size());
            Assertions.assertEquals("bad", errors.get(0).get("taskId"));
            Assertions.assertEquals("TaskValidationException", errors.get(0).get("errorType"));
            Assertions.assertTrue(engine.loadTask("bad").isEmpty());
            Assertions.assertEquals(1L, engine.getSessionStatistics().currentSession().statistics().errorsEncountered());
        } finally {
            engine.shutdown(true);
            TestFixtures.deleteRecursively(root);
        }
    }

    @Test
    void staleSaveIsMergedWithNewerPeerCopy() throws Exception {
        Path root = Files.createTempDirectory("sessionvault-engine-merge-");
        SessionVaultConfig base = TestFixtures.config(root);
        CrossSessionPersistenceEngine a = new CrossSessionPersistenceEngine(
                base.withSettings(base.settings().withConflictResolution("merge")), clock);
        CrossSessionPersistenceEngine b = new CrossSessionPersistenceEngine(base, clock);
        try {
            List<PersistenceEvent> resolved = new ArrayList<>();
            a.events().subscribe(PersistenceEventType.CONFLICT_RESOLVED, resolved::add);
            a.initialize();
            b.initialize();

            Task original = TestFixtures.task("task-0001").withTags(List.of("x"));
            a.saveTask(original);
            a.flushWriteBuffer();

            clock.advance(Duration.ofMinutes(1));
            Instant t1 = clock.instant();
            CrossSessionPersistenceEngine.SaveResult peerSave = b.saveTask(
                    original.withTags(List.of("y")).withStatus(TaskStatus.IN_PROGRESS, t1));
            Assertions.assertFalse(peerSave.conflictResolved());
            b.flushWriteBuffer();

            CrossSessionPersistenceEngine.SaveResult staleSave = a.saveTask(original);

            Assertions.assertTrue(staleSave.conflictResolved());
            Assertions.assertEquals("task-task-0001", staleSave.conflictId());
            Task merged = a.loadTask("task-0001").orElseThrow();
            Assertions.assertEquals(List.of("x", "y"), merged.tags());
            Assertions.assertEquals(TaskStatus.IN_PROGRESS, merged.status());
            Assertions.assertEquals(t1, merged.updatedAt());
            Assertions.assertEquals(1, resolved.size());
            Assertions.assertEquals("merge", resolved.get(0).get("strategy"));
            Assertions.assertEquals(1L, a.getSessionStatistics().conflictStats().totalConflicts());
        } finally {
            a.shutdown(true);
            b.shutdown(true);
            TestFixtures.deleteRecursively(root);
        }
    }

    @Test
    void timestampStrategyKeepsPeerCopyOverStaleSave() throws Exception {
        Path root = Files.createTempDirectory("sessionvault-engine-lww-");
        SessionVaultConfig config = TestFixtures.config(root);
        CrossSessionPersistenceEngine a = new CrossSessionPersistenceEngine(config, clock);
        CrossSessionPersistenceEngine b = new CrossSessionPersistenceEngine(config, clock);
        try {
            a.initialize();
            b.initialize();
            Task original = TestFixtures.task("task-0001");
            clock.advance(Duration.ofSeconds(30));
            Task newer = original.withStatus(TaskStatus.COMPLETED, clock.instant())
                    .withResult(Jsons.mapper().createObjectNode().put("exitCode", 0));
            b.saveTask(newer);
            b.flushWriteBuffer();

            CrossSessionPersistenceEngine.SaveResult result = a.saveTask(original);

            Assertions.assertTrue(result.conflictResolved());
            Assertions.assertEquals(newer, result.savedTask());
            a.flushWriteBuffer();
            Assertions.assertEquals(TaskStatus.COMPLETED, b.loadTask("task-0001", false).orElseThrow().status());
        } finally {
            a.shutdown(true);
            b.shutdown(true);
            TestFixtures.deleteRecursively(root);
        }
    }

    @Test
    void gracefulShutdownLeavesOneManualCheckpoint() throws Exception {
        Path root = Files.createTempDirectory("sessionvault-engine-shutdown-");
        SessionVaultConfig config = TestFixtures.config(root);
        CrossSessionPersistenceEngine engine = new CrossSessionPersistenceEngine(config, clock);
        try {
            engine.initialize();
            Assertions.assertEquals(3, engine.activeTimerCount());
            engine.saveTask(TestFixtures.task("task-0001"));

            engine.shutdown(false);

            List<Checkpoint> checkpoints = engine.listCheckpoints();
            Assertions.assertEquals(1, checkpoints.size());
            Assertions.assertEquals(CheckpointType.MANUAL, checkpoints.get(0).type());
            Assertions.assertTrue(checkpoints.get(0).taskSnapshot().containsKey("task-0001"));
            Assertions.assertEquals(0, engine.activeTimerCount());
            Assertions.assertEquals(SessionState.TERMINATED, engine.state());

            SessionMetadata persisted = new SessionRegistry(config, clock).read(engine.sessionId()).orElseThrow();
            Assertions.assertEquals(SessionState.TERMINATED, persisted.state());
            Assertions.assertEquals(TestFixtures.T0, persisted.endTime());

            engine.shutdown(false);
            Assertions.assertEquals(1, engine.listCheckpoints().size());
            Assertions.assertThrows(PersistenceException.class, () -> engine.saveTask(TestFixtures.task("task-0002")));
        } finally {
            TestFixtures.deleteRecursively(root);
        }
    }

    @Test
    void restoreReplacesCurrentState() throws Exception {
        Path root = Files.createTempDirectory("sessionvault-engine-restore-");
        CrossSessionPersistenceEngine engine = new CrossSessionPersistenceEngine(TestFixtures.config(root), clock);
        try {
            engine.initialize();
            Task first = TestFixtures.task("task-0001");
            Task second = TestFixtures.task("task-0002").withTags(List.of("keep"));
            engine.saveTask(first);
            engine.saveTask(second);
            ObjectNode payload = Jsons.mapper().createObjectNode();
            payload.putArray("taskIds").add("task-0001").add("task-0002");
            engine.saveQueue(new TaskQueue("queue-main", payload));
            Checkpoint checkpoint = engine.createCheckpoint(CheckpointType.MANUAL);
            Assertions.assertTrue(engine.verifyCheckpoint(checkpoint.id()));

            engine.deleteTask("task-0001");
            engine.saveTask(TestFixtures.task("task-0003"));
            engine.saveTask(second.withStatus(TaskStatus.CANCELLED, TestFixtures.T0));
            engine.deleteQueue("queue-main");
            engine.flushWriteBuffer();

            CheckpointManager.RestoreSummary summary = engine.restoreFromCheckpoint(checkpoint.id());

            Assertions.assertEquals(2, summary.tasksRestored());
            Assertions.assertEquals(1, summary.queuesRestored());
            Assertions.assertEquals(first, engine.loadTask("task-0001", false).orElseThrow());
            Assertions.assertEquals(second, engine.loadTask("task-0002", false).orElseThrow());
            Assertions.assertTrue(engine.loadTask("task-0003").isEmpty());
            Assertions.assertEquals(payload, engine.loadQueue("queue-main").orElseThrow().payload());
            Assertions.assertEquals(2, engine.queryTasks(TaskFilter.all()).size());
            Assertions.assertEquals(0L, engine.getSessionStatistics().conflictStats().totalConflicts());
        } finally {
            engine.shutdown(true);
            TestFixtures.deleteRecursively(root);
        }
    }

    @Test
    void restoringUnknownCheckpointFails() throws Exception {
        Path root = Files.createTempDirectory("sessionvault-engine-restore-missing-");
        CrossSessionPersistenceEngine engine = new CrossSessionPersistenceEngine(TestFixtures.config(root), clock);
        try {
            List<PersistenceEvent> errors = new ArrayList<>();
            engine.events().subscribe(PersistenceEventType.RESTORE_ERROR, errors::add);
            engine.initialize();

            Assertions.assertThrows(PersistenceException.class, () -> engine.restoreFromCheckpoint("no-such-checkpoint"));
            Assertions.assertEquals(1, errors.size());
            Assertions.assertEquals("no-such-checkpoint", errors.get(0).get("checkpointId"));
        } finally {
            engine.shutdown(true);
            TestFixtures.deleteRecursively(root);
        }
    }

    @Test
    void crashHandlerWritesEmergencyCheckpoint() throws Exception {
        Path root = Files.createTempDirectory("sessionvault-engine-crash-");
        SessionVaultConfig config = TestFixtures.config(root);
        CrossSessionPersistenceEngine engine = new CrossSessionPersistenceEngine(config, clock);
        try {
            List<PersistenceEvent> emergency = new ArrayList<>();
            engine.events().subscribe(PersistenceEventType.EMERGENCY_CHECKPOINT, emergency::add);
            engine.initialize();
            engine.saveTask(TestFixtures.task("task-0001"));

            engine.handleCrash(new IllegalStateException("host died"));

            Assertions.assertEquals(SessionState.CRASHED, engine.state());
            Assertions.assertEquals(0, engine.activeTimerCount());
            Assertions.assertEquals(1, emergency.size());
            Checkpoint checkpoint = engine.listCheckpoints().get(0);
            Assertions.assertEquals(CheckpointType.CRASH_RECOVERY, checkpoint.type());
            Assertions.assertEquals(checkpoint.id(), emergency.get(0).get("checkpointId"));
            Assertions.assertTrue(checkpoint.taskSnapshot().containsKey("task-0001"));
            Assertions.assertEquals(SessionState.CRASHED,
                    new SessionRegistry(config, clock).read(engine.sessionId()).orElseThrow().state());
        } finally {
            TestFixtures.deleteRecursively(root);
        }
    }

    @Test
    void startupRecoversCrashedPeerFromItsCheckpoint() throws Exception {
        Path root = Files.createTempDirectory("sessionvault-engine-recovery-");
        SessionVaultConfig config = TestFixtures.config(root);
        Instant crashTime = TestFixtures.T0.minus(Duration.ofMinutes(20));
        clock.set(crashTime);
        SessionRegistry registry = new SessionRegistry(config, clock);
        registry.write(SessionMetadata.start("ghost-session", crashTime));
        CheckpointManager ghostCheckpoints = new CheckpointManager(config, new DataIntegrityManager(clock),
                new TransactionCoordinator(clock), clock);
        Task orphan = TestFixtures.task("task-orphan", crashTime);
        Checkpoint source = ghostCheckpoints.create(CheckpointType.AUTOMATIC, "ghost-session",
                Map.of(orphan.id(), orphan), Map.of(), List.of());
        clock.set(TestFixtures.T0);

        CrossSessionPersistenceEngine engine = new CrossSessionPersistenceEngine(config, clock);
        try {
            List<PersistenceEvent> completed = new ArrayList<>();
            engine.events().subscribe(PersistenceEventType.CRASH_RECOVERY_COMPLETED, completed::add);
            engine.initialize();

            Assertions.assertEquals(1, completed.size());
            Assertions.assertEquals(source.id(), completed.get(0).get("checkpointId"));
            Assertions.assertEquals(orphan, engine.loadTask("task-orphan", false).orElseThrow());
            SessionMetadata ghost = registry.read("ghost-session").orElseThrow();
            Assertions.assertEquals(SessionState.CRASHED, ghost.state());
            Assertions.assertEquals(TestFixtures.T0, ghost.endTime());
            Assertions.assertTrue(engine.listCheckpoints().stream()
                    .anyMatch(c -> c.type() == CheckpointType.CRASH_RECOVERY));
        } finally {
            engine.shutdown(true);
            TestFixtures.deleteRecursively(root);
        }
    }

    @Test
    void recoverySurvivesRetentionWhenPeerCheckpointIsOldest() throws Exception {
        Path root = Files.createTempDirectory("sessionvault-engine-recovery-retention-");
        SessionVaultConfig config = TestFixtures.config(root);
        Instant lastActive = TestFixtures.T0.minus(Duration.ofMinutes(11));
        clock.set(lastActive);
        SessionRegistry registry = new SessionRegistry(config, clock);
        registry.write(SessionMetadata.start("peer-crashed", lastActive));
        CheckpointManager peerCheckpoints = new CheckpointManager(config, new DataIntegrityManager(clock),
                new TransactionCoordinator(clock), clock);
        Task orphan = TestFixtures.task("task-orphan", lastActive);
        Checkpoint source = peerCheckpoints.create(CheckpointType.AUTOMATIC, "peer-crashed",
                Map.of(orphan.id(), orphan), Map.of(), List.of());
        for (int i = 0; i < 9; i++) {
            clock.advance(Duration.ofSeconds(1));
            peerCheckpoints.create(CheckpointType.AUTOMATIC, "bystander-" + i, Map.of(), Map.of(), List.of());
        }
        Assertions.assertEquals(config.settings().maxCheckpoints(), peerCheckpoints.list().size());
        clock.set(TestFixtures.T0);

        CrossSessionPersistenceEngine engine = new CrossSessionPersistenceEngine(config, clock);
        try {
            List<PersistenceEvent> completed = new ArrayList<>();
            List<PersistenceEvent> failed = new ArrayList<>();
            engine.events().subscribe(PersistenceEventType.CRASH_RECOVERY_COMPLETED, completed::add);
            engine.events().subscribe(PersistenceEventType.CRASH_RECOVERY_FAILED, failed::add);
            engine.initialize();

            Assertions.assertTrue(failed.isEmpty());
            Assertions.assertEquals(1, completed.size());
            Assertions.assertEquals(source.id(), completed.get(0).get("checkpointId"));
            Assertions.assertEquals(orphan, engine.loadTask("task-orphan", false).orElseThrow());
            Assertions.assertEquals(SessionState.CRASHED, registry.read("peer-crashed").orElseThrow().state());
            Assertions.assertEquals(config.settings().maxCheckpoints(), engine.listCheckpoints().size());
        } finally {
            engine.shutdown(true);
            TestFixtures.deleteRecursively(root);
        }
    }

    @Test
    void loadRepairsAndMigratesStoredDocuments() throws Exception {
        Path root = Files.createTempDirectory("sessionvault-engine-repair-");
        SessionVaultConfig config = TestFixtures.config(root);
        CrossSessionPersistenceEngine engine = new CrossSessionPersistenceEngine(config, clock);
        try {
            engine.initialize();
            ObjectNode broken = Jsons.mapper().valueToTree(TestFixtures.task("task-0001"));
            broken.remove("name");
            broken.put("subtasks", "none");
            Files.writeString(config.tasksDir().resolve("task-0001.json"), Jsons.toJson(broken), StandardCharsets.UTF_8);
            ObjectNode legacy = Jsons.mapper().valueToTree(TestFixtures.task("task-0002"));
            legacy.remove("context");
            legacy.remove("parameters");
            Files.writeString(config.tasksDir().resolve("task-0002.json"), Jsons.toJson(legacy), StandardCharsets.UTF_8);

            Task repaired = engine.loadTask("task-0001", false).orElseThrow();
            Task migrated = engine.loadTask("task-0002", false).orElseThrow();

            Assertions.assertEquals("Recovered Task", repaired.name());
            Assertions.assertTrue(repaired.subtasks().isEmpty());
            Assertions.assertEquals(30_000, migrated.context().path("timeout").asInt());
            Assertions.assertEquals(1L, engine.getSessionStatistics().migrationStats().successfulSteps());
        } finally {
            engine.shutdown(true);
            TestFixtures.deleteRecursively(root);
        }
    }

    @Test
    void checkpointsAutomaticallyAfterConfiguredOperations() throws Exception {
        Path root = Files.createTempDirectory("sessionvault-engine-auto-");
        SessionVaultConfig base = TestFixtures.config(root);
        SessionVaultConfig config = base.withSettings(base.settings().withCheckpointEveryOperations(3));
        CrossSessionPersistenceEngine engine = new CrossSessionPersistenceEngine(config, clock);
        try {
            engine.initialize();
            engine.saveTask(TestFixtures.task("task-0001"));
            engine.saveTask(TestFixtures.task("task-0002"));
            Assertions.assertTrue(engine.listCheckpoints().isEmpty());

            engine.saveTask(TestFixtures.task("task-0003"));

            List<Checkpoint> checkpoints = engine.listCheckpoints();
            Assertions.assertEquals(1, checkpoints.size());
            Assertions.assertEquals(CheckpointType.AUTOMATIC, checkpoints.get(0).type());
            Assertions.assertEquals(3, checkpoints.get(0).taskSnapshot().size());
        } finally {
            engine.shutdown(true);
            TestFixtures.deleteRecursively(root);
        }
    }

    @Test
    void queryTasksSeesBufferedWrites() throws Exception {
        Path root = Files.createTempDirectory("sessionvault-engine-query-");
        CrossSessionPersistenceEngine engine = new CrossSessionPersistenceEngine(TestFixtures.config(root), clock);
        try {
            engine.initialize();
            engine.saveTask(TestFixtures.task("task-0001").withTags(List.of("ui")));
            engine.flushWriteBuffer();
            engine.saveTask(TestFixtures.task("task-0001").withStatus(TaskStatus.COMPLETED, TestFixtures.T0)
                    .withResult(Jsons.mapper().createObjectNode()));
            engine.saveTask(TestFixtures.task("task-0002").withTags(List.of("ui")));

            Assertions.assertEquals(List.of("task-0002"),
                    engine.queryTasks(TaskFilter.byTag("ui")).stream().map(Task::id).toList());
            Assertions.assertEquals(1, engine.queryTasks(TaskFilter.byStatus(TaskStatus.COMPLETED)).size());
        } finally {
            engine.shutdown(true);
            TestFixtures.deleteRecursively(root);
        }
    }

    @Test
    void transactionalSavesAreRecorded() throws Exception {
        Path root = Files.createTempDirectory("sessionvault-engine-tx-");
        CrossSessionPersistenceEngine engine = new CrossSessionPersistenceEngine(TestFixtures.config(root), clock);
        try {
            engine.initialize();
            Transaction tx = engine.beginTransaction();
            CrossSessionPersistenceEngine.SaveResult result = engine.saveTask(TestFixtures.task("task-0001"), tx);
            Checkpoint during = engine.createCheckpoint(CheckpointType.MANUAL);
            engine.commitTransaction(tx);

            Assertions.assertFalse(result.buffered());
            Assertions.assertEquals(List.of(tx.id()), during.activeTransactions());
            Assertions.assertEquals(1, tx.operations().size());
            Assertions.assertFalse(engine.rollbackTransaction(tx));
            Assertions.assertEquals(0, engine.getSessionStatistics().transactionStats().active());
        } finally {
            engine.shutdown(true);
            TestFixtures.deleteRecursively(root);
        }
    }

    @Test
    void statisticsMetricsAndAuditTrail() throws Exception {
        Path root = Files.createTempDirectory("sessionvault-engine-stats-");
        CrossSessionPersistenceEngine engine = new CrossSessionPersistenceEngine(TestFixtures.config(root), clock);
        try {
            engine.initialize();
            engine.saveTask(TestFixtures.task("task-0001"));
            engine.flushWriteBuffer();
            engine.loadTask("task-0001");
            engine.loadTask("task-0001");

            CrossSessionPersistenceEngine.SessionStatistics stats = engine.getSessionStatistics();
            Assertions.assertEquals(1, stats.activeSessions().size());
            Assertions.assertEquals(1L, stats.currentSession().statistics().tasksProcessed());
            Assertions.assertEquals(2L, stats.operationMetrics().get("loadTask").count());
            Assertions.assertEquals(50.0, stats.performanceStats().cacheHitRate(), 0.001);
            Assertions.assertEquals(1, stats.performanceStats().prefetchCacheSize());

            String metrics = PrometheusFormatter.format(stats);
            Assertions.assertTrue(metrics.contains("sessionvault_tasks_processed_total 1"));
            Assertions.assertTrue(metrics.contains("sessionvault_operation_count{operation=\"loadTask\"} 2"));

            AuditLogger audit = engine.auditLogger();
            Assertions.assertNotNull(audit);
            AuditLogger.VerifyOutcome outcome = audit.verify();
            Assertions.assertTrue(outcome.ok());
            Assertions.assertTrue(outcome.checkedRows() >= 4);
        } finally {
            engine.shutdown(true);
            TestFixtures.deleteRecursively(root);
        }
    }

    @Test
    void unknownConflictStrategyFailsConstruction() throws Exception {
        Path root = Files.createTempDirectory("sessionvault-engine-strategy-");
        try {
            SessionVaultConfig base = TestFixtures.config(root);
            SessionVaultConfig config = base.withSettings(base.settings().withConflictResolution("newest-wins-maybe"));
            Assertions.assertThrows(PersistenceException.class, () -> new CrossSessionPersistenceEngine(config, clock));
        } finally {
            TestFixtures.deleteRecursively(root);
        }
    }
}
