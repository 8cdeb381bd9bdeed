package io.sessionvault.runtime;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.sessionvault.cache.OperationMetrics;
import io.sessionvault.cache.PerformanceOptimizer;
import io.sessionvault.checkpoint.CheckpointManager;
import io.sessionvault.checkpoint.RestoreTarget;
import io.sessionvault.config.SessionVaultConfig;
import io.sessionvault.conflict.Conflict;
import io.sessionvault.conflict.ConflictResolution;
import io.sessionvault.conflict.ConflictResolver;
import io.sessionvault.conflict.ConflictStrategy;
import io.sessionvault.error.IntegrityException;
import io.sessionvault.error.PersistenceException;
import io.sessionvault.error.StorageException;
import io.sessionvault.event.PersistenceEvent;
import io.sessionvault.event.PersistenceEventBus;
import io.sessionvault.event.PersistenceEventType;
import io.sessionvault.integrity.CorruptionReport;
import io.sessionvault.integrity.DataIntegrityManager;
import io.sessionvault.integrity.RepairContext;
import io.sessionvault.migration.DataKind;
import io.sessionvault.migration.SchemaMigrationManager;
import io.sessionvault.model.Checkpoint;
import io.sessionvault.model.CheckpointType;
import io.sessionvault.model.SessionMetadata;
import io.sessionvault.model.SessionState;
import io.sessionvault.model.Task;
import io.sessionvault.model.TaskQueue;
import io.sessionvault.observability.AuditLogger;
import io.sessionvault.recovery.CrashRecoveryManager;
import io.sessionvault.recovery.RecoveryHost;
import io.sessionvault.session.SessionRegistry;
import io.sessionvault.storage.TaskFilter;
import io.sessionvault.storage.TaskFileStore;
import io.sessionvault.transaction.IsolationLevel;
import io.sessionvault.transaction.Transaction;
import io.sessionvault.transaction.TransactionCoordinator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Entry point of the persistence engine for one process instance (one session).
 * <p>
 * Saves pass through validation, cross-session conflict detection and the write buffer
 * before reaching the task store. Public operations are serialized on the engine monitor,
 * so calls made by one caller take effect in the order they were issued. Three timers run
 * on a private daemon scheduler: the session heartbeat, periodic checkpoints and the
 * write-buffer flush.
 */
public final class CrossSessionPersistenceEngine {
    private static final Logger log = LoggerFactory.getLogger(CrossSessionPersistenceEngine.class);

    private final SessionVaultConfig config;
    private final SessionVaultConfig.Settings settings;
    private final Clock clock;
    private final String sessionId;
    private final PersistenceEventBus events = new PersistenceEventBus();
    private final TaskFileStore storage;
    private final DataIntegrityManager integrity;
    private final SchemaMigrationManager migrations;
    private final TransactionCoordinator transactions;
    private final CheckpointManager checkpoints;
    private final ConflictResolver conflicts;
    private final SessionRegistry sessions;
    private final CrashRecoveryManager recovery;
    private final PerformanceOptimizer optimizer;
    private final AtomicLong tasksProcessed = new AtomicLong();
    private final AtomicLong errorsEncountered = new AtomicLong();
    private final AtomicLong totalOperations = new AtomicLong();
    private final AtomicLong loadCount = new AtomicLong();
    private final List<ScheduledFuture<?>> timers = new ArrayList<>();

    private ScheduledExecutorService scheduler;
    private AuditLogger auditLogger;
    private SessionMetadata session;
    private long startedAtNanos;
    private long operationsSinceCheckpoint;
    private boolean restoring;

    public CrossSessionPersistenceEngine(SessionVaultConfig config) {
        this(config, Clock.systemUTC());
    }

    public CrossSessionPersistenceEngine(SessionVaultConfig config, Clock clock) {
        this.config = config;
        this.settings = config.settings();
        this.clock = clock;
        this.sessionId = UUID.randomUUID().toString();
        this.storage = new TaskFileStore(config);
        this.integrity = new DataIntegrityManager(clock);
        this.migrations = new SchemaMigrationManager(integrity, clock);
        this.transactions = new TransactionCoordinator(clock);
        this.checkpoints = new CheckpointManager(config, integrity, transactions, clock);
        this.conflicts = new ConflictResolver(ConflictStrategy.fromString(settings.conflictResolution()), clock);
        this.sessions = new SessionRegistry(config, clock);
        this.recovery = new CrashRecoveryManager(sessions, checkpoints, events, clock);
        this.optimizer = new PerformanceOptimizer(settings, storage, transactions, clock);
    }

    public synchronized void initialize() {
        if (session != null) {
            throw new IllegalStateException("Engine already initialized: " + sessionId);
        }
        try {
            createDirectories(config.storageDir(), config.tasksDir(), config.queuesDir(), config.checkpointsDir());
            startedAtNanos = System.nanoTime();
            session = SessionMetadata.start(sessionId, clock.instant());
            sessions.write(session);
            if (settings.auditEnabled()) {
                auditLogger = new AuditLogger(config.auditFile(sessionId), sessionId);
                events.subscribeAll(auditLogger::log);
            }
            int loaded = checkpoints.loadExisting();
            SessionRegistry.Classification peers = sessions.classifyPeers(sessionId);
            long recovered = 0L;
            if (settings.crashRecoveryEnabled() && !peers.crashed().isEmpty()) {
                try {
                    recovered = recovery.recover(sessionId, peers.crashed(), recoveryHost()).recoveredCount();
                } catch (RuntimeException e) {
                    errorsEncountered.incrementAndGet();
                    publishError(PersistenceEventType.CRASH_RECOVERY_ERROR, e, mapOf("crashedSessions", peers.crashed().size()));
                    log.error("Crash recovery pass failed for session {}; continuing without it", sessionId, e);
                }
            }
            startTimers();
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("sessionId", sessionId);
            payload.put("storageDir", config.storageDir().toString());
            payload.put("conflictResolution", conflicts.strategy().wireName());
            payload.put("livePeers", peers.live().size());
            payload.put("crashedSessions", peers.crashed().size());
            payload.put("recoveredSessions", recovered);
            payload.put("checkpointsLoaded", loaded);
            publish(PersistenceEventType.CROSS_SESSION_INITIALIZED, payload);
            log.info("Session {} initialized at {} ({} live peers, {} crashed)",
                    sessionId, config.storageDir(), peers.live().size(), peers.crashed().size());
        } catch (RuntimeException e) {
            throw failure(PersistenceEventType.INITIALIZATION_ERROR, "Initialization", e, Map.of());
        }
    }

    public SaveResult saveTask(Task task) {
        return saveTask(task, null);
    }

    /**
     * Validates the task, reconciles it with any newer copy written by a live peer session,
     * then buffers it (no transaction) or writes it through (inside {@code tx}).
     */
    public synchronized SaveResult saveTask(Task task, Transaction tx) {
        long startNs = System.nanoTime();
        String operationId = UUID.randomUUID().toString();
        String taskId = task == null ? null : task.id();
        try {
            ensureRunning();
            integrity.validateTaskData(task);
            Task toWrite = task;
            String conflictId = null;
            if (!restoring) {
                Optional<Conflict> conflict = conflicts.detect(task, sessionId, sessions.livePeers(sessionId), this::storedCopy);
                if (conflict.isPresent()) {
                    ConflictResolution resolution = conflicts.resolve(conflict.get());
                    toWrite = resolution.resolvedData();
                    conflictId = resolution.conflictId();
                    Map<String, Object> payload = new LinkedHashMap<>();
                    payload.put("taskId", taskId);
                    payload.put("conflictId", conflictId);
                    payload.put("strategy", resolution.strategy().wireName());
                    payload.put("sessions", resolution.sessions());
                    publish(PersistenceEventType.CONFLICT_RESOLVED, payload);
                }
            }
            boolean buffered = optimizer.save(toWrite, tx);
            tasksProcessed.incrementAndGet();
            long total = totalOperations.incrementAndGet();
            operationsSinceCheckpoint++;
            long durationNs = System.nanoTime() - startNs;
            optimizer.recordOperation("saveTask", durationNs);
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("taskId", taskId);
            payload.put("sessionId", sessionId);
            payload.put("duration", durationNs / 1_000_000.0);
            payload.put("operationId", operationId);
            payload.put("conflict", conflictId);
            payload.put("buffered", buffered);
            publish(PersistenceEventType.TASK_SAVED, payload);
            if (!restoring && total % settings.checkpointEveryOperations() == 0) {
                autoCheckpoint();
            }
            return new SaveResult(taskId, operationId, toWrite, buffered, conflictId, durationNs / 1_000_000.0);
        } catch (RuntimeException e) {
            Map<String, Object> context = new LinkedHashMap<>();
            context.put("taskId", taskId);
            context.put("operationId", operationId);
            throw failure(PersistenceEventType.SAVE_ERROR, "Task save", e, context);
        }
    }

    public Optional<Task> loadTask(String taskId) {
        return loadTask(taskId, true);
    }

    /**
     * Reads the newest copy visible to this session: pending buffered write first, then the
     * prefetch cache (when {@code useCache}), then the task file. Documents read from disk
     * are repaired and migrated to the current task schema before decoding.
     */
    public synchronized Optional<Task> loadTask(String taskId, boolean useCache) {
        long startNs = System.nanoTime();
        try {
            ensureRunning();
            String source = "buffer";
            Optional<Task> found = optimizer.buffered(taskId);
            if (found.isEmpty() && useCache) {
                found = optimizer.cached(taskId);
                source = "cache";
            }
            if (found.isEmpty()) {
                found = loadFromStorage(taskId);
                source = "storage";
                if (found.isPresent() && useCache) {
                    optimizer.cache(found.get());
                }
            }
            loadCount.incrementAndGet();
            totalOperations.incrementAndGet();
            long durationNs = System.nanoTime() - startNs;
            optimizer.recordOperation("loadTask", durationNs);
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("taskId", taskId);
            payload.put("found", found.isPresent());
            payload.put("source", source);
            payload.put("duration", durationNs / 1_000_000.0);
            publish(PersistenceEventType.TASK_LOADED, payload);
            return found;
        } catch (RuntimeException e) {
            throw failure(PersistenceEventType.LOAD_ERROR, "Task load", e, mapOf("taskId", taskId));
        }
    }

    private Optional<Task> loadFromStorage(String taskId) {
        Optional<ObjectNode> raw = storage.readTaskNode(taskId);
        if (raw.isEmpty()) {
            return Optional.empty();
        }
        ObjectNode node = raw.get();
        RepairContext repairContext = settings.autoRepair()
                ? RepairContext.autoRepair(taskId)
                : RepairContext.detectOnly();
        CorruptionReport report = integrity.detectAndRepairCorruption(node, repairContext);
        if (report.corrupted()) {
            if (!report.success()) {
                throw new IntegrityException("Task document " + taskId + " is corrupted: " + report.issues());
            }
            node = report.repairedData();
        }
        String version = migrations.detectDataVersion(node);
        if (SchemaMigrationManager.compareVersions(version, SchemaMigrationManager.TASK_SCHEMA_VERSION) < 0) {
            SchemaMigrationManager.MigrationOutcome outcome = migrations.migrate(
                    DataKind.TASK, version, SchemaMigrationManager.TASK_SCHEMA_VERSION, node);
            if (!outcome.success()) {
                throw new IntegrityException("Task document " + taskId + " could not be migrated: " + outcome.error());
            }
            node = outcome.migratedData();
        }
        return Optional.of(storage.decodeTask(taskId, node));
    }

    // copy on disk as a peer would have written it; bypasses buffer and cache
    private Optional<Task> storedCopy(String taskId) {
        try {
            return storage.loadTask(taskId);
        } catch (StorageException e) {
            log.warn("Ignoring unreadable stored copy of {} during conflict check: {}", taskId, e.getMessage());
            return Optional.empty();
        }
    }

    public void saveQueue(TaskQueue queue) {
        saveQueue(queue, null);
    }

    public synchronized void saveQueue(TaskQueue queue, Transaction tx) {
        long startNs = System.nanoTime();
        String queueId = queue == null ? null : queue.id();
        try {
            ensureRunning();
            if (queueId == null || queueId.isBlank()) {
                throw new IllegalArgumentException("Queue id must not be blank");
            }
            storage.saveQueue(queue);
            transactions.record(tx, "save_queue", queueId);
            totalOperations.incrementAndGet();
            long durationNs = System.nanoTime() - startNs;
            optimizer.recordOperation("saveQueue", durationNs);
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("queueId", queueId);
            payload.put("sessionId", sessionId);
            payload.put("duration", durationNs / 1_000_000.0);
            publish(PersistenceEventType.QUEUE_SAVED, payload);
        } catch (RuntimeException e) {
            throw failure(PersistenceEventType.SAVE_ERROR, "Queue save", e, mapOf("queueId", queueId));
        }
    }

    public synchronized Optional<TaskQueue> loadQueue(String queueId) {
        long startNs = System.nanoTime();
        try {
            ensureRunning();
            Optional<TaskQueue> found = storage.loadQueue(queueId);
            totalOperations.incrementAndGet();
            optimizer.recordOperation("loadQueue", System.nanoTime() - startNs);
            return found;
        } catch (RuntimeException e) {
            throw failure(PersistenceEventType.LOAD_ERROR, "Queue load", e, mapOf("queueId", queueId));
        }
    }

    public synchronized boolean deleteTask(String taskId) {
        long startNs = System.nanoTime();
        try {
            ensureRunning();
            optimizer.forget(taskId);
            boolean deleted = storage.deleteTask(taskId, false);
            totalOperations.incrementAndGet();
            optimizer.recordOperation("deleteTask", System.nanoTime() - startNs);
            return deleted;
        } catch (RuntimeException e) {
            throw failure(PersistenceEventType.SAVE_ERROR, "Task delete", e, mapOf("taskId", taskId));
        }
    }

    public synchronized boolean deleteQueue(String queueId) {
        long startNs = System.nanoTime();
        try {
            ensureRunning();
            boolean deleted = storage.deleteTask(queueId, true);
            totalOperations.incrementAndGet();
            optimizer.recordOperation("deleteQueue", System.nanoTime() - startNs);
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("queueId", queueId);
            payload.put("deleted", deleted);
            publish(PersistenceEventType.QUEUE_DELETED, payload);
            return deleted;
        } catch (RuntimeException e) {
            throw failure(PersistenceEventType.DELETE_QUEUE_ERROR, "Queue delete", e, mapOf("queueId", queueId));
        }
    }

    public synchronized List<Task> queryTasks(TaskFilter filter) {
        long startNs = System.nanoTime();
        TaskFilter effective = filter == null ? TaskFilter.all() : filter;
        try {
            ensureRunning();
            Map<String, Task> byId = new LinkedHashMap<>();
            for (String id : storage.listTaskIds()) {
                loadFromStorage(id).ifPresent(task -> byId.put(id, task));
            }
            for (Task pending : optimizer.writeBuffer().snapshot()) {
                byId.put(pending.id(), pending);
            }
            List<Task> out = new ArrayList<>();
            for (Task task : byId.values()) {
                if (effective.matches(task)) {
                    out.add(task);
                }
            }
            totalOperations.incrementAndGet();
            optimizer.recordOperation("queryTasks", System.nanoTime() - startNs);
            return out;
        } catch (RuntimeException e) {
            throw failure(PersistenceEventType.LOAD_ERROR, "Task query", e, Map.of());
        }
    }

    public synchronized int flushWriteBuffer() {
        long startNs = System.nanoTime();
        try {
            int written = optimizer.flushWriteBuffer();
            if (written > 0) {
                optimizer.recordOperation("flushWriteBuffer", System.nanoTime() - startNs);
                publish(PersistenceEventType.WRITE_BUFFER_FLUSHED, mapOf("written", written));
            }
            return written;
        } catch (RuntimeException e) {
            throw failure(PersistenceEventType.FLUSH_ERROR, "Write buffer flush", e, Map.of());
        }
    }

    public Transaction beginTransaction() {
        return transactions.begin(IsolationLevel.READ_COMMITTED);
    }

    public Transaction beginTransaction(IsolationLevel isolationLevel) {
        return transactions.begin(isolationLevel);
    }

    public void commitTransaction(Transaction tx) {
        transactions.commit(tx);
    }

    public boolean rollbackTransaction(Transaction tx) {
        return transactions.rollback(tx);
    }

    public synchronized Checkpoint createCheckpoint(CheckpointType type) {
        long startNs = System.nanoTime();
        try {
            requireInitialized();
            optimizer.flushWriteBuffer();
            Map<String, Task> tasks = new LinkedHashMap<>();
            for (String id : storage.listTaskIds()) {
                loadFromStorage(id).ifPresent(task -> tasks.put(task.id(), task));
            }
            Map<String, TaskQueue> queues = storage.loadAllQueues();
            Checkpoint checkpoint = checkpoints.create(type, sessionId, tasks, queues, transactions.activeTransactionIds());
            operationsSinceCheckpoint = 0L;
            optimizer.recordOperation("createCheckpoint", System.nanoTime() - startNs);
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("checkpointId", checkpoint.id());
            payload.put("type", type.wireName());
            payload.put("tasks", tasks.size());
            payload.put("queues", queues.size());
            payload.put("size", checkpoint.size());
            publish(PersistenceEventType.CHECKPOINT_CREATED, payload);
            return checkpoint;
        } catch (RuntimeException e) {
            errorsEncountered.incrementAndGet();
            publishError(PersistenceEventType.CHECKPOINT_ERROR, e, mapOf("type", type == null ? null : type.wireName()));
            throw new PersistenceException("Checkpoint creation failed: " + e.getMessage(), e);
        }
    }

    public synchronized CheckpointManager.RestoreSummary restoreFromCheckpoint(String checkpointId) {
        long startNs = System.nanoTime();
        try {
            requireInitialized();
            restoring = true;
            CheckpointManager.RestoreSummary summary;
            try {
                summary = checkpoints.restore(checkpointId, restoreTarget());
            } finally {
                restoring = false;
            }
            optimizer.recordOperation("restoreFromCheckpoint", System.nanoTime() - startNs);
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("checkpointId", checkpointId);
            payload.put("tasksRestored", summary.tasksRestored());
            payload.put("queuesRestored", summary.queuesRestored());
            publish(PersistenceEventType.CHECKPOINT_RESTORED, payload);
            return summary;
        } catch (RuntimeException e) {
            throw failure(PersistenceEventType.RESTORE_ERROR, "Checkpoint restore", e, mapOf("checkpointId", checkpointId));
        }
    }

    public List<Checkpoint> listCheckpoints() {
        return checkpoints.list();
    }

    public boolean verifyCheckpoint(String checkpointId) {
        return checkpoints.verify(checkpointId);
    }

    public synchronized SessionStatistics getSessionStatistics() {
        requireInitialized();
        List<SessionMetadata> active = new ArrayList<>();
        active.add(currentSession());
        active.addAll(sessions.livePeers(sessionId));
        OperationMetrics metrics = optimizer.metrics();
        long measured = metrics.totalCount();
        double avgOperationMs = measured == 0 ? 0.0 : metrics.totalTimeMs() / measured;
        double uptimeSeconds = Math.max(1e-3, (System.nanoTime() - startedAtNanos) / 1_000_000_000.0);
        long loads = loadCount.get();
        double cacheHitRate = loads == 0 ? 0.0 : optimizer.prefetchCache().totalHits() * 100.0 / loads;
        PerformanceStats performance = new PerformanceStats(
                avgOperationMs,
                totalOperations.get() / uptimeSeconds,
                cacheHitRate,
                optimizer.writeBuffer().size(),
                optimizer.prefetchCache().size()
        );
        TransactionStats transactionStats = new TransactionStats(
                transactions.activeTransactionIds().size(),
                transactions.committedCount(),
                transactions.rolledBackCount()
        );
        return new SessionStatistics(
                currentSession(),
                active,
                metrics.snapshot(),
                checkpoints.stats(),
                performance,
                integrity.integrityStats(),
                conflicts.stats(),
                migrations.migrationStats(),
                transactionStats
        );
    }

    public synchronized void heartbeat() {
        if (session == null || session.state() != SessionState.ACTIVE) {
            return;
        }
        try {
            session = currentSession().withLastActivity(clock.instant());
            sessions.write(session);
            sessions.cleanupInactive(sessionId);
            optimizer.prefetchCache().purgeExpired();
        } catch (RuntimeException e) {
            errorsEncountered.incrementAndGet();
            publishError(PersistenceEventType.HEARTBEAT_ERROR, e, Map.of());
            log.warn("Heartbeat failed for session {}: {}", sessionId, e.getMessage());
        }
    }

    /**
     * Emergency path for unrecoverable host failures: seals a crash-recovery checkpoint and
     * marks the session crashed. Never throws.
     */
    public synchronized void handleCrash(Throwable cause) {
        try {
            Checkpoint checkpoint = createCheckpoint(CheckpointType.CRASH_RECOVERY);
            cancelTimers();
            session = currentSession().withState(SessionState.CRASHED).withEndTime(clock.instant());
            sessions.write(session);
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("checkpointId", checkpoint.id());
            payload.put("error", cause == null ? null : String.valueOf(cause.getMessage()));
            publish(PersistenceEventType.EMERGENCY_CHECKPOINT, payload);
            log.error("Session {} crashed; emergency checkpoint {} written", sessionId, checkpoint.id(), cause);
        } catch (RuntimeException e) {
            log.error("CRITICAL: Unable to create emergency checkpoint for session {}", sessionId, e);
        }
    }

    public synchronized void shutdown(boolean force) {
        if (session == null || session.state() == SessionState.TERMINATED) {
            return;
        }
        try {
            session = currentSession().withState(SessionState.TERMINATING);
            cancelTimers();
            optimizer.flushWriteBuffer();
            String checkpointId = null;
            if (!force) {
                checkpointId = createCheckpoint(CheckpointType.MANUAL).id();
            }
            session = currentSession().withEndTime(clock.instant()).withState(SessionState.TERMINATED);
            sessions.write(session);
            optimizer.clear();
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("force", force);
            payload.put("checkpointId", checkpointId);
            payload.put("totalOperations", totalOperations.get());
            publish(PersistenceEventType.CROSS_SESSION_SHUTDOWN, payload);
            log.info("Session {} shut down (force={})", sessionId, force);
        } catch (RuntimeException e) {
            throw failure(PersistenceEventType.SHUTDOWN_ERROR, "Shutdown", e, mapOf("force", force));
        }
    }

    public PersistenceEventBus events() {
        return events;
    }

    public String sessionId() {
        return sessionId;
    }

    public synchronized SessionState state() {
        return session == null ? null : session.state();
    }

    public synchronized int activeTimerCount() {
        int active = 0;
        for (ScheduledFuture<?> timer : timers) {
            if (!timer.isCancelled() && !timer.isDone()) {
                active++;
            }
        }
        return active;
    }

    public SessionVaultConfig config() {
        return config;
    }

    public AuditLogger auditLogger() {
        return auditLogger;
    }

    private void startTimers() {
        scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread thread = new Thread(r, "sessionvault-timers-" + sessionId.substring(0, 8));
            thread.setDaemon(true);
            return thread;
        });
        schedule(this::heartbeat, settings.heartbeatIntervalMs());
        schedule(this::checkpointTick, settings.checkpointIntervalMs());
        schedule(this::flushTick, settings.writeBufferFlushIntervalMs());
    }

    private void schedule(Runnable task, long intervalMs) {
        timers.add(scheduler.scheduleWithFixedDelay(() -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                log.warn("Timer task failed in session {}: {}", sessionId, e.getMessage(), e);
            }
        }, intervalMs, intervalMs, TimeUnit.MILLISECONDS));
    }

    private void cancelTimers() {
        for (ScheduledFuture<?> timer : timers) {
            timer.cancel(false);
        }
        if (scheduler != null) {
            scheduler.shutdown();
        }
    }

    private synchronized void checkpointTick() {
        if (session.state() == SessionState.ACTIVE && operationsSinceCheckpoint > 0) {
            createCheckpoint(CheckpointType.AUTOMATIC);
        }
    }

    private synchronized void flushTick() {
        if (session.state() == SessionState.ACTIVE) {
            flushWriteBuffer();
        }
    }

    private void autoCheckpoint() {
        try {
            createCheckpoint(CheckpointType.AUTOMATIC);
        } catch (PersistenceException e) {
            log.warn("Automatic checkpoint after {} operations failed: {}", totalOperations.get(), e.getMessage());
        }
    }

    private RestoreTarget restoreTarget() {
        return new RestoreTarget() {
            @Override
            public void clearCurrentState(Transaction tx) {
                optimizer.clear();
                int removed = storage.clear();
                transactions.record(tx, "clear_state", "*");
                log.debug("Cleared {} task and queue files before restore", removed);
            }

            @Override
            public void restoreTask(Task task, Transaction tx) {
                saveTask(task, tx);
            }

            @Override
            public void restoreQueue(TaskQueue queue, Transaction tx) {
                saveQueue(queue, tx);
            }
        };
    }

    private RecoveryHost recoveryHost() {
        return new RecoveryHost() {
            @Override
            public Checkpoint createCheckpoint(CheckpointType type) {
                return CrossSessionPersistenceEngine.this.createCheckpoint(type);
            }

            @Override
            public CheckpointManager.RestoreSummary restoreFromCheckpoint(String checkpointId) {
                return CrossSessionPersistenceEngine.this.restoreFromCheckpoint(checkpointId);
            }
        };
    }

    private SessionMetadata currentSession() {
        return session.withStatistics(new SessionMetadata.Statistics(
                tasksProcessed.get(),
                transactions.committedCount(),
                errorsEncountered.get(),
                totalOperations.get()
        ));
    }

    private void requireInitialized() {
        if (session == null) {
            throw new IllegalStateException("Engine not initialized");
        }
    }

    private void ensureRunning() {
        requireInitialized();
        SessionState state = session.state();
        if (state == SessionState.TERMINATED || state == SessionState.CRASHED) {
            throw new IllegalStateException("Session " + sessionId + " is " + state.wireName());
        }
    }

    private static void createDirectories(Path... dirs) {
        for (Path dir : dirs) {
            try {
                Files.createDirectories(dir);
            } catch (IOException e) {
                throw new StorageException("Failed to create directory", dir, e);
            }
        }
    }

    private PersistenceException failure(
            PersistenceEventType errorType,
            String operation,
            RuntimeException e,
            Map<String, Object> context
    ) {
        errorsEncountered.incrementAndGet();
        publishError(errorType, e, context);
        if (e instanceof PersistenceException) {
            return (PersistenceException) e;
        }
        return new PersistenceException(operation + " failed: " + e.getMessage(), e);
    }

    private void publishError(PersistenceEventType errorType, RuntimeException e, Map<String, Object> context) {
        Map<String, Object> payload = new LinkedHashMap<>(context);
        payload.put("error", String.valueOf(e.getMessage()));
        payload.put("errorType", e.getClass().getSimpleName());
        publish(errorType, payload);
    }

    private void publish(PersistenceEventType type, Map<String, Object> payload) {
        events.publish(new PersistenceEvent(type, sessionId, payload, clock.instant()));
    }

    private static Map<String, Object> mapOf(String key, Object value) {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put(key, value);
        return map;
    }

    public record SaveResult(
            String taskId,
            String operationId,
            Task savedTask,
            boolean buffered,
            String conflictId,
            double durationMs
    ) {
        public boolean conflictResolved() {
            return conflictId != null;
        }
    }

    public record PerformanceStats(
            double avgOperationTimeMs,
            double operationsPerSecond,
            double cacheHitRate,
            int writeBufferSize,
            int prefetchCacheSize
    ) {
    }

    public record TransactionStats(int active, long committed, long rolledBack) {
    }

    public record SessionStatistics(
            SessionMetadata currentSession,
            List<SessionMetadata> activeSessions,
            Map<String, OperationMetrics.OperationMetric> operationMetrics,
            CheckpointManager.CheckpointStats checkpointStats,
            PerformanceStats performanceStats,
            DataIntegrityManager.IntegrityStats integrityStats,
            ConflictResolver.ConflictStats conflictStats,
            SchemaMigrationManager.MigrationStats migrationStats,
            TransactionStats transactionStats
    ) {
    }
}
