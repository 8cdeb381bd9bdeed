package io.sessionvault.checkpoint;

import io.sessionvault.config.SessionVaultConfig;
import io.sessionvault.error.CheckpointNotFoundException;
import io.sessionvault.error.IntegrityException;
import io.sessionvault.error.StorageException;
import io.sessionvault.integrity.DataIntegrityManager;
import io.sessionvault.model.Checkpoint;
import io.sessionvault.model.CheckpointType;
import io.sessionvault.model.Task;
import io.sessionvault.model.TaskQueue;
import io.sessionvault.transaction.Transaction;
import io.sessionvault.transaction.TransactionCoordinator;
import io.sessionvault.util.AtomicFiles;
import io.sessionvault.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Creates sealed checkpoints under {@code checkpoints/}, keeps the newest
 * {@code maxCheckpoints} of them, and restores one into a {@link RestoreTarget}.
 */
public final class CheckpointManager {
    private static final Logger log = LoggerFactory.getLogger(CheckpointManager.class);
    private static final String FILE_PREFIX = "checkpoint-";
    private static final String FILE_SUFFIX = ".json";
    private static final Comparator<Entry> NEWEST_FIRST = Comparator
            .comparing((Entry e) -> e.checkpoint().timestamp(), Comparator.nullsFirst(Comparator.<Instant>naturalOrder()))
            .thenComparingLong(Entry::sequence)
            .reversed();

    private final SessionVaultConfig config;
    private final DataIntegrityManager integrity;
    private final TransactionCoordinator transactions;
    private final Clock clock;
    private final int maxCheckpoints;
    private final Map<String, Entry> checkpoints = new LinkedHashMap<>();
    private final Set<String> pinned = new HashSet<>();
    private final AtomicLong sequence = new AtomicLong();

    public CheckpointManager(
            SessionVaultConfig config,
            DataIntegrityManager integrity,
            TransactionCoordinator transactions,
            Clock clock
    ) {
        this.config = config;
        this.integrity = integrity;
        this.transactions = transactions;
        this.clock = clock;
        this.maxCheckpoints = config.settings().maxCheckpoints();
    }

    public synchronized Checkpoint create(
            CheckpointType type,
            String sessionId,
            Map<String, Task> tasks,
            Map<String, TaskQueue> queues,
            List<String> activeTransactions
    ) {
        Map<String, Task> taskSnapshot = new TreeMap<>(tasks);
        Map<String, TaskQueue> queueSnapshot = new TreeMap<>(queues);
        Checkpoint unsealed = new Checkpoint(
                UUID.randomUUID().toString(),
                clock.instant(),
                sessionId,
                type,
                taskSnapshot,
                queueSnapshot,
                List.copyOf(activeTransactions),
                Checkpoint.sizeOf(taskSnapshot, queueSnapshot),
                null
        );
        Checkpoint sealed = unsealed.withIntegrityHash(integrity.calculateCheckpointHash(unsealed));
        Path file = config.checkpointFile(sealed.id());
        try {
            AtomicFiles.writeString(file, Jsons.toJson(sealed));
        } catch (IOException e) {
            throw new StorageException("Failed to write checkpoint", file, e);
        }
        checkpoints.put(sealed.id(), new Entry(sealed, sequence.incrementAndGet()));
        log.info("Created {} checkpoint {} with {} tasks and {} queues",
                type.wireName(), sealed.id(), taskSnapshot.size(), queueSnapshot.size());
        enforceRetention();
        return sealed;
    }

    public synchronized int loadExisting() {
        Path dir = config.checkpointsDir();
        if (!Files.isDirectory(dir)) {
            return checkpoints.size();
        }
        List<Path> files = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, FILE_PREFIX + "*" + FILE_SUFFIX)) {
            for (Path file : stream) {
                files.add(file);
            }
        } catch (IOException e) {
            throw new StorageException("Failed to list checkpoints", dir, e);
        }
        for (Path file : files) {
            try {
                Checkpoint checkpoint = Jsons.mapper().readValue(Files.readString(file, StandardCharsets.UTF_8), Checkpoint.class);
                if (checkpoint.id() == null || checkpoint.timestamp() == null) {
                    log.warn("Skipping checkpoint file {} without id or timestamp", file);
                    continue;
                }
                if (!checkpoints.containsKey(checkpoint.id())) {
                    checkpoints.put(checkpoint.id(), new Entry(checkpoint, sequence.incrementAndGet()));
                }
            } catch (IOException e) {
                log.warn("Skipping unreadable checkpoint file {}: {}", file, e.getMessage());
            }
        }
        enforceRetention();
        log.info("Loaded {} checkpoints from {}", checkpoints.size(), dir);
        return checkpoints.size();
    }

    public Optional<Checkpoint> loadFromDisk(String checkpointId) {
        return readStored(checkpointId).map(Stored::checkpoint);
    }

    private Optional<Stored> readStored(String checkpointId) {
        Path file = config.checkpointFile(checkpointId);
        String raw;
        try {
            raw = Files.readString(file, StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw new StorageException("Failed to read checkpoint", file, e);
        }
        try {
            return Optional.of(new Stored(Jsons.mapper().readValue(raw, Checkpoint.class), raw));
        } catch (IOException e) {
            throw new IntegrityException("Checkpoint " + checkpointId + " is corrupted", e);
        }
    }

    public boolean verify(String checkpointId) {
        Path file = config.checkpointFile(checkpointId);
        return Files.isRegularFile(file) && integrity.validateCheckpointIntegrity(file);
    }

    /**
     * Clears the target and replays the checkpoint into it inside one transaction. The
     * transaction is rolled back and the failure rethrown if any write fails.
     */
    public RestoreSummary restore(String checkpointId, RestoreTarget target) {
        Stored stored = readStored(checkpointId)
                .orElseThrow(() -> new CheckpointNotFoundException(checkpointId));
        Checkpoint checkpoint = stored.checkpoint();
        if (!integrity.validateCheckpointIntegrity(checkpoint, stored.text())) {
            throw new IntegrityException("Checkpoint integrity validation failed: " + checkpointId);
        }
        Transaction tx = transactions.begin();
        try {
            target.clearCurrentState(tx);
            for (Task task : checkpoint.taskSnapshot().values()) {
                target.restoreTask(task, tx);
            }
            for (TaskQueue queue : checkpoint.queueSnapshot().values()) {
                target.restoreQueue(queue, tx);
            }
            transactions.commit(tx);
        } catch (RuntimeException e) {
            transactions.rollback(tx);
            throw e;
        }
        log.info("Restored checkpoint {}: {} tasks, {} queues",
                checkpointId, checkpoint.taskSnapshot().size(), checkpoint.queueSnapshot().size());
        return new RestoreSummary(checkpointId, checkpoint.sessionId(),
                checkpoint.taskSnapshot().size(), checkpoint.queueSnapshot().size());
    }

    public synchronized void pin(String checkpointId) {
        pinned.add(checkpointId);
    }

    public synchronized void unpin(String checkpointId) {
        if (pinned.remove(checkpointId)) {
            enforceRetention();
        }
    }

    public synchronized Optional<Checkpoint> find(String checkpointId) {
        Entry entry = checkpoints.get(checkpointId);
        return entry == null ? Optional.empty() : Optional.of(entry.checkpoint());
    }

    // newest first
    public synchronized List<Checkpoint> list() {
        List<Entry> entries = new ArrayList<>(checkpoints.values());
        entries.sort(NEWEST_FIRST);
        List<Checkpoint> out = new ArrayList<>(entries.size());
        for (Entry entry : entries) {
            out.add(entry.checkpoint());
        }
        return out;
    }

    public synchronized Optional<Checkpoint> latestForSession(String sessionId) {
        for (Checkpoint checkpoint : list()) {
            if (checkpoint.sessionId() != null && checkpoint.sessionId().equals(sessionId)) {
                return Optional.of(checkpoint);
            }
        }
        return Optional.empty();
    }

    public synchronized CheckpointStats stats() {
        Map<String, Long> byType = new LinkedHashMap<>();
        for (CheckpointType type : CheckpointType.values()) {
            byType.put(type.wireName(), 0L);
        }
        Instant newest = null;
        Instant oldest = null;
        for (Entry entry : checkpoints.values()) {
            Checkpoint checkpoint = entry.checkpoint();
            if (checkpoint.type() != null) {
                byType.merge(checkpoint.type().wireName(), 1L, Long::sum);
            }
            if (checkpoint.timestamp() == null) {
                continue;
            }
            if (newest == null || checkpoint.timestamp().isAfter(newest)) {
                newest = checkpoint.timestamp();
            }
            if (oldest == null || checkpoint.timestamp().isBefore(oldest)) {
                oldest = checkpoint.timestamp();
            }
        }
        return new CheckpointStats(checkpoints.size(), byType, newest, oldest);
    }

    private void enforceRetention() {
        if (checkpoints.size() <= maxCheckpoints) {
            return;
        }
        List<Entry> entries = new ArrayList<>(checkpoints.values());
        entries.sort(NEWEST_FIRST);
        for (Entry stale : entries.subList(maxCheckpoints, entries.size())) {
            String id = stale.checkpoint().id();
            if (pinned.contains(id)) {
                continue;
            }
            checkpoints.remove(id);
            Path file = config.checkpointFile(id);
            try {
                Files.deleteIfExists(file);
                log.debug("Retention removed checkpoint {}", id);
            } catch (IOException e) {
                log.warn("Failed to delete old checkpoint file {}: {}", file, e.getMessage());
            }
        }
    }

    private record Entry(Checkpoint checkpoint, long sequence) {
    }

    private record Stored(Checkpoint checkpoint, String text) {
    }

    public record RestoreSummary(String checkpointId, String sourceSessionId, int tasksRestored, int queuesRestored) {
    }

    public record CheckpointStats(int total, Map<String, Long> byType, Instant newest, Instant oldest) {
    }
}
