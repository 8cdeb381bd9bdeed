package io.sessionvault.cache;

import io.sessionvault.config.SessionVaultConfig;
import io.sessionvault.model.Task;
import io.sessionvault.storage.TaskFileStore;
import io.sessionvault.transaction.Transaction;
import io.sessionvault.transaction.TransactionCoordinator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;

public final class PerformanceOptimizer {
    private static final Logger log = LoggerFactory.getLogger(PerformanceOptimizer.class);

    private final TaskFileStore storage;
    private final TransactionCoordinator transactions;
    private final WriteBuffer writeBuffer;
    private final PrefetchCache<Task> prefetch;
    private final OperationMetrics metrics = new OperationMetrics();
    private final boolean metricsEnabled;

    public PerformanceOptimizer(
            SessionVaultConfig.Settings settings,
            TaskFileStore storage,
            TransactionCoordinator transactions,
            Clock clock
    ) {
        this.storage = storage;
        this.transactions = transactions;
        this.writeBuffer = new WriteBuffer(settings.writeBufferCapacity(), clock);
        this.prefetch = new PrefetchCache<>(settings.prefetchCapacity(), Duration.ofMillis(settings.prefetchTtlMs()), clock);
        this.metricsEnabled = settings.enableMetrics();
    }

    // buffered only outside a transaction and while the buffer has room
    public boolean save(Task task, Transaction tx) {
        prefetch.invalidate(task.id());
        if (tx == null && writeBuffer.offer(task)) {
            return true;
        }
        flushWriteBuffer();
        storage.saveTask(task);
        transactions.record(tx, "save_task", task.id());
        return false;
    }

    public int flushWriteBuffer() {
        List<WriteBuffer.BufferedWrite> drained = writeBuffer.drain();
        if (drained.isEmpty()) {
            return 0;
        }
        Transaction tx = transactions.begin();
        int written = 0;
        try {
            for (WriteBuffer.BufferedWrite write : drained) {
                storage.saveTask(write.data());
                transactions.record(tx, "save_task", write.data().id());
                written++;
            }
            transactions.commit(tx);
        } catch (RuntimeException e) {
            transactions.rollback(tx);
            writeBuffer.requeue(drained.subList(written, drained.size()));
            throw e;
        }
        log.debug("Flushed {} buffered writes", written);
        return written;
    }

    public Optional<Task> buffered(String taskId) {
        return writeBuffer.get(taskId);
    }

    public Optional<Task> cached(String taskId) {
        return prefetch.get(taskId);
    }

    public void cache(Task task) {
        prefetch.put(task.id(), task);
    }

    public void forget(String taskId) {
        writeBuffer.remove(taskId);
        prefetch.invalidate(taskId);
    }

    public void clear() {
        writeBuffer.clear();
        prefetch.clear();
    }

    public void recordOperation(String operation, long durationNanos) {
        if (metricsEnabled) {
            metrics.record(operation, durationNanos);
        }
    }

    public WriteBuffer writeBuffer() {
        return writeBuffer;
    }

    public PrefetchCache<Task> prefetchCache() {
        return prefetch;
    }

    public OperationMetrics metrics() {
        return metrics;
    }
}
