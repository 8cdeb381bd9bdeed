package io.sessionvault.transaction;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Tracks open transactions of one session. Transactions group writes for logging and
 * checkpoint headers only: rollback forgets the transaction and does not undo files
 * already written.
 */
public final class TransactionCoordinator {
    private static final Logger log = LoggerFactory.getLogger(TransactionCoordinator.class);

    private final Clock clock;
    private final Map<String, Transaction> active = new ConcurrentHashMap<>();
    private final AtomicLong committed = new AtomicLong();
    private final AtomicLong rolledBack = new AtomicLong();

    public TransactionCoordinator(Clock clock) {
        this.clock = clock;
    }

    public Transaction begin() {
        return begin(IsolationLevel.READ_COMMITTED);
    }

    public Transaction begin(IsolationLevel isolationLevel) {
        Transaction tx = new Transaction(UUID.randomUUID().toString(),
                isolationLevel == null ? IsolationLevel.READ_COMMITTED : isolationLevel,
                clock.instant());
        active.put(tx.id(), tx);
        log.debug("Began transaction {} ({})", tx.id(), tx.isolationLevel());
        return tx;
    }

    public void record(Transaction tx, String kind, String entityId) {
        if (tx == null) {
            return;
        }
        requireActive(tx);
        tx.add(new Transaction.Operation(kind, entityId, clock.instant()));
    }

    public void commit(Transaction tx) {
        requireActive(tx);
        active.remove(tx.id());
        committed.incrementAndGet();
        log.debug("Committed transaction {} with {} operations", tx.id(), tx.operations().size());
    }

    public boolean rollback(Transaction tx) {
        if (tx == null || active.remove(tx.id()) == null) {
            return false;
        }
        rolledBack.incrementAndGet();
        log.debug("Rolled back transaction {} after {} operations", tx.id(), tx.operations().size());
        return true;
    }

    public boolean isActive(Transaction tx) {
        return tx != null && active.containsKey(tx.id());
    }

    public List<String> activeTransactionIds() {
        return List.copyOf(active.keySet());
    }

    public long committedCount() {
        return committed.get();
    }

    public long rolledBackCount() {
        return rolledBack.get();
    }

    private void requireActive(Transaction tx) {
        if (tx == null || !active.containsKey(tx.id())) {
            throw new IllegalStateException("Transaction is not active: " + (tx == null ? null : tx.id()));
        }
    }
}
