package io.sessionvault.transaction;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

public final class Transaction {
    private final String id;
    private final IsolationLevel isolationLevel;
    private final Instant startedAt;
    private final List<Operation> operations = new ArrayList<>();

    Transaction(String id, IsolationLevel isolationLevel, Instant startedAt) {
        this.id = id;
        this.isolationLevel = isolationLevel;
        this.startedAt = startedAt;
    }

    public String id() {
        return id;
    }

    public IsolationLevel isolationLevel() {
        return isolationLevel;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public synchronized List<Operation> operations() {
        return List.copyOf(operations);
    }

    synchronized void add(Operation operation) {
        operations.add(operation);
    }

    public record Operation(String kind, String entityId, Instant at) {
    }
}
