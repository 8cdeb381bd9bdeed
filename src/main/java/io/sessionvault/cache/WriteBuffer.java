package io.sessionvault.cache;

import io.sessionvault.model.Task;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public final class WriteBuffer {
    private final int capacity;
    private final Clock clock;
    private final Map<String, BufferedWrite> pending = new LinkedHashMap<>();

    public WriteBuffer(int capacity, Clock clock) {
        this.capacity = capacity;
        this.clock = clock;
    }

    public synchronized boolean offer(Task task) {
        if (!pending.containsKey(task.id()) && pending.size() >= capacity) {
            return false;
        }
        pending.put(task.id(), new BufferedWrite(task, clock.instant()));
        return true;
    }

    public synchronized Optional<Task> get(String taskId) {
        BufferedWrite write = pending.get(taskId);
        return write == null ? Optional.empty() : Optional.of(write.data());
    }

    public synchronized List<Task> snapshot() {
        List<Task> out = new ArrayList<>(pending.size());
        for (BufferedWrite write : pending.values()) {
            out.add(write.data());
        }
        return out;
    }

    public synchronized boolean remove(String taskId) {
        return pending.remove(taskId) != null;
    }

    public synchronized List<BufferedWrite> drain() {
        List<BufferedWrite> out = new ArrayList<>(pending.values());
        pending.clear();
        return out;
    }

    // a newer write for the same id wins over a requeued one
    public synchronized void requeue(List<BufferedWrite> writes) {
        for (BufferedWrite write : writes) {
            pending.putIfAbsent(write.data().id(), write);
        }
    }

    public synchronized void clear() {
        pending.clear();
    }

    public synchronized int size() {
        return pending.size();
    }

    public synchronized boolean isEmpty() {
        return pending.isEmpty();
    }

    public int capacity() {
        return capacity;
    }

    public record BufferedWrite(Task data, Instant timestamp) {
    }
}
