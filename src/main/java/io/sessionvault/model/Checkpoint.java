package io.sessionvault.model;

import io.sessionvault.util.Jsons;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Immutable snapshot of every task and queue visible to one session at one instant.
 * {@code integrityHash} seals the snapshot together with the header fields.
 */
public record Checkpoint(
        String id,
        Instant timestamp,
        String sessionId,
        CheckpointType type,
        Map<String, Task> taskSnapshot,
        Map<String, TaskQueue> queueSnapshot,
        List<String> activeTransactions,
        long size,
        String integrityHash
) {
    public static long sizeOf(Map<String, Task> tasks, Map<String, TaskQueue> queues) {
        Map<String, Object> state = new LinkedHashMap<>();
        state.put("tasks", tasks);
        state.put("queues", queues);
        return Jsons.toCompactJson(state).getBytes(StandardCharsets.UTF_8).length;
    }

    public Checkpoint withIntegrityHash(String hash) {
        return new Checkpoint(id, timestamp, sessionId, type, taskSnapshot, queueSnapshot, activeTransactions, size, hash);
    }
}
