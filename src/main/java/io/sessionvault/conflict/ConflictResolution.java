package io.sessionvault.conflict;

import io.sessionvault.model.Task;

import java.time.Instant;
import java.util.List;

public record ConflictResolution(
        String conflictId,
        ConflictStrategy strategy,
        Instant timestamp,
        List<String> sessions,
        Task resolvedData,
        long durationMicros
) {
}
