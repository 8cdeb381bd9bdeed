package io.sessionvault.conflict;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.sessionvault.model.SessionMetadata;
import io.sessionvault.model.SessionState;
import io.sessionvault.model.Task;
import io.sessionvault.model.TaskStatus;
import io.sessionvault.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Detects concurrent writes of the same task by peer sessions and reconciles them with
 * the configured {@link ConflictStrategy}.
 */
public final class ConflictResolver {
    private static final Logger log = LoggerFactory.getLogger(ConflictResolver.class);
    static final int MAX_HISTORY_PER_CONFLICT = 100;
    static final String TASK_TYPE = "task";

    private final ConflictStrategy strategy;
    private final Clock clock;
    private final Map<String, Deque<ConflictResolution>> history = new HashMap<>();
    private final Map<String, Long> byStrategy = new LinkedHashMap<>();
    private final Map<String, Long> byType = new LinkedHashMap<>();
    private long totalConflicts;
    private long totalResolutionMicros;

    public ConflictResolver(ConflictStrategy strategy, Clock clock) {
        this.strategy = strategy;
        this.clock = clock;
    }

    public ConflictStrategy strategy() {
        return strategy;
    }

    public Optional<Conflict> detect(
            Task incoming,
            String localSessionId,
            Collection<SessionMetadata> peers,
            Function<String, Optional<Task>> storedCopy
    ) {
        for (SessionMetadata peer : peers) {
            if (peer.sessionId().equals(localSessionId) || peer.state() != SessionState.ACTIVE) {
                continue;
            }
            Optional<Task> stored = storedCopy.apply(incoming.id());
            if (stored.isEmpty() || stored.get().updatedAt() == null || incoming.updatedAt() == null) {
                continue;
            }
            if (stored.get().updatedAt().isAfter(incoming.updatedAt())) {
                return Optional.of(new Conflict(TASK_TYPE, incoming.id(), incoming, stored.get(),
                        List.of(localSessionId, peer.sessionId())));
            }
        }
        return Optional.empty();
    }

    public ConflictResolution resolve(Conflict conflict) {
        long startNs = System.nanoTime();
        Task resolved = switch (strategy) {
            case TIMESTAMP, MANUAL -> resolveByTimestamp(conflict);
            case MERGE -> resolveByMerging(conflict);
        };
        long micros = (System.nanoTime() - startNs) / 1_000L;
        ConflictResolution resolution = new ConflictResolution(
                conflict.conflictId(),
                strategy,
                clock.instant(),
                conflict.sessions(),
                resolved,
                micros
        );
        record(conflict, resolution);
        log.info("Resolved conflict {} between sessions {} using {}",
                conflict.conflictId(), conflict.sessions(), strategy.wireName());
        return resolution;
    }

    // last writer wins; ties keep the copy being saved
    static Task resolveByTimestamp(Conflict conflict) {
        Task current = conflict.currentData();
        Task conflicting = conflict.conflictingData();
        return conflicting.updatedAt().isAfter(current.updatedAt()) ? conflicting : current;
    }

    /**
     * Field-wise merge: the saved copy is the base, parameters are overlaid with the peer's,
     * tags and subtasks are unioned, and the more advanced status wins.
     */
    static Task resolveByMerging(Conflict conflict) {
        Task current = conflict.currentData();
        Task conflicting = conflict.conflictingData();
        ObjectNode parameters = Jsons.mapper().createObjectNode();
        if (current.parameters() != null) {
            parameters.setAll(current.parameters());
        }
        if (conflicting.parameters() != null) {
            parameters.setAll(conflicting.parameters());
        }
        return new Task(
                current.id(),
                current.name(),
                current.description(),
                current.type(),
                current.priority(),
                mostAdvanced(current, conflicting),
                current.createdAt(),
                conflicting.updatedAt().isAfter(current.updatedAt()) ? conflicting.updatedAt() : current.updatedAt(),
                current.dependencies(),
                union(current.tags(), conflicting.tags()),
                union(current.subtasks(), conflicting.subtasks()),
                current.parentTaskId(),
                current.scheduledAt(),
                current.context(),
                parameters,
                conflicting.result() != null ? conflicting.result() : current.result()
        );
    }

    private static TaskStatus mostAdvanced(Task current, Task conflicting) {
        return conflicting.status() != null && conflicting.status().isMoreAdvancedThan(current.status())
                ? conflicting.status()
                : current.status();
    }

    private static List<String> union(List<String> left, List<String> right) {
        Set<String> merged = new LinkedHashSet<>();
        if (left != null) {
            merged.addAll(left);
        }
        if (right != null) {
            merged.addAll(right);
        }
        return List.copyOf(merged);
    }

    private synchronized void record(Conflict conflict, ConflictResolution resolution) {
        Deque<ConflictResolution> records = history.computeIfAbsent(conflict.conflictId(), k -> new ArrayDeque<>());
        records.addLast(resolution);
        while (records.size() > MAX_HISTORY_PER_CONFLICT) {
            records.removeFirst();
        }
        totalConflicts++;
        totalResolutionMicros += resolution.durationMicros();
        byStrategy.merge(resolution.strategy().wireName(), 1L, Long::sum);
        byType.merge(conflict.type(), 1L, Long::sum);
    }

    public synchronized List<ConflictResolution> history(String conflictId) {
        Deque<ConflictResolution> records = history.get(conflictId);
        return records == null ? List.of() : new ArrayList<>(records);
    }

    public synchronized ConflictStats stats() {
        double averageMs = totalConflicts == 0 ? 0.0 : totalResolutionMicros / 1_000.0 / totalConflicts;
        return new ConflictStats(totalConflicts, new LinkedHashMap<>(byStrategy), new LinkedHashMap<>(byType), averageMs);
    }

    public record ConflictStats(
            long totalConflicts,
            Map<String, Long> byStrategy,
            Map<String, Long> byType,
            double averageResolutionTimeMs
    ) {
    }
}
