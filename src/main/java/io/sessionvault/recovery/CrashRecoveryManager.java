package io.sessionvault.recovery;

import io.sessionvault.checkpoint.CheckpointManager;
import io.sessionvault.error.CrashRecoveryException;
import io.sessionvault.event.PersistenceEvent;
import io.sessionvault.event.PersistenceEventBus;
import io.sessionvault.event.PersistenceEventType;
import io.sessionvault.model.Checkpoint;
import io.sessionvault.model.CheckpointType;
import io.sessionvault.model.SessionMetadata;
import io.sessionvault.model.SessionState;
import io.sessionvault.session.SessionRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Restores the newest checkpoint of every crashed peer. Before each restore a
 * {@code crash_recovery} checkpoint of the current state is taken so the restore can be undone.
 */
public final class CrashRecoveryManager {
    private static final Logger log = LoggerFactory.getLogger(CrashRecoveryManager.class);

    private final SessionRegistry sessions;
    private final CheckpointManager checkpoints;
    private final PersistenceEventBus events;
    private final Clock clock;

    public CrashRecoveryManager(
            SessionRegistry sessions,
            CheckpointManager checkpoints,
            PersistenceEventBus events,
            Clock clock
    ) {
        this.sessions = sessions;
        this.checkpoints = checkpoints;
        this.events = events;
        this.clock = clock;
    }

    public RecoveryReport recover(String localSessionId, List<SessionMetadata> crashed, RecoveryHost host) {
        List<SessionRecovery> results = new ArrayList<>();
        if (crashed.isEmpty()) {
            return new RecoveryReport(results);
        }
        List<String> ids = new ArrayList<>();
        for (SessionMetadata session : crashed) {
            ids.add(session.sessionId());
        }
        log.info("Crash recovery started for {} sessions: {}", crashed.size(), ids);
        publish(localSessionId, PersistenceEventType.CRASH_RECOVERY_STARTED, Map.of(
                "crashedSessions", crashed.size(),
                "sessionIds", ids
        ));
        for (SessionMetadata session : crashed) {
            results.add(recoverSession(localSessionId, session, host));
        }
        return new RecoveryReport(results);
    }

    private SessionRecovery recoverSession(String localSessionId, SessionMetadata session, RecoveryHost host) {
        String crashedId = session.sessionId();
        Optional<Checkpoint> latest = checkpoints.latestForSession(crashedId);
        if (latest.isEmpty()) {
            log.warn("No checkpoint found for crashed session {}", crashedId);
            try {
                markCrashed(session);
            } catch (RuntimeException e) {
                log.warn("Could not mark session {} as crashed: {}", crashedId, e.getMessage());
            }
            publish(localSessionId, PersistenceEventType.CRASH_RECOVERY_NO_CHECKPOINT, Map.of(
                    "crashedSessionId", crashedId
            ));
            return new SessionRecovery(crashedId, Outcome.NO_CHECKPOINT, null, null, 0, 0, null);
        }
        Checkpoint source = latest.get();
        checkpoints.pin(source.id());
        try {
            Checkpoint safety = host.createCheckpoint(CheckpointType.CRASH_RECOVERY);
            CheckpointManager.RestoreSummary restored = host.restoreFromCheckpoint(source.id());
            markCrashed(session);
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("crashedSessionId", crashedId);
            payload.put("checkpointId", source.id());
            payload.put("safetyCheckpointId", safety.id());
            payload.put("tasksRestored", restored.tasksRestored());
            payload.put("queuesRestored", restored.queuesRestored());
            publish(localSessionId, PersistenceEventType.CRASH_RECOVERY_COMPLETED, payload);
            log.info("Recovered crashed session {} from checkpoint {}", crashedId, source.id());
            return new SessionRecovery(crashedId, Outcome.RECOVERED, source.id(), safety.id(),
                    restored.tasksRestored(), restored.queuesRestored(), null);
        } catch (RuntimeException e) {
            CrashRecoveryException failure = new CrashRecoveryException(crashedId, e);
            log.error(failure.getMessage(), e);
            Map<String, Object> payload = new LinkedHashMap<>();
            payload.put("crashedSessionId", crashedId);
            payload.put("checkpointId", source.id());
            payload.put("error", String.valueOf(e.getMessage()));
            publish(localSessionId, PersistenceEventType.CRASH_RECOVERY_FAILED, payload);
            return new SessionRecovery(crashedId, Outcome.FAILED, source.id(), null, 0, 0, failure.getMessage());
        } finally {
            checkpoints.unpin(source.id());
        }
    }

    private void markCrashed(SessionMetadata session) {
        Instant now = clock.instant();
        sessions.write(session.withState(SessionState.CRASHED).withEndTime(now));
    }

    private void publish(String sessionId, PersistenceEventType type, Map<String, Object> payload) {
        events.publish(new PersistenceEvent(type, sessionId, payload, clock.instant()));
    }

    public enum Outcome {
        RECOVERED,
        NO_CHECKPOINT,
        FAILED
    }

    public record SessionRecovery(
            String sessionId,
            Outcome outcome,
            String checkpointId,
            String safetyCheckpointId,
            int tasksRestored,
            int queuesRestored,
            String error
    ) {
    }

    public record RecoveryReport(List<SessionRecovery> sessions) {
        public long recoveredCount() {
            return sessions.stream().filter(s -> s.outcome() == Outcome.RECOVERED).count();
        }
    }
}
