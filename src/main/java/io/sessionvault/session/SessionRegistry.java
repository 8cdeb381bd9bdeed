package io.sessionvault.session;

import io.sessionvault.config.SessionVaultConfig;
import io.sessionvault.error.StorageException;
import io.sessionvault.model.SessionMetadata;
import io.sessionvault.model.SessionState;
import io.sessionvault.util.AtomicFiles;
import io.sessionvault.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Reads and writes {@code session-<id>.json} files and classifies peers by how long ago
 * they last reported activity.
 */
public final class SessionRegistry {
    private static final Logger log = LoggerFactory.getLogger(SessionRegistry.class);

    public static final Duration STALE_AFTER = Duration.ofMinutes(5);
    public static final Duration CRASHED_AFTER = Duration.ofMinutes(10);
    public static final Duration CLEANUP_AFTER = Duration.ofMinutes(30);
    private static final String FILE_PREFIX = "session-";
    private static final String FILE_SUFFIX = ".json";

    private final SessionVaultConfig config;
    private final Clock clock;

    public SessionRegistry(SessionVaultConfig config, Clock clock) {
        this.config = config;
        this.clock = clock;
    }

    public void write(SessionMetadata session) {
        Path file = config.sessionFile(session.sessionId());
        try {
            AtomicFiles.writeString(file, Jsons.toJson(session));
        } catch (IOException e) {
            throw new StorageException("Failed to write session file", file, e);
        }
    }

    public Optional<SessionMetadata> read(String sessionId) {
        Path file = config.sessionFile(sessionId);
        if (!Files.isRegularFile(file)) {
            return Optional.empty();
        }
        return Optional.ofNullable(readFile(file));
    }

    public List<SessionMetadata> readAll() {
        Path dir = config.sessionsDir();
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        List<SessionMetadata> sessions = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, FILE_PREFIX + "*" + FILE_SUFFIX)) {
            for (Path file : stream) {
                SessionMetadata session = readFile(file);
                if (session != null) {
                    sessions.add(session);
                }
            }
        } catch (IOException e) {
            throw new StorageException("Failed to list session files", dir, e);
        }
        sessions.sort(Comparator.comparing(SessionMetadata::startTime, Comparator.nullsFirst(Comparator.<Instant>naturalOrder())));
        return sessions;
    }

    public boolean delete(String sessionId) {
        Path file = config.sessionFile(sessionId);
        try {
            return Files.deleteIfExists(file);
        } catch (IOException e) {
            throw new StorageException("Failed to delete session file", file, e);
        }
    }

    public List<SessionMetadata> livePeers(String localSessionId) {
        Instant now = clock.instant();
        List<SessionMetadata> live = new ArrayList<>();
        for (SessionMetadata session : readAll()) {
            if (session.sessionId().equals(localSessionId)) {
                continue;
            }
            if (session.state() == SessionState.ACTIVE && !isStale(session, now)) {
                live.add(session);
            }
        }
        return live;
    }

    /**
     * Splits peers found at startup. A session still marked active but silent for more than
     * {@link #CRASHED_AFTER} is crashed; any other session silent for more than
     * {@link #STALE_AFTER} is treated as inactive. The crash check runs first so that a
     * crashed peer is not hidden by the stale marking.
     */
    public Classification classifyPeers(String localSessionId) {
        Instant now = clock.instant();
        List<SessionMetadata> crashed = new ArrayList<>();
        List<SessionMetadata> inactive = new ArrayList<>();
        List<SessionMetadata> live = new ArrayList<>();
        for (SessionMetadata session : readAll()) {
            if (session.sessionId().equals(localSessionId)) {
                continue;
            }
            if (isCrashed(session, now)) {
                crashed.add(session);
            } else if (session.state() != SessionState.ACTIVE || isStale(session, now)) {
                inactive.add(session.state() == SessionState.ACTIVE ? session.withState(SessionState.INACTIVE) : session);
            } else {
                live.add(session);
            }
        }
        return new Classification(crashed, inactive, live);
    }

    public List<String> cleanupInactive(String localSessionId) {
        Instant cutoff = clock.instant().minus(CLEANUP_AFTER);
        List<String> removed = new ArrayList<>();
        for (SessionMetadata session : readAll()) {
            if (session.sessionId().equals(localSessionId) || session.lastActivity() == null) {
                continue;
            }
            boolean notRunning = session.state() != SessionState.ACTIVE || isStale(session, clock.instant());
            if (notRunning && session.lastActivity().isBefore(cutoff) && delete(session.sessionId())) {
                removed.add(session.sessionId());
                log.info("Removed inactive session {} (last activity {})", session.sessionId(), session.lastActivity());
            }
        }
        return removed;
    }

    public static boolean isCrashed(SessionMetadata session, Instant now) {
        return session.state() == SessionState.ACTIVE
                && session.lastActivity() != null
                && session.lastActivity().isBefore(now.minus(CRASHED_AFTER));
    }

    public static boolean isStale(SessionMetadata session, Instant now) {
        return session.lastActivity() == null || session.lastActivity().isBefore(now.minus(STALE_AFTER));
    }

    private SessionMetadata readFile(Path file) {
        try {
            SessionMetadata session = Jsons.mapper().readValue(Files.readString(file, StandardCharsets.UTF_8), SessionMetadata.class);
            if (session.sessionId() == null) {
                log.warn("Skipping session file without id: {}", file);
                return null;
            }
            return session;
        } catch (IOException e) {
            log.warn("Skipping unreadable session file {}: {}", file, e.getMessage());
            return null;
        }
    }

    public record Classification(
            List<SessionMetadata> crashed,
            List<SessionMetadata> inactive,
            List<SessionMetadata> live
    ) {
    }
}
