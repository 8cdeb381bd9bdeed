package io.sessionvault.model;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.Instant;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record SessionMetadata(
        String sessionId,
        Instant startTime,
        Instant endTime,
        Instant lastActivity,
        SessionState state,
        ProcessInfo processInfo,
        Statistics statistics
) {
    public static SessionMetadata start(String sessionId, Instant now) {
        return new SessionMetadata(sessionId, now, null, now, SessionState.ACTIVE, ProcessInfo.current(), Statistics.empty());
    }

    public SessionMetadata withState(SessionState newState) {
        return new SessionMetadata(sessionId, startTime, endTime, lastActivity, newState, processInfo, statistics);
    }

    public SessionMetadata withLastActivity(Instant at) {
        return new SessionMetadata(sessionId, startTime, endTime, at, state, processInfo, statistics);
    }

    public SessionMetadata withEndTime(Instant at) {
        return new SessionMetadata(sessionId, startTime, at, lastActivity, state, processInfo, statistics);
    }

    public SessionMetadata withStatistics(Statistics newStatistics) {
        return new SessionMetadata(sessionId, startTime, endTime, lastActivity, state, processInfo, newStatistics);
    }

    public record ProcessInfo(long pid, String osName, String javaVersion, String hostName) {
        public static ProcessInfo current() {
            String host;
            try {
                host = InetAddress.getLocalHost().getHostName();
            } catch (UnknownHostException e) {
                host = "unknown";
            }
            return new ProcessInfo(
                    ProcessHandle.current().pid(),
                    System.getProperty("os.name", "unknown"),
                    System.getProperty("java.version", "unknown"),
                    host
            );
        }
    }

    public record Statistics(
            long tasksProcessed,
            long transactionsCommitted,
            long errorsEncountered,
            long totalOperations
    ) {
        public static Statistics empty() {
            return new Statistics(0L, 0L, 0L, 0L);
        }
    }
}
