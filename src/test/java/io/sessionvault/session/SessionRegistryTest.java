package io.sessionvault.session;

import io.sessionvault.TestFixtures;
import io.sessionvault.config.SessionVaultConfig;
import io.sessionvault.model.SessionMetadata;
import io.sessionvault.model.SessionState;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

final class SessionRegistryTest {
    private final TestFixtures.MutableClock clock = new TestFixtures.MutableClock(TestFixtures.T0);

    @Test
    void classifiesPeersByLastActivity() throws Exception {
        Path root = Files.createTempDirectory("sessionvault-sessions-");
        try {
            SessionRegistry registry = new SessionRegistry(TestFixtures.config(root), clock);
            registry.write(SessionMetadata.start("local", TestFixtures.T0));
            registry.write(SessionMetadata.start("crashed", TestFixtures.T0.minus(Duration.ofMinutes(11))));
            registry.write(SessionMetadata.start("quiet", TestFixtures.T0.minus(Duration.ofMinutes(9))));
            registry.write(SessionMetadata.start("live", TestFixtures.T0.minus(Duration.ofMinutes(1))));
            registry.write(SessionMetadata.start("done", TestFixtures.T0.minus(Duration.ofHours(1)))
                    .withState(SessionState.TERMINATED));

            SessionRegistry.Classification peers = registry.classifyPeers("local");

            Assertions.assertEquals(List.of("crashed"), ids(peers.crashed()));
            Assertions.assertEquals(List.of("live"), ids(peers.live()));
            Assertions.assertEquals(2, peers.inactive().size());
            Assertions.assertTrue(ids(peers.inactive()).contains("quiet"));
            Assertions.assertTrue(ids(peers.inactive()).contains("done"));
            Assertions.assertEquals(List.of("live"), ids(registry.livePeers("local")));
        } finally {
            TestFixtures.deleteRecursively(root);
        }
    }

    @Test
    void crashThresholdIsTenMinutesOfSilence() {
        SessionMetadata eleven = SessionMetadata.start("s1", TestFixtures.T0.minus(Duration.ofMinutes(11)));
        SessionMetadata nine = SessionMetadata.start("s2", TestFixtures.T0.minus(Duration.ofMinutes(9)));

        Assertions.assertTrue(SessionRegistry.isCrashed(eleven, TestFixtures.T0));
        Assertions.assertFalse(SessionRegistry.isCrashed(nine, TestFixtures.T0));
        Assertions.assertTrue(SessionRegistry.isStale(nine, TestFixtures.T0));
        Assertions.assertFalse(SessionRegistry.isCrashed(eleven.withState(SessionState.TERMINATED), TestFixtures.T0));
    }

    @Test
    void cleanupRemovesLongInactiveSessions() throws Exception {
        Path root = Files.createTempDirectory("sessionvault-sessions-cleanup-");
        try {
            SessionVaultConfig config = TestFixtures.config(root);
            SessionRegistry registry = new SessionRegistry(config, clock);
            registry.write(SessionMetadata.start("local", TestFixtures.T0.minus(Duration.ofHours(2))));
            registry.write(SessionMetadata.start("old", TestFixtures.T0.minus(Duration.ofMinutes(31)))
                    .withState(SessionState.TERMINATED));
            registry.write(SessionMetadata.start("recent", TestFixtures.T0.minus(Duration.ofMinutes(20)))
                    .withState(SessionState.TERMINATED));

            Assertions.assertEquals(List.of("old"), registry.cleanupInactive("local"));
            Assertions.assertFalse(Files.exists(config.sessionFile("old")));
            Assertions.assertTrue(registry.read("recent").isPresent());
            Assertions.assertTrue(registry.read("local").isPresent());
        } finally {
            TestFixtures.deleteRecursively(root);
        }
    }

    @Test
    void skipsUnreadableSessionFiles() throws Exception {
        Path root = Files.createTempDirectory("sessionvault-sessions-bad-");
        try {
            SessionVaultConfig config = TestFixtures.config(root);
            SessionRegistry registry = new SessionRegistry(config, clock);
            registry.write(SessionMetadata.start("good", TestFixtures.T0));
            Files.writeString(config.sessionFile("broken"), "{oops", StandardCharsets.UTF_8);

            Assertions.assertEquals(List.of("good"), ids(registry.readAll()));
        } finally {
            TestFixtures.deleteRecursively(root);
        }
    }

    private static List<String> ids(List<SessionMetadata> sessions) {
        return sessions.stream().map(SessionMetadata::sessionId).sorted().toList();
    }
}
