package io.sessionvault.cache;

import io.sessionvault.TestFixtures;
import io.sessionvault.config.SessionVaultConfig;
import io.sessionvault.model.TaskStatus;
import io.sessionvault.storage.TaskFileStore;
import io.sessionvault.transaction.Transaction;
import io.sessionvault.transaction.TransactionCoordinator;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;

final class PerformanceOptimizerTest {
    private final TestFixtures.MutableClock clock = new TestFixtures.MutableClock(TestFixtures.T0);

    @Test
    void buffersUntilFlushAndKeepsLatestWritePerTask() throws Exception {
        Path root = Files.createTempDirectory("sessionvault-optimizer-");
        try {
            SessionVaultConfig config = TestFixtures.config(root);
            TaskFileStore storage = new TaskFileStore(config);
            TransactionCoordinator transactions = new TransactionCoordinator(clock);
            PerformanceOptimizer optimizer = new PerformanceOptimizer(config.settings(), storage, transactions, clock);

            Assertions.assertTrue(optimizer.save(TestFixtures.task("task-0001"), null));
            Assertions.assertTrue(optimizer.save(TestFixtures.task("task-0001").withStatus(TaskStatus.READY, TestFixtures.T0), null));
            Assertions.assertEquals(1, optimizer.writeBuffer().size());
            Assertions.assertTrue(storage.loadTask("task-0001").isEmpty());
            Assertions.assertEquals(TaskStatus.READY, optimizer.buffered("task-0001").orElseThrow().status());

            Assertions.assertEquals(1, optimizer.flushWriteBuffer());
            Assertions.assertEquals(TaskStatus.READY, storage.loadTask("task-0001").orElseThrow().status());
            Assertions.assertTrue(optimizer.writeBuffer().isEmpty());
            Assertions.assertEquals(1L, transactions.committedCount());
            Assertions.assertEquals(0, optimizer.flushWriteBuffer());
        } finally {
            TestFixtures.deleteRecursively(root);
        }
    }

    @Test
    void transactionalSaveWritesThrough() throws Exception {
        Path root = Files.createTempDirectory("sessionvault-optimizer-tx-");
        try {
            SessionVaultConfig config = TestFixtures.config(root);
            TaskFileStore storage = new TaskFileStore(config);
            TransactionCoordinator transactions = new TransactionCoordinator(clock);
            PerformanceOptimizer optimizer = new PerformanceOptimizer(config.settings(), storage, transactions, clock);
            optimizer.save(TestFixtures.task("task-0001"), null);

            Transaction tx = transactions.begin();
            Assertions.assertFalse(optimizer.save(TestFixtures.task("task-0002"), tx));

            Assertions.assertTrue(storage.loadTask("task-0001").isPresent());
            Assertions.assertTrue(storage.loadTask("task-0002").isPresent());
            Assertions.assertEquals("task-0002", tx.operations().get(0).entityId());
        } finally {
            TestFixtures.deleteRecursively(root);
        }
    }

    @Test
    void fullBufferFallsBackToDirectWrite() throws Exception {
        Path root = Files.createTempDirectory("sessionvault-optimizer-full-");
        try {
            SessionVaultConfig config = TestFixtures.config(root);
            TaskFileStore storage = new TaskFileStore(config);
            PerformanceOptimizer optimizer = new PerformanceOptimizer(config.settings(), storage,
                    new TransactionCoordinator(clock), clock);
            int capacity = optimizer.writeBuffer().capacity();
            for (int i = 0; i < capacity; i++) {
                Assertions.assertTrue(optimizer.save(TestFixtures.task(String.format("task-%04d", i)), null));
            }

            Assertions.assertFalse(optimizer.save(TestFixtures.task("task-overflow"), null));
            Assertions.assertEquals(capacity + 1, storage.listTaskIds().size());
            Assertions.assertTrue(optimizer.writeBuffer().isEmpty());
        } finally {
            TestFixtures.deleteRecursively(root);
        }
    }

    @Test
    void failedFlushRequeuesUnwrittenEntries() throws Exception {
        Path root = Files.createTempDirectory("sessionvault-optimizer-requeue-");
        try {
            SessionVaultConfig config = TestFixtures.config(root);
            TaskFileStore storage = new TaskFileStore(config);
            TransactionCoordinator transactions = new TransactionCoordinator(clock);
            PerformanceOptimizer optimizer = new PerformanceOptimizer(config.settings(), storage, transactions, clock);
            optimizer.save(TestFixtures.task("task-0001"), null);
            optimizer.save(TestFixtures.task("bad/../id"), null);
            optimizer.save(TestFixtures.task("task-0003"), null);

            Assertions.assertThrows(IllegalArgumentException.class, optimizer::flushWriteBuffer);

            Assertions.assertTrue(storage.loadTask("task-0001").isPresent());
            Assertions.assertEquals(2, optimizer.writeBuffer().size());
            Assertions.assertTrue(optimizer.buffered("task-0003").isPresent());
            Assertions.assertEquals(1L, transactions.rolledBackCount());
        } finally {
            TestFixtures.deleteRecursively(root);
        }
    }

    @Test
    void cacheIsInvalidatedBySave() throws Exception {
        Path root = Files.createTempDirectory("sessionvault-optimizer-cache-");
        try {
            SessionVaultConfig config = TestFixtures.config(root);
            PerformanceOptimizer optimizer = new PerformanceOptimizer(config.settings(), new TaskFileStore(config),
                    new TransactionCoordinator(clock), clock);
            optimizer.cache(TestFixtures.task("task-0001"));
            Assertions.assertTrue(optimizer.cached("task-0001").isPresent());

            optimizer.save(TestFixtures.task("task-0001"), null);

            Assertions.assertTrue(optimizer.cached("task-0001").isEmpty());
            optimizer.recordOperation("saveTask", 2_000_000L);
            Assertions.assertEquals(1L, optimizer.metrics().count("saveTask"));
        } finally {
            TestFixtures.deleteRecursively(root);
        }
    }
}
