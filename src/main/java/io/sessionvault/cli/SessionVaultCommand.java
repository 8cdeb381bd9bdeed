package io.sessionvault.cli;

import io.sessionvault.checkpoint.CheckpointManager;
import io.sessionvault.config.SessionVaultConfig;
import io.sessionvault.model.Checkpoint;
import io.sessionvault.model.CheckpointType;
import io.sessionvault.model.SessionMetadata;
import io.sessionvault.model.Task;
import io.sessionvault.model.TaskStatus;
import io.sessionvault.observability.PrometheusFormatter;
import io.sessionvault.runtime.CrossSessionPersistenceEngine;
import io.sessionvault.session.SessionRegistry;
import io.sessionvault.storage.TaskFilter;
import io.sessionvault.util.Jsons;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;

@Command(
        name = "sessionvault",
        mixinStandardHelpOptions = true,
        description = "Cross-session task persistence engine CLI",
        subcommands = {
                SessionVaultCommand.InitCommand.class,
                SessionVaultCommand.SaveCommand.class,
                SessionVaultCommand.LoadCommand.class,
                SessionVaultCommand.QueryCommand.class,
                SessionVaultCommand.CheckpointCommand.class,
                SessionVaultCommand.CheckpointsCommand.class,
                SessionVaultCommand.RestoreCommand.class,
                SessionVaultCommand.VerifyCheckpointCommand.class,
                SessionVaultCommand.StatsCommand.class,
                SessionVaultCommand.MetricsCommand.class,
                SessionVaultCommand.SessionsCommand.class,
                SessionVaultCommand.RunCommand.class
        }
)
public final class SessionVaultCommand implements Runnable {
    @Option(names = {"--storage-dir"}, description = "Task and queue storage directory", defaultValue = SessionVaultConfig.DEFAULT_STORAGE_DIR)
    String storageDir;

    @Option(names = {"--settings"}, description = "Settings JSON file (defaults to sessionvault-settings.json next to the storage directory)")
    Path settingsFile;

    @Override
    public void run() {
        System.out.println("Use subcommands: init | save | load | query | checkpoint | checkpoints | restore | verify-checkpoint | stats | metrics | sessions | run");
    }

    SessionVaultConfig config() {
        return settingsFile == null
                ? SessionVaultConfig.fromStorageDir(storageDir)
                : SessionVaultConfig.fromStorageDir(storageDir, settingsFile);
    }

    // one-shot commands end with a forced shutdown so they leave no checkpoint behind
    CrossSessionPersistenceEngine engine() {
        CrossSessionPersistenceEngine engine = new CrossSessionPersistenceEngine(config());
        engine.initialize();
        return engine;
    }

    @Command(name = "init", description = "Create the storage layout and register a session")
    static final class InitCommand implements Callable<Integer> {
        @ParentCommand
        SessionVaultCommand parent;

        @Override
        public Integer call() {
            CrossSessionPersistenceEngine engine = parent.engine();
            engine.shutdown(true);
            System.out.println("Initialized session vault at: " + engine.config().storageDir());
            return 0;
        }
    }

    @Command(name = "save", description = "Save a task read from a JSON file")
    static final class SaveCommand implements Callable<Integer> {
        @ParentCommand
        SessionVaultCommand parent;

        @Option(names = {"--file"}, required = true, description = "Task JSON file")
        Path file;

        @Override
        public Integer call() throws Exception {
            Task task = Jsons.mapper().readValue(Files.readString(file, StandardCharsets.UTF_8), Task.class);
            CrossSessionPersistenceEngine engine = parent.engine();
            try {
                CrossSessionPersistenceEngine.SaveResult result = engine.saveTask(task);
                engine.flushWriteBuffer();
                Map<String, Object> out = new LinkedHashMap<>();
                out.put("taskId", result.taskId());
                out.put("operationId", result.operationId());
                out.put("conflictId", result.conflictId());
                out.put("durationMs", result.durationMs());
                System.out.println(Jsons.toJson(out));
                return 0;
            } finally {
                engine.shutdown(true);
            }
        }
    }

    @Command(name = "load", description = "Print a task by id")
    static final class LoadCommand implements Callable<Integer> {
        @ParentCommand
        SessionVaultCommand parent;

        @Parameters(index = "0", description = "Task id")
        String taskId;

        @Override
        public Integer call() {
            CrossSessionPersistenceEngine engine = parent.engine();
            try {
                Optional<Task> task = engine.loadTask(taskId, false);
                if (task.isEmpty()) {
                    System.out.println("{\"error\":\"task not found\"}");
                    return 1;
                }
                System.out.println(Jsons.toJson(task.get()));
                return 0;
            } finally {
                engine.shutdown(true);
            }
        }
    }

    @Command(name = "query", description = "List tasks matching the given filters")
    static final class QueryCommand implements Callable<Integer> {
        @ParentCommand
        SessionVaultCommand parent;

        @Option(names = {"--status"}, split = ",", description = "Status filter, comma separated")
        List<String> statuses;

        @Option(names = {"--type"}, description = "Task type")
        String type;

        @Option(names = {"--tag"}, description = "Required tag")
        String tag;

        @Option(names = {"--parent"}, description = "Parent task id")
        String parentTaskId;

        @Override
        public Integer call() {
            Set<TaskStatus> parsed = new LinkedHashSet<>();
            if (statuses != null) {
                for (String status : statuses) {
                    parsed.add(TaskStatus.fromString(status));
                }
            }
            TaskFilter filter = new TaskFilter(parsed, type, tag, null, parentTaskId);
            CrossSessionPersistenceEngine engine = parent.engine();
            try {
                System.out.println(Jsons.toJson(engine.queryTasks(filter)));
                return 0;
            } finally {
                engine.shutdown(true);
            }
        }
    }

    @Command(name = "checkpoint", description = "Create a manual checkpoint")
    static final class CheckpointCommand implements Callable<Integer> {
        @ParentCommand
        SessionVaultCommand parent;

        @Override
        public Integer call() {
            CrossSessionPersistenceEngine engine = parent.engine();
            try {
                Checkpoint checkpoint = engine.createCheckpoint(CheckpointType.MANUAL);
                System.out.println(Jsons.toJson(summary(checkpoint)));
                return 0;
            } finally {
                engine.shutdown(true);
            }
        }
    }

    @Command(name = "checkpoints", description = "List retained checkpoints, newest first")
    static final class CheckpointsCommand implements Callable<Integer> {
        @ParentCommand
        SessionVaultCommand parent;

        @Override
        public Integer call() {
            CrossSessionPersistenceEngine engine = parent.engine();
            try {
                List<Map<String, Object>> out = new ArrayList<>();
                for (Checkpoint checkpoint : engine.listCheckpoints()) {
                    out.add(summary(checkpoint));
                }
                System.out.println(Jsons.toJson(out));
                return 0;
            } finally {
                engine.shutdown(true);
            }
        }
    }

    @Command(name = "restore", description = "Replace current state with a checkpoint")
    static final class RestoreCommand implements Callable<Integer> {
        @ParentCommand
        SessionVaultCommand parent;

        @Parameters(index = "0", description = "Checkpoint id")
        String checkpointId;

        @Override
        public Integer call() {
            CrossSessionPersistenceEngine engine = parent.engine();
            try {
                CheckpointManager.RestoreSummary summary = engine.restoreFromCheckpoint(checkpointId);
                System.out.println(Jsons.toJson(summary));
                return 0;
            } finally {
                engine.shutdown(true);
            }
        }
    }

    @Command(name = "verify-checkpoint", description = "Check a checkpoint file against its integrity hash")
    static final class VerifyCheckpointCommand implements Callable<Integer> {
        @ParentCommand
        SessionVaultCommand parent;

        @Parameters(index = "0", description = "Checkpoint id")
        String checkpointId;

        @Override
        public Integer call() {
            CrossSessionPersistenceEngine engine = parent.engine();
            try {
                boolean ok = engine.verifyCheckpoint(checkpointId);
                System.out.println(Jsons.toJson(Map.of("checkpointId", checkpointId, "ok", ok)));
                return ok ? 0 : 2;
            } finally {
                engine.shutdown(true);
            }
        }
    }

    @Command(name = "stats", description = "Print session statistics as JSON")
    static final class StatsCommand implements Callable<Integer> {
        @ParentCommand
        SessionVaultCommand parent;

        @Override
        public Integer call() {
            CrossSessionPersistenceEngine engine = parent.engine();
            try {
                System.out.println(Jsons.toJson(engine.getSessionStatistics()));
                return 0;
            } finally {
                engine.shutdown(true);
            }
        }
    }

    @Command(name = "metrics", description = "Print Prometheus metrics text")
    static final class MetricsCommand implements Callable<Integer> {
        @ParentCommand
        SessionVaultCommand parent;

        @Override
        public Integer call() {
            CrossSessionPersistenceEngine engine = parent.engine();
            try {
                System.out.print(PrometheusFormatter.format(engine.getSessionStatistics()));
                return 0;
            } finally {
                engine.shutdown(true);
            }
        }
    }

    @Command(name = "sessions", description = "List session files without starting a session")
    static final class SessionsCommand implements Callable<Integer> {
        @ParentCommand
        SessionVaultCommand parent;

        @Override
        public Integer call() {
            SessionRegistry registry = new SessionRegistry(parent.config(), Clock.systemUTC());
            List<SessionMetadata> sessions = registry.readAll();
            System.out.println(Jsons.toJson(sessions));
            return 0;
        }
    }

    @Command(name = "run", description = "Keep a session alive with heartbeats, periodic checkpoints and buffer flushes")
    static final class RunCommand implements Callable<Integer> {
        @ParentCommand
        SessionVaultCommand parent;

        @Override
        public Integer call() throws Exception {
            CrossSessionPersistenceEngine engine = parent.engine();
            CountDownLatch stopped = new CountDownLatch(1);
            Thread.setDefaultUncaughtExceptionHandler((thread, error) -> {
                engine.handleCrash(error);
                stopped.countDown();
            });
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                engine.shutdown(false);
                stopped.countDown();
            }, "sessionvault-shutdown-hook"));
            System.out.println("Session " + engine.sessionId() + " running at " + engine.config().storageDir());
            stopped.await();
            return 0;
        }
    }

    private static Map<String, Object> summary(Checkpoint checkpoint) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("id", checkpoint.id());
        out.put("timestamp", checkpoint.timestamp());
        out.put("sessionId", checkpoint.sessionId());
        out.put("type", checkpoint.type());
        out.put("tasks", checkpoint.taskSnapshot().size());
        out.put("queues", checkpoint.queueSnapshot().size());
        out.put("size", checkpoint.size());
        return out;
    }
}
