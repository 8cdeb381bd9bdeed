package io.sessionvault.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.sessionvault.config.SessionVaultConfig;
import io.sessionvault.error.StorageException;
import io.sessionvault.model.Task;
import io.sessionvault.model.TaskQueue;
import io.sessionvault.util.AtomicFiles;
import io.sessionvault.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * One pretty-printed JSON file per task ({@code tasks/<id>.json}) and per queue
 * ({@code queues/<id>.json}). A missing file is reported as empty, never as an error.
 * Before a task file is overwritten its previous content is copied to
 * {@code backups/<id>/<n>.json}; only the newest {@code maxBackupVersions} copies are kept.
 */
public final class TaskFileStore {
    private static final Logger log = LoggerFactory.getLogger(TaskFileStore.class);
    private static final String SUFFIX = ".json";

    private final SessionVaultConfig config;
    private final int maxBackupVersions;

    public TaskFileStore(SessionVaultConfig config) {
        this.config = config;
        this.maxBackupVersions = config.settings().maxBackupVersions();
    }

    public void saveTask(Task task) {
        Path file = taskFile(task.id());
        if (maxBackupVersions > 0 && Files.isRegularFile(file)) {
            backup(task.id(), file);
        }
        write(file, Jsons.toJson(task));
    }

    public List<Path> listTaskBackups(String taskId) {
        Path dir = config.backupsDir().resolve(safeFileName(taskId));
        List<Path> out = new ArrayList<>();
        for (long version : backupVersions(dir)) {
            out.add(dir.resolve(version + SUFFIX));
        }
        return out;
    }

    public Optional<Task> loadTask(String taskId) {
        return readTaskNode(taskId).map(node -> convert(node, Task.class, taskFile(taskId)));
    }

    public Optional<ObjectNode> readTaskNode(String taskId) {
        return readObject(taskFile(taskId));
    }

    public Task decodeTask(String taskId, JsonNode node) {
        return convert(node, Task.class, taskFile(taskId));
    }

    public void saveQueue(TaskQueue queue) {
        write(queueFile(queue.id()), Jsons.toJson(queue));
    }

    public Optional<TaskQueue> loadQueue(String queueId) {
        return readObject(queueFile(queueId)).map(node -> convert(node, TaskQueue.class, queueFile(queueId)));
    }

    public boolean deleteTask(String id, boolean isQueue) {
        Path file = isQueue ? queueFile(id) : taskFile(id);
        try {
            return Files.deleteIfExists(file);
        } catch (IOException e) {
            throw new StorageException("Failed to delete", file, e);
        }
    }

    // full scan; there is no secondary index
    public List<Task> queryTasks(TaskFilter filter) {
        TaskFilter effective = filter == null ? TaskFilter.all() : filter;
        List<Task> out = new ArrayList<>();
        for (String id : listTaskIds()) {
            loadTask(id).filter(effective::matches).ifPresent(out::add);
        }
        return out;
    }

    public Map<String, Task> loadAllTasks() {
        Map<String, Task> out = new LinkedHashMap<>();
        for (String id : listTaskIds()) {
            loadTask(id).ifPresent(task -> out.put(task.id(), task));
        }
        return out;
    }

    public Map<String, TaskQueue> loadAllQueues() {
        Map<String, TaskQueue> out = new LinkedHashMap<>();
        for (String id : listQueueIds()) {
            loadQueue(id).ifPresent(queue -> out.put(queue.id(), queue));
        }
        return out;
    }

    public List<String> listTaskIds() {
        return listIds(config.tasksDir());
    }

    public List<String> listQueueIds() {
        return listIds(config.queuesDir());
    }

    public int clear() {
        int removed = 0;
        for (String id : listTaskIds()) {
            if (deleteTask(id, false)) {
                removed++;
            }
        }
        for (String id : listQueueIds()) {
            if (deleteTask(id, true)) {
                removed++;
            }
        }
        return removed;
    }

    Path taskFile(String taskId) {
        return config.tasksDir().resolve(safeFileName(taskId) + SUFFIX);
    }

    Path queueFile(String queueId) {
        return config.queuesDir().resolve(safeFileName(queueId) + SUFFIX);
    }

    private static String safeFileName(String id) {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id must not be blank");
        }
        if (id.contains("/") || id.contains("\\") || id.contains("..")) {
            throw new IllegalArgumentException("id contains path characters: " + id);
        }
        return id;
    }

    private void backup(String taskId, Path file) {
        Path dir = config.backupsDir().resolve(safeFileName(taskId));
        try {
            Files.createDirectories(dir);
            List<Long> versions = backupVersions(dir);
            long next = versions.isEmpty() ? 1L : versions.get(0) + 1L;
            Files.copy(file, dir.resolve(next + SUFFIX), StandardCopyOption.REPLACE_EXISTING);
            versions.add(0, next);
            for (long stale : versions.subList(Math.min(maxBackupVersions, versions.size()), versions.size())) {
                Files.deleteIfExists(dir.resolve(stale + SUFFIX));
            }
        } catch (IOException e) {
            log.warn("Failed to back up task {} before overwrite: {}", taskId, e.getMessage());
        }
    }

    // descending
    private static List<Long> backupVersions(Path dir) {
        List<Long> versions = new ArrayList<>();
        if (!Files.isDirectory(dir)) {
            return versions;
        }
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, "*" + SUFFIX)) {
            for (Path file : stream) {
                String name = file.getFileName().toString();
                try {
                    versions.add(Long.parseLong(name.substring(0, name.length() - SUFFIX.length())));
                } catch (NumberFormatException e) {
                    log.debug("Ignoring foreign file {} in backup directory", file);
                }
            }
        } catch (IOException e) {
            throw new StorageException("Failed to list backups", dir, e);
        }
        versions.sort(Comparator.reverseOrder());
        return versions;
    }

    private List<String> listIds(Path dir) {
        if (!Files.isDirectory(dir)) {
            return List.of();
        }
        List<String> ids = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir, "*" + SUFFIX)) {
            for (Path file : stream) {
                String name = file.getFileName().toString();
                ids.add(name.substring(0, name.length() - SUFFIX.length()));
            }
        } catch (IOException e) {
            throw new StorageException("Failed to list directory", dir, e);
        }
        ids.sort(Comparator.naturalOrder());
        return ids;
    }

    private Optional<ObjectNode> readObject(Path file) {
        String raw;
        try {
            raw = Files.readString(file, StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            return Optional.empty();
        } catch (IOException e) {
            throw new StorageException("Failed to read", file, e);
        }
        try {
            JsonNode node = Jsons.mapper().readTree(raw);
            if (node == null || !node.isObject()) {
                throw new StorageException("Not a JSON object", file, null);
            }
            return Optional.of((ObjectNode) node);
        } catch (JsonProcessingException e) {
            throw new StorageException("Malformed JSON", file, e);
        }
    }

    private static <T> T convert(JsonNode node, Class<T> type, Path file) {
        try {
            return Jsons.mapper().treeToValue(node, type);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new StorageException("Failed to decode " + type.getSimpleName(), file, e);
        }
    }

    private static void write(Path target, String content) {
        try {
            AtomicFiles.writeString(target, content);
        } catch (IOException e) {
            throw new StorageException("Failed to write", target, e);
        }
    }
}
