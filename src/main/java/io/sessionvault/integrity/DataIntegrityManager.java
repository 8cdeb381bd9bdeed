package io.sessionvault.integrity;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.sessionvault.error.TaskValidationException;
import io.sessionvault.error.ValidationCategory;
import io.sessionvault.model.Checkpoint;
import io.sessionvault.model.Task;
import io.sessionvault.model.TaskDependency;
import io.sessionvault.model.TaskStatus;
import io.sessionvault.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.regex.Pattern;

/**
 * Validates tasks before they are written, seals and verifies checkpoints, and repairs
 * known corruption patterns in raw task documents.
 */
public final class DataIntegrityManager {
    private static final Logger log = LoggerFactory.getLogger(DataIntegrityManager.class);

    public static final int MAX_NAME_LENGTH = 500;
    public static final int MAX_DESCRIPTION_LENGTH = 10_000;
    public static final int MAX_TAG_LENGTH = 50;
    public static final Duration FUTURE_UPDATE_TOLERANCE = Duration.ofMinutes(5);
    private static final Pattern ID_PATTERN = Pattern.compile("^[a-zA-Z0-9_-]{8,}$");

    private final Clock clock;
    private final Map<String, CorruptionDetector> detectors = new LinkedHashMap<>();
    private final AtomicLong validationsPassed = new AtomicLong();
    private final AtomicLong corruptionsDetected = new AtomicLong();
    private final AtomicLong corruptionsFixed = new AtomicLong();

    public DataIntegrityManager(Clock clock) {
        this.clock = clock;
        registerDetector(new MissingFieldsDetector());
        registerDetector(new InvalidTimestampsDetector(clock));
        registerDetector(new MalformedCollectionsDetector());
    }

    public void registerDetector(CorruptionDetector detector) {
        detectors.put(detector.type(), detector);
    }

    public List<String> detectorTypes() {
        return List.copyOf(detectors.keySet());
    }

    public void validateTaskData(Task task) {
        String taskId = task == null ? null : task.id();
        try {
            validateStructure(task);
            validateContent(task);
            validateBusinessRules(task);
            validateTemporal(task);
        } catch (TaskValidationException e) {
            corruptionsDetected.incrementAndGet();
            throw e;
        }
        validationsPassed.incrementAndGet();
        log.debug("Task {} passed validation", taskId);
    }

    private void validateStructure(Task task) {
        if (task == null) {
            throw structural(null, "task is null");
        }
        requireText(task, task.id(), "id");
        requireText(task, task.name(), "name");
        require(task, task.description(), "description");
        requireText(task, task.type(), "type");
        require(task, task.priority(), "priority");
        require(task, task.status(), "status");
        require(task, task.createdAt(), "createdAt");
        require(task, task.updatedAt(), "updatedAt");
        if (task.dependencies() == null) {
            throw structural(task.id(), "dependencies must be an array");
        }
        if (task.subtasks() == null) {
            throw structural(task.id(), "subtasks must be an array");
        }
        if (task.tags() == null) {
            throw structural(task.id(), "tags must be an array");
        }
    }

    private void validateContent(Task task) {
        if (task.name().length() > MAX_NAME_LENGTH) {
            throw content(task, "name exceeds " + MAX_NAME_LENGTH + " characters");
        }
        if (task.description().length() > MAX_DESCRIPTION_LENGTH) {
            throw content(task, "description exceeds " + MAX_DESCRIPTION_LENGTH + " characters");
        }
        if (!ID_PATTERN.matcher(task.id()).matches()) {
            throw content(task, "invalid id format: " + task.id());
        }
        for (TaskDependency dependency : task.dependencies()) {
            if (dependency == null || dependency.taskId() == null || dependency.taskId().isBlank()) {
                throw content(task, "dependency without taskId");
            }
            if (dependency.type() == null) {
                throw content(task, "dependency " + dependency.taskId() + " has no valid type");
            }
        }
        for (String tag : task.tags()) {
            if (tag == null || tag.isBlank()) {
                throw content(task, "empty tag");
            }
            if (tag.length() > MAX_TAG_LENGTH) {
                throw content(task, "tag exceeds " + MAX_TAG_LENGTH + " characters: " + tag);
            }
        }
    }

    private void validateBusinessRules(Task task) {
        if (task.id().equals(task.parentTaskId())) {
            throw new TaskValidationException(ValidationCategory.BUSINESS, task.id(), "task cannot be its own parent");
        }
        if (task.subtasks().contains(task.id())) {
            throw new TaskValidationException(ValidationCategory.BUSINESS, task.id(), "task cannot be its own subtask");
        }
        for (TaskDependency dependency : task.dependencies()) {
            if (task.id().equals(dependency.taskId())) {
                throw new TaskValidationException(ValidationCategory.BUSINESS, task.id(), "task cannot depend on itself");
            }
        }
        if (task.status() == TaskStatus.COMPLETED && (task.result() == null || task.result().isNull())) {
            log.warn("Task {} is completed but has no result", task.id());
        }
    }

    private void validateTemporal(Task task) {
        Instant now = clock.instant();
        if (task.createdAt().isAfter(now)) {
            throw temporal(task, "createdAt is in the future");
        }
        if (task.updatedAt().isBefore(task.createdAt())) {
            throw temporal(task, "updatedAt is before createdAt");
        }
        if (task.updatedAt().isAfter(now.plus(FUTURE_UPDATE_TOLERANCE))) {
            throw temporal(task, "updatedAt is too far in the future");
        }
        if (task.scheduledAt() != null && task.scheduledAt().isBefore(task.createdAt())) {
            throw temporal(task, "scheduledAt is before createdAt");
        }
    }

    public String calculateStateHash(Object state) {
        return StateHasher.hash(state);
    }

    // seal covers every header field except the hash itself
    public String calculateCheckpointHash(Checkpoint checkpoint) {
        Map<String, Object> sealed = new LinkedHashMap<>();
        sealed.put("id", checkpoint.id());
        sealed.put("timestamp", checkpoint.timestamp());
        sealed.put("sessionId", checkpoint.sessionId());
        sealed.put("type", checkpoint.type());
        sealed.put("size", checkpoint.size());
        sealed.put("activeTransactions", checkpoint.activeTransactions());
        sealed.put("tasks", checkpoint.taskSnapshot());
        sealed.put("queues", checkpoint.queueSnapshot());
        return StateHasher.hash(sealed);
    }

    public boolean validateCheckpointIntegrity(Checkpoint checkpoint) {
        try {
            if (checkpoint == null || checkpoint.id() == null || checkpoint.timestamp() == null
                    || checkpoint.sessionId() == null || checkpoint.integrityHash() == null) {
                log.warn("Checkpoint is missing header fields");
                return false;
            }
            if (checkpoint.taskSnapshot() == null || checkpoint.queueSnapshot() == null) {
                log.warn("Checkpoint {} has no snapshot", checkpoint.id());
                return false;
            }
            for (Map.Entry<String, Task> entry : checkpoint.taskSnapshot().entrySet()) {
                Task task = entry.getValue();
                if (task == null || !entry.getKey().equals(task.id())) {
                    log.warn("Checkpoint {} has task keyed {} with mismatching id", checkpoint.id(), entry.getKey());
                    return false;
                }
                validateTaskData(task);
            }
            String expected = calculateCheckpointHash(checkpoint);
            if (!expected.equals(checkpoint.integrityHash())) {
                log.warn("Checkpoint {} hash mismatch", checkpoint.id());
                return false;
            }
            return true;
        } catch (RuntimeException e) {
            log.warn("Checkpoint integrity check failed: {}", e.getMessage());
            return false;
        }
    }

    public boolean validateCheckpointIntegrity(Path checkpointFile) {
        String stored;
        Checkpoint checkpoint;
        try {
            stored = Files.readString(checkpointFile, StandardCharsets.UTF_8);
            checkpoint = Jsons.mapper().readValue(stored, Checkpoint.class);
        } catch (IOException | RuntimeException e) {
            log.warn("Checkpoint file {} unreadable: {}", checkpointFile, e.getMessage());
            return false;
        }
        return validateCheckpointIntegrity(checkpoint, stored);
    }

    /**
     * Checks a checkpoint decoded from {@code storedText}. The text must be exactly what the
     * decoded checkpoint serializes to, so edits that decoding would normalize away still fail.
     */
    public boolean validateCheckpointIntegrity(Checkpoint checkpoint, String storedText) {
        try {
            String rewritten = Jsons.toJson(checkpoint);
            if (!normalizeLineEndings(rewritten).equals(normalizeLineEndings(storedText))) {
                log.warn("Checkpoint {} file differs from its decoded form", checkpoint == null ? null : checkpoint.id());
                return false;
            }
        } catch (RuntimeException e) {
            log.warn("Checkpoint integrity check failed: {}", e.getMessage());
            return false;
        }
        return validateCheckpointIntegrity(checkpoint);
    }

    private static String normalizeLineEndings(String text) {
        return text == null ? "" : text.replace("\r\n", "\n");
    }

    public CorruptionReport detectAndRepairCorruption(ObjectNode data, RepairContext context) {
        long startNs = System.nanoTime();
        ObjectNode working = data.deepCopy();
        List<CorruptionIssue> issues = new ArrayList<>();
        List<RepairResult> repairs = new ArrayList<>();
        for (CorruptionDetector detector : detectors.values()) {
            Optional<CorruptionIssue> detected = detector.detect(working);
            if (detected.isEmpty()) {
                continue;
            }
            CorruptionIssue issue = detected.get();
            issues.add(issue);
            corruptionsDetected.incrementAndGet();
            if (!detector.autoRepair() || !context.allowAutoRepair()) {
                continue;
            }
            try {
                String method = detector.repair(working, issue, context);
                repairs.add(RepairResult.repaired(issue.type(), method));
                corruptionsFixed.incrementAndGet();
                log.warn("Repaired {} in {} using {}", issue.type(), context.expectedId(), method);
            } catch (RuntimeException e) {
                repairs.add(RepairResult.failed(issue.type(), e.getMessage()));
                log.warn("Repair of {} in {} failed: {}", issue.type(), context.expectedId(), e.getMessage());
            }
        }
        long repairedCount = repairs.stream().filter(RepairResult::success).count();
        boolean success = issues.isEmpty() || repairedCount == issues.size();
        long durationMs = (System.nanoTime() - startNs) / 1_000_000L;
        return new CorruptionReport(List.copyOf(issues), List.copyOf(repairs), working, success, durationMs);
    }

    public IntegrityStats integrityStats() {
        long passed = validationsPassed.get();
        long detected = corruptionsDetected.get();
        long fixed = corruptionsFixed.get();
        double successRate = passed + detected == 0 ? 100.0 : passed * 100.0 / (passed + detected);
        double repairRate = detected == 0 ? 100.0 : fixed * 100.0 / detected;
        return new IntegrityStats(passed, detected, fixed, successRate, repairRate);
    }

    public record IntegrityStats(
            long validationsPassed,
            long corruptionsDetected,
            long corruptionsFixed,
            double successRate,
            double repairRate
    ) {
    }

    private static void require(Task task, Object value, String field) {
        if (value == null) {
            throw structural(task.id(), "missing required field: " + field);
        }
    }

    private static void requireText(Task task, String value, String field) {
        if (value == null || value.isBlank()) {
            throw structural(task.id(), "missing required field: " + field);
        }
    }

    private static TaskValidationException structural(String taskId, String message) {
        return new TaskValidationException(ValidationCategory.STRUCTURAL, taskId, message);
    }

    private static TaskValidationException content(Task task, String message) {
        return new TaskValidationException(ValidationCategory.CONTENT, task.id(), message);
    }

    private static TaskValidationException temporal(Task task, String message) {
        return new TaskValidationException(ValidationCategory.TEMPORAL, task.id(), message);
    }
}
