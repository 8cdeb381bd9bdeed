package io.sessionvault.observability;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.sessionvault.event.PersistenceEvent;
import io.sessionvault.util.Hashing;
import io.sessionvault.util.Jsons;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Append-only JSON-lines record of one session's lifecycle events. Each row carries the
 * hash of the previous row so that edits or deletions break the chain.
 */
public final class AuditLogger {
    private static final Logger log = LoggerFactory.getLogger(AuditLogger.class);

    private final Path auditFile;
    private final String sessionId;
    private String previousHash;

    public AuditLogger(Path auditFile, String sessionId) {
        this.auditFile = auditFile;
        this.sessionId = sessionId;
        try {
            Files.createDirectories(auditFile.getParent());
            if (!Files.exists(auditFile)) {
                try {
                    Files.createFile(auditFile);
                } catch (FileAlreadyExistsException ignored) {
                    // Created concurrently between exists() and createFile().
                }
            }
        } catch (IOException e) {
            throw new RuntimeException("Failed to initialize audit log file: " + auditFile, e);
        }
        this.previousHash = loadLastHash();
    }

    public synchronized void log(PersistenceEvent event) {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("timestamp", event.timestamp().toString());
        row.put("session_id", sessionId);
        row.put("event", event.type().wireName());
        row.put("error", event.type().isError());
        row.put("payload", Jsons.compactMapper().valueToTree(event.payload()));
        row.put("prev_hash", previousHash);
        String rowHash = Hashing.sha256Hex(Jsons.toCompactJson(row));
        row.put("hash", rowHash);
        String line = Jsons.toCompactJson(row) + System.lineSeparator();
        try {
            Files.writeString(auditFile, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND, StandardOpenOption.WRITE);
            previousHash = rowHash;
        } catch (IOException e) {
            throw new RuntimeException("Failed to write audit log", e);
        }
    }

    public synchronized String currentHash() {
        return previousHash;
    }

    public Path auditFile() {
        return auditFile;
    }

    public synchronized VerifyOutcome verify() {
        int checkedRows = 0;
        String expectedPrev = "";
        List<String> lines;
        try {
            lines = Files.readAllLines(auditFile, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new RuntimeException("Failed to verify audit log", e);
        }
        for (int i = 0; i < lines.size(); i++) {
            String line = lines.get(i);
            if (line == null || line.isBlank()) {
                continue;
            }
            JsonNode parsed;
            try {
                parsed = Jsons.mapper().readTree(line);
            } catch (JsonProcessingException e) {
                return new VerifyOutcome(false, checkedRows, i + 1, "invalid_json");
            }
            String hash = parsed.path("hash").asText("");
            if (!parsed.path("prev_hash").asText("").equals(expectedPrev)) {
                return new VerifyOutcome(false, checkedRows, i + 1, "prev_hash_mismatch");
            }
            ObjectNode canonical = parsed.deepCopy();
            canonical.remove("hash");
            if (!Hashing.sha256Hex(Jsons.toCompactJson(canonical)).equals(hash)) {
                return new VerifyOutcome(false, checkedRows, i + 1, "hash_mismatch");
            }
            checkedRows++;
            expectedPrev = hash;
        }
        return new VerifyOutcome(true, checkedRows, 0, "");
    }

    private String loadLastHash() {
        try {
            String last = "";
            for (String line : Files.readAllLines(auditFile, StandardCharsets.UTF_8)) {
                if (line != null && !line.isBlank()) {
                    last = line;
                }
            }
            if (last.isBlank()) {
                return "";
            }
            return Jsons.mapper().readTree(last).path("hash").asText("");
        } catch (IOException e) {
            log.warn("Audit log {} has an unreadable tail, starting a new chain: {}", auditFile, e.getMessage());
            return "";
        }
    }

    public record VerifyOutcome(boolean ok, int checkedRows, int brokenLine, String reason) {
    }
}
