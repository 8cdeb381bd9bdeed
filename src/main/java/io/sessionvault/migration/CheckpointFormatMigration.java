package io.sessionvault.migration;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.sessionvault.integrity.DataIntegrityManager;
import io.sessionvault.model.Checkpoint;
import io.sessionvault.model.CheckpointType;
import io.sessionvault.util.Jsons;

final class CheckpointFormatMigration implements SchemaMigration {
    static final String ID = "checkpoint_1_0_0_to_2_0_0";

    private final DataIntegrityManager integrity;

    CheckpointFormatMigration(DataIntegrityManager integrity) {
        this.integrity = integrity;
    }

    @Override
    public String id() {
        return ID;
    }

    @Override
    public String description() {
        return "Add integrity hash, size, type and active transactions to checkpoints";
    }

    @Override
    public DataKind kind() {
        return DataKind.CHECKPOINT;
    }

    @Override
    public String fromVersion() {
        return "1.0.0";
    }

    @Override
    public String toVersion() {
        return "2.0.0";
    }

    @Override
    public boolean reversible() {
        return false;
    }

    @Override
    public ObjectNode migrate(ObjectNode data) {
        if (!data.hasNonNull("type")) {
            data.put("type", CheckpointType.MANUAL.wireName());
        }
        if (!data.path("activeTransactions").isArray()) {
            data.putArray("activeTransactions");
        }
        data.put("size", 0L);
        data.put("integrityHash", "");
        try {
            Checkpoint decoded = Jsons.mapper().treeToValue(data, Checkpoint.class);
            Checkpoint sized = new Checkpoint(decoded.id(), decoded.timestamp(), decoded.sessionId(), decoded.type(),
                    decoded.taskSnapshot(), decoded.queueSnapshot(), decoded.activeTransactions(),
                    Checkpoint.sizeOf(decoded.taskSnapshot(), decoded.queueSnapshot()), null);
            data.put("size", sized.size());
            data.put("integrityHash", integrity.calculateCheckpointHash(sized));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Checkpoint document cannot be decoded: " + e.getOriginalMessage(), e);
        }
        return data;
    }

    @Override
    public boolean validate(ObjectNode data) {
        return data.hasNonNull("id") && data.path("taskSnapshot").isObject() && data.path("queueSnapshot").isObject();
    }

    @Override
    public boolean validateAfter(ObjectNode data) {
        return data.path("integrityHash").isTextual() && !data.path("integrityHash").asText().isEmpty()
                && data.path("size").isNumber();
    }
}
