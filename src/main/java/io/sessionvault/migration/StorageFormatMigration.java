package io.sessionvault.migration;

import com.fasterxml.jackson.databind.node.ObjectNode;

final class StorageFormatMigration implements SchemaMigration {
    static final String ID = "storage_1_1_0_to_1_2_0";

    @Override
    public String id() {
        return ID;
    }

    @Override
    public String description() {
        return "Add compression and encryption flags, creation index and tombstones";
    }

    @Override
    public DataKind kind() {
        return DataKind.STORAGE;
    }

    @Override
    public String fromVersion() {
        return "1.1.0";
    }

    @Override
    public String toVersion() {
        return "1.2.0";
    }

    @Override
    public boolean reversible() {
        return true;
    }

    @Override
    public ObjectNode migrate(ObjectNode data) {
        data.put("version", toVersion());
        ObjectNode metadata = objectField(data, "metadata");
        metadata.put("compressionEnabled", false);
        metadata.put("encryptionEnabled", false);
        ObjectNode indexes = objectField(data, "indexes");
        if (!indexes.path("byCreationDate").isArray()) {
            indexes.putArray("byCreationDate");
        }
        ObjectNode tombstones = data.putObject("tombstones");
        tombstones.putArray("tasks");
        tombstones.putArray("queues");
        return data;
    }

    @Override
    public ObjectNode rollback(ObjectNode data) {
        data.put("version", fromVersion());
        if (data.path("metadata").isObject()) {
            ObjectNode metadata = (ObjectNode) data.get("metadata");
            metadata.remove("compressionEnabled");
            metadata.remove("encryptionEnabled");
        }
        if (data.path("indexes").isObject()) {
            ((ObjectNode) data.get("indexes")).remove("byCreationDate");
        }
        data.remove("tombstones");
        return data;
    }

    @Override
    public boolean validate(ObjectNode data) {
        return data.has("version") && data.has("metadata") && data.has("tasks") && data.has("queues");
    }

    @Override
    public boolean validateAfter(ObjectNode data) {
        return data.path("tombstones").isObject();
    }

    private static ObjectNode objectField(ObjectNode data, String field) {
        if (data.path(field).isObject()) {
            return (ObjectNode) data.get(field);
        }
        return data.putObject(field);
    }
}
