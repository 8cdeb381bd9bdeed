package io.sessionvault.migration;

import com.fasterxml.jackson.databind.node.ObjectNode;

public interface SchemaMigration {
    String id();

    String description();

    DataKind kind();

    String fromVersion();

    String toVersion();

    boolean reversible();

    ObjectNode migrate(ObjectNode data);

    default ObjectNode rollback(ObjectNode data) {
        throw new UnsupportedOperationException("Migration " + id() + " is not reversible");
    }

    boolean validate(ObjectNode data);

    boolean validateAfter(ObjectNode data);
}
