package org.morm.model.change;

import org.morm.model.SchemaSnapshot;

/**
 * Full-create sentinel: the model has no baseline yet.
 */
public record CreateTable(SchemaSnapshot snapshot) implements SchemaChange {
    @Override
    public String describe() {
        return "create table " + snapshot.getTable() + " with fields " + snapshot.getFields().keySet();
    }
}
