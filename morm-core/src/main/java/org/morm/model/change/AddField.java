package org.morm.model.change;

import org.morm.model.FieldSpec;

public record AddField(FieldSpec field) implements SchemaChange {
    @Override
    public String describe() {
        return "add field " + field.getName() + " " + field.getSqlType();
    }
}
