package org.morm.model.change;

public record DropField(String fieldName) implements SchemaChange {
    @Override
    public String describe() {
        return "drop field " + fieldName;
    }
}
