package org.morm.model.change;

public record DropFieldUnique(String fieldName) implements SchemaChange {
    @Override
    public String describe() {
        return "drop unique constraint of field " + fieldName;
    }
}
