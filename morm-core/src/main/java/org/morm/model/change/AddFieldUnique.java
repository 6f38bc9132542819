package org.morm.model.change;

public record AddFieldUnique(String fieldName) implements SchemaChange {
    @Override
    public String describe() {
        return "make field " + fieldName + " unique";
    }
}
