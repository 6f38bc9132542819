package org.morm.model.change;

public record DropIndex(String fieldName, String kind) implements SchemaChange {
    @Override
    public String describe() {
        return "drop " + kind + " index on " + fieldName;
    }
}
