package org.morm.model.change;

public record AddIndex(String fieldName, String kind, String opClass) implements SchemaChange {
    @Override
    public String describe() {
        return "add " + kind + " index on " + fieldName + (opClass != null ? " (" + opClass + ")" : "");
    }
}
