package org.morm.model.change;

public record DropTable(String table) implements SchemaChange {
    @Override
    public String describe() {
        return "drop table " + table;
    }
}
