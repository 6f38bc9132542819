package org.morm.model.change;

public record DropUniqueGroup(String groupName) implements SchemaChange {
    @Override
    public String describe() {
        return "drop unique group " + groupName;
    }
}
