package org.morm.model.change;

import org.morm.model.UniqueGroup;

public record AddUniqueGroup(UniqueGroup group) implements SchemaChange {
    @Override
    public String describe() {
        return "add unique group " + group.getGroupName() + " " + group.getFieldNames();
    }
}
