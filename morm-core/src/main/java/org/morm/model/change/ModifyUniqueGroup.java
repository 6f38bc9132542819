package org.morm.model.change;

import java.util.List;

/**
 * Members of a unique group changed. Always rendered as a drop followed by an add.
 */
public record ModifyUniqueGroup(String groupName, List<String> fieldNames) implements SchemaChange {

    public ModifyUniqueGroup {
        fieldNames = fieldNames == null ? List.of() : List.copyOf(fieldNames);
    }

    @Override
    public String describe() {
        return "change unique group " + groupName + " to " + fieldNames;
    }
}
