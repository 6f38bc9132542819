package org.morm.model.change;

import java.util.List;

public record AlterField(String fieldName, List<String> ops) implements SchemaChange {

    public AlterField {
        ops = ops == null ? List.of() : List.copyOf(ops);
    }

    @Override
    public String describe() {
        return "alter field " + fieldName + " " + ops;
    }
}
