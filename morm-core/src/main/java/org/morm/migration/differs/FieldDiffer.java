package org.morm.migration.differs;

import org.morm.model.FieldSpec;
import org.morm.model.SchemaSnapshot;
import org.morm.model.change.AddField;
import org.morm.model.change.AddFieldUnique;
import org.morm.model.change.AlterField;
import org.morm.model.change.ChangeSet;
import org.morm.model.change.DropField;
import org.morm.model.change.DropFieldUnique;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.TreeSet;

/**
 * Column level changes, matched by field name in lexicographic order.
 * A renamed field shows up as one drop and one add.
 */
public class FieldDiffer implements Differ {

    static final String TYPE_OP_PREFIX = "TYPE ";

    @Override
    public void diff(SchemaSnapshot oldSnapshot, SchemaSnapshot newSnapshot, ChangeSet.Builder result) {
        TreeSet<String> names = new TreeSet<>(oldSnapshot.getFields().keySet());
        names.addAll(newSnapshot.getFields().keySet());

        for (String name : names) {
            FieldSpec oldField = oldSnapshot.field(name);
            FieldSpec newField = newSnapshot.field(name);

            if (oldField == null) {
                result.add(new AddField(newField));
                if (newField.isUnique()) {
                    result.add(new AddFieldUnique(name));
                }
            } else if (newField == null) {
                // the column's own constraints and indexes go with it
                result.add(new DropField(name));
            } else {
                List<String> ops = alterOps(oldField, newField);
                if (!ops.isEmpty()) {
                    result.add(new AlterField(name, ops));
                }
                if (oldField.isUnique() != newField.isUnique()) {
                    result.add(newField.isUnique() ? new AddFieldUnique(name) : new DropFieldUnique(name));
                }
            }
        }
    }

    /**
     * Ops to run for a modified field: the type change first, then the alter ops that are
     * new since the old definition. When only {@code onAdd} changed the current alter ops are
     * re-applied as a whole.
     */
    static List<String> alterOps(FieldSpec oldField, FieldSpec newField) {
        List<String> ops = new ArrayList<>();
        if (oldField.sameColumnDefinition(newField)) {
            return ops;
        }
        if (!normalize(oldField.getSqlType()).equals(normalize(newField.getSqlType()))) {
            ops.add(TYPE_OP_PREFIX + newField.getSqlType().trim());
        }
        for (String op : newField.getAlterOps()) {
            if (!oldField.getAlterOps().contains(op)) {
                ops.add(op);
            }
        }
        if (ops.isEmpty() && !Objects.equals(oldField.getOnAdd().trim(), newField.getOnAdd().trim())) {
            ops.addAll(newField.getAlterOps());
        }
        return ops;
    }

    private static String normalize(String s) {
        return s == null ? "" : s.trim().replaceAll("\\s+", " ");
    }
}
