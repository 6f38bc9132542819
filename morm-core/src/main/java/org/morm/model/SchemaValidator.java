package org.morm.model;

import org.morm.exception.DeclarationException;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Declaration checks run when a model is described and again right before a unit is written,
 * so an invalid snapshot never produces SQL on disk.
 */
public final class SchemaValidator {

    /** Field names starting with this marker are reserved for the ORM itself. */
    public static final String RESERVED_MARKER = "_";

    private SchemaValidator() {
    }

    public static void validate(SchemaSnapshot snapshot) {
        List<String> errors = collectErrors(snapshot);
        if (!errors.isEmpty()) {
            String table = snapshot != null ? snapshot.getTable() : null;
            throw new DeclarationException("Invalid declaration for table '" + table + "': " + String.join("; ", errors));
        }
    }

    public static List<String> collectErrors(SchemaSnapshot snapshot) {
        List<String> errors = new ArrayList<>();
        if (snapshot == null) {
            errors.add("snapshot is null");
            return errors;
        }
        if (isBlank(snapshot.getTable())) {
            errors.add("table name must not be blank");
        }
        if (snapshot.getFields().isEmpty()) {
            errors.add("a table needs at least one field");
        }

        for (Map.Entry<String, FieldSpec> e : snapshot.getFields().entrySet()) {
            validateField(e.getKey(), e.getValue(), errors);
        }

        String pk = snapshot.getPrimaryKey();
        if (pk != null) {
            FieldSpec pkField = snapshot.field(pk);
            if (pkField == null) {
                errors.add("primary key '" + pk + "' is not a declared field");
            } else if (pkField.getOnAdd().toUpperCase(Locale.ROOT).contains("PRIMARY KEY")) {
                errors.add("primary key '" + pk + "' must not repeat PRIMARY KEY in its onAdd fragment");
            }
        }

        for (Map.Entry<String, UniqueGroup> e : snapshot.getUniqueGroups().entrySet()) {
            validateGroup(e.getKey(), e.getValue(), snapshot, errors);
        }
        return errors;
    }

    private static void validateField(String key, FieldSpec field, List<String> errors) {
        if (field == null) {
            errors.add("field '" + key + "' has no definition");
            return;
        }
        String name = field.getName();
        if (isBlank(name)) {
            errors.add("field name must not be blank");
            return;
        }
        if (!name.equals(key)) {
            errors.add("field '" + name + "' is registered under a different key '" + key + "'");
        }
        if (name.startsWith(RESERVED_MARKER)) {
            errors.add("field name '" + name + "' starts with reserved marker '" + RESERVED_MARKER + "'");
        }
        if (isBlank(field.getSqlType())) {
            errors.add("field '" + name + "' has no SQL type");
        }
        for (String op : field.getAlterOps()) {
            if (isBlank(op)) {
                errors.add("field '" + name + "' has a blank alter op");
            }
        }
        Set<String> kinds = new HashSet<>();
        for (String raw : field.getIndexSpecs()) {
            try {
                IndexSpec spec = IndexSpec.parse(raw);
                if (!kinds.add(spec.kind())) {
                    errors.add("field '" + name + "' lists index kind '" + spec.kind() + "' more than once");
                }
            } catch (RuntimeException ex) {
                errors.add("field '" + name + "': " + ex.getMessage());
            }
        }
    }

    private static void validateGroup(String key, UniqueGroup group, SchemaSnapshot snapshot, List<String> errors) {
        if (group == null || isBlank(group.getGroupName())) {
            errors.add("unique group '" + key + "' has no name");
            return;
        }
        if (!group.getGroupName().equals(key)) {
            errors.add("unique group '" + group.getGroupName() + "' is registered under a different key '" + key + "'");
        }
        if (group.getFieldNames().isEmpty()) {
            errors.add("unique group '" + key + "' has no fields");
        }
        Set<String> seen = new HashSet<>();
        for (String f : group.getFieldNames()) {
            if (!snapshot.getFields().containsKey(f)) {
                errors.add("unique group '" + key + "' references unknown field '" + f + "'");
            }
            if (!seen.add(f)) {
                errors.add("unique group '" + key + "' lists field '" + f + "' more than once");
            }
        }
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
