package org.morm.migration.contributor.create;

import org.morm.migration.contributor.DdlContributor;
import org.morm.migration.dialect.DdlDialect;
import org.morm.naming.Naming;

import java.util.List;

public record FieldUniqueAddContributor(String table, String fieldName) implements DdlContributor {
    @Override
    public int priority() {
        return 70; // Constraint Add
    }

    @Override
    public void contribute(List<String> statements, DdlDialect dialect, Naming naming) {
        statements.add(dialect.getAddUniqueConstraintSql(table, naming.fieldUniqueConstraint(table, fieldName), List.of(fieldName)));
    }
}
