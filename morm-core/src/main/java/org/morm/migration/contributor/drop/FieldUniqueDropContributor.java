package org.morm.migration.contributor.drop;

import org.morm.migration.contributor.DdlContributor;
import org.morm.migration.dialect.DdlDialect;
import org.morm.naming.Naming;

import java.util.List;

public record FieldUniqueDropContributor(String table, String fieldName) implements DdlContributor {
    @Override
    public int priority() {
        return 10; // Constraint Drop
    }

    @Override
    public void contribute(List<String> statements, DdlDialect dialect, Naming naming) {
        statements.add(dialect.getDropConstraintSql(table, naming.fieldUniqueConstraint(table, fieldName)));
    }
}
