package org.morm.migration.contributor.create;

import org.morm.exception.GenerationException;
import org.morm.migration.contributor.DdlContributor;
import org.morm.migration.dialect.DdlDialect;
import org.morm.model.FieldSpec;
import org.morm.naming.Naming;

import java.util.List;

public record ColumnAddContributor(String table, FieldSpec field) implements DdlContributor {
    @Override
    public int priority() {
        return 40; // Column Add
    }

    @Override
    public void contribute(List<String> statements, DdlDialect dialect, Naming naming) {
        if (field == null || field.getSqlType() == null || field.getSqlType().isBlank()) {
            throw new GenerationException("Cannot add a column without SQL type to table '" + table + "'");
        }
        statements.add(dialect.getAddColumnSql(table, field));
    }
}
