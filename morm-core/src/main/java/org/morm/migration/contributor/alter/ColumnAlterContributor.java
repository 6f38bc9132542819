package org.morm.migration.contributor.alter;

import org.morm.exception.GenerationException;
import org.morm.migration.contributor.DdlContributor;
import org.morm.migration.dialect.DdlDialect;
import org.morm.naming.Naming;

import java.util.List;

public record ColumnAlterContributor(String table, String fieldName, List<String> ops) implements DdlContributor {
    @Override
    public int priority() {
        return 50; // Column Alter
    }

    @Override
    public void contribute(List<String> statements, DdlDialect dialect, Naming naming) {
        for (String op : ops) {
            if (op == null || op.isBlank()) {
                throw new GenerationException("Blank alter op for column '" + table + "." + fieldName + "'");
            }
            statements.add(dialect.getAlterColumnSql(table, fieldName, op));
        }
    }
}
