package org.morm.migration.contributor.drop;

import org.morm.migration.contributor.DdlContributor;
import org.morm.migration.dialect.DdlDialect;
import org.morm.naming.Naming;

import java.util.List;

public record ColumnDropContributor(String table, String fieldName) implements DdlContributor {
    @Override
    public int priority() {
        return 30; // Column Drop
    }

    @Override
    public void contribute(List<String> statements, DdlDialect dialect, Naming naming) {
        statements.add(dialect.getDropColumnSql(table, fieldName));
    }
}
