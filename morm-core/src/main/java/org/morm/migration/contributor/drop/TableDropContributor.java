package org.morm.migration.contributor.drop;

import org.morm.exception.GenerationException;
import org.morm.migration.contributor.DdlContributor;
import org.morm.migration.dialect.DdlDialect;
import org.morm.naming.Naming;

import java.util.List;

public record TableDropContributor(String table) implements DdlContributor {
    @Override
    public int priority() {
        return 5; // Table Drop
    }

    @Override
    public void contribute(List<String> statements, DdlDialect dialect, Naming naming) {
        if (table == null || table.isBlank()) {
            throw new GenerationException("Cannot drop a table without a name");
        }
        statements.add(dialect.getDropTableSql(table));
    }
}
