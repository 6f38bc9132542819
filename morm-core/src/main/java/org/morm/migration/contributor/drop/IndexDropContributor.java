package org.morm.migration.contributor.drop;

import org.morm.migration.contributor.DdlContributor;
import org.morm.migration.dialect.DdlDialect;
import org.morm.naming.Naming;

import java.util.List;

public record IndexDropContributor(String table, String fieldName, String kind) implements DdlContributor {
    @Override
    public int priority() {
        return 20; // Index Drop
    }

    @Override
    public void contribute(List<String> statements, DdlDialect dialect, Naming naming) {
        statements.add(dialect.getDropIndexSql(naming.indexName(table, fieldName, kind)));
    }
}
