package org.morm.migration.contributor.create;

import org.morm.exception.GenerationException;
import org.morm.migration.contributor.DdlContributor;
import org.morm.migration.dialect.DdlDialect;
import org.morm.model.IndexSpec;
import org.morm.naming.Naming;

import java.util.List;

public record IndexAddContributor(String table, String fieldName, String kind, String opClass) implements DdlContributor {
    @Override
    public int priority() {
        return 60; // Index Add
    }

    @Override
    public void contribute(List<String> statements, DdlDialect dialect, Naming naming) {
        IndexSpec spec;
        try {
            spec = IndexSpec.parse(opClass != null ? kind + ":" + opClass : kind);
        } catch (RuntimeException e) {
            throw new GenerationException("Cannot render index on '" + table + "." + fieldName + "': " + e.getMessage());
        }
        statements.add(dialect.getCreateIndexSql(table, naming.indexName(table, fieldName, spec.kind()),
                fieldName, spec.kind(), spec.opClass()));
    }
}
