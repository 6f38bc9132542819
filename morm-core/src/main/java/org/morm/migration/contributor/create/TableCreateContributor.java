package org.morm.migration.contributor.create;

import org.morm.migration.CreateTableBuilder;
import org.morm.migration.contributor.DdlContributor;
import org.morm.migration.dialect.DdlDialect;
import org.morm.model.SchemaSnapshot;
import org.morm.naming.Naming;

import java.util.List;

public record TableCreateContributor(SchemaSnapshot snapshot) implements DdlContributor {
    @Override
    public int priority() {
        return 35; // Table Create, after every drop
    }

    @Override
    public void contribute(List<String> statements, DdlDialect dialect, Naming naming) {
        statements.addAll(new CreateTableBuilder(snapshot, dialect, naming).build());
    }
}
