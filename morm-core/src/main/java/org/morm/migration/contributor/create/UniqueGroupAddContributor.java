package org.morm.migration.contributor.create;

import org.morm.exception.GenerationException;
import org.morm.migration.contributor.DdlContributor;
import org.morm.migration.dialect.DdlDialect;
import org.morm.naming.Naming;

import java.util.List;

public record UniqueGroupAddContributor(String table, String groupName, List<String> fieldNames) implements DdlContributor {
    @Override
    public int priority() {
        return 70; // Constraint Add
    }

    @Override
    public void contribute(List<String> statements, DdlDialect dialect, Naming naming) {
        if (fieldNames == null || fieldNames.isEmpty()) {
            throw new GenerationException("Unique group '" + groupName + "' of table '" + table + "' has no fields");
        }
        statements.add(dialect.getAddUniqueConstraintSql(table, naming.uniqueGroupConstraint(table, groupName), fieldNames));
    }
}
