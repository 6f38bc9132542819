package org.morm.migration;

import org.morm.exception.GenerationException;
import org.morm.migration.contributor.create.IndexAddContributor;
import org.morm.migration.contributor.create.UniqueGroupAddContributor;
import org.morm.migration.dialect.DdlDialect;
import org.morm.model.FieldSpec;
import org.morm.model.IndexSpec;
import org.morm.model.SchemaSnapshot;
import org.morm.model.UniqueGroup;
import org.morm.naming.Naming;

import java.util.ArrayList;
import java.util.List;

/**
 * First-time creation of a table: one {@code CREATE TABLE} carrying every column, then one
 * constraint statement per unique group in insertion order, then the declared indexes.
 */
public class CreateTableBuilder {
    private final SchemaSnapshot snapshot;
    private final DdlDialect dialect;
    private final Naming naming;

    public CreateTableBuilder(SchemaSnapshot snapshot, DdlDialect dialect, Naming naming) {
        this.snapshot = snapshot;
        this.dialect = dialect;
        this.naming = naming;
    }

    public List<String> build() {
        if (snapshot == null || snapshot.getTable() == null || snapshot.getTable().isBlank()) {
            throw new GenerationException("Cannot create a table without a name");
        }
        String table = snapshot.getTable();
        if (snapshot.getFields().isEmpty()) {
            throw new GenerationException("Cannot create table '" + table + "' without fields");
        }

        List<String> body = new ArrayList<>();
        for (FieldSpec field : snapshot.getFields().values()) {
            if (field.getSqlType() == null || field.getSqlType().isBlank()) {
                throw new GenerationException("Field '" + table + "." + field.getName() + "' has no SQL type");
            }
            String uniqueName = field.isUnique() ? naming.fieldUniqueConstraint(table, field.getName()) : null;
            body.add(dialect.getColumnDefinitionSql(table, field, uniqueName));
        }
        if (snapshot.getPrimaryKey() != null) {
            body.add(dialect.getPrimaryKeyDefinitionSql(snapshot.getPrimaryKey()));
        }

        List<String> statements = new ArrayList<>();
        statements.add(dialect.openCreateTable(table) + String.join(",\n", body) + dialect.closeCreateTable());

        for (UniqueGroup group : snapshot.getUniqueGroups().values()) {
            new UniqueGroupAddContributor(table, group.getGroupName(), group.getFieldNames())
                    .contribute(statements, dialect, naming);
        }
        for (FieldSpec field : snapshot.getFields().values()) {
            for (IndexSpec spec : field.parsedIndexSpecs()) {
                // removal markers mean nothing on a table that never had the index
                if (!spec.removal()) {
                    new IndexAddContributor(table, field.getName(), spec.kind(), spec.opClass())
                            .contribute(statements, dialect, naming);
                }
            }
        }
        return statements;
    }
}
