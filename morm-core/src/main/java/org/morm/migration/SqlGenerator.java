package org.morm.migration;

import lombok.extern.slf4j.Slf4j;
import org.morm.exception.GenerationException;
import org.morm.migration.contributor.DdlContributor;
import org.morm.migration.contributor.alter.ColumnAlterContributor;
import org.morm.migration.contributor.create.ColumnAddContributor;
import org.morm.migration.contributor.create.FieldUniqueAddContributor;
import org.morm.migration.contributor.create.IndexAddContributor;
import org.morm.migration.contributor.create.TableCreateContributor;
import org.morm.migration.contributor.create.UniqueGroupAddContributor;
import org.morm.migration.contributor.drop.ColumnDropContributor;
import org.morm.migration.contributor.drop.FieldUniqueDropContributor;
import org.morm.migration.contributor.drop.IndexDropContributor;
import org.morm.migration.contributor.drop.TableDropContributor;
import org.morm.migration.contributor.drop.UniqueGroupDropContributor;
import org.morm.migration.dialect.DdlDialect;
import org.morm.migration.dialect.postgres.PostgresDialect;
import org.morm.model.SchemaSnapshot;
import org.morm.model.change.AddField;
import org.morm.model.change.AddFieldUnique;
import org.morm.model.change.AddIndex;
import org.morm.model.change.AddUniqueGroup;
import org.morm.model.change.AlterField;
import org.morm.model.change.ChangeSet;
import org.morm.model.change.CreateTable;
import org.morm.model.change.DropField;
import org.morm.model.change.DropFieldUnique;
import org.morm.model.change.DropIndex;
import org.morm.model.change.DropTable;
import org.morm.model.change.DropUniqueGroup;
import org.morm.model.change.ModifyUniqueGroup;
import org.morm.model.change.SchemaChange;
import org.morm.naming.DefaultNaming;
import org.morm.naming.Naming;

import java.util.List;
import java.util.Objects;

/**
 * Turns a change set into the ordered DDL statements that implement it. Pure: the same change
 * set always yields the same statements.
 */
@Slf4j
public class SqlGenerator {
    private final DdlDialect dialect;
    private final Naming naming;

    public SqlGenerator() {
        this(new PostgresDialect(), new DefaultNaming());
    }

    public SqlGenerator(DdlDialect dialect, Naming naming) {
        this.dialect = Objects.requireNonNull(dialect, "dialect must not be null");
        this.naming = Objects.requireNonNull(naming, "naming must not be null");
    }

    public List<String> generate(String table, ChangeSet changeSet) {
        Objects.requireNonNull(changeSet, "changeSet must not be null");
        AlterTableBuilder builder = new AlterTableBuilder(table, dialect, naming);
        for (SchemaChange change : changeSet.getChanges()) {
            for (DdlContributor contributor : contributorsFor(table, change)) {
                builder.add(contributor);
            }
        }
        List<String> statements = builder.build();
        log.debug("Generated {} statement(s) for {} change(s) on table '{}'",
                statements.size(), changeSet.size(), table);
        return statements;
    }

    public List<String> generateCreateTable(SchemaSnapshot snapshot) {
        return new CreateTableBuilder(snapshot, dialect, naming).build();
    }

    private List<DdlContributor> contributorsFor(String table, SchemaChange change) {
        if (change instanceof CreateTable c) {
            return List.of(new TableCreateContributor(c.snapshot()));
        }
        if (change instanceof DropTable c) {
            return List.of(new TableDropContributor(c.table()));
        }
        if (change instanceof AddField c) {
            return List.of(new ColumnAddContributor(table, c.field()));
        }
        if (change instanceof DropField c) {
            return List.of(new ColumnDropContributor(table, c.fieldName()));
        }
        if (change instanceof AlterField c) {
            return List.of(new ColumnAlterContributor(table, c.fieldName(), c.ops()));
        }
        if (change instanceof AddIndex c) {
            return List.of(new IndexAddContributor(table, c.fieldName(), c.kind(), c.opClass()));
        }
        if (change instanceof DropIndex c) {
            return List.of(new IndexDropContributor(table, c.fieldName(), c.kind()));
        }
        if (change instanceof AddFieldUnique c) {
            return List.of(new FieldUniqueAddContributor(table, c.fieldName()));
        }
        if (change instanceof DropFieldUnique c) {
            return List.of(new FieldUniqueDropContributor(table, c.fieldName()));
        }
        if (change instanceof AddUniqueGroup c) {
            return List.of(new UniqueGroupAddContributor(table, c.group().getGroupName(), c.group().getFieldNames()));
        }
        if (change instanceof DropUniqueGroup c) {
            return List.of(new UniqueGroupDropContributor(table, c.groupName()));
        }
        if (change instanceof ModifyUniqueGroup c) {
            // never an in-place alter: drop in the drop phase, add back in the add phase
            return List.of(
                    new UniqueGroupDropContributor(table, c.groupName()),
                    new UniqueGroupAddContributor(table, c.groupName(), c.fieldNames()));
        }
        throw new GenerationException("Unsupported change type: " + change.getClass().getName());
    }
}
