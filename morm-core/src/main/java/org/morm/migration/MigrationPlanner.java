package org.morm.migration;

import lombok.extern.slf4j.Slf4j;
import org.morm.migration.baseline.SnapshotStore;
import org.morm.migration.differs.SchemaDiffer;
import org.morm.migration.unit.MigrationUnitRepository;
import org.morm.model.ModelDefinition;
import org.morm.model.SchemaSnapshot;
import org.morm.model.change.ChangeSet;

import java.util.List;
import java.util.Objects;

/**
 * Diff and render for one model. Reads the store and the unit history, writes nothing.
 */
@Slf4j
public class MigrationPlanner {
    private final SnapshotStore store;
    private final MigrationUnitRepository repository;
    private final SchemaDiffer differ;
    private final SqlGenerator sqlGenerator;

    public MigrationPlanner(SnapshotStore store, MigrationUnitRepository repository,
                            SchemaDiffer differ, SqlGenerator sqlGenerator) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.repository = Objects.requireNonNull(repository, "repository must not be null");
        this.differ = Objects.requireNonNull(differ, "differ must not be null");
        this.sqlGenerator = Objects.requireNonNull(sqlGenerator, "sqlGenerator must not be null");
    }

    /**
     * Validates the declaration, diffs it against the latest known snapshot and renders the SQL.
     * Declaration and generation errors surface here, before any unit exists.
     */
    public PlannedMigration plan(ModelDefinition model) {
        SchemaSnapshot target = model.describe();
        SchemaSnapshot baseline = latestSnapshot(model.getName());

        ChangeSet changeSet;
        if (baseline != null && !Objects.equals(baseline.getTable(), target.getTable())) {
            log.warn("Model {} moved from table '{}' to '{}'; the old table will be dropped",
                    model.getName(), baseline.getTable(), target.getTable());
            changeSet = differ.replaceTable(baseline, target);
        } else {
            changeSet = differ.diff(baseline, target);
        }
        List<String> statements = sqlGenerator.generate(target.getTable(), changeSet);
        return new PlannedMigration(model.getName(), target.getTable(), baseline, target, changeSet, statements);
    }

    /**
     * Target snapshot of the newest unit, queued or applied, falling back to the store. Diffing
     * against queued units keeps a second generate from queuing the same changes again.
     */
    public SchemaSnapshot latestSnapshot(String model) {
        return repository.latestSnapshot(model).orElseGet(() -> store.load(model));
    }
}
