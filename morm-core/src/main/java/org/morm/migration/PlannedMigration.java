package org.morm.migration;

import org.morm.model.SchemaSnapshot;
import org.morm.model.change.ChangeSet;

import java.util.List;

/**
 * What generation would queue for one model, before anything is written.
 *
 * @param baseline   snapshot the diff started from, {@code null} if the model has none yet
 * @param target     snapshot described by the model's current declaration
 * @param statements rendered SQL of {@code changeSet}
 */
public record PlannedMigration(String model, String table, SchemaSnapshot baseline, SchemaSnapshot target,
                               ChangeSet changeSet, List<String> statements) {

    public PlannedMigration {
        statements = List.copyOf(statements);
    }

    public boolean isEmpty() {
        return changeSet.isEmpty();
    }
}
