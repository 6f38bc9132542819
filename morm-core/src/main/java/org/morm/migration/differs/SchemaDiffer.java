package org.morm.migration.differs;

import org.morm.exception.DiffException;
import org.morm.model.SchemaSnapshot;
import org.morm.model.change.ChangeSet;
import org.morm.model.change.CreateTable;
import org.morm.model.change.DropTable;

import java.util.List;
import java.util.Objects;

/**
 * Computes the ordered change set between the last known snapshot of a model and its
 * current declaration. Pure: reads both snapshots, touches nothing else.
 */
public class SchemaDiffer {
    private final List<Differ> differs;

    public SchemaDiffer() {
        this(createDefaultDiffers());
    }

    public SchemaDiffer(List<Differ> differs) {
        this.differs = List.copyOf(Objects.requireNonNull(differs, "differs must not be null"));
    }

    /**
     * Pipeline order is fixed so the change set for a given pair of snapshots is stable:
     * 1. FieldDiffer (columns, type/default alterations, single-column unique)
     * 2. IndexDiffer (per-field index kinds)
     * 3. UniqueGroupDiffer (named composite unique constraints)
     */
    private static List<Differ> createDefaultDiffers() {
        return List.of(
                new FieldDiffer(),
                new IndexDiffer(),
                new UniqueGroupDiffer()
        );
    }

    /**
     * @param oldSnapshot last known snapshot, {@code null} if the model never had one
     * @param newSnapshot declared snapshot
     * @return the changes, a single {@link CreateTable} when there is no old snapshot,
     *         or an empty change set when both are structurally equal
     */
    public ChangeSet diff(SchemaSnapshot oldSnapshot, SchemaSnapshot newSnapshot) {
        Objects.requireNonNull(newSnapshot, "newSnapshot must not be null");

        if (oldSnapshot == null) {
            return ChangeSet.of(new CreateTable(newSnapshot));
        }
        if (!Objects.equals(oldSnapshot.getTable(), newSnapshot.getTable())) {
            throw new DiffException("Cannot diff table '" + oldSnapshot.getTable()
                    + "' against table '" + newSnapshot.getTable() + "'");
        }
        if (!Objects.equals(oldSnapshot.getPrimaryKey(), newSnapshot.getPrimaryKey())) {
            throw new DiffException("Primary key of table '" + newSnapshot.getTable() + "' changed from '"
                    + oldSnapshot.getPrimaryKey() + "' to '" + newSnapshot.getPrimaryKey() + "'; not supported");
        }
        if (oldSnapshot.equals(newSnapshot)) {
            return ChangeSet.empty();
        }

        ChangeSet.Builder result = ChangeSet.builder();
        for (Differ differ : differs) {
            differ.diff(oldSnapshot, newSnapshot, result);
        }
        return result.build();
    }

    /**
     * A model now maps to a different table. No rename inference: the old table is dropped
     * and the new one created from scratch.
     */
    public ChangeSet replaceTable(SchemaSnapshot oldSnapshot, SchemaSnapshot newSnapshot) {
        Objects.requireNonNull(oldSnapshot, "oldSnapshot must not be null");
        Objects.requireNonNull(newSnapshot, "newSnapshot must not be null");
        return ChangeSet.of(new DropTable(oldSnapshot.getTable()), new CreateTable(newSnapshot));
    }
}
