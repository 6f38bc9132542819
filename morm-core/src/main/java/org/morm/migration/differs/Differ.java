package org.morm.migration.differs;

import org.morm.model.SchemaSnapshot;
import org.morm.model.change.ChangeSet;

/**
 * One stage of the diff pipeline. Both snapshots describe the same table.
 */
public interface Differ {
    void diff(SchemaSnapshot oldSnapshot, SchemaSnapshot newSnapshot, ChangeSet.Builder result);
}
