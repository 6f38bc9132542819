package org.morm.migration.runner;

import org.morm.db.SqlExecutor;
import org.morm.migration.unit.MigrationUnit;
import org.morm.model.ModelDefinition;

/**
 * @param db    executor bound to the unit's transaction
 * @param model the model being migrated; {@link ModelDefinition#getJavaType()} is its declared type
 * @param unit  the unit being applied
 */
public record HookContext(SqlExecutor db, ModelDefinition model, MigrationUnit unit) {
}
