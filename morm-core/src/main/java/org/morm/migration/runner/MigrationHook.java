package org.morm.migration.runner;

/**
 * Code run inside a unit's transaction around its generated SQL. Implementations are named in
 * the unit's {@code hooks.hookClass} and need a public no-arg constructor.
 */
public interface MigrationHook {
    MigrationHook NONE = new MigrationHook() {
    };

    default void runBefore(HookContext context) throws Exception {
    }

    default void runAfter(HookContext context) throws Exception {
    }
}
