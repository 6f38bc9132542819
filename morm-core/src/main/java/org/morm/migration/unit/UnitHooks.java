package org.morm.migration.unit;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Operator-editable part of a unit. Empty lists and no hook class mean both hooks do nothing.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UnitHooks {
    /** Statements run inside the unit's transaction before the generated SQL. */
    @Builder.Default private List<String> runBefore = new ArrayList<>();
    /** Statements run inside the unit's transaction after the generated SQL. */
    @Builder.Default private List<String> runAfter = new ArrayList<>();
    /** Fully qualified name of a {@code MigrationHook} with a no-arg constructor. */
    private String hookClass;

    public static UnitHooks template() {
        return UnitHooks.builder().build();
    }

    public List<String> getRunBefore() {
        return runBefore != null ? runBefore : List.of();
    }

    public List<String> getRunAfter() {
        return runAfter != null ? runAfter : List.of();
    }
}
