package org.morm.migration.unit;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.morm.model.SchemaSnapshot;
import org.morm.model.change.ChangeSet;

import java.util.ArrayList;
import java.util.List;

/**
 * One queued or applied package of changes for a model. The generated SQL is captured when the
 * unit is written and never re-derived.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class MigrationUnit {
    private String model;
    private long sequence;
    @Builder.Default private UnitState state = UnitState.QUEUED;
    private String createdAt;
    private String appliedAt;
    /** Hash of the snapshot the change set was computed from, {@code null} for a first create. */
    private String baselineHash;
    private String targetHash;
    private ChangeSet changeSet;
    @Builder.Default private List<String> generatedSql = new ArrayList<>();
    @Builder.Default private UnitHooks hooks = UnitHooks.template();
    /** Snapshot the model has once this unit is applied. */
    private SchemaSnapshot snapshot;
    private String failure;

    public List<String> getGeneratedSql() {
        return generatedSql != null ? generatedSql : List.of();
    }

    public UnitHooks getHooks() {
        return hooks != null ? hooks : UnitHooks.template();
    }

    @JsonIgnore
    public boolean isApplied() {
        return state == UnitState.APPLIED;
    }
}
