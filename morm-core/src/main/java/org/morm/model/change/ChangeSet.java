package org.morm.model.change;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.util.ArrayList;
import java.util.List;

/**
 * Ordered, immutable list of changes. Exactly what gets serialized into a migration unit.
 */
@Getter
@EqualsAndHashCode
@ToString
public final class ChangeSet {
    private static final ChangeSet EMPTY = new ChangeSet(List.of());

    private final List<SchemaChange> changes;

    @JsonCreator
    public ChangeSet(@JsonProperty("changes") List<SchemaChange> changes) {
        this.changes = changes == null ? List.of() : List.copyOf(changes);
    }

    public static ChangeSet empty() {
        return EMPTY;
    }

    public static ChangeSet of(SchemaChange... changes) {
        return new ChangeSet(List.of(changes));
    }

    @JsonIgnore
    public boolean isEmpty() {
        return changes.isEmpty();
    }

    public int size() {
        return changes.size();
    }

    @JsonIgnore
    public boolean isFullCreate() {
        return changes.stream().anyMatch(c -> c instanceof CreateTable);
    }

    public <T extends SchemaChange> List<T> ofType(Class<T> type) {
        List<T> out = new ArrayList<>();
        for (SchemaChange c : changes) {
            if (type.isInstance(c)) {
                out.add(type.cast(c));
            }
        }
        return out;
    }

    /**
     * Collects changes while a differ walks two snapshots.
     */
    public static class Builder {
        private final List<SchemaChange> changes = new ArrayList<>();

        public Builder add(SchemaChange change) {
            changes.add(change);
            return this;
        }

        public List<SchemaChange> peek() {
            return changes;
        }

        public ChangeSet build() {
            return new ChangeSet(changes);
        }
    }

    public static Builder builder() {
        return new Builder();
    }
}
