package org.morm.migration.differs;

import org.morm.model.FieldSpec;
import org.morm.model.SchemaSnapshot;
import org.morm.model.change.AddIndex;
import org.morm.model.change.ChangeSet;
import org.morm.model.change.DropIndex;
import org.morm.model.change.SchemaChange;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class IndexDifferTest {

    private static SchemaSnapshot withIndexes(String... specs) {
        FieldSpec title = FieldSpec.builder().name("title").sqlType("TEXT").indexSpecs(List.of(specs)).build();
        return SchemaSnapshot.of("posts", List.of(FieldSpec.of("id", "BIGINT"), title), List.of());
    }

    private static List<SchemaChange> diff(SchemaSnapshot old, SchemaSnapshot current) {
        ChangeSet.Builder result = ChangeSet.builder();
        new IndexDiffer().diff(old, current, result);
        return result.peek();
    }

    @Test
    @DisplayName("Kinds only in the new declaration are added, kinds only in the old one are dropped")
    void addAndDrop() {
        assertThat(diff(withIndexes("btree"), withIndexes("hash"))).containsExactly(
                new DropIndex("title", "btree"),
                new AddIndex("title", "hash", null));
    }

    @Test
    @DisplayName("A changed operator class recreates the index")
    void operatorClassChange() {
        assertThat(diff(withIndexes("gin:gin_trgm_ops"), withIndexes("gin:gin_bigm_ops"))).containsExactly(
                new DropIndex("title", "gin"),
                new AddIndex("title", "gin", "gin_bigm_ops"));
    }

    @Test
    @DisplayName("Removal marker drops the kind even when the old snapshot never listed it")
    void removalMarkerIsUnconditional() {
        assertThat(diff(withIndexes(), withIndexes("-hash"))).containsExactly(new DropIndex("title", "hash"));
    }

    @Test
    @DisplayName("Removal marker of an existing kind emits exactly one drop")
    void removalMarkerOfExistingKind() {
        assertThat(diff(withIndexes("hash"), withIndexes("-hash"))).containsExactly(new DropIndex("title", "hash"));
    }

    @Test
    @DisplayName("A marker already recorded in the old snapshot is not emitted again")
    void removalMarkerFiresOnce() {
        assertThat(diff(withIndexes("-hash"), withIndexes("-hash"))).isEmpty();
        assertThat(diff(withIndexes("-hash"), withIndexes("btree", "-hash")))
                .containsExactly(new AddIndex("title", "btree", null));
    }

    @Test
    @DisplayName("Order of index specs is irrelevant")
    void orderIrrelevant() {
        assertThat(diff(withIndexes("btree", "hash"), withIndexes("hash", "btree"))).isEmpty();
    }

    @Test
    @DisplayName("Indexes of a new field are added; removal markers on it are ignored")
    void newFieldIndexes() {
        SchemaSnapshot old = SchemaSnapshot.of("posts", List.of(FieldSpec.of("id", "BIGINT")), List.of());

        assertThat(diff(old, withIndexes("btree", "-hash"))).containsExactly(new AddIndex("title", "btree", null));
    }
}
