package org.morm.migration.differs;

import org.morm.model.FieldSpec;
import org.morm.model.SchemaSnapshot;
import org.morm.model.UniqueGroup;
import org.morm.model.change.AddUniqueGroup;
import org.morm.model.change.ChangeSet;
import org.morm.model.change.DropUniqueGroup;
import org.morm.model.change.ModifyUniqueGroup;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class UniqueGroupDifferTest {

    private static SchemaSnapshot groups(UniqueGroup... groups) {
        return SchemaSnapshot.of("t",
                List.of(FieldSpec.of("a", "INT"), FieldSpec.of("b", "INT"), FieldSpec.of("c", "INT")),
                List.of(groups));
    }

    @Test
    @DisplayName("Groups are matched by name and visited in name order")
    void matchedByName() {
        ChangeSet.Builder result = ChangeSet.builder();

        new UniqueGroupDiffer().diff(
                groups(UniqueGroup.of("keep", List.of("a")), UniqueGroup.of("old", List.of("b")),
                        UniqueGroup.of("moved", List.of("a", "b"))),
                groups(UniqueGroup.of("new", List.of("c")), UniqueGroup.of("keep", List.of("a")),
                        UniqueGroup.of("moved", List.of("a", "c"))),
                result);

        assertThat(result.peek()).containsExactly(
                new ModifyUniqueGroup("moved", List.of("a", "c")),
                new AddUniqueGroup(UniqueGroup.of("new", List.of("c"))),
                new DropUniqueGroup("old"));
    }
}
