package org.morm.migration.differs;

import org.morm.model.FieldSpec;
import org.morm.model.SchemaSnapshot;
import org.morm.model.change.AddField;
import org.morm.model.change.AddFieldUnique;
import org.morm.model.change.AlterField;
import org.morm.model.change.ChangeSet;
import org.morm.model.change.DropFieldUnique;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FieldDifferTest {

    private static FieldSpec field(String sqlType, String onAdd, List<String> alterOps) {
        return FieldSpec.builder().name("age").sqlType(sqlType).onAdd(onAdd).alterOps(alterOps).build();
    }

    private static ChangeSet diff(FieldSpec oldField, FieldSpec newField) {
        ChangeSet.Builder result = ChangeSet.builder();
        new FieldDiffer().diff(
                SchemaSnapshot.of("people", List.of(oldField), List.of()),
                SchemaSnapshot.of("people", List.of(newField), List.of()),
                result);
        return result.build();
    }

    @Test
    @DisplayName("A type change comes first, followed by the newly declared alter ops")
    void typeChangeThenNewOps() {
        FieldSpec old = field("INT", "", List.of("SET NOT NULL"));
        FieldSpec cur = field("BIGINT", "", List.of("SET NOT NULL", "SET DEFAULT 0"));

        assertEquals(List.of("TYPE BIGINT", "SET DEFAULT 0"), FieldDiffer.alterOps(old, cur));
    }

    @Test
    @DisplayName("Whitespace differences in the SQL type are not a change")
    void typeWhitespaceIgnored() {
        assertTrue(FieldDiffer.alterOps(field("VARCHAR( 10 )", "", List.of()), field(" VARCHAR( 10 )", "", List.of())).isEmpty());
        assertTrue(FieldDiffer.alterOps(field("NUMERIC(10,  2)", "", List.of()), field("NUMERIC(10, 2)", "", List.of())).isEmpty());
    }

    @Test
    @DisplayName("A changed onAdd fragment re-applies the current alter ops")
    void onAddChangeReappliesOps() {
        FieldSpec old = field("INT", "DEFAULT 1", List.of("SET DEFAULT 2"));
        FieldSpec cur = field("INT", "DEFAULT 2", List.of("SET DEFAULT 2"));

        assertEquals(List.of("SET DEFAULT 2"), FieldDiffer.alterOps(old, cur));
    }

    @Test
    @DisplayName("A difference that maps to no op emits no AlterField")
    void noOpDifference() {
        FieldSpec old = field("INT", "DEFAULT 1", List.of());
        FieldSpec cur = field("INT", "DEFAULT 2", List.of());

        assertTrue(diff(old, cur).isEmpty());
    }

    @Test
    @DisplayName("Removed alter ops are not reverted")
    void removedOpsAreForwardOnly() {
        FieldSpec old = field("INT", "", List.of("SET NOT NULL", "SET DEFAULT 0"));
        FieldSpec cur = field("INT", "", List.of("SET NOT NULL"));

        assertTrue(FieldDiffer.alterOps(old, cur).isEmpty());
    }

    @Test
    @DisplayName("Toggling the unique flag adds or drops the single column constraint")
    void uniqueToggle() {
        FieldSpec plain = field("INT", "", List.of());
        FieldSpec unique = plain.toBuilder().unique(true).build();

        assertEquals(List.of(new AddFieldUnique("age")), diff(plain, unique).getChanges());
        assertEquals(List.of(new DropFieldUnique("age")), diff(unique, plain).getChanges());
    }

    @Test
    @DisplayName("A new unique field is added, then its constraint")
    void newUniqueField() {
        FieldSpec id = FieldSpec.of("id", "BIGINT");
        FieldSpec email = FieldSpec.builder().name("email").sqlType("TEXT").unique(true).build();
        ChangeSet.Builder result = ChangeSet.builder();

        new FieldDiffer().diff(
                SchemaSnapshot.of("people", List.of(id), List.of()),
                SchemaSnapshot.of("people", List.of(id, email), List.of()),
                result);

        assertEquals(List.of(new AddField(email), new AddFieldUnique("email")), result.peek());
    }

    @Test
    @DisplayName("Type and op changes surface as one AlterField")
    void alterFieldRecord() {
        ChangeSet changes = diff(field("INT", "", List.of()), field("TEXT", "", List.of()));

        assertEquals(List.of(new AlterField("age", List.of("TYPE TEXT"))), changes.getChanges());
    }
}
