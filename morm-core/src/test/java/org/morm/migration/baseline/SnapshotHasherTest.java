package org.morm.migration.baseline;

import org.morm.model.FieldSpec;
import org.morm.model.SchemaSnapshot;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SnapshotHasherTest {

    private final SnapshotHasher hasher = new SnapshotHasher();

    @Test
    @DisplayName("Hash is a 64 character hex SHA-256")
    void hashFormat() {
        String hash = hasher.hash(SchemaSnapshot.of("t", List.of(FieldSpec.of("id", "INT")), List.of()));

        assertNotNull(hash);
        assertTrue(hash.matches("[0-9a-f]{64}"));
    }

    @Test
    @DisplayName("Field declaration order does not change the hash")
    void orderIndependent() {
        SchemaSnapshot a = SchemaSnapshot.of("t", List.of(FieldSpec.of("id", "INT"), FieldSpec.of("n", "TEXT")), List.of());
        SchemaSnapshot b = SchemaSnapshot.of("t", List.of(FieldSpec.of("n", "TEXT"), FieldSpec.of("id", "INT")), List.of());

        assertEquals(hasher.hash(a), hasher.hash(b));
    }

    @Test
    @DisplayName("Different content gives a different hash; no snapshot gives none")
    void contentSensitive() {
        SchemaSnapshot a = SchemaSnapshot.of("t", List.of(FieldSpec.of("id", "INT")), List.of());
        SchemaSnapshot b = SchemaSnapshot.of("t", List.of(FieldSpec.of("id", "BIGINT")), List.of());

        assertNotEquals(hasher.hash(a), hasher.hash(b));
        assertNull(hasher.hash(null));
    }
}
