package org.morm.migration.differs;

import org.morm.model.FieldSpec;
import org.morm.model.IndexSpec;
import org.morm.model.SchemaSnapshot;
import org.morm.model.change.AddIndex;
import org.morm.model.change.ChangeSet;
import org.morm.model.change.DropIndex;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;

/**
 * Index kinds per field.
 *
 * <p>A removal marker ({@code -kind}) drops the index whether or not the old snapshot listed
 * the kind. It fires once: when the old snapshot already carries the same marker nothing is
 * emitted, so a declaration that keeps the marker stays diff-free.
 *
 * <p>Indexes of dropped fields are not dropped explicitly; the database removes them with the column.
 */
public class IndexDiffer implements Differ {

    @Override
    public void diff(SchemaSnapshot oldSnapshot, SchemaSnapshot newSnapshot, ChangeSet.Builder result) {
        for (String name : new TreeSet<>(newSnapshot.getFields().keySet())) {
            FieldSpec newField = newSnapshot.field(name);
            FieldSpec oldField = oldSnapshot.field(name);

            Map<String, IndexSpec> newActive = active(newField);
            if (oldField == null) {
                newActive.values().forEach(s -> result.add(new AddIndex(name, s.kind(), s.opClass())));
                continue;
            }

            Map<String, IndexSpec> oldActive = active(oldField);
            Set<String> oldRemoved = removed(oldField);
            Set<String> newRemoved = removed(newField);

            Set<String> drops = new LinkedHashSet<>();
            for (IndexSpec old : oldActive.values()) {
                IndexSpec cur = newActive.get(old.kind());
                if (cur == null || !Objects.equals(cur.opClass(), old.opClass())) {
                    drops.add(old.kind());
                }
            }
            for (String kind : newRemoved) {
                if (!oldRemoved.contains(kind)) {
                    drops.add(kind);
                }
            }
            drops.forEach(kind -> result.add(new DropIndex(name, kind)));

            for (IndexSpec cur : newActive.values()) {
                IndexSpec old = oldActive.get(cur.kind());
                if (old == null || !Objects.equals(cur.opClass(), old.opClass())) {
                    result.add(new AddIndex(name, cur.kind(), cur.opClass()));
                }
            }
        }
    }

    private static Map<String, IndexSpec> active(FieldSpec field) {
        Map<String, IndexSpec> byKind = new LinkedHashMap<>();
        for (IndexSpec spec : field.parsedIndexSpecs()) {
            if (!spec.removal()) {
                byKind.put(spec.kind(), spec);
            }
        }
        return byKind;
    }

    private static Set<String> removed(FieldSpec field) {
        Set<String> kinds = new HashSet<>();
        for (IndexSpec spec : field.parsedIndexSpecs()) {
            if (spec.removal()) {
                kinds.add(spec.kind());
            }
        }
        return kinds;
    }
}
