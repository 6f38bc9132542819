package org.morm.migration.differs;

import org.morm.model.SchemaSnapshot;
import org.morm.model.UniqueGroup;
import org.morm.model.change.AddUniqueGroup;
import org.morm.model.change.ChangeSet;
import org.morm.model.change.DropUniqueGroup;
import org.morm.model.change.ModifyUniqueGroup;

import java.util.TreeSet;

/**
 * Named unique groups, matched by group name. Member lists are compared in order.
 */
public class UniqueGroupDiffer implements Differ {

    @Override
    public void diff(SchemaSnapshot oldSnapshot, SchemaSnapshot newSnapshot, ChangeSet.Builder result) {
        TreeSet<String> names = new TreeSet<>(oldSnapshot.getUniqueGroups().keySet());
        names.addAll(newSnapshot.getUniqueGroups().keySet());

        for (String name : names) {
            UniqueGroup oldGroup = oldSnapshot.getUniqueGroups().get(name);
            UniqueGroup newGroup = newSnapshot.getUniqueGroups().get(name);

            if (oldGroup == null) {
                result.add(new AddUniqueGroup(UniqueGroup.of(name, newGroup.getFieldNames())));
            } else if (newGroup == null) {
                result.add(new DropUniqueGroup(name));
            } else if (!oldGroup.getFieldNames().equals(newGroup.getFieldNames())) {
                result.add(new ModifyUniqueGroup(name, newGroup.getFieldNames()));
            }
        }
    }
}
