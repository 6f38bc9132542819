package org.morm.model.change;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * One typed structural change between two snapshots.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "op")
@JsonSubTypes({
        @JsonSubTypes.Type(value = CreateTable.class, name = "createTable"),
        @JsonSubTypes.Type(value = DropTable.class, name = "dropTable"),
        @JsonSubTypes.Type(value = AddField.class, name = "addField"),
        @JsonSubTypes.Type(value = DropField.class, name = "dropField"),
        @JsonSubTypes.Type(value = AlterField.class, name = "alterField"),
        @JsonSubTypes.Type(value = AddIndex.class, name = "addIndex"),
        @JsonSubTypes.Type(value = DropIndex.class, name = "dropIndex"),
        @JsonSubTypes.Type(value = AddFieldUnique.class, name = "addFieldUnique"),
        @JsonSubTypes.Type(value = DropFieldUnique.class, name = "dropFieldUnique"),
        @JsonSubTypes.Type(value = AddUniqueGroup.class, name = "addUniqueGroup"),
        @JsonSubTypes.Type(value = DropUniqueGroup.class, name = "dropUniqueGroup"),
        @JsonSubTypes.Type(value = ModifyUniqueGroup.class, name = "modifyUniqueGroup")
})
public interface SchemaChange {

    /**
     * Short human readable summary shown to the operator before a unit is written.
     */
    String describe();
}
