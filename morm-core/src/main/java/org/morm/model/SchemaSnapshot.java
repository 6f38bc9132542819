package org.morm.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Structural state of one model's table at a point in time.
 * Field and unique-group maps keep declaration order, which only matters for {@code CREATE TABLE}.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class SchemaSnapshot {
    private String table;
    @Builder.Default private String primaryKey = null;
    @Builder.Default private Map<String, FieldSpec> fields = new LinkedHashMap<>();
    @Builder.Default private Map<String, UniqueGroup> uniqueGroups = new LinkedHashMap<>();

    public Map<String, FieldSpec> getFields() {
        return fields != null ? fields : Map.of();
    }

    public Map<String, UniqueGroup> getUniqueGroups() {
        return uniqueGroups != null ? uniqueGroups : Map.of();
    }

    @JsonIgnore
    public FieldSpec field(String name) {
        return getFields().get(name);
    }

    /**
     * Convenience for tests and descriptor loading: snapshot with the given fields in order.
     */
    public static SchemaSnapshot of(String table, List<FieldSpec> fields, List<UniqueGroup> groups) {
        Map<String, FieldSpec> byName = new LinkedHashMap<>();
        fields.forEach(f -> byName.put(f.getName(), f));
        Map<String, UniqueGroup> groupsByName = new LinkedHashMap<>();
        groups.forEach(g -> groupsByName.put(g.getGroupName(), g));
        return SchemaSnapshot.builder().table(table).fields(byName).uniqueGroups(groupsByName).build();
    }
}
