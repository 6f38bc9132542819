package org.morm.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Named composite uniqueness constraint. Member order is significant and part of equality.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UniqueGroup {
    private String groupName;
    @Builder.Default private List<String> fieldNames = new ArrayList<>();

    public static UniqueGroup of(String groupName, List<String> fieldNames) {
        return new UniqueGroup(groupName, new ArrayList<>(fieldNames));
    }

    public List<String> getFieldNames() {
        return fieldNames != null ? fieldNames : List.of();
    }
}
