package org.morm.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * One column of a model. The name is the identity used for diffing; position is irrelevant.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class FieldSpec {
    private String name;
    private String sqlType;
    /** DDL fragment used only when the column is created, e.g. {@code NOT NULL}. */
    @Builder.Default private String onAdd = "";
    /** Fragments rendered as {@code ALTER COLUMN ... <op>} whenever the field is modified. */
    @Builder.Default private List<String> alterOps = new ArrayList<>();
    /** Index specs in {@code [-]kind[:opclass]} form. */
    @Builder.Default private List<String> indexSpecs = new ArrayList<>();
    @Builder.Default private boolean unique = false;

    public static FieldSpec of(String name, String sqlType) {
        return FieldSpec.builder().name(name).sqlType(sqlType).build();
    }

    public String getOnAdd() {
        return onAdd != null ? onAdd : "";
    }

    public List<String> getAlterOps() {
        return alterOps != null ? alterOps : List.of();
    }

    public List<String> getIndexSpecs() {
        return indexSpecs != null ? indexSpecs : List.of();
    }

    @JsonIgnore
    public List<IndexSpec> parsedIndexSpecs() {
        return getIndexSpecs().stream().map(IndexSpec::parse).toList();
    }

    /**
     * Same column definition, ignoring indexes and the unique flag which are diffed separately.
     */
    public boolean sameColumnDefinition(FieldSpec other) {
        return normalize(sqlType).equals(normalize(other.sqlType))
                && getOnAdd().trim().equals(other.getOnAdd().trim())
                && getAlterOps().equals(other.getAlterOps());
    }

    private static String normalize(String s) {
        return s == null ? "" : s.trim().replaceAll("\\s+", " ");
    }
}
