package org.morm.model;

import lombok.Getter;
import org.morm.exception.DeclarationException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Explicit declaration of a model: fields are registered in order through the builder
 * instead of being discovered from class attributes.
 */
@Getter
public class ModelDefinition {
    private final String name;
    private final String table;
    private final String primaryKey;
    private final Class<?> javaType;
    private final boolean abstractModel;
    private final Map<String, FieldSpec> fields;
    private final Map<String, UniqueGroup> uniqueGroups;

    private ModelDefinition(Builder b) {
        this.name = b.name;
        this.table = b.table != null ? b.table : b.name;
        this.primaryKey = b.primaryKey;
        this.javaType = b.javaType;
        this.abstractModel = b.abstractModel;
        this.fields = b.fields;
        this.uniqueGroups = b.uniqueGroups;
    }

    /**
     * Flattened, validated schema description of this model. Each call returns a fresh copy.
     */
    public SchemaSnapshot describe() {
        Map<String, FieldSpec> f = new LinkedHashMap<>();
        fields.forEach((k, v) -> f.put(k, v.toBuilder()
                .alterOps(new ArrayList<>(v.getAlterOps()))
                .indexSpecs(new ArrayList<>(v.getIndexSpecs()))
                .build()));
        Map<String, UniqueGroup> g = new LinkedHashMap<>();
        uniqueGroups.forEach((k, v) -> g.put(k, UniqueGroup.of(v.getGroupName(), v.getFieldNames())));

        SchemaSnapshot snapshot = SchemaSnapshot.builder()
                .table(table)
                .primaryKey(primaryKey)
                .fields(f)
                .uniqueGroups(g)
                .build();
        SchemaValidator.validate(snapshot);
        return snapshot;
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public static class Builder {
        private final String name;
        private String table;
        private String primaryKey;
        private Class<?> javaType;
        private boolean abstractModel;
        private final Map<String, FieldSpec> fields = new LinkedHashMap<>();
        private final Map<String, UniqueGroup> uniqueGroups = new LinkedHashMap<>();

        private Builder(String name) {
            if (name == null || name.isBlank()) {
                throw new DeclarationException("Model name must not be blank");
            }
            this.name = name;
        }

        public Builder table(String table) {
            this.table = table;
            return this;
        }

        public Builder primaryKey(String primaryKey) {
            this.primaryKey = primaryKey;
            return this;
        }

        public Builder javaType(Class<?> javaType) {
            this.javaType = javaType;
            return this;
        }

        public Builder abstractModel(boolean abstractModel) {
            this.abstractModel = abstractModel;
            return this;
        }

        public Builder field(FieldSpec field) {
            if (field == null || field.getName() == null) {
                throw new DeclarationException("Field of model '" + name + "' has no name");
            }
            if (fields.putIfAbsent(field.getName(), field) != null) {
                throw new DeclarationException("Duplicate field '" + field.getName() + "' in model '" + name + "'");
            }
            return this;
        }

        public Builder field(String fieldName, String sqlType) {
            return field(FieldSpec.of(fieldName, sqlType));
        }

        public Builder uniqueGroup(String groupName, String... fieldNames) {
            return uniqueGroup(groupName, List.of(fieldNames));
        }

        public Builder uniqueGroup(String groupName, List<String> fieldNames) {
            if (uniqueGroups.putIfAbsent(groupName, UniqueGroup.of(groupName, fieldNames)) != null) {
                throw new DeclarationException("Duplicate unique group '" + groupName + "' in model '" + name + "'");
            }
            return this;
        }

        public ModelDefinition build() {
            return new ModelDefinition(this);
        }
    }
}
