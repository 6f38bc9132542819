package org.morm.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import org.morm.model.FieldSpec;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * File form of model declarations, read by {@link ModelDescriptorLoader}.
 */
@Data
public class ModelDescriptor {

    @JsonProperty("models")
    private List<ModelEntry> models = new ArrayList<>();

    @Data
    public static class ModelEntry {

        @JsonProperty("name")
        private String name;

        @JsonProperty("table")
        private String table;

        @JsonProperty("primaryKey")
        private String primaryKey;

        /** Class name handed to hooks as the model's declared type. */
        @JsonProperty("javaType")
        private String javaType;

        @JsonProperty("abstract")
        private boolean abstractModel;

        /** Model whose fields and unique groups come first. */
        @JsonProperty("extends")
        private String parent;

        @JsonProperty("fields")
        private List<FieldSpec> fields = new ArrayList<>();

        @JsonProperty("uniqueGroups")
        private Map<String, List<String>> uniqueGroups = new LinkedHashMap<>();
    }
}
