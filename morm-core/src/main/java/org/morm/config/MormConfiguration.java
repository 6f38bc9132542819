package org.morm.config;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.ToString;

import java.util.HashMap;
import java.util.Map;

/**
 * Contents of {@code morm.yaml}.
 */
@Data
public class MormConfiguration {

    @JsonProperty("profiles")
    private Map<String, ProfileConfiguration> profiles = new HashMap<>();

    @Data
    public static class ProfileConfiguration {

        @JsonProperty("migrations")
        private MigrationsConfiguration migrations;

        @JsonProperty("models")
        private ModelsConfiguration models;

        @JsonProperty("database")
        private DatabaseConfiguration database;

        @JsonProperty("apply")
        private ApplyConfiguration apply;
    }

    @Data
    public static class MigrationsConfiguration {

        @JsonProperty("basePath")
        private String basePath;

        @JsonProperty("sequenceWidth")
        private Integer sequenceWidth;
    }

    @Data
    public static class ModelsConfiguration {

        @JsonProperty("descriptor")
        private String descriptor;
    }

    @Data
    public static class DatabaseConfiguration {

        @JsonProperty("url")
        private String url;

        @JsonProperty("username")
        private String username;

        @ToString.Exclude
        private String password;
    }

    @Data
    public static class ApplyConfiguration {

        @JsonProperty("parallelism")
        private Integer parallelism;

        @JsonProperty("statementTimeoutSeconds")
        private Integer statementTimeoutSeconds;
    }
}
