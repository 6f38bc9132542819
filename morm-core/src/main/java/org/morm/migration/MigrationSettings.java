package org.morm.migration;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import org.morm.migration.unit.MigrationUnitRepository;
import org.morm.options.MormOptions;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;

@Getter
@Builder
@ToString
public class MigrationSettings {
    private final Path basePath;
    @Builder.Default private final int sequenceWidth = MigrationUnitRepository.DEFAULT_SEQUENCE_WIDTH;
    /** Models applied at the same time. Units of one model are always applied one by one. */
    @Builder.Default private final int parallelism = 1;
    /** Per statement, 0 for none. */
    @Builder.Default private final int statementTimeoutSeconds = 0;

    /**
     * Settings from a flattened configuration map as produced by the configuration loader.
     */
    public static MigrationSettings fromConfiguration(Map<String, String> config) {
        return MigrationSettings.builder()
                .basePath(Paths.get(config.getOrDefault(MormOptions.Migrations.BASE_PATH_KEY,
                        MormOptions.Migrations.BASE_PATH_DEFAULT)))
                .sequenceWidth(intValue(config, MormOptions.Migrations.SEQUENCE_WIDTH_KEY,
                        MormOptions.Migrations.SEQUENCE_WIDTH_DEFAULT))
                .parallelism(intValue(config, MormOptions.Apply.PARALLELISM_KEY,
                        MormOptions.Apply.PARALLELISM_DEFAULT))
                .statementTimeoutSeconds(intValue(config, MormOptions.Apply.STATEMENT_TIMEOUT_KEY,
                        MormOptions.Apply.STATEMENT_TIMEOUT_DEFAULT))
                .build();
    }

    private static int intValue(Map<String, String> config, String key, int defaultValue) {
        String value = config.get(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Configuration value of " + key + " is not a number: " + value, e);
        }
    }
}
