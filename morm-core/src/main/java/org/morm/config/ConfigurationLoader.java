package org.morm.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.morm.options.MormOptions;
import org.morm.support.ObjectMappers;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

@Slf4j
public class ConfigurationLoader {

    private static final String CONFIG_FILE_NAME = MormOptions.Profile.CONFIG_FILE;
    private static final String DEFAULT_PROFILE = MormOptions.Profile.DEFAULT;
    private static final String PROFILE_ENV_VAR = MormOptions.Profile.ENV_VAR;

    private final ObjectMapper yamlMapper;
    private final Path startDirectory;
    private final Function<String, String> environment;

    public ConfigurationLoader() {
        this(Paths.get("").toAbsolutePath());
    }

    public ConfigurationLoader(Path startDirectory) {
        this(startDirectory, System::getenv);
    }

    public ConfigurationLoader(Path startDirectory, Function<String, String> environment) {
        this.yamlMapper = ObjectMappers.yaml();
        this.startDirectory = startDirectory;
        this.environment = environment;
    }

    /**
     * Loads {@code morm.yaml} and flattens the active profile into {@link MormOptions} keys.
     * Profile precedence: CLI, then the {@code MORM_PROFILE} environment variable, then {@code dev}.
     *
     * @param cliProfile profile given on the command line, may be {@code null}
     */
    public Map<String, String> loadConfiguration(String cliProfile) {
        String activeProfile = resolveActiveProfile(cliProfile);

        Optional<MormConfiguration> config = findAndLoadConfiguration();
        if (config.isEmpty()) {
            return createDefaultConfiguration();
        }

        return extractConfigurationForProfile(config.get(), activeProfile);
    }

    String resolveActiveProfile(String cliProfile) {
        if (cliProfile != null && !cliProfile.trim().isEmpty()) {
            return cliProfile;
        }

        String envProfile = environment.apply(PROFILE_ENV_VAR);
        if (envProfile != null && !envProfile.trim().isEmpty()) {
            return envProfile;
        }

        return DEFAULT_PROFILE;
    }

    /**
     * Looks for morm.yaml in the start directory and then in each parent.
     */
    private Optional<MormConfiguration> findAndLoadConfiguration() {
        Path currentDir = startDirectory;

        while (currentDir != null) {
            Path configFile = currentDir.resolve(CONFIG_FILE_NAME);
            if (Files.exists(configFile)) {
                try {
                    return Optional.of(yamlMapper.readValue(configFile.toFile(), MormConfiguration.class));
                } catch (IOException e) {
                    log.warn("Failed to parse {}: {}", configFile, e.getMessage());
                    return Optional.empty();
                }
            }
            currentDir = currentDir.getParent();
        }

        return Optional.empty();
    }

    private Map<String, String> extractConfigurationForProfile(MormConfiguration config, String profile) {
        var profileConfig = config.getProfiles().get(profile);
        if (profileConfig == null) {
            log.warn("Profile '{}' not found in configuration. Using defaults.", profile);
            return createDefaultConfiguration();
        }

        var configMap = new HashMap<>(createDefaultConfiguration());

        var migrations = profileConfig.getMigrations();
        if (migrations != null) {
            putIfPresent(configMap, MormOptions.Migrations.BASE_PATH_KEY, migrations.getBasePath());
            putIfPresent(configMap, MormOptions.Migrations.SEQUENCE_WIDTH_KEY, migrations.getSequenceWidth());
        }
        if (profileConfig.getModels() != null) {
            putIfPresent(configMap, MormOptions.Models.DESCRIPTOR_KEY, profileConfig.getModels().getDescriptor());
        }
        var database = profileConfig.getDatabase();
        if (database != null) {
            putIfPresent(configMap, MormOptions.Database.URL_KEY, database.getUrl());
            putIfPresent(configMap, MormOptions.Database.USERNAME_KEY, database.getUsername());
            putIfPresent(configMap, MormOptions.Database.PASSWORD_KEY, database.getPassword());
        }
        var apply = profileConfig.getApply();
        if (apply != null) {
            putIfPresent(configMap, MormOptions.Apply.PARALLELISM_KEY, apply.getParallelism());
            putIfPresent(configMap, MormOptions.Apply.STATEMENT_TIMEOUT_KEY, apply.getStatementTimeoutSeconds());
        }

        return configMap;
    }

    private static void putIfPresent(Map<String, String> configMap, String key, Object value) {
        if (value != null) {
            configMap.put(key, String.valueOf(value));
        }
    }

    private Map<String, String> createDefaultConfiguration() {
        return Map.of(
                MormOptions.Migrations.BASE_PATH_KEY, MormOptions.Migrations.BASE_PATH_DEFAULT,
                MormOptions.Migrations.SEQUENCE_WIDTH_KEY, String.valueOf(MormOptions.Migrations.SEQUENCE_WIDTH_DEFAULT),
                MormOptions.Models.DESCRIPTOR_KEY, MormOptions.Models.DESCRIPTOR_DEFAULT,
                MormOptions.Apply.PARALLELISM_KEY, String.valueOf(MormOptions.Apply.PARALLELISM_DEFAULT),
                MormOptions.Apply.STATEMENT_TIMEOUT_KEY, String.valueOf(MormOptions.Apply.STATEMENT_TIMEOUT_DEFAULT)
        );
    }
}
