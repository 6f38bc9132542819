package org.morm.cli.service;

import org.morm.cli.CommonOptions;
import org.morm.config.ConfigurationLoader;
import org.morm.config.ModelDescriptorLoader;
import org.morm.db.DriverManagerConnectionProvider;
import org.morm.db.JdbcTransactionManager;
import org.morm.db.TransactionManager;
import org.morm.migration.MigrationEngine;
import org.morm.migration.MigrationSettings;
import org.morm.model.ModelRegistry;
import org.morm.options.MormOptions;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.Map;

/**
 * Resolves configuration for a command and wires the engine.
 */
public class EngineFactory {

    private final CommonOptions options;
    private final Map<String, String> config;

    public EngineFactory(CommonOptions options) {
        this.options = options;
        Path start = options.getConfigDir() != null
                ? options.getConfigDir().toAbsolutePath()
                : Paths.get("").toAbsolutePath();
        this.config = applyOverrides(new ConfigurationLoader(start).loadConfiguration(options.getProfile()));
    }

    public MigrationEngine create(boolean needsDatabase) {
        ModelRegistry registry = new ModelDescriptorLoader()
                .load(Paths.get(config.get(MormOptions.Models.DESCRIPTOR_KEY)));
        MigrationSettings settings = MigrationSettings.fromConfiguration(config);
        return new MigrationEngine(registry, settings, needsDatabase ? transactionManager(settings) : null);
    }

    public Map<String, String> getConfig() {
        return Map.copyOf(config);
    }

    private TransactionManager transactionManager(MigrationSettings settings) {
        String url = config.get(MormOptions.Database.URL_KEY);
        if (url == null || url.isBlank()) {
            throw new IllegalArgumentException("No database url configured; use --db-url or database.url in "
                    + MormOptions.Profile.CONFIG_FILE);
        }
        return new JdbcTransactionManager(
                new DriverManagerConnectionProvider(url,
                        config.get(MormOptions.Database.USERNAME_KEY),
                        config.get(MormOptions.Database.PASSWORD_KEY)),
                settings.getStatementTimeoutSeconds());
    }

    private Map<String, String> applyOverrides(Map<String, String> loaded) {
        Map<String, String> merged = new HashMap<>(loaded);
        if (options.getModelsDescriptor() != null) {
            merged.put(MormOptions.Models.DESCRIPTOR_KEY, options.getModelsDescriptor().toString());
        }
        if (options.getBasePath() != null) {
            merged.put(MormOptions.Migrations.BASE_PATH_KEY, options.getBasePath().toString());
        }
        if (options.getDbUrl() != null) {
            merged.put(MormOptions.Database.URL_KEY, options.getDbUrl());
        }
        if (options.getDbUser() != null) {
            merged.put(MormOptions.Database.USERNAME_KEY, options.getDbUser());
        }
        if (options.getDbPassword() != null) {
            merged.put(MormOptions.Database.PASSWORD_KEY, options.getDbPassword());
        }
        return merged;
    }
}
