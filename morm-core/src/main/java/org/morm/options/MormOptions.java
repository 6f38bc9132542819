package org.morm.options;

/**
 * Configuration keys shared by the configuration loader, the engine and the CLI.
 */
public final class MormOptions {

    private MormOptions() {
    }

    public static final class Profile {
        private Profile() {}

        public static final String DEFAULT = "dev";

        public static final String ENV_VAR = "MORM_PROFILE";

        public static final String CONFIG_FILE = "morm.yaml";
    }

    public static final class Migrations {
        private Migrations() {}

        /**
         * Directory holding one sub-directory of units and snapshots per model.
         */
        public static final String BASE_PATH_KEY = "morm.migrations.basePath";
        public static final String BASE_PATH_DEFAULT = "migrations";

        /**
         * Zero padding of the sequence in unit file names.
         * Default: 8
         */
        public static final String SEQUENCE_WIDTH_KEY = "morm.migrations.sequenceWidth";
        public static final int SEQUENCE_WIDTH_DEFAULT = 8;
    }

    public static final class Models {
        private Models() {}

        /**
         * YAML or JSON file declaring the models.
         */
        public static final String DESCRIPTOR_KEY = "morm.models.descriptor";
        public static final String DESCRIPTOR_DEFAULT = "models.yaml";
    }

    public static final class Database {
        private Database() {}

        public static final String URL_KEY = "morm.database.url";
        public static final String USERNAME_KEY = "morm.database.username";
        public static final String PASSWORD_KEY = "morm.database.password";
    }

    public static final class Apply {
        private Apply() {}

        /**
         * Number of models applied concurrently.
         * Default: 1
         */
        public static final String PARALLELISM_KEY = "morm.apply.parallelism";
        public static final int PARALLELISM_DEFAULT = 1;

        /**
         * Timeout per statement in seconds, 0 disables it.
         */
        public static final String STATEMENT_TIMEOUT_KEY = "morm.apply.statementTimeoutSeconds";
        public static final int STATEMENT_TIMEOUT_DEFAULT = 0;
    }
}
