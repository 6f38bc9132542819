package org.morm.cli;

import lombok.Getter;
import picocli.CommandLine;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Options shared by every subcommand. Values given here win over morm.yaml.
 */
@Getter
public class CommonOptions {

    @CommandLine.Option(names = "--profile", description = "Configuration profile (dev, prod, test ...)")
    private String profile;

    @CommandLine.Option(names = "--config-dir", description = "Directory where the search for morm.yaml starts")
    private Path configDir;

    @CommandLine.Option(names = "--models", description = "Model descriptor file (YAML or JSON)")
    private Path modelsDescriptor;

    @CommandLine.Option(names = "--base-path", description = "Directory of migration units and snapshots")
    private Path basePath;

    @CommandLine.Option(names = "--db-url", description = "JDBC url")
    private String dbUrl;

    @CommandLine.Option(names = "--db-user", description = "Database user")
    private String dbUser;

    @CommandLine.Option(names = "--db-password", description = "Database password")
    private String dbPassword;

    @CommandLine.Option(names = {"-m", "--model"}, description = "Model to process; repeat for several, omit for all")
    private List<String> modelNames = new ArrayList<>();
}
