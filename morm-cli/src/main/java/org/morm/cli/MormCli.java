package org.morm.cli;

import picocli.CommandLine;

/**
 * Main CLI entry point: generate, apply and maintain per-model migration units.
 */
@CommandLine.Command(
        name = "morm",
        mixinStandardHelpOptions = true,
        version = "morm 0.1.0",
        description = "Per-model schema migrations: diff declarations, queue units, apply them transactionally",
        subcommands = {
                GenerateCommand.class,
                ApplyCommand.class,
                DeleteRangeCommand.class,
                StatusCommand.class
        }
)
public class MormCli {
    public static void main(String[] args) {
        int exitCode = new CommandLine(new MormCli()).execute(args);
        System.exit(exitCode);
    }
}
