package org.morm.cli;

import org.morm.cli.service.ConsoleChangeReview;
import org.morm.cli.service.EngineFactory;
import org.morm.migration.MigrationEngine;
import org.morm.migration.unit.MigrationUnit;
import picocli.CommandLine;

import java.io.BufferedReader;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Diffs each model's declaration against its latest snapshot and queues a unit for the changes.
 */
@CommandLine.Command(
        name = "generate",
        mixinStandardHelpOptions = true,
        description = "Detect declaration changes and queue migration units"
)
public class GenerateCommand implements Callable<Integer> {

    @CommandLine.Mixin
    private CommonOptions common;

    @CommandLine.Option(names = {"-y", "--yes"}, description = "Write every unit without asking")
    private boolean yes;

    @CommandLine.Option(names = {"-q", "--quiet"}, description = "Do not print the generated SQL")
    private boolean quiet;

    @Override
    public Integer call() {
        try {
            MigrationEngine engine = new EngineFactory(common).create(false);
            ConsoleChangeReview review = new ConsoleChangeReview(
                    new BufferedReader(new InputStreamReader(System.in, StandardCharsets.UTF_8)),
                    System.out, quiet, yes);

            List<MigrationUnit> written = engine.generate(common.getModelNames(), review);
            if (written.isEmpty()) {
                System.out.println("No migration written.");
                return 0;
            }
            for (MigrationUnit unit : written) {
                System.out.println("Queued " + engine.getRepository().unitFile(unit.getModel(), unit.getSequence()));
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Generation failed: " + e.getMessage());
            return 1;
        }
    }
}
