package org.morm.cli;

import org.morm.cli.service.EngineFactory;
import picocli.CommandLine;

import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Removes queued units by sequence range. Applied units are never deleted.
 */
@CommandLine.Command(
        name = "delete-range",
        mixinStandardHelpOptions = true,
        description = "Delete queued, not yet applied units with sequence in [start, end]"
)
public class DeleteRangeCommand implements Callable<Integer> {

    @CommandLine.Mixin
    private CommonOptions common;

    @CommandLine.Parameters(index = "0", description = "First sequence to delete")
    private long start;

    @CommandLine.Parameters(index = "1", description = "Last sequence to delete")
    private long end;

    @Override
    public Integer call() {
        try {
            Map<String, List<Long>> deleted = new EngineFactory(common).create(false)
                    .deleteRange(common.getModelNames(), start, end);
            deleted.forEach((model, sequences) -> System.out.printf("%s: deleted %s%n", model, sequences));
            return 0;
        } catch (Exception e) {
            System.err.println("Delete failed: " + e.getMessage());
            return 1;
        }
    }
}
