package org.morm.cli;

import org.morm.cli.service.EngineFactory;
import org.morm.migration.ModelStatus;
import picocli.CommandLine;

import java.util.List;
import java.util.concurrent.Callable;

@CommandLine.Command(
        name = "status",
        mixinStandardHelpOptions = true,
        description = "Show applied, queued and failed units per model"
)
public class StatusCommand implements Callable<Integer> {

    @CommandLine.Mixin
    private CommonOptions common;

    @Override
    public Integer call() {
        try {
            List<ModelStatus> statuses = new EngineFactory(common).create(false).status(common.getModelNames());
            for (ModelStatus s : statuses) {
                System.out.printf("%s (table %s): applied up to %d, queued %s, failed %s%s%n",
                        s.model(), s.table(), s.lastAppliedSequence(), s.queued(), s.failed(),
                        s.pendingChanges() ? ", declaration has changes not yet generated" : "");
            }
            return 0;
        } catch (Exception e) {
            System.err.println("Status failed: " + e.getMessage());
            return 1;
        }
    }
}
