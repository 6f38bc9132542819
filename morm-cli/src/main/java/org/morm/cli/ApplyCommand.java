package org.morm.cli;

import org.morm.cli.service.EngineFactory;
import org.morm.migration.runner.ModelApplyReport;
import picocli.CommandLine;

import java.util.List;
import java.util.concurrent.Callable;

@CommandLine.Command(
        name = "apply",
        mixinStandardHelpOptions = true,
        description = "Apply queued migration units, one transaction per unit"
)
public class ApplyCommand implements Callable<Integer> {

    @CommandLine.Mixin
    private CommonOptions common;

    @Override
    public Integer call() {
        try {
            List<ModelApplyReport> reports = new EngineFactory(common).create(true).apply(common.getModelNames());

            boolean failed = false;
            for (ModelApplyReport report : reports) {
                if (report.isSuccess()) {
                    System.out.printf("%s: applied %s, now at %d%n",
                            report.getModel(), report.getAppliedSequences(), report.getLastAppliedSequence());
                } else {
                    failed = true;
                    System.err.printf("%s: %s%n", report.getModel(), report.getFailure().getMessage());
                    if (!report.getSkippedSequences().isEmpty()) {
                        System.err.printf("%s: not attempted %s%n", report.getModel(), report.getSkippedSequences());
                    }
                }
            }
            return failed ? 1 : 0;
        } catch (Exception e) {
            System.err.println("Apply failed: " + e.getMessage());
            return 1;
        }
    }
}
