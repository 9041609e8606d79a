package org.scallopsim.cli.commands;

import org.scallopsim.runtime.StepRecord;
import org.scallopsim.runtime.output.TrajectoryReader;
import org.scallopsim.runtime.output.TrajectorySummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;

@Command(
    name = "summary",
    description = "Prints statistics of a trajectory file written by 'run'."
)
public class SummaryCommand implements Callable<Integer> {

    private static final Logger LOGGER = LoggerFactory.getLogger(SummaryCommand.class);

    @Spec
    private CommandSpec spec;

    @Parameters(index = "0", description = "Trajectory file.")
    private Path trajectory;

    @Option(names = "--period", description = "Oscillation period used for the drift per period. Default: 1.0",
        defaultValue = "1.0")
    private double period;

    @Override
    public Integer call() {
        final List<StepRecord> records;
        try {
            records = TrajectoryReader.read(trajectory);
        } catch (IOException e) {
            LOGGER.error("Cannot read trajectory {}: {}", trajectory, e.getMessage());
            return 1;
        }
        if (records.isEmpty()) {
            LOGGER.error("Trajectory {} is empty", trajectory);
            return 1;
        }
        if (!(period > 0.0)) {
            LOGGER.error("Period must be positive, got {}", period);
            return 1;
        }

        final TrajectorySummary summary = TrajectorySummary.of(records, period);
        final PrintWriter out = spec.commandLine().getOut();
        out.println(String.format(Locale.ROOT, "steps:                %d", summary.stepCount()));
        out.println(String.format(Locale.ROOT, "time span:            %.5f .. %.5f", summary.startTime(), summary.endTime()));
        out.println(String.format(Locale.ROOT, "mean U:               %.10f", summary.meanSpeed()));
        out.println(String.format(Locale.ROOT, "min U:                %.10f", summary.minSpeed()));
        out.println(String.format(Locale.ROOT, "max U:                %.10f", summary.maxSpeed()));
        out.println(String.format(Locale.ROOT, "final x:              %.10f", summary.finalDisplacement()));
        out.println(String.format(Locale.ROOT, "drift per period:     %.10f", summary.displacementPerPeriod()));
        out.flush();
        return 0;
    }
}
