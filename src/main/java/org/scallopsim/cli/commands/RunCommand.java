package org.scallopsim.cli.commands;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.scallopsim.cli.CommandLineInterface;
import org.scallopsim.config.ScallopConfiguration;
import org.scallopsim.runtime.ScallopParameters;
import org.scallopsim.runtime.Simulation;
import org.scallopsim.runtime.SingularSystemException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.ParentCommand;

import java.io.File;
import java.io.IOException;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.Callable;

@Command(
    name = "run",
    description = "Runs a simulation and writes the trajectory (t, U, x) to the output file."
)
public class RunCommand implements Callable<Integer> {

    private static final Logger LOGGER = LoggerFactory.getLogger(RunCommand.class);

    @ParentCommand
    private CommandLineInterface parent;

    @Option(names = {"-o", "--output"}, description = "Trajectory file; overrides scallop.output.file.")
    private File output;

    @Option(names = "--model", description = "boundary-element or slender-body; overrides scallop.model.")
    private String model;

    @Option(names = "--integrator", description = "explicit-euler or adams-bashforth-2; overrides scallop.integrator.")
    private String integrator;

    @Option(names = "--duration", description = "Simulated time; overrides scallop.time.duration.")
    private Double duration;

    @Option(names = "--time-step", description = "Time step; overrides scallop.time.step.")
    private Double timeStep;

    @Option(names = "--segments", description = "Boundary elements per filament; overrides scallop.filament.segments.")
    private Integer segments;

    @Override
    public Integer call() {
        final ScallopConfiguration configuration;
        try {
            configuration = ScallopConfiguration.fromConfig(withOverrides(parent.getConfig()));
        } catch (ConfigException | IllegalArgumentException e) {
            LOGGER.error("Invalid configuration: {}", e.getMessage());
            return 1;
        }

        final ScallopParameters p = configuration.parameters();
        LOGGER.info("Model={} integrator={} amplitude={} tilt={} period={} length={} segments={} "
                + "dt={} T={} delta={} quadrature={}",
            configuration.model().getKey(), configuration.integrator().getKey(), p.amplitude(), p.tilt(),
            p.period(), p.length(), p.segments(), p.timeStep(), p.duration(), p.regularization(),
            p.quadratureOrder());

        final Simulation simulation = configuration.createSimulation();
        try {
            final long steps = simulation.run(configuration.outputFile());
            LOGGER.info("Wrote {} steps to {}", steps, configuration.outputFile().toAbsolutePath());
            return 0;
        } catch (SingularSystemException e) {
            LOGGER.error("Simulation aborted: {}", e.getMessage());
            return 1;
        } catch (IOException e) {
            LOGGER.error("Failed to write trajectory to {}: {}", configuration.outputFile(), e.getMessage());
            return 1;
        }
    }

    private Config withOverrides(Config config) {
        final Map<String, Object> overrides = new HashMap<>();
        if (output != null) {
            overrides.put("scallop.output.file", output.getPath());
        }
        if (model != null) {
            overrides.put("scallop.model", model);
        }
        if (integrator != null) {
            overrides.put("scallop.integrator", integrator);
        }
        if (duration != null) {
            overrides.put("scallop.time.duration", duration);
        }
        if (timeStep != null) {
            overrides.put("scallop.time.step", timeStep);
        }
        if (segments != null) {
            overrides.put("scallop.filament.segments", segments);
        }
        return ConfigFactory.parseMap(overrides, "command line").withFallback(config);
    }
}
