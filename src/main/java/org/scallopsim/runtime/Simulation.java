package org.scallopsim.runtime;

import org.scallopsim.runtime.hydrodynamics.HydrodynamicSolution;
import org.scallopsim.runtime.hydrodynamics.IHydrodynamicModel;
import org.scallopsim.runtime.integration.ITimeIntegrator;
import org.scallopsim.runtime.output.ITrajectorySink;
import org.scallopsim.runtime.output.TrajectoryWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Drives the scallop through time. Each step solves the hydrodynamic model at the current time and
 * hinge position, advances the hinge with the configured integrator, appends
 * {@code (t, U, x)} to the output and moves to {@code t + dt}. Stepping continues while
 * {@code t < T}.
 * <p>
 * A run is all-or-nothing: a singular system or an output failure aborts it, leaving the rows
 * written so far intact.
 */
public class Simulation {

    private static final Logger LOG = LoggerFactory.getLogger(Simulation.class);

    /** Relative slack when counting steps, so that {@code T = n dt} yields exactly {@code n} steps. */
    private static final double STEP_COUNT_TOLERANCE = 1e-9;

    private final IHydrodynamicModel model;
    private final ITimeIntegrator integrator;
    private final double timeStep;
    private final long totalSteps;
    private final SimulationState state = new SimulationState();

    /**
     * @param model      The hydrodynamic model.
     * @param integrator The integrator for the hinge position; bound to this simulation.
     * @param timeStep   The time step.
     * @param duration   The simulated duration, at least one time step.
     */
    public Simulation(IHydrodynamicModel model, ITimeIntegrator integrator, double timeStep, double duration) {
        if (!(timeStep > 0.0) || Double.isInfinite(timeStep)) {
            throw new IllegalArgumentException("Time step must be positive, got " + timeStep);
        }
        if (!Double.isFinite(duration) || duration < timeStep) {
            throw new IllegalArgumentException("Duration must be at least one time step, got " + duration);
        }
        this.model = model;
        this.integrator = integrator;
        this.timeStep = timeStep;
        this.totalSteps = countSteps(timeStep, duration);
    }

    /**
     * Number of steps {@code n} with {@code n dt < T}.
     *
     * @param timeStep The time step.
     * @param duration The duration.
     * @return the step count.
     */
    public static long countSteps(double timeStep, double duration) {
        return (long) Math.ceil(duration / timeStep - STEP_COUNT_TOLERANCE);
    }

    /**
     * @return true once every step has been taken.
     */
    public boolean isFinished() {
        return state.getStepIndex() >= totalSteps;
    }

    /**
     * Executes one time step.
     *
     * @return the row produced by the step.
     * @throws SingularSystemException if the hydrodynamic system of this step cannot be solved.
     * @throws IllegalStateException if the simulation has already finished.
     */
    public StepRecord step() throws SingularSystemException {
        if (isFinished()) {
            throw new IllegalStateException("Simulation already finished after " + totalSteps + " steps");
        }
        final double time = state.getTime();
        final HydrodynamicSolution solution;
        try {
            solution = model.solve(time, state.getHingePosition());
        } catch (SingularSystemException e) {
            throw new SingularSystemException(
                String.format(Locale.ROOT, "Step %d at t=%.5f: %s", state.getStepIndex(), time, e.getMessage()), e);
        }
        final double speed = solution.translationSpeed();
        final double position = integrator.advance(state.getHingePosition(), speed, timeStep);
        state.advance(speed, position, timeStep);

        if (LOG.isDebugEnabled()) {
            LOG.debug("t={} U={} x={} netForceX={}", time, speed, position, solution.netForceX());
        }
        return new StepRecord(time, speed, position);
    }

    /**
     * Steps until finished, appending every row to {@code sink}. The sink is not closed.
     *
     * @param sink The destination of the rows.
     * @return the number of steps executed.
     * @throws SingularSystemException if a step cannot be solved; earlier rows remain in the sink.
     * @throws IOException if a row cannot be written.
     */
    public long run(ITrajectorySink sink) throws SingularSystemException, IOException {
        LOG.info("Running {} steps of dt={} with model '{}' and integrator '{}'",
            totalSteps - state.getStepIndex(), timeStep, model.getName(), integrator.getName());
        final long startNanos = System.nanoTime();
        long executed = 0;
        while (!isFinished()) {
            sink.append(step());
            executed++;
        }
        LOG.info("Finished {} steps in {} ms; final hinge position {}",
            executed, (System.nanoTime() - startNanos) / 1_000_000, state.getHingePosition());
        return executed;
    }

    /**
     * Runs to completion, writing the trajectory to {@code output}. The file is created or truncated,
     * flushed after every row and closed on return.
     *
     * @param output The output file.
     * @return the number of steps executed.
     * @throws SingularSystemException if a step cannot be solved.
     * @throws IOException if the file cannot be written.
     */
    public long run(Path output) throws SingularSystemException, IOException {
        try (TrajectoryWriter writer = TrajectoryWriter.open(output)) {
            return run(writer);
        }
    }

    public SimulationState getState() {
        return state;
    }

    public long getTotalSteps() {
        return totalSteps;
    }

    public double getTimeStep() {
        return timeStep;
    }

    public IHydrodynamicModel getModel() {
        return model;
    }
}
