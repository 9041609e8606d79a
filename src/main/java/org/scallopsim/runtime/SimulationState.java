package org.scallopsim.runtime;

/**
 * Mutable state of a running simulation. Owned by {@link Simulation} and advanced once per step.
 */
public final class SimulationState {

    private long stepIndex;
    private double time;
    private double hingePosition;
    private double translationSpeed;

    /**
     * Creates the initial state: step zero, {@code t = 0}, hinge at the origin.
     */
    public SimulationState() {
        this(0L, 0.0, 0.0, 0.0);
    }

    SimulationState(long stepIndex, double time, double hingePosition, double translationSpeed) {
        this.stepIndex = stepIndex;
        this.time = time;
        this.hingePosition = hingePosition;
        this.translationSpeed = translationSpeed;
    }

    /**
     * Records the outcome of the current step and moves to the next one.
     *
     * @param speed       The translation speed solved at the current time.
     * @param newPosition The hinge position after integration.
     * @param timeStep    The time step of the run.
     */
    void advance(double speed, double newPosition, double timeStep) {
        this.translationSpeed = speed;
        this.hingePosition = newPosition;
        this.stepIndex++;
        // t_n = n * dt avoids drift from repeated addition
        this.time = stepIndex * timeStep;
    }

    public long getStepIndex() {
        return stepIndex;
    }

    public double getTime() {
        return time;
    }

    public double getHingePosition() {
        return hingePosition;
    }

    public double getTranslationSpeed() {
        return translationSpeed;
    }

    @Override
    public String toString() {
        return "SimulationState{step=" + stepIndex + ", t=" + time + ", x=" + hingePosition
            + ", U=" + translationSpeed + "}";
    }
}
