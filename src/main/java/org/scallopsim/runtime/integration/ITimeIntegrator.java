package org.scallopsim.runtime.integration;

/**
 * Advances the hinge position from the translation speed solved at the current step.
 * Implementations may keep history and are bound to a single run.
 */
public interface ITimeIntegrator {

    /**
     * @param position The current hinge position.
     * @param speed    The translation speed solved at the current time.
     * @param timeStep The time step.
     * @return the hinge position one step later.
     */
    double advance(double position, double speed, double timeStep);

    /**
     * @return a short name used in log output.
     */
    String getName();
}
