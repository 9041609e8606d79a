package org.scallopsim.runtime;

/**
 * One row of the trajectory: the state reported for a single time step.
 *
 * @param time             Time at which the hydrodynamic system was solved.
 * @param translationSpeed Solved translation speed of the hinge along x.
 * @param hingePosition    Hinge x-position after advancing by this step's speed.
 */
public record StepRecord(double time, double translationSpeed, double hingePosition) {
}
