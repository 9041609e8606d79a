package org.scallopsim.runtime.hydrodynamics;

import org.scallopsim.runtime.SingularSystemException;

/**
 * A hydrodynamic model of the force-free scallop: given the prescribed stroke at some time,
 * it solves for the translation speed of the hinge.
 */
public interface IHydrodynamicModel {

    /**
     * Updates the geometry to {@code time} and {@code hingePosition}, rebuilds the linear system
     * and solves it once.
     *
     * @param time          The simulation time.
     * @param hingePosition The current hinge x-position.
     * @return the solution of this step.
     * @throws SingularSystemException if the system cannot be solved.
     */
    HydrodynamicSolution solve(double time, double hingePosition) throws SingularSystemException;

    /**
     * @return a short name used in log output.
     */
    String getName();
}
