package org.scallopsim.runtime.hydrodynamics;

import org.apache.commons.math3.linear.RealVector;

/**
 * Outcome of one hydrodynamic solve.
 *
 * @param translationSpeed Rigid translation speed of the hinge along x.
 * @param forceDensities   Solved force densities of the upper filament, components interleaved per element.
 * @param netForceX        Quadrature-weighted sum of the x force densities; zero up to solver tolerance.
 */
public record HydrodynamicSolution(double translationSpeed, RealVector forceDensities, double netForceX) {
}
