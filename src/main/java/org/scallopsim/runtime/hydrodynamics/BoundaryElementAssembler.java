package org.scallopsim.runtime.hydrodynamics;

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.scallopsim.runtime.model.Filament;
import org.scallopsim.runtime.model.ScallopGeometry;
import org.scallopsim.runtime.quadrature.QuadraturePoints;
import org.scallopsim.runtime.quadrature.QuadratureSampler;

/**
 * Builds the {@code (3N+1) x (3N+1)} boundary-element system for the current geometry.
 * <p>
 * Unknowns are the force densities of the upper filament's segments, {@code (f_x, f_y, f_z)} per
 * segment, followed by the translation speed {@code U}. The lower filament's force densities are the
 * y-mirror of the upper ones, so its contribution is folded into the same columns through
 * {@code diag(1, -1, 1)}. This halves the unknown count and only holds for the antisymmetric
 * two-filament stroke.
 * <p>
 * Row block {@code i} states that the velocity induced at the upper midpoint {@code i}, minus {@code U}
 * in the x-row, equals the rotational velocity prescribed there. The last row requires the net
 * x-force {@code sum_i ds f_x,i} to vanish.
 */
public final class BoundaryElementAssembler {

    private static final double[] MIRROR = {1.0, -1.0, 1.0};

    private final ScallopGeometry geometry;
    private final QuadratureSampler sampler;
    private final RegularizedStokeslet kernel;

    /**
     * @param geometry Geometry of the current step; must be updated before {@link #assemble()}.
     * @param sampler  Sampler over the same geometry.
     * @param kernel   The Stokeslet kernel.
     */
    public BoundaryElementAssembler(ScallopGeometry geometry, QuadratureSampler sampler, RegularizedStokeslet kernel) {
        this.geometry = geometry;
        this.sampler = sampler;
        this.kernel = kernel;
    }

    /**
     * Assembles a fresh system from the geometry's current state.
     * @return the assembled system.
     */
    public InteractionSystem assemble() {
        final int n = geometry.getSegmentCount();
        final int size = 3 * n + 1;
        final int speedColumn = 3 * n;
        final double[][] lhs = new double[size][size];
        final double[] rhs = new double[size];

        final Filament upper = geometry.upper();
        final Filament lower = geometry.lower();
        final QuadraturePoints[] upperPoints = sampler.sampleAll(upper);
        final QuadraturePoints[] lowerPoints = sampler.sampleAll(lower);

        final double theta = upper.getAngle();
        final double thetaDot = upper.getAngularVelocity();
        final double normalX = -Math.sin(theta);
        final double normalY = Math.cos(theta);
        final double[][] block = new double[3][3];

        for (int i = 0; i < n; i++) {
            final double[] target = upper.midpoint(i);
            final int row = 3 * i;
            for (int j = 0; j < n; j++) {
                final int column = 3 * j;

                clear(block);
                kernel.integrate(target, upperPoints[j], block);
                for (int a = 0; a < 3; a++) {
                    for (int b = 0; b < 3; b++) {
                        lhs[row + a][column + b] += block[a][b];
                    }
                }

                clear(block);
                kernel.integrate(target, lowerPoints[j], block);
                for (int a = 0; a < 3; a++) {
                    for (int b = 0; b < 3; b++) {
                        lhs[row + a][column + b] += block[a][b] * MIRROR[b];
                    }
                }
            }

            final double rotationalSpeed = geometry.distanceFromHinge(geometry.arclengthMidpoint(i)) * thetaDot;
            rhs[row] = rotationalSpeed * normalX;
            rhs[row + 1] = rotationalSpeed * normalY;
            rhs[row + 2] = 0.0;

            lhs[row][speedColumn] = -1.0;
        }

        final double ds = geometry.getSegmentLength();
        for (int i = 0; i < n; i++) {
            lhs[speedColumn][3 * i] = ds;
        }

        return new InteractionSystem(new Array2DRowRealMatrix(lhs, false), new ArrayRealVector(rhs, false));
    }

    private static void clear(double[][] block) {
        for (double[] row : block) {
            row[0] = 0.0;
            row[1] = 0.0;
            row[2] = 0.0;
        }
    }
}
