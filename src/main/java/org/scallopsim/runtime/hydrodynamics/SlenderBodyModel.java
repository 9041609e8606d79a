package org.scallopsim.runtime.hydrodynamics;

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.RealVector;
import org.scallopsim.runtime.ScallopParameters;
import org.scallopsim.runtime.SingularSystemException;
import org.scallopsim.runtime.SlenderBodyParameters;
import org.scallopsim.runtime.model.StrokeKinematics;
import org.scallopsim.runtime.quadrature.ClenshawCurtisRule;

/**
 * Nonlocal slender-body model of the scallop, used as a cross-check of the boundary-element model.
 * <p>
 * The motion is planar, so each Clenshaw-Curtis node of the upper filament carries two unknowns
 * {@code (f_x, f_y)}; the last unknown is the translation speed {@code U}. Equations are scaled
 * by {@code 8 pi}:
 * <pre>
 * [c (I + pp) + 2 (I - pp)] f(s) + (I + pp) int (f(s') - f(s)) / |s - s'|_d ds'
 *     + cross-filament Stokeslet - 8 pi U e_x = 8 pi u_rot(s)
 * </pre>
 * The lower filament's force is the y-mirror of the upper one, as in the boundary-element model.
 */
public final class SlenderBodyModel implements IHydrodynamicModel {

    private static final double EIGHT_PI = 8.0 * Math.PI;

    private final StrokeKinematics kinematics;
    private final double halfLength;
    private final double slenderness;
    private final double regularizationSquared;
    private final double hingeOffset;
    private final double[] arclengths;
    private final double[] weights;
    private final DenseSystemSolver solver;

    /**
     * @param params     Stroke and filament parameters; segment-related values are not used.
     * @param bodyParams Slender-body parameters.
     */
    public SlenderBodyModel(ScallopParameters params, SlenderBodyParameters bodyParams) {
        this(params, bodyParams, new DenseSystemSolver());
    }

    /**
     * @param params     Stroke and filament parameters; segment-related values are not used.
     * @param bodyParams Slender-body parameters.
     * @param solver     The linear solver to use.
     */
    public SlenderBodyModel(ScallopParameters params, SlenderBodyParameters bodyParams, DenseSystemSolver solver) {
        this.kinematics = new StrokeKinematics(params.amplitude(), params.tilt(), params.period());
        this.halfLength = 0.5 * params.length();
        this.slenderness = bodyParams.slenderness();
        final double delta = bodyParams.regularization();
        this.regularizationSquared = delta * delta;
        this.hingeOffset = bodyParams.hingeOffset();
        final ClenshawCurtisRule rule = ClenshawCurtisRule.of(bodyParams.order());
        this.arclengths = new double[rule.size()];
        this.weights = new double[rule.size()];
        rule.rescale(-halfLength, halfLength, arclengths, weights);
        this.solver = solver;
    }

    @Override
    public HydrodynamicSolution solve(double time, double hingePosition) throws SingularSystemException {
        final InteractionSystem system = assemble(time, hingePosition);
        final RealVector solution = solver.solve(system);
        final int speedIndex = solution.getDimension() - 1;
        final RealVector forces = solution.getSubVector(0, speedIndex);
        double netForceX = 0.0;
        for (int j = 0; j < weights.length; j++) {
            netForceX += weights[j] * forces.getEntry(2 * j);
        }
        return new HydrodynamicSolution(solution.getEntry(speedIndex), forces, netForceX);
    }

    /**
     * Builds the system for the given state without solving it.
     *
     * @param time          The simulation time.
     * @param hingePosition The hinge x-position.
     * @return the assembled system.
     */
    public InteractionSystem assemble(double time, double hingePosition) {
        final int nodes = arclengths.length;
        final int size = 2 * nodes + 1;
        final int speedColumn = 2 * nodes;
        final double[][] lhs = new double[size][size];
        final double[] rhs = new double[size];

        final double theta = kinematics.angle(time);
        final double thetaDot = kinematics.angularVelocity(time);
        final double cos = Math.cos(theta);
        final double sin = Math.sin(theta);
        final double[][] plus = {{1.0 + cos * cos, cos * sin}, {cos * sin, 1.0 + sin * sin}};
        final double[][] minus = {{1.0 - cos * cos, -cos * sin}, {-cos * sin, 1.0 - sin * sin}};

        final double[] x = new double[nodes];
        final double[] y = new double[nodes];
        for (int i = 0; i < nodes; i++) {
            final double fromHinge = arclengths[i] + halfLength;
            x[i] = hingePosition + fromHinge * cos;
            y[i] = hingeOffset + fromHinge * sin;
        }

        for (int i = 0; i < nodes; i++) {
            final int row = 2 * i;
            double subtracted = 0.0;
            for (int j = 0; j < nodes; j++) {
                final int column = 2 * j;
                final double ds = arclengths[i] - arclengths[j];
                final double kernel = weights[j] / Math.sqrt(ds * ds + regularizationSquared);
                subtracted += kernel;
                for (int a = 0; a < 2; a++) {
                    for (int b = 0; b < 2; b++) {
                        lhs[row + a][column + b] += kernel * plus[a][b];
                    }
                }

                // lower node j sits at (x_j, -y_j) and carries (f_x, -f_y)
                final double rx = x[i] - x[j];
                final double ry = y[i] + y[j];
                final double distance = Math.sqrt(rx * rx + ry * ry);
                final double ux = rx / distance;
                final double uy = ry / distance;
                final double scale = weights[j] / distance;
                lhs[row][column] += scale * (1.0 + ux * ux);
                lhs[row][column + 1] += -scale * ux * uy;
                lhs[row + 1][column] += scale * uy * ux;
                lhs[row + 1][column + 1] += -scale * (1.0 + uy * uy);
            }

            for (int a = 0; a < 2; a++) {
                for (int b = 0; b < 2; b++) {
                    lhs[row + a][row + b] += -subtracted * plus[a][b]
                        + slenderness * plus[a][b] + 2.0 * minus[a][b];
                }
            }

            lhs[row][speedColumn] = -EIGHT_PI;
            lhs[speedColumn][row] = weights[i];

            final double rotationalSpeed = EIGHT_PI * (arclengths[i] + halfLength) * thetaDot;
            rhs[row] = -rotationalSpeed * sin;
            rhs[row + 1] = rotationalSpeed * cos;
        }

        return new InteractionSystem(new Array2DRowRealMatrix(lhs, false), new ArrayRealVector(rhs, false));
    }

    /**
     * @return number of quadrature nodes per filament.
     */
    public int getNodeCount() {
        return arclengths.length;
    }

    @Override
    public String getName() {
        return "slender-body";
    }
}
