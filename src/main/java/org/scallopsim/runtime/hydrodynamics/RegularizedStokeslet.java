package org.scallopsim.runtime.hydrodynamics;

import org.scallopsim.runtime.quadrature.QuadraturePoints;

/**
 * Regularized Stokeslet with regularization length {@code delta}:
 * <pre>
 * G_ij(r) = [ (|r|^2 + 2 delta^2) delta_ij + r_i r_j ] / (8 pi (|r|^2 + delta^2)^(3/2))
 * </pre>
 * with {@code r = target - source}. The kernel is finite at {@code r = 0}, so coincident source and
 * target points need no special treatment.
 */
public final class RegularizedStokeslet {

    private static final double EIGHT_PI = 8.0 * Math.PI;

    private final double delta;
    private final double deltaSquared;

    /**
     * @param delta The regularization length, strictly positive.
     */
    public RegularizedStokeslet(double delta) {
        if (!(delta > 0.0)) {
            throw new IllegalArgumentException("Regularization length must be positive, got " + delta);
        }
        this.delta = delta;
        this.deltaSquared = delta * delta;
    }

    /**
     * Evaluates the 3x3 kernel for a single source/target pair.
     *
     * @param target The target point.
     * @param source The source point.
     * @return a new 3x3 matrix.
     */
    public double[][] evaluate(double[] target, double[] source) {
        final double[][] out = new double[3][3];
        accumulate(target, source, 1.0, out);
        return out;
    }

    /**
     * Adds the quadrature-weighted kernel between {@code target} and every point of {@code sources}
     * into {@code block}: {@code block += sum_k w_k G(target - q_k)}.
     *
     * @param target  The target point.
     * @param sources Source positions and weights.
     * @param block   The 3x3 accumulator.
     */
    public void integrate(double[] target, QuadraturePoints sources, double[][] block) {
        final double[][] positions = sources.positions();
        final double[] weights = sources.weights();
        for (int k = 0; k < weights.length; k++) {
            accumulate(target, positions[k], weights[k], block);
        }
    }

    private void accumulate(double[] target, double[] source, double weight, double[][] block) {
        final double rx = target[0] - source[0];
        final double ry = target[1] - source[1];
        final double rz = target[2] - source[2];
        final double rSquared = rx * rx + ry * ry + rz * rz;
        final double regularized = Math.sqrt(rSquared + deltaSquared);
        final double scale = weight / (EIGHT_PI * regularized * regularized * regularized);
        final double diagonal = (rSquared + 2.0 * deltaSquared) * scale;

        block[0][0] += diagonal + rx * rx * scale;
        block[0][1] += rx * ry * scale;
        block[0][2] += rx * rz * scale;
        block[1][0] += ry * rx * scale;
        block[1][1] += diagonal + ry * ry * scale;
        block[1][2] += ry * rz * scale;
        block[2][0] += rz * rx * scale;
        block[2][1] += rz * ry * scale;
        block[2][2] += diagonal + rz * rz * scale;
    }

    public double getDelta() {
        return delta;
    }
}
