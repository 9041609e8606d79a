package org.scallopsim.runtime.quadrature;

/**
 * Clenshaw-Curtis rule of order {@code M}: {@code M + 1} Chebyshev extreme points
 * {@code x_k = cos(pi k / M)}, ordered from {@code +1} down to {@code -1}.
 * <p>
 * Exact for polynomials up to degree {@code M}.
 */
public final class ClenshawCurtisRule extends QuadratureRule {

    private ClenshawCurtisRule(double[] nodes, double[] weights) {
        super(nodes, weights);
    }

    /**
     * @param order The order {@code M}, at least 1.
     * @return a rule with {@code order + 1} nodes.
     */
    public static ClenshawCurtisRule of(int order) {
        if (order < 1) {
            throw new IllegalArgumentException("Clenshaw-Curtis order must be at least 1, got " + order);
        }
        final int m = order;
        final double[] theta = new double[m + 1];
        final double[] nodes = new double[m + 1];
        for (int k = 0; k <= m; k++) {
            theta[k] = Math.PI * k / m;
            nodes[k] = Math.cos(theta[k]);
        }
        final double[] weights = new double[m + 1];
        final double[] v = new double[m + 1];
        for (int k = 1; k < m; k++) {
            v[k] = 1.0;
        }
        if (m % 2 == 0) {
            weights[0] = 1.0 / (m * (double) m - 1.0);
            for (int j = 1; j <= m / 2 - 1; j++) {
                for (int k = 1; k < m; k++) {
                    v[k] -= 2.0 * Math.cos(2.0 * j * theta[k]) / (4.0 * j * j - 1.0);
                }
            }
            for (int k = 1; k < m; k++) {
                v[k] -= Math.cos(m * theta[k]) / (m * (double) m - 1.0);
            }
        } else {
            weights[0] = 1.0 / (m * (double) m);
            for (int j = 1; j <= (m - 1) / 2; j++) {
                for (int k = 1; k < m; k++) {
                    v[k] -= 2.0 * Math.cos(2.0 * j * theta[k]) / (4.0 * j * j - 1.0);
                }
            }
        }
        weights[m] = weights[0];
        for (int k = 1; k < m; k++) {
            weights[k] = 2.0 * v[k] / m;
        }
        // the endpoints are exact in theory; pin them against cos() rounding
        nodes[0] = 1.0;
        nodes[m] = -1.0;
        return new ClenshawCurtisRule(nodes, weights);
    }
}
