package org.scallopsim.runtime.quadrature;

import java.util.Arrays;
import java.util.function.DoubleUnaryOperator;

/**
 * An immutable set of quadrature nodes and weights on the canonical interval {@code [-1, 1]}.
 */
public class QuadratureRule {

    private final double[] nodes;
    private final double[] weights;

    /**
     * @param nodes   Canonical nodes in {@code [-1, 1]}.
     * @param weights Matching weights.
     */
    protected QuadratureRule(double[] nodes, double[] weights) {
        if (nodes.length != weights.length) {
            throw new IllegalArgumentException(
                "Node and weight counts differ: " + nodes.length + " vs " + weights.length);
        }
        this.nodes = nodes.clone();
        this.weights = weights.clone();
    }

    public int size() {
        return nodes.length;
    }

    public double node(int index) {
        return nodes[index];
    }

    public double weight(int index) {
        return weights[index];
    }

    /**
     * Maps the rule onto {@code [a, b]}: {@code x = (b-a)/2 x0 + (b+a)/2}, {@code w = (b-a)/2 w0}.
     *
     * @param a        Start of the target interval.
     * @param b        End of the target interval.
     * @param nodesOut Destination for the rescaled nodes, length {@link #size()}.
     * @param weightsOut Destination for the rescaled weights, length {@link #size()}.
     */
    public void rescale(double a, double b, double[] nodesOut, double[] weightsOut) {
        final double halfWidth = 0.5 * (b - a);
        final double center = 0.5 * (b + a);
        for (int k = 0; k < nodes.length; k++) {
            nodesOut[k] = halfWidth * nodes[k] + center;
            weightsOut[k] = halfWidth * weights[k];
        }
    }

    /**
     * Integrates a function over {@code [a, b]} with this rule.
     *
     * @param f The integrand.
     * @param a Start of the interval.
     * @param b End of the interval.
     * @return the quadrature sum.
     */
    public double integrate(DoubleUnaryOperator f, double a, double b) {
        final double[] x = new double[nodes.length];
        final double[] w = new double[nodes.length];
        rescale(a, b, x, w);
        double sum = 0.0;
        for (int k = 0; k < x.length; k++) {
            sum += w[k] * f.applyAsDouble(x[k]);
        }
        return sum;
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{nodes=" + Arrays.toString(nodes)
            + ", weights=" + Arrays.toString(weights) + "}";
    }
}
