package org.scallopsim.runtime.quadrature;

import org.apache.commons.math3.analysis.integration.gauss.GaussIntegrator;
import org.apache.commons.math3.analysis.integration.gauss.GaussIntegratorFactory;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Gauss-Legendre rule, exact for polynomials up to degree {@code 2n - 1}.
 * <p>
 * Rules are computed once per order by Apache Commons Math and shared process-wide. They are
 * immutable, so sharing them is safe.
 */
public final class GaussLegendreRule extends QuadratureRule {

    private static final GaussIntegratorFactory FACTORY = new GaussIntegratorFactory();
    private static final Map<Integer, GaussLegendreRule> RULES = new ConcurrentHashMap<>();

    private GaussLegendreRule(double[] nodes, double[] weights) {
        super(nodes, weights);
    }

    /**
     * Returns the canonical rule with the given number of points.
     * @param order Number of points, at least one.
     * @return the shared rule.
     */
    public static GaussLegendreRule of(int order) {
        if (order <= 0) {
            throw new IllegalArgumentException("Quadrature order must be positive, got " + order);
        }
        return RULES.computeIfAbsent(order, GaussLegendreRule::compute);
    }

    private static GaussLegendreRule compute(int order) {
        final GaussIntegrator integrator = FACTORY.legendre(order);
        final double[] nodes = new double[order];
        final double[] weights = new double[order];
        for (int k = 0; k < order; k++) {
            nodes[k] = integrator.getPoint(k);
            weights[k] = integrator.getWeight(k);
        }
        return new GaussLegendreRule(nodes, weights);
    }
}
