package org.scallopsim.runtime.quadrature;

import org.scallopsim.runtime.model.Filament;
import org.scallopsim.runtime.model.ScallopGeometry;

/**
 * Places Gauss-Legendre sample points along the boundary elements of a filament.
 * <p>
 * The canonical rule is rescaled onto each segment's arclength interval and each rescaled node
 * {@code s_k} is mapped to {@code hinge + (s_k + L/2) p} using the filament's current orientation.
 * Results depend on the geometry's current state and must be recomputed after every update.
 */
public final class QuadratureSampler {

    private final ScallopGeometry geometry;
    private final QuadratureRule rule;

    /**
     * @param geometry The geometry to sample.
     * @param rule     The canonical rule.
     */
    public QuadratureSampler(ScallopGeometry geometry, QuadratureRule rule) {
        this.geometry = geometry;
        this.rule = rule;
    }

    /**
     * Samples one segment of one filament.
     *
     * @param segment  The segment index.
     * @param filament The filament.
     * @return positions and weights for the segment.
     */
    public QuadraturePoints sample(int segment, Filament filament) {
        final int n = rule.size();
        final double[] arclengths = new double[n];
        final double[] weights = new double[n];
        rule.rescale(geometry.segmentStart(segment), geometry.segmentEnd(segment), arclengths, weights);
        final double[][] positions = new double[n][3];
        for (int k = 0; k < n; k++) {
            filament.pointAt(geometry.distanceFromHinge(arclengths[k]), positions[k]);
        }
        return new QuadraturePoints(positions, weights);
    }

    /**
     * Samples every segment of a filament.
     * @param filament The filament.
     * @return one point set per segment, indexed by segment.
     */
    public QuadraturePoints[] sampleAll(Filament filament) {
        final QuadraturePoints[] result = new QuadraturePoints[geometry.getSegmentCount()];
        for (int j = 0; j < result.length; j++) {
            result[j] = sample(j, filament);
        }
        return result;
    }

    public QuadratureRule getRule() {
        return rule;
    }
}
