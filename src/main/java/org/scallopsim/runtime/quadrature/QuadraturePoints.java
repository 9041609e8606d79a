package org.scallopsim.runtime.quadrature;

/**
 * Sample positions and weights of one boundary element.
 *
 * @param positions {@code positions[k]} is the 3-D position of sample {@code k}.
 * @param weights   Quadrature weight of each sample, in arclength units.
 */
public record QuadraturePoints(double[][] positions, double[] weights) {

    public int size() {
        return weights.length;
    }
}
