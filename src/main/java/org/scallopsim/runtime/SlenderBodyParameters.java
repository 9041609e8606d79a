package org.scallopsim.runtime;

/**
 * Parameters of the nonlocal slender-body model.
 *
 * @param radius Filament radius. Sets the slenderness, the kernel regularization and the hinge separation.
 * @param order  Clenshaw-Curtis order; each filament is sampled at {@code order + 1} nodes.
 */
public record SlenderBodyParameters(double radius, int order) {

    public SlenderBodyParameters {
        ScallopParameters.requirePositive("radius", radius);
        if (order < 2) {
            throw new IllegalArgumentException("order must be at least 2, got " + order);
        }
    }

    /**
     * Slenderness coefficient {@code |ln(a^2) + 1|} of the local drag term.
     * @return the slenderness coefficient.
     */
    public double slenderness() {
        return Math.abs(Math.log(radius * radius) + 1.0);
    }

    /**
     * Regularization length of the nonlocal arclength integral, four filament radii.
     * @return the regularization length.
     */
    public double regularization() {
        return 4.0 * radius;
    }

    /**
     * Distance of each hinge anchor from the symmetry axis, five filament radii.
     * @return the hinge offset.
     */
    public double hingeOffset() {
        return 5.0 * radius;
    }
}
