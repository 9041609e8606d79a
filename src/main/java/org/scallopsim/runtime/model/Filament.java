package org.scallopsim.runtime.model;

/**
 * One of the two rigid rods of the scallop.
 * <p>
 * The upper filament (id 1) is anchored above the symmetry axis, the lower one (id 2) below it.
 * Orientation, hinge anchor and segment midpoints are overwritten in place by
 * {@link ScallopGeometry#update(double, double)}.
 */
public final class Filament {

    public static final int UPPER = 1;
    public static final int LOWER = 2;

    private final int id;
    private final double hingeOffset;
    private final double[] hinge = new double[3];
    private final double[] tangent = new double[3];
    private final double[][] midpoints;
    private double angle;
    private double angularVelocity;

    Filament(int id, double hingeOffset, int segments) {
        if (id != UPPER && id != LOWER) {
            throw new IllegalArgumentException("Filament id must be 1 or 2, got " + id);
        }
        this.id = id;
        this.hingeOffset = hingeOffset;
        this.hinge[1] = hingeOffset;
        this.midpoints = new double[segments][3];
    }

    void orient(double newAngle, double newAngularVelocity, double hingeX) {
        this.angle = newAngle;
        this.angularVelocity = newAngularVelocity;
        tangent[0] = Math.cos(newAngle);
        tangent[1] = Math.sin(newAngle);
        tangent[2] = 0.0;
        hinge[0] = hingeX;
        hinge[1] = hingeOffset;
        hinge[2] = 0.0;
    }

    void placeMidpoint(int segment, double distanceFromHinge) {
        pointAt(distanceFromHinge, midpoints[segment]);
    }

    /**
     * Writes the position of the material point at the given distance from the hinge into {@code out}.
     *
     * @param distanceFromHinge Arclength measured from the hinge, {@code s + L/2}.
     * @param out               Destination array of length 3.
     */
    public void pointAt(double distanceFromHinge, double[] out) {
        out[0] = hinge[0] + distanceFromHinge * tangent[0];
        out[1] = hinge[1] + distanceFromHinge * tangent[1];
        out[2] = hinge[2] + distanceFromHinge * tangent[2];
    }

    public int getId() {
        return id;
    }

    public double getAngle() {
        return angle;
    }

    public double getAngularVelocity() {
        return angularVelocity;
    }

    /**
     * @return a copy of the unit tangent {@code (cos theta, sin theta, 0)}.
     */
    public double[] getTangent() {
        return tangent.clone();
    }

    /**
     * @return a copy of the hinge anchor.
     */
    public double[] getHinge() {
        return hinge.clone();
    }

    /**
     * Returns the current midpoint of a segment. The returned array is live and must not be modified.
     * @param segment The segment index.
     * @return the midpoint position.
     */
    public double[] midpoint(int segment) {
        return midpoints[segment];
    }

    public int getSegmentCount() {
        return midpoints.length;
    }
}
