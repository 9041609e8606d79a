package org.scallopsim.runtime.model;

import org.scallopsim.runtime.ScallopParameters;

/**
 * Discretized geometry of the two-filament scallop.
 * <p>
 * Each filament is split into {@code N} equal boundary elements over the arclength interval
 * {@code [-L/2, L/2]}, with the hinge at {@code s = -L/2}. Hinge anchors sit at {@code y = +5 delta}
 * and {@code y = -5 delta}. The lower filament's angle is the negation of the upper one's.
 */
public final class ScallopGeometry {

    private static final double HINGE_OFFSET_FACTOR = 5.0;

    private final double length;
    private final double segmentLength;
    private final double[] breakpoints;
    private final double[] arclengthMidpoints;
    private final StrokeKinematics kinematics;
    private final Filament upper;
    private final Filament lower;

    /**
     * Creates the geometry and places it at {@code t = 0} with the hinge at the origin.
     * @param params The run parameters.
     */
    public ScallopGeometry(ScallopParameters params) {
        final int segments = params.segments();
        this.length = params.length();
        this.segmentLength = params.segmentLength();
        this.breakpoints = new double[segments + 1];
        for (int k = 0; k <= segments; k++) {
            breakpoints[k] = -0.5 * length + k * segmentLength;
        }
        breakpoints[segments] = 0.5 * length;
        this.arclengthMidpoints = new double[segments];
        for (int k = 0; k < segments; k++) {
            arclengthMidpoints[k] = 0.5 * (breakpoints[k] + breakpoints[k + 1]);
        }
        this.kinematics = new StrokeKinematics(params.amplitude(), params.tilt(), params.period());
        final double offset = HINGE_OFFSET_FACTOR * params.regularization();
        this.upper = new Filament(Filament.UPPER, offset, segments);
        this.lower = new Filament(Filament.LOWER, -offset, segments);
        update(0.0, 0.0);
    }

    /**
     * Moves both filaments to their prescribed orientation at {@code time} and translates the hinge.
     *
     * @param time   The simulation time.
     * @param hingeX The shared x-coordinate of both hinge anchors.
     */
    public void update(double time, double hingeX) {
        final double theta = kinematics.angle(time);
        final double thetaDot = kinematics.angularVelocity(time);
        upper.orient(theta, thetaDot, hingeX);
        lower.orient(-theta, -thetaDot, hingeX);
        for (int k = 0; k < arclengthMidpoints.length; k++) {
            final double fromHinge = distanceFromHinge(arclengthMidpoints[k]);
            upper.placeMidpoint(k, fromHinge);
            lower.placeMidpoint(k, fromHinge);
        }
    }

    /**
     * Converts an arclength coordinate in {@code [-L/2, L/2]} to the distance from the hinge.
     * @param arclength The arclength coordinate.
     * @return {@code arclength + L/2}.
     */
    public double distanceFromHinge(double arclength) {
        return arclength + 0.5 * length;
    }

    public Filament upper() {
        return upper;
    }

    public Filament lower() {
        return lower;
    }

    /**
     * @param id {@link Filament#UPPER} or {@link Filament#LOWER}.
     * @return the filament with that id.
     */
    public Filament filament(int id) {
        return id == Filament.UPPER ? upper : lower;
    }

    public int getSegmentCount() {
        return arclengthMidpoints.length;
    }

    public double getSegmentLength() {
        return segmentLength;
    }

    public double getLength() {
        return length;
    }

    /**
     * @param segment The segment index.
     * @return the arclength at which the segment starts.
     */
    public double segmentStart(int segment) {
        return breakpoints[segment];
    }

    /**
     * @param segment The segment index.
     * @return the arclength at which the segment ends.
     */
    public double segmentEnd(int segment) {
        return breakpoints[segment + 1];
    }

    /**
     * @param segment The segment index.
     * @return the arclength of the segment midpoint.
     */
    public double arclengthMidpoint(int segment) {
        return arclengthMidpoints[segment];
    }
}
