package org.scallopsim.runtime.model;

/**
 * Prescribed angular motion of the upper filament.
 * <p>
 * {@code theta(t) = A sin(2 pi t / tau) + theta0}; the lower filament always moves in antiphase.
 */
public final class StrokeKinematics {

    private final double amplitude;
    private final double tilt;
    private final double angularFrequency;

    /**
     * @param amplitude Oscillation amplitude in radians.
     * @param tilt      Mean tilt angle in radians.
     * @param period    Oscillation period.
     */
    public StrokeKinematics(double amplitude, double tilt, double period) {
        this.amplitude = amplitude;
        this.tilt = tilt;
        this.angularFrequency = 2.0 * Math.PI / period;
    }

    /**
     * Angle of the upper filament at the given time.
     * @param time The simulation time.
     * @return the angle in radians.
     */
    public double angle(double time) {
        return amplitude * Math.sin(angularFrequency * time) + tilt;
    }

    /**
     * Angular velocity of the upper filament at the given time.
     * @param time The simulation time.
     * @return the angular velocity in radians per unit time.
     */
    public double angularVelocity(double time) {
        return amplitude * angularFrequency * Math.cos(angularFrequency * time);
    }
}
