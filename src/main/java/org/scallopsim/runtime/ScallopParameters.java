package org.scallopsim.runtime;

/**
 * Construction parameters of a two-filament scallop run.
 * <p>
 * All values are checked when the record is created, so an invalid configuration is rejected
 * before the first time step executes.
 *
 * @param amplitude       Oscillation amplitude of the prescribed angle, in radians.
 * @param tilt            Mean tilt angle of the upper filament, in radians.
 * @param segments        Number of boundary elements per filament.
 * @param length          Filament length.
 * @param timeStep        Time step of the driver.
 * @param duration        Total simulated time.
 * @param period          Oscillation period.
 * @param regularization  Regularization length of the Stokeslet kernel.
 * @param quadratureOrder Number of Gauss-Legendre points per boundary element.
 */
public record ScallopParameters(double amplitude,
                                double tilt,
                                int segments,
                                double length,
                                double timeStep,
                                double duration,
                                double period,
                                double regularization,
                                int quadratureOrder) {

    public ScallopParameters {
        requireFinite("amplitude", amplitude);
        requireFinite("tilt", tilt);
        if (segments <= 0) {
            throw new IllegalArgumentException("segments must be positive, got " + segments);
        }
        requirePositive("length", length);
        requirePositive("timeStep", timeStep);
        requirePositive("period", period);
        requirePositive("regularization", regularization);
        if (!Double.isFinite(duration) || duration < timeStep) {
            throw new IllegalArgumentException(
                "duration must be at least one time step (" + timeStep + "), got " + duration);
        }
        if (quadratureOrder <= 0) {
            throw new IllegalArgumentException("quadratureOrder must be positive, got " + quadratureOrder);
        }
    }

    /**
     * Returns the arclength of a single boundary element.
     * @return {@code length / segments}
     */
    public double segmentLength() {
        return length / segments;
    }

    /**
     * Returns a copy of these parameters with a different oscillation amplitude.
     * @param newAmplitude The amplitude in radians.
     * @return The modified parameters.
     */
    public ScallopParameters withAmplitude(double newAmplitude) {
        return new ScallopParameters(newAmplitude, tilt, segments, length, timeStep, duration,
            period, regularization, quadratureOrder);
    }

    /**
     * Returns a copy of these parameters with a different time step.
     * @param newTimeStep The time step.
     * @return The modified parameters.
     */
    public ScallopParameters withTimeStep(double newTimeStep) {
        return new ScallopParameters(amplitude, tilt, segments, length, newTimeStep, duration,
            period, regularization, quadratureOrder);
    }

    static void requireFinite(String name, double value) {
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException(name + " must be finite, got " + value);
        }
    }

    static void requirePositive(String name, double value) {
        if (!(value > 0.0) || Double.isInfinite(value)) {
            throw new IllegalArgumentException(name + " must be a positive finite number, got " + value);
        }
    }
}
