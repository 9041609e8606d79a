package org.scallopsim.runtime.integration;

/**
 * Forward Euler: {@code x += U dt}.
 */
public final class ExplicitEuler implements ITimeIntegrator {

    @Override
    public double advance(double position, double speed, double timeStep) {
        return position + speed * timeStep;
    }

    @Override
    public String getName() {
        return "explicit-euler";
    }
}
