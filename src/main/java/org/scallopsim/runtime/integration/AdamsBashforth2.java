package org.scallopsim.runtime.integration;

/**
 * Two-step Adams-Bashforth: {@code x += dt (3 U_n - U_{n-1}) / 2}.
 * <p>
 * The first step has no history and uses {@code U_{-1} = U_0}, which reduces it to forward Euler.
 */
public final class AdamsBashforth2 implements ITimeIntegrator {

    private double previousSpeed;
    private boolean hasHistory;

    @Override
    public double advance(double position, double speed, double timeStep) {
        final double previous = hasHistory ? previousSpeed : speed;
        previousSpeed = speed;
        hasHistory = true;
        return position + 0.5 * timeStep * (3.0 * speed - previous);
    }

    @Override
    public String getName() {
        return "adams-bashforth-2";
    }
}
