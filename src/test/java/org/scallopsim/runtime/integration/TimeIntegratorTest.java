package org.scallopsim.runtime.integration;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@Tag("unit")
class TimeIntegratorTest {

    @Test
    void explicitEulerAdvancesBySpeedTimesStep() {
        ExplicitEuler euler = new ExplicitEuler();

        assertThat(euler.advance(0.5, 3.0, 0.01)).isCloseTo(0.53, within(1e-15));
        assertThat(euler.advance(0.5, -2.0, 0.25)).isEqualTo(0.0);
        assertThat(euler.getName()).isEqualTo("explicit-euler");
    }

    @Test
    void adamsBashforthFirstStepMatchesEuler() {
        AdamsBashforth2 ab2 = new AdamsBashforth2();

        assertThat(ab2.advance(0.0, 3.108725597836334, 0.002)).isCloseTo(0.006217451195672669, within(1e-15));
    }

    @Test
    void adamsBashforthUsesPreviousSpeed() {
        AdamsBashforth2 ab2 = new AdamsBashforth2();
        double dt = 0.002;

        double x1 = ab2.advance(0.0, 3.108725597836334, dt);
        double x2 = ab2.advance(x1, 3.1152739452957827, dt);
        double x3 = ab2.advance(x2, 3.1210192075980316, dt);

        assertThat(x2).isCloseTo(0.012454547433723682, within(1e-14));
        assertThat(x3).isCloseTo(0.018702331111221993, within(1e-14));
    }

    @Test
    void adamsBashforthIsExactForLinearlyGrowingSpeed() {
        AdamsBashforth2 ab2 = new AdamsBashforth2();
        double dt = 0.1;
        double x = 0.0;

        x = ab2.advance(x, 0.0, dt);
        for (int n = 1; n < 10; n++) {
            x = ab2.advance(x, n * dt, dt);
        }

        // exact after the first step, which misses dt^2 / 2
        assertThat(x).isCloseTo(0.5 - 0.5 * dt * dt, within(1e-12));
    }
}
