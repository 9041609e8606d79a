package org.scallopsim.runtime.hydrodynamics;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.scallopsim.runtime.ScallopParameters;
import org.scallopsim.runtime.SingularSystemException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

@Tag("unit")
class BoundaryElementModelTest {

    private final ScallopParameters reference =
        new ScallopParameters(1.0, 1.0, 100, 1.0, 0.002, 1.0, 1.0, 0.01, 6);

    @Test
    void matchesReferenceSpeedAtStart() throws SingularSystemException {
        HydrodynamicSolution solution = new BoundaryElementModel(reference).solve(0.0, 0.0);

        assertThat(solution.translationSpeed()).isCloseTo(3.1210676992305126, within(1e-7));
        assertThat(solution.forceDensities().getDimension()).isEqualTo(300);
    }

    @Test
    void matchesReferenceSpeedForSmallConfiguration() throws SingularSystemException {
        ScallopParameters params = new ScallopParameters(0.5, 0.3, 8, 2.0, 0.05, 1.0, 2.0, 0.02, 3);

        HydrodynamicSolution solution = new BoundaryElementModel(params).solve(0.0, 0.0);

        assertThat(solution.translationSpeed()).isCloseTo(0.6555755309140846, within(1e-9));
    }

    @Test
    void resultantForceVanishes() throws SingularSystemException {
        BoundaryElementModel model = new BoundaryElementModel(reference.withAmplitude(0.8));

        for (double t = 0.0; t < 1.0; t += 0.17) {
            assertThat(model.solve(t, 0.0).netForceX()).isCloseTo(0.0, within(1e-10));
        }
    }

    @Test
    void doesNotMoveWithoutStroke() throws SingularSystemException {
        ScallopParameters still = new ScallopParameters(0.0, 1.0, 10, 1.0, 0.01, 0.1, 1.0, 0.01, 4);

        HydrodynamicSolution solution = new BoundaryElementModel(still).solve(0.3, 0.1);

        assertThat(solution.translationSpeed()).isCloseTo(0.0, within(1e-15));
        assertThat(solution.forceDensities().getLInfNorm()).isCloseTo(0.0, within(1e-15));
    }

    @Test
    void speedDoesNotDependOnHingePosition() throws SingularSystemException {
        ScallopParameters params = new ScallopParameters(1.0, 1.0, 10, 1.0, 0.01, 0.1, 1.0, 0.01, 4);
        BoundaryElementModel model = new BoundaryElementModel(params);

        double atOrigin = model.solve(0.25, 0.0).translationSpeed();
        double shifted = model.solve(0.25, -7.5).translationSpeed();

        assertThat(shifted).isCloseTo(atOrigin, within(1e-10));
    }

    @Test
    void reportsSingularSystem() {
        ScallopParameters params = new ScallopParameters(1.0, 1.0, 4, 1.0, 0.01, 0.1, 1.0, 0.01, 2);
        BoundaryElementModel model = new BoundaryElementModel(params, new DenseSystemSolver(1e6));

        assertThatThrownBy(() -> model.solve(0.0, 0.0)).isInstanceOf(SingularSystemException.class);
    }

    @Test
    void keepsGeometryAtLastSolvedState() throws SingularSystemException {
        ScallopParameters params = new ScallopParameters(1.0, 1.0, 4, 1.0, 0.01, 0.1, 1.0, 0.01, 2);
        BoundaryElementModel model = new BoundaryElementModel(params);

        model.solve(0.25, 1.5);

        assertThat(model.getGeometry().upper().getHinge()[0]).isEqualTo(1.5);
        assertThat(model.getGeometry().upper().getAngle()).isCloseTo(2.0, within(1e-12));
        assertThat(model.getName()).isEqualTo("boundary-element");
    }
}
