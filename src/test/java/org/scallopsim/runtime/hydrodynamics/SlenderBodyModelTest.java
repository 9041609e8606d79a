package org.scallopsim.runtime.hydrodynamics;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.scallopsim.runtime.ScallopParameters;
import org.scallopsim.runtime.SingularSystemException;
import org.scallopsim.runtime.SlenderBodyParameters;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

@Tag("unit")
class SlenderBodyModelTest {

    private final ScallopParameters params =
        new ScallopParameters(1.0, 1.0, 20, 1.0, 0.002, 1.0, 1.0, 0.01, 6);

    @Test
    void matchesReferenceSpeedAtStart() throws SingularSystemException {
        SlenderBodyModel model = new SlenderBodyModel(params, new SlenderBodyParameters(0.01, 20));

        HydrodynamicSolution solution = model.solve(0.0, 0.0);

        assertThat(model.getNodeCount()).isEqualTo(21);
        assertThat(solution.forceDensities().getDimension()).isEqualTo(42);
        assertThat(solution.translationSpeed()).isCloseTo(3.108733718520548, within(1e-7));
        assertThat(solution.netForceX()).isCloseTo(0.0, within(1e-10));
    }

    @Test
    @Tag("integration")
    void agreesWithBoundaryElementModel() throws SingularSystemException {
        double slender = new SlenderBodyModel(params, new SlenderBodyParameters(0.01, 20)).solve(0.0, 0.0).translationSpeed();
        double boundary = new BoundaryElementModel(params).solve(0.0, 0.0).translationSpeed();

        assertThat(slender).isCloseTo(boundary, within(0.03 * Math.abs(boundary)));
    }

    @Test
    void doesNotMoveWithoutStroke() throws SingularSystemException {
        SlenderBodyModel model = new SlenderBodyModel(params.withAmplitude(0.0), new SlenderBodyParameters(0.01, 10));

        assertThat(model.solve(0.4, 0.0).translationSpeed()).isCloseTo(0.0, within(1e-15));
    }

    @Test
    void speedDoesNotDependOnHingePosition() throws SingularSystemException {
        SlenderBodyModel model = new SlenderBodyModel(params, new SlenderBodyParameters(0.01, 16));

        double atOrigin = model.solve(0.3, 0.0).translationSpeed();
        double shifted = model.solve(0.3, 4.0).translationSpeed();

        assertThat(shifted).isCloseTo(atOrigin, within(1e-10));
        assertThat(model.getName()).isEqualTo("slender-body");
    }
}
