package org.scallopsim.runtime.hydrodynamics;

import org.apache.commons.math3.linear.RealVector;
import org.scallopsim.runtime.ScallopParameters;
import org.scallopsim.runtime.SingularSystemException;
import org.scallopsim.runtime.model.ScallopGeometry;
import org.scallopsim.runtime.quadrature.GaussLegendreRule;
import org.scallopsim.runtime.quadrature.QuadratureSampler;

/**
 * Boundary-element model of the scallop with regularized Stokeslets and Gauss-Legendre quadrature
 * along each element.
 */
public final class BoundaryElementModel implements IHydrodynamicModel {

    private final ScallopGeometry geometry;
    private final BoundaryElementAssembler assembler;
    private final DenseSystemSolver solver;

    /**
     * @param params The run parameters.
     */
    public BoundaryElementModel(ScallopParameters params) {
        this(params, new DenseSystemSolver());
    }

    /**
     * @param params The run parameters.
     * @param solver The linear solver to use.
     */
    public BoundaryElementModel(ScallopParameters params, DenseSystemSolver solver) {
        this.geometry = new ScallopGeometry(params);
        final QuadratureSampler sampler = new QuadratureSampler(geometry, GaussLegendreRule.of(params.quadratureOrder()));
        this.assembler = new BoundaryElementAssembler(geometry, sampler, new RegularizedStokeslet(params.regularization()));
        this.solver = solver;
    }

    @Override
    public HydrodynamicSolution solve(double time, double hingePosition) throws SingularSystemException {
        geometry.update(time, hingePosition);
        final InteractionSystem system = assembler.assemble();
        final RealVector solution = solver.solve(system);

        final int speedIndex = solution.getDimension() - 1;
        final RealVector forces = solution.getSubVector(0, speedIndex);
        final double ds = geometry.getSegmentLength();
        double netForceX = 0.0;
        for (int i = 0; i < speedIndex; i += 3) {
            netForceX += ds * forces.getEntry(i);
        }
        return new HydrodynamicSolution(solution.getEntry(speedIndex), forces, netForceX);
    }

    /**
     * @return the geometry, positioned at the most recently solved step.
     */
    public ScallopGeometry getGeometry() {
        return geometry;
    }

    /**
     * Builds the system for the given state without solving it.
     *
     * @param time          The simulation time.
     * @param hingePosition The hinge x-position.
     * @return the assembled system.
     */
    public InteractionSystem assemble(double time, double hingePosition) {
        geometry.update(time, hingePosition);
        return assembler.assemble();
    }

    @Override
    public String getName() {
        return "boundary-element";
    }
}
