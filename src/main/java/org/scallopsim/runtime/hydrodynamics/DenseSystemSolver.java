package org.scallopsim.runtime.hydrodynamics;

import org.apache.commons.math3.linear.DecompositionSolver;
import org.apache.commons.math3.linear.LUDecomposition;
import org.apache.commons.math3.linear.RealVector;
import org.apache.commons.math3.linear.SingularMatrixException;
import org.scallopsim.runtime.SingularSystemException;

/**
 * Direct dense solve by LU decomposition with partial pivoting.
 * <p>
 * A singular matrix is reported as {@link SingularSystemException}; no least-squares or
 * pseudo-inverse substitute is attempted.
 */
public final class DenseSystemSolver {

    /** Pivot magnitude below which the matrix is considered singular. */
    public static final double DEFAULT_SINGULARITY_THRESHOLD = 1e-11;

    private final double singularityThreshold;

    public DenseSystemSolver() {
        this(DEFAULT_SINGULARITY_THRESHOLD);
    }

    /**
     * @param singularityThreshold Pivot magnitude below which the matrix is considered singular.
     */
    public DenseSystemSolver(double singularityThreshold) {
        this.singularityThreshold = singularityThreshold;
    }

    /**
     * Solves the system exactly once.
     *
     * @param system The system to solve.
     * @return the solution vector.
     * @throws SingularSystemException if the matrix is singular or the solution is not finite.
     */
    public RealVector solve(InteractionSystem system) throws SingularSystemException {
        final DecompositionSolver solver = new LUDecomposition(system.matrix(), singularityThreshold).getSolver();
        if (!solver.isNonSingular()) {
            throw new SingularSystemException(
                "Interaction matrix of size " + system.size() + " is singular to working precision");
        }
        final RealVector solution;
        try {
            solution = solver.solve(system.rhs());
        } catch (SingularMatrixException e) {
            throw new SingularSystemException("LU solve failed for system of size " + system.size(), e);
        }
        if (solution.isNaN() || solution.isInfinite()) {
            throw new SingularSystemException(
                "Interaction matrix of size " + system.size() + " is too ill-conditioned: solution is not finite");
        }
        return solution;
    }
}
