package org.scallopsim.runtime.hydrodynamics;

import org.apache.commons.math3.linear.RealMatrix;
import org.apache.commons.math3.linear.RealVector;

/**
 * A dense square linear system {@code A x = b} assembled for one time step.
 *
 * @param matrix The system matrix {@code A}.
 * @param rhs    The right-hand side {@code b}.
 */
public record InteractionSystem(RealMatrix matrix, RealVector rhs) {

    public InteractionSystem {
        if (!matrix.isSquare() || matrix.getRowDimension() != rhs.getDimension()) {
            throw new IllegalArgumentException("System must be square and match its right-hand side: "
                + matrix.getRowDimension() + "x" + matrix.getColumnDimension() + " vs " + rhs.getDimension());
        }
    }

    public int size() {
        return rhs.getDimension();
    }
}
