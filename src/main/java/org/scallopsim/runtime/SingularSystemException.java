package org.scallopsim.runtime;

/**
 * Thrown when the hydrodynamic linear system of a time step cannot be solved.
 * <p>
 * The matrix was singular to working precision, or the solve produced non-finite values.
 * Either way the translation speed of that step is undefined and the run cannot continue.
 */
public class SingularSystemException extends Exception {

    /**
     * Constructs a new exception with the specified detail message.
     *
     * @param message the detail message explaining the failure
     */
    public SingularSystemException(String message) {
        super(message);
    }

    /**
     * Constructs a new exception with the specified detail message and cause.
     *
     * @param message the detail message explaining the failure
     * @param cause the underlying cause of the failure
     */
    public SingularSystemException(String message, Throwable cause) {
        super(message, cause);
    }
}
