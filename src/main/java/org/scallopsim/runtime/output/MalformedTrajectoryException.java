package org.scallopsim.runtime.output;

import java.io.IOException;

/**
 * Thrown when a trajectory file contains a line that cannot be parsed.
 */
public class MalformedTrajectoryException extends IOException {

    private final int lineNumber;

    /**
     * @param lineNumber One-based number of the offending line.
     * @param message    What was wrong with it.
     * @param cause      The parse failure.
     */
    public MalformedTrajectoryException(int lineNumber, String message, Throwable cause) {
        super("Line " + lineNumber + ": " + message, cause);
        this.lineNumber = lineNumber;
    }

    public int getLineNumber() {
        return lineNumber;
    }
}
