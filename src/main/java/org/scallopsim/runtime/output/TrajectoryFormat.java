package org.scallopsim.runtime.output;

import org.scallopsim.runtime.StepRecord;

import java.util.Locale;

/**
 * Plain-text trajectory format: one line per step with time, translation speed and hinge position,
 * separated by single spaces, e.g. {@code 0.00000 0.0000000000 0.0000000000}.
 */
public final class TrajectoryFormat {

    private static final String LINE_FORMAT = "%.5f %.10f %.10f";

    private TrajectoryFormat() {
        // Private constructor to prevent instantiation
    }

    /**
     * @param record The row to format.
     * @return the formatted line, without line terminator.
     */
    public static String format(StepRecord record) {
        return String.format(Locale.ROOT, LINE_FORMAT,
            record.time(), record.translationSpeed(), record.hingePosition());
    }

    /**
     * @param line A formatted line.
     * @return the parsed row.
     * @throws IllegalArgumentException if the line does not have three numeric fields.
     */
    public static StepRecord parse(String line) {
        final String[] fields = line.trim().split("\\s+");
        if (fields.length != 3) {
            throw new IllegalArgumentException("Expected 3 fields but found " + fields.length);
        }
        try {
            return new StepRecord(Double.parseDouble(fields[0]), Double.parseDouble(fields[1]),
                Double.parseDouble(fields[2]));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Non-numeric field: " + e.getMessage(), e);
        }
    }
}
