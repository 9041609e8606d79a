package org.scallopsim.runtime.output;

import org.scallopsim.runtime.StepRecord;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Reads a trajectory file written by {@link TrajectoryWriter}. Blank lines are skipped.
 */
public final class TrajectoryReader {

    private TrajectoryReader() {
        // Private constructor to prevent instantiation
    }

    /**
     * @param file The trajectory file.
     * @return all rows in file order.
     * @throws MalformedTrajectoryException if a line cannot be parsed.
     * @throws IOException if the file cannot be read.
     */
    public static List<StepRecord> read(Path file) throws IOException {
        final List<StepRecord> records = new ArrayList<>();
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            int lineNumber = 0;
            while ((line = reader.readLine()) != null) {
                lineNumber++;
                if (line.isBlank()) {
                    continue;
                }
                try {
                    records.add(TrajectoryFormat.parse(line));
                } catch (IllegalArgumentException e) {
                    throw new MalformedTrajectoryException(lineNumber, e.getMessage(), e);
                }
            }
        }
        return records;
    }
}
