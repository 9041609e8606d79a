package org.scallopsim.runtime.output;

import org.scallopsim.runtime.StepRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Writes trajectory rows to a text file, flushing after every row so that completed steps survive
 * an abrupt termination of the process.
 */
public final class TrajectoryWriter implements ITrajectorySink {

    private static final Logger LOG = LoggerFactory.getLogger(TrajectoryWriter.class);

    private final Writer writer;
    private final String description;
    private long rowsWritten;

    TrajectoryWriter(Writer writer, String description) {
        this.writer = writer;
        this.description = description;
    }

    /**
     * Creates (or truncates) the file and opens it for writing. Missing parent directories are created.
     *
     * @param file The output file.
     * @return an open writer.
     * @throws IOException if the file cannot be created.
     */
    public static TrajectoryWriter open(Path file) throws IOException {
        final Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        final BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
        LOG.debug("Opened trajectory file {}", file.toAbsolutePath());
        return new TrajectoryWriter(writer, file.toString());
    }

    @Override
    public void append(StepRecord record) throws IOException {
        writer.write(TrajectoryFormat.format(record));
        writer.write('\n');
        writer.flush();
        rowsWritten++;
    }

    public long getRowsWritten() {
        return rowsWritten;
    }

    @Override
    public void close() throws IOException {
        writer.close();
        LOG.debug("Closed trajectory {} after {} rows", description, rowsWritten);
    }
}
