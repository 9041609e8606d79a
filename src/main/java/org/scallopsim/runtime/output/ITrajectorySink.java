package org.scallopsim.runtime.output;

import org.scallopsim.runtime.StepRecord;

import java.io.Closeable;
import java.io.IOException;

/**
 * Append-only destination for trajectory rows.
 */
public interface ITrajectorySink extends Closeable {

    /**
     * Appends one row. When this returns, the row is durable.
     *
     * @param record The row to append.
     * @throws IOException if the row cannot be written.
     */
    void append(StepRecord record) throws IOException;
}
