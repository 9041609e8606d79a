package org.scallopsim.runtime.output;

import org.scallopsim.runtime.StepRecord;

import java.util.List;

/**
 * Aggregate statistics of a trajectory.
 *
 * @param stepCount            Number of rows.
 * @param startTime            Time of the first row.
 * @param endTime              Time of the last row.
 * @param meanSpeed            Arithmetic mean of the translation speed.
 * @param minSpeed             Smallest translation speed.
 * @param maxSpeed             Largest translation speed.
 * @param finalDisplacement    Hinge position after the last step.
 * @param displacementPerPeriod Net hinge drift per oscillation period, averaged over the run.
 */
public record TrajectorySummary(int stepCount,
                                double startTime,
                                double endTime,
                                double meanSpeed,
                                double minSpeed,
                                double maxSpeed,
                                double finalDisplacement,
                                double displacementPerPeriod) {

    /**
     * @param records The trajectory rows, in time order; at least one.
     * @param period  The oscillation period.
     * @return the summary.
     */
    public static TrajectorySummary of(List<StepRecord> records, double period) {
        if (records.isEmpty()) {
            throw new IllegalArgumentException("Cannot summarize an empty trajectory");
        }
        if (!(period > 0.0)) {
            throw new IllegalArgumentException("Period must be positive, got " + period);
        }
        double sum = 0.0;
        double min = Double.POSITIVE_INFINITY;
        double max = Double.NEGATIVE_INFINITY;
        for (StepRecord record : records) {
            final double u = record.translationSpeed();
            sum += u;
            min = Math.min(min, u);
            max = Math.max(max, u);
        }
        final StepRecord first = records.get(0);
        final StepRecord last = records.get(records.size() - 1);
        // the last row's position is reached one step after its time stamp
        final double timeStep = records.size() > 1
            ? (last.time() - first.time()) / (records.size() - 1)
            : 0.0;
        final double elapsed = last.time() - first.time() + timeStep;
        final double drift = elapsed > 0.0 ? last.hingePosition() / elapsed * period : 0.0;
        return new TrajectorySummary(records.size(), first.time(), last.time(), sum / records.size(),
            min, max, last.hingePosition(), drift);
    }
}
