/* (C)2026 */
package com.ammann.trips.algorithm;

/**
 * Single-pass mean and variance accumulator using Welford's update.
 *
 * <p>Standard deviation is the population estimate {@code sqrt(M2 / n)}. Naive
 * sum/sum-of-squares accumulation is avoided because it loses all precision on
 * large-magnitude inputs with small spread.
 */
public final class RunningStatistics
{
    private long count;
    private double mean;
    private double m2;

    /**
     * Adds one sample.
     *
     * @param value finite sample
     */
    public void add(double value)
    {
        count++;
        double delta = value - mean;
        mean += delta / count;
        m2 += delta * (value - mean);
    }

    /**
     * Reverses a previous {@link #add(double)} of {@code value}. Used by sliding windows
     * when the oldest sample leaves the window.
     *
     * @param value a sample that was previously added
     */
    public void remove(double value)
    {
        if (count == 0) {
            throw new IllegalStateException("Cannot remove a sample from empty statistics");
        }
        if (count == 1) {
            reset();
            return;
        }
        double previousMean = mean - (value - mean) / (count - 1);
        m2 -= (value - previousMean) * (value - mean);
        mean = previousMean;
        count--;
        if (m2 < 0.0) {
            // rounding residue
            m2 = 0.0;
        }
    }

    public void reset()
    {
        count = 0;
        mean = 0.0;
        m2 = 0.0;
    }

    public long count()
    {
        return count;
    }

    /** Mean of all samples, 0 when empty. */
    public double mean()
    {
        return mean;
    }

    /** Population variance, 0 when empty. */
    public double variance()
    {
        return count > 0 ? m2 / count : 0.0;
    }

    /** Population standard deviation, 0 when empty. */
    public double standardDeviation()
    {
        return Math.sqrt(variance());
    }

    /**
     * Standardized deviation of {@code value} from the current mean.
     *
     * <p>Returns 0 when fewer than two samples were seen or the spread is zero, so a
     * degenerate dimension can never produce a division fault.
     */
    public double zScore(double value)
    {
        double std = standardDeviation();
        if (count < 2 || std == 0.0) {
            return 0.0;
        }
        return (value - mean) / std;
    }
}
