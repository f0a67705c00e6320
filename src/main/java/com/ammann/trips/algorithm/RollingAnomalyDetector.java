/* (C)2026 */
package com.ammann.trips.algorithm;

import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Streaming anomaly detector over a fixed-size window of the most recent values.
 *
 * <p>Each value joins the window before it is judged, so the window mean and population
 * standard deviation include it. Statistics are maintained incrementally: a Welford update
 * on arrival and its inverse when the oldest value is evicted, with a rebuild from the window
 * once per {@code windowSize} evictions. Nothing is flagged until the
 * window holds at least {@value #MIN_SAMPLES} values or while its spread is zero.
 *
 * <p>Not thread-safe; intended for a single owner feeding one metric stream.
 */
public final class RollingAnomalyDetector
{
    public static final int DEFAULT_WINDOW_SIZE = 100;
    static final int MIN_SAMPLES = 3;

    // Relative spread below which the window counts as constant; eviction leaves rounding residue.
    private static final double ZERO_SPREAD = 1e-12;

    private final int windowSize;
    private final double threshold;
    private final Deque<Double> window = new ArrayDeque<>();
    private final RunningStatistics stats = new RunningStatistics();
    private long evictions;

    public RollingAnomalyDetector()
    {
        this(DEFAULT_WINDOW_SIZE, AnomalyScorer.DEFAULT_THRESHOLD);
    }

    /**
     * @param windowSize number of most recent values kept, at least 1
     * @param threshold  |z-score| above which a value is anomalous
     */
    public RollingAnomalyDetector(int windowSize, double threshold)
    {
        if (windowSize < 1) {
            throw new IllegalArgumentException(
                    String.format("Window size must be positive, got %d", windowSize));
        }
        if (!Double.isFinite(threshold) || threshold < 0.0) {
            throw new IllegalArgumentException(
                    String.format("Anomaly threshold must be a finite non-negative number, got %s", threshold));
        }
        this.windowSize = windowSize;
        this.threshold = threshold;
    }

    /**
     * Adds a value to the window and reports whether it is anomalous against it.
     *
     * @param value finite sample
     * @return {@code true} if the value deviates more than the threshold
     */
    public boolean add(double value)
    {
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException(
                    String.format("Rolling detector input must be finite, got %s", value));
        }

        window.addLast(value);
        stats.add(value);
        if (window.size() > windowSize) {
            stats.remove(window.removeFirst());
            if (++evictions % windowSize == 0) {
                reseed();
            }
        }

        if (window.size() < MIN_SAMPLES) {
            return false;
        }
        double std = stats.standardDeviation();
        if (std <= ZERO_SPREAD * Math.max(1.0, Math.abs(stats.mean()))) {
            return false;
        }
        return Math.abs(value - stats.mean()) / std > threshold;
    }

    /** Rebuilds the statistics from the window to discard accumulated rounding drift. */
    private void reseed()
    {
        stats.reset();
        for (double v : window) {
            stats.add(v);
        }
    }

    public int size()
    {
        return window.size();
    }

    public double mean()
    {
        return stats.mean();
    }

    public double standardDeviation()
    {
        return stats.standardDeviation();
    }

    public int windowSize()
    {
        return windowSize;
    }

    public double threshold()
    {
        return threshold;
    }
}
