/* (C)2026 */
package com.ammann.trips.algorithm;

import java.util.ArrayList;
import java.util.List;

/**
 * Batch z-score outlier detection over multi-dimensional observations.
 *
 * <p>The first pass computes each dimension's population mean and standard deviation with
 * {@link RunningStatistics}. The second pass standardizes every value and flags observations
 * where any dimension's |z| exceeds the threshold. A dimension with zero spread, or a batch
 * of fewer than two observations, scores 0 and cannot trigger a flag on its own.
 *
 * <p>Holds no state across calls. A caller wanting a sliding window submits one batch
 * per window.
 */
public final class AnomalyScorer
{
    public static final double DEFAULT_THRESHOLD = 2.5;

    private final double threshold;

    public AnomalyScorer()
    {
        this(DEFAULT_THRESHOLD);
    }

    /**
     * @param threshold |z-score| above which an observation is anomalous
     * @throws IllegalArgumentException if the threshold is negative or not finite
     */
    public AnomalyScorer(double threshold)
    {
        if (!Double.isFinite(threshold) || threshold < 0.0) {
            throw new IllegalArgumentException(
                    String.format("Anomaly threshold must be a finite non-negative number, got %s", threshold));
        }
        this.threshold = threshold;
    }

    public double threshold()
    {
        return threshold;
    }

    /**
     * Scores every observation of {@code batch}.
     *
     * @param batch rows of equal length, one value per dimension
     * @return per-observation z-scores and flags, in input order
     * @throws IllegalArgumentException if rows differ in length or contain non-finite values
     */
    public AnomalyReport score(List<double[]> batch)
    {
        if (batch.isEmpty()) {
            return new AnomalyReport(0, threshold, List.of());
        }

        double[] first = batch.get(0);
        if (first == null) {
            throw new IllegalArgumentException("Observation 0 is null");
        }
        int dimensions = first.length;
        RunningStatistics[] stats = new RunningStatistics[dimensions];
        for (int d = 0; d < dimensions; d++) {
            stats[d] = new RunningStatistics();
        }

        for (int i = 0; i < batch.size(); i++) {
            double[] row = batch.get(i);
            validateRow(row, i, dimensions);
            for (int d = 0; d < dimensions; d++) {
                stats[d].add(row[d]);
            }
        }

        List<ScoredObservation> observations = new ArrayList<>(batch.size());
        for (int i = 0; i < batch.size(); i++) {
            double[] row = batch.get(i);
            List<Double> values = new ArrayList<>(dimensions);
            List<Double> zScores = new ArrayList<>(dimensions);
            boolean anomalous = false;
            for (int d = 0; d < dimensions; d++) {
                double z = stats[d].zScore(row[d]);
                values.add(row[d]);
                zScores.add(z);
                anomalous |= Math.abs(z) > threshold;
            }
            observations.add(new ScoredObservation(i, values, zScores, anomalous));
        }

        return new AnomalyReport(batch.size(), threshold, observations);
    }

    private static void validateRow(double[] row, int index, int dimensions)
    {
        if (row == null || row.length != dimensions) {
            throw new IllegalArgumentException(String.format(
                    "Observation %d has %d dimensions, expected %d",
                    index, row == null ? 0 : row.length, dimensions));
        }
        for (double value : row) {
            if (!Double.isFinite(value)) {
                throw new IllegalArgumentException(
                        String.format("Observation %d contains non-finite value %s", index, value));
            }
        }
    }
}
