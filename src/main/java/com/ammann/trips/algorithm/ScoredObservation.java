/* (C)2026 */
package com.ammann.trips.algorithm;

import java.util.List;

/**
 * One observation of a scored batch.
 *
 * @param index     0-based position in the input batch
 * @param values    observed value per dimension
 * @param zScores   standardized deviation per dimension, 0 for degenerate dimensions
 * @param anomalous whether any |z-score| exceeds the scorer's threshold
 */
public record ScoredObservation(int index, List<Double> values, List<Double> zScores, boolean anomalous)
{
    public ScoredObservation
    {
        values = List.copyOf(values);
        zScores = List.copyOf(zScores);
    }

    public double value(int dimension)
    {
        return values.get(dimension);
    }

    public double zScore(int dimension)
    {
        return zScores.get(dimension);
    }
}
