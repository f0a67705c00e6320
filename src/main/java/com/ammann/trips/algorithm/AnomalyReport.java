/* (C)2026 */
package com.ammann.trips.algorithm;

import java.util.List;

/**
 * Result of {@link AnomalyScorer#score(List)}.
 *
 * @param totalChecked number of observations in the batch
 * @param threshold    |z-score| above which an observation is flagged
 * @param observations every observation in input order
 */
public record AnomalyReport(int totalChecked, double threshold, List<ScoredObservation> observations)
{
    public AnomalyReport
    {
        observations = List.copyOf(observations);
    }

    /** Flagged observations, in input order. */
    public List<ScoredObservation> anomalies()
    {
        return observations.stream().filter(ScoredObservation::anomalous).toList();
    }
}
