package com.ammann.trips.dto;

import com.ammann.trips.algorithm.ScoredObservation;
import com.ammann.trips.enumeration.TripMetric;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * A trip flagged by an anomaly scan, with its metrics and their z-scores.
 */
@Schema(description = "Anomalous trip with per-metric values and z-scores")
public record TripAnomalyDTO(
        @Schema(description = "0-based position of the trip in the scanned batch")
        Integer index,

        @JsonProperty("speed_kmh")
        Double speedKmh,

        @JsonProperty("fare_per_km")
        Double farePerKm,

        @JsonProperty("distance_km")
        Double distanceKm,

        @JsonProperty("speed_z_score")
        Double speedZScore,

        @JsonProperty("fare_z_score")
        Double fareZScore,

        @JsonProperty("distance_z_score")
        Double distanceZScore
) {
    /**
     * Maps a scored observation whose dimensions follow {@link TripMetric} order.
     */
    public static TripAnomalyDTO from(ScoredObservation observation) {
        return new TripAnomalyDTO(
                observation.index(),
                observation.value(TripMetric.SPEED_KMH.dimension()),
                observation.value(TripMetric.FARE_PER_KM.dimension()),
                observation.value(TripMetric.DISTANCE_KM.dimension()),
                observation.zScore(TripMetric.SPEED_KMH.dimension()),
                observation.zScore(TripMetric.FARE_PER_KM.dimension()),
                observation.zScore(TripMetric.DISTANCE_KM.dimension())
        );
    }
}
