package com.ammann.trips.model;

import com.ammann.trips.enumeration.TripMetric;

/**
 * Numeric metrics of a single trip as extracted by the query layer.
 *
 * @param speedKmh   average speed in km/h
 * @param farePerKm  fare per kilometre
 * @param distanceKm trip distance in kilometres
 */
public record TripObservation(
        double speedKmh,
        double farePerKm,
        double distanceKm
) {
    /**
     * Returns the metrics as a vector indexed by {@link TripMetric#dimension()}.
     */
    public double[] toVector() {
        double[] vector = new double[TripMetric.values().length];
        vector[TripMetric.SPEED_KMH.dimension()] = speedKmh;
        vector[TripMetric.FARE_PER_KM.dimension()] = farePerKm;
        vector[TripMetric.DISTANCE_KM.dimension()] = distanceKm;
        return vector;
    }
}
