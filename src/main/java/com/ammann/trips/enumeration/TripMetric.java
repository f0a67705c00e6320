package com.ammann.trips.enumeration;

/**
 * Numeric trip dimensions scored for anomalies.
 *
 * <p>The ordinal is the dimension's position in an observation vector, so the declaration
 * order must match {@link com.ammann.trips.model.TripObservation#toVector()}.
 */
public enum TripMetric
{
    /** Average trip speed in km/h. */
    SPEED_KMH("speed_kmh"),
    /** Fare divided by trip distance. */
    FARE_PER_KM("fare_per_km"),
    /** Trip distance in km. */
    DISTANCE_KM("distance_km");

    private final String columnName;

    TripMetric(String columnName) {
        this.columnName = columnName;
    }

    public int dimension() { return ordinal(); }

    public String getColumnName() { return columnName; }
}
