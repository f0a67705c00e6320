/* (C)2026 */
package com.ammann.trips.model;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Pickup zone identified by coordinates rounded to {@value #SCALE} decimals
 * (0.01 degree, roughly one kilometre).
 *
 * @param lat rounded latitude
 * @param lng rounded longitude
 */
public record ZoneKey(double lat, double lng) {

    public static final int SCALE = 2;

    /**
     * Returns the zone containing {@code location}. Rounding is half-even on the decimal
     * representation of each coordinate.
     */
    public static ZoneKey of(PickupLocation location) {
        return new ZoneKey(round(location.lat()), round(location.lng()));
    }

    private static double round(double degrees) {
        return BigDecimal.valueOf(degrees).setScale(SCALE, RoundingMode.HALF_EVEN).doubleValue();
    }
}
