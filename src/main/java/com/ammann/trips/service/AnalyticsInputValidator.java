/* (C)2026 */
package com.ammann.trips.service;

import com.ammann.trips.exception.ValidationException;
import com.ammann.trips.model.PickupLocation;
import com.ammann.trips.model.TripObservation;
import java.util.List;

/**
 * Validation of caller-supplied analytics parameters.
 *
 * <p>Runs before any algorithm is entered so that illegal input surfaces as a
 * {@link ValidationException} instead of being coerced.
 */
final class AnalyticsInputValidator {

    static final int MIN_HOUR = 0;
    static final int MAX_HOUR = 23;

    private AnalyticsInputValidator() {}

    static void validateK(int k) {
        if (k <= 0) {
            throw ValidationException.invalidParameter("k", k, "a positive integer");
        }
    }

    static void validateHour(String name, int hour) {
        if (hour < MIN_HOUR || hour > MAX_HOUR) {
            throw ValidationException.invalidParameter(
                    name, hour, String.format("an hour between %d and %d", MIN_HOUR, MAX_HOUR));
        }
    }

    static void validateThreshold(double threshold) {
        if (!Double.isFinite(threshold) || threshold < 0.0) {
            throw ValidationException.invalidParameter(
                    "threshold", threshold, "a finite non-negative number");
        }
    }

    static <T> void validateNotNull(String name, List<T> values) {
        if (values == null) {
            throw ValidationException.invalidParameter(name, null, "a list");
        }
        for (int i = 0; i < values.size(); i++) {
            if (values.get(i) == null) {
                throw ValidationException.invalidElement(name, i, null, "a non-null value");
            }
        }
    }

    static void validateFinite(String name, List<Double> values) {
        validateNotNull(name, values);
        for (int i = 0; i < values.size(); i++) {
            if (!Double.isFinite(values.get(i))) {
                throw ValidationException.invalidElement(name, i, values.get(i), "a finite number");
            }
        }
    }

    static void validateHours(String name, List<Integer> hours) {
        validateNotNull(name, hours);
        for (int i = 0; i < hours.size(); i++) {
            int hour = hours.get(i);
            if (hour < MIN_HOUR || hour > MAX_HOUR) {
                throw ValidationException.invalidElement(
                        name, i, hour, String.format("an hour between %d and %d", MIN_HOUR, MAX_HOUR));
            }
        }
    }

    static void validateLocations(String name, List<PickupLocation> locations) {
        validateNotNull(name, locations);
        for (int i = 0; i < locations.size(); i++) {
            PickupLocation location = locations.get(i);
            if (!Double.isFinite(location.lat()) || Math.abs(location.lat()) > 90.0
                    || !Double.isFinite(location.lng()) || Math.abs(location.lng()) > 180.0) {
                throw ValidationException.invalidElement(
                        name, i, location, "latitude within [-90, 90] and longitude within [-180, 180]");
            }
        }
    }

    static void validateObservations(String name, List<TripObservation> observations) {
        validateNotNull(name, observations);
        for (int i = 0; i < observations.size(); i++) {
            TripObservation observation = observations.get(i);
            if (!Double.isFinite(observation.speedKmh())
                    || !Double.isFinite(observation.farePerKm())
                    || !Double.isFinite(observation.distanceKm())) {
                throw ValidationException.invalidElement(name, i, observation, "finite metrics");
            }
        }
    }
}
