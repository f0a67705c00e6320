package com.ammann.trips.model;

/**
 * Raw pickup coordinate of a trip in decimal degrees.
 *
 * @param lat latitude
 * @param lng longitude
 */
public record PickupLocation(double lat, double lng) {}
