package com.ammann.trips.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Median trip speed for one pickup hour.
 *
 * <p>{@code medianSpeedKmh} is {@code null} when the hour has no trips; it is serialized
 * explicitly so clients can tell "no data" from a missing field.
 */
@Schema(description = "Median trip speed for a pickup hour")
public record MedianSpeedDTO(
        @Schema(description = "Pickup hour of day (0-23)")
        Integer hour,

        @JsonProperty("median_speed_kmh")
        @Schema(description = "Median speed in km/h, null without samples", nullable = true)
        Double medianSpeedKmh,

        @JsonProperty("sample_count")
        @Schema(description = "Number of speed samples in the hour")
        Integer sampleCount
) {}
