package com.ammann.trips.dto;

import com.ammann.trips.model.ZoneKey;
import com.fasterxml.jackson.annotation.JsonInclude;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Pickup zone (coordinates rounded to 0.01 degree) and its trip count.
 */
@Schema(description = "Pickup zone with its trip count")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ZoneFrequencyDTO(
        @Schema(description = "Zone latitude rounded to 2 decimals")
        Double lat,

        @Schema(description = "Zone longitude rounded to 2 decimals")
        Double lng,

        @Schema(description = "Number of pickups in this zone")
        Long count
) {
    public static ZoneFrequencyDTO of(ZoneKey zone, long count) {
        return new ZoneFrequencyDTO(zone.lat(), zone.lng(), count);
    }
}
