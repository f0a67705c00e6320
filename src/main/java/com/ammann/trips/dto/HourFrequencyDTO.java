package com.ammann.trips.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

@Schema(description = "Pickup hour bucket with its trip count")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record HourFrequencyDTO(
        @Schema(description = "Pickup hour of day (0-23)")
        Integer hour,

        @Schema(description = "Number of trips picked up in this hour")
        Long count
) {}
