package com.ammann.trips.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * Outcome of an anomaly scan over a batch of trips.
 *
 * <p>{@code anomalies} may be truncated to the configured reporting limit;
 * {@code totalChecked} always counts the whole batch.
 */
@Schema(description = "Result of a z-score anomaly scan")
public record AnomalyScanResultDTO(
        @JsonProperty("total_checked")
        @Schema(description = "Number of trips scored")
        Integer totalChecked,

        @Schema(description = "|z-score| above which a trip is flagged")
        Double threshold,

        @Schema(description = "Flagged trips in batch order")
        List<TripAnomalyDTO> anomalies
) {}
