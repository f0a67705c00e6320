package com.ammann.trips.dto;

import com.ammann.trips.algorithm.FrequencyRecord;
import com.fasterxml.jackson.annotation.JsonInclude;
import org.eclipse.microprofile.openapi.annotations.media.Schema;

/**
 * A category and the number of times it occurred, as ranked by a top-k query.
 */
@Schema(description = "Category with its occurrence count")
@JsonInclude(JsonInclude.Include.NON_NULL)
public record FrequencyEntryDTO(
        @Schema(description = "Category key as text")
        String category,

        @Schema(description = "Number of occurrences")
        Long count
) {
    public static FrequencyEntryDTO from(FrequencyRecord<?> record) {
        return new FrequencyEntryDTO(String.valueOf(record.category()), record.count());
    }
}
