/* (C)2026 */
package com.ammann.trips.service;

import com.ammann.trips.algorithm.FrequencyRecord;
import com.ammann.trips.algorithm.TopKSelector;
import com.ammann.trips.dto.FrequencyEntryDTO;
import com.ammann.trips.dto.HourFrequencyDTO;
import com.ammann.trips.dto.ZoneFrequencyDTO;
import com.ammann.trips.model.PickupLocation;
import com.ammann.trips.model.ZoneKey;
import jakarta.enterprise.context.ApplicationScoped;
import java.util.List;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Top-k frequency queries over categorical trip attributes.
 *
 * <p>Each call builds its own {@link TopKSelector} sized to the requested {@code k}, feeds
 * the whole sequence through it and discards it, so the bean itself is stateless.
 * Default {@code k} values for the dashboard's hour and zone charts are configurable via
 * {@code trips.analytics.top-hours.default-k} and {@code trips.analytics.top-zones.default-k}.
 */
@ApplicationScoped
public class FrequencyAnalysisService {

    private static final Logger LOG = Logger.getLogger(FrequencyAnalysisService.class);

    static final int DEFAULT_TOP_HOURS = 5;
    static final int DEFAULT_TOP_ZONES = 10;

    @ConfigProperty(name = "trips.analytics.top-hours.default-k", defaultValue = "5")
    int defaultTopHours = DEFAULT_TOP_HOURS;

    @ConfigProperty(name = "trips.analytics.top-zones.default-k", defaultValue = "10")
    int defaultTopZones = DEFAULT_TOP_ZONES;

    /**
     * Ranks arbitrary category keys by frequency.
     *
     * @param categories one entry per occurrence, in scan order
     * @param k          number of categories wanted
     * @return up to {@code k} entries, count descending, first-seen order on ties
     */
    public <K> List<FrequencyEntryDTO> topCategories(List<K> categories, int k) {
        AnalyticsInputValidator.validateK(k);
        AnalyticsInputValidator.validateNotNull("categories", categories);

        List<FrequencyEntryDTO> result = rank(categories, k).stream()
                .map(FrequencyEntryDTO::from)
                .toList();

        LOG.debugf("Top-%d categories computed from %d occurrences: %d entries",
                k, categories.size(), result.size());
        return result;
    }

    /**
     * Busiest pickup hours using the configured default {@code k}.
     */
    public List<HourFrequencyDTO> topPickupHours(List<Integer> pickupHours) {
        return topPickupHours(pickupHours, defaultTopHours);
    }

    /**
     * Ranks pickup hours (0-23) by number of trips.
     *
     * @param pickupHours pickup hour of each trip
     * @param k           number of hours wanted
     */
    public List<HourFrequencyDTO> topPickupHours(List<Integer> pickupHours, int k) {
        AnalyticsInputValidator.validateK(k);
        AnalyticsInputValidator.validateHours("pickupHours", pickupHours);

        List<HourFrequencyDTO> result = rank(pickupHours, k).stream()
                .map(r -> new HourFrequencyDTO(r.category(), r.count()))
                .toList();

        LOG.debugf("Top-%d pickup hours computed from %d trips", k, pickupHours.size());
        return result;
    }

    /**
     * Busiest pickup zones using the configured default {@code k}.
     */
    public List<ZoneFrequencyDTO> topPickupZones(List<PickupLocation> pickups) {
        return topPickupZones(pickups, defaultTopZones);
    }

    /**
     * Ranks pickup zones by number of trips. Coordinates are rounded to 0.01 degree
     * (see {@link ZoneKey}) so nearby pickups fall into the same zone.
     *
     * @param pickups pickup coordinate of each trip
     * @param k       number of zones wanted
     */
    public List<ZoneFrequencyDTO> topPickupZones(List<PickupLocation> pickups, int k) {
        AnalyticsInputValidator.validateK(k);
        AnalyticsInputValidator.validateLocations("pickups", pickups);

        List<ZoneKey> zones = pickups.stream().map(ZoneKey::of).toList();
        List<ZoneFrequencyDTO> result = rank(zones, k).stream()
                .map(r -> ZoneFrequencyDTO.of(r.category(), r.count()))
                .toList();

        LOG.debugf("Top-%d pickup zones computed from %d trips", k, pickups.size());
        return result;
    }

    private static <K> List<FrequencyRecord<K>> rank(List<K> occurrences, int k) {
        TopKSelector<K> selector = new TopKSelector<>(Math.min(k, occurrences.size()));
        for (K occurrence : occurrences) {
            selector.insert(occurrence);
        }
        return selector.topK(k);
    }
}
