/* (C)2026 */
package com.ammann.trips.service;

import com.ammann.trips.algorithm.StreamingMedian;
import com.ammann.trips.dto.MedianSpeedDTO;
import jakarta.enterprise.context.ApplicationScoped;
import java.util.ArrayList;
import java.util.List;
import java.util.OptionalDouble;
import org.jboss.logging.Logger;

/**
 * Median queries over numeric trip metrics, backed by {@link StreamingMedian}.
 */
@ApplicationScoped
public class MedianAnalysisService {

    private static final Logger LOG = Logger.getLogger(MedianAnalysisService.class);

    /**
     * Median of {@code values}.
     *
     * @return the median, or empty for an empty sequence
     */
    public OptionalDouble median(List<Double> values) {
        AnalyticsInputValidator.validateFinite("values", values);

        StreamingMedian median = new StreamingMedian();
        median.insertAll(values);
        return median.median();
    }

    /**
     * Median trip speed of the trips picked up in {@code hour}.
     *
     * @param hour   pickup hour the speeds were filtered to (0-23)
     * @param speeds speeds in km/h of those trips
     * @return the median with its sample count; the median is null without samples
     */
    public MedianSpeedDTO medianSpeedForHour(int hour, List<Double> speeds) {
        AnalyticsInputValidator.validateHour("hour", hour);
        OptionalDouble median = median(speeds);

        if (median.isEmpty()) {
            LOG.debugf("No speed samples for hour %d", hour);
            return new MedianSpeedDTO(hour, null, 0);
        }

        LOG.debugf("Median speed for hour %d: %.3f km/h from %d samples",
                (Object) hour, (Object) median.getAsDouble(), (Object) speeds.size());
        return new MedianSpeedDTO(hour, median.getAsDouble(), speeds.size());
    }

    /**
     * Median after each prefix of {@code values}: element {@code i} is the median of
     * the first {@code i + 1} values.
     */
    public List<Double> runningMedians(List<Double> values) {
        AnalyticsInputValidator.validateFinite("values", values);

        StreamingMedian median = new StreamingMedian();
        List<Double> medians = new ArrayList<>(values.size());
        for (double value : values) {
            median.insert(value);
            medians.add(median.median().orElseThrow());
        }
        return medians;
    }
}
