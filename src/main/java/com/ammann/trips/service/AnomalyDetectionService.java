/* (C)2026 */
package com.ammann.trips.service;

import com.ammann.trips.algorithm.AnomalyReport;
import com.ammann.trips.algorithm.AnomalyScorer;
import com.ammann.trips.algorithm.RollingAnomalyDetector;
import com.ammann.trips.algorithm.ScoredObservation;
import com.ammann.trips.dto.AnomalyScanResultDTO;
import com.ammann.trips.dto.TripAnomalyDTO;
import com.ammann.trips.exception.ValidationException;
import com.ammann.trips.model.TripObservation;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import java.util.List;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

/**
 * Z-score anomaly scans over batches of trips (speed, fare per km, distance).
 *
 * <p>The scan is a two-pass batch computation over whatever window the caller supplies;
 * no state is kept between calls. The threshold and the maximum number of reported
 * anomalies come from {@code trips.anomaly.threshold} and {@code trips.anomaly.max-reported}.
 */
@ApplicationScoped
public class AnomalyDetectionService {

    private static final Logger LOG = Logger.getLogger(AnomalyDetectionService.class);

    static final int DEFAULT_MAX_REPORTED = 50;

    @ConfigProperty(name = "trips.anomaly.threshold", defaultValue = "2.5")
    double threshold = AnomalyScorer.DEFAULT_THRESHOLD;

    @ConfigProperty(name = "trips.anomaly.max-reported", defaultValue = "50")
    int maxReported = DEFAULT_MAX_REPORTED;

    @ConfigProperty(name = "trips.anomaly.rolling.window-size", defaultValue = "100")
    int rollingWindowSize = RollingAnomalyDetector.DEFAULT_WINDOW_SIZE;

    private final MeterRegistry meterRegistry;

    @Inject
    public AnomalyDetectionService(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    /**
     * Scans {@code observations} with the configured threshold.
     */
    public AnomalyScanResultDTO scan(List<TripObservation> observations) {
        return scan(observations, threshold);
    }

    /**
     * Scores every trip and reports those whose speed, fare per km or distance deviates
     * more than {@code threshold} standard deviations from the batch mean.
     *
     * @param observations trips in the order the caller wants indexes reported in
     * @param threshold    non-negative |z-score| limit
     * @return total checked, the threshold used, and at most {@code max-reported} anomalies
     * @throws ValidationException on a negative or non-finite threshold or malformed trips
     */
    public AnomalyScanResultDTO scan(List<TripObservation> observations, double threshold) {
        AnalyticsInputValidator.validateThreshold(threshold);
        AnalyticsInputValidator.validateObservations("observations", observations);

        Timer.Sample sample = meterRegistry != null ? Timer.start(meterRegistry) : null;

        List<double[]> batch = observations.stream().map(TripObservation::toVector).toList();
        AnomalyReport report = new AnomalyScorer(threshold).score(batch);
        List<ScoredObservation> flagged = report.anomalies();

        if (flagged.size() > maxReported) {
            LOG.infof("Anomaly scan flagged %d of %d trips; reporting first %d",
                    flagged.size(), report.totalChecked(), maxReported);
        } else {
            LOG.debugf("Anomaly scan flagged %d of %d trips (threshold=%.2f)",
                    (Object) flagged.size(), (Object) report.totalChecked(), (Object) threshold);
        }

        List<TripAnomalyDTO> anomalies = flagged.stream()
                .limit(Math.max(maxReported, 0))
                .map(TripAnomalyDTO::from)
                .toList();

        recordScan(sample, report.totalChecked(), flagged.size());
        return new AnomalyScanResultDTO(report.totalChecked(), threshold, anomalies);
    }

    /**
     * Creates a streaming detector configured from {@code trips.anomaly.rolling.window-size}
     * and the configured threshold. The caller owns the returned instance.
     */
    public RollingAnomalyDetector rollingDetector() {
        return new RollingAnomalyDetector(rollingWindowSize, threshold);
    }

    private void recordScan(Timer.Sample sample, int checked, int flagged) {
        if (meterRegistry == null) {
            return;
        }

        sample.stop(Timer.builder("trips_anomaly_scan_duration")
                .description("Duration of anomaly scans")
                .register(meterRegistry));
        Counter.builder("trips_anomaly_checked_total")
                .description("Total number of trips scored for anomalies")
                .register(meterRegistry)
                .increment(checked);
        Counter.builder("trips_anomaly_flagged_total")
                .description("Total number of trips flagged as anomalous")
                .register(meterRegistry)
                .increment(flagged);
    }
}
