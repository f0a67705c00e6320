package com.ammann.trips.service;

import com.ammann.trips.dto.MedianSpeedDTO;
import com.ammann.trips.exception.ValidationException;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link MedianAnalysisService}.
 */
class MedianAnalysisServiceTest
{

    private final MedianAnalysisService service = new MedianAnalysisService();

    @Test
    void medianSpeedForHourReportsSampleCount()
    {
        MedianSpeedDTO dto = service.medianSpeedForHour(8, List.of(22.0, 35.5, 18.0, 41.0));

        assertThat(dto.hour()).isEqualTo(8);
        assertThat(dto.medianSpeedKmh()).isEqualTo(28.75);
        assertThat(dto.sampleCount()).isEqualTo(4);
    }

    @Test
    void medianSpeedWithoutSamplesIsNull()
    {
        MedianSpeedDTO dto = service.medianSpeedForHour(3, List.of());

        assertThat(dto.medianSpeedKmh()).isNull();
        assertThat(dto.sampleCount()).isZero();
    }

    @Test
    void runningMediansFollowEachPrefix()
    {
        assertThat(service.runningMedians(List.of(5.0, 2.0, 8.0, 1.0)))
                .containsExactly(5.0, 3.5, 5.0, 3.5);
    }

    @Test
    void medianOfEmptyInputIsAbsent()
    {
        assertThat(service.median(List.of())).isEmpty();
        assertThat(service.median(List.of(4.0))).hasValue(4.0);
    }

    @Test
    void rejectsInvalidInput()
    {
        assertThatThrownBy(() -> service.medianSpeedForHour(24, List.of(1.0)))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("'hour'");
        assertThatThrownBy(() -> service.median(List.of(1.0, Double.NaN)))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("index 1");
        assertThatThrownBy(() -> service.runningMedians(Arrays.asList(1.0, null)))
                .isInstanceOf(ValidationException.class);
    }
}
