package com.metricsentinel.core.detection;

import com.metricsentinel.core.config.DetectionSettings;
import com.metricsentinel.core.model.DetectorKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Unit tests for {@link DetectorFactory}.
 */
class DetectorFactoryTest {

    private final DetectionSettings settings = new DetectionSettings();

    @Test
    @DisplayName("Should create StatisticalBaselineDetector for STATISTICAL")
    void shouldCreateStatisticalDetector() {
        assertThat(DetectorFactory.create(DetectorKind.STATISTICAL, settings))
                .isInstanceOf(StatisticalBaselineDetector.class);
    }

    @Test
    @DisplayName("Should create OutlierClassifierDetector for OUTLIER")
    void shouldCreateOutlierDetector() {
        assertThat(DetectorFactory.create(DetectorKind.OUTLIER, settings))
                .isInstanceOf(OutlierClassifierDetector.class);
    }

    @Test
    @DisplayName("Should create ForecastDeviationDetector for FORECAST")
    void shouldCreateForecastDetector() {
        assertThat(DetectorFactory.create(DetectorKind.FORECAST, settings))
                .isInstanceOf(ForecastDeviationDetector.class);
    }

    @Test
    @DisplayName("Should create one unmodifiable detector per kind")
    void shouldCreateAll() {
        List<AnomalyDetector> all = DetectorFactory.createAll(settings);

        assertThat(all).extracting(AnomalyDetector::kind)
                .containsExactly(DetectorKind.values());
        assertThatThrownBy(() -> all.add(all.get(0)))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("Should reject null kind")
    void shouldRejectNullKind() {
        assertThatThrownBy(() -> DetectorFactory.create(null, settings))
                .isInstanceOf(NullPointerException.class)
                .hasMessageContaining("DetectorKind");
    }
}
