package com.metricsentinel.core.config;

import com.metricsentinel.core.model.DetectorKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link SettingsLoader} and the settings it binds.
 */
class SettingsLoaderTest {

    @Test
    @DisplayName("Should bind overrides and keep defaults for omitted keys")
    void shouldBindOverrides() {
        PipelineSettings settings = SettingsLoader.fromClasspath("test-pipeline.yml");

        DetectionSettings detection = settings.getDetection();
        assertThat(detection.zThresholdFor("position")).isEqualTo(2.0);
        assertThat(detection.zThresholdFor("clicks")).isEqualTo(3.0);
        assertThat(detection.getMinBaselinePoints()).isEqualTo(10);
        assertThat(detection.getBaselineWindowDays()).isEqualTo(28);

        FusionSettings fusion = settings.getFusion();
        assertThat(fusion.detectorWeights())
                .containsEntry(DetectorKind.STATISTICAL, 0.5)
                .containsEntry(DetectorKind.OUTLIER, 0.25);
        assertThat(fusion.getHighCutoff()).isEqualTo(0.7);
        assertThat(fusion.getMediumCutoff()).isEqualTo(0.5);

        DeliverySettings delivery = settings.getDelivery();
        assertThat(delivery.getMaxAttempts()).isEqualTo(3);
        assertThat(delivery.backoffBase()).isEqualTo(Duration.ofSeconds(10));
        assertThat(delivery.backoffCap()).isEqualTo(Duration.ofHours(1));
    }

    @Test
    @DisplayName("Should list every invalid value in one exception")
    void shouldCollectAllErrors() {
        assertThatThrownBy(() -> SettingsLoader.fromClasspath("invalid-pipeline.yml"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("detection.defaultZThreshold")
                .hasMessageContaining("mediumCutoff")
                .hasMessageContaining("delivery.maxAttempts");
    }

    @Test
    @DisplayName("Should validate the documented defaults")
    void shouldAcceptDefaults() {
        PipelineSettings defaults = PipelineSettings.defaults();
        defaults.validate();

        assertThat(defaults.getFusion().detectorWeights())
                .containsEntry(DetectorKind.STATISTICAL, 0.4)
                .containsEntry(DetectorKind.OUTLIER, 0.3)
                .containsEntry(DetectorKind.FORECAST, 0.3);
        assertThat(defaults.getDetection().getDefaultZThreshold()).isEqualTo(2.5);
        assertThat(defaults.getDelivery().getMaxAttempts()).isEqualTo(5);
    }

    @Test
    @DisplayName("Should throw when the settings file does not exist")
    void shouldThrowForMissingFile() {
        assertThatThrownBy(() -> SettingsLoader.fromFile("/no/such/pipeline.yml"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not found");
    }
}
