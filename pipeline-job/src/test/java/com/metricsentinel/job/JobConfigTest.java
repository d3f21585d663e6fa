package com.metricsentinel.job;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link JobConfig}.
 */
class JobConfigTest {

    @Test
    @DisplayName("Should build with documented defaults")
    void shouldUseDefaults() {
        JobConfig config = new JobConfig.Builder().build();

        assertThat(config.getMetricsInputPath()).isEqualTo("metrics.jsonl");
        assertThat(config.getJobJournalPath()).isEqualTo("notification-jobs.json");
        assertThat(config.getDeliveryLogPath()).isEqualTo("delivery-attempts.jsonl");
        assertThat(config.getSuppressionStatePath()).isEqualTo("suppression-state.json");
        assertThat(config.getDetectionParallelism()).isEqualTo(4);
        assertThat(config.getRunIntervalMinutes()).isEqualTo(60);
        assertThat(config.getLookbackDays()).isEqualTo(90);
        assertThat(config.getOperationsPort()).isEqualTo(8080);
        assertThat(config.isEmailEnabled()).isFalse();
    }

    @Test
    @DisplayName("Should enable email when an SMTP host is configured")
    void shouldEnableEmail() {
        JobConfig config = new JobConfig.Builder()
                .smtpHost("smtp.internal")
                .smtpPort(587)
                .mailFrom("alerts@example.com")
                .build();

        assertThat(config.isEmailEnabled()).isTrue();
        assertThat(config.getSmtpPort()).isEqualTo(587);
    }

    @Test
    @DisplayName("Should reject a parallelism below one")
    void shouldRejectZeroParallelism() {
        assertThatThrownBy(() -> new JobConfig.Builder().detectionParallelism(0).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("detectionParallelism");
    }

    @Test
    @DisplayName("Should reject ports outside [1, 65535]")
    void shouldRejectInvalidPorts() {
        assertThatThrownBy(() -> new JobConfig.Builder().operationsPort(0).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("operationsPort");
        assertThatThrownBy(() -> new JobConfig.Builder().smtpPort(70_000).build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("smtpPort");
    }

    @Test
    @DisplayName("Should reject blank paths")
    void shouldRejectBlankPaths() {
        assertThatThrownBy(() -> new JobConfig.Builder().metricsInputPath(" ").build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("metricsInputPath");
        assertThatThrownBy(() -> new JobConfig.Builder().jobJournalPath("").build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new JobConfig.Builder().suppressionStatePath("").build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("suppressionStatePath");
    }

    @Test
    @DisplayName("Should require a sender when email is enabled")
    void shouldRequireMailFrom() {
        assertThatThrownBy(() -> new JobConfig.Builder().smtpHost("smtp.internal").mailFrom("").build())
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("mailFrom");
    }

    @Test
    @DisplayName("Should reject non-positive run interval and lookback")
    void shouldRejectNonPositiveSchedule() {
        assertThatThrownBy(() -> new JobConfig.Builder().runIntervalMinutes(0).build())
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new JobConfig.Builder().lookbackDays(-1).build())
                .isInstanceOf(IllegalArgumentException.class);
    }
}
