package com.metricsentinel.core.delivery;

import com.metricsentinel.core.config.DeliverySettings;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Random;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link ExponentialBackoff}.
 */
class ExponentialBackoffTest {

    @Test
    @DisplayName("Should double the delay per failed attempt up to the cap")
    void shouldGrowExponentially() {
        ExponentialBackoff backoff = new ExponentialBackoff(Duration.ofSeconds(30), Duration.ofMinutes(5), 0.0,
                new Random(1));

        assertThat(backoff.delay(1)).isEqualTo(Duration.ofSeconds(30));
        assertThat(backoff.delay(2)).isEqualTo(Duration.ofSeconds(60));
        assertThat(backoff.delay(3)).isEqualTo(Duration.ofSeconds(120));
        assertThat(backoff.delay(4)).isEqualTo(Duration.ofSeconds(240));
        assertThat(backoff.delay(5)).isEqualTo(Duration.ofMinutes(5));
        assertThat(backoff.delay(60)).isEqualTo(Duration.ofMinutes(5));
    }

    @Test
    @DisplayName("Should only shorten delays when jitter is applied")
    void shouldApplyJitterDownwards() {
        ExponentialBackoff backoff = new ExponentialBackoff(Duration.ofSeconds(10), Duration.ofHours(1), 0.2,
                new Random(42));

        for (int i = 0; i < 50; i++) {
            assertThat(backoff.delay(2)).isBetween(Duration.ofSeconds(16), Duration.ofSeconds(20));
        }
    }

    @Test
    @DisplayName("Should build from delivery settings")
    void shouldBuildFromSettings() {
        DeliverySettings settings = new DeliverySettings();
        settings.setBackoffJitter(0.0);

        ExponentialBackoff backoff = ExponentialBackoff.from(settings);

        assertThat(backoff.delay(1)).isEqualTo(settings.backoffBase());
        assertThat(backoff.delay(20)).isEqualTo(settings.backoffCap());
    }

    @Test
    @DisplayName("Should reject invalid arguments")
    void shouldRejectInvalidArguments() {
        assertThatThrownBy(() -> new ExponentialBackoff(Duration.ZERO, Duration.ofSeconds(1), 0.0, new Random()))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ExponentialBackoff(Duration.ofSeconds(10), Duration.ofSeconds(5), 0.0,
                new Random())).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new ExponentialBackoff(Duration.ofSeconds(1), Duration.ofSeconds(5), 1.0,
                new Random())).isInstanceOf(IllegalArgumentException.class);

        ExponentialBackoff backoff = new ExponentialBackoff(Duration.ofSeconds(1), Duration.ofSeconds(5), 0.0,
                new Random());
        assertThatThrownBy(() -> backoff.delay(0)).isInstanceOf(IllegalArgumentException.class);
    }
}
