package com.metricsentinel.core.store;

import com.metricsentinel.core.model.JobStatus;
import com.metricsentinel.core.model.NotificationJob;
import com.metricsentinel.core.model.NotificationPayload;
import com.metricsentinel.core.model.Severity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link FileNotificationJobRepository}.
 */
class FileNotificationJobRepositoryTest {

    private static final Instant NOW = Instant.parse("2024-03-10T08:00:00Z");

    @TempDir
    Path dir;

    @Test
    @DisplayName("Should start empty when no journal exists")
    void shouldStartEmpty() {
        FileNotificationJobRepository repository = new FileNotificationJobRepository(dir.resolve("jobs.json"));

        assertThat(repository.findAll()).isEmpty();
        assertThat(repository.getJournal()).doesNotExist();
    }

    @Test
    @DisplayName("Should survive a restart with jobs and payload intact")
    void shouldReloadJournal() {
        Path journal = dir.resolve("state/jobs.json");
        FileNotificationJobRepository first = new FileNotificationJobRepository(journal);
        first.insertIfAbsent(job("j1", "alert-1", Severity.HIGH));
        first.insertIfAbsent(job("j2", "alert-2", Severity.LOW));

        FileNotificationJobRepository reloaded = new FileNotificationJobRepository(journal);

        assertThat(reloaded.findAll()).extracting(NotificationJob::getId).containsExactly("j1", "j2");
        assertThat(reloaded.findById("j1")).hasValueSatisfying(j -> {
            assertThat(j.getSeverity()).isEqualTo(Severity.HIGH);
            assertThat(j.getCreatedAt()).isEqualTo(NOW);
            assertThat(j.getPayload().getAlertIds()).containsExactly("alert-1");
            assertThat(j.getPayload().getMetrics()).containsEntry("actual", 12.5);
        });
        assertThat(reloaded.insertIfAbsent(job("j3", "alert-1", Severity.HIGH))).isFalse();
    }

    @Test
    @DisplayName("Should persist in-flight claims so they can be recovered after a crash")
    void shouldRecoverInFlightAfterRestart() {
        Path journal = dir.resolve("jobs.json");
        FileNotificationJobRepository first = new FileNotificationJobRepository(journal);
        first.insertIfAbsent(job("j1", "alert-1", Severity.MEDIUM));
        first.claimDue(NOW, 10);

        FileNotificationJobRepository restarted = new FileNotificationJobRepository(journal);
        assertThat(restarted.findByStatus(JobStatus.IN_FLIGHT)).hasSize(1);

        assertThat(restarted.recoverInFlight(NOW.plusSeconds(60))).isEqualTo(1);
        assertThat(new FileNotificationJobRepository(journal).findById("j1")).hasValueSatisfying(j -> {
            assertThat(j.getStatus()).isEqualTo(JobStatus.QUEUED);
            assertThat(j.getNextAttemptAt()).isEqualTo(NOW.plusSeconds(60));
        });
    }

    @Test
    @DisplayName("Should fail loudly on a corrupt journal")
    void shouldRejectCorruptJournal() throws IOException {
        Path journal = dir.resolve("jobs.json");
        Files.writeString(journal, "{not json");

        assertThatThrownBy(() -> new FileNotificationJobRepository(journal))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("Failed to read job journal");
    }

    @Test
    @DisplayName("Should reject updates to unknown jobs")
    void shouldRejectUnknownUpdate() {
        FileNotificationJobRepository repository = new FileNotificationJobRepository(dir.resolve("jobs.json"));

        assertThatThrownBy(() -> repository.update(job("missing", "a", Severity.LOW)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    // Helper

    static NotificationJob job(String id, String alertId, Severity severity) {
        NotificationPayload payload = new NotificationPayload();
        payload.setTitle("title " + alertId);
        payload.setSeverity(severity);
        payload.setAlertIds(List.of(alertId));
        payload.setAlertCount(1);
        payload.setMetrics(Map.of("actual", 12.5));
        payload.setCreatedAt(NOW);
        return new NotificationJob(id, alertId, "rule-1", "webhook", "http://localhost/hook", severity, payload,
                NOW);
    }
}
