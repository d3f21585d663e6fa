package com.metricsentinel.core.store;

import com.metricsentinel.core.model.Severity;
import com.metricsentinel.core.model.Suppression;
import com.metricsentinel.core.model.Suppression.DigestEntry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link FileSuppressionRepository}.
 */
class FileSuppressionRepositoryTest {

    private static final Instant NOW = Instant.parse("2024-03-10T08:00:00Z");
    private static final LocalDate DAY = LocalDate.of(2024, 3, 10);

    @TempDir
    Path dir;

    @Test
    @DisplayName("Should start empty when no journal exists")
    void shouldStartEmpty() {
        FileSuppressionRepository repository = new FileSuppressionRepository(dir.resolve("suppression.json"));

        assertThat(repository.findAll()).isEmpty();
        assertThat(repository.getJournal()).doesNotExist();
    }

    @Test
    @DisplayName("Should restore open windows with their pending digest after a restart")
    void shouldReloadWindows() {
        Path journal = dir.resolve("state/suppression.json");
        FileSuppressionRepository first = new FileSuppressionRepository(journal);
        first.compute("k1", existing -> {
            Suppression s = new Suppression("k1", "drops", NOW, NOW.plusSeconds(3600));
            s.incrementSuppressed();
            s.addPending(new DigestEntry("a1", "[LOW] Drops", Severity.LOW, NOW));
            s.addPending(new DigestEntry("a2", "[LOW] Drops", Severity.LOW, NOW.plusSeconds(60)));
            return s;
        });

        FileSuppressionRepository reloaded = new FileSuppressionRepository(journal);

        assertThat(reloaded.find("k1")).hasValueSatisfying(s -> {
            assertThat(s.getRuleId()).isEqualTo("drops");
            assertThat(s.getWindowEnd()).isEqualTo(NOW.plusSeconds(3600));
            assertThat(s.getSuppressedCount()).isEqualTo(1);
            assertThat(s.getPendingDigest()).extracting(DigestEntry::getAlertId).containsExactly("a1", "a2");
            assertThat(s.isActiveAt(NOW.plusSeconds(10))).isTrue();
        });
    }

    @Test
    @DisplayName("Should keep the daily allowance used before a restart")
    void shouldReloadDailyCounters() {
        Path journal = dir.resolve("suppression.json");
        FileSuppressionRepository first = new FileSuppressionRepository(journal);
        assertThat(first.tryAcquireDailySlot("drops", DAY, 1)).isTrue();

        FileSuppressionRepository reloaded = new FileSuppressionRepository(journal);

        assertThat(reloaded.tryAcquireDailySlot("drops", DAY, 1)).isFalse();
        assertThat(reloaded.tryAcquireDailySlot("drops", DAY.plusDays(1), 1)).isTrue();
    }

    @Test
    @DisplayName("Should persist removal of a closed window")
    void shouldPersistRemoval() {
        Path journal = dir.resolve("suppression.json");
        FileSuppressionRepository first = new FileSuppressionRepository(journal);
        first.compute("k1", existing -> new Suppression("k1", "drops", NOW, NOW.plusSeconds(60)));
        first.compute("k1", existing -> null);

        assertThat(new FileSuppressionRepository(journal).findAll()).isEmpty();
    }

    @Test
    @DisplayName("Should fail fast on a corrupt journal")
    void shouldRejectCorruptJournal() throws IOException {
        Path journal = dir.resolve("suppression.json");
        Files.writeString(journal, "{not json");

        assertThatThrownBy(() -> new FileSuppressionRepository(journal))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("suppression journal");
    }
}
