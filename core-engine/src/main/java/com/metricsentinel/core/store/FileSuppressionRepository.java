package com.metricsentinel.core.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.metricsentinel.core.model.JsonMapping;
import com.metricsentinel.core.model.Suppression;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * {@link SuppressionRepository} journalled to a JSON snapshot file, so open
 * dedup windows, pending digest entries and daily counters survive a restart.
 *
 * <p>
 * Written the same way as {@link FileNotificationJobRepository}: the whole
 * state goes to a temporary file that is moved over the journal atomically.
 * An unreadable or unwritable journal surfaces as
 * {@link IllegalStateException}.
 * </p>
 *
 * @since 1.0.0
 */
public class FileSuppressionRepository extends InMemorySuppressionRepository {

    private static final Logger LOG = LoggerFactory.getLogger(FileSuppressionRepository.class);

    private final Path journal;
    private final ObjectMapper mapper = JsonMapping.newMapper();

    public FileSuppressionRepository(Path journal) {
        this.journal = Objects.requireNonNull(journal, "journal path must not be null");
        load();
    }

    private synchronized void load() {
        if (!Files.exists(journal)) {
            LOG.info("No suppression journal at {} - starting empty", journal);
            return;
        }
        try {
            State state = mapper.readValue(journal.toFile(), State.class);
            restore(state.windows, state.dailyCounts);
            LOG.info("Loaded {} suppression window(s) from {}", state.windows.size(), journal);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read suppression journal: " + journal, e);
        }
    }

    @Override
    protected synchronized void afterMutation() {
        State state = new State();
        state.windows = new ArrayList<>(windowsSnapshot());
        state.dailyCounts = new LinkedHashMap<>(dailyCountsSnapshot());
        Path parent = journal.toAbsolutePath().getParent();
        try {
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path tmp = Files.createTempFile(parent, journal.getFileName().toString(), ".tmp");
            try {
                mapper.writeValue(tmp.toFile(), state);
                Files.move(tmp, journal, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } finally {
                Files.deleteIfExists(tmp);
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write suppression journal: " + journal, e);
        }
    }

    public Path getJournal() {
        return journal;
    }

    /** On-disk layout of the journal. */
    static final class State {
        public List<Suppression> windows = new ArrayList<>();
        public Map<String, Integer> dailyCounts = new LinkedHashMap<>();
    }
}
