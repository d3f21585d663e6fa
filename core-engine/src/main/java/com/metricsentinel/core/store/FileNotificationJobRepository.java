package com.metricsentinel.core.store;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.metricsentinel.core.model.JsonMapping;
import com.metricsentinel.core.model.NotificationJob;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * {@link NotificationJobRepository} journalled to a JSON snapshot file.
 *
 * <p>
 * After every change the full job list is written to a temporary file next to
 * the journal and moved over it atomically, so a crash leaves either the old
 * or the new snapshot, never a torn one. The journal is read back on
 * construction.
 * </p>
 *
 * <h3>Failure</h3>
 * <p>
 * An unreadable or unwritable journal is a storage failure and surfaces as
 * {@link IllegalStateException}.
 * </p>
 *
 * @since 1.0.0
 */
public class FileNotificationJobRepository extends InMemoryNotificationJobRepository {

    private static final Logger LOG = LoggerFactory.getLogger(FileNotificationJobRepository.class);
    private static final TypeReference<List<NotificationJob>> JOB_LIST = new TypeReference<>() {
    };

    private final Path journal;
    private final ObjectMapper mapper = JsonMapping.newMapper();

    public FileNotificationJobRepository(Path journal) {
        this.journal = Objects.requireNonNull(journal, "journal path must not be null");
        load();
    }

    private synchronized void load() {
        if (!Files.exists(journal)) {
            LOG.info("No job journal at {} - starting empty", journal);
            return;
        }
        try {
            List<NotificationJob> jobs = mapper.readValue(journal.toFile(), JOB_LIST);
            restore(jobs);
            LOG.info("Loaded {} notification job(s) from {}", jobs.size(), journal);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read job journal: " + journal, e);
        }
    }

    @Override
    protected void afterMutation() {
        Path parent = journal.toAbsolutePath().getParent();
        try {
            if (parent != null) {
                Files.createDirectories(parent);
            }
            Path tmp = Files.createTempFile(parent, journal.getFileName().toString(), ".tmp");
            try {
                mapper.writeValue(tmp.toFile(), new ArrayList<>(snapshot()));
                Files.move(tmp, journal, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } finally {
                Files.deleteIfExists(tmp);
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to write job journal: " + journal, e);
        }
    }

    public Path getJournal() {
        return journal;
    }
}
