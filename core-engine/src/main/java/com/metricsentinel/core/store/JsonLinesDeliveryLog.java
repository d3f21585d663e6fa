package com.metricsentinel.core.store;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.metricsentinel.core.model.DeliveryAttempt;
import com.metricsentinel.core.model.JsonMapping;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * {@link DeliveryLog} appended to a file with one JSON attempt per line.
 * Lines that cannot be parsed on start-up are logged and skipped.
 *
 * @since 1.0.0
 */
public class JsonLinesDeliveryLog implements DeliveryLog {

    private static final Logger LOG = LoggerFactory.getLogger(JsonLinesDeliveryLog.class);

    private final Path file;
    private final ObjectMapper mapper = JsonMapping.newMapper();
    private final InMemoryDeliveryLog cache = new InMemoryDeliveryLog();

    public JsonLinesDeliveryLog(Path file) {
        this.file = Objects.requireNonNull(file, "file must not be null");
        if (Files.exists(file)) {
            readExisting();
        }
    }

    private void readExisting() {
        int skipped = 0;
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (line.isBlank()) {
                    continue;
                }
                try {
                    cache.append(mapper.readValue(line, DeliveryAttempt.class));
                } catch (IOException e) {
                    skipped++;
                    LOG.warn("Skipping unreadable delivery log line in {}: {}", file, e.getMessage());
                }
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read delivery log: " + file, e);
        }
        LOG.info("Loaded {} delivery attempt(s) from {} ({} skipped)", cache.all().size(), file, skipped);
    }

    @Override
    public synchronized void append(DeliveryAttempt attempt) {
        Objects.requireNonNull(attempt, "attempt must not be null");
        try {
            Path parent = file.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (BufferedWriter writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND)) {
                writer.write(mapper.writeValueAsString(attempt));
                writer.newLine();
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to append to delivery log: " + file, e);
        }
        cache.append(attempt);
    }

    @Override
    public List<DeliveryAttempt> attemptsFor(String jobId) {
        return cache.attemptsFor(jobId);
    }

    @Override
    public List<DeliveryAttempt> all() {
        return new ArrayList<>(cache.all());
    }
}
