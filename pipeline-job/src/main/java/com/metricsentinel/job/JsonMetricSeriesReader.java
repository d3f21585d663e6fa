package com.metricsentinel.job;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.metricsentinel.core.model.JsonMapping;
import com.metricsentinel.core.model.MetricPoint;
import com.metricsentinel.core.model.SeriesKey;
import com.metricsentinel.core.store.InMemoryMetricSeriesReader;
import com.metricsentinel.core.store.MetricSeriesReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;
import java.util.Objects;

/**
 * {@link MetricSeriesReader} over a JSON-lines export of the metric store,
 * one {@link MetricPoint} object per line:
 *
 * <pre>
 * {"entityId":"/pricing","metric":"clicks","date":"2024-03-01","value":132.0}
 * </pre>
 *
 * <p>
 * Malformed lines are logged and skipped so a single bad record does not
 * abort a run. {@link #refresh()} re-reads the file; an unreadable file
 * throws {@link UncheckedIOException}.
 * </p>
 *
 * @since 1.0.0
 */
public class JsonMetricSeriesReader implements MetricSeriesReader {

    private static final Logger LOG = LoggerFactory.getLogger(JsonMetricSeriesReader.class);

    private final Path file;
    private final ObjectMapper mapper = JsonMapping.newMapper();
    private volatile InMemoryMetricSeriesReader snapshot = new InMemoryMetricSeriesReader();

    public JsonMetricSeriesReader(Path file) {
        this.file = Objects.requireNonNull(file, "file must not be null");
    }

    /**
     * Re-read the input file.
     *
     * @return number of points loaded
     */
    public int refresh() {
        InMemoryMetricSeriesReader next = new InMemoryMetricSeriesReader();
        int loaded = 0;
        int skipped = 0;
        try (BufferedReader in = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            int lineNo = 0;
            while ((line = in.readLine()) != null) {
                lineNo++;
                if (line.isBlank()) {
                    continue;
                }
                try {
                    next.add(mapper.readValue(line, MetricPoint.class));
                    loaded++;
                } catch (IOException | RuntimeException e) {
                    skipped++;
                    LOG.warn("Skipping malformed metric at {}:{}: {}", file, lineNo, e.getMessage());
                }
            }
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read metrics input " + file, e);
        }
        snapshot = next;
        LOG.info("Loaded {} metric point(s) from {} ({} skipped)", loaded, file, skipped);
        return loaded;
    }

    @Override
    public List<SeriesKey> listSeries() {
        return snapshot.listSeries();
    }

    @Override
    public List<MetricPoint> readSeries(SeriesKey key, LocalDate from, LocalDate to) {
        return snapshot.readSeries(key, from, to);
    }
}
