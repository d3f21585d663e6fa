package com.metricsentinel.core.store;

import com.metricsentinel.core.model.MetricPoint;
import com.metricsentinel.core.model.SeriesKey;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * Metric store held in memory. A later point for the same series and date
 * replaces the earlier one.
 *
 * @since 1.0.0
 */
public class InMemoryMetricSeriesReader implements MetricSeriesReader {

    private final Map<SeriesKey, NavigableMap<LocalDate, MetricPoint>> series = new ConcurrentHashMap<>();

    public void add(MetricPoint point) {
        Objects.requireNonNull(point, "point must not be null");
        series.computeIfAbsent(SeriesKey.of(point), k -> new ConcurrentSkipListMap<>())
                .put(point.getDate(), point);
    }

    public void addAll(Collection<MetricPoint> points) {
        points.forEach(this::add);
    }

    @Override
    public List<SeriesKey> listSeries() {
        return series.keySet().stream().sorted().toList();
    }

    @Override
    public List<MetricPoint> readSeries(SeriesKey key, LocalDate from, LocalDate to) {
        NavigableMap<LocalDate, MetricPoint> points = series.get(key);
        if (points == null) {
            return List.of();
        }
        return new ArrayList<>(points.subMap(from, true, to, true).values());
    }
}
