package com.metricsentinel.core.store;

import com.metricsentinel.core.model.MetricPoint;
import com.metricsentinel.core.model.SeriesKey;

import java.time.LocalDate;
import java.util.List;

/**
 * Read contract of the metric store.
 *
 * <p>
 * Series are ordered by date ascending. Days without data are absent from the
 * result, never zero-filled.
 * </p>
 *
 * @since 1.0.0
 */
public interface MetricSeriesReader {

    /**
     * @return every (entity, metric) pair with at least one point
     */
    List<SeriesKey> listSeries();

    /**
     * @param key  entity and metric
     * @param from first date, inclusive
     * @param to   last date, inclusive
     * @return points in {@code [from, to]} ordered by date
     */
    List<MetricPoint> readSeries(SeriesKey key, LocalDate from, LocalDate to);
}
