package com.metricsentinel.core.detection;

import com.metricsentinel.core.model.MetricPoint;
import org.apache.commons.math3.stat.regression.SimpleRegression;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Small numeric helpers shared by the detectors.
 */
final class SeriesMath {

    private SeriesMath() {
    }

    /**
     * Sort by date, keeping the last point when a date occurs twice.
     */
    static List<MetricPoint> normalise(List<MetricPoint> series) {
        Map<LocalDate, MetricPoint> byDate = new TreeMap<>();
        for (MetricPoint p : series) {
            byDate.put(p.getDate(), p);
        }
        return byDate.values().stream()
                .sorted(Comparator.comparing(MetricPoint::getDate))
                .toList();
    }

    static double mean(double[] values) {
        double sum = 0;
        for (double v : values) {
            sum += v;
        }
        return sum / values.length;
    }

    /** Population standard deviation. */
    static double stdDev(double[] values, double mean) {
        double sumSquaredDiff = 0;
        for (double v : values) {
            double diff = v - mean;
            sumSquaredDiff += diff * diff;
        }
        return Math.sqrt(sumSquaredDiff / values.length);
    }

    /**
     * Least-squares slope of value against day offset; 0 for fewer than two
     * distinct days.
     */
    static double slope(List<MetricPoint> points) {
        if (points.size() < 2) {
            return 0.0;
        }
        LocalDate origin = points.get(0).getDate();
        SimpleRegression regression = new SimpleRegression();
        for (MetricPoint p : points) {
            regression.addData(ChronoUnit.DAYS.between(origin, p.getDate()), p.getValue());
        }
        double slope = regression.getSlope();
        return Double.isNaN(slope) ? 0.0 : slope;
    }
}
